package com.h2blog.imageprocessor.service.converter.transcode;

import com.h2blog.imageprocessor.common.processexec.ProcessExecutor;
import com.h2blog.imageprocessor.common.processexec.ProcessExecutor.ProcessResult;
import com.h2blog.imageprocessor.config.ImageProcessingConfig;
import com.h2blog.imageprocessor.exception.ImageEncodingException;
import com.h2blog.imageprocessor.model.ImageFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes images by shelling out to the {@code cwebp} tool from libwebp.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CwebpImageEncoder implements ImageEncoder {

    private final ImageProcessingConfig config;
    private final ProcessExecutor processExecutor;

    @Override
    public byte[] encode(byte[] source, ImageFormat sourceFormat, int quality, String contextInfo) {
        ImageProcessingConfig.Webp webp = config.getWebp();
        Path input = null;
        Path output = null;
        try {
            input = Files.createTempFile("cwebp-in-", "." + sourceFormat.getExtension());
            output = Files.createTempFile("cwebp-out-", ".webp");
            Files.write(input, source);

            ProcessResult result = processExecutor.execute(buildCommand(input, output, quality), contextInfo,
                    webp.getEncodeTimeout(), "cwebp");
            if (result.exitCode() != 0) {
                throw new ImageEncodingException(String.format("cwebp exited with code %d for '%s'. Error: %s",
                        result.exitCode(), contextInfo, result.stderr()));
            }
            byte[] encoded = Files.readAllBytes(output);
            if (encoded.length == 0) {
                throw new ImageEncodingException("cwebp produced an empty output for '" + contextInfo + "'");
            }
            log.debug("[{}] cwebp encoded {} -> {} bytes at quality {}.", contextInfo, source.length, encoded.length,
                    quality);
            return encoded;
        } catch (IOException e) {
            throw new ImageEncodingException("cwebp process failed for '" + contextInfo + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageEncodingException("Interrupted while encoding '" + contextInfo + "'", e);
        } finally {
            deleteQuietly(input, contextInfo);
            deleteQuietly(output, contextInfo);
        }
    }

    private List<String> buildCommand(Path input, Path output, int quality) {
        List<String> command = new ArrayList<>();
        command.add(config.getWebp().getCwebpPath());
        command.add("-quiet");
        command.add("-q");
        command.add(Integer.toString(quality));
        command.addAll(config.getWebp().getExtraOptions());
        command.add(input.toAbsolutePath().toString());
        command.add("-o");
        command.add(output.toAbsolutePath().toString());
        return command;
    }

    private static void deleteQuietly(Path path, String contextInfo) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("[{}] Failed to delete temporary file: {}", contextInfo, path);
        }
    }
}
