package com.h2blog.imageprocessor.service.s3;

import com.h2blog.imageprocessor.exception.ObjectNotFoundException;
import com.h2blog.imageprocessor.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class S3StorageServiceTest {

    private static final String BUCKET = "blog-images";

    private S3Client s3Client;
    private S3StorageService storage;

    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        storage = new S3StorageService(s3Client, BUCKET);
    }

    @Test
    @DisplayName("should download the object bytes from the configured bucket")
    void should_download_the_object_bytes_from_the_configured_bucket() {
        // given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[]{4, 2}));

        // when
        var content = storage.getObject("images/cover.jpg");

        // then
        assertThat(content).containsExactly(4, 2);
        var captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo(BUCKET);
        assertThat(captor.getValue().key()).isEqualTo("images/cover.jpg");
    }

    @Test
    @DisplayName("should report a missing key as object not found")
    void should_report_a_missing_key_as_object_not_found() {
        // given
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        // when / then
        assertThatThrownBy(() -> storage.getObject("images/gone.jpg"))
                .isInstanceOf(ObjectNotFoundException.class)
                .hasMessageContaining("images/gone.jpg");
    }

    @Test
    @DisplayName("should wrap upload failures in a storage exception")
    void should_wrap_upload_failures_in_a_storage_exception() {
        // given
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("boom").build());

        // when / then
        assertThatThrownBy(() -> storage.putObject("images/cover.webp", new byte[]{1}))
                .isInstanceOf(StorageException.class)
                .isNotInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    @DisplayName("should rename by copying then deleting the source")
    void should_rename_by_copying_then_deleting_the_source() {
        // when
        storage.renameObject("images/a.jpg", "images/b.jpg");

        // then
        var copy = ArgumentCaptor.forClass(CopyObjectRequest.class);
        verify(s3Client).copyObject(copy.capture());
        assertThat(copy.getValue().sourceKey()).isEqualTo("images/a.jpg");
        assertThat(copy.getValue().destinationKey()).isEqualTo("images/b.jpg");
        var delete = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(delete.capture());
        assertThat(delete.getValue().key()).isEqualTo("images/a.jpg");
    }

    @Test
    @DisplayName("should keep the source when the copy fails")
    void should_keep_the_source_when_the_copy_fails() {
        // given
        when(s3Client.copyObject(any(CopyObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        // when / then
        assertThatThrownBy(() -> storage.renameObject("images/a.jpg", "images/b.jpg"))
                .isInstanceOf(ObjectNotFoundException.class);
        verify(s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    @DisplayName("should list every key under the prefix")
    void should_list_every_key_under_the_prefix() {
        // given
        var request = ListObjectsV2Request.builder().bucket(BUCKET).prefix("images/").build();
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("images/a.jpg").build(), S3Object.builder().key("images/a.webp").build())
                .isTruncated(false)
                .build());
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenReturn(new ListObjectsV2Iterable(s3Client, request));

        // when
        var keys = storage.listObjects("images/");

        // then
        assertThat(keys).containsExactly("images/a.jpg", "images/a.webp");
    }
}
