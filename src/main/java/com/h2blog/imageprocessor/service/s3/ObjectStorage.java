package com.h2blog.imageprocessor.service.s3;

import com.h2blog.imageprocessor.exception.ObjectNotFoundException;
import com.h2blog.imageprocessor.exception.StorageException;

import java.util.List;

/**
 * A flat key/value object store holding the blog's images.
 * Implementations throw {@link StorageException} for any failure they cannot classify further.
 */
public interface ObjectStorage {

    /**
     * @throws ObjectNotFoundException if no object exists at {@code path}
     */
    byte[] getObject(String path);

    void putObject(String path, byte[] content);

    void deleteObject(String path);

    /**
     * Copies the object to {@code newPath} and removes the old one.
     */
    void renameObject(String oldPath, String newPath);

    List<String> listObjects(String prefix);
}
