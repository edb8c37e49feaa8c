package com.h2blog.imageprocessor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.codec.digest.DigestUtils;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Metadata for an image stored by the blog. One row per image name.
 */
@Entity
@Table(name = "h2_img_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageRecord {

    private static final int ID_LENGTH = 32;

    /**
     * Derived from the image name, so repeated conversions of the same image update one row.
     */
    @Id
    @Column(name = "image_id", length = ID_LENGTH)
    private String imageId;

    @Column(name = "image_name", nullable = false, unique = true)
    private String imageName;

    @Enumerated(EnumType.STRING)
    @Column(name = "image_format", nullable = false, length = 10)
    private ImageFormat imageFormat;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public static ImageRecord of(ImageDescriptor image) {
        return ImageRecord.builder()
                .imageId(idFor(image.name()))
                .imageName(image.name())
                .imageFormat(image.format())
                .build();
    }

    public static String idFor(String imageName) {
        return DigestUtils.sha256Hex(imageName).substring(0, ID_LENGTH);
    }
}
