package com.h2blog.imageprocessor.repository;

import com.h2blog.imageprocessor.model.ImageFormat;
import com.h2blog.imageprocessor.model.ImageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link ImageRecord} entity.
 */
@Repository
public interface ImageRecordRepository extends JpaRepository<ImageRecord, String> {

    Optional<ImageRecord> findByImageName(String imageName);

    List<ImageRecord> findAllByImageFormat(ImageFormat imageFormat);
}
