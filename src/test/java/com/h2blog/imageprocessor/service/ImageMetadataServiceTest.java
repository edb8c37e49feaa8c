package com.h2blog.imageprocessor.service;

import com.h2blog.imageprocessor.model.ImageFormat;
import com.h2blog.imageprocessor.model.ImageRecord;
import com.h2blog.imageprocessor.repository.ImageRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.List;

import static com.h2blog.imageprocessor.testutils.TestDataFactory.jpg;
import static com.h2blog.imageprocessor.testutils.TestDataFactory.png;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ImageMetadataServiceTest {

    private ImageRecordRepository repository;
    private ImageMetadataService service;

    @BeforeEach
    void setUp() {
        repository = mock(ImageRecordRepository.class);
        when(repository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        service = new ImageMetadataService(repository);
    }

    @Test
    @DisplayName("should update the format of an existing row and keep its creation time")
    @SuppressWarnings("unchecked")
    void should_update_the_format_of_an_existing_row_and_keep_its_creation_time() {
        // given
        var createdAt = LocalDateTime.of(2024, 1, 1, 12, 0);
        var existing = ImageRecord.of(jpg("cover"));
        existing.setCreatedAt(createdAt);
        when(repository.findAllById(anyIterable())).thenReturn(List.of(existing));

        // when
        service.saveAll(List.of(ImageRecord.of(jpg("cover").withFormat(ImageFormat.WEBP)), ImageRecord.of(png("new"))));

        // then
        ArgumentCaptor<List<ImageRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAll(captor.capture());
        assertThat(captor.getValue())
                .extracting(ImageRecord::getImageName, ImageRecord::getImageFormat, ImageRecord::getCreatedAt)
                .containsExactly(
                        tuple("cover", ImageFormat.WEBP, createdAt),
                        tuple("new", ImageFormat.PNG, null));
        assertThat(captor.getValue().get(0)).isSameAs(existing);
    }

    @Test
    @DisplayName("should keep the last record when a name appears twice")
    @SuppressWarnings("unchecked")
    void should_keep_the_last_record_when_a_name_appears_twice() {
        // given
        when(repository.findAllById(anyIterable())).thenReturn(List.of());

        // when
        var saved = service.saveAll(List.of(ImageRecord.of(jpg("a")), ImageRecord.of(jpg("a").withFormat(ImageFormat.WEBP))));

        // then
        assertThat(saved).singleElement().satisfies(record -> {
            assertThat(record.getImageName()).isEqualTo("a");
            assertThat(record.getImageFormat()).isEqualTo(ImageFormat.WEBP);
            assertThat(record.getImageId()).isEqualTo(ImageRecord.idFor("a"));
        });
    }

    @Test
    @DisplayName("should not touch the repository for an empty batch")
    void should_not_touch_the_repository_for_an_empty_batch() {
        // when
        var saved = service.saveAll(List.of());

        // then
        assertThat(saved).isEmpty();
        verifyNoInteractions(repository);
    }
}
