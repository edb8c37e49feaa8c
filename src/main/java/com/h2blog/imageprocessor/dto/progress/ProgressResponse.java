package com.h2blog.imageprocessor.dto.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.h2blog.imageprocessor.service.progress.ProgressEvent;
import com.h2blog.imageprocessor.service.progress.ProgressSnapshot;
import lombok.Builder;
import lombok.Getter;

/**
 * Progress of the current batch. The per-image fields are set only on streamed events.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressResponse {
    private final long total;
    private final long success;
    private final long failed;
    private final long completed;
    private final boolean done;

    private final String image;
    private final Boolean imageSuccess;
    private final String errorKind;
    private final String errorMessage;

    public static ProgressResponse from(ProgressSnapshot snapshot) {
        return base(snapshot).build();
    }

    public static ProgressResponse from(ProgressSnapshot snapshot, ProgressEvent event) {
        return base(snapshot)
                .image(event.image().fileName())
                .imageSuccess(event.success())
                .errorKind(event.errorKind() != null ? event.errorKind().name() : null)
                .errorMessage(event.message())
                .build();
    }

    private static ProgressResponseBuilder base(ProgressSnapshot snapshot) {
        return ProgressResponse.builder()
                .total(snapshot.total())
                .success(snapshot.success())
                .failed(snapshot.failed())
                .completed(snapshot.completed())
                .done(snapshot.isDone());
    }
}
