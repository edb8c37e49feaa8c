package com.h2blog.imageprocessor.dto.conversion.response;

import com.h2blog.imageprocessor.service.converter.ConverterState;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ConverterStatusResponse {
    private final ConverterState state;
    private final boolean idle;
    private final int outstandingTasks;
    private final int workerCount;
    private final boolean webpEnabled;
}
