package com.h2blog.imageprocessor.service.converter;

public enum ConverterState {
    RUNNING,
    SHUTTING_DOWN,
    CLOSED
}
