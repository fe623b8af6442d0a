package com.flowmable.optimizer;

public enum ConversionStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
