package com.kreasipositif.tdi17batch.domain;

/**
 * Outcome of reconciling one TDI17 file.
 */
public enum EftProcessStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
