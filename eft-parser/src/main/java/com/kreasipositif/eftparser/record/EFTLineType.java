package com.kreasipositif.eftparser.record;

public enum EFTLineType {
    HEADER,
    TRANSACTION,
    TRAILER
}
