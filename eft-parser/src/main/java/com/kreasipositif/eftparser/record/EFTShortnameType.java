package com.kreasipositif.eftparser.record;

/**
 * Payment channel derived from a transaction description.
 */
public enum EFTShortnameType {
    EFT,
    WIRE
}
