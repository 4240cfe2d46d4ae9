package com.kreasipositif.eftparser;

import com.kreasipositif.eftparser.record.EFTBase;
import com.kreasipositif.eftparser.record.EFTHeader;
import com.kreasipositif.eftparser.record.EFTRecord;
import com.kreasipositif.eftparser.record.EFTTrailer;

/**
 * Picks the record class for a TDI17 line from its first character.
 *
 * <p>Lines tagged {@code 1} become an {@link EFTHeader} and lines tagged {@code 7} an
 * {@link EFTTrailer}. Everything else is parsed as an {@link EFTRecord}, which reports an
 * unexpected tag as {@code INVALID_RECORD_TYPE}.
 */
public final class EFTLineParser {

    private EFTLineParser() {
    }

    public static EFTBase parse(String content, int index) {
        String recordType = content.isEmpty() ? "" : content.substring(0, 1);
        return switch (recordType) {
            case EFTConstants.HEADER_RECORD_TYPE -> new EFTHeader(content, index);
            case EFTConstants.TRAILER_RECORD_TYPE -> new EFTTrailer(content, index);
            default -> new EFTRecord(content, index);
        };
    }
}
