package com.kreasipositif.tdi17batch.domain;

import com.kreasipositif.eftparser.error.EFTParseError;
import com.kreasipositif.eftparser.record.EFTBase;
import com.kreasipositif.eftparser.record.EFTLineType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the error report: a single parse error and the line it was found on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EftErrorRow {

    private EFTLineType lineType;

    /** 0-based line in the TDI17 file. */
    private Integer lineIndex;

    private String code;
    private String message;

    public static EftErrorRow of(EFTBase line, EFTParseError error) {
        return EftErrorRow.builder()
                .lineType(line.getLineType())
                .lineIndex(error.getIndex())
                .code(error.getCode())
                .message(error.getMessage())
                .build();
    }
}
