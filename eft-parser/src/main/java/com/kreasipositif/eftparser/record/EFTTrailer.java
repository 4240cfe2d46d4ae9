package com.kreasipositif.eftparser.record;

import com.kreasipositif.eftparser.EFTConstants;
import com.kreasipositif.eftparser.error.EFTError;
import com.kreasipositif.eftparser.error.EFTParseError;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Trailer line of a TDI17 file (record type {@code 7}).
 */
@Getter
public class EFTTrailer extends EFTBase {

    private Integer numberOfDetails;

    /** In cents, as written in the file. */
    private BigDecimal totalDepositAmount;

    public EFTTrailer(String content, int index) {
        super(content, index);
        process();
    }

    @Override
    public EFTLineType getLineType() {
        return EFTLineType.TRAILER;
    }

    private void process() {
        if (!isValidLength()) {
            addError(new EFTParseError(EFTError.INVALID_LINE_LENGTH));
            return;
        }

        recordType = extractValue(0, 1);
        validateRecordType(EFTConstants.TRAILER_RECORD_TYPE);

        numberOfDetails = parseInt(extractValue(1, 7), EFTError.INVALID_NUMBER_OF_DETAILS);
        totalDepositAmount = parseDecimal(extractValue(7, 21), EFTError.INVALID_TOTAL_DEPOSIT_AMOUNT);
    }
}
