package com.kreasipositif.eftparser.record;

import com.kreasipositif.eftparser.EFTConstants;
import com.kreasipositif.eftparser.error.EFTError;
import com.kreasipositif.eftparser.error.EFTParseError;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Header line of a TDI17 file (record type {@code 1}).
 *
 * <p>The raw date and time strings are kept alongside their parsed values so callers can
 * report exactly what the bank sent.
 */
@Getter
public class EFTHeader extends EFTBase {

    private String creationDate;
    private String creationTime;
    private String depositStartDate;
    private String depositEndDate;

    private LocalDateTime creationDateTime;
    private LocalDate startingDepositDate;
    private LocalDate endingDepositDate;

    public EFTHeader(String content, int index) {
        super(content, index);
        process();
    }

    @Override
    public EFTLineType getLineType() {
        return EFTLineType.HEADER;
    }

    private void process() {
        if (!isValidLength()) {
            addError(new EFTParseError(EFTError.INVALID_LINE_LENGTH));
            return;
        }

        recordType = extractValue(0, 1);
        validateRecordType(EFTConstants.HEADER_RECORD_TYPE);

        creationDate = extractValue(16, 24);
        creationTime = extractValue(41, 45);
        creationDateTime = parseDateTime(creationDate + creationTime, EFTError.INVALID_CREATION_DATETIME);

        depositStartDate = extractValue(69, 77);
        startingDepositDate = parseDate(depositStartDate, EFTError.INVALID_DEPOSIT_START_DATE);

        depositEndDate = extractValue(89, 97);
        endingDepositDate = parseDate(depositEndDate, EFTError.INVALID_DEPOSIT_END_DATE);
    }
}
