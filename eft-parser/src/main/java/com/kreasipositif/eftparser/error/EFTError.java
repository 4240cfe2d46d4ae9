package com.kreasipositif.eftparser.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of validation failure a TDI17 line can produce.
 */
@Getter
@RequiredArgsConstructor
public enum EFTError {

    INVALID_LINE_LENGTH("Invalid EFT file line length."),
    INVALID_RECORD_TYPE("Invalid Record Type."),
    MISPLACED_HEADER("Header record must be the first line of the file."),
    MISPLACED_TRAILER("Trailer record must be the last line of the file."),

    // header
    INVALID_CREATION_DATETIME("Invalid header creation date time."),
    INVALID_DEPOSIT_START_DATE("Invalid header deposit start date."),
    INVALID_DEPOSIT_END_DATE("Invalid header deposit end date."),

    // transaction
    INVALID_DEPOSIT_DATETIME("Invalid transaction deposit date time."),
    INVALID_DEPOSIT_AMOUNT("Invalid transaction deposit amount."),
    INVALID_EXCHANGE_ADJ_AMOUNT("Invalid transaction exchange adjustment amount."),
    INVALID_DEPOSIT_AMOUNT_CAD("Invalid transaction deposit amount CAD."),
    INVALID_TRANSACTION_DATE("Invalid transaction date."),
    ACCOUNT_SHORTNAME_REQUIRED("Account shortname is missing from the transaction description."),

    // trailer
    INVALID_NUMBER_OF_DETAILS("Invalid trailer number of details value."),
    INVALID_TOTAL_DEPOSIT_AMOUNT("Invalid trailer total deposit amount.");

    private final String message;
}
