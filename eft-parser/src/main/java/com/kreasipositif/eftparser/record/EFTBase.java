package com.kreasipositif.eftparser.record;

import com.kreasipositif.eftparser.EFTConstants;
import com.kreasipositif.eftparser.error.EFTError;
import com.kreasipositif.eftparser.error.EFTParseError;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of a single line of a CAS TDI17 file.
 *
 * <h3>TDI17 layout</h3>
 * <pre>
 *  One header record:
 *    Columns  Len  Purpose
 *     1 -   1   1  Record type (always 1)
 *     2 -  16  15  "CREATION DATE: "
 *    17 -  24   8  File creation date, YYYYMMDD
 *    25 -  41  17  "CREATION TIME:   "
 *    42 -  45   4  File creation time, HHMM
 *    46 -  69  24  "DEPOSIT DATE(S) FROM:   "
 *    70 -  77   8  Starting deposit date, YYYYMMDD
 *    78 -  89  12  " TO DATE :  "
 *    90 -  97   8  Ending deposit date, YYYYMMDD
 *
 *  Zero or more detail records:
 *     1 -   1   1  Record type (always 2)
 *     2 -   3   2  Ministry code
 *     4 -   7   4  Program code
 *     8 -  15   8  Deposit date, YYYYMMDD
 *    16 -  20   5  Location ID
 *    21 -  24   4  Deposit time, HHMM (optional)
 *    25 -  27   3  Transaction sequence number (optional)
 *    28 -  67  40  Transaction description
 *    68 -  80  13  Deposit amount in the specified currency, in cents
 *    81 -  82   2  Currency (blank = CAD, US = USD)
 *    83 -  95  13  Exchange adjustment amount, in cents
 *    96 - 108  13  Deposit amount in CAD, in cents
 *   109 - 112   4  Destination bank number
 *   113 - 121   9  Batch number (optional; only if posted to GL)
 *   122 - 122   1  JV type (I = inter, J = intra; mandatory if JV batch specified)
 *   123 - 131   9  JV number (mandatory if JV batch specified)
 *   132 - 139   8  Transaction date (optional)
 *
 *  One trailer record:
 *     1 -   1   1  Record type (always 7)
 *     2 -   7   6  Number of details (left zero filled)
 *     8 -  21  14  Total deposit amount, in CAD (left zero filled)
 * </pre>
 *
 * <p>Numbers are right justified and left padded with zeroes. In a money field the rightmost
 * character is either blank (positive) or a minus sign (negative).
 *
 * <p>None of the parsing helpers throw on malformed input. A failure is recorded as an
 * {@link EFTParseError} and the helper returns {@code null}, so one bad line yields a full
 * report of everything wrong with it.
 */
@Getter
public abstract class EFTBase {

    /** Raw, unmodified line. */
    private final String content;

    /** 0-based position of the line in its source file. */
    private final int index;

    /** Column 0, set by the subclass before it validates it. */
    protected String recordType;

    @Getter(AccessLevel.NONE)
    private final List<EFTParseError> errors = new ArrayList<>();

    protected EFTBase(String content, int index) {
        this.content = content;
        this.index = index;
    }

    public abstract EFTLineType getLineType();

    public boolean isValidLength() {
        return isValidLength(EFTConstants.EXPECTED_LINE_LENGTH);
    }

    public boolean isValidLength(int length) {
        return content != null && content.length() == length;
    }

    /**
     * Adds {@link EFTError#INVALID_RECORD_TYPE} when column 0 does not hold the expected tag.
     * Parsing carries on either way.
     */
    public void validateRecordType(String expectedRecordType) {
        if (!expectedRecordType.equals(recordType)) {
            addError(new EFTParseError(EFTError.INVALID_RECORD_TYPE, index));
        }
    }

    /**
     * Returns {@code content[startIndex, endIndex)} stripped of surrounding whitespace.
     * Indices past the end of the line are clamped, so a short line yields a shorter or empty value.
     */
    public String extractValue(int startIndex, int endIndex) {
        if (content == null) {
            return "";
        }
        int start = Math.max(0, Math.min(startIndex, content.length()));
        int end = Math.max(start, Math.min(endIndex, content.length()));
        return content.substring(start, end).strip();
    }

    public BigDecimal parseDecimal(String value, EFTError error) {
        try {
            // money values end with a blank or a minus sign
            if (value.endsWith("-")) {
                value = "-" + value.substring(0, value.length() - 1);
            }
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            addError(new EFTParseError(error));
            return null;
        }
    }

    public Integer parseInt(String value, EFTError error) {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            addError(new EFTParseError(error));
            return null;
        }
    }

    public LocalDate parseDate(String value, EFTError error) {
        try {
            return LocalDate.parse(value, EFTConstants.DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            addError(new EFTParseError(error));
            return null;
        }
    }

    public LocalDateTime parseDateTime(String value, EFTError error) {
        try {
            return LocalDateTime.parse(value, EFTConstants.DATE_TIME_FORMATTER);
        } catch (DateTimeParseException e) {
            addError(new EFTParseError(error));
            return null;
        }
    }

    /**
     * Returns the first of {@code patterns}, in iteration order, that {@code value} starts with,
     * or {@code null} when none does.
     */
    public String findMatchingPattern(List<String> patterns, String value) {
        if (value == null) {
            return null;
        }
        for (String pattern : patterns) {
            if (value.startsWith(pattern)) {
                return pattern;
            }
        }
        return null;
    }

    /**
     * Records a parse error against this line. The stored copy always carries this record's index.
     */
    public void addError(EFTParseError error) {
        errors.add(error.withIndex(index));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<EFTParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getErrorMessages() {
        return errors.stream().map(EFTParseError::getMessage).toList();
    }
}
