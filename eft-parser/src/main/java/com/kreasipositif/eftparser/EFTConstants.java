package com.kreasipositif.eftparser;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

/**
 * Fixed values of the CAS TDI17 deposit file format.
 *
 * <pre>
 *  Record types:  1 = header, 2 = transaction detail, 7 = trailer
 *  Line length :  139 characters for every record type
 * </pre>
 */
public final class EFTConstants {

    public static final int EXPECTED_LINE_LENGTH = 139;

    public static final String DATE_FORMAT = "uuuuMMdd";
    public static final String DATE_TIME_FORMAT = "uuuuMMddHHmm";

    /** Strict so that out-of-range values such as month 30 or day 50 are rejected. */
    public static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern(DATE_FORMAT).withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter DATE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern(DATE_TIME_FORMAT).withResolverStyle(ResolverStyle.STRICT);

    public static final String HEADER_RECORD_TYPE = "1";
    public static final String TRANSACTION_RECORD_TYPE = "2";
    public static final String TRAILER_RECORD_TYPE = "7";

    public static final String CURRENCY_CAD = "CAD";

    public static final String DEFAULT_DEPOSIT_TIME = "0000";

    private EFTConstants() {
    }
}
