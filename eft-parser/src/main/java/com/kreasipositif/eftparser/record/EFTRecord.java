package com.kreasipositif.eftparser.record;

import com.kreasipositif.eftparser.EFTConstants;
import com.kreasipositif.eftparser.error.EFTError;
import com.kreasipositif.eftparser.error.EFTParseError;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Transaction detail line of a TDI17 file (record type {@code 2}).
 *
 * <p>The record parses itself in the constructor. Fields that fail to parse are left
 * {@code null} and reported through {@link #getErrors()}.
 *
 * <h3>Short name classification</h3>
 * The bank file carries no channel indicator, only a free-text description whose prefix
 * identifies the channel. Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>{@value #FEDERAL_PAYMENT_DESCRIPTION_PATTERN} &rarr; {@link EFTShortnameType#EFT}, short name
 *       must be generated downstream</li>
 *   <li>{@value #WIRE_DESCRIPTION_PATTERN} &rarr; {@link EFTShortnameType#WIRE}, prefix stripped</li>
 *   <li>{@value #EFT_DESCRIPTION_PATTERN} but not {@value #PAD_DESCRIPTION_PATTERN}
 *       &rarr; {@link EFTShortnameType#EFT}, prefix stripped</li>
 *   <li>anything else (PAD included) &rarr; unclassified, description untouched</li>
 * </ol>
 */
@Slf4j
@Getter
public class EFTRecord extends EFTBase {

    public static final String FEDERAL_PAYMENT_DESCRIPTION_PATTERN = "FEDERAL PAYMENT CANADA";
    public static final String WIRE_DESCRIPTION_PATTERN = "FUNDS TRANSFER CR TT";
    public static final String EFT_DESCRIPTION_PATTERN = "MISC PAYMENT";
    public static final String PAD_DESCRIPTION_PATTERN = "MISC PAYMENT BCONLINE";

    public static final List<String> GENERATE_SHORT_NAME_PATTERNS = List.of(FEDERAL_PAYMENT_DESCRIPTION_PATTERN);
    public static final List<String> WIRE_PATTERNS = List.of(WIRE_DESCRIPTION_PATTERN);
    public static final List<String> EFT_PATTERNS = List.of(EFT_DESCRIPTION_PATTERN);
    public static final List<String> PAD_PATTERNS = List.of(PAD_DESCRIPTION_PATTERN);

    private String ministryCode;
    private String programCode;
    private LocalDateTime depositDateTime;
    private String locationId;
    private String transactionSequence;
    private String transactionDescription;

    // money fields are in cents, as written in the file
    private BigDecimal depositAmount;
    private String currency;
    private BigDecimal exchangeAdjAmount;
    private BigDecimal depositAmountCad;

    private String destBankNumber;
    private String batchNumber;
    private String jvType;
    private String jvNumber;
    private LocalDate transactionDate;

    private EFTShortnameType shortNameType;
    private boolean generateShortName;

    public EFTRecord(String content, int index) {
        super(content, index);
        process();
    }

    @Override
    public EFTLineType getLineType() {
        return EFTLineType.TRANSACTION;
    }

    /**
     * Blank currency means CAD, anything else is passed through.
     */
    public static String resolveCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return EFTConstants.CURRENCY_CAD;
        }
        return currency;
    }

    private void process() {
        if (!isValidLength()) {
            addError(new EFTParseError(EFTError.INVALID_LINE_LENGTH));
            return;
        }

        recordType = extractValue(0, 1);
        validateRecordType(EFTConstants.TRANSACTION_RECORD_TYPE);

        ministryCode = extractValue(1, 3);
        programCode = extractValue(3, 7);

        String depositTime = extractValue(20, 24);
        if (depositTime.isEmpty()) {
            depositTime = EFTConstants.DEFAULT_DEPOSIT_TIME;
        }
        depositDateTime = parseDateTime(extractValue(7, 15) + depositTime, EFTError.INVALID_DEPOSIT_DATETIME);

        locationId = extractValue(15, 20);
        transactionSequence = extractValue(24, 27);

        // the short name used for account matching comes from here
        transactionDescription = extractValue(27, 67);
        if (transactionDescription.isEmpty()) {
            addError(new EFTParseError(EFTError.ACCOUNT_SHORTNAME_REQUIRED));
        }
        parseTransactionDescription();

        depositAmount = parseDecimal(extractValue(67, 80), EFTError.INVALID_DEPOSIT_AMOUNT);
        currency = resolveCurrency(extractValue(80, 82));
        exchangeAdjAmount = parseDecimal(extractValue(82, 95), EFTError.INVALID_EXCHANGE_ADJ_AMOUNT);
        depositAmountCad = parseDecimal(extractValue(95, 108), EFTError.INVALID_DEPOSIT_AMOUNT_CAD);

        destBankNumber = extractValue(108, 112);
        batchNumber = extractValue(112, 121);
        jvType = extractValue(121, 122);
        jvNumber = extractValue(122, 131);

        String transactionDateValue = extractValue(131, 139);
        transactionDate = transactionDateValue.isEmpty()
                ? null
                : parseDate(transactionDateValue, EFTError.INVALID_TRANSACTION_DATE);
    }

    /** Must only run once: it strips the prefix it matched on. */
    private void parseTransactionDescription() {
        if (transactionDescription.isEmpty()) {
            return;
        }

        String matchingPattern = findMatchingPattern(GENERATE_SHORT_NAME_PATTERNS, transactionDescription);
        if (matchingPattern != null) {
            shortNameType = EFTShortnameType.EFT;
            transactionDescription = matchingPattern.strip();
            generateShortName = true;
            log.debug("Line {}: federal payment, short name will be generated", getIndex());
            return;
        }

        matchingPattern = findMatchingPattern(WIRE_PATTERNS, transactionDescription);
        if (matchingPattern != null) {
            shortNameType = EFTShortnameType.WIRE;
            transactionDescription = transactionDescription.substring(matchingPattern.length()).strip();
            log.debug("Line {}: WIRE short name '{}'", getIndex(), transactionDescription);
            return;
        }

        matchingPattern = findMatchingPattern(EFT_PATTERNS, transactionDescription);
        if (matchingPattern != null && findMatchingPattern(PAD_PATTERNS, transactionDescription) == null) {
            shortNameType = EFTShortnameType.EFT;
            transactionDescription = transactionDescription.substring(matchingPattern.length()).strip();
            log.debug("Line {}: EFT short name '{}'", getIndex(), transactionDescription);
        }
    }
}
