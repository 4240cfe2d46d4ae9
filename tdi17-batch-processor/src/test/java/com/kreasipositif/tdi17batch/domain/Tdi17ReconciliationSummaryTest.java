package com.kreasipositif.tdi17batch.domain;

import com.kreasipositif.eftparser.EFTLineParser;
import com.kreasipositif.eftparser.error.EFTError;
import com.kreasipositif.eftparser.error.EFTParseError;
import com.kreasipositif.eftparser.record.EFTShortnameType;
import com.kreasipositif.eftparser.record.EFTTrailer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static com.kreasipositif.eftparser.Tdi17Factory.header;
import static com.kreasipositif.eftparser.Tdi17Factory.record;
import static com.kreasipositif.eftparser.Tdi17Factory.trailer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class Tdi17ReconciliationSummaryTest {

    private static final String VALID_HEADER = header("1", "20230814", "1230", "20230810", "20230810");
    private static final String VALID_TRAILER = trailer("7", "3", "56500");

    private Tdi17ReconciliationSummary summary;

    @BeforeEach
    void setUp() {
        summary = new Tdi17ReconciliationSummary();
    }

    private void accept(String line, int index) {
        summary.accept(EFTLineParser.parse(line, index));
    }

    @Test
    @DisplayName("COMPLETED — balances grouped by short name in first-seen order, in dollars")
    void completedFile_groupsBalancesByShortName() {
        accept(VALID_HEADER, 0);
        accept(record().transactionDescription("MISC PAYMENT ABC123")
                .depositAmount("10000").depositAmountCad("10000").depositTime("0900").build(), 1);
        accept(record().transactionDescription("FUNDS TRANSFER CR TT JOHN DOE")
                .depositAmount("20000").depositAmountCad("20000").build(), 2);
        accept(record().transactionDescription("MISC PAYMENT ABC123")
                .depositAmount("26500").depositAmountCad("26500").build(), 3);
        accept(VALID_TRAILER, 4);
        summary.finish(4);

        assertThat(summary.getStatus()).isEqualTo(EftProcessStatus.COMPLETED);
        assertThat(summary.getTransactionCount()).isEqualTo(3);
        assertThat(summary.getErrors()).isEmpty();

        List<ShortNameBalance> balances = summary.getShortNameBalances();
        assertThat(balances).extracting(ShortNameBalance::getShortName).containsExactly("ABC123", "JOHN DOE");

        ShortNameBalance abc = balances.get(0);
        assertThat(abc.getShortNameType()).isEqualTo(EFTShortnameType.EFT);
        assertThat(abc.isGenerateShortName()).isFalse();
        assertThat(abc.getBalance()).isEqualByComparingTo("365.00");
        assertThat(abc.getTransactions()).containsExactly(
                new ShortNameTransaction(1, new BigDecimal("100.00"), LocalDateTime.of(2023, 8, 10, 9, 0)),
                new ShortNameTransaction(3, new BigDecimal("265.00"), LocalDateTime.of(2023, 8, 10, 0, 0)));

        assertThat(balances.get(1).getShortNameType()).isEqualTo(EFTShortnameType.WIRE);
        assertThat(balances.get(1).getBalance()).isEqualByComparingTo("200.00");
    }

    @Test
    @DisplayName("COMPLETED — federal payment balance is flagged for short name generation")
    void federalPayment_flaggedForGeneration() {
        accept(VALID_HEADER, 0);
        accept(record().transactionDescription("FEDERAL PAYMENT CANADA 987654")
                .depositAmount("1234-").depositAmountCad("1234-").build(), 1);
        accept(VALID_TRAILER, 2);
        summary.finish(2);

        ShortNameBalance balance = summary.getShortNameBalances().get(0);
        assertThat(balance.getShortName()).isEqualTo("FEDERAL PAYMENT CANADA");
        assertThat(balance.isGenerateShortName()).isTrue();
        assertThat(balance.getBalance()).isEqualByComparingTo("-12.34");
    }

    @Test
    @DisplayName("FAILED — transaction with errors, no balances reported")
    void transactionErrors_failTheFile() {
        accept(VALID_HEADER, 0);
        accept(record().transactionDescription("MISC PAYMENT ABC123").build(), 1);
        accept(record().transactionDescription("MISC PAYMENT ABC123").depositAmount("13A00").build(), 2);
        accept(VALID_TRAILER, 3);
        summary.finish(3);

        assertThat(summary.getStatus()).isEqualTo(EftProcessStatus.FAILED);
        assertThat(summary.getInvalidTransactionCount()).isEqualTo(1);
        assertThat(summary.getErrors()).extracting(EFTParseError::getError, EFTParseError::getIndex)
                .containsExactly(tuple(EFTError.INVALID_DEPOSIT_AMOUNT, 2));
        assertThat(summary.getShortNameBalances()).isEmpty();
    }

    @Test
    @DisplayName("FAILED — header with invalid dates")
    void invalidHeader_failsTheFile() {
        accept(header("1", "2023AB14", "1230", "20230810", "20230810"), 0);
        accept(record().transactionDescription("MISC PAYMENT ABC123").build(), 1);
        accept(VALID_TRAILER, 2);
        summary.finish(2);

        assertThat(summary.isHeaderValid()).isFalse();
        assertThat(summary.isTrailerValid()).isTrue();
        assertThat(summary.getStatus()).isEqualTo(EftProcessStatus.FAILED);
    }

    @Test
    @DisplayName("FAILED — trailer missing")
    void missingTrailer_failsTheFile() {
        accept(VALID_HEADER, 0);
        accept(record().transactionDescription("MISC PAYMENT ABC123").build(), 1);
        summary.finish(1);

        assertThat(summary.getTrailer()).isNull();
        assertThat(summary.getStatus()).isEqualTo(EftProcessStatus.FAILED);
    }

    @Test
    @DisplayName("COMPLETED — same short name over EFT and WIRE gives two balances")
    void sameShortName_separatedByType() {
        accept(VALID_HEADER, 0);
        accept(record().transactionDescription("MISC PAYMENT JOHN").depositAmountCad("10000").build(), 1);
        accept(record().transactionDescription("FUNDS TRANSFER CR TT JOHN").depositAmountCad("20000").build(), 2);
        accept(VALID_TRAILER, 3);
        summary.finish(3);

        assertThat(summary.getShortNameBalances())
                .extracting(ShortNameBalance::getShortName, ShortNameBalance::getShortNameType, ShortNameBalance::getBalance)
                .containsExactly(
                        tuple("JOHN", EFTShortnameType.EFT, new BigDecimal("100.00")),
                        tuple("JOHN", EFTShortnameType.WIRE, new BigDecimal("200.00")));
    }

    @Test
    @DisplayName("FAILED — header not on the first line")
    void headerNotFirst_failsTheFile() {
        accept(record().transactionDescription("MISC PAYMENT ABC123").build(), 0);
        accept(VALID_HEADER, 1);
        accept(VALID_TRAILER, 2);
        summary.finish(2);

        assertThat(summary.getHeader().getIndex()).isEqualTo(1);
        assertThat(summary.isHeaderValid()).isFalse();
        assertThat(summary.getStatus()).isEqualTo(EftProcessStatus.FAILED);
        assertThat(summary.getErrors()).extracting(EFTParseError::getError, EFTParseError::getIndex)
                .containsExactly(tuple(EFTError.MISPLACED_HEADER, 1));
    }

    @Test
    @DisplayName("FAILED — trailer followed by more lines")
    void trailerNotLast_failsTheFile() {
        accept(VALID_HEADER, 0);
        accept(VALID_TRAILER, 1);
        accept(record().transactionDescription("MISC PAYMENT ABC123").build(), 2);

        assertThat(summary.finish(2)).extracting(EFTTrailer::getIndex).containsExactly(1);
        assertThat(summary.isTrailerValid()).isFalse();
        assertThat(summary.getStatus()).isEqualTo(EftProcessStatus.FAILED);
        assertThat(summary.getErrors()).extracting(EFTParseError::getError, EFTParseError::getIndex)
                .containsExactly(tuple(EFTError.MISPLACED_TRAILER, 1));
        assertThat(summary.getShortNameBalances()).isEmpty();
    }

    @Test
    @DisplayName("FAILED — duplicate header and trailer are reported, first header and last trailer kept")
    void duplicateHeaderAndTrailer_failTheFile() {
        accept(VALID_HEADER, 0);
        accept(header("1", "20230901", "0000", "20230901", "20230901"), 1);
        accept(trailer("7", "9", "1"), 2);
        accept(VALID_TRAILER, 3);
        summary.finish(3);

        assertThat(summary.getHeader().getIndex()).isZero();
        assertThat(summary.getTrailer().getIndex()).isEqualTo(3);
        assertThat(summary.getStatus()).isEqualTo(EftProcessStatus.FAILED);
        assertThat(summary.getErrors()).extracting(EFTParseError::getError, EFTParseError::getIndex)
                .containsExactly(tuple(EFTError.MISPLACED_HEADER, 1), tuple(EFTError.MISPLACED_TRAILER, 2));
    }
}
