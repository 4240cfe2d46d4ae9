package com.kreasipositif.tdi17batch.domain;

import com.kreasipositif.eftparser.error.EFTError;
import com.kreasipositif.eftparser.error.EFTParseError;
import com.kreasipositif.eftparser.record.EFTBase;
import com.kreasipositif.eftparser.record.EFTHeader;
import com.kreasipositif.eftparser.record.EFTRecord;
import com.kreasipositif.eftparser.record.EFTShortnameType;
import com.kreasipositif.eftparser.record.EFTTrailer;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the lines of one TDI17 file as they leave the item processor and derives the
 * file status and the per short name balances.
 *
 * <p>Only lines that survived the EFT filter are expected here: the header, the trailer, and
 * transactions that either carry errors or are EFT/WIRE deposits for the configured location.
 * Filtered lines still count for line positions, so {@link #finish(int)} must be told the index
 * of the last line read before the trailer position can be checked.
 *
 * <p>The file is {@link EftProcessStatus#FAILED} when the header or trailer is missing, when any
 * header or trailer line has errors (a misplaced or duplicate one included), or when any accepted
 * transaction has errors. Balances are only meaningful for a {@link EftProcessStatus#COMPLETED} file.
 */
@Slf4j
@Getter
public class Tdi17ReconciliationSummary {

    private EFTHeader header;
    private EFTTrailer trailer;
    private int transactionCount;
    private int invalidTransactionCount;

    @Getter(AccessLevel.NONE)
    private final List<EFTHeader> headers = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<EFTTrailer> trailers = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<EFTParseError> errors = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Map<BalanceKey, ShortNameBalance> balances = new LinkedHashMap<>();

    /**
     * Adds one line. Trailer errors are only collected by {@link #finish(int)}, once it is known
     * whether the trailer really was the last line.
     */
    public void accept(EFTBase line) {
        if (line instanceof EFTHeader) {
            acceptHeader((EFTHeader) line);
        } else if (line instanceof EFTTrailer) {
            trailers.add((EFTTrailer) line);
            trailer = (EFTTrailer) line;
        } else {
            errors.addAll(line.getErrors());
            acceptTransaction((EFTRecord) line);
        }
    }

    private void acceptHeader(EFTHeader line) {
        if (line.getIndex() != 0) {
            log.warn("Line {}: header record is not the first line", line.getIndex());
            line.addError(new EFTParseError(EFTError.MISPLACED_HEADER));
        }
        errors.addAll(line.getErrors());
        headers.add(line);
        if (header == null) {
            header = line;
        }
    }

    private void acceptTransaction(EFTRecord transaction) {
        transactionCount++;
        if (transaction.hasErrors()) {
            invalidTransactionCount++;
            return;
        }

        BigDecimal depositAmount = toDollars(transaction.getDepositAmountCad());
        BalanceKey key = new BalanceKey(transaction.getTransactionDescription(), transaction.getShortNameType());
        ShortNameBalance balance = balances.computeIfAbsent(key,
                k -> new ShortNameBalance(k.shortName(), k.shortNameType(), transaction.isGenerateShortName()));
        balance.add(new ShortNameTransaction(transaction.getIndex(), depositAmount,
                transaction.getDepositDateTime()));
    }

    /**
     * Closes the file: flags every trailer that is not on {@code lastLineIndex} and collects the
     * trailer errors. Returns the trailer lines, in file order, so their errors can be reported.
     */
    public List<EFTTrailer> finish(int lastLineIndex) {
        for (EFTTrailer line : trailers) {
            if (line.getIndex() != lastLineIndex) {
                log.warn("Line {}: trailer record is not the last line ({})", line.getIndex(), lastLineIndex);
                line.addError(new EFTParseError(EFTError.MISPLACED_TRAILER));
            }
            errors.addAll(line.getErrors());
        }
        return Collections.unmodifiableList(trailers);
    }

    public boolean isHeaderValid() {
        return header != null && headers.stream().noneMatch(EFTBase::hasErrors);
    }

    public boolean isTrailerValid() {
        return trailer != null && trailers.stream().noneMatch(EFTBase::hasErrors);
    }

    public EftProcessStatus getStatus() {
        if (!isHeaderValid() || !isTrailerValid() || invalidTransactionCount > 0) {
            return EftProcessStatus.FAILED;
        }
        return EftProcessStatus.COMPLETED;
    }

    public List<EFTParseError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * Balances in first-seen order, or an empty list when the file failed.
     */
    public List<ShortNameBalance> getShortNameBalances() {
        if (getStatus() != EftProcessStatus.COMPLETED) {
            return List.of();
        }
        return List.copyOf(balances.values());
    }

    static BigDecimal toDollars(BigDecimal cents) {
        return cents.movePointLeft(2);
    }

    /** The same short name used over EFT and over WIRE is two separate balances. */
    private record BalanceKey(String shortName, EFTShortnameType shortNameType) {
    }
}
