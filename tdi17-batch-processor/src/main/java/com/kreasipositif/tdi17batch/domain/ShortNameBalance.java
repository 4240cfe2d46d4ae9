package com.kreasipositif.tdi17batch.domain;

import com.kreasipositif.eftparser.record.EFTShortnameType;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running total of the error-free deposits made under one short name.
 */
@Getter
public class ShortNameBalance {

    private final String shortName;
    private final EFTShortnameType shortNameType;
    private final boolean generateShortName;
    private BigDecimal balance = BigDecimal.ZERO;

    @Getter(AccessLevel.NONE)
    private final List<ShortNameTransaction> transactions = new ArrayList<>();

    public ShortNameBalance(String shortName, EFTShortnameType shortNameType, boolean generateShortName) {
        this.shortName = shortName;
        this.shortNameType = shortNameType;
        this.generateShortName = generateShortName;
    }

    public void add(ShortNameTransaction transaction) {
        transactions.add(transaction);
        balance = balance.add(transaction.depositAmount());
    }

    public List<ShortNameTransaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    public int getTransactionCount() {
        return transactions.size();
    }
}
