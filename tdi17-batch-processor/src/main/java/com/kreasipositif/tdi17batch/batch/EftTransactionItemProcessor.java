package com.kreasipositif.tdi17batch.batch;

import com.kreasipositif.eftparser.record.EFTBase;
import com.kreasipositif.eftparser.record.EFTRecord;
import com.kreasipositif.eftparser.record.EFTShortnameType;
import com.kreasipositif.tdi17batch.config.EftProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.stereotype.Component;

/**
 * Drops the transactions that are not ours to reconcile.
 *
 * <p>A transaction is kept when it has parse errors (so they get reported) or when it is an
 * EFT or WIRE deposit made at the configured TDI17 location. Header and trailer records
 * always pass through. Returning {@code null} filters the item out of the chunk.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EftTransactionItemProcessor implements ItemProcessor<EFTBase, EFTBase> {

    private final EftProperties eftProperties;

    @Override
    public EFTBase process(EFTBase item) {
        if (!(item instanceof EFTRecord)) {
            return item;
        }
        EFTRecord transaction = (EFTRecord) item;

        if (transaction.hasErrors()) {
            log.debug("Line {} kept with {} error(s)", transaction.getIndex(), transaction.getErrors().size());
            return transaction;
        }
        if (isEftOrWire(transaction.getShortNameType())
                && eftProperties.getTdi17LocationId().equals(transaction.getLocationId())) {
            return transaction;
        }

        log.debug("Line {} skipped, type={}, location={}",
                transaction.getIndex(), transaction.getShortNameType(), transaction.getLocationId());
        return null;
    }

    private static boolean isEftOrWire(EFTShortnameType shortNameType) {
        return shortNameType == EFTShortnameType.EFT || shortNameType == EFTShortnameType.WIRE;
    }
}
