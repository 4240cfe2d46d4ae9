package com.kreasipositif.tdi17batch.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One deposit counted towards a {@link ShortNameBalance}.
 *
 * @param lineIndex       0-based line of the deposit in the TDI17 file
 * @param depositAmount   deposit amount in dollars
 * @param depositDateTime deposit date and time as written in the file
 */
public record ShortNameTransaction(int lineIndex, BigDecimal depositAmount, LocalDateTime depositDateTime) {
}
