package com.kreasipositif.eftparser.error;

import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * A single parse failure on a TDI17 line.
 *
 * <p>{@code index} is the 0-based line number of the owning record. It is stamped by
 * {@link com.kreasipositif.eftparser.record.EFTBase#addError(EFTParseError)}, so an error
 * created by a parsing helper usually starts out without one.
 */
@Value
@AllArgsConstructor
public class EFTParseError {

    EFTError error;

    @With
    Integer index;

    String message;

    public EFTParseError(EFTError error) {
        this(error, null, error.getMessage());
    }

    public EFTParseError(EFTError error, Integer index) {
        this(error, index, error.getMessage());
    }

    /** Enum name of the error kind, e.g. {@code INVALID_RECORD_TYPE}. */
    public String getCode() {
        return error.name();
    }
}
