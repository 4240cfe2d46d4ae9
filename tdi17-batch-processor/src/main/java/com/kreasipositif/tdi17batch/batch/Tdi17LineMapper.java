package com.kreasipositif.tdi17batch.batch;

import com.kreasipositif.eftparser.EFTLineParser;
import com.kreasipositif.eftparser.TDI17File;
import com.kreasipositif.eftparser.record.EFTBase;
import org.springframework.batch.item.file.LineMapper;
import org.springframework.stereotype.Component;

/**
 * Maps a raw TDI17 line to its parsed record.
 *
 * <p>Spring Batch line numbers are 1-based; record indexes are 0-based. A UTF-8 byte order
 * mark on the first line is dropped before parsing. Malformed lines never fail the step, they
 * come back as records carrying parse errors.
 */
@Component
public class Tdi17LineMapper implements LineMapper<EFTBase> {

    @Override
    public EFTBase mapLine(String line, int lineNumber) {
        String content = lineNumber == 1 ? TDI17File.stripByteOrderMark(line) : line;
        return EFTLineParser.parse(content, lineNumber - 1);
    }
}
