package com.kreasipositif.eftparser;

import com.kreasipositif.eftparser.error.EFTError;
import com.kreasipositif.eftparser.error.EFTParseError;
import com.kreasipositif.eftparser.record.EFTBase;
import com.kreasipositif.eftparser.record.EFTHeader;
import com.kreasipositif.eftparser.record.EFTRecord;
import com.kreasipositif.eftparser.record.EFTTrailer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fully parsed TDI17 file: one header, the transaction lines and one trailer.
 *
 * <p>Parsing never fails. A missing header or trailer leaves the corresponding field
 * {@code null}. The header must be the first line and the trailer the last one: any other
 * header or trailer line, duplicates included, gets a {@link EFTError#MISPLACED_HEADER} or
 * {@link EFTError#MISPLACED_TRAILER} error. When a file carries more than one, the first
 * header and the last trailer are exposed and every line stays available through
 * {@link #getLines()}.
 */
@Slf4j
@Getter
public class TDI17File {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final List<EFTBase> lines;
    private final EFTHeader header;
    private final EFTTrailer trailer;
    private final List<EFTRecord> transactions;

    private TDI17File(List<EFTBase> lines) {
        this.lines = Collections.unmodifiableList(lines);

        int lastIndex = lines.size() - 1;
        EFTHeader firstHeader = null;
        EFTTrailer lastTrailer = null;
        List<EFTRecord> records = new ArrayList<>();
        for (EFTBase line : lines) {
            if (line instanceof EFTHeader) {
                if (line.getIndex() != 0) {
                    line.addError(new EFTParseError(EFTError.MISPLACED_HEADER));
                }
                if (firstHeader == null) {
                    firstHeader = (EFTHeader) line;
                }
            } else if (line instanceof EFTTrailer) {
                if (line.getIndex() != lastIndex) {
                    line.addError(new EFTParseError(EFTError.MISPLACED_TRAILER));
                }
                lastTrailer = (EFTTrailer) line;
            } else {
                records.add((EFTRecord) line);
            }
        }
        this.header = firstHeader;
        this.trailer = lastTrailer;
        this.transactions = Collections.unmodifiableList(records);
    }

    public static TDI17File parse(String fileContent) {
        String content = stripByteOrderMark(fileContent);
        return parse(content.lines().toList());
    }

    public static TDI17File parse(List<String> rawLines) {
        List<EFTBase> parsed = new ArrayList<>(rawLines.size());
        for (int i = 0; i < rawLines.size(); i++) {
            String line = rawLines.get(i);
            if (i == 0) {
                line = stripByteOrderMark(line);
            }
            parsed.add(EFTLineParser.parse(line, i));
        }
        TDI17File file = new TDI17File(parsed);
        log.debug("Parsed TDI17 file: {} lines, {} transactions, header={}, trailer={}",
                parsed.size(), file.transactions.size(), file.header != null, file.trailer != null);
        return file;
    }

    public static String stripByteOrderMark(String value) {
        if (!value.isEmpty() && value.charAt(0) == BYTE_ORDER_MARK) {
            return value.substring(1);
        }
        return value;
    }

    public boolean hasErrors() {
        return header == null || trailer == null || lines.stream().anyMatch(EFTBase::hasErrors);
    }

    /** Every error of every line, in file order. */
    public List<EFTParseError> getAllErrors() {
        return lines.stream()
                .flatMap(line -> line.getErrors().stream())
                .toList();
    }
}
