package com.kreasipositif.tdi17batch.batch;

import com.kreasipositif.eftparser.error.EFTParseError;
import com.kreasipositif.eftparser.record.EFTBase;
import com.kreasipositif.eftparser.record.EFTRecord;
import com.kreasipositif.eftparser.record.EFTTrailer;
import com.kreasipositif.tdi17batch.domain.EftErrorRow;
import com.kreasipositif.tdi17batch.domain.EftProcessStatus;
import com.kreasipositif.tdi17batch.domain.ShortNameBalance;
import com.kreasipositif.tdi17batch.domain.Tdi17ReconciliationSummary;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamWriter;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.batch.item.file.transform.BeanWrapperFieldExtractor;
import org.springframework.batch.item.file.transform.DelimitedLineAggregator;
import org.springframework.core.io.FileSystemResource;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds every line that survived the processor into a {@link Tdi17ReconciliationSummary} and
 * writes the reconciliation report as CSV files in the output directory:
 * <ul>
 *   <li><b>transactions-{jobExecutionId}.csv</b>: accepted transactions without errors</li>
 *   <li><b>errors-{jobExecutionId}.csv</b>: one row per parse error, header and trailer included</li>
 *   <li><b>balances-{jobExecutionId}.csv</b>: totals per short name, only for a completed file</li>
 * </ul>
 *
 * <p>Every field is double quoted; the header row is not.
 *
 * <p>Created as a {@code @StepScope} bean in {@link com.kreasipositif.tdi17batch.config.BatchConfig},
 * so each step execution starts with a fresh summary. Being a {@link StepExecutionListener}, it is
 * registered on the step together with the writer and turns the summary status into the step's
 * exit status.
 */
@Slf4j
public class EftReconciliationItemWriter implements ItemStreamWriter<EFTBase>, StepExecutionListener {

    static final String[] TRANSACTION_FIELDS = {
            "index", "locationId", "depositDateTime", "transactionDescription", "shortNameType",
            "generateShortName", "depositAmount", "currency", "exchangeAdjAmount", "depositAmountCad",
            "transactionDate", "jvType", "jvNumber"
    };

    static final String[] ERROR_FIELDS = {"lineType", "lineIndex", "code", "message"};

    static final String[] BALANCE_FIELDS = {
            "shortName", "shortNameType", "generateShortName", "balance", "transactionCount"
    };

    private final String outputDirectory;
    private final long jobExecutionId;

    @Getter
    private final Tdi17ReconciliationSummary summary = new Tdi17ReconciliationSummary();

    private FlatFileItemWriter<EFTRecord> transactionWriter;
    private FlatFileItemWriter<EftErrorRow> errorWriter;

    public EftReconciliationItemWriter(String outputDirectory, long jobExecutionId) {
        this.outputDirectory = outputDirectory;
        this.jobExecutionId = jobExecutionId;
    }

    @Override
    public void open(ExecutionContext executionContext) throws ItemStreamException {
        File outputDir = new File(outputDirectory);
        if (!outputDir.exists() && !outputDir.mkdirs()) {
            throw new ItemStreamException("Cannot create output directory " + outputDir.getAbsolutePath());
        }

        transactionWriter = buildWriter(outputPath("transactions"), TRANSACTION_FIELDS, "transactionWriter");
        errorWriter = buildWriter(outputPath("errors"), ERROR_FIELDS, "errorWriter");

        transactionWriter.open(executionContext);
        errorWriter.open(executionContext);

        log.info("Reconciliation output for job execution {} goes to {}", jobExecutionId, outputDir.getAbsolutePath());
    }

    @Override
    public void write(Chunk<? extends EFTBase> chunk) throws Exception {
        List<EFTRecord> transactions = new ArrayList<>();
        List<EftErrorRow> errorRows = new ArrayList<>();

        for (EFTBase line : chunk) {
            summary.accept(line);
            // trailer errors are only final once the last line is known, see afterStep
            if (!(line instanceof EFTTrailer)) {
                errorRows.addAll(errorRows(line));
            }
            if (line instanceof EFTRecord && !line.hasErrors()) {
                transactions.add((EFTRecord) line);
            }
        }

        if (!transactions.isEmpty()) {
            transactionWriter.write(new Chunk<>(transactions));
        }
        if (!errorRows.isEmpty()) {
            errorWriter.write(new Chunk<>(errorRows));
        }
    }

    @Override
    public void update(ExecutionContext executionContext) throws ItemStreamException {
        if (transactionWriter != null) transactionWriter.update(executionContext);
        if (errorWriter != null) errorWriter.update(executionContext);
    }

    @Override
    public void close() throws ItemStreamException {
        if (transactionWriter != null) transactionWriter.close();
        if (errorWriter != null) errorWriter.close();
    }

    /**
     * Runs once every chunk has been written: reports the file status and, for a completed
     * file, writes the short name balances.
     */
    @Override
    public ExitStatus afterStep(StepExecution stepExecution) {
        // every line is read, filtered or not, and line indexes start at 0
        int lastLineIndex = (int) stepExecution.getReadCount() - 1;
        List<EftErrorRow> trailerErrorRows = new ArrayList<>();
        for (EFTTrailer trailer : summary.finish(lastLineIndex)) {
            trailerErrorRows.addAll(errorRows(trailer));
        }
        if (!trailerErrorRows.isEmpty()) {
            writeRows(errorWriter, trailerErrorRows, "trailer errors");
        }

        EftProcessStatus status = summary.getStatus();
        stepExecution.getExecutionContext().putString("eftProcessStatus", status.name());

        if (!summary.isHeaderValid()) {
            log.error("TDI17 file has a missing or invalid header");
        }
        if (!summary.isTrailerValid()) {
            log.error("TDI17 file has a missing or invalid trailer");
        }

        if (status == EftProcessStatus.FAILED) {
            log.error("TDI17 reconciliation FAILED: {} transaction(s), {} with errors, {} error(s) in total",
                    summary.getTransactionCount(), summary.getInvalidTransactionCount(), summary.getErrors().size());
            return ExitStatus.FAILED.addExitDescription(
                    summary.getErrors().size() + " parse error(s), see " + outputPath("errors"));
        }

        List<ShortNameBalance> balances = summary.getShortNameBalances();
        writeBalances(balances);
        log.info("TDI17 reconciliation COMPLETED: {} transaction(s) across {} short name(s)",
                summary.getTransactionCount(), balances.size());
        return ExitStatus.COMPLETED;
    }

    private void writeBalances(List<ShortNameBalance> balances) {
        FlatFileItemWriter<ShortNameBalance> balanceWriter =
                buildWriter(outputPath("balances"), BALANCE_FIELDS, "balanceWriter");
        balanceWriter.open(new ExecutionContext());
        try {
            writeRows(balanceWriter, balances, "short name balances");
        } finally {
            balanceWriter.close();
        }
    }

    private static <T> void writeRows(FlatFileItemWriter<T> writer, List<T> rows, String what) {
        try {
            writer.write(new Chunk<>(rows));
        } catch (Exception e) {
            throw new ItemStreamException("Failed to write " + what, e);
        }
    }

    private static List<EftErrorRow> errorRows(EFTBase line) {
        List<EftErrorRow> rows = new ArrayList<>();
        for (EFTParseError error : line.getErrors()) {
            rows.add(EftErrorRow.of(line, error));
        }
        return rows;
    }

    String outputPath(String prefix) {
        return new File(outputDirectory, prefix + "-" + jobExecutionId + ".csv").getAbsolutePath();
    }

    // ─── helper ──────────────────────────────────────────────────────────────

    private static <T> FlatFileItemWriter<T> buildWriter(String path, String[] fields, String name) {
        BeanWrapperFieldExtractor<T> extractor = new BeanWrapperFieldExtractor<>();
        extractor.setNames(fields);

        DelimitedLineAggregator<T> aggregator = new DelimitedLineAggregator<>();
        aggregator.setDelimiter(",");
        // descriptions and messages may contain the delimiter
        aggregator.setQuoteCharacter("\"");
        aggregator.setFieldExtractor(extractor);

        return new FlatFileItemWriterBuilder<T>()
                .name(name)
                .resource(new FileSystemResource(path))
                .lineAggregator(aggregator)
                .headerCallback(writer -> writer.write(String.join(",", fields)))
                .append(false)
                .build();
    }
}
