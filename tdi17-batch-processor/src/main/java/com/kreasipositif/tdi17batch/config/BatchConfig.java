package com.kreasipositif.tdi17batch.config;

import com.kreasipositif.eftparser.record.EFTBase;
import com.kreasipositif.tdi17batch.batch.EftReconciliationItemWriter;
import com.kreasipositif.tdi17batch.batch.EftTransactionItemProcessor;
import com.kreasipositif.tdi17batch.batch.Tdi17LineMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.file.FlatFileItemReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;

/**
 * Central Spring Batch configuration.
 *
 * <h3>Architecture</h3>
 * <pre>
 *  tdi17ReconciliationJob ─► tdi17ParseStep (chunk-oriented)
 *                                 │
 *                                 ├── FlatFileItemReader          (one TDI17 line per item, Tdi17LineMapper)
 *                                 ├── EftTransactionItemProcessor (drops other locations / PAD deposits)
 *                                 └── EftReconciliationItemWriter (transactions / errors / balances CSV)
 * </pre>
 *
 * <p>The file is read in a single step on the launching thread. Line order matters: the
 * header must be the first record and the trailer the last.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BatchConfig {

    public static final String JOB_NAME = "tdi17ReconciliationJob";
    public static final String STEP_NAME = "tdi17ParseStep";

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final Tdi17LineMapper lineMapper;
    private final EftTransactionItemProcessor itemProcessor;
    private final ResourceLoader resourceLoader;

    @Value("${batch.chunk-size:100}")
    private int chunkSize;

    @Value("${batch.output-dir:${java.io.tmpdir}/tdi17-output}")
    private String outputDirectory;

    // ─── Job ─────────────────────────────────────────────────────────────────

    @Bean
    public Job tdi17ReconciliationJob() {
        return new JobBuilder(JOB_NAME, jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(tdi17ParseStep())
                .build();
    }

    // ─── Step ────────────────────────────────────────────────────────────────

    /**
     * The writer is also a step listener; the step builder registers it as one because it
     * implements {@link org.springframework.batch.core.StepExecutionListener}.
     */
    @Bean
    public Step tdi17ParseStep() {
        return new StepBuilder(STEP_NAME, jobRepository)
                .<EFTBase, EFTBase>chunk(chunkSize, transactionManager)
                .reader(tdi17ItemReader(null))      // placeholder, overridden by @StepScope
                .processor(itemProcessor)
                .writer(reconciliationItemWriter(null))
                .build();
    }

    /**
     * Step-scoped reader over the {@code inputFile} job parameter, falling back to the
     * {@code batch.input-file} property.
     */
    @Bean
    @StepScope
    public FlatFileItemReader<EFTBase> tdi17ItemReader(
            @Value("#{jobParameters['inputFile'] ?: '${batch.input-file:}'}") String inputFile) {
        if (!StringUtils.hasText(inputFile)) {
            throw new IllegalArgumentException(
                    "No TDI17 file given: pass the 'inputFile' job parameter or set batch.input-file");
        }
        Resource resource = resourceLoader.getResource(inputFile);
        log.info("Reading TDI17 file '{}'", inputFile);

        FlatFileItemReader<EFTBase> reader = new FlatFileItemReader<>();
        reader.setName("tdi17ItemReader");
        reader.setResource(resource);
        reader.setEncoding(StandardCharsets.UTF_8.name());
        reader.setLineMapper(lineMapper);
        // every TDI17 line is data, none is a comment
        reader.setComments(new String[0]);
        return reader;
    }

    /**
     * Step-scoped writer: each step execution gets its own summary and its own output files,
     * named after the job execution id.
     */
    @Bean
    @StepScope
    public EftReconciliationItemWriter reconciliationItemWriter(
            @Value("#{stepExecution.jobExecutionId}") Long jobExecutionId) {
        return new EftReconciliationItemWriter(outputDirectory, jobExecutionId != null ? jobExecutionId : 0L);
    }
}
