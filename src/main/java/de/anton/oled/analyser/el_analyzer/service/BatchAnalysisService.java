package de.anton.oled.analyser.el_analyzer.service;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import de.anton.oled.analyser.el_analyzer.exceptions.DegenerateComputationException;
import de.anton.oled.analyser.el_analyzer.exceptions.IngestionException;
import de.anton.oled.analyser.el_analyzer.model.AngleSeries;
import de.anton.oled.analyser.el_analyzer.model.BatchReport;
import de.anton.oled.analyser.el_analyzer.model.ExcelExporter;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.model.ResultWriter;
import de.anton.oled.analyser.el_analyzer.model.SampleResult;
import de.anton.oled.analyser.el_analyzer.model.SampleRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the analysis over every sample run below a data root
 * ({@code <dataRoot>/<sample>/<timestamp>/raw}). Samples are processed one after another;
 * a failing sample is reported and the batch continues.
 */
public class BatchAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final AnalysisService analysisService;
    private final ResultWriter resultWriter;
    private final ExcelExporter excelExporter;

    public BatchAnalysisService(AnalysisConfiguration config, ReferenceData reference) {
        Objects.requireNonNull(config, "Configuration cannot be null.");
        this.analysisService = new AnalysisService(config, reference);
        this.resultWriter = new ResultWriter(config.oledArea(), config.photodiodeDistance(),
            config.photodiodeArea(), LocalDateTime.now());
        this.excelExporter = new ExcelExporter();
    }

    /**
     * Analyses all runs below the data root and writes their results.
     *
     * @throws ConfigurationException if the data root is unusable or a run's angle sweep
     *                                ends neither at 90 nor at 180 degrees
     */
    public BatchReport runBatch(Path dataRoot) throws ConfigurationException {
        BatchReport report = new BatchReport();
        List<SampleRun> runs = preflight(discoverRuns(dataRoot), report);
        logger.info("Batch: {} sample runs to analyse below {}", runs.size(), dataRoot);

        for (SampleRun run : runs) {
            try {
                SampleResult result = analysisService.runSample(run);
                resultWriter.writeAll(result);
                excelExporter.export(result, run.outputDirectory().resolve(run.sampleName() + "_effdata.xlsx"));
                report.addResult(result);
            } catch (IngestionException | DegenerateComputationException | IOException e) {
                logger.error("Batch: sample run {} failed", run, e);
                report.addFailure(run, e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Batch: unexpected error in sample run {}", run, e);
                report.addFailure(run, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        logger.info("Batch finished: {}", report);
        return report;
    }

    /**
     * Every {@code <sample>/<timestamp>} folder that contains a {@code raw} folder, sorted by path.
     */
    public List<SampleRun> discoverRuns(Path dataRoot) throws ConfigurationException {
        if (!Files.isDirectory(dataRoot)) {
            throw new ConfigurationException("Data root is not a directory: " + dataRoot);
        }
        List<SampleRun> runs = new ArrayList<>();
        try {
            for (Path sampleDirectory : listDirectories(dataRoot)) {
                for (Path runDirectory : listDirectories(sampleDirectory)) {
                    SampleRun run = new SampleRun(sampleDirectory.getFileName().toString(),
                        runDirectory.getFileName().toString(), runDirectory);
                    if (Files.isDirectory(run.rawDirectory())) {
                        runs.add(run);
                    } else {
                        logger.warn("Skipping {}: no {} folder", runDirectory, SampleRun.RAW_FOLDER);
                    }
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot scan data root " + dataRoot + ": " + e.getMessage(), e);
        }
        logger.debug("Discovered runs: {}", runs);
        return runs;
    }

    /**
     * Checks the angle range of every run before any is processed. Runs whose angle file
     * cannot be read are reported as failed and dropped.
     *
     * @return the runs that passed
     * @throws ConfigurationException on the first run with an unsupported max angle
     */
    public List<SampleRun> preflight(List<SampleRun> runs, BatchReport report) throws ConfigurationException {
        SpectrumIngestionService ingestion = analysisService.getIngestionService();
        List<SampleRun> accepted = new ArrayList<>();
        for (SampleRun run : runs) {
            AngleSeries angles;
            try {
                angles = ingestion.loadAngleSeries(run.keithleyDirectory());
            } catch (IngestionException e) {
                logger.error("Batch: cannot read the angle series of {}", run, e);
                report.addFailure(run, e.getMessage());
                continue;
            }
            try {
                angles.operativeRange();
            } catch (ConfigurationException e) {
                logger.error("Batch: aborting, sample run {} has an unsupported angle range {}", run, angles);
                throw e;
            }
            accepted.add(run);
        }
        return accepted;
    }

    private static List<Path> listDirectories(Path parent) throws IOException {
        try (Stream<Path> stream = Files.list(parent)) {
            return stream
                .filter(Files::isDirectory)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
