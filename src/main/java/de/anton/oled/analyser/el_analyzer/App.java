package de.anton.oled.analyser.el_analyzer;

import de.anton.oled.analyser.el_analyzer.exceptions.ConfigurationException;
import de.anton.oled.analyser.el_analyzer.exceptions.ReferenceDataException;
import de.anton.oled.analyser.el_analyzer.model.BatchReport;
import de.anton.oled.analyser.el_analyzer.model.ReferenceData;
import de.anton.oled.analyser.el_analyzer.service.AnalysisConfiguration;
import de.anton.oled.analyser.el_analyzer.service.BatchAnalysisService;
import de.anton.oled.analyser.el_analyzer.service.ConfigurationLoader;
import de.anton.oled.analyser.el_analyzer.service.ReferenceDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Command line entry point: {@code App <dataRoot> [configFile]}.
 * Exits with 0 if every sample run was analysed, 2 if some failed and 1 on a fatal error.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_SAMPLE_FAILURES = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the batch and returns the process exit code.
     */
    static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            logger.error("Usage: App <dataRoot> [configFile]");
            return EXIT_FATAL;
        }
        Path dataRoot = Paths.get(args[0]);
        Path configFile = args.length == 2 ? Paths.get(args[1]) : null;

        try {
            logger.info("Creating application components...");
            AnalysisConfiguration config = new ConfigurationLoader().load(configFile);
            ReferenceData reference = new ReferenceDataService().load(config);
            BatchReport report = new BatchAnalysisService(config, reference).runBatch(dataRoot);

            for (Map.Entry<?, String> failure : report.getFailures().entrySet()) {
                logger.warn("Failed: {} ({})", failure.getKey(), failure.getValue());
            }
            logger.info("Analysed {} of {} sample runs below {}", report.getResults().size(), report.total(), dataRoot);
            return report.hasFailures() ? EXIT_SAMPLE_FAILURES : EXIT_OK;
        } catch (ConfigurationException | ReferenceDataException e) {
            logger.error("Analysis aborted: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }
}
