package com.bankrecon.bankrecon.run;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.ReconProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Command-line entry point: maps the run options onto a {@link RunRequest} and exposes the run's exit code.
 */
@Component
@ConditionalOnProperty(prefix = "recon.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationRunner.class);

    private final RunOrchestrator runOrchestrator;
    private final ReconProperties reconProperties;
    private int exitCode = ReconConstants.EXIT_OK;

    public ReconciliationRunner(RunOrchestrator runOrchestrator, ReconProperties reconProperties) {
        this.runOrchestrator = runOrchestrator;
        this.reconProperties = reconProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String baseDir = optionValue(args, ReconConstants.OPTION_BASE_DIR);
        String pacFile = optionValue(args, ReconConstants.OPTION_PAC_FILE);
        if (baseDir == null || pacFile == null) {
            log.error("Missing required option. {}", ReconConstants.MSG_USAGE);
            exitCode = ReconConstants.EXIT_USAGE;
            return;
        }

        LocalDate runDate = LocalDate.now();
        String outputDir = optionValue(args, ReconConstants.OPTION_OUTPUT_DIR);
        RunRequest request = new RunRequest(
                Path.of(baseDir),
                Path.of(pacFile),
                outputDir != null ? Path.of(outputDir) : defaultOutputDir(runDate),
                optionValue(args, ReconConstants.OPTION_ONLY_BANK),
                args.containsOption(ReconConstants.OPTION_SKIP_PM),
                args.containsOption(ReconConstants.OPTION_SKIP_BM),
                runDate
        );
        log.info("Starting run: baseDir={}, pacFile={}, outputDir={}, onlyBank={}, skipPm={}, skipBm={}",
                request.baseDir(), request.pacFile(), request.outputDir(), request.onlyBank(),
                request.skipPm(), request.skipBm());

        exitCode = runOrchestrator.run(request).exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private Path defaultOutputDir(LocalDate runDate) {
        String date = runDate.format(DateTimeFormatter.ofPattern(ReconConstants.DATE_STAMP_PATTERN));
        return Path.of(reconProperties.getOutputRoot()).resolve(reconProperties.getOutputDirPrefix() + date);
    }

    private String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(0).trim();
        return value.isEmpty() ? null : value;
    }
}
