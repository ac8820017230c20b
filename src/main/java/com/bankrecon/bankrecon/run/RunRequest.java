package com.bankrecon.bankrecon.run;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Inputs of one reconciliation run.
 *
 * @param onlyBank restricts processing to this bank id, {@code null} for all banks
 * @param runDate  date stamped into output file names
 */
public record RunRequest(
        Path baseDir,
        Path pacFile,
        Path outputDir,
        String onlyBank,
        boolean skipPm,
        boolean skipBm,
        LocalDate runDate
) {
}
