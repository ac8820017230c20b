package com.bankrecon.bankrecon.run;

import com.bankrecon.bankrecon.ReconConstants;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * The two independent per-bank flows: retail (PM) and business (BM).
 */
public enum FlowType {
    PM(""),
    BM("_BM");

    private static final DateTimeFormatter DATE_STAMP = DateTimeFormatter.ofPattern(ReconConstants.DATE_STAMP_PATTERN);

    private final String fileNameInfix;

    FlowType(String fileNameInfix) {
        this.fileNameInfix = fileNameInfix;
    }

    /**
     * {@code 1234_20250706.xlsx} for PM, {@code 1234_BM_20250706.xlsx} for BM.
     */
    public String outputFileName(String bankId, LocalDate runDate) {
        return bankId + fileNameInfix + "_" + runDate.format(DATE_STAMP) + ReconConstants.OUTPUT_FILE_EXTENSION;
    }
}
