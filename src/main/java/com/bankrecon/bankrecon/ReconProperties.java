package com.bankrecon.bankrecon;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.Charset;

/**
 * Externalized reconciliation configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "recon")
public class ReconProperties {

    private String customerKeyColumn = ReconConstants.DEFAULT_CUSTOMER_KEY_COLUMN;
    private String pmExtension = ReconConstants.DEFAULT_PM_EXTENSION;
    private String bmExtension = ReconConstants.DEFAULT_BM_EXTENSION;
    private String obsMarker = ReconConstants.DEFAULT_OBS_MARKER;
    private String extractDelimiter = ReconConstants.DEFAULT_EXTRACT_DELIMITER;
    private String extractCharset = ReconConstants.DEFAULT_EXTRACT_CHARSET;
    private int flagSampleSize = ReconConstants.DEFAULT_FLAG_SAMPLE_SIZE;
    private long flagSampleSeed = ReconConstants.DEFAULT_FLAG_SAMPLE_SEED;
    private int orgNumberWidth = ReconConstants.DEFAULT_ORG_NUMBER_WIDTH;
    private String outputRoot = ReconConstants.DEFAULT_OUTPUT_ROOT;
    private String outputDirPrefix = ReconConstants.DEFAULT_OUTPUT_DIR_PREFIX;

    public String getCustomerKeyColumn() {
        return customerKeyColumn;
    }

    public void setCustomerKeyColumn(String customerKeyColumn) {
        this.customerKeyColumn = customerKeyColumn;
    }

    public String getPmExtension() {
        return pmExtension;
    }

    public void setPmExtension(String pmExtension) {
        this.pmExtension = pmExtension;
    }

    public String getBmExtension() {
        return bmExtension;
    }

    public void setBmExtension(String bmExtension) {
        this.bmExtension = bmExtension;
    }

    public String getObsMarker() {
        return obsMarker;
    }

    public void setObsMarker(String obsMarker) {
        this.obsMarker = obsMarker;
    }

    public String getExtractDelimiter() {
        return extractDelimiter;
    }

    public void setExtractDelimiter(String extractDelimiter) {
        this.extractDelimiter = extractDelimiter;
    }

    public String getExtractCharset() {
        return extractCharset;
    }

    public void setExtractCharset(String extractCharset) {
        this.extractCharset = extractCharset;
    }

    public Charset extractCharset() {
        return Charset.forName(extractCharset);
    }

    public int getFlagSampleSize() {
        return flagSampleSize;
    }

    public void setFlagSampleSize(int flagSampleSize) {
        this.flagSampleSize = flagSampleSize;
    }

    public long getFlagSampleSeed() {
        return flagSampleSeed;
    }

    public void setFlagSampleSeed(long flagSampleSeed) {
        this.flagSampleSeed = flagSampleSeed;
    }

    public int getOrgNumberWidth() {
        return orgNumberWidth;
    }

    public void setOrgNumberWidth(int orgNumberWidth) {
        this.orgNumberWidth = orgNumberWidth;
    }

    public String getOutputRoot() {
        return outputRoot;
    }

    public void setOutputRoot(String outputRoot) {
        this.outputRoot = outputRoot;
    }

    public String getOutputDirPrefix() {
        return outputDirPrefix;
    }

    public void setOutputDirPrefix(String outputDirPrefix) {
        this.outputDirPrefix = outputDirPrefix;
    }
}
