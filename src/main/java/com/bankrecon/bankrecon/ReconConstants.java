package com.bankrecon.bankrecon;

/**
 * Shared constants for the extract merge and PAC reconciliation flow.
 */
public final class ReconConstants {

    private ReconConstants() {
    }

    public static final String FLAG_PRESENT = "J";
    public static final String FLAG_ABSENT = "N";
    public static final String BLANK = "";

    public static final String DEFAULT_CUSTOMER_KEY_COLUMN = "Kundenummer";
    public static final String DEFAULT_PM_EXTENSION = ".CSV";
    public static final String DEFAULT_BM_EXTENSION = ".CSV.BM";
    public static final String DEFAULT_OBS_MARKER = "OBS";
    public static final String DEFAULT_EXTRACT_DELIMITER = ";";
    public static final String DEFAULT_EXTRACT_CHARSET = "ISO-8859-1";
    public static final int DEFAULT_FLAG_SAMPLE_SIZE = 100;
    public static final long DEFAULT_FLAG_SAMPLE_SEED = 42L;
    public static final int DEFAULT_ORG_NUMBER_WIDTH = 11;
    public static final String DEFAULT_OUTPUT_ROOT = ".";
    public static final String DEFAULT_OUTPUT_DIR_PREFIX = "Out_Excel_Exports_";

    public static final String BANK_ID_REGEX = "\\.B(\\d{4})\\.";
    public static final String SHAPE_KEY_REPLACEMENT = ".B####.";
    public static final int CATEGORY_COLUMN_INDEX = 2;
    public static final String UNNAMED_COLUMN_PREFIX = "Unnamed: ";

    public static final String CATEGORY_COUNT_COLUMN = "Category_Count";
    public static final String AGREEMENT_IDS_COLUMN = "AVTALE_IDs";
    public static final String USERS_COLUMN = "Users_PERSONNR:BRUKERTYPE";
    public static final String LOOKUP_JOIN_DELIMITER = "|";
    public static final String PERSON_ROLE_SEPARATOR = ":";

    public static final String PAC_COLUMN_BANK_ID = "BANK_ID";
    public static final String PAC_COLUMN_ORG_NUMBER = "FORETAKSNR";
    public static final String PAC_COLUMN_PERSON_NUMBER = "PERSONNR";
    public static final String PAC_COLUMN_AGREEMENT_ID = "AVTALE_ID";
    public static final String PAC_COLUMN_USER_TYPE = "BRUKERTYPE";

    public static final String DATE_STAMP_PATTERN = "yyyyMMdd";
    public static final String OUTPUT_FILE_EXTENSION = ".xlsx";
    public static final String OUTPUT_SHEET_NAME = "Sheet1";
    public static final String LOG_FILE_PREFIX = "bankrecon_";
    public static final String LOG_FILE_EXTENSION = ".log";
    public static final String SUMMARY_LOGGER = "bankrecon.summary";

    public static final String OPTION_BASE_DIR = "base-dir";
    public static final String OPTION_PAC_FILE = "pac-file";
    public static final String OPTION_VERBOSE = "verbose";
    public static final String OPTION_ONLY_BANK = "only-bank";
    public static final String OPTION_SKIP_PM = "skip-pm";
    public static final String OPTION_SKIP_BM = "skip-bm";
    public static final String OPTION_OUTPUT_DIR = "output-dir";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_USAGE = 2;

    public static final String MSG_DIRECTORY_UNREADABLE = "Unable to read bank file directory: %s";
    public static final String MSG_NO_BANKS_FOUND = "No bank files matching *.B####.* found in: %s";
    public static final String MSG_EXTRACT_READ_FAILED = "Unable to read extract file: %s";
    public static final String MSG_EXTRACT_EXTRA_FIELDS = "Extract %s line %d: expected %d fields, saw %d";
    public static final String MSG_BLANK_CATEGORY = "Category label is blank in first data row of %s";
    public static final String MSG_KEY_COLUMN_MISSING = "Customer key column %s not found in merged table";
    public static final String MSG_PAC_READ_FAILED = "Unable to read PAC export: %s";
    public static final String MSG_PAC_NO_SHEET = "PAC export has no sheet: %s";
    public static final String MSG_PAC_COLUMNS_MISSING = "PAC export %s is missing required column(s): %s";
    public static final String MSG_OUTPUT_WRITE_FAILED = "Unable to write spreadsheet: %s";
    public static final String MSG_NO_PAC_DATA = "No PAC data found for bank %s";
    public static final String MSG_USAGE = "Usage: --base-dir=<dir> --pac-file=<xlsx> [--verbose] [--only-bank=<id>]"
            + " [--skip-pm] [--skip-bm] [--output-dir=<dir>]";
}
