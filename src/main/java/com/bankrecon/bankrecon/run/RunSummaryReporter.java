package com.bankrecon.bankrecon.run;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.report.DatasetStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the end-of-run summary and emits it on the summary logger, which always reaches the console.
 */
@Component
public class RunSummaryReporter {

    private static final Logger summaryLog = LoggerFactory.getLogger(ReconConstants.SUMMARY_LOGGER);
    private static final String INDENT = "   ";
    private static final String ITEM_INDENT = "      ";

    public void report(RunResult result) {
        summaryLog.info(render(result));
    }

    public String render(RunResult result) {
        StringBuilder text = new StringBuilder();
        text.append(System.lineSeparator()).append("Run summary").append(System.lineSeparator());
        if (result.isFatal()) {
            line(text, INDENT + "- Run aborted: " + result.fatalMessage());
            return text.toString();
        }
        line(text, INDENT + "- Processed " + result.summary().bankCount() + " banks");
        text.append(System.lineSeparator());

        for (BankSummary bank : result.summary().banks()) {
            line(text, "Bank " + bank.bankId() + ":");
            section(text, "Categories merged", bank.mergedCategories(), "+ ");
            section(text, "Bank does not have category types", bank.missingFiles(), "! ");
            section(text, "Files with errors", bank.failedFiles(), "x ");
            line(text, INDENT + "- Final columns: " + bank.columns().size() + " columns");
            for (String note : bank.notes()) {
                line(text, INDENT + "- Note: " + note);
            }
            for (FlowOutcome flow : bank.flowOutcomes()) {
                line(text, INDENT + "- " + flow.flow() + " flow: " + describe(flow));
            }

            DatasetStats stats = bank.stats();
            if (stats != null) {
                text.append(System.lineSeparator());
                line(text, "Dataset summary");
                line(text, INDENT + "- Total rows: " + stats.totalRows());
                line(text, INDENT + "- Total columns: " + stats.totalColumns());
                line(text, INDENT + "- Static columns: " + stats.staticColumns().size() + " -> " + stats.staticColumns());
                line(text, INDENT + "- Dynamic category columns: " + stats.flagColumns().size());
                line(text, INDENT + "- Rows with multiple categories: " + stats.multiCategoryRows());
            }
            text.append(System.lineSeparator());
        }
        return text.toString();
    }

    private void section(StringBuilder text, String title, List<String> items, String marker) {
        line(text, INDENT + "- " + title + ": " + items.size());
        items.stream().sorted().forEach(item -> line(text, ITEM_INDENT + marker + item));
    }

    private String describe(FlowOutcome flow) {
        return switch (flow.status()) {
            case COMPLETED -> "saved " + flow.rows() + " rows to " + flow.outputFile();
            case NO_FILES, NO_DATA -> "skipped (" + flow.message() + ")";
            case FAILED -> "failed (" + flow.message() + ")";
        };
    }

    private void line(StringBuilder text, String value) {
        text.append(value).append(System.lineSeparator());
    }
}
