package com.bankrecon.bankrecon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

@SpringBootApplication
public class BankReconApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(BankReconApplication.class);
        application.setDefaultProperties(defaultLoggingProperties(args));
        System.exit(SpringApplication.exit(application.run(args)));
    }

    /**
     * Routes the run log to a dated file and keeps the console at WARN unless {@code --verbose} is given.
     */
    static Map<String, Object> defaultLoggingProperties(String[] args) {
        boolean verbose = Arrays.stream(args).anyMatch(BankReconApplication::isVerboseOption);
        String date = LocalDate.now().format(DateTimeFormatter.ofPattern(ReconConstants.DATE_STAMP_PATTERN));

        Map<String, Object> defaults = new HashMap<>();
        defaults.put("logging.file.name", ReconConstants.LOG_FILE_PREFIX + date + ReconConstants.LOG_FILE_EXTENSION);
        defaults.put("logging.threshold.console", verbose ? "INFO" : "WARN");
        return defaults;
    }

    private static boolean isVerboseOption(String arg) {
        String option = "--" + ReconConstants.OPTION_VERBOSE;
        if (arg.equals(option)) {
            return true;
        }
        return arg.startsWith(option + "=") && !"false".equalsIgnoreCase(arg.substring(option.length() + 1));
    }
}
