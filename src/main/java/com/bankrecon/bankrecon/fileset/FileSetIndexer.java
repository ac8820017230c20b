package com.bankrecon.bankrecon.fileset;

import com.bankrecon.bankrecon.ReconConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Groups the files of an export directory by the bank code embedded as {@code .B####.} in the name.
 */
@Component
public class FileSetIndexer {

    private static final Logger log = LoggerFactory.getLogger(FileSetIndexer.class);
    private static final Pattern BANK_ID_PATTERN = Pattern.compile(ReconConstants.BANK_ID_REGEX);

    /**
     * Lists regular files in {@code directory} (names sorted) and indexes those carrying a bank code.
     * Files without a bank code are ignored.
     */
    public FileSetIndex scan(Path directory) {
        List<String> fileNames = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .forEach(fileNames::add);
        } catch (IOException ex) {
            throw new IllegalStateException(ReconConstants.MSG_DIRECTORY_UNREADABLE.formatted(directory), ex);
        }

        Map<String, List<String>> filesByBank = new LinkedHashMap<>();
        for (String fileName : fileNames) {
            String bankId = bankIdOf(fileName);
            if (bankId != null) {
                filesByBank.computeIfAbsent(bankId, id -> new ArrayList<>()).add(fileName);
            }
        }
        log.info("Indexed {} bank(s) from {} file(s) in {}", filesByBank.size(), fileNames.size(), directory);
        return new FileSetIndex(filesByBank);
    }

    static String bankIdOf(String fileName) {
        Matcher matcher = BANK_ID_PATTERN.matcher(fileName);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * File name with every bank code masked, used to compare file-set shapes across banks.
     */
    public static String shapeKey(String fileName) {
        return BANK_ID_PATTERN.matcher(fileName).replaceAll(Matcher.quoteReplacement(ReconConstants.SHAPE_KEY_REPLACEMENT));
    }
}
