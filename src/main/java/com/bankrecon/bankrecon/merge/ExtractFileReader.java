package com.bankrecon.bankrecon.merge;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.ReconProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses mainframe extract files: delimited text in a single-byte charset, first record is the header.
 * No type inference is done, so identifiers keep leading zeros. Quote characters are plain data.
 */
@Component
public class ExtractFileReader {

    private final ReconProperties reconProperties;

    public ExtractFileReader(ReconProperties reconProperties) {
        this.reconProperties = reconProperties;
    }

    public ExtractFile read(Path file) {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(reconProperties.getExtractDelimiter())
                .setQuote(null)
                .setIgnoreEmptyLines(true)
                .build();

        try (BufferedReader reader = Files.newBufferedReader(file, reconProperties.extractCharset());
             CSVParser parser = csvFormat.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            String fileName = file.getFileName().toString();
            if (!records.hasNext()) {
                return new ExtractFile(fileName, List.of(), List.of());
            }

            List<String> columns = headerNames(records.next());
            List<Map<String, String>> rows = new ArrayList<>();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (record.size() > columns.size()) {
                    throw new IllegalStateException(ReconConstants.MSG_EXTRACT_EXTRA_FIELDS.formatted(
                            fileName, record.getRecordNumber(), columns.size(), record.size()));
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), i < record.size() ? record.get(i) : ReconConstants.BLANK);
                }
                rows.add(row);
            }
            return new ExtractFile(fileName, columns, rows);
        } catch (IOException ex) {
            throw new IllegalStateException(ReconConstants.MSG_EXTRACT_READ_FAILED.formatted(file), ex);
        }
    }

    /**
     * Blank names become {@code Unnamed: <index>}; repeated names get {@code .1}, {@code .2} suffixes.
     */
    private List<String> headerNames(CSVRecord headerRecord) {
        List<String> names = new ArrayList<>(headerRecord.size());
        Set<String> used = new HashSet<>();
        Map<String, Integer> repeats = new HashMap<>();
        for (int i = 0; i < headerRecord.size(); i++) {
            String raw = headerRecord.get(i);
            String name = raw.isEmpty() ? ReconConstants.UNNAMED_COLUMN_PREFIX + i : raw;
            String unique = name;
            while (!used.add(unique)) {
                int next = repeats.merge(name, 1, Integer::sum);
                unique = name + "." + next;
            }
            names.add(unique);
        }
        return names;
    }
}
