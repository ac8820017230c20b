package com.bankrecon.bankrecon.fileset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Bank identifier to file names, in the order the banks were first encountered.
 */
public record FileSetIndex(Map<String, List<String>> filesByBank) {

    public FileSetIndex {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        filesByBank.forEach((bankId, files) -> copy.put(bankId, List.copyOf(files)));
        filesByBank = Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return filesByBank.isEmpty();
    }

    /**
     * Bank identifiers in processing order (ascending).
     */
    public Set<String> sortedBankIds() {
        return new TreeSet<>(filesByBank.keySet());
    }

    public List<String> filesFor(String bankId) {
        return filesByBank.getOrDefault(bankId, List.of());
    }

    /**
     * Files of one bank ending with {@code extension}, optionally without OBS-marked ones.
     */
    public List<String> filesFor(String bankId, String extension, String excludedMarker) {
        List<String> selected = new ArrayList<>();
        for (String fileName : filesFor(bankId)) {
            if (!fileName.endsWith(extension)) {
                continue;
            }
            if (excludedMarker != null && !excludedMarker.isEmpty()
                    && fileName.toUpperCase().contains(excludedMarker.toUpperCase())) {
                continue;
            }
            selected.add(fileName);
        }
        return selected;
    }
}
