package com.bankrecon.bankrecon.pac;

import java.util.List;

/**
 * Parsed PAC export in its natural row order.
 */
public record PacLookupTable(List<PacRecord> records) {

    public PacLookupTable {
        records = List.copyOf(records);
    }

    public boolean hasBank(String bankId) {
        return records.stream().anyMatch(record -> record.bankId().equals(bankId));
    }

    public List<PacRecord> recordsFor(String bankId) {
        return records.stream()
                .filter(record -> record.bankId().equals(bankId))
                .toList();
    }
}
