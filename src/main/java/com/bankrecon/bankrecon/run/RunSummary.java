package com.bankrecon.bankrecon.run;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-bank summaries of one run, in the order the banks were processed. Owned by a single run.
 */
public class RunSummary {

    private final Map<String, BankSummary> banks = new LinkedHashMap<>();

    public BankSummary bank(String bankId) {
        return banks.computeIfAbsent(bankId, BankSummary::new);
    }

    public Optional<BankSummary> find(String bankId) {
        return Optional.ofNullable(banks.get(bankId));
    }

    public Collection<BankSummary> banks() {
        return Collections.unmodifiableCollection(banks.values());
    }

    public int bankCount() {
        return banks.size();
    }
}
