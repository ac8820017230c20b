package com.bankrecon.bankrecon.fileset;

import java.util.Set;

/**
 * A bank whose file-set shape differs from the reference bank's.
 *
 * @param missing    shape keys the reference has but the bank lacks
 * @param unexpected shape keys the bank has but the reference lacks
 */
public record ShapeMismatch(String bankId, String referenceBankId, Set<String> missing, Set<String> unexpected) {

    public ShapeMismatch {
        missing = Set.copyOf(missing);
        unexpected = Set.copyOf(unexpected);
    }

    public String describe() {
        return "Bank file inconsistency: " + bankId + " differs from reference " + referenceBankId
                + "; missing " + missing.stream().sorted().toList()
                + ", unexpected " + unexpected.stream().sorted().toList();
    }
}
