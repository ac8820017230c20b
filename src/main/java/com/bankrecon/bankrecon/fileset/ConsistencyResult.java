package com.bankrecon.bankrecon.fileset;

import java.util.Optional;

/**
 * Outcome of comparing every bank's file-set shape against the reference bank.
 */
public record ConsistencyResult(String referenceBankId, int fileTypeCount, ShapeMismatch mismatch) {

    public static ConsistencyResult consistent(String referenceBankId, int fileTypeCount) {
        return new ConsistencyResult(referenceBankId, fileTypeCount, null);
    }

    public static ConsistencyResult inconsistent(String referenceBankId, int fileTypeCount, ShapeMismatch mismatch) {
        return new ConsistencyResult(referenceBankId, fileTypeCount, mismatch);
    }

    public boolean isConsistent() {
        return mismatch == null;
    }

    public Optional<ShapeMismatch> findMismatch() {
        return Optional.ofNullable(mismatch);
    }
}
