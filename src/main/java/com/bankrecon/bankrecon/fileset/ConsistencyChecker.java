package com.bankrecon.bankrecon.fileset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Verifies that all banks expose the same file types, using the first indexed bank as reference.
 */
@Component
public class ConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    /**
     * Stops at the first bank whose shape-key set differs from the reference.
     *
     * @throws IllegalArgumentException when the index holds no bank
     */
    public ConsistencyResult check(FileSetIndex index) {
        if (index.isEmpty()) {
            throw new IllegalArgumentException("Consistency check requires at least one bank");
        }

        Map.Entry<String, List<String>> reference = index.filesByBank().entrySet().iterator().next();
        String referenceBankId = reference.getKey();
        Set<String> referenceShape = shapeOf(reference.getValue());
        log.info("Using bank {} as reference with {} file types.", referenceBankId, referenceShape.size());

        for (Map.Entry<String, List<String>> entry : index.filesByBank().entrySet()) {
            Set<String> shape = shapeOf(entry.getValue());
            if (shape.equals(referenceShape)) {
                continue;
            }
            Set<String> missing = new TreeSet<>(referenceShape);
            missing.removeAll(shape);
            Set<String> unexpected = new TreeSet<>(shape);
            unexpected.removeAll(referenceShape);

            log.error("Inconsistency detected for bank {}. Expected ({}): {} Found ({}): {}",
                    entry.getKey(), referenceBankId, referenceShape, entry.getKey(), shape);
            return ConsistencyResult.inconsistent(referenceBankId, referenceShape.size(),
                    new ShapeMismatch(entry.getKey(), referenceBankId, missing, unexpected));
        }

        log.info("All banks have consistent file sets.");
        return ConsistencyResult.consistent(referenceBankId, referenceShape.size());
    }

    private Set<String> shapeOf(List<String> fileNames) {
        return fileNames.stream()
                .map(FileSetIndexer::shapeKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
