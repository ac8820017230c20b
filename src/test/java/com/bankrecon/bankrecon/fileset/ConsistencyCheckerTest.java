package com.bankrecon.bankrecon.fileset;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker();

    @Test
    void shouldAcceptBanksWithSameFileShape() {
        Map<String, List<String>> files = new LinkedHashMap<>();
        files.put("1234", List.of("X.B1234.A.CSV", "X.B1234.B.CSV.BM"));
        files.put("5678", List.of("X.B5678.B.CSV.BM", "X.B5678.A.CSV"));

        ConsistencyResult result = checker.check(new FileSetIndex(files));

        assertTrue(result.isConsistent());
        assertEquals("1234", result.referenceBankId());
        assertEquals(2, result.fileTypeCount());
    }

    @Test
    void shouldTriviallyAcceptSingleBank() {
        ConsistencyResult result = checker.check(new FileSetIndex(Map.of("1234", List.of("X.B1234.A.CSV"))));

        assertTrue(result.isConsistent());
    }

    @Test
    void shouldReportFirstMismatchAgainstReferenceBank() {
        Map<String, List<String>> files = new LinkedHashMap<>();
        files.put("1234", List.of("X.B1234.A.CSV", "X.B1234.B.CSV"));
        files.put("5678", List.of("X.B5678.A.CSV", "X.B5678.C.CSV"));
        files.put("9999", List.of("X.B9999.A.CSV"));

        ConsistencyResult result = checker.check(new FileSetIndex(files));

        assertFalse(result.isConsistent());
        ShapeMismatch mismatch = result.findMismatch().orElseThrow();
        assertEquals("5678", mismatch.bankId());
        assertEquals("1234", mismatch.referenceBankId());
        assertEquals(Set.of("X.B####.B.CSV"), mismatch.missing());
        assertEquals(Set.of("X.B####.C.CSV"), mismatch.unexpected());
        assertTrue(mismatch.describe().contains("5678"));
    }

    @Test
    void shouldRejectEmptyIndex() {
        assertThrows(IllegalArgumentException.class, () -> checker.check(new FileSetIndex(Map.of())));
    }
}
