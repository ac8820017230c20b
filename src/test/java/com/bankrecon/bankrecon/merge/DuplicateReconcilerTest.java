package com.bankrecon.bankrecon.merge;

import com.bankrecon.bankrecon.ReconProperties;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DuplicateReconcilerTest {

    private static final List<String> COLUMNS = List.of("Kundenummer", "Navn", "Postnr");

    private final DuplicateReconciler reconciler = new DuplicateReconciler(new ReconProperties());

    @Test
    void shouldCollapseEachCustomerIntoOneRowWithUnionOfFlags() {
        MergedTable table = new MergedTable();
        table.appendCategory("RETAIL", COLUMNS, List.of(row("002", "Kari", ""), row("001", "Ola", "")));
        table.appendCategory("SAVINGS", COLUMNS, List.of(row("001", "", "0150")));
        table.appendCategory("LOAN", COLUMNS, List.of(row("003", "Per", "5003")));

        MergedTable reconciled = reconciler.reconcile(table, "Kundenummer");

        assertEquals(3, reconciled.rowCount());
        assertEquals(table.columns(), reconciled.columns());
        assertEquals("001", reconciled.value(0, "Kundenummer"));
        assertEquals("J", reconciled.value(0, "RETAIL"));
        assertEquals("J", reconciled.value(0, "SAVINGS"));
        assertEquals("N", reconciled.value(0, "LOAN"));
        assertEquals("Ola", reconciled.value(0, "Navn"));
        assertEquals("0150", reconciled.value(0, "Postnr"));
        assertEquals("002", reconciled.value(1, "Kundenummer"));
        assertEquals("N", reconciled.value(1, "SAVINGS"));
        assertEquals("003", reconciled.value(2, "Kundenummer"));
        assertEquals("J", reconciled.value(2, "LOAN"));
    }

    @Test
    void shouldTakeFirstNonEmptyValueWithoutSynthesizingNewOnes() {
        MergedTable table = new MergedTable();
        table.appendCategory("RETAIL", COLUMNS, List.of(row("001", "", "0150"), row("001", "Ola", "0151")));

        MergedTable reconciled = reconciler.reconcile(table, "Kundenummer");

        assertEquals(1, reconciled.rowCount());
        assertEquals("Ola", reconciled.value(0, "Navn"));
        assertEquals("0150", reconciled.value(0, "Postnr"));
    }

    @Test
    void shouldDropRowsWithEmptyKey() {
        MergedTable table = new MergedTable();
        table.appendCategory("RETAIL", COLUMNS, List.of(row("", "Anonym", "0001"), row("001", "Ola", "0150")));

        MergedTable reconciled = reconciler.reconcile(table, "Kundenummer");

        assertEquals(1, reconciled.rowCount());
        assertEquals("001", reconciled.value(0, "Kundenummer"));
    }

    @Test
    void shouldClassifyFlagColumnsFromSampleOnLargeTables() {
        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            rows.add(row(String.format("%04d", i), "Kunde " + i, "0150"));
        }
        MergedTable table = new MergedTable();
        table.appendCategory("RETAIL", COLUMNS, rows);

        List<String> flags = FlagColumns.sampledFlagColumns(table, 100, 42L);

        assertEquals(List.of("RETAIL"), flags);
        assertEquals(250, reconciler.reconcile(table, "Kundenummer").rowCount());
    }

    @Test
    void shouldFailWhenKeyColumnIsMissing() {
        MergedTable table = new MergedTable();
        table.appendCategory("RETAIL", List.of("Navn"), List.of(Map.of("Navn", "Ola")));

        assertThrows(IllegalStateException.class, () -> reconciler.reconcile(table, "Kundenummer"));
    }

    private Map<String, String> row(String key, String name, String postCode) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Kundenummer", key);
        row.put("Navn", name);
        row.put("Postnr", postCode);
        return row;
    }
}
