package com.bankrecon.bankrecon.pac;

import com.bankrecon.bankrecon.merge.MergedTable;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnricherTest {

    private final Enricher enricher = new Enricher();

    @Test
    void shouldAttachAgreementsAndUsersByOrganizationNumber() {
        MergedTable table = customers("00912345678", "00987654321");
        PacLookupTable lookup = new PacLookupTable(List.of(
                PacRecord.normalized("1234", "912345678", "01017012345", "A-2", "ADMIN", 11),
                PacRecord.normalized("1234", "912345678", "02028054321", "A-1", "USER", 11),
                PacRecord.normalized("1234", "00912345678", "01017012345", "A-2", "USER", 11),
                PacRecord.normalized("5678", "987654321", "03039011111", "B-1", "ADMIN", 11)
        ));

        EnrichmentResult result = enricher.enrich(table, "1234", lookup, "Kundenummer");

        assertTrue(result.bankFound());
        assertEquals(1, result.matchedRows());
        assertEquals("A-1|A-2", table.value(0, "AVTALE_IDs"));
        assertEquals("01017012345:ADMIN|02028054321:USER|01017012345:USER",
                table.value(0, "Users_PERSONNR:BRUKERTYPE"));
        assertEquals("", table.value(1, "AVTALE_IDs"));
        assertEquals("", table.value(1, "Users_PERSONNR:BRUKERTYPE"));
    }

    @Test
    void shouldReturnTableUnchangedWhenBankHasNoLookupData() {
        MergedTable table = customers("777");
        List<String> columnsBefore = List.copyOf(table.columns());
        PacLookupTable lookup = new PacLookupTable(List.of(
                PacRecord.normalized("1234", "777", "01017012345", "A-1", "ADMIN", 11)));

        EnrichmentResult result = enricher.enrich(table, "5678", lookup, "Kundenummer");

        assertFalse(result.bankFound());
        assertSame(table, result.table());
        assertEquals(columnsBefore, result.table().columns());
        assertEquals(1, result.table().rowCount());
        assertEquals("777", result.table().value(0, "Kundenummer"));
    }

    @Test
    void shouldZeroPadOrganizationNumbersToConfiguredWidth() {
        assertEquals("00000000777", PacRecord.normalized("1", " 777 ", "p", "a", "r", 11).orgNumber());
        assertEquals("123456789012", PacRecord.normalized("1", "123456789012", "p", "a", "r", 11).orgNumber());
    }

    private MergedTable customers(String... keys) {
        MergedTable table = new MergedTable();
        List<Map<String, String>> rows = Arrays.stream(keys)
                .map(key -> Map.of("Kundenummer", key))
                .toList();
        table.appendCategory("BEDRIFT", List.of("Kundenummer"), rows);
        return table;
    }
}
