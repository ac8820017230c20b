package com.bankrecon.bankrecon.pac;

import com.bankrecon.bankrecon.ReconConstants;
import com.bankrecon.bankrecon.merge.MergedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Attaches PAC agreement ids and user roles to a reconciled business table, joined on organization number.
 */
@Component
public class Enricher {

    private static final Logger log = LoggerFactory.getLogger(Enricher.class);

    /**
     * Adds {@code AVTALE_IDs} (sorted distinct agreement ids) and {@code Users_PERSONNR:BRUKERTYPE}
     * ("person:role" in PAC row order), both pipe-joined. Customers without PAC rows get empty strings.
     * A bank without any PAC rows gets the table back untouched.
     */
    public EnrichmentResult enrich(MergedTable table, String bankId, PacLookupTable lookup, String keyColumn) {
        List<PacRecord> bankRecords = lookup.recordsFor(bankId);
        if (bankRecords.isEmpty()) {
            log.info(ReconConstants.MSG_NO_PAC_DATA.formatted(bankId));
            return new EnrichmentResult(table, false, 0);
        }
        if (!table.hasColumn(keyColumn)) {
            throw new IllegalStateException(ReconConstants.MSG_KEY_COLUMN_MISSING.formatted(keyColumn));
        }

        Map<String, List<PacRecord>> byOrgNumber = new LinkedHashMap<>();
        for (PacRecord record : bankRecords) {
            byOrgNumber.computeIfAbsent(record.orgNumber(), org -> new ArrayList<>()).add(record);
        }

        Map<String, String> agreementsByOrg = new HashMap<>();
        Map<String, String> usersByOrg = new HashMap<>();
        byOrgNumber.forEach((orgNumber, records) -> {
            TreeSet<String> agreementIds = new TreeSet<>();
            List<String> users = new ArrayList<>(records.size());
            for (PacRecord record : records) {
                agreementIds.add(record.agreementId());
                users.add(record.personNumber() + ReconConstants.PERSON_ROLE_SEPARATOR + record.userType());
            }
            agreementsByOrg.put(orgNumber, String.join(ReconConstants.LOOKUP_JOIN_DELIMITER, agreementIds));
            usersByOrg.put(orgNumber, String.join(ReconConstants.LOOKUP_JOIN_DELIMITER, users));
        });

        table.addColumn(ReconConstants.AGREEMENT_IDS_COLUMN,
                row -> agreementsByOrg.getOrDefault(row.get(keyColumn), ReconConstants.BLANK));
        table.addColumn(ReconConstants.USERS_COLUMN,
                row -> usersByOrg.getOrDefault(row.get(keyColumn), ReconConstants.BLANK));

        int matched = 0;
        for (Map<String, String> row : table.rows()) {
            if (agreementsByOrg.containsKey(row.get(keyColumn))) {
                matched++;
            }
        }
        log.info("Enriched BM data with PAC for bank {}: {} of {} customer(s) matched", bankId, matched, table.rowCount());
        return new EnrichmentResult(table, true, matched);
    }
}
