package com.bankrecon.bankrecon.pac;

import com.bankrecon.bankrecon.merge.MergedTable;

/**
 * Enriched table plus whether the bank had any PAC data and how many customers matched.
 */
public record EnrichmentResult(MergedTable table, boolean bankFound, int matchedRows) {
}
