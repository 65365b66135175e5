package it.floro.saber.domain;

import java.util.List;

/**
 * I sei indicatori nell'ordine fisso di {@link KpiKey}, più le diagnostiche raccolte.
 */
public record KpiReport(List<KpiResult> results, List<Diagnostic> diagnostics) {

    public KpiReport {
        results = List.copyOf(results);
        diagnostics = List.copyOf(diagnostics);
    }

    public KpiResult get(KpiKey key) {
        return results.stream()
                .filter(r -> r.key() == key)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("KPI assente: " + key));
    }
}
