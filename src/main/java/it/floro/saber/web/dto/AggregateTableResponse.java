package it.floro.saber.web.dto;

import it.floro.saber.domain.AggregateRow;
import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AggregationResult;
import it.floro.saber.domain.Diagnostic;
import it.floro.saber.domain.GroupKey;
import it.floro.saber.domain.NormalizationResult;
import it.floro.saber.domain.NormalizedMeasure;
import it.floro.saber.domain.SubjectPopulation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabella aggregata per (chiave, materia) con i valori standardizzati affiancati.
 *
 * Le materie escluse dalla normalizzazione (varianza degenere) mantengono media e
 * deviazione ma hanno zScore e standardized null; il motivo è tra le diagnostiche.
 */
public record AggregateTableResponse(
        AggregationLevel level,
        List<String> groupFields,
        double bound,
        List<Row> rows,
        List<SubjectPopulation> populations,
        long excludedRecords,
        List<Diagnostic> diagnostics
) {

    public record Row(
            String entity,
            Map<String, String> key,
            String subject,
            long count,
            Double mean,
            Double std,
            Double zScore,
            Double standardized,
            Boolean clipped
    ) {}

    public static AggregateTableResponse of(AggregationLevel level, AggregationResult aggregates,
                                            NormalizationResult normalized) {
        Map<String, NormalizedMeasure> byKey = new HashMap<>();
        for (NormalizedMeasure m : normalized.measures()) {
            byKey.put(m.subject() + "@" + m.key().values(), m);
        }

        List<Row> rows = new ArrayList<>(aggregates.rows().size());
        for (AggregateRow r : aggregates.rows()) {
            NormalizedMeasure m = byKey.get(r.subject() + "@" + r.key().values());
            rows.add(new Row(r.key().label(), keyMap(r.key()), r.subject(), r.count(), r.mean(), r.std(),
                    m == null ? null : m.zScore(),
                    m == null ? null : m.standardized(),
                    m == null ? null : m.clipped()));
        }

        List<Diagnostic> diagnostics = new ArrayList<>(aggregates.diagnostics());
        diagnostics.addAll(normalized.diagnostics());
        return new AggregateTableResponse(level, aggregates.groupFields(), normalized.bound(), rows,
                normalized.populations(), aggregates.excludedRecords(), diagnostics);
    }

    private static Map<String, String> keyMap(GroupKey key) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < key.fields().size(); i++) {
            out.put(key.fields().get(i), key.values().get(i));
        }
        return out;
    }
}
