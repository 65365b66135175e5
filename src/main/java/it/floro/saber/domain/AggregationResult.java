package it.floro.saber.domain;

import java.util.List;

/**
 * Tabella aggregata di un livello, con le righe ordinate per chiave e materia.
 */
public record AggregationResult(
        List<String> groupFields,
        List<AggregateRow> rows,
        long excludedRecords,               // Record senza valore per almeno una chiave
        List<Diagnostic> diagnostics
) {

    public AggregationResult {
        groupFields = List.copyOf(groupFields);
        rows = List.copyOf(rows);
        diagnostics = List.copyOf(diagnostics);
    }

    public List<AggregateRow> rowsFor(String subject) {
        return rows.stream().filter(r -> r.subject().equals(subject)).toList();
    }
}
