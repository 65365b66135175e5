package it.floro.saber.domain;

import java.util.List;

/**
 * Esito della canonicalizzazione di uno o più batch.
 */
public record CanonicalizationResult(
        List<StudentRecord> records,
        long inputRows,
        long droppedRows,                   // Righe scartate per identificativi obbligatori assenti
        List<Diagnostic> diagnostics
) {

    public CanonicalizationResult {
        records = List.copyOf(records);
        diagnostics = List.copyOf(diagnostics);
    }
}
