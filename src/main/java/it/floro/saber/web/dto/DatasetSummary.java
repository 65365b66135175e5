package it.floro.saber.web.dto;

import it.floro.saber.domain.CanonicalizationResult;
import it.floro.saber.domain.Diagnostic;

import java.util.List;

/**
 * Esito di una canonicalizzazione senza i record: conteggi e diagnostiche.
 */
public record DatasetSummary(long inputRows, long droppedRows, long records, List<Diagnostic> diagnostics) {

    public static DatasetSummary of(CanonicalizationResult result) {
        return new DatasetSummary(result.inputRows(), result.droppedRows(), result.records().size(),
                result.diagnostics());
    }
}
