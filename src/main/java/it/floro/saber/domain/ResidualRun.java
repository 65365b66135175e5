package it.floro.saber.domain;

import it.floro.saber.exception.EncodingMismatchException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Esito completo di un fit del modello di valore aggiunto.
 *
 * Un run è autosufficiente: modello, encoder e residui appartengono allo stesso fit.
 * Con status INSUFFICIENT_DATA non contiene alcun residuo.
 */
public record ResidualRun(
        Status status,
        String targetSubject,
        List<String> featureFields,
        AggregationLevel level,
        long filteredRecords,               // Record con target e feature presenti
        long excludedRecords,
        ModelFit fit,                       // null se INSUFFICIENT_DATA
        Map<String, Double> featureImportance,
        CategoryEncoder encoder,            // null se INSUFFICIENT_DATA
        List<ResidualResult> results,
        List<Diagnostic> diagnostics
) {

    public enum Status {
        FITTED,
        INSUFFICIENT_DATA
    }

    public ResidualRun {
        featureFields = List.copyOf(featureFields);
        featureImportance = Collections.unmodifiableMap(new LinkedHashMap<>(featureImportance));
        results = List.copyOf(results);
        diagnostics = List.copyOf(diagnostics);
    }

    public static ResidualRun insufficient(String targetSubject, List<String> featureFields, AggregationLevel level,
                                           long filteredRecords, long excludedRecords, List<Diagnostic> diagnostics) {
        return new ResidualRun(Status.INSUFFICIENT_DATA, targetSubject, featureFields, level,
                filteredRecords, excludedRecords, null, Map.of(), null, List.of(), diagnostics);
    }

    public boolean isAvailable() {
        return status == Status.FITTED;
    }

    /**
     * Variazione del valore aggiunto (residuo di {@code later} meno residuo di questo run)
     * per le entità presenti in entrambi.
     *
     * @throws EncodingMismatchException se i due fit non condividono target, livello e codifica
     */
    public Map<String, Double> valueAddedShift(ResidualRun later) {
        if (!isAvailable() || !later.isAvailable()) {
            throw new IllegalStateException("Confronto possibile solo tra run con modello stimato");
        }
        if (!targetSubject.equals(later.targetSubject) || level != later.level) {
            throw new EncodingMismatchException("Run con target o livello diversi: "
                    + targetSubject + "/" + level + " vs " + later.targetSubject + "/" + later.level);
        }
        if (!encoder.equals(later.encoder)) {
            throw new EncodingMismatchException("Run con codifica categorica diversa: "
                    + encoder + " vs " + later.encoder);
        }
        Map<String, Double> before = new LinkedHashMap<>();
        for (ResidualResult r : results) {
            before.put(r.entityId(), r.residual());
        }
        Map<String, Double> shift = new LinkedHashMap<>();
        for (ResidualResult r : later.results) {
            Double b = before.get(r.entityId());
            if (b != null) {
                shift.put(r.entityId(), r.residual() - b);
            }
        }
        return shift;
    }
}
