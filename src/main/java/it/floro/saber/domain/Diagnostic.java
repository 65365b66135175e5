package it.floro.saber.domain;

/**
 * Segnalazione di una condizione recuperabile: il soggetto interessato viene
 * escluso e il calcolo prosegue per tutto il resto.
 */
public record Diagnostic(
        DiagnosticType type,
        String scope,                       // Operazione o oggetto interessato (es. "normalize:PUNT_INGLES")
        String message,
        long affected                       // Numero di record, gruppi o entità coinvolti
) {

    public static Diagnostic missingField(String scope, String message, long affected) {
        return new Diagnostic(DiagnosticType.MISSING_FIELD, scope, message, affected);
    }

    public static Diagnostic insufficientSample(String scope, String message, long affected) {
        return new Diagnostic(DiagnosticType.INSUFFICIENT_SAMPLE, scope, message, affected);
    }

    public static Diagnostic degenerateVariance(String scope, String message) {
        return new Diagnostic(DiagnosticType.DEGENERATE_VARIANCE, scope, message, 0);
    }
}
