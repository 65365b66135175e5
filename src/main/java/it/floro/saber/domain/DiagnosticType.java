package it.floro.saber.domain;

/**
 * Condizioni recuperabili segnalate dalla pipeline.
 */
public enum DiagnosticType {
    MISSING_FIELD,          // Record o colonna privi di un campo richiesto
    INSUFFICIENT_SAMPLE,    // Gruppo, fit o sottogruppo sotto la soglia minima
    DEGENERATE_VARIANCE     // Deviazione standard nulla: standardizzazione impossibile
}
