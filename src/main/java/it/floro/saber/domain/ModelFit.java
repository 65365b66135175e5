package it.floro.saber.domain;

/**
 * Bontà di adattamento misurata sul campione di test.
 */
public record ModelFit(
        Double r2,                          // Assente se il target di test non ha varianza
        double mae,
        double rmse,
        int trainSize,
        int testSize
) {
}
