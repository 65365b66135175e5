package it.floro.saber.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Punteggio osservato contro punteggio atteso di un'entità per la materia target.
 *
 * Convenzione di segno: residual = actual - predicted. Un residuo positivo indica
 * che l'entità ha fatto meglio di quanto il suo contesto lasciasse prevedere.
 */
public record ResidualResult(
        String entityId,
        long observations,                  // Prove dello studente/entità usate
        double actual,
        double predicted,
        double residual,
        Map<String, Double> featureImportance
) implements Rankable {

    public ResidualResult {
        featureImportance = Collections.unmodifiableMap(new LinkedHashMap<>(featureImportance));
    }

    public static ResidualResult of(String entityId, long observations, double actual, double predicted,
                                    Map<String, Double> featureImportance) {
        return new ResidualResult(entityId, observations, actual, predicted, actual - predicted, featureImportance);
    }

    @Override
    public OptionalDouble measure(String name) {
        return switch (name) {
            case "residual" -> OptionalDouble.of(residual);
            case "actual" -> OptionalDouble.of(actual);
            case "predicted" -> OptionalDouble.of(predicted);
            case "observations" -> OptionalDouble.of(observations);
            default -> OptionalDouble.empty();
        };
    }
}
