package it.floro.saber.domain;

import java.util.OptionalDouble;

/**
 * Variazione della media di un'entità tra due anni.
 */
public record EntityChange(
        GroupKey key,                       // Chiave dell'entità senza l'anno
        String subject,
        int yearStart,
        int yearEnd,
        double startMean,
        double endMean,
        double change,                      // endMean - startMean
        Double changePct                    // Assente se startMean = 0
) implements Rankable {

    @Override
    public String entityId() {
        return key.label();
    }

    @Override
    public OptionalDouble measure(String name) {
        return switch (name) {
            case "change" -> OptionalDouble.of(change);
            case "changePct" -> changePct == null ? OptionalDouble.empty() : OptionalDouble.of(changePct);
            case "startMean" -> OptionalDouble.of(startMean);
            case "endMean" -> OptionalDouble.of(endMean);
            default -> OptionalDouble.empty();
        };
    }
}
