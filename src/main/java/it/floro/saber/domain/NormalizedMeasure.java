package it.floro.saber.domain;

import java.util.OptionalDouble;

/**
 * Media di gruppo standardizzata rispetto alla popolazione di gruppi dello stesso livello
 * e limitata a [-bound, +bound].
 */
public record NormalizedMeasure(
        GroupKey key,
        String subject,
        long count,
        double mean,
        double std,
        double zScore,                      // (mean - media popolazione) / deviazione popolazione
        double standardized,                // zScore limitato al bound
        boolean clipped                     // true se zScore era fuori dal bound
) implements Rankable {

    @Override
    public String entityId() {
        return key.label();
    }

    @Override
    public OptionalDouble measure(String name) {
        return switch (name) {
            case "standardized" -> OptionalDouble.of(standardized);
            case "zScore" -> OptionalDouble.of(zScore);
            case "mean" -> OptionalDouble.of(mean);
            case "count" -> OptionalDouble.of(count);
            default -> OptionalDouble.empty();
        };
    }
}
