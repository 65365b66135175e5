package it.floro.saber.domain;

/**
 * Valore di un indicatore calcolato su un insieme di record.
 *
 * Se i dati non bastano il risultato è marcato non disponibile: value e status
 * restano null e {@code unavailableReason} spiega perché.
 */
public record KpiResult(
        KpiKey key,
        String name,
        boolean available,
        Double value,
        double target,
        String comparison,                  // ">", "<" o "≈"
        KpiStatus status,
        String unit,
        String description,
        String formula,
        long sampleSize,                    // Osservazioni o entità su cui poggia il valore
        String unavailableReason
) {

    public static KpiResult available(KpiKey key, double value, long sampleSize) {
        return new KpiResult(key, key.title(), true, value, key.target(), key.comparison().symbol(),
                key.classify(value), key.unit(), key.description(), key.formula(), sampleSize, null);
    }

    public static KpiResult unavailable(KpiKey key, String reason) {
        return new KpiResult(key, key.title(), false, null, key.target(), key.comparison().symbol(),
                null, key.unit(), key.description(), key.formula(), 0, reason);
    }
}
