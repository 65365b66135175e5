package it.floro.saber.domain;

/**
 * Statistiche di una materia all'interno di un gruppo.
 *
 * Invarianti: count >= 0; mean e std assenti se count = 0; std >= 0.
 * L'aggregatore non emette mai righe con count = 0.
 */
public record AggregateRow(
        GroupKey key,
        String subject,
        long count,                         // Punteggi validi che contribuiscono
        Double mean,                        // Media aritmetica dei count valori
        Double std                          // Deviazione standard campionaria (0 se count = 1)
) {

    public AggregateRow {
        if (count < 0) {
            throw new IllegalArgumentException("count negativo: " + count);
        }
        if (count == 0 && (mean != null || std != null)) {
            throw new IllegalArgumentException("media/deviazione definite con count = 0");
        }
        if (count > 0 && (mean == null || std == null)) {
            throw new IllegalArgumentException("media/deviazione mancanti con count = " + count);
        }
        if (std != null && std < 0) {
            throw new IllegalArgumentException("deviazione standard negativa: " + std);
        }
    }
}
