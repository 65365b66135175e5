package it.floro.saber.domain;

/**
 * Operatore di confronto tra valore di un KPI e il suo target.
 */
public enum Comparison {

    GREATER(">"),
    LESS("<"),
    APPROX("≈");

    private final String symbol;

    Comparison(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Distanza dal raggiungimento del target: 0 se il target è soddisfatto.
     *
     * @param tolerance ampiezza ammessa attorno al target (solo per APPROX)
     */
    public double shortfall(double value, double target, double tolerance) {
        return switch (this) {
            case GREATER -> value > target ? 0 : target - value;
            case LESS -> value < target ? 0 : value - target;
            case APPROX -> Math.max(0, Math.abs(value - target) - tolerance);
        };
    }
}
