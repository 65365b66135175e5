package it.floro.saber.domain;

/**
 * I sei indicatori indipendenti di equità ed efficienza, con target documentati.
 *
 * Ogni indicatore isola una dimensione distinta: peso del contesto socioeconomico,
 * divario geografico, resilienza delle minoranze, divario di genere a parità di
 * abilità, quota di eccellenza municipale, volatilità tra materie.
 */
public enum KpiKey {

    EALG("Equity-Adjusted Learning Gap",
            "Quota della varianza del punteggio non spiegata dal contesto socioeconomico (più alto è meglio)",
            "1 - R²(punteggio ~ estrato + area)",
            "", 0.85, Comparison.GREATER, 0.0, 0.10),

    RUCDI("Rural-Urban Competency Divergence Index",
            "Differenza standardizzata tra studenti urbani e rurali (più basso è meglio)",
            "(media_urbano - media_rurale) / σ_pooled",
            "σ", 0.30, Comparison.LESS, 0.0, 0.20),

    ERR("Ethnic Resilience Ratio",
            "Punteggio medio delle minoranze etniche rispetto al resto degli studenti (target ≈ 1)",
            "media_minoranza / media_complemento",
            "", 0.95, Comparison.GREATER, 0.0, 0.05),

    GNCTP("Gender-Neutral Critical Thinking Premium",
            "Divario femmine-maschi in lettura critica a parità di matematica (vicino a 0 è meglio)",
            "β_femmina in lettura ~ matematica + femmina",
            "pts", 0.0, Comparison.APPROX, 1.0, 2.0),

    MEF("Municipal Efficiency Frontier",
            "Percentuale di municipi sopra il 90° percentile del punteggio municipale",
            "% municipi con media > P90",
            "%", 15.0, Comparison.GREATER, 0.0, 5.0),

    SVS("School-Level Volatility Stabilizer",
            "Stabilità del rendimento delle scuole tra le materie (più alto è meglio)",
            "1 - mediana(CV dei punteggi medi per materia)",
            "", 0.80, Comparison.GREATER, 0.0, 0.10);

    private final String title;
    private final String description;
    private final String formula;
    private final String unit;
    private final double target;
    private final Comparison comparison;
    private final double tolerance;
    private final double yellowBand;

    KpiKey(String title, String description, String formula, String unit,
           double target, Comparison comparison, double tolerance, double yellowBand) {
        this.title = title;
        this.description = description;
        this.formula = formula;
        this.unit = unit;
        this.target = target;
        this.comparison = comparison;
        this.tolerance = tolerance;
        this.yellowBand = yellowBand;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String formula() {
        return formula;
    }

    public String unit() {
        return unit;
    }

    public double target() {
        return target;
    }

    public Comparison comparison() {
        return comparison;
    }

    public double tolerance() {
        return tolerance;
    }

    /**
     * Classificazione a semaforo: verde se il target è soddisfatto, giallo se lo si
     * manca di non più della banda gialla, rosso altrimenti.
     */
    public KpiStatus classify(double value) {
        double miss = comparison.shortfall(value, target, tolerance);
        if (miss == 0) return KpiStatus.GREEN;
        if (miss <= yellowBand) return KpiStatus.YELLOW;
        return KpiStatus.RED;
    }
}
