package it.floro.saber.domain;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Superficie di configurazione della pipeline, fornita dal chiamante.
 *
 * Nessuno stadio legge l'ambiente: chi invoca passa sempre un AnalysisConfig esplicito.
 * {@link #defaults()} restituisce la configurazione di riferimento; le varianti si
 * ottengono con {@link #toBuilder()}.
 */
public record AnalysisConfig(
        Map<AggregationLevel, List<String>> groupKeys,  // Chiavi di raggruppamento per livello
        List<String> subjects,                          // Vocabolario delle materie analizzate
        double clipBound,                               // Limite simmetrico dei punteggi standardizzati
        int regressionMinSample,                        // Record minimi per stimare il modello
        int kpiMinSubgroup,                             // Osservazioni minime per sottogruppo KPI
        int kpiMinEntitySize,                           // Prove minime perché un'entità entri nei KPI
        int kpiMinEntities,                             // Entità minime per KPI distributivi (MEF, SVS)
        double testRatio,                               // Quota di record nel campione di test
        long seed,
        int trees,
        int maxDepth,
        int topN,
        Set<Double> sentinelScores,                     // Codici "prova non sostenuta"
        List<String> mandatoryIdentifiers,              // Record senza questi campi vengono scartati
        int defaultGrade,                               // Grado assegnato se il batch non lo riporta
        List<String> residualFeatures,                  // Feature di contesto predefinite
        KpiSettings kpi
) {

    public static final double DEFAULT_CLIP_BOUND = 3.5;

    public AnalysisConfig {
        EnumMap<AggregationLevel, List<String>> keys = new EnumMap<>(AggregationLevel.class);
        for (AggregationLevel level : AggregationLevel.values()) {
            List<String> k = groupKeys == null ? null : groupKeys.get(level);
            keys.put(level, List.copyOf(k != null ? k : level.defaultKeys()));
        }
        groupKeys = Map.copyOf(keys);
        subjects = List.copyOf(subjects);
        sentinelScores = Set.copyOf(sentinelScores);
        mandatoryIdentifiers = List.copyOf(mandatoryIdentifiers);
        residualFeatures = List.copyOf(residualFeatures);
        if (!(clipBound > 0)) {
            throw new IllegalArgumentException("clipBound deve essere positivo: " + clipBound);
        }
        if (testRatio <= 0 || testRatio >= 1) {
            throw new IllegalArgumentException("testRatio fuori da (0, 1): " + testRatio);
        }
        if (regressionMinSample < 2 || kpiMinSubgroup < 2 || kpiMinEntitySize < 1 || kpiMinEntities < 2) {
            throw new IllegalArgumentException("Soglie minime non valide");
        }
        if (trees < 1 || maxDepth < 2 || topN < 0) {
            throw new IllegalArgumentException("Parametri del modello non validi");
        }
    }

    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> groupKeys(AggregationLevel level) {
        return groupKeys.get(level);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.groupKeys = new EnumMap<>(groupKeys);
        b.subjects = subjects;
        b.clipBound = clipBound;
        b.regressionMinSample = regressionMinSample;
        b.kpiMinSubgroup = kpiMinSubgroup;
        b.kpiMinEntitySize = kpiMinEntitySize;
        b.kpiMinEntities = kpiMinEntities;
        b.testRatio = testRatio;
        b.seed = seed;
        b.trees = trees;
        b.maxDepth = maxDepth;
        b.topN = topN;
        b.sentinelScores = sentinelScores;
        b.mandatoryIdentifiers = mandatoryIdentifiers;
        b.defaultGrade = defaultGrade;
        b.residualFeatures = residualFeatures;
        b.kpi = kpi;
        return b;
    }

    public static final class Builder {

        private Map<AggregationLevel, List<String>> groupKeys = new EnumMap<>(AggregationLevel.class);
        private List<String> subjects = CanonicalFields.SUBJECTS;
        private double clipBound = DEFAULT_CLIP_BOUND;
        private int regressionMinSample = 100;
        private int kpiMinSubgroup = 30;
        private int kpiMinEntitySize = 10;
        private int kpiMinEntities = 10;
        private double testRatio = 0.2;
        private long seed = 42L;
        private int trees = 200;
        private int maxDepth = 10;
        private int topN = 20;
        private Set<Double> sentinelScores = Set.of(-1.0);
        private List<String> mandatoryIdentifiers = List.of(CanonicalFields.SCHOOL_ID);
        private int defaultGrade = 11;
        private List<String> residualFeatures = List.of(
                CanonicalFields.STRATUM,
                CanonicalFields.MOTHER_EDUCATION,
                CanonicalFields.FATHER_EDUCATION,
                CanonicalFields.HAS_INTERNET,
                CanonicalFields.HAS_COMPUTER,
                CanonicalFields.STUDENT_GENDER,
                CanonicalFields.SCHOOL_TYPE,
                CanonicalFields.AREA);
        private KpiSettings kpi = KpiSettings.defaults();

        private Builder() {
        }

        public Builder groupKeys(AggregationLevel level, List<String> keys) {
            this.groupKeys.put(level, new ArrayList<>(keys));
            return this;
        }

        public Builder subjects(List<String> subjects) {
            this.subjects = subjects;
            return this;
        }

        public Builder clipBound(double clipBound) {
            this.clipBound = clipBound;
            return this;
        }

        public Builder regressionMinSample(int n) {
            this.regressionMinSample = n;
            return this;
        }

        public Builder kpiMinSubgroup(int n) {
            this.kpiMinSubgroup = n;
            return this;
        }

        public Builder kpiMinEntitySize(int n) {
            this.kpiMinEntitySize = n;
            return this;
        }

        public Builder kpiMinEntities(int n) {
            this.kpiMinEntities = n;
            return this;
        }

        public Builder testRatio(double testRatio) {
            this.testRatio = testRatio;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder trees(int trees) {
            this.trees = trees;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder topN(int topN) {
            this.topN = topN;
            return this;
        }

        public Builder sentinelScores(Set<Double> sentinelScores) {
            this.sentinelScores = sentinelScores;
            return this;
        }

        public Builder mandatoryIdentifiers(List<String> fields) {
            this.mandatoryIdentifiers = fields;
            return this;
        }

        public Builder defaultGrade(int grade) {
            this.defaultGrade = grade;
            return this;
        }

        public Builder residualFeatures(List<String> features) {
            this.residualFeatures = features;
            return this;
        }

        public Builder kpi(KpiSettings kpi) {
            this.kpi = kpi;
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(groupKeys, subjects, clipBound, regressionMinSample, kpiMinSubgroup,
                    kpiMinEntitySize, kpiMinEntities, testRatio, seed, trees, maxDepth, topN, sentinelScores,
                    mandatoryIdentifiers, defaultGrade, residualFeatures, kpi);
        }
    }
}
