package it.floro.saber.service;

import it.floro.saber.domain.AggregateRow;
import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AggregationResult;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.Diagnostic;
import it.floro.saber.domain.GroupKey;
import it.floro.saber.domain.KpiKey;
import it.floro.saber.domain.KpiReport;
import it.floro.saber.domain.KpiResult;
import it.floro.saber.domain.KpiSettings;
import it.floro.saber.domain.StudentRecord;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Service centralizzato per il calcolo dei sei indicatori di equità ed efficienza.
 *
 * KPI supportati (ordine fisso di {@link KpiKey}):
 * - EALG: quota di varianza non spiegata da estrato e area
 * - RUCDI: divario urbano-rurale standardizzato
 * - ERR: rapporto tra media delle minoranze etniche e media del complemento
 * - GNCTP: coefficiente di genere in lettura critica a parità di matematica
 * - MEF: percentuale di municipi sopra il 90° percentile
 * - SVS: 1 - mediana del coefficiente di variazione tra materie per scuola
 *
 * Ogni indicatore è indipendente dagli altri. Se un campo o un sottogruppo manca, o
 * resta sotto la soglia minima, il risultato è "non disponibile" con motivazione e
 * diagnostica: nessun valore di ripiego viene mai prodotto.
 */
@Service
public class EquityKpiService {

    private static final Logger logger = LoggerFactory.getLogger(EquityKpiService.class);

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final AggregationService aggregationService;

    public EquityKpiService(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    /**
     * Calcola i sei indicatori, aggregando internamente per scuola e per municipio.
     *
     * @param records record canonici, già filtrati dal chiamante
     * @param config  soglie minime ed etichette dei sottogruppi
     */
    public KpiReport computeKpis(List<StudentRecord> records, AnalysisConfig config) {
        KpiSettings k = config.kpi();
        AggregationResult schools = aggregationService.aggregate(records,
                config.groupKeys(AggregationLevel.SCHOOL), k.svsSubjects());
        AggregationResult municipalities = aggregationService.aggregate(records,
                config.groupKeys(AggregationLevel.MUNICIPALITY), List.of(k.mefSubject()));
        return computeKpis(records, schools, municipalities, config);
    }

    /**
     * Calcola i sei indicatori riusando aggregati già disponibili.
     *
     * @param schoolAggregates       aggregati per scuola che includono le materie di SVS
     * @param municipalityAggregates aggregati per municipio che includono la materia di MEF
     */
    public KpiReport computeKpis(List<StudentRecord> records, AggregationResult schoolAggregates,
                                 AggregationResult municipalityAggregates, AnalysisConfig config) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<KpiResult> results = List.of(
                ealg(records, config, diagnostics),
                rucdi(records, config, diagnostics),
                err(records, config, diagnostics),
                gnctp(records, config, diagnostics),
                mef(municipalityAggregates, config, diagnostics),
                svs(schoolAggregates, config, diagnostics));

        long available = results.stream().filter(KpiResult::available).count();
        logger.info("KPI calcolati su {} record: {}/{} disponibili", records.size(), available, results.size());
        if (logger.isDebugEnabled()) {
            results.forEach(r -> logger.debug("{} = {} ({})", r.key(),
                    r.available() ? r.value() : "n/d", r.available() ? r.status() : r.unavailableReason()));
        }
        return new KpiReport(results, diagnostics);
    }

    // ========================================================================
    // SEZIONE 1: EALG (peso del contesto socioeconomico)
    // ========================================================================

    /**
     * EALG = 1 - R² della regressione OLS del punteggio su estrato e area codificati a dummy.
     * La prima categoria (in ordine alfabetico) di ciascun campo fa da riferimento.
     */
    public KpiResult ealg(List<StudentRecord> records, AnalysisConfig config, List<Diagnostic> diagnostics) {
        KpiSettings k = config.kpi();
        String scope = scope(KpiKey.EALG);
        List<StudentRecord> rows = records.stream()
                .filter(r -> r.hasScore(k.targetSubject()))
                .filter(r -> r.has(k.stratumField()) && r.has(k.areaField()))
                .toList();
        if (rows.size() < config.kpiMinSubgroup()) {
            return insufficient(KpiKey.EALG, scope, rows.size(), config.kpiMinSubgroup(), diagnostics);
        }

        List<String> strata = categories(rows, k.stratumField());
        List<String> areas = categories(rows, k.areaField());
        int cols = (strata.size() - 1) + (areas.size() - 1);
        if (cols == 0) {
            diagnostics.add(Diagnostic.degenerateVariance(scope, "Estrato e area senza variazione"));
            return KpiResult.unavailable(KpiKey.EALG, "Estrato e area hanno una sola categoria");
        }
        if (rows.size() <= cols + 1) {
            return insufficient(KpiKey.EALG, scope, rows.size(), cols + 2, diagnostics);
        }

        double[] y = new double[rows.size()];
        double[][] x = new double[rows.size()][cols];
        for (int i = 0; i < rows.size(); i++) {
            StudentRecord r = rows.get(i);
            y[i] = r.score(k.targetSubject()).orElseThrow();
            int s = strata.indexOf(r.field(k.stratumField()));
            int a = areas.indexOf(r.field(k.areaField()));
            if (s > 0) x[i][s - 1] = 1.0;
            if (a > 0) x[i][strata.size() - 1 + a - 1] = 1.0;
        }

        Double r2 = rSquared(y, x, scope, diagnostics);
        if (r2 == null) {
            return KpiResult.unavailable(KpiKey.EALG, "Regressione non stimabile (varianza nulla o collinearità)");
        }
        return KpiResult.available(KpiKey.EALG, 1.0 - r2, rows.size());
    }

    // ========================================================================
    // SEZIONE 2: RUCDI (divario urbano-rurale)
    // ========================================================================

    /**
     * RUCDI = (media urbana - media rurale) / σ_pooled, d di Cohen sui punteggi degli studenti.
     *
     * Prima del confronto si escludono le scuole con meno studenti della soglia per entità;
     * la diagnostica elenca le scuole escluse.
     */
    public KpiResult rucdi(List<StudentRecord> records, AnalysisConfig config, List<Diagnostic> diagnostics) {
        KpiSettings k = config.kpi();
        String scope = scope(KpiKey.RUCDI);
        String subject = k.rucdiSubject();

        List<StudentRecord> scored = records.stream()
                .filter(r -> r.hasScore(subject) && r.has(k.areaField()))
                .toList();
        List<StudentRecord> eligible = applyEntityFloor(scored, config, scope, diagnostics);

        Set<String> urban = normalizedLabels(k.urbanLabels());
        Set<String> rural = normalizedLabels(k.ruralLabels());
        SummaryStatistics u = new SummaryStatistics();
        SummaryStatistics ru = new SummaryStatistics();
        for (StudentRecord r : eligible) {
            String area = RecordFilters.normalizeLabel(r.field(k.areaField()));
            double v = r.score(subject).orElseThrow();
            if (urban.contains(area)) {
                u.addValue(v);
            } else if (rural.contains(area)) {
                ru.addValue(v);
            }
        }

        long min = Math.min(u.getN(), ru.getN());
        if (min < config.kpiMinSubgroup()) {
            return insufficient(KpiKey.RUCDI, scope, min, config.kpiMinSubgroup(), diagnostics);
        }
        double pooled = pooledStd(u, ru);
        if (!(pooled > 0)) {
            diagnostics.add(Diagnostic.degenerateVariance(scope, "Deviazione standard combinata nulla"));
            return KpiResult.unavailable(KpiKey.RUCDI, "Deviazione standard combinata nulla");
        }
        double d = (u.getMean() - ru.getMean()) / pooled;
        return KpiResult.available(KpiKey.RUCDI, d, u.getN() + ru.getN());
    }

    // ========================================================================
    // SEZIONE 3: ERR (resilienza delle minoranze etniche)
    // ========================================================================

    /**
     * ERR = media del sottogruppo di minoranza / media del complemento.
     * Minoranza: etnia valorizzata e non compresa tra le etichette di maggioranza.
     */
    public KpiResult err(List<StudentRecord> records, AnalysisConfig config, List<Diagnostic> diagnostics) {
        KpiSettings k = config.kpi();
        String scope = scope(KpiKey.ERR);
        Set<String> majority = normalizedLabels(k.majorityLabels());

        SummaryStatistics minority = new SummaryStatistics();
        SummaryStatistics complement = new SummaryStatistics();
        for (StudentRecord r : records) {
            if (!r.hasScore(k.errSubject()) || !r.has(k.ethnicityField())) continue;
            double v = r.score(k.errSubject()).orElseThrow();
            if (majority.contains(RecordFilters.normalizeLabel(r.field(k.ethnicityField())))) {
                complement.addValue(v);
            } else {
                minority.addValue(v);
            }
        }

        long min = Math.min(minority.getN(), complement.getN());
        if (min < config.kpiMinSubgroup()) {
            return insufficient(KpiKey.ERR, scope, min, config.kpiMinSubgroup(), diagnostics);
        }
        if (complement.getMean() == 0) {
            diagnostics.add(Diagnostic.degenerateVariance(scope, "Media del complemento nulla"));
            return KpiResult.unavailable(KpiKey.ERR, "Media del complemento nulla");
        }
        return KpiResult.available(KpiKey.ERR, minority.getMean() / complement.getMean(),
                minority.getN() + complement.getN());
    }

    // ========================================================================
    // SEZIONE 4: GNCTP (divario di genere a parità di matematica)
    // ========================================================================

    /**
     * GNCTP = coefficiente dell'indicatore femmina nella regressione OLS
     * esito ~ controllo + femmina. Positivo: le studentesse superano i pari abilità maschi.
     */
    public KpiResult gnctp(List<StudentRecord> records, AnalysisConfig config, List<Diagnostic> diagnostics) {
        KpiSettings k = config.kpi();
        String scope = scope(KpiKey.GNCTP);
        String female = RecordFilters.normalizeLabel(k.femaleLabel());
        String male = RecordFilters.normalizeLabel(k.maleLabel());

        List<double[]> rows = new ArrayList<>();
        long females = 0;
        long males = 0;
        for (StudentRecord r : records) {
            if (!r.hasScore(k.gnctpOutcome()) || !r.hasScore(k.gnctpControl())) continue;
            String g = RecordFilters.normalizeLabel(r.field(k.genderField()));
            double flag;
            if (female.equals(g)) {
                flag = 1.0;
                females++;
            } else if (male.equals(g)) {
                flag = 0.0;
                males++;
            } else {
                continue;
            }
            rows.add(new double[]{r.score(k.gnctpOutcome()).orElseThrow(), r.score(k.gnctpControl()).orElseThrow(), flag});
        }

        long min = Math.min(females, males);
        if (min < config.kpiMinSubgroup()) {
            return insufficient(KpiKey.GNCTP, scope, min, config.kpiMinSubgroup(), diagnostics);
        }

        double[] y = new double[rows.size()];
        double[][] x = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            y[i] = rows.get(i)[0];
            x[i] = new double[]{rows.get(i)[1], rows.get(i)[2]};
        }
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            ols.newSampleData(y, x);
            double[] beta = ols.estimateRegressionParameters();
            return KpiResult.available(KpiKey.GNCTP, beta[2], rows.size());
        } catch (MathIllegalArgumentException e) {
            logger.warn("{}: regressione non stimabile: {}", scope, e.getMessage());
            diagnostics.add(Diagnostic.degenerateVariance(scope, "Regressione singolare: " + e.getMessage()));
            return KpiResult.unavailable(KpiKey.GNCTP, "Regressione non stimabile (collinearità)");
        }
    }

    // ========================================================================
    // SEZIONE 5: MEF (frontiera di efficienza municipale)
    // ========================================================================

    /**
     * MEF = percentuale di municipi con media strettamente superiore al 90° percentile
     * (stimatore R-7) delle medie municipali. Municipi sotto la soglia per entità esclusi.
     */
    public KpiResult mef(AggregationResult municipalityAggregates, AnalysisConfig config,
                         List<Diagnostic> diagnostics) {
        String scope = scope(KpiKey.MEF);
        List<AggregateRow> rows = municipalityAggregates.rowsFor(config.kpi().mefSubject());
        List<AggregateRow> eligible = rows.stream()
                .filter(r -> r.count() >= config.kpiMinEntitySize())
                .toList();
        if (eligible.size() < rows.size()) {
            diagnostics.add(Diagnostic.insufficientSample(scope, String.format(
                    "%d municipi con meno di %d studenti esclusi", rows.size() - eligible.size(),
                    config.kpiMinEntitySize()), rows.size() - eligible.size()));
        }
        if (eligible.size() < config.kpiMinEntities()) {
            return insufficient(KpiKey.MEF, scope, eligible.size(), config.kpiMinEntities(), diagnostics);
        }

        double[] means = eligible.stream().mapToDouble(AggregateRow::mean).toArray();
        double p90 = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(means, 90.0);
        long above = Arrays.stream(means).filter(m -> m > p90).count();
        return KpiResult.available(KpiKey.MEF, 100.0 * above / means.length, means.length);
    }

    // ========================================================================
    // SEZIONE 6: SVS (stabilità tra materie)
    // ========================================================================

    /**
     * SVS = 1 - mediana del coefficiente di variazione (deviazione campionaria / media)
     * delle medie per materia di ciascuna scuola. Servono almeno due materie per scuola.
     */
    public KpiResult svs(AggregationResult schoolAggregates, AnalysisConfig config, List<Diagnostic> diagnostics) {
        String scope = scope(KpiKey.SVS);
        Set<String> subjects = Set.copyOf(config.kpi().svsSubjects());

        Map<GroupKey, DescriptiveStatistics> bySchool = new TreeMap<>();
        for (AggregateRow r : schoolAggregates.rows()) {
            if (!subjects.contains(r.subject())) continue;
            bySchool.computeIfAbsent(r.key(), key -> new DescriptiveStatistics()).addValue(r.mean());
        }

        DescriptiveStatistics cvs = new DescriptiveStatistics();
        long skipped = 0;
        for (DescriptiveStatistics s : bySchool.values()) {
            if (s.getN() < 2 || !(s.getMean() > 0)) {
                skipped++;
                continue;
            }
            cvs.addValue(s.getStandardDeviation() / s.getMean());
        }
        if (skipped > 0) {
            diagnostics.add(Diagnostic.missingField(scope,
                    "Scuole con meno di due materie o media non positiva escluse", skipped));
        }
        if (cvs.getN() < config.kpiMinEntities()) {
            return insufficient(KpiKey.SVS, scope, cvs.getN(), config.kpiMinEntities(), diagnostics);
        }
        return KpiResult.available(KpiKey.SVS, 1.0 - cvs.getPercentile(50), cvs.getN());
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private static String scope(KpiKey key) {
        return "kpi:" + key.name();
    }

    private static KpiResult insufficient(KpiKey key, String scope, long observed, long required,
                                          List<Diagnostic> diagnostics) {
        String reason = String.format("Campione insufficiente: %d osservazioni, minimo %d", observed, required);
        logger.warn("{} non disponibile: {}", key, reason);
        diagnostics.add(Diagnostic.insufficientSample(scope, reason, observed));
        return KpiResult.unavailable(key, reason);
    }

    /**
     * Esclude gli studenti delle scuole sotto la soglia per entità.
     * Record senza scuola non sono attribuibili e vengono esclusi anch'essi.
     */
    private List<StudentRecord> applyEntityFloor(List<StudentRecord> records, AnalysisConfig config,
                                                 String scope, List<Diagnostic> diagnostics) {
        AggregationService.GroupedRecords grouped = aggregationService.group(records,
                config.groupKeys(AggregationLevel.SCHOOL));
        if (grouped.excluded() > 0) {
            diagnostics.add(Diagnostic.missingField(scope, "Record senza scuola esclusi", grouped.excluded()));
        }

        List<StudentRecord> kept = new ArrayList<>();
        TreeSet<String> small = new TreeSet<>();
        long dropped = 0;
        for (Map.Entry<GroupKey, List<StudentRecord>> e : grouped.groups().entrySet()) {
            if (e.getValue().size() < config.kpiMinEntitySize()) {
                small.add(e.getKey().label());
                dropped += e.getValue().size();
            } else {
                kept.addAll(e.getValue());
            }
        }
        if (!small.isEmpty()) {
            logger.debug("{}: scuole sotto soglia {}", scope, small);
            diagnostics.add(Diagnostic.insufficientSample(scope, String.format(
                    "Scuole con meno di %d studenti escluse: %s", config.kpiMinEntitySize(), small), dropped));
        }
        return kept;
    }

    /**
     * R² della regressione OLS con intercetta, oppure null se non stimabile.
     */
    private static Double rSquared(double[] y, double[][] x, String scope, List<Diagnostic> diagnostics) {
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            ols.newSampleData(y, x);
            double r2 = ols.calculateRSquared();
            if (!Double.isFinite(r2)) {
                diagnostics.add(Diagnostic.degenerateVariance(scope, "Varianza del punteggio nulla"));
                return null;
            }
            return r2;
        } catch (MathIllegalArgumentException e) {
            logger.warn("{}: regressione non stimabile: {}", scope, e.getMessage());
            diagnostics.add(Diagnostic.degenerateVariance(scope, "Regressione singolare: " + e.getMessage()));
            return null;
        }
    }

    private static double pooledStd(SummaryStatistics a, SummaryStatistics b) {
        double num = (a.getN() - 1) * a.getVariance() + (b.getN() - 1) * b.getVariance();
        return Math.sqrt(num / (a.getN() + b.getN() - 2));
    }

    private static List<String> categories(List<StudentRecord> rows, String field) {
        return rows.stream()
                .map(r -> r.field(field))
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    private static Set<String> normalizedLabels(Set<String> labels) {
        return labels.stream().map(RecordFilters::normalizeLabel).collect(Collectors.toSet());
    }
}
