package it.floro.saber.service;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.CategoryEncoder;
import it.floro.saber.domain.Diagnostic;
import it.floro.saber.domain.GroupKey;
import it.floro.saber.domain.ModelFit;
import it.floro.saber.domain.ResidualResult;
import it.floro.saber.domain.ResidualRun;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.exception.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.regression.RandomForest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

/**
 * Service che stima il valore aggiunto come residuo di un modello di contesto.
 *
 * Flusso di un fit:
 * 1. Filtro dei record con target, feature e chiave di entità presenti
 * 2. Controllo della soglia minima di campione (sotto soglia: INSUFFICIENT_DATA, nessun residuo)
 * 3. Codifica ordinale delle feature categoriche con un {@link CategoryEncoder} dedicato al fit
 * 4. Split train/test con seme fisso e random forest Smile sul train
 * 5. R², MAE e RMSE sul test
 * 6. Previsione sull'intero insieme filtrato; residuo = osservato - atteso
 * 7. Ai livelli aggregati, media dei residui per entità
 *
 * Ogni chiamata è un ricalcolo completo e indipendente; fit diversi possono girare in
 * parallelo su thread diversi.
 */
@Service
public class RegressionResidualService {

    private static final Logger logger = LoggerFactory.getLogger(RegressionResidualService.class);

    private static final String TARGET_COLUMN = "TARGET";
    private static final int NODE_SIZE = 5;

    /**
     * Stima il modello e calcola i residui al livello richiesto.
     *
     * @param records       record canonici
     * @param targetSubject materia da prevedere
     * @param featureFields campi categorici di contesto
     * @param level         STUDENT per un residuo per prova, altrimenti media per entità
     * @param config        soglia minima, split, seme, parametri della foresta
     * @return run stimato, oppure run INSUFFICIENT_DATA senza residui
     */
    public ResidualRun fitResiduals(List<StudentRecord> records, String targetSubject, List<String> featureFields,
                                    AggregationLevel level, AnalysisConfig config) {
        if (!CanonicalFields.isSubject(targetSubject)) {
            throw new MalformedInputException("Materia target sconosciuta: " + targetSubject);
        }
        for (String f : featureFields) {
            if (!CanonicalFields.isKnown(f) || CanonicalFields.isSubject(f)) {
                throw new MalformedInputException("Feature non categorica o sconosciuta: " + f);
            }
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        String scope = "residuals:" + targetSubject + "@" + level;

        // ===== FEATURE E TARGET ASSENTI OVUNQUE =====
        List<String> features = new ArrayList<>();
        for (String f : featureFields) {
            if (records.stream().anyMatch(r -> r.has(f))) {
                features.add(f);
            } else {
                diagnostics.add(Diagnostic.missingField(scope, "Feature assente in tutti i record: " + f,
                        records.size()));
            }
        }
        if (records.stream().noneMatch(r -> r.hasScore(targetSubject))) {
            diagnostics.add(Diagnostic.missingField(scope, "Materia target assente in tutti i record",
                    records.size()));
            return ResidualRun.insufficient(targetSubject, features, level, 0, records.size(), diagnostics);
        }
        if (features.isEmpty()) {
            diagnostics.add(Diagnostic.missingField(scope, "Nessuna feature disponibile", records.size()));
            return ResidualRun.insufficient(targetSubject, features, level, 0, records.size(), diagnostics);
        }

        // ===== FILTRO =====
        List<String> entityKeys = config.groupKeys(level);
        List<StudentRecord> filtered = records.stream()
                .filter(r -> r.hasScore(targetSubject))
                .filter(r -> features.stream().allMatch(r::has))
                .filter(r -> GroupKey.of(r, entityKeys) != null)
                .toList();
        long excluded = records.size() - filtered.size();
        if (excluded > 0) {
            diagnostics.add(Diagnostic.missingField(scope,
                    "Record senza target, feature o chiave di entità esclusi dal fit", excluded));
        }
        if (filtered.size() < config.regressionMinSample()) {
            logger.warn("Fit {} non eseguito: {} record filtrati, minimo {}",
                    scope, filtered.size(), config.regressionMinSample());
            diagnostics.add(Diagnostic.insufficientSample(scope, String.format(
                    "Dati insufficienti: %d record, minimo %d", filtered.size(), config.regressionMinSample()),
                    filtered.size()));
            return ResidualRun.insufficient(targetSubject, features, level, filtered.size(), excluded, diagnostics);
        }

        // ===== CODIFICA =====
        CategoryEncoder encoder = CategoryEncoder.fit(filtered, features);
        int n = filtered.size();
        int p = features.size();
        double[][] data = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            StudentRecord r = filtered.get(i);
            double[] x = encoder.encode(r);
            double[] row = new double[p + 1];
            System.arraycopy(x, 0, row, 0, p);
            y[i] = r.score(targetSubject).orElseThrow();
            row[p] = y[i];
            data[i] = row;
        }
        String[] names = new String[p + 1];
        for (int j = 0; j < p; j++) {
            names[j] = features.get(j);
        }
        names[p] = TARGET_COLUMN;

        // ===== SPLIT E FIT =====
        Split split = split(n, config.testRatio(), config.seed());
        DataFrame train = DataFrame.of(select(data, split.train()), names);
        int maxNodes = Math.max(2, split.train().length / NODE_SIZE);
        RandomForest model = RandomForest.fit(Formula.lhs(TARGET_COLUMN), train,
                config.trees(), p, config.maxDepth(), maxNodes, NODE_SIZE, 1.0,
                LongStream.range(config.seed(), config.seed() + config.trees()));

        DataFrame all = DataFrame.of(data, names);
        double[] predicted = new double[n];
        for (int i = 0; i < n; i++) {
            predicted[i] = model.predict(all.get(i));
        }

        ModelFit fit = evaluate(y, predicted, split.test(), split.train().length);
        Map<String, Double> importance = importance(model.importance(), features);

        // ===== RESIDUI PER ENTITÀ =====
        Map<String, List<Integer>> byEntity = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            String id = GroupKey.of(filtered.get(i), entityKeys).label();
            byEntity.computeIfAbsent(id, k -> new ArrayList<>()).add(i);
        }
        List<ResidualResult> results = new ArrayList<>(byEntity.size());
        for (Map.Entry<String, List<Integer>> e : byEntity.entrySet()) {
            double actual = 0;
            double expected = 0;
            for (int i : e.getValue()) {
                actual += y[i];
                expected += predicted[i];
            }
            int k = e.getValue().size();
            results.add(ResidualResult.of(e.getKey(), k, actual / k, expected / k, importance));
        }

        logger.info("Fit {}: {} record ({} train, {} test), R²={}, MAE={}, {} entità",
                scope, n, fit.trainSize(), fit.testSize(), fit.r2(), String.format("%.3f", fit.mae()),
                results.size());
        return new ResidualRun(ResidualRun.Status.FITTED, targetSubject, features, level, n, excluded,
                fit, importance, encoder, results, diagnostics);
    }

    /**
     * Run con le feature predefinite della configurazione.
     */
    public ResidualRun fitResiduals(List<StudentRecord> records, String targetSubject,
                                    AggregationLevel level, AnalysisConfig config) {
        return fitResiduals(records, targetSubject, config.residualFeatures(), level, config);
    }

    /**
     * Fit indipendenti per più materie target, eseguiti in parallelo.
     * Ogni fit lavora sulla stessa lista immutabile e non condivide stato con gli altri.
     */
    public Map<String, ResidualRun> fitAll(List<StudentRecord> records, List<String> targetSubjects,
                                           AggregationLevel level, AnalysisConfig config) {
        List<StudentRecord> snapshot = List.copyOf(records);
        List<ResidualRun> runs = targetSubjects.parallelStream()
                .map(t -> fitResiduals(snapshot, t, level, config))
                .toList();
        Map<String, ResidualRun> out = new LinkedHashMap<>();
        for (int i = 0; i < targetSubjects.size(); i++) {
            out.put(targetSubjects.get(i), runs.get(i));
        }
        return out;
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private record Split(int[] train, int[] test) {
    }

    /**
     * Permutazione con seme fisso; le prime ceil(n * ratio) posizioni vanno al test.
     */
    private static Split split(int n, double testRatio, long seed) {
        List<Integer> idx = new ArrayList<>(IntStream.range(0, n).boxed().toList());
        Collections.shuffle(idx, new Random(seed));
        int testSize = (int) Math.ceil(n * testRatio);
        testSize = Math.max(1, Math.min(n - 2, testSize));
        int[] test = idx.subList(0, testSize).stream().mapToInt(Integer::intValue).toArray();
        int[] train = idx.subList(testSize, n).stream().mapToInt(Integer::intValue).toArray();
        return new Split(train, test);
    }

    private static double[][] select(double[][] data, int[] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = data[rows[i]];
        }
        return out;
    }

    private static ModelFit evaluate(double[] y, double[] predicted, int[] test, int trainSize) {
        double mean = 0;
        for (int i : test) mean += y[i];
        mean /= test.length;

        double absErr = 0;
        double sqErr = 0;
        double total = 0;
        for (int i : test) {
            double d = y[i] - predicted[i];
            absErr += Math.abs(d);
            sqErr += d * d;
            total += (y[i] - mean) * (y[i] - mean);
        }
        Double r2 = total > 0 ? 1.0 - sqErr / total : null;
        return new ModelFit(r2, absErr / test.length, Math.sqrt(sqErr / test.length), trainSize, test.length);
    }

    /**
     * Importanza normalizzata a somma 1; se la foresta non ne attribuisce alcuna,
     * quote uguali tra le feature.
     */
    private static Map<String, Double> importance(double[] raw, List<String> features) {
        double sum = 0;
        for (double v : raw) sum += Math.max(0, v);
        Map<String, Double> out = new LinkedHashMap<>();
        for (int j = 0; j < features.size(); j++) {
            double v = j < raw.length ? Math.max(0, raw[j]) : 0;
            out.put(features.get(j), sum > 0 ? v / sum : 1.0 / features.size());
        }
        return out;
    }
}
