package it.floro.saber.web.api;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AggregationResult;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.EntityChange;
import it.floro.saber.domain.KpiReport;
import it.floro.saber.domain.NormalizationResult;
import it.floro.saber.domain.RawBatch;
import it.floro.saber.domain.ResidualResult;
import it.floro.saber.domain.ResidualRun;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.exception.MalformedInputException;
import it.floro.saber.service.AggregationService;
import it.floro.saber.service.EquityKpiService;
import it.floro.saber.service.ImprovementService;
import it.floro.saber.service.NormalizationService;
import it.floro.saber.service.RankingService;
import it.floro.saber.service.RecordFilters;
import it.floro.saber.service.RegressionResidualService;
import it.floro.saber.service.ScoreDataService;
import it.floro.saber.web.dto.AggregateTableResponse;
import it.floro.saber.web.dto.DatasetSummary;
import it.floro.saber.web.dto.FilterOptions;
import it.floro.saber.web.dto.ImprovementResponse;
import it.floro.saber.web.dto.ResidualResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Controller REST che espone i risultati del motore di analisi SABER.
 *
 * Responsabilità:
 * - Applicare i filtri geografici/temporali al dataset corrente
 * - Delegare i calcoli ai service (aggregazione, normalizzazione, residui, KPI, graduatorie)
 * - Restituire strutture dati semplici; la presentazione resta al client
 *
 * Mapping base: /api/analytics
 *
 * Parametri di filtro comuni a tutti gli endpoint di calcolo:
 * department, municipality, year, area, schoolType (tutti opzionali).
 * Materie e campi accettano anche nomi grezzi (es. "punt_matematicas").
 */
@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    // ========================================================================
    // DIPENDENZE INIETTATE
    // ========================================================================

    private final ScoreDataService dataService;
    private final RecordFilters filters;
    private final AggregationService aggregationService;
    private final NormalizationService normalizationService;
    private final RegressionResidualService residualService;
    private final EquityKpiService kpiService;
    private final ImprovementService improvementService;
    private final RankingService rankingService;
    private final AnalysisConfig config;

    public AnalyticsController(ScoreDataService dataService,
                               RecordFilters filters,
                               AggregationService aggregationService,
                               NormalizationService normalizationService,
                               RegressionResidualService residualService,
                               EquityKpiService kpiService,
                               ImprovementService improvementService,
                               RankingService rankingService,
                               AnalysisConfig config) {
        this.dataService = dataService;
        this.filters = filters;
        this.aggregationService = aggregationService;
        this.normalizationService = normalizationService;
        this.residualService = residualService;
        this.kpiService = kpiService;
        this.improvementService = improvementService;
        this.rankingService = rankingService;
        this.config = config;
    }

    // ========================================================================
    // ENDPOINT 1: GET - TABELLA AGGREGATA E STANDARDIZZATA
    // ========================================================================

    /**
     * Medie per entità al livello richiesto, con z-score limitati.
     *
     * Esempio: GET /api/analytics/aggregates?level=school&subject=PUNT_MATEMATICAS&dimension=YEAR
     *
     * La normalizzazione usa sempre l'intera popolazione del livello (dopo i filtri).
     */
    @GetMapping("/aggregates")
    public AggregateTableResponse aggregates(
            @RequestParam(defaultValue = "school") String level,
            @RequestParam(required = false) List<String> subject,
            @RequestParam(required = false) List<String> dimension,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) String municipality,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) String area,
            @RequestParam(required = false) String schoolType) {

        AggregationLevel lvl = AggregationLevel.parse(level);
        List<StudentRecord> records = filtered(department, municipality, year, area, schoolType);
        List<String> subjects = subject == null || subject.isEmpty() ? config.subjects() : canonicalSubjects(subject);
        List<String> keys = new ArrayList<>(config.groupKeys(lvl));
        if (dimension != null) {
            for (String d : dimension) {
                String f = canonicalField(d);
                if (!keys.contains(f)) keys.add(f);
            }
        }

        AggregationResult agg = aggregationService.aggregate(records, keys, subjects);
        NormalizationResult norm = normalizationService.normalize(agg.rows(), config.clipBound());
        return AggregateTableResponse.of(lvl, agg, norm);
    }

    // ========================================================================
    // ENDPOINT 2: GET - VALORE AGGIUNTO (RESIDUI)
    // ========================================================================

    /**
     * Stima il modello di contesto e restituisce le graduatorie per residuo.
     *
     * Esempio: GET /api/analytics/residuals?target=PUNT_GLOBAL&level=school&top=10
     *
     * Chiamata bloccante: il fit della foresta richiede alcuni secondi sul dataset completo.
     */
    @GetMapping("/residuals")
    public ResidualResponse residuals(
            @RequestParam(defaultValue = CanonicalFields.GLOBAL) String target,
            @RequestParam(defaultValue = "school") String level,
            @RequestParam(required = false) List<String> feature,
            @RequestParam(required = false) Integer top,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) String municipality,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) String area,
            @RequestParam(required = false) String schoolType) {

        AggregationLevel lvl = AggregationLevel.parse(level);
        String targetSubject = canonicalSubjects(List.of(target)).get(0);
        List<String> features = feature == null || feature.isEmpty()
                ? config.residualFeatures()
                : feature.stream().map(AnalyticsController::canonicalField).toList();
        int n = top != null ? top : config.topN();

        List<StudentRecord> records = filtered(department, municipality, year, area, schoolType);
        ResidualRun run = residualService.fitResiduals(records, targetSubject, features, lvl, config);
        List<ResidualResult> best = rankingService.topN(run.results(), "residual", n);
        List<ResidualResult> worst = rankingService.bottomN(run.results(), "residual", n);
        return ResidualResponse.of(run, best, worst);
    }

    // ========================================================================
    // ENDPOINT 3: GET - INDICATORI DI EQUITÀ
    // ========================================================================

    /**
     * I sei KPI sul sottoinsieme filtrato, nell'ordine fisso EALG, RUCDI, ERR, GNCTP, MEF, SVS.
     *
     * Esempio: GET /api/analytics/kpis?department=ANTIOQUIA&year=2024
     */
    @GetMapping("/kpis")
    public KpiReport kpis(
            @RequestParam(required = false) String department,
            @RequestParam(required = false) String municipality,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) String area,
            @RequestParam(required = false) String schoolType) {
        return kpiService.computeKpis(filtered(department, municipality, year, area, schoolType), config);
    }

    // ========================================================================
    // ENDPOINT 4: GET - MIGLIORAMENTO ANNO SU ANNO
    // ========================================================================

    /**
     * Entità più migliorate e più peggiorate tra due anni.
     *
     * Esempio: GET /api/analytics/improvement?level=municipality&subject=PUNT_GLOBAL&from=2023&to=2024
     */
    @GetMapping("/improvement")
    public ImprovementResponse improvement(
            @RequestParam(defaultValue = "school") String level,
            @RequestParam(defaultValue = CanonicalFields.GLOBAL) String subject,
            @RequestParam int from,
            @RequestParam int to,
            @RequestParam(required = false) Integer top,
            @RequestParam(required = false) String department,
            @RequestParam(required = false) String municipality,
            @RequestParam(required = false) String area,
            @RequestParam(required = false) String schoolType) {

        AggregationLevel lvl = AggregationLevel.parse(level);
        String s = canonicalSubjects(List.of(subject)).get(0);
        int n = top != null ? top : config.topN();

        // Il filtro per anno non si applica: servono entrambi gli anni
        List<StudentRecord> records = filtered(department, municipality, null, area, schoolType);
        List<EntityChange> changes = improvementService.compareYears(records, lvl, s, from, to, config);
        return new ImprovementResponse(lvl, s, from, to, changes.size(),
                improvementService.mostImproved(changes, n),
                improvementService.mostDeclined(changes, n),
                changes);
    }

    // ========================================================================
    // ENDPOINT 5: GET - OPZIONI DEI FILTRI
    // ========================================================================

    @GetMapping("/filters")
    public FilterOptions filterOptions(@RequestParam(required = false) String department) {
        List<StudentRecord> all = dataService.getAll();
        return new FilterOptions(
                filters.departmentsFrom(all),
                filters.municipalitiesFrom(all, department),
                filters.yearsFrom(all),
                config.subjects(),
                Arrays.stream(AggregationLevel.values()).map(Enum::name).toList());
    }

    // ========================================================================
    // ENDPOINT 6: DATASET
    // ========================================================================

    /**
     * Esito della canonicalizzazione del dataset corrente.
     */
    @GetMapping("/dataset")
    public DatasetSummary dataset() {
        return DatasetSummary.of(dataService.lastCanonicalization());
    }

    /**
     * Sostituisce il dataset con batch tabellari già letti dal chiamante.
     */
    @PostMapping("/dataset")
    public DatasetSummary replaceDataset(@RequestBody List<RawBatch> batches) {
        return DatasetSummary.of(dataService.replace(batches));
    }

    /**
     * Rigenera il dataset simulato.
     */
    @PostMapping("/dataset/regenerate")
    public DatasetSummary regenerate() {
        return DatasetSummary.of(dataService.regenerate());
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private List<StudentRecord> filtered(String department, String municipality, Integer year,
                                         String area, String schoolType) {
        RecordFilters.FilterParams p = filters.fromRequest(department, municipality, year, area, schoolType);
        return filters.apply(dataService.getAll(), p);
    }

    private static List<String> canonicalSubjects(List<String> raw) {
        List<String> out = new ArrayList<>(raw.size());
        for (String r : raw) {
            String s = canonicalField(r);
            if (!CanonicalFields.isSubject(s)) {
                throw new MalformedInputException("Non è una materia: " + r);
            }
            out.add(s);
        }
        return out;
    }

    private static String canonicalField(String raw) {
        return CanonicalFields.resolve(raw)
                .orElseThrow(() -> new MalformedInputException("Campo sconosciuto: " + raw));
    }
}
