package it.floro.saber.service;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.DiagnosticType;
import it.floro.saber.domain.ResidualResult;
import it.floro.saber.domain.ResidualRun;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.exception.EncodingMismatchException;
import it.floro.saber.exception.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static it.floro.saber.TestRecords.student;
import static org.junit.jupiter.api.Assertions.*;

public class RegressionResidualServiceTest {

    private final RegressionResidualService service = new RegressionResidualService();

    private final AnalysisConfig config = AnalysisConfig.defaults().toBuilder()
            .trees(20)
            .maxDepth(6)
            .build();

    private static final List<String> FEATURES = List.of(CanonicalFields.STRATUM, CanonicalFields.AREA);

    /**
     * Sei scuole da 60 studenti: il punteggio dipende dall'estrato e da un effetto scuola
     * che le feature non vedono. S1 supera le attese, S6 resta sotto.
     */
    private static List<StudentRecord> schools(int strata) {
        Random rnd = new Random(7);
        double[] effect = {8, 3, 0, 0, -3, -8};
        List<StudentRecord> out = new ArrayList<>();
        for (int s = 0; s < effect.length; s++) {
            for (int i = 0; i < 60; i++) {
                int stratum = 1 + (i % strata);
                double score = 40 + 5 * stratum + effect[s] + rnd.nextGaussian();
                out.add(student("S" + (s + 1))
                        .field(CanonicalFields.STRATUM, "Estrato " + stratum)
                        .area(i % 2 == 0 ? "URBANO" : "RURAL")
                        .math(score)
                        .build());
            }
        }
        return out;
    }

    @Test
    void testBelowFloorReturnsInsufficientWithoutResults() {
        List<StudentRecord> records = schools(3).subList(0, 80);

        ResidualRun run = service.fitResiduals(records, CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config);

        assertEquals(ResidualRun.Status.INSUFFICIENT_DATA, run.status());
        assertFalse(run.isAvailable());
        assertTrue(run.results().isEmpty());
        assertNull(run.fit());
        assertTrue(run.diagnostics().stream().anyMatch(d -> d.type() == DiagnosticType.INSUFFICIENT_SAMPLE));
    }

    @Test
    void testResidualSignLawAndEntityAveraging() {
        ResidualRun run = service.fitResiduals(schools(3), CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config);

        assertTrue(run.isAvailable());
        assertEquals(6, run.results().size());
        for (ResidualResult r : run.results()) {
            assertEquals(r.actual() - r.predicted(), r.residual(), 1e-9);
            assertEquals(60, r.observations());
        }

        List<String> byResidual = run.results().stream()
                .sorted(Comparator.comparingDouble(ResidualResult::residual).reversed())
                .map(ResidualResult::entityId).toList();
        List<String> byDifference = run.results().stream()
                .sorted(Comparator.comparingDouble((ResidualResult r) -> r.actual() - r.predicted()).reversed())
                .map(ResidualResult::entityId).toList();
        assertEquals(byResidual, byDifference);

        // L'effetto scuola non è osservabile dalle feature: finisce nel residuo
        assertEquals("S1", byResidual.get(0));
        assertEquals("S6", byResidual.get(5));
        assertTrue(run.results().stream().filter(r -> r.entityId().equals("S1")).findFirst().orElseThrow().residual() > 0);
    }

    @Test
    void testFeatureImportanceIsNonNegativeAndSumsToOne() {
        ResidualRun run = service.fitResiduals(schools(3), CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config);

        Map<String, Double> importance = run.featureImportance();
        assertEquals(FEATURES.size(), importance.size());
        assertTrue(importance.values().stream().allMatch(v -> v >= 0));
        assertEquals(1.0, importance.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    void testFeatureImportanceKeepsFeatureOrder() {
        List<String> features = List.of(CanonicalFields.AREA, CanonicalFields.STRATUM);

        ResidualRun run = service.fitResiduals(schools(3), CanonicalFields.MATH, features,
                AggregationLevel.SCHOOL, config);

        assertEquals(features, List.copyOf(run.featureImportance().keySet()));
        for (ResidualResult r : run.results()) {
            assertEquals(features, List.copyOf(r.featureImportance().keySet()));
        }
    }

    @Test
    void testHoldoutMetricsReported() {
        ResidualRun run = service.fitResiduals(schools(3), CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config);

        assertEquals(360, run.fit().testSize() + run.fit().trainSize());
        assertTrue(run.fit().testSize() >= 72 && run.fit().testSize() <= 73);
        assertTrue(run.fit().mae() >= 0);
        assertTrue(run.fit().rmse() >= run.fit().mae());
        assertNotNull(run.fit().r2());
    }

    @Test
    void testStudentLevelGivesOneResidualPerRecord() {
        List<StudentRecord> records = schools(3);

        ResidualRun run = service.fitResiduals(records, CanonicalFields.MATH, FEATURES,
                AggregationLevel.STUDENT, config);

        assertEquals(records.size(), run.results().size());
        assertTrue(run.results().stream().allMatch(r -> r.observations() == 1));
    }

    @Test
    void testSameSeedSameResiduals() {
        List<StudentRecord> records = schools(3);

        ResidualRun a = service.fitResiduals(records, CanonicalFields.MATH, FEATURES, AggregationLevel.SCHOOL, config);
        ResidualRun b = service.fitResiduals(records, CanonicalFields.MATH, FEATURES, AggregationLevel.SCHOOL, config);

        for (int i = 0; i < a.results().size(); i++) {
            assertEquals(a.results().get(i).entityId(), b.results().get(i).entityId());
            assertEquals(a.results().get(i).residual(), b.results().get(i).residual(), 1e-9);
        }
    }

    @Test
    void testRowsMissingFeaturesAreExcluded() {
        List<StudentRecord> records = new ArrayList<>(schools(3));
        records.add(student("S1").math(99).build());

        ResidualRun run = service.fitResiduals(records, CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config);

        assertEquals(360, run.filteredRecords());
        assertEquals(1, run.excludedRecords());
    }

    @Test
    void testGloballyAbsentFeatureIsDroppedWithDiagnostic() {
        ResidualRun run = service.fitResiduals(schools(3), CanonicalFields.MATH,
                List.of(CanonicalFields.STRATUM, CanonicalFields.HAS_INTERNET), AggregationLevel.SCHOOL, config);

        assertTrue(run.isAvailable());
        assertEquals(List.of(CanonicalFields.STRATUM), run.featureFields());
        assertTrue(run.diagnostics().stream().anyMatch(d -> d.message().contains(CanonicalFields.HAS_INTERNET)));
    }

    @Test
    void testValueAddedShiftRequiresSameEncoding() {
        ResidualRun first = service.fitResiduals(schools(3), CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config);
        ResidualRun same = service.fitResiduals(schools(3), CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config.toBuilder().seed(7).build());
        ResidualRun otherEncoding = service.fitResiduals(schools(4), CanonicalFields.MATH, FEATURES,
                AggregationLevel.SCHOOL, config);

        Map<String, Double> shift = first.valueAddedShift(same);
        assertEquals(6, shift.size());
        assertThrows(EncodingMismatchException.class, () -> first.valueAddedShift(otherEncoding));
    }

    @Test
    void testFitAllRunsEveryTarget() {
        List<StudentRecord> records = new ArrayList<>();
        for (StudentRecord r : schools(3)) {
            Map<String, Double> scores = Map.of(
                    CanonicalFields.MATH, r.score(CanonicalFields.MATH).orElseThrow(),
                    CanonicalFields.ENGLISH, r.score(CanonicalFields.MATH).orElseThrow() - 5);
            records.add(new StudentRecord(r.recordId(), r.fields(), scores));
        }
        AnalysisConfig cfg = config.toBuilder().residualFeatures(FEATURES).build();

        Map<String, ResidualRun> runs = service.fitAll(records,
                List.of(CanonicalFields.MATH, CanonicalFields.ENGLISH), AggregationLevel.SCHOOL, cfg);

        assertEquals(List.of(CanonicalFields.MATH, CanonicalFields.ENGLISH), List.copyOf(runs.keySet()));
        assertTrue(runs.values().stream().allMatch(ResidualRun::isAvailable));
    }

    @Test
    void testUnknownTargetRejected() {
        assertThrows(MalformedInputException.class, () -> service.fitResiduals(schools(3),
                CanonicalFields.AREA, FEATURES, AggregationLevel.SCHOOL, config));
    }
}
