package it.floro.saber.service;

import it.floro.saber.domain.AggregateRow;
import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AggregationResult;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.NormalizationResult;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.exception.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static it.floro.saber.TestRecords.student;
import static org.junit.jupiter.api.Assertions.*;

public class AggregationServiceTest {

    private final AggregationService service = new AggregationService();
    private final AnalysisConfig config = AnalysisConfig.defaults();

    private static final List<String> SCHOOL = List.of(CanonicalFields.SCHOOL_ID);

    @Test
    void testMeanUsesOnlyPresentValues() {
        List<StudentRecord> records = List.of(
                student("S1").math(40).build(),
                student("S1").math(60).build(),
                student("S1").score(CanonicalFields.ENGLISH, 70).build());

        AggregationResult result = service.aggregate(records, SCHOOL, List.of(CanonicalFields.MATH));

        AggregateRow row = result.rows().get(0);
        assertEquals(2, row.count());
        assertEquals(50.0, row.mean(), 1e-12);
        assertEquals(Math.sqrt(200), row.std(), 1e-12);
    }

    @Test
    void testNoRowForGroupWithoutValues() {
        List<StudentRecord> records = List.of(
                student("S1").math(40).build(),
                student("S2").score(CanonicalFields.ENGLISH, 70).build());

        AggregationResult result = service.aggregate(records, SCHOOL,
                List.of(CanonicalFields.MATH, CanonicalFields.ENGLISH));

        assertEquals(2, result.rows().size());
        assertTrue(result.rows().stream().noneMatch(r ->
                r.key().value(CanonicalFields.SCHOOL_ID).equals("S2") && r.subject().equals(CanonicalFields.MATH)));
        assertTrue(result.rows().stream().allMatch(r -> r.count() > 0));
    }

    @Test
    void testRecordsMissingKeyExcludedNotDefaulted() {
        List<StudentRecord> records = List.of(
                student("S1").math(40).build(),
                student().math(90).build());

        AggregationResult result = service.aggregate(records, SCHOOL, List.of(CanonicalFields.MATH));

        assertEquals(1, result.rows().size());
        assertEquals(1, result.excludedRecords());
        assertEquals(40.0, result.rows().get(0).mean(), 1e-12);
        assertFalse(result.diagnostics().isEmpty());
    }

    @Test
    void testSingleValueHasZeroStd() {
        AggregationResult result = service.aggregate(List.of(student("S1").math(40).build()),
                SCHOOL, List.of(CanonicalFields.MATH));

        assertEquals(0.0, result.rows().get(0).std(), 0.0);
    }

    @Test
    void testLevelKeysPlusExtraDimension() {
        List<StudentRecord> records = List.of(
                student("S1").municipality("CALI").year(2023).math(40).build(),
                student("S2").municipality("CALI").year(2023).math(60).build(),
                student("S3").municipality("CALI").year(2024).math(80).build(),
                student("S4").municipality("PASTO").year(2024).math(30).build());

        AggregationResult result = service.aggregate(records, AggregationLevel.MUNICIPALITY,
                List.of(CanonicalFields.YEAR), config);

        List<AggregateRow> math = result.rowsFor(CanonicalFields.MATH);
        assertEquals(List.of(CanonicalFields.DEPARTMENT, CanonicalFields.MUNICIPALITY, CanonicalFields.YEAR),
                result.groupFields());
        assertEquals(3, math.size());
        assertEquals("DEP | CALI | 2023", math.get(0).key().label());
        assertEquals(50.0, math.get(0).mean(), 1e-12);
        assertEquals("DEP | PASTO | 2024", math.get(2).key().label());
    }

    @Test
    void testNationalLevelHasSingleGroup() {
        List<StudentRecord> records = List.of(
                student("S1").math(40).build(),
                student("S2").math(60).build());

        AggregationResult result = service.aggregate(records, AggregationLevel.NATIONAL, List.of(), config);

        List<AggregateRow> math = result.rowsFor(CanonicalFields.MATH);
        assertEquals(1, math.size());
        assertEquals("NACIONAL", math.get(0).key().label());
    }

    @Test
    void testSubjectAbsentEverywhereIsDiagnosed() {
        AggregationResult result = service.aggregate(List.of(student("S1").math(40).build()),
                SCHOOL, List.of(CanonicalFields.ENGLISH));

        assertTrue(result.rows().isEmpty());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.scope().contains(CanonicalFields.ENGLISH)));
    }

    @Test
    void testRepeatedAggregationIsIdentical() {
        List<StudentRecord> records = List.of(
                student("S2").math(41).build(),
                student("S1").math(60).build(),
                student("S2").math(47).build());

        assertEquals(service.aggregate(records, SCHOOL, List.of(CanonicalFields.MATH)),
                service.aggregate(records, SCHOOL, List.of(CanonicalFields.MATH)));
    }

    @Test
    void testAggregateThenNormalizeIsIdempotent() {
        NormalizationService normalizer = new NormalizationService();
        List<StudentRecord> records = List.of(
                student("S1").math(40).score(CanonicalFields.ENGLISH, 52).build(),
                student("S2").math(55).score(CanonicalFields.ENGLISH, 61).build(),
                student("S2").math(59).build(),
                student("S3").math(71).score(CanonicalFields.ENGLISH, 48).build());

        NormalizationResult first = normalizer.normalize(
                service.aggregate(records, AggregationLevel.SCHOOL, List.of(), config).rows());
        NormalizationResult second = normalizer.normalize(
                service.aggregate(records, AggregationLevel.SCHOOL, List.of(), config).rows());

        assertFalse(first.measures().isEmpty());
        assertEquals(first, second);
    }

    @Test
    void testInvalidKeyOrSubjectRejected() {
        assertThrows(MalformedInputException.class,
                () -> service.aggregate(List.of(), List.of("NOPE"), List.of(CanonicalFields.MATH)));
        assertThrows(MalformedInputException.class,
                () -> service.aggregate(List.of(), SCHOOL, List.of(CanonicalFields.AREA)));
    }
}
