package it.floro.saber.service;

import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.CanonicalizationResult;
import it.floro.saber.domain.DiagnosticType;
import it.floro.saber.domain.RawBatch;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.exception.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RecordCanonicalizerTest {

    private final RecordCanonicalizer canonicalizer = new RecordCanonicalizer();
    private final AnalysisConfig config = AnalysisConfig.defaults();

    private static List<String> row(String... cells) {
        return Arrays.asList(cells);
    }

    @Test
    void testMixedCaseAndAccentedHeadersResolve() {
        var batch = new RawBatch("b1",
                List.of("estu_consecutivo", "Periodo", "cole_cod_dane_establecimiento", "Punt Matemáticas", "PUNT_INGLES"),
                List.of(row("SB1", "20241", "111", "61", "55")));

        CanonicalizationResult result = canonicalizer.canonicalize(List.of(batch), config);

        assertEquals(1, result.records().size());
        StudentRecord r = result.records().get(0);
        assertEquals("SB1", r.recordId());
        assertEquals("111", r.schoolId());
        assertEquals(61.0, r.score(CanonicalFields.MATH).orElseThrow());
        assertEquals(55.0, r.score(CanonicalFields.ENGLISH).orElseThrow());
    }

    @Test
    void testYearDerivedFromPeriodAndDefaultGrade() {
        var batch = new RawBatch("b1",
                List.of("PERIODO", "COLE_COD_DANE_ESTABLECIMIENTO"),
                List.of(row("20232", "111")));

        StudentRecord r = canonicalizer.canonicalize(List.of(batch), config).records().get(0);

        assertEquals(2023, r.year());
        assertEquals("11", r.field(CanonicalFields.GRADE));
    }

    @Test
    void testSentinelScoreBecomesMissingWithDiagnostic() {
        var batch = new RawBatch("b1",
                List.of("COLE_COD_DANE_ESTABLECIMIENTO", "PUNT_MATEMATICAS", "PUNT_INGLES"),
                List.of(row("111", "-1", "40"), row("111", "abc", "42"), row("111", "70", "")));

        CanonicalizationResult result = canonicalizer.canonicalize(List.of(batch), config);

        assertEquals(3, result.records().size());
        long withMath = result.records().stream().filter(r -> r.hasScore(CanonicalFields.MATH)).count();
        assertEquals(1, withMath);
        assertFalse(result.records().get(2).hasScore(CanonicalFields.ENGLISH));
        assertTrue(result.diagnostics().stream().anyMatch(d ->
                d.scope().endsWith(CanonicalFields.MATH) && d.affected() == 2));
    }

    @Test
    void testRowsWithoutMandatoryIdentifierAreDroppedAndCounted() {
        var batch = new RawBatch("b1",
                List.of("COLE_COD_DANE_ESTABLECIMIENTO", "PUNT_GLOBAL"),
                List.of(row("111", "250"), row("", "300"), row(null, "310")));

        CanonicalizationResult result = canonicalizer.canonicalize(List.of(batch), config);

        assertEquals(3, result.inputRows());
        assertEquals(2, result.droppedRows());
        assertEquals(1, result.records().size());
        assertTrue(result.diagnostics().stream().anyMatch(d ->
                d.type() == DiagnosticType.MISSING_FIELD && d.affected() == 2));
    }

    @Test
    void testAllRowsWithoutIdentifiersIsMalformed() {
        var batch = new RawBatch("b1",
                List.of("PUNT_GLOBAL"),
                List.of(row("250"), row("300")));

        assertThrows(MalformedInputException.class,
                () -> canonicalizer.canonicalize(List.of(batch), config));
    }

    @Test
    void testUnknownColumnsIgnoredAndRecordIdFallsBackToRowIndex() {
        var batch = new RawBatch("file.csv",
                List.of("COLE_COD_DANE_ESTABLECIMIENTO", "ESTU_TIPODOCUMENTO"),
                List.of(row("111", "TI"), row("222", "CC")));

        CanonicalizationResult result = canonicalizer.canonicalize(List.of(batch), config);

        assertEquals("file.csv#1", result.records().get(1).recordId());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.message().contains("ESTU_TIPODOCUMENTO")));
    }

    @Test
    void testExactColumnNameWinsOverAliasWhateverTheOrder() {
        var batch = new RawBatch("b1",
                List.of("COLE_CODIGO_ICFES", "COLE_COD_DANE_ESTABLECIMIENTO", "PUNT_MATEMATICAS"),
                List.of(row("ICFES-1", "EST-9", "50")));

        StudentRecord r = canonicalizer.canonicalize(List.of(batch), config).records().get(0);

        assertEquals("EST-9", r.schoolId());
    }

    @Test
    void testCampusCodeIsNotTakenAsSchoolId() {
        var batch = new RawBatch("b1",
                List.of("COLE_COD_DANE_SEDE", "COLE_COD_DANE_ESTABLECIMIENTO", "PUNT_MATEMATICAS"),
                List.of(row("SEDE-1", "EST-9", "50")));

        CanonicalizationResult result = canonicalizer.canonicalize(List.of(batch), config);

        assertEquals("EST-9", result.records().get(0).schoolId());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.message().contains("COLE_COD_DANE_SEDE")));
    }

    @Test
    void testBatchesAreConcatenated() {
        var b1 = new RawBatch("a", List.of("COLE_COD_DANE_ESTABLECIMIENTO", "YEAR"), List.of(row("1", "2023")));
        var b2 = new RawBatch("b", List.of("cole_cod_dane_establecimiento", "ano"), List.of(row("2", "2024")));

        CanonicalizationResult result = canonicalizer.canonicalize(List.of(b1, b2), config);

        assertEquals(List.of(2023, 2024), result.records().stream().map(StudentRecord::year).toList());
    }

    @Test
    void testRaggedRowRejected() {
        assertThrows(MalformedInputException.class, () -> new RawBatch("x",
                List.of("A", "B"), List.of(row("1"))));
    }

    @Test
    void testParsingHelpers() {
        assertEquals(2024, RecordCanonicalizer.yearFromPeriod("20241"));
        assertEquals(2019, RecordCanonicalizer.yearFromPeriod("20194.0"));
        assertNull(RecordCanonicalizer.yearFromPeriod("19"));
        assertNull(RecordCanonicalizer.yearFromPeriod("abcd"));
        assertEquals(61.5, RecordCanonicalizer.parseScore("61,5", config));
        assertNull(RecordCanonicalizer.parseScore("-1", config));
        assertNull(RecordCanonicalizer.parseScore("NaN", config));
    }
}
