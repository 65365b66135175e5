package it.floro.saber.simulator;

import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.CanonicalizationResult;
import it.floro.saber.domain.RawBatch;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.service.RecordCanonicalizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ExamDataSimulatorTest {

    private static List<RawBatch> generate(long seed) {
        return new ExamDataSimulator(seed, List.of(2023, 2024), 30, 20).generate();
    }

    @Test
    void testSameSeedSameBatches() {
        assertEquals(generate(42), generate(42));
        assertNotEquals(generate(42), generate(43));
    }

    @Test
    void testOneOrTwoBatchesPerYear() {
        List<RawBatch> batches = generate(42);

        Set<String> sources = batches.stream().map(RawBatch::source).collect(Collectors.toSet());
        assertTrue(sources.contains("saber11_20232"));
        assertTrue(sources.contains("saber11_20242"));
        assertTrue(batches.size() >= 2 && batches.size() <= 4);
    }

    @Test
    void testOddYearsUseDecoratedHeader() {
        List<RawBatch> batches = generate(42);

        RawBatch odd = batches.stream().filter(b -> b.source().startsWith("saber11_2023")).findFirst().orElseThrow();
        RawBatch even = batches.stream().filter(b -> b.source().startsWith("saber11_2024")).findFirst().orElseThrow();
        assertTrue(odd.columns().contains("punt_matemáticas"));
        assertTrue(even.columns().contains("PUNT_MATEMATICAS"));
    }

    @Test
    void testCanonicalizedDatasetIsConsistent() {
        CanonicalizationResult result = new RecordCanonicalizer()
                .canonicalize(generate(42), AnalysisConfig.defaults());
        List<StudentRecord> records = result.records();

        assertFalse(records.isEmpty());
        assertEquals(0, result.droppedRows());
        assertEquals(Set.of(2023, 2024), records.stream().map(StudentRecord::year).collect(Collectors.toSet()));
        assertTrue(records.stream()
                .map(r -> r.score(CanonicalFields.GLOBAL).orElseThrow())
                .allMatch(v -> v >= 0 && v <= 500));
        assertTrue(records.stream()
                .flatMap(r -> r.scores().values().stream())
                .noneMatch(v -> v < 0));
    }

    @Test
    void testSentinelScoresReportedAsMissing() {
        CanonicalizationResult result = new RecordCanonicalizer()
                .canonicalize(new ExamDataSimulator(42, List.of(2024), 100, 30).generate(), AnalysisConfig.defaults());

        assertTrue(result.diagnostics().stream().anyMatch(d -> d.message().contains("sentinella")));
        assertTrue(result.records().stream().anyMatch(r -> !r.hasScore(CanonicalFields.MATH)));
    }

    @Test
    void testInvalidSizesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExamDataSimulator(1, List.of(2024), 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ExamDataSimulator(1, List.of(2024), 10, 0));
    }
}
