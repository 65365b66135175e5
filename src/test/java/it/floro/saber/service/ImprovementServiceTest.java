package it.floro.saber.service;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.EntityChange;
import it.floro.saber.domain.StudentRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static it.floro.saber.TestRecords.student;
import static org.junit.jupiter.api.Assertions.*;

public class ImprovementServiceTest {

    private final ImprovementService service =
            new ImprovementService(new AggregationService(), new RankingService());
    private final AnalysisConfig config = AnalysisConfig.defaults();

    private static List<StudentRecord> twoYears() {
        List<StudentRecord> out = new ArrayList<>();
        // S1 +10, S2 -5, S3 invariata, S4 solo nel 2023, S5 parte da 0
        addSchool(out, "S1", 2023, 50);
        addSchool(out, "S1", 2024, 60);
        addSchool(out, "S2", 2023, 55);
        addSchool(out, "S2", 2024, 50);
        addSchool(out, "S3", 2023, 40);
        addSchool(out, "S3", 2024, 40);
        addSchool(out, "S4", 2023, 70);
        addSchool(out, "S5", 2023, 0);
        addSchool(out, "S5", 2024, 3);
        return out;
    }

    private static void addSchool(List<StudentRecord> out, String school, int year, double mean) {
        out.add(student(school).year(year).math(mean - 1).build());
        out.add(student(school).year(year).math(mean + 1).build());
    }

    @Test
    void testCompareYearsPairsEntitiesPresentInBothYears() {
        List<EntityChange> changes = service.compareYears(twoYears(), AggregationLevel.SCHOOL,
                CanonicalFields.MATH, 2023, 2024, config);

        assertEquals(List.of("S1", "S2", "S3", "S5"), changes.stream().map(EntityChange::entityId).toList());
        EntityChange s1 = changes.get(0);
        assertEquals(50.0, s1.startMean(), 1e-12);
        assertEquals(60.0, s1.endMean(), 1e-12);
        assertEquals(10.0, s1.change(), 1e-12);
        assertEquals(20.0, s1.changePct(), 1e-12);
    }

    @Test
    void testZeroStartHasNoPercentage() {
        List<EntityChange> changes = service.compareYears(twoYears(), AggregationLevel.SCHOOL,
                CanonicalFields.MATH, 2023, 2024, config);

        EntityChange s5 = changes.get(3);
        assertEquals("S5", s5.entityId());
        assertNull(s5.changePct());
        assertEquals(3.0, s5.change(), 1e-12);
    }

    @Test
    void testMostImprovedAndMostDeclined() {
        List<EntityChange> changes = service.compareYears(twoYears(), AggregationLevel.SCHOOL,
                CanonicalFields.MATH, 2023, 2024, config);

        assertEquals("S1", service.mostImproved(changes, 1).get(0).entityId());
        assertEquals("S2", service.mostDeclined(changes, 1).get(0).entityId());
    }

    @Test
    void testMunicipalityLevelDropsYearFromKey() {
        List<EntityChange> changes = service.compareYears(twoYears(), AggregationLevel.MUNICIPALITY,
                CanonicalFields.MATH, 2023, 2024, config);

        assertEquals(1, changes.size());
        assertEquals("DEP | MUN", changes.get(0).entityId());
    }
}
