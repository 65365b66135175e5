package it.floro.saber.config;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.exception.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisPropertiesTest {

    @Test
    void testUnsetPropertiesKeepDefaults() {
        assertEquals(AnalysisConfig.defaults(), new AnalysisProperties().toConfig());
    }

    @Test
    void testOverridesApplied() {
        var props = new AnalysisProperties();
        props.setClipBound(3.0);
        props.setKpiMinSubgroup(50);
        props.setTrees(25);
        props.setSentinelScores(List.of(-1.0, 999.0));

        AnalysisConfig config = props.toConfig();

        assertEquals(3.0, config.clipBound());
        assertEquals(50, config.kpiMinSubgroup());
        assertEquals(25, config.trees());
        assertEquals(Set.of(-1.0, 999.0), config.sentinelScores());
        assertEquals(AnalysisConfig.defaults().regressionMinSample(), config.regressionMinSample());
    }

    @Test
    void testGroupKeysAcceptRawColumnNames() {
        var props = new AnalysisProperties();
        props.setGroupKeys(Map.of("municipio", List.of("cole_mcpio_ubicacion")));

        AnalysisConfig config = props.toConfig();

        assertEquals(List.of(CanonicalFields.MUNICIPALITY), config.groupKeys(AggregationLevel.MUNICIPALITY));
        assertEquals(List.of(CanonicalFields.SCHOOL_ID), config.groupKeys(AggregationLevel.SCHOOL));
    }

    @Test
    void testUnknownColumnRejected() {
        var props = new AnalysisProperties();
        props.setResidualFeatures(List.of("NOT_A_COLUMN"));

        assertThrows(MalformedInputException.class, props::toConfig);
    }

    @Test
    void testInvalidValueRejected() {
        var props = new AnalysisProperties();
        props.setTestRatio(1.5);

        assertThrows(IllegalArgumentException.class, props::toConfig);
    }
}
