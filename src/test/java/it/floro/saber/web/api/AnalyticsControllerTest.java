package it.floro.saber.web.api;

import it.floro.saber.config.AnalyticsExceptionHandler;
import it.floro.saber.config.DatasetProperties;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.service.AggregationService;
import it.floro.saber.service.EquityKpiService;
import it.floro.saber.service.ImprovementService;
import it.floro.saber.service.NormalizationService;
import it.floro.saber.service.RankingService;
import it.floro.saber.service.RecordCanonicalizer;
import it.floro.saber.service.RecordFilters;
import it.floro.saber.service.RegressionResidualService;
import it.floro.saber.service.ScoreDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Test degli endpoint REST sul dataset simulato ridotto, con i service reali.
 */
public class AnalyticsControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DatasetProperties dataset = new DatasetProperties();
        dataset.setSeed(42);
        dataset.setSchools(40);
        dataset.setStudentsPerSchool(25);
        dataset.setYears(List.of(2023, 2024));

        AnalysisConfig config = AnalysisConfig.defaults().toBuilder()
                .trees(10)
                .maxDepth(6)
                .build();

        AggregationService aggregation = new AggregationService();
        RankingService ranking = new RankingService();
        AnalyticsController controller = new AnalyticsController(
                new ScoreDataService(new RecordCanonicalizer(), dataset, config),
                new RecordFilters(),
                aggregation,
                new NormalizationService(),
                new RegressionResidualService(),
                new EquityKpiService(aggregation),
                new ImprovementService(aggregation, ranking),
                ranking,
                config);

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new AnalyticsExceptionHandler())
                .build();
    }

    @Test
    void testKpisReturnsSixIndicatorsInOrder() throws Exception {
        mockMvc.perform(get("/api/analytics/kpis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.length()").value(6))
                .andExpect(jsonPath("$.results[0].key").value("EALG"))
                .andExpect(jsonPath("$.results[5].key").value("SVS"));
    }

    @Test
    void testAggregatesAtMunicipalityLevel() throws Exception {
        mockMvc.perform(get("/api/analytics/aggregates")
                        .param("level", "municipio")
                        .param("subject", "punt_matemáticas"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value("MUNICIPALITY"))
                .andExpect(jsonPath("$.rows.length()").value(16))
                .andExpect(jsonPath("$.rows[0].subject").value("PUNT_MATEMATICAS"))
                .andExpect(jsonPath("$.bound").value(3.5));
    }

    @Test
    void testAggregatesWithYearDimension() throws Exception {
        mockMvc.perform(get("/api/analytics/aggregates")
                        .param("level", "department")
                        .param("subject", "PUNT_GLOBAL")
                        .param("dimension", "YEAR"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupFields[1]").value("YEAR"));
    }

    @Test
    void testUnknownLevelIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/analytics/aggregates").param("level", "galaxy"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void testNonSubjectIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/analytics/aggregates").param("subject", "COLE_AREA_UBICACION"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testFilterOptions() throws Exception {
        mockMvc.perform(get("/api/analytics/filters").param("department", "antioquia"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.departments", hasItem("BOGOTÁ D.C.")))
                .andExpect(jsonPath("$.municipalities", hasItem("MEDELLÍN")))
                .andExpect(jsonPath("$.municipalities.length()").value(3))
                .andExpect(jsonPath("$.years.length()").value(2));
    }

    @Test
    void testImprovementBetweenYears() throws Exception {
        mockMvc.perform(get("/api/analytics/improvement")
                        .param("level", "municipality")
                        .param("from", "2023")
                        .param("to", "2024")
                        .param("top", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entities").value(16))
                .andExpect(jsonPath("$.mostImproved.length()").value(3))
                .andExpect(jsonPath("$.mostDeclined.length()").value(3));
    }

    @Test
    void testImprovementRequiresYears() throws Exception {
        mockMvc.perform(get("/api/analytics/improvement"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testResidualsRankSchools() throws Exception {
        mockMvc.perform(get("/api/analytics/residuals")
                        .param("target", "PUNT_GLOBAL")
                        .param("level", "school")
                        .param("feature", "FAMI_ESTRATOVIVIENDA", "COLE_AREA_UBICACION")
                        .param("top", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FITTED"))
                .andExpect(jsonPath("$.entities").value(40))
                .andExpect(jsonPath("$.topPerformers.length()").value(5))
                .andExpect(jsonPath("$.bottomPerformers.length()").value(5));
    }

    @Test
    void testDatasetSummaryAndRegenerate() throws Exception {
        mockMvc.perform(get("/api/analytics/dataset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records", greaterThan(0)))
                .andExpect(jsonPath("$.droppedRows").value(0));

        mockMvc.perform(post("/api/analytics/dataset/regenerate"))
                .andExpect(status().isOk());
    }

    @Test
    void testReplaceDatasetWithPostedBatches() throws Exception {
        String body = "[{\"source\": \"upload.csv\","
                + " \"columns\": [\"ESTU_CONSECUTIVO\", \"PERIODO\", \"COLE_COD_DANE_ESTABLECIMIENTO\", \"PUNT_MATEMATICAS\"],"
                + " \"rows\": [[\"A1\", \"20241\", \"111\", \"55\"], [\"A2\", \"20241\", \"\", \"60\"]]}]";

        mockMvc.perform(post("/api/analytics/dataset")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.inputRows").value(2))
                .andExpect(jsonPath("$.droppedRows").value(1))
                .andExpect(jsonPath("$.records").value(1));
    }
}
