package it.floro.saber.config;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.exception.MalformedInputException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parametri di analisi letti da {@code saber.analysis.*}.
 *
 * Ogni proprietà non valorizzata mantiene il default di {@link AnalysisConfig#defaults()}.
 * Le chiavi di raggruppamento per livello accettano nomi di colonna grezzi, ricondotti
 * al vocabolario canonico.
 */
@ConfigurationProperties(prefix = "saber.analysis")
public class AnalysisProperties {

    private Double clipBound;
    private Integer regressionMinSample;
    private Integer kpiMinSubgroup;
    private Integer kpiMinEntitySize;
    private Integer kpiMinEntities;
    private Double testRatio;
    private Long seed;
    private Integer trees;
    private Integer maxDepth;
    private Integer topN;
    private List<Double> sentinelScores;
    private List<String> residualFeatures;
    private Map<String, List<String>> groupKeys = new LinkedHashMap<>();

    /**
     * Sovrappone le proprietà valorizzate alla configurazione di riferimento.
     *
     * @throws MalformedInputException se un nome di livello o di colonna non è riconosciuto
     */
    public AnalysisConfig toConfig() {
        AnalysisConfig.Builder b = AnalysisConfig.defaults().toBuilder();
        if (clipBound != null) b.clipBound(clipBound);
        if (regressionMinSample != null) b.regressionMinSample(regressionMinSample);
        if (kpiMinSubgroup != null) b.kpiMinSubgroup(kpiMinSubgroup);
        if (kpiMinEntitySize != null) b.kpiMinEntitySize(kpiMinEntitySize);
        if (kpiMinEntities != null) b.kpiMinEntities(kpiMinEntities);
        if (testRatio != null) b.testRatio(testRatio);
        if (seed != null) b.seed(seed);
        if (trees != null) b.trees(trees);
        if (maxDepth != null) b.maxDepth(maxDepth);
        if (topN != null) b.topN(topN);
        if (sentinelScores != null) b.sentinelScores(new HashSet<>(sentinelScores));
        if (residualFeatures != null) b.residualFeatures(canonical(residualFeatures));
        for (Map.Entry<String, List<String>> e : groupKeys.entrySet()) {
            b.groupKeys(AggregationLevel.parse(e.getKey()), canonical(e.getValue()));
        }
        return b.build();
    }

    private static List<String> canonical(List<String> raw) {
        return raw.stream()
                .map(f -> CanonicalFields.resolve(f)
                        .orElseThrow(() -> new MalformedInputException("Colonna sconosciuta in configurazione: " + f)))
                .toList();
    }

    // ===== GETTER / SETTER =====

    public Double getClipBound() { return clipBound; }
    public void setClipBound(Double clipBound) { this.clipBound = clipBound; }

    public Integer getRegressionMinSample() { return regressionMinSample; }
    public void setRegressionMinSample(Integer regressionMinSample) { this.regressionMinSample = regressionMinSample; }

    public Integer getKpiMinSubgroup() { return kpiMinSubgroup; }
    public void setKpiMinSubgroup(Integer kpiMinSubgroup) { this.kpiMinSubgroup = kpiMinSubgroup; }

    public Integer getKpiMinEntitySize() { return kpiMinEntitySize; }
    public void setKpiMinEntitySize(Integer kpiMinEntitySize) { this.kpiMinEntitySize = kpiMinEntitySize; }

    public Integer getKpiMinEntities() { return kpiMinEntities; }
    public void setKpiMinEntities(Integer kpiMinEntities) { this.kpiMinEntities = kpiMinEntities; }

    public Double getTestRatio() { return testRatio; }
    public void setTestRatio(Double testRatio) { this.testRatio = testRatio; }

    public Long getSeed() { return seed; }
    public void setSeed(Long seed) { this.seed = seed; }

    public Integer getTrees() { return trees; }
    public void setTrees(Integer trees) { this.trees = trees; }

    public Integer getMaxDepth() { return maxDepth; }
    public void setMaxDepth(Integer maxDepth) { this.maxDepth = maxDepth; }

    public Integer getTopN() { return topN; }
    public void setTopN(Integer topN) { this.topN = topN; }

    public List<Double> getSentinelScores() { return sentinelScores; }
    public void setSentinelScores(List<Double> sentinelScores) { this.sentinelScores = sentinelScores; }

    public List<String> getResidualFeatures() { return residualFeatures; }
    public void setResidualFeatures(List<String> residualFeatures) { this.residualFeatures = residualFeatures; }

    public Map<String, List<String>> getGroupKeys() { return groupKeys; }
    public void setGroupKeys(Map<String, List<String>> groupKeys) { this.groupKeys = groupKeys; }
}
