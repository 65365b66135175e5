package it.floro.saber.web.dto;

import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.Diagnostic;
import it.floro.saber.domain.ModelFit;
import it.floro.saber.domain.ResidualResult;
import it.floro.saber.domain.ResidualRun;

import java.util.List;
import java.util.Map;

/**
 * Run di valore aggiunto pronto per la presentazione: bontà del modello, importanza
 * delle feature, codifica usata e graduatorie per residuo (positivo = sopra le attese).
 */
public record ResidualResponse(
        ResidualRun.Status status,
        String targetSubject,
        AggregationLevel level,
        List<String> features,
        long filteredRecords,
        long excludedRecords,
        ModelFit fit,
        Map<String, Double> featureImportance,
        Map<String, List<String>> encoding,
        List<ResidualResult> topPerformers,
        List<ResidualResult> bottomPerformers,
        int entities,
        List<Diagnostic> diagnostics
) {

    public static ResidualResponse of(ResidualRun run, List<ResidualResult> top, List<ResidualResult> bottom) {
        return new ResidualResponse(
                run.status(),
                run.targetSubject(),
                run.level(),
                run.featureFields(),
                run.filteredRecords(),
                run.excludedRecords(),
                run.fit(),
                run.featureImportance(),
                run.encoder() == null ? Map.of() : run.encoder().categories(),
                top,
                bottom,
                run.results().size(),
                run.diagnostics());
    }
}
