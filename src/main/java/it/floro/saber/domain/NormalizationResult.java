package it.floro.saber.domain;

import java.util.List;

public record NormalizationResult(
        double bound,
        List<NormalizedMeasure> measures,
        List<SubjectPopulation> populations,
        List<Diagnostic> diagnostics
) {

    public NormalizationResult {
        measures = List.copyOf(measures);
        populations = List.copyOf(populations);
        diagnostics = List.copyOf(diagnostics);
    }

    public List<NormalizedMeasure> measuresFor(String subject) {
        return measures.stream().filter(m -> m.subject().equals(subject)).toList();
    }
}
