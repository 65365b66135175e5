package it.floro.saber.service;

import it.floro.saber.domain.AggregateRow;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.Diagnostic;
import it.floro.saber.domain.NormalizationResult;
import it.floro.saber.domain.NormalizedMeasure;
import it.floro.saber.domain.SubjectPopulation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service che standardizza le medie aggregate e ne limita gli outlier.
 *
 * Algoritmo, per ogni materia:
 * 1. Media e deviazione standard della popolazione di gruppi passata in ingresso
 * 2. z = (media gruppo - media popolazione) / deviazione popolazione
 * 3. Limitazione di z a [-bound, +bound]
 *
 * Il risultato dipende dall'intera popolazione: normalizzare un sottoinsieme produce
 * valori diversi. Per confronti sulla stessa scala va sempre passata la popolazione
 * completa di un livello.
 */
@Service
public class NormalizationService {

    private static final Logger logger = LoggerFactory.getLogger(NormalizationService.class);

    public NormalizationResult normalize(List<AggregateRow> rows) {
        return normalize(rows, AnalysisConfig.DEFAULT_CLIP_BOUND);
    }

    /**
     * Standardizza e limita le righe aggregate.
     *
     * Una materia con meno di due gruppi o con deviazione nulla viene esclusa con una
     * diagnostica DEGENERATE_VARIANCE: nessun NaN esce da qui.
     *
     * @param rows  popolazione completa di un livello (tutte le materie)
     * @param bound limite simmetrico, positivo
     */
    public NormalizationResult normalize(List<AggregateRow> rows, double bound) {
        if (!(bound > 0) || Double.isInfinite(bound)) {
            throw new IllegalArgumentException("Il limite deve essere positivo e finito: " + bound);
        }

        // Materia -> righe, nell'ordine di prima apparizione
        Map<String, List<AggregateRow>> bySubject = new LinkedHashMap<>();
        for (AggregateRow r : rows) {
            if (r.count() == 0) continue;
            bySubject.computeIfAbsent(r.subject(), s -> new ArrayList<>()).add(r);
        }

        List<NormalizedMeasure> measures = new ArrayList<>(rows.size());
        List<SubjectPopulation> populations = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Map.Entry<String, List<AggregateRow>> e : bySubject.entrySet()) {
            String subject = e.getKey();
            DescriptiveStatistics population = new DescriptiveStatistics();
            e.getValue().forEach(r -> population.addValue(r.mean()));

            double mean = population.getMean();
            double std = population.getStandardDeviation();
            if (population.getN() < 2 || !Double.isFinite(std) || std == 0) {
                logger.warn("Normalizzazione di {} saltata: {} gruppi, deviazione {}", subject, population.getN(), std);
                diagnostics.add(Diagnostic.degenerateVariance("normalize:" + subject, String.format(
                        "Deviazione standard nulla o indefinita su %d gruppi", population.getN())));
                continue;
            }
            populations.add(new SubjectPopulation(subject, population.getN(), mean, std));

            int clippedCount = 0;
            for (AggregateRow r : e.getValue()) {
                double z = (r.mean() - mean) / std;
                double bounded = clip(z, bound);
                boolean clipped = bounded != z;
                if (clipped) clippedCount++;
                measures.add(new NormalizedMeasure(r.key(), subject, r.count(), r.mean(), r.std(),
                        z, bounded, clipped));
            }
            if (clippedCount > 0) {
                logger.debug("{}: {} gruppi limitati a ±{}", subject, clippedCount, bound);
            }
        }

        logger.info("Normalizzate {} misure su {} materie (bound ±{})", measures.size(), populations.size(), bound);
        return new NormalizationResult(bound, measures, populations, diagnostics);
    }

    private static double clip(double z, double bound) {
        return Math.max(-bound, Math.min(bound, z));
    }
}
