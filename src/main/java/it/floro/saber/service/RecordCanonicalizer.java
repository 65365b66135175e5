package it.floro.saber.service;

import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.CanonicalizationResult;
import it.floro.saber.domain.Diagnostic;
import it.floro.saber.domain.RawBatch;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.exception.MalformedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Componente che porta batch tabellari eterogenei nello schema canonico.
 *
 * Responsabilità:
 * - Riconoscimento delle colonne senza distinzione di maiuscole/accenti (vedi {@link CanonicalFields})
 * - Conversione dei punteggi sentinella o illeggibili in valori mancanti
 * - Derivazione dei campi ricavabili (anno dal codice periodo, grado predefinito)
 * - Scarto, con conteggio, delle righe prive degli identificativi obbligatori
 *
 * Le righe scartate e i punteggi invalidati finiscono sempre in una {@link Diagnostic}:
 * nulla viene eliminato senza lasciare traccia.
 */
@Component
public class RecordCanonicalizer {

    private static final Logger logger = LoggerFactory.getLogger(RecordCanonicalizer.class);

    /**
     * Canonicalizza uno o più batch in un'unica tabella di {@link StudentRecord}.
     *
     * @param batches batch già letti dal collaboratore di ingestione
     * @param config  configurazione (sentinelle, identificativi obbligatori, grado predefinito)
     * @return record canonici più conteggi e diagnostiche
     * @throws MalformedInputException se tutte le righe in ingresso mancano degli identificativi obbligatori
     */
    public CanonicalizationResult canonicalize(List<RawBatch> batches, AnalysisConfig config) {
        List<StudentRecord> out = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        long inputRows = 0;
        long dropped = 0;

        for (RawBatch batch : batches) {
            inputRows += batch.rows().size();
            BatchOutcome outcome = canonicalizeBatch(batch, config, diagnostics);
            out.addAll(outcome.records());
            dropped += outcome.dropped();
        }

        if (inputRows > 0 && out.isEmpty() && dropped == inputRows) {
            throw new MalformedInputException(
                    "Nessuna riga con gli identificativi obbligatori " + config.mandatoryIdentifiers()
                            + " su " + inputRows + " righe in ingresso");
        }

        logger.info("Canonicalizzati {} batch: {} righe in ingresso, {} record validi, {} scartati",
                batches.size(), inputRows, out.size(), dropped);
        return new CanonicalizationResult(out, inputRows, dropped, diagnostics);
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private record BatchOutcome(List<StudentRecord> records, long dropped) {
    }

    private BatchOutcome canonicalizeBatch(RawBatch batch, AnalysisConfig config, List<Diagnostic> diagnostics) {
        String scope = "canonicalize:" + batch.source();

        // Indice colonna -> nome canonico. Un nome canonico esatto vince sempre su un alias,
        // a parità la prima occorrenza
        Map<Integer, String> mapping = new TreeMap<>();
        TreeSet<String> ignored = new TreeSet<>();
        Map<String, Integer> seen = new HashMap<>();
        for (boolean exactPass : new boolean[]{true, false}) {
            for (int i = 0; i < batch.columns().size(); i++) {
                String raw = batch.columns().get(i);
                if (CanonicalFields.isCanonicalName(raw) != exactPass) continue;
                Optional<String> canonical = CanonicalFields.resolve(raw);
                if (canonical.isEmpty()) {
                    ignored.add(raw);
                    continue;
                }
                if (seen.putIfAbsent(canonical.get(), i) != null) {
                    ignored.add(raw);
                    continue;
                }
                mapping.put(i, canonical.get());
            }
        }
        if (!ignored.isEmpty()) {
            logger.debug("Batch {}: colonne ignorate {}", batch.source(), ignored);
            diagnostics.add(Diagnostic.missingField(scope,
                    "Colonne fuori vocabolario o duplicate ignorate: " + ignored, ignored.size()));
        }

        List<String> absentIds = config.mandatoryIdentifiers().stream()
                .filter(f -> !seen.containsKey(f) && !CanonicalFields.RECORD_ID.equals(f))
                .toList();
        if (!absentIds.isEmpty()) {
            logger.warn("Batch {}: colonne identificative assenti {}", batch.source(), absentIds);
        }

        List<StudentRecord> records = new ArrayList<>(batch.rows().size());
        Map<String, Long> invalidScores = new TreeMap<>();
        long dropped = 0;
        int rowIndex = 0;
        for (List<String> row : batch.rows()) {
            Map<String, String> fields = new HashMap<>();
            Map<String, Double> scores = new HashMap<>();
            for (Map.Entry<Integer, String> e : mapping.entrySet()) {
                String cell = blankToNull(row.get(e.getKey()));
                String field = e.getValue();
                if (CanonicalFields.isSubject(field)) {
                    Double score = parseScore(cell, config);
                    if (score != null) {
                        scores.put(field, score);
                    } else if (cell != null) {
                        invalidScores.merge(field, 1L, Long::sum);
                    }
                } else if (cell != null) {
                    fields.put(field, cell);
                }
            }
            deriveFields(fields, config);

            String recordId = fields.remove(CanonicalFields.RECORD_ID);
            if (recordId == null) {
                recordId = batch.source() + "#" + rowIndex;
            }
            rowIndex++;

            boolean complete = config.mandatoryIdentifiers().stream()
                    .allMatch(f -> CanonicalFields.RECORD_ID.equals(f) || fields.containsKey(f));
            if (!complete) {
                dropped++;
                continue;
            }
            records.add(new StudentRecord(recordId, fields, scores));
        }

        if (dropped > 0) {
            logger.warn("Batch {}: {} righe scartate per identificativi obbligatori mancanti",
                    batch.source(), dropped);
            diagnostics.add(Diagnostic.missingField(scope,
                    "Righe senza identificativi obbligatori " + config.mandatoryIdentifiers(), dropped));
        }
        invalidScores.forEach((subject, n) -> diagnostics.add(Diagnostic.missingField(scope + ":" + subject,
                "Punteggi sentinella o non numerici trattati come mancanti", n)));

        return new BatchOutcome(records, dropped);
    }

    /**
     * Completa i campi ricavabili: anno dal periodo composto (20241 -> 2024) e grado predefinito.
     */
    private static void deriveFields(Map<String, String> fields, AnalysisConfig config) {
        if (!fields.containsKey(CanonicalFields.YEAR)) {
            Integer year = yearFromPeriod(fields.get(CanonicalFields.PERIOD));
            if (year != null) {
                fields.put(CanonicalFields.YEAR, String.valueOf(year));
            }
        } else {
            Integer year = yearFromPeriod(fields.get(CanonicalFields.YEAR));
            if (year == null) {
                fields.remove(CanonicalFields.YEAR);
            } else {
                fields.put(CanonicalFields.YEAR, String.valueOf(year));
            }
        }
        if (!fields.containsKey(CanonicalFields.GRADE)) {
            fields.put(CanonicalFields.GRADE, String.valueOf(config.defaultGrade()));
        }
    }

    /**
     * Estrae l'anno dalle prime quattro cifre del codice periodo.
     *
     * @return anno, oppure null se il codice non è leggibile
     */
    static Integer yearFromPeriod(String period) {
        if (period == null) return null;
        String digits = period.trim();
        int dot = digits.indexOf('.');
        if (dot >= 0) digits = digits.substring(0, dot);
        if (digits.length() < 4 || !digits.chars().allMatch(Character::isDigit)) return null;
        return Integer.valueOf(digits.substring(0, 4));
    }

    /**
     * Interpreta un punteggio. Sentinelle, valori non finiti e testo non numerico diventano null.
     */
    static Double parseScore(String cell, AnalysisConfig config) {
        if (cell == null) return null;
        String s = cell.trim();
        if (s.indexOf(',') >= 0 && s.indexOf('.') < 0) {
            s = s.replace(',', '.');
        }
        double v;
        try {
            v = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
        if (!Double.isFinite(v) || config.sentinelScores().contains(v)) return null;
        return v;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
