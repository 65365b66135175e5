package it.floro.saber.service;

import it.floro.saber.domain.AggregateRow;
import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AggregationResult;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.Diagnostic;
import it.floro.saber.domain.GroupKey;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.exception.MalformedInputException;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Service di aggregazione dei record canonici per chiave di raggruppamento.
 *
 * Un unico percorso di calcolo serve tutti i livelli (scuola, municipio, dipartimento,
 * nazionale): il livello fornisce solo l'elenco dei campi chiave, a cui si possono
 * aggiungere dimensioni come anno o grado.
 *
 * Per ogni gruppo e materia produce conteggio, media e deviazione standard campionaria
 * dei soli punteggi presenti. Gruppi senza punteggi per una materia non generano righe.
 */
@Service
public class AggregationService {

    private static final Logger logger = LoggerFactory.getLogger(AggregationService.class);

    /**
     * Aggrega al livello indicato usando le chiavi configurate per quel livello.
     *
     * @param records         record canonici
     * @param level           livello organizzativo
     * @param extraDimensions campi aggiunti alla chiave (es. YEAR, GRADO), anche vuoto
     * @param config          configurazione con chiavi per livello e vocabolario materie
     */
    public AggregationResult aggregate(List<StudentRecord> records, AggregationLevel level,
                                       List<String> extraDimensions, AnalysisConfig config) {
        List<String> keys = new ArrayList<>(config.groupKeys(level));
        for (String d : extraDimensions) {
            if (!keys.contains(d)) keys.add(d);
        }
        return aggregate(records, keys, config.subjects());
    }

    /**
     * Aggrega per la tupla esatta dei campi {@code groupKeys}.
     *
     * Record con un valore mancante in una qualsiasi chiave sono esclusi (non finiscono
     * in un gruppo di default); il loro numero è riportato nel risultato.
     *
     * @param records   record canonici
     * @param groupKeys campi di raggruppamento, nell'ordine della chiave
     * @param subjects  materie da aggregare
     * @return righe (chiave, materia) ordinate per chiave e poi per ordine delle materie
     */
    public AggregationResult aggregate(List<StudentRecord> records, List<String> groupKeys, List<String> subjects) {
        for (String k : groupKeys) {
            if (!CanonicalFields.isKnown(k) || CanonicalFields.isSubject(k)) {
                throw new MalformedInputException("Campo di raggruppamento non valido: " + k);
            }
        }
        for (String s : subjects) {
            if (!CanonicalFields.isSubject(s)) {
                throw new MalformedInputException("Materia sconosciuta: " + s);
            }
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        GroupedRecords grouped = group(records, groupKeys);
        if (grouped.excluded() > 0) {
            logger.warn("Aggregazione per {}: {} record esclusi per chiave mancante", groupKeys, grouped.excluded());
            diagnostics.add(Diagnostic.missingField("aggregate:" + String.join("+", groupKeys),
                    "Record con almeno un campo chiave mancante", grouped.excluded()));
        }

        List<AggregateRow> rows = new ArrayList<>();
        for (String subject : subjects) {
            boolean anyValue = records.stream().anyMatch(r -> r.hasScore(subject));
            if (!anyValue) {
                diagnostics.add(Diagnostic.missingField("aggregate:" + subject,
                        "Materia assente in tutti i record", records.size()));
            }
        }

        for (Map.Entry<GroupKey, List<StudentRecord>> e : grouped.groups().entrySet()) {
            for (String subject : subjects) {
                SummaryStatistics stats = new SummaryStatistics();
                for (StudentRecord r : e.getValue()) {
                    r.score(subject).ifPresent(stats::addValue);
                }
                if (stats.getN() == 0) continue;
                // SummaryStatistics restituisce 0 come deviazione di un solo valore
                rows.add(new AggregateRow(e.getKey(), subject, stats.getN(), stats.getMean(),
                        stats.getStandardDeviation()));
            }
        }

        logger.info("Aggregati {} record in {} gruppi per {} ({} righe)",
                records.size(), grouped.groups().size(), groupKeys, rows.size());
        return new AggregationResult(groupKeys, rows, grouped.excluded(), diagnostics);
    }

    /**
     * Raggruppa i record per chiave, escludendo quelli con un campo chiave mancante.
     * Riutilizzato dagli altri stadi per medie per entità.
     */
    public GroupedRecords group(List<StudentRecord> records, List<String> groupKeys) {
        Map<GroupKey, List<StudentRecord>> groups = new TreeMap<>();
        long excluded = 0;
        for (StudentRecord r : records) {
            GroupKey key = GroupKey.of(r, groupKeys);
            if (key == null) {
                excluded++;
                continue;
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }
        return new GroupedRecords(groups, excluded);
    }

    /**
     * Record raggruppati per chiave, in ordine di chiave.
     */
    public record GroupedRecords(Map<GroupKey, List<StudentRecord>> groups, long excluded) {
    }
}
