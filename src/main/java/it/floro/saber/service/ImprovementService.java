package it.floro.saber.service;

import it.floro.saber.domain.AggregateRow;
import it.floro.saber.domain.AggregationLevel;
import it.floro.saber.domain.AggregationResult;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.EntityChange;
import it.floro.saber.domain.GroupKey;
import it.floro.saber.domain.StudentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Confronto anno su anno delle medie per entità.
 *
 * Le entità devono comparire in entrambi gli anni. Le graduatorie "più migliorate" e
 * "più peggiorate" passano dal {@link RankingService} sulla misura "change".
 */
@Service
public class ImprovementService {

    private static final Logger logger = LoggerFactory.getLogger(ImprovementService.class);

    private final AggregationService aggregationService;
    private final RankingService rankingService;

    public ImprovementService(AggregationService aggregationService, RankingService rankingService) {
        this.aggregationService = aggregationService;
        this.rankingService = rankingService;
    }

    /**
     * Variazione della media di {@code subject} tra {@code yearStart} e {@code yearEnd}.
     *
     * @return una variazione per entità presente in entrambi gli anni, in ordine di chiave
     */
    public List<EntityChange> compareYears(List<StudentRecord> records, AggregationLevel level, String subject,
                                           int yearStart, int yearEnd, AnalysisConfig config) {
        List<String> keys = new ArrayList<>(config.groupKeys(level));
        keys.remove(CanonicalFields.YEAR);
        keys.add(CanonicalFields.YEAR);
        AggregationResult agg = aggregationService.aggregate(records, keys, List.of(subject));

        Map<GroupKey, AggregateRow> start = new TreeMap<>();
        Map<GroupKey, AggregateRow> end = new TreeMap<>();
        for (AggregateRow row : agg.rows()) {
            String y = row.key().value(CanonicalFields.YEAR);
            if (String.valueOf(yearStart).equals(y)) {
                start.put(row.key().without(CanonicalFields.YEAR), row);
            } else if (String.valueOf(yearEnd).equals(y)) {
                end.put(row.key().without(CanonicalFields.YEAR), row);
            }
        }

        List<EntityChange> changes = new ArrayList<>();
        for (Map.Entry<GroupKey, AggregateRow> e : start.entrySet()) {
            AggregateRow later = end.get(e.getKey());
            if (later == null) continue;
            double s = e.getValue().mean();
            double t = later.mean();
            Double pct = s != 0 ? (t - s) / s * 100.0 : null;
            changes.add(new EntityChange(e.getKey(), subject, yearStart, yearEnd, s, t, t - s, pct));
        }
        logger.info("Variazioni {} {}->{} a livello {}: {} entità confrontabili",
                subject, yearStart, yearEnd, level, changes.size());
        return changes;
    }

    /** Le {@code n} entità con l'aumento di media maggiore. */
    public List<EntityChange> mostImproved(List<EntityChange> changes, int n) {
        return rankingService.topN(changes, "change", n);
    }

    /** Le {@code n} entità con il calo di media maggiore. */
    public List<EntityChange> mostDeclined(List<EntityChange> changes, int n) {
        return rankingService.bottomN(changes, "change", n);
    }
}
