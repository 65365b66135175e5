package it.floro.saber.service;

import it.floro.saber.config.DatasetProperties;
import it.floro.saber.domain.AnalysisConfig;
import it.floro.saber.domain.CanonicalizationResult;
import it.floro.saber.domain.RawBatch;
import it.floro.saber.domain.StudentRecord;
import it.floro.saber.simulator.ExamDataSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service che custodisce il dataset canonico corrente.
 *
 * Responsabilità:
 * - Generazione lazy del dataset simulato al primo accesso
 * - Sostituzione del dataset con batch forniti dal chiamante
 * - Esposizione dell'ultimo esito di canonicalizzazione (conteggi e diagnostiche)
 *
 * Il dataset è una lista immutabile sostituita in blocco: chi l'ha letta continua a
 * lavorare sulla propria copia anche se nel frattempo viene rimpiazzata.
 */
@Service
public class ScoreDataService {

    private static final Logger logger = LoggerFactory.getLogger(ScoreDataService.class);

    /**
     * Ultimo esito di canonicalizzazione; volatile per la visibilità tra thread,
     * la scrittura avviene sempre sotto lock.
     */
    private volatile CanonicalizationResult cached;

    private final RecordCanonicalizer canonicalizer;
    private final DatasetProperties dataset;
    private final AnalysisConfig config;

    public ScoreDataService(RecordCanonicalizer canonicalizer, DatasetProperties dataset, AnalysisConfig config) {
        this.canonicalizer = canonicalizer;
        this.dataset = dataset;
        this.config = config;
    }

    // ========================================================================
    // METODI PUBBLICI
    // ========================================================================

    /**
     * Tutti i record canonici correnti (generati al primo accesso se assenti).
     */
    public List<StudentRecord> getAll() {
        ensureDataLoaded();
        return cached.records();
    }

    /**
     * Esito dell'ultima canonicalizzazione: righe in ingresso, scartate, diagnostiche.
     */
    public CanonicalizationResult lastCanonicalization() {
        ensureDataLoaded();
        return cached;
    }

    /**
     * Rigenera il dataset simulato con i parametri configurati.
     */
    public synchronized CanonicalizationResult regenerate() {
        cached = generate();
        return cached;
    }

    /**
     * Sostituisce il dataset con batch esterni già letti.
     * Se la canonicalizzazione fallisce il dataset precedente resta in uso.
     */
    public synchronized CanonicalizationResult replace(List<RawBatch> batches) {
        CanonicalizationResult result = canonicalizer.canonicalize(batches, config);
        cached = result;
        logger.info("Dataset sostituito: {} record da {} batch", result.records().size(), batches.size());
        return result;
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    /**
     * Lazy initialization con double-checked locking.
     */
    private void ensureDataLoaded() {
        if (cached == null) {
            synchronized (this) {
                if (cached == null) {
                    cached = generate();
                }
            }
        }
    }

    private CanonicalizationResult generate() {
        ExamDataSimulator simulator = new ExamDataSimulator(
                dataset.getSeed(),
                dataset.getYears(),
                dataset.getSchools(),
                dataset.getStudentsPerSchool());
        List<RawBatch> batches = simulator.generate();
        CanonicalizationResult result = canonicalizer.canonicalize(batches, config);
        logger.info("Dataset simulato: {} scuole, anni {}, {} record", dataset.getSchools(),
                dataset.getYears(), result.records().size());
        return result;
    }
}
