package it.aw.issueprioritizer.service;

import it.aw.issueprioritizer.model.Aggregation;
import it.aw.issueprioritizer.model.FilterParams;
import it.aw.issueprioritizer.model.IssueRecord;
import it.aw.issueprioritizer.model.IssueResultSet;
import it.aw.issueprioritizer.model.ModelInfo;
import it.aw.issueprioritizer.model.PriorityLevel;
import it.aw.issueprioritizer.model.RunMetrics;
import it.aw.issueprioritizer.model.RunSummary;
import it.aw.issueprioritizer.model.ScoredIssue;
import it.aw.issueprioritizer.scoring.IssueScorer;
import it.aw.issueprioritizer.scoring.PriorityPrototypes;
import it.aw.issueprioritizer.scoring.ScoringModelHolder;
import it.aw.issueprioritizer.scoring.ScoringSettings;
import it.aw.issueprioritizer.store.ResultStore;
import it.aw.issueprioritizer.store.RunSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Esegue un run di prioritizzazione e interroga il risultato pubblicato.
 * <p>
 * Pipeline di un run:
 * <ol>
 *   <li>Recupero dello scorer (caricamento del modello al primo run)</li>
 *   <li>Aggregazione: normalizzazione, deduplicazione, scoring per chiave</li>
 *   <li>Ranking con i filtri predefiniti</li>
 *   <li>Pubblicazione atomica della nuova fotografia nel {@link ResultStore}</li>
 * </ol>
 * Un errore fatale (modello non disponibile, cancellazione) lascia intatto il risultato precedente.
 * È ammesso un solo run alla volta.
 */
@Service
public class PrioritizationService {

    private static final Logger log = LoggerFactory.getLogger(PrioritizationService.class);

    private final ScoringModelHolder modelHolder;
    private final IssueAggregator aggregator;
    private final RankingEngine rankingEngine;
    private final ResultStore store;
    private final FilterParams defaultFilter;
    private final ScoringSettings scoringSettings;
    private final AtomicReference<CancellationToken> activeRun = new AtomicReference<>();

    public PrioritizationService(ScoringModelHolder modelHolder,
                                 IssueAggregator aggregator,
                                 RankingEngine rankingEngine,
                                 ResultStore store,
                                 FilterParams defaultFilter,
                                 ScoringSettings scoringSettings) {
        this.modelHolder = modelHolder;
        this.aggregator = aggregator;
        this.rankingEngine = rankingEngine;
        this.store = store;
        this.defaultFilter = defaultFilter;
        this.scoringSettings = scoringSettings;
    }

    /**
     * Esegue un run completo e ne pubblica il risultato.
     *
     * @throws RunInProgressException se un altro run è in corso
     * @throws it.aw.issueprioritizer.scoring.ModelUnavailableException se il modello non si carica
     * @throws RunCancelledException se il run viene cancellato prima della fine
     */
    public RunSummary run(List<IssueRecord> records) {
        CancellationToken token = new CancellationToken();
        if (!activeRun.compareAndSet(null, token)) {
            throw new RunInProgressException("Un run di prioritizzazione è già in corso");
        }
        String runId = UUID.randomUUID().toString();
        LocalDateTime startedAt = LocalDateTime.now();
        log.info("Inizio run {}: {} record", runId, records.size());
        try {
            IssueScorer scorer = modelHolder.get();
            Aggregation aggregation = aggregator.aggregate(records, scorer, token);
            token.throwIfCancelled();

            IssueResultSet view = rankingEngine.rankAndFilter(aggregation.issues(), defaultFilter);
            RunMetrics metrics = RunMetrics.of(view, aggregation.totalRecords());
            RunSummary summary = new RunSummary(
                    runId, startedAt, LocalDateTime.now(), scorer.modelId(),
                    aggregation.totalRecords(), aggregation.emptyRecords(),
                    aggregation.issues().size(), aggregation.failedScorings(), metrics);

            store.publish(new RunSnapshot(aggregation, view, summary));
            log.info("Run {} completato: {} segnalazioni uniche, {} vuoti, {} scoring falliti",
                    runId, summary.uniqueIssues(), summary.emptyRecords(), summary.failedScorings());
            return summary;
        } catch (RuntimeException e) {
            log.error("Run {} fallito, risultato precedente mantenuto: {}", runId, e.getMessage());
            throw e;
        } finally {
            activeRun.set(null);
        }
    }

    /** Segnala la cancellazione del run in corso. Ritorna false se nessun run è attivo. */
    public boolean cancelActiveRun() {
        CancellationToken token = activeRun.get();
        if (token == null) return false;
        token.cancel();
        log.info("Cancellazione richiesta per il run in corso");
        return true;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    /**
     * Vista filtrata dell'ultimo run.
     *
     * @param params filtri di score e occorrenze
     * @param search sottostringa da cercare nel testo (case-insensitive), opzionale
     * @param limit  numero massimo di righe dopo il ranking, opzionale
     */
    public IssueResultSet query(FilterParams params, String search, Integer limit) {
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit deve essere >= 1 (ricevuto: " + limit + ")");
        }
        List<ScoredIssue> ranked = filteredView(store.snapshot(), params, search);
        if (limit != null && ranked.size() > limit) {
            ranked = ranked.subList(0, limit);
        }
        return new IssueResultSet(ranked);
    }

    /**
     * Metriche della vista filtrata (stessi filtri di {@link #query}, senza limit).
     * totalRecords resta quello del run, vuoti compresi.
     */
    public RunMetrics metrics(FilterParams params, String search) {
        RunSnapshot snapshot = store.snapshot();
        IssueResultSet view = new IssueResultSet(filteredView(snapshot, params, search));
        return RunMetrics.of(view, snapshot.aggregation().totalRecords());
    }

    private List<ScoredIssue> filteredView(RunSnapshot snapshot, FilterParams params, String search) {
        List<ScoredIssue> ranked = rankingEngine.rankAndFilter(snapshot.aggregation().issues(), params).issues();
        if (search != null && !search.isBlank()) {
            String needle = search.toLowerCase(Locale.ROOT);
            ranked = ranked.stream()
                    .filter(i -> i.displayText().toLowerCase(Locale.ROOT).contains(needle))
                    .collect(Collectors.toList());
        }
        return ranked;
    }

    public IssueResultSet all() {
        return store.all();
    }

    public RunMetrics metrics() {
        return store.metrics();
    }

    public RunSummary lastRun() {
        return store.snapshot().summary();
    }

    public FilterParams defaultFilter() {
        return defaultFilter;
    }

    public ModelInfo modelInfo() {
        return new ModelInfo(
                modelHolder.modelId(),
                PriorityPrototypes.SCORED_LABEL,
                scoringSettings.temperature(),
                scoringSettings.maxInputChars(),
                PriorityLevel.HIGH_THRESHOLD,
                PriorityLevel.MEDIUM_THRESHOLD,
                modelHolder.isLoaded());
    }
}
