package it.aw.issueprioritizer.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Stato di processo del modello di scoring.
 * <p>
 * Lo scorer viene costruito al primo utilizzo, una sola volta, e riusato da tutti
 * i run successivi; non viene mai ricaricato. {@link #release()} lo rilascia allo
 * shutdown. Se la costruzione fallisce non viene memorizzato nulla: il chiamante
 * riceve {@link ModelUnavailableException} e il tentativo successivo riparte da zero.
 */
public class ScoringModelHolder {

    private static final Logger log = LoggerFactory.getLogger(ScoringModelHolder.class);

    private final Supplier<IssueScorer> scorerFactory;
    private final String modelId;
    private volatile IssueScorer scorer;

    public ScoringModelHolder(Supplier<IssueScorer> scorerFactory, String modelId) {
        this.scorerFactory = scorerFactory;
        this.modelId = modelId;
    }

    public IssueScorer get() {
        IssueScorer current = scorer;
        if (current != null) return current;
        synchronized (this) {
            if (scorer == null) {
                scorer = load();
            }
            return scorer;
        }
    }

    public boolean isLoaded() {
        return scorer != null;
    }

    public String modelId() {
        return modelId;
    }

    public synchronized void release() {
        if (scorer != null) {
            log.info("Rilascio modello di scoring {}", modelId);
            scorer = null;
        }
    }

    private IssueScorer load() {
        log.info("Caricamento modello di scoring {}...", modelId);
        long start = System.nanoTime();
        IssueScorer loaded;
        try {
            loaded = scorerFactory.get();
        } catch (ModelUnavailableException e) {
            log.error("Modello {} non disponibile: {}", modelId, e.getMessage());
            throw e;
        } catch (RuntimeException | LinkageError e) {
            log.error("Modello {} non disponibile: {}", modelId, e.toString());
            throw new ModelUnavailableException("Caricamento del modello " + modelId + " fallito", e);
        }
        log.info("Modello {} caricato in {} ms", modelId, (System.nanoTime() - start) / 1_000_000);
        return loaded;
    }
}
