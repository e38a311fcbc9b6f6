package it.aw.issueprioritizer.config;

import it.aw.issueprioritizer.scoring.ScoringModelHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Rilascia le risorse di processo allo shutdown dell'applicazione:
 * il pool di scoring e il modello caricato.
 * <p>
 * Il caricamento del modello non avviene qui ma al primo run (ScoringModelHolder).
 */
@Component
public class EngineLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EngineLifecycle.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final ExecutorService scoringExecutor;
    private final ScoringModelHolder modelHolder;

    public EngineLifecycle(@Qualifier("scoringExecutor") ExecutorService scoringExecutor,
                           ScoringModelHolder modelHolder) {
        this.scoringExecutor = scoringExecutor;
        this.modelHolder = modelHolder;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutdown: arresto pool di scoring e rilascio modello...");
        scoringExecutor.shutdown();
        try {
            if (!scoringExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Pool di scoring non terminato entro {}s, arresto forzato", SHUTDOWN_WAIT_SECONDS);
                scoringExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scoringExecutor.shutdownNow();
        }
        modelHolder.release();
    }
}
