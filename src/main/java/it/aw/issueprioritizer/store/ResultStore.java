package it.aw.issueprioritizer.store;

import it.aw.issueprioritizer.model.IssueResultSet;
import it.aw.issueprioritizer.model.RunMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Risultato corrente in memoria.
 * <p>
 * Un run completato sostituisce l'intera {@link RunSnapshot} con un unico scambio di
 * riferimento: chi legge vede la fotografia vecchia o quella nuova, mai un misto.
 * Chi deve fare più letture coerenti prende prima {@link #snapshot()} e lavora su quella.
 */
@Component
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    private final AtomicReference<RunSnapshot> current = new AtomicReference<>(RunSnapshot.empty());

    public RunSnapshot snapshot() {
        return current.get();
    }

    public IssueResultSet all() {
        return current.get().defaultView();
    }

    public RunMetrics metrics() {
        return current.get().metrics();
    }

    public void publish(RunSnapshot snapshot) {
        RunSnapshot previous = current.getAndSet(snapshot);
        log.debug("ResultStore: pubblicato run {} (precedente: {})",
                snapshot.summary().runId(), previous.summary().runId());
    }
}
