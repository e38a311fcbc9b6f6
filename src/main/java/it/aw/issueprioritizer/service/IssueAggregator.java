package it.aw.issueprioritizer.service;

import it.aw.issueprioritizer.model.Aggregation;
import it.aw.issueprioritizer.model.IssueRecord;
import it.aw.issueprioritizer.model.NormalizedKey;
import it.aw.issueprioritizer.model.ScoredIssue;
import it.aw.issueprioritizer.scoring.IssueScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Raggruppa i record per chiave normalizzata e assegna un punteggio a ogni chiave.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Passata sequenziale: normalizzazione, mappa chiave → gruppo in ordine di
 *       prima apparizione, conteggio delle occorrenze</li>
 *   <li>Scoring: una sola chiamata al modello per chiave non vuota, distribuita sul
 *       pool in finestre di {@code parallelism} chiamate, ciascuna con timeout proprio
 *       misurato dall'istante in cui ottiene un thread</li>
 * </ol>
 * Un errore di scoring (eccezione, timeout) vale 0.0 con {@code scoringFailed = true}
 * e non interrompe il batch. La cancellazione invece interrompe il run.
 * <p>
 * L'ordine restituito è quello di prima apparizione, non quello di presentazione.
 */
public class IssueAggregator {

    private static final Logger log = LoggerFactory.getLogger(IssueAggregator.class);
    private static final long START_POLL_MS = 50;

    private final TextNormalizer normalizer;
    private final ExecutorService executor;
    private final int parallelism;
    private final Duration timeout;

    public IssueAggregator(TextNormalizer normalizer, ExecutorService executor, int parallelism, Duration timeout) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism deve essere >= 1 (ricevuto: " + parallelism + ")");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout deve essere positivo (ricevuto: " + timeout + ")");
        }
        this.normalizer = normalizer;
        this.executor = executor;
        this.parallelism = parallelism;
        this.timeout = timeout;
    }

    public Aggregation aggregate(List<IssueRecord> records, IssueScorer scorer) {
        return aggregate(records, scorer, CancellationToken.none());
    }

    public Aggregation aggregate(List<IssueRecord> records, IssueScorer scorer, CancellationToken token) {
        Map<NormalizedKey, Group> groups = new LinkedHashMap<>();
        Group empty = null;

        for (int i = 0; i < records.size(); i++) {
            IssueRecord record = records.get(i);
            NormalizedKey key = normalizer.normalize(record.rawText());
            if (key.isEmpty()) {
                if (empty == null) empty = new Group(key, record.rawText() == null ? "" : record.rawText(), i);
                else empty.occurrences++;
                continue;
            }
            Group group = groups.get(key);
            if (group == null) {
                groups.put(key, new Group(key, record.rawText(), i));
            } else {
                group.occurrences++;
            }
        }
        log.debug("Aggregazione: {} record, {} chiavi distinte, {} vuoti",
                records.size(), groups.size(), empty == null ? 0 : empty.occurrences);

        List<Group> unique = new ArrayList<>(groups.values());
        scoreAll(unique, scorer, token);

        List<ScoredIssue> issues = unique.stream().map(Group::toScoredIssue).collect(Collectors.toList());
        Optional<ScoredIssue> emptyGroup = Optional.ofNullable(empty).map(Group::toScoredIssue);
        return new Aggregation(issues, emptyGroup, records.size());
    }

    private void scoreAll(List<Group> groups, IssueScorer scorer, CancellationToken token) {
        for (int from = 0; from < groups.size(); from += parallelism) {
            List<Group> window = groups.subList(from, Math.min(from + parallelism, groups.size()));
            List<ScoringCall> calls = new ArrayList<>(window.size());
            try {
                for (Group group : window) {
                    token.throwIfCancelled();
                    calls.add(ScoringCall.submit(executor, group, scorer));
                }
                for (ScoringCall call : calls) {
                    collect(call, token);
                }
            } catch (RunCancelledException e) {
                calls.forEach(c -> c.future.cancel(true));
                throw e;
            }
        }
    }

    /**
     * Il timeout parte quando la chiamata inizia a girare su un thread del pool, non quando
     * viene accodata: un thread ancora occupato da una chiamata scaduta non fa fallire le successive.
     */
    private void collect(ScoringCall call, CancellationToken token) {
        Group group = call.group;
        try {
            call.awaitStart(token);
            long remaining = Math.max(0L, call.startedAt + timeout.toNanos() - System.nanoTime());
            double score = call.future.get(remaining, TimeUnit.NANOSECONDS);
            if (Double.isNaN(score)) {
                fail(group, "punteggio NaN");
            } else {
                group.score = Math.min(1.0, Math.max(0.0, score));
            }
        } catch (TimeoutException e) {
            call.future.cancel(true);
            fail(group, "timeout dopo " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(group, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("run interrotto durante lo scoring");
        }
    }

    private static void fail(Group group, String reason) {
        log.warn("Scoring fallito per '{}': {} (assegnato 0.0)", group.displayText, reason);
        group.score = 0.0;
        group.failed = true;
    }

    /** Chiamata al modello per una chiave, con l'istante in cui ha ottenuto un thread. */
    private static final class ScoringCall {
        final Group group;
        final CountDownLatch started = new CountDownLatch(1);
        volatile long startedAt;
        Future<Double> future;

        private ScoringCall(Group group) {
            this.group = group;
        }

        static ScoringCall submit(ExecutorService executor, Group group, IssueScorer scorer) {
            ScoringCall call = new ScoringCall(group);
            String text = group.key.value();
            call.future = executor.submit(() -> {
                call.startedAt = System.nanoTime();
                call.started.countDown();
                return scorer.score(text);
            });
            return call;
        }

        /** Attende che la chiamata parta; in coda resta sensibile alla cancellazione del run. */
        void awaitStart(CancellationToken token) throws InterruptedException {
            while (!started.await(START_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (future.isDone()) {
                    startedAt = System.nanoTime();
                    return;
                }
                token.throwIfCancelled();
            }
        }
    }

    /** Accumulatore mutabile, vive solo durante l'aggregazione. */
    private static final class Group {
        final NormalizedKey key;
        final String displayText;
        final int firstSeen;
        int occurrences = 1;
        double score;
        boolean failed;

        Group(NormalizedKey key, String displayText, int firstSeen) {
            this.key = key;
            this.displayText = displayText;
            this.firstSeen = firstSeen;
        }

        ScoredIssue toScoredIssue() {
            return new ScoredIssue(key, displayText, score, occurrences, firstSeen, failed);
        }
    }
}
