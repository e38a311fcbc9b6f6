package it.aw.issueprioritizer.model;

import java.util.List;
import java.util.Optional;

/**
 * Esito della fase di aggregazione, prima del ranking.
 *
 * @param issues       segnalazioni uniche non vuote, in ordine di prima apparizione
 * @param emptyGroup   gruppo dei record vuoti (score 0.0, escluso dalla vista predefinita)
 * @param totalRecords record grezzi ricevuti, vuoti compresi
 */
public record Aggregation(List<ScoredIssue> issues, Optional<ScoredIssue> emptyGroup, int totalRecords) {

    public Aggregation {
        issues = List.copyOf(issues);
    }

    public static Aggregation empty() {
        return new Aggregation(List.of(), Optional.empty(), 0);
    }

    public int emptyRecords() {
        return emptyGroup.map(ScoredIssue::occurrences).orElse(0);
    }

    public int failedScorings() {
        return (int) issues.stream().filter(ScoredIssue::scoringFailed).count();
    }
}
