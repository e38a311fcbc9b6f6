package it.aw.issueprioritizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Sequenza ordinata e in sola lettura di segnalazioni: score decrescente,
 * poi occorrenze decrescenti, poi ordine di prima apparizione.
 * Viene costruita una volta per run e sostituita per intero al run successivo.
 */
public record IssueResultSet(List<ScoredIssue> issues) {

    public IssueResultSet {
        issues = List.copyOf(issues);
    }

    public static IssueResultSet empty() {
        return new IssueResultSet(List.of());
    }

    public int size() {
        return issues.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return issues.isEmpty();
    }

    public int totalOccurrences() {
        return issues.stream().mapToInt(ScoredIssue::occurrences).sum();
    }
}
