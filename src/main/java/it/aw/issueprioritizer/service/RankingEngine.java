package it.aw.issueprioritizer.service;

import it.aw.issueprioritizer.model.FilterParams;
import it.aw.issueprioritizer.model.IssueResultSet;
import it.aw.issueprioritizer.model.ScoredIssue;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Filtra e ordina le segnalazioni aggregate.
 * Ordine: score decrescente, occorrenze decrescenti, prima apparizione crescente.
 * L'ultimo criterio rende l'ordine totale e quindi riproducibile.
 */
public class RankingEngine {

    public static final Comparator<ScoredIssue> RANKING =
            Comparator.comparingDouble(ScoredIssue::score).reversed()
                    .thenComparing(Comparator.comparingInt(ScoredIssue::occurrences).reversed())
                    .thenComparingInt(ScoredIssue::firstSeen);

    /**
     * @throws it.aw.issueprioritizer.model.InvalidFilterParametersException
     *         se minScore non è in [0, 1] o minOccurrences è minore di 1
     */
    public IssueResultSet rankAndFilter(List<ScoredIssue> issues, double minScore, int minOccurrences) {
        return rankAndFilter(issues, new FilterParams(minScore, minOccurrences));
    }

    public IssueResultSet rankAndFilter(List<ScoredIssue> issues, FilterParams params) {
        return new IssueResultSet(issues.stream()
                .filter(params::accepts)
                .sorted(RANKING)
                .collect(Collectors.toList()));
    }
}
