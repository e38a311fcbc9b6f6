package it.aw.issueprioritizer.store;

import it.aw.issueprioritizer.model.Aggregation;
import it.aw.issueprioritizer.model.IssueResultSet;
import it.aw.issueprioritizer.model.RunMetrics;
import it.aw.issueprioritizer.model.RunSummary;

/**
 * Fotografia immutabile di un run completato: aggregato completo (per le query con
 * filtri diversi), vista predefinita già ordinata e riepilogo con metriche.
 */
public record RunSnapshot(Aggregation aggregation, IssueResultSet defaultView, RunSummary summary) {

    public static RunSnapshot empty() {
        return new RunSnapshot(Aggregation.empty(), IssueResultSet.empty(), RunSummary.none());
    }

    public RunMetrics metrics() {
        return summary.metrics();
    }
}
