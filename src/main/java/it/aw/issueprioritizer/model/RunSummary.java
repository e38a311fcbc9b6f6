package it.aw.issueprioritizer.model;

import java.time.LocalDateTime;

/**
 * Riepilogo dell'ultimo run pubblicato.
 * Prima del primo run i campi identificativi sono null e le metriche a zero.
 */
public record RunSummary(
        String        runId,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        String        modelId,
        int           totalRecords,
        int           emptyRecords,
        int           uniqueIssues,      // chiavi distinte non vuote, prima del filtro
        int           failedScorings,    // chiavi con punteggio di ripiego
        RunMetrics    metrics            // metriche della vista predefinita
) {

    public static RunSummary none() {
        return new RunSummary(null, null, null, null, 0, 0, 0, 0, RunMetrics.empty());
    }
}
