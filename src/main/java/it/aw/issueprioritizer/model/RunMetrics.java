package it.aw.issueprioritizer.model;

/**
 * Metriche derivate dal risultato di un run, mai memorizzate separatamente dal run stesso.
 * Con risultato vuoto maxScore e avgScore valgono 0.0 per convenzione.
 */
public record RunMetrics(
        int    uniqueCount,
        int    totalRecords,   // record grezzi ingeriti, vuoti compresi
        double maxScore,
        double avgScore
) {

    public static RunMetrics empty() {
        return new RunMetrics(0, 0, 0.0, 0.0);
    }

    public static RunMetrics of(IssueResultSet resultSet, int totalRecords) {
        if (resultSet.isEmpty()) {
            return new RunMetrics(0, totalRecords, 0.0, 0.0);
        }
        double max = 0.0;
        double sum = 0.0;
        for (ScoredIssue issue : resultSet.issues()) {
            max = Math.max(max, issue.score());
            sum += issue.score();
        }
        return new RunMetrics(resultSet.size(), totalRecords, max, sum / resultSet.size());
    }
}
