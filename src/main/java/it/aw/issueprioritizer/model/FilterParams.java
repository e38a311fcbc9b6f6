package it.aw.issueprioritizer.model;

/**
 * Soglie applicate dal ranking: una segnalazione resta nel risultato se e solo se
 * {@code score >= minScore} e {@code occurrences >= minOccurrences}.
 */
public record FilterParams(double minScore, int minOccurrences) {

    public static final double DEFAULT_MIN_SCORE       = 0.0;
    public static final int    DEFAULT_MIN_OCCURRENCES = 1;

    /** Costruttore compatto con validazione. */
    public FilterParams {
        if (Double.isNaN(minScore) || minScore < 0.0 || minScore > 1.0) {
            throw new InvalidFilterParametersException(
                    "minScore deve essere in [0.0, 1.0] (ricevuto: " + minScore + ")");
        }
        if (minOccurrences < 1) {
            throw new InvalidFilterParametersException(
                    "minOccurrences deve essere >= 1 (ricevuto: " + minOccurrences + ")");
        }
    }

    public static FilterParams defaults() {
        return new FilterParams(DEFAULT_MIN_SCORE, DEFAULT_MIN_OCCURRENCES);
    }

    public boolean accepts(ScoredIssue issue) {
        return issue.score() >= minScore && issue.occurrences() >= minOccurrences;
    }
}
