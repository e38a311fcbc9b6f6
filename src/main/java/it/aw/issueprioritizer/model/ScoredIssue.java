package it.aw.issueprioritizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Una segnalazione unica dopo la deduplicazione: una per {@link NormalizedKey}.
 * <p>
 * {@code firstSeen} è la posizione del primo record del gruppo nella sequenza
 * di ingresso ed è l'ultimo criterio di ordinamento del ranking.
 * {@code scoringFailed} indica che il modello non ha prodotto un punteggio
 * per questa chiave e che {@code score} è il valore di ripiego 0.0.
 */
public record ScoredIssue(
        NormalizedKey key,
        String        displayText,    // testo del primo record visto per la chiave
        double        score,          // priorità in [0.0, 1.0]
        int           occurrences,    // record grezzi confluiti nel gruppo (>= 1)
        int           firstSeen,
        boolean       scoringFailed
) {

    public ScoredIssue {
        if (occurrences < 1) {
            throw new IllegalArgumentException("occurrences deve essere >= 1 (ricevuto: " + occurrences + ")");
        }
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score fuori da [0, 1]: " + score);
        }
    }

    @JsonProperty("priorityLevel")
    public PriorityLevel priorityLevel() {
        return PriorityLevel.of(score);
    }
}
