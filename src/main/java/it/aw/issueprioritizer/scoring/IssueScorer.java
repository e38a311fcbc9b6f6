package it.aw.issueprioritizer.scoring;

/**
 * Contratto del modello di priorità.
 * <p>
 * Per una versione fissa del modello lo stesso testo produce sempre lo stesso punteggio.
 * Le implementazioni devono tollerare chiamate concorrenti.
 */
public interface IssueScorer {

    /**
     * @param text testo normalizzato della segnalazione
     * @return punteggio di priorità in [0.0, 1.0]
     * @throws ScoringFailedException se il testo non può essere valutato
     */
    double score(String text);

    /** Identificativo del modello, fisso per la durata del processo. */
    String modelId();
}
