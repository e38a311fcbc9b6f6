package it.aw.issueprioritizer.scoring;

/**
 * Errore di scoring limitato a un singolo testo. Non interrompe il batch:
 * l'aggregatore assegna il punteggio di ripiego e marca la segnalazione.
 */
public class ScoringFailedException extends RuntimeException {

    public ScoringFailedException(String message) {
        super(message);
    }

    public ScoringFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
