package it.aw.issueprioritizer.scoring;

/**
 * Il modello di scoring non può essere caricato (pesi mancanti, runtime nativo
 * incompatibile, ...). Fatale per il run: nessun risultato viene pubblicato.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
