package it.aw.issueprioritizer.service;

/**
 * Richiesta di un nuovo run mentre un altro è ancora in esecuzione.
 */
public class RunInProgressException extends RuntimeException {

    public RunInProgressException(String message) {
        super(message);
    }
}
