package it.aw.issueprioritizer.service;

/**
 * Run interrotto su richiesta prima del completamento. Nessun risultato viene pubblicato.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message) {
        super(message);
    }
}
