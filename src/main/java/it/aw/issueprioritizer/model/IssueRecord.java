package it.aw.issueprioritizer.model;

/**
 * Singola segnalazione grezza ricevuta in ingresso.
 * Vive solo fino alla normalizzazione: l'aggregatore ne conserva il testo
 * (come displayText del primo record di ogni gruppo) e la posizione.
 */
public record IssueRecord(
        String rawText,     // testo libero della segnalazione (null ammesso: vale come vuoto)
        int    sourceRow    // posizione 0-based nella sequenza di ingresso
) {}
