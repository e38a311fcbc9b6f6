package it.aw.issueprioritizer.model;

/**
 * Informazioni sul modello di scoring e sulla mappatura etichetta → punteggio.
 */
public record ModelInfo(
        String  modelId,
        String  scoredLabel,       // classe la cui confidenza diventa il punteggio
        double  temperature,
        int     maxInputChars,
        double  highThreshold,
        double  mediumThreshold,
        boolean loaded
) {}
