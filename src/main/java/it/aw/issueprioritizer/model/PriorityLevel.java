package it.aw.issueprioritizer.model;

/**
 * Fascia di priorità derivata dal punteggio del modello.
 */
public enum PriorityLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static final double HIGH_THRESHOLD   = 0.8;
    public static final double MEDIUM_THRESHOLD = 0.5;

    public static PriorityLevel of(double score) {
        if (score >= HIGH_THRESHOLD) return HIGH;
        if (score >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}
