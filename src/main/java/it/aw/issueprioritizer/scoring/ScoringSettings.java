package it.aw.issueprioritizer.scoring;

/**
 * Parametri del classificatore basato su embedding.
 */
public record ScoringSettings(
        String modelId,
        double temperature,     // più bassa = separazione più netta tra le classi
        int    maxInputChars,   // oltre questa lunghezza il testo viene troncato prima dell'inferenza
        int    maxTextLength    // oltre questa lunghezza il testo viene rifiutato
) {

    public static final String DEFAULT_MODEL_ID      = "all-minilm-l6-v2-q";
    public static final double DEFAULT_TEMPERATURE   = 0.05;
    public static final int    DEFAULT_MAX_INPUT     = 512;
    public static final int    DEFAULT_MAX_TEXT      = 10_000;

    public ScoringSettings {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId è obbligatorio");
        }
        if (!(temperature > 0.0)) {
            throw new IllegalArgumentException("temperature deve essere > 0 (ricevuto: " + temperature + ")");
        }
        if (maxInputChars < 1) {
            throw new IllegalArgumentException("maxInputChars deve essere >= 1 (ricevuto: " + maxInputChars + ")");
        }
        if (maxTextLength < maxInputChars) {
            throw new IllegalArgumentException(
                    "maxTextLength (" + maxTextLength + ") deve essere >= maxInputChars (" + maxInputChars + ")");
        }
    }

    public static ScoringSettings defaults() {
        return new ScoringSettings(DEFAULT_MODEL_ID, DEFAULT_TEMPERATURE, DEFAULT_MAX_INPUT, DEFAULT_MAX_TEXT);
    }
}
