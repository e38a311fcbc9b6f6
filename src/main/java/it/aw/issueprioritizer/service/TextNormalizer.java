package it.aw.issueprioritizer.service;

import it.aw.issueprioritizer.model.NormalizedKey;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Riduce il testo di una segnalazione alla sua chiave di raggruppamento:
 * minuscolo, rimozione dei caratteri di punteggiatura configurati,
 * spazi consecutivi ridotti a uno, trim.
 * <p>
 * Funzione pura, non lancia eccezioni: null, stringa vuota o solo spazi/punteggiatura
 * producono {@link NormalizedKey#EMPTY}.
 */
public class TextNormalizer {

    /** Punteggiatura ASCII. */
    public static final String DEFAULT_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String punctuation;

    public TextNormalizer() {
        this(DEFAULT_PUNCTUATION);
    }

    public TextNormalizer(String punctuation) {
        this.punctuation = punctuation == null ? "" : punctuation;
    }

    public NormalizedKey normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) return NormalizedKey.EMPTY;

        String lower = rawText.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (punctuation.indexOf(c) < 0) sb.append(c);
        }
        String collapsed = WHITESPACE.matcher(sb).replaceAll(" ").trim();
        return collapsed.isEmpty() ? NormalizedKey.EMPTY : new NormalizedKey(collapsed);
    }
}
