package it.aw.issueprioritizer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Forma canonica del testo di una segnalazione, usata come chiave di raggruppamento.
 * Due record con la stessa chiave sono considerati la stessa segnalazione.
 * <p>
 * Il testo vuoto (o composto solo da spazi e punteggiatura) produce sempre
 * {@link #EMPTY}, che non viene mai inviato al modello.
 */
public record NormalizedKey(@JsonValue String value) {

    public static final NormalizedKey EMPTY = new NormalizedKey("");

    public NormalizedKey {
        Objects.requireNonNull(value, "value");
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }
}
