package it.aw.issueprioritizer.scoring;

import java.util.List;

/**
 * Frasi prototipo delle due classi usate dalla classificazione zero-shot.
 * Il punteggio di una segnalazione è la confidenza della classe URGENT.
 */
public record PriorityPrototypes(List<String> urgent, List<String> routine) {

    public static final String SCORED_LABEL = "URGENT";

    public PriorityPrototypes {
        if (urgent == null || urgent.isEmpty() || routine == null || routine.isEmpty()) {
            throw new IllegalArgumentException("servono prototipi per entrambe le classi");
        }
        urgent = List.copyOf(urgent);
        routine = List.copyOf(routine);
    }

    public static PriorityPrototypes defaults() {
        return new PriorityPrototypes(
                List.of(
                        "the application crashes and users lose their data",
                        "login fails and nobody can access the system",
                        "payment is broken and customers are charged twice",
                        "critical security vulnerability exposes personal data",
                        "the service is down in production",
                        "error on save, all changes are lost"),
                List.of(
                        "it would be nice to change the color of the button",
                        "minor typo in the help page",
                        "feature request for a dark theme",
                        "the layout looks slightly misaligned on one screen",
                        "question about how to export a report",
                        "small cosmetic improvement to the settings page"));
    }
}
