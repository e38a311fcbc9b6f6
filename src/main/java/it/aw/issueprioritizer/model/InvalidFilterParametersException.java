package it.aw.issueprioritizer.model;

/**
 * Parametri di filtro fuori dominio. Non viene mai applicato un clamp silenzioso.
 */
public class InvalidFilterParametersException extends IllegalArgumentException {

    public InvalidFilterParametersException(String message) {
        super(message);
    }
}
