package it.aw.issueprioritizer.controller;

import it.aw.issueprioritizer.model.InvalidFilterParametersException;
import it.aw.issueprioritizer.scoring.ModelUnavailableException;
import it.aw.issueprioritizer.service.RunCancelledException;
import it.aw.issueprioritizer.service.RunInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

/**
 * Traduce le eccezioni di dominio in risposte JSON {timestamp, error, message}.
 * Filtri e input non validi → 400, modello non disponibile → 503,
 * run cancellato o già in corso → 409, tutto il resto → 500 (loggato).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidFilterParametersException.class)
    public ResponseEntity<Map<String, Object>> invalidFilter(InvalidFilterParametersException ex) {
        return body(HttpStatus.BAD_REQUEST, "invalid_filter_parameters", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", "richiesta non valida");
    }

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<Map<String, Object>> modelUnavailable(ModelUnavailableException ex) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, "model_unavailable", ex.getMessage());
    }

    @ExceptionHandler(RunCancelledException.class)
    public ResponseEntity<Map<String, Object>> cancelled(RunCancelledException ex) {
        return body(HttpStatus.CONFLICT, "run_cancelled", ex.getMessage());
    }

    @ExceptionHandler(RunInProgressException.class)
    public ResponseEntity<Map<String, Object>> conflict(RunInProgressException ex) {
        return body(HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> internal(Exception ex) {
        log.error("Errore non gestito", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                ex.getMessage() == null ? "unexpected error" : ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
