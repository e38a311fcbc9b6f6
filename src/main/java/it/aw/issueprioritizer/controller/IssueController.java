package it.aw.issueprioritizer.controller;

import it.aw.issueprioritizer.export.CsvExporter;
import it.aw.issueprioritizer.model.FilterParams;
import it.aw.issueprioritizer.model.IngestRequest;
import it.aw.issueprioritizer.model.IssueRecord;
import it.aw.issueprioritizer.model.IssueResultSet;
import it.aw.issueprioritizer.model.ModelInfo;
import it.aw.issueprioritizer.model.RunMetrics;
import it.aw.issueprioritizer.model.RunSummary;
import it.aw.issueprioritizer.service.PrioritizationService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Espone il run di prioritizzazione e le query sul risultato corrente.
 *
 * Endpoint disponibili:
 *   POST   /api/issues/runs              — esegue un run su un batch di righe
 *   DELETE /api/issues/runs/current      — cancella il run in corso (best-effort)
 *   GET    /api/issues                   — vista ordinata e filtrata
 *   GET    /api/issues/metrics           — metriche della vista (predefinita o filtrata)
 *   GET    /api/issues/run               — riepilogo dell'ultimo run
 *   GET    /api/issues/export            — vista filtrata in CSV
 *   GET    /api/issues/model             — modello e mappatura del punteggio
 *
 * Gli errori di dominio sono tradotti in risposta da {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/issues")
public class IssueController {

    private final PrioritizationService prioritizationService;
    private final CsvExporter csvExporter;

    public IssueController(PrioritizationService prioritizationService, CsvExporter csvExporter) {
        this.prioritizationService = prioritizationService;
        this.csvExporter = csvExporter;
    }

    // -------------------------------------------------------------------------
    // POST /api/issues/runs
    // -------------------------------------------------------------------------

    /**
     * Esegue un run sincrono e pubblica il risultato.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/issues/runs \
     *        -H "Content-Type: application/json" \
     *        -d '{"textField":"description","rows":[{"description":"Login fails"}],"maxRows":500}'
     */
    @PostMapping("/runs")
    public ResponseEntity<RunSummary> run(@RequestBody IngestRequest request) {
        List<IssueRecord> records = request.toRecords();
        return ResponseEntity.ok(prioritizationService.run(records));
    }

    // -------------------------------------------------------------------------
    // DELETE /api/issues/runs/current
    // -------------------------------------------------------------------------

    @DeleteMapping("/runs/current")
    public ResponseEntity<Void> cancel() {
        return prioritizationService.cancelActiveRun()
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // -------------------------------------------------------------------------
    // GET /api/issues?minScore=&minOccurrences=&q=&limit=
    // -------------------------------------------------------------------------

    /**
     * Vista ordinata dell'ultimo run. Senza parametri usa i filtri predefiniti.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/issues?minScore=0.5&minOccurrences=2&q=login&limit=20"
     */
    @GetMapping
    public ResponseEntity<IssueResultSet> list(
            @RequestParam(value = "minScore", required = false) Double minScore,
            @RequestParam(value = "minOccurrences", required = false) Integer minOccurrences,
            @RequestParam(value = "q", required = false) String search,
            @RequestParam(value = "limit", required = false) Integer limit) {
        FilterParams params = filterParams(minScore, minOccurrences);
        return ResponseEntity.ok(prioritizationService.query(params, search, limit));
    }

    /**
     * Metriche della vista. Senza parametri quelle della vista predefinita del run,
     * altrimenti quelle della vista filtrata con gli stessi parametri di GET /api/issues.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/issues/metrics?minScore=0.5&q=login"
     */
    @GetMapping("/metrics")
    public ResponseEntity<RunMetrics> metrics(
            @RequestParam(value = "minScore", required = false) Double minScore,
            @RequestParam(value = "minOccurrences", required = false) Integer minOccurrences,
            @RequestParam(value = "q", required = false) String search) {
        if (minScore == null && minOccurrences == null && search == null) {
            return ResponseEntity.ok(prioritizationService.metrics());
        }
        FilterParams params = filterParams(minScore, minOccurrences);
        return ResponseEntity.ok(prioritizationService.metrics(params, search));
    }

    @GetMapping("/run")
    public ResponseEntity<RunSummary> lastRun() {
        return ResponseEntity.ok(prioritizationService.lastRun());
    }

    // -------------------------------------------------------------------------
    // GET /api/issues/export
    // -------------------------------------------------------------------------

    /**
     * Scarica la vista filtrata come CSV (colonne: testo, punteggio, occorrenze).
     *
     * Esempio:
     *   curl -OJ "http://localhost:8889/api/issues/export?minScore=0.8"
     */
    @GetMapping("/export")
    public ResponseEntity<byte[]> export(
            @RequestParam(value = "minScore", required = false) Double minScore,
            @RequestParam(value = "minOccurrences", required = false) Integer minOccurrences,
            @RequestParam(value = "q", required = false) String search,
            @RequestParam(value = "limit", required = false) Integer limit) {
        FilterParams params = filterParams(minScore, minOccurrences);
        IssueResultSet resultSet = prioritizationService.query(params, search, limit);
        byte[] body = csvExporter.toCsv(resultSet).getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + csvExporter.filename(LocalDateTime.now()) + "\"")
                .contentType(CsvExporter.CONTENT_TYPE)
                .body(body);
    }

    @GetMapping("/model")
    public ResponseEntity<ModelInfo> model() {
        return ResponseEntity.ok(prioritizationService.modelInfo());
    }

    private FilterParams filterParams(Double minScore, Integer minOccurrences) {
        FilterParams defaults = prioritizationService.defaultFilter();
        return new FilterParams(
                minScore != null ? minScore : defaults.minScore(),
                minOccurrences != null ? minOccurrences : defaults.minOccurrences());
    }
}
