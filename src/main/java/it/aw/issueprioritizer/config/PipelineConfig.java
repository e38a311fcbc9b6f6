package it.aw.issueprioritizer.config;

import it.aw.issueprioritizer.export.CsvExporter;
import it.aw.issueprioritizer.model.FilterParams;
import it.aw.issueprioritizer.service.IssueAggregator;
import it.aw.issueprioritizer.service.RankingEngine;
import it.aw.issueprioritizer.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Componenti della pipeline di prioritizzazione.
 * <p>
 * I filtri predefiniti vengono validati qui: valori fuori dominio
 * in application.properties bloccano l'avvio.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Value("${prioritizer.filter.min-score:0.0}")
    private double minScore;

    @Value("${prioritizer.filter.min-occurrences:1}")
    private int minOccurrences;

    @Value("${prioritizer.scoring.parallelism:4}")
    private int parallelism;

    @Value("${prioritizer.scoring.timeout:10s}")
    private Duration timeout;

    @Value("${prioritizer.normalizer.punctuation:#{null}}")
    private String punctuation;

    @Bean
    public FilterParams defaultFilter() {
        FilterParams params = new FilterParams(minScore, minOccurrences);
        log.info("Filtri predefiniti: minScore={}, minOccurrences={}", params.minScore(), params.minOccurrences());
        return params;
    }

    @Bean
    public TextNormalizer textNormalizer() {
        return punctuation == null ? new TextNormalizer() : new TextNormalizer(punctuation);
    }

    /** Pool limitato per le chiamate di scoring, una per chiave distinta. */
    @Bean
    public ExecutorService scoringExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "scoring-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public IssueAggregator issueAggregator(TextNormalizer textNormalizer,
                                           @Qualifier("scoringExecutor") ExecutorService scoringExecutor) {
        log.info("Aggregatore: parallelism={}, timeout per chiamata={}", parallelism, timeout);
        return new IssueAggregator(textNormalizer, scoringExecutor, parallelism, timeout);
    }

    @Bean
    public RankingEngine rankingEngine() {
        return new RankingEngine();
    }

    @Bean
    public CsvExporter csvExporter() {
        return new CsvExporter();
    }
}
