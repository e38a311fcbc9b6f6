package it.aw.issueprioritizer.config;

import dev.langchain4j.model.embedding.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import it.aw.issueprioritizer.scoring.EmbeddingPriorityScorer;
import it.aw.issueprioritizer.scoring.PriorityPrototypes;
import it.aw.issueprioritizer.scoring.ScoringModelHolder;
import it.aw.issueprioritizer.scoring.ScoringSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configura il modello di scoring.
 *
 * EmbeddingModel: AllMiniLM-L6-v2 quantizzato — gira in locale, senza API key.
 *                 Non viene istanziato all'avvio: lo crea lo ScoringModelHolder
 *                 al primo run e lo tiene fino allo shutdown (EngineLifecycle).
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${prioritizer.model.id:" + ScoringSettings.DEFAULT_MODEL_ID + "}")
    private String modelId;

    @Value("${prioritizer.model.temperature:" + ScoringSettings.DEFAULT_TEMPERATURE + "}")
    private double temperature;

    @Value("${prioritizer.model.max-input-chars:" + ScoringSettings.DEFAULT_MAX_INPUT + "}")
    private int maxInputChars;

    @Value("${prioritizer.model.max-text-length:" + ScoringSettings.DEFAULT_MAX_TEXT + "}")
    private int maxTextLength;

    @Bean
    public ScoringSettings scoringSettings() {
        return new ScoringSettings(modelId, temperature, maxInputChars, maxTextLength);
    }

    @Bean
    public ScoringModelHolder scoringModelHolder(ScoringSettings settings) {
        PriorityPrototypes prototypes = PriorityPrototypes.defaults();
        return new ScoringModelHolder(() -> {
            log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
            EmbeddingModel model = new AllMiniLmL6V2QuantizedEmbeddingModel();
            return new EmbeddingPriorityScorer(model, prototypes, settings);
        }, settings.modelId());
    }
}
