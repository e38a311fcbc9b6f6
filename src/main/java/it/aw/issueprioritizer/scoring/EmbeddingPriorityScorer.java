package it.aw.issueprioritizer.scoring;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Classificatore zero-shot a due classi sopra un {@link EmbeddingModel} LangChain4j.
 * <p>
 * Per un testo t:
 * <pre>
 *   u = max cos(t, prototipi URGENT)
 *   r = max cos(t, prototipi ROUTINE)
 *   score = 1 / (1 + exp(-(u - r) / T))
 * </pre>
 * Gli embedding dei prototipi vengono calcolati una sola volta nel costruttore:
 * se il modello non risponde qui, l'adapter non nasce ({@link ModelUnavailableException}).
 * <p>
 * L'EmbeddingModel ONNX in-process supporta inferenze concorrenti, quindi
 * {@link #score(String)} non serializza le chiamate.
 */
public class EmbeddingPriorityScorer implements IssueScorer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingPriorityScorer.class);

    private final EmbeddingModel model;
    private final ScoringSettings settings;
    private final List<Embedding> urgentEmbeddings;
    private final List<Embedding> routineEmbeddings;

    public EmbeddingPriorityScorer(EmbeddingModel model, PriorityPrototypes prototypes, ScoringSettings settings) {
        this.model = model;
        this.settings = settings;
        try {
            this.urgentEmbeddings = embedAll(prototypes.urgent());
            this.routineEmbeddings = embedAll(prototypes.routine());
        } catch (RuntimeException e) {
            throw new ModelUnavailableException(
                    "Modello " + settings.modelId() + " non utilizzabile: " + e.getMessage(), e);
        }
        log.info("Scorer pronto: modello={}, prototipi URGENT={}, ROUTINE={}, T={}",
                settings.modelId(), urgentEmbeddings.size(), routineEmbeddings.size(), settings.temperature());
    }

    @Override
    public double score(String text) {
        if (text == null || text.isBlank()) {
            throw new ScoringFailedException("testo vuoto");
        }
        if (text.length() > settings.maxTextLength()) {
            throw new ScoringFailedException("testo troppo lungo: " + text.length()
                    + " caratteri (max " + settings.maxTextLength() + ")");
        }
        String input = text.length() > settings.maxInputChars()
                ? text.substring(0, settings.maxInputChars())
                : text;

        Embedding embedding;
        try {
            embedding = model.embed(input).content();
        } catch (RuntimeException e) {
            throw new ScoringFailedException("inferenza fallita: " + e.getMessage(), e);
        }

        double urgent = maxSimilarity(embedding, urgentEmbeddings);
        double routine = maxSimilarity(embedding, routineEmbeddings);
        double probability = 1.0 / (1.0 + Math.exp(-(urgent - routine) / settings.temperature()));
        if (Double.isNaN(probability)) {
            throw new ScoringFailedException("punteggio non definito (embedding degenere)");
        }
        return Math.min(1.0, Math.max(0.0, probability));
    }

    @Override
    public String modelId() {
        return settings.modelId();
    }

    private List<Embedding> embedAll(List<String> texts) {
        List<TextSegment> segments = texts.stream().map(TextSegment::from).collect(Collectors.toList());
        List<Embedding> embeddings = model.embedAll(segments).content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new IllegalStateException("il modello ha restituito "
                    + (embeddings == null ? 0 : embeddings.size()) + " embedding per " + texts.size() + " testi");
        }
        return List.copyOf(embeddings);
    }

    private static double maxSimilarity(Embedding embedding, List<Embedding> prototypes) {
        double best = Double.NEGATIVE_INFINITY;
        for (Embedding prototype : prototypes) {
            best = Math.max(best, CosineSimilarity.between(embedding, prototype));
        }
        return best;
    }
}
