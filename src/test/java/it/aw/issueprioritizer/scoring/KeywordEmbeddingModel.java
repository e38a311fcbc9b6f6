package it.aw.issueprioritizer.scoring;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * EmbeddingModel deterministico a tre dimensioni: parole "urgenti", parole "di routine", bias.
 * Sostituisce AllMiniLM nei test senza scaricare pesi ONNX.
 */
class KeywordEmbeddingModel implements EmbeddingModel {

    private static final Set<String> URGENT = Set.of(
            "crash", "crashes", "fail", "fails", "down", "lose", "lost", "broken", "security",
            "error", "critical", "charged", "payment", "access", "vulnerability", "data");
    private static final Set<String> ROUTINE = Set.of(
            "color", "typo", "theme", "layout", "question", "cosmetic", "nice", "minor",
            "feature", "export", "settings", "misaligned", "button", "dark");

    private final List<String> seen = new ArrayList<>();

    @Override
    public synchronized Response<List<Embedding>> embedAll(List<TextSegment> segments) {
        List<Embedding> embeddings = new ArrayList<>(segments.size());
        for (TextSegment segment : segments) {
            seen.add(segment.text());
            if (segment.text().contains("boom")) {
                throw new IllegalStateException("inferenza esplosa");
            }
            embeddings.add(Embedding.from(vector(segment.text())));
        }
        return Response.from(embeddings);
    }

    synchronized List<String> seen() {
        return List.copyOf(seen);
    }

    private static float[] vector(String text) {
        float urgent = 0f;
        float routine = 0f;
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            if (URGENT.contains(word)) urgent++;
            if (ROUTINE.contains(word)) routine++;
        }
        return new float[]{urgent, routine, 0.1f};
    }
}
