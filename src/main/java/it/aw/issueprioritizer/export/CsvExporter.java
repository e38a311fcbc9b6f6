package it.aw.issueprioritizer.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import it.aw.issueprioritizer.model.IssueResultSet;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializza un {@link IssueResultSet} in CSV, una riga per segnalazione, nello stesso ordine.
 * Colonne fisse: testo, punteggio, occorrenze. Nessuna logica di aggregazione.
 */
public class CsvExporter {

    public static final MediaType CONTENT_TYPE = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectWriter writer;

    public CsvExporter() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS)
                .build();
        CsvSchema schema = mapper.schemaFor(CsvRow.class).withHeader();
        this.writer = mapper.writer(schema);
    }

    public String toCsv(IssueResultSet resultSet) {
        List<CsvRow> rows = resultSet.issues().stream()
                .map(i -> new CsvRow(i.displayText(), i.score(), i.occurrences()))
                .collect(Collectors.toList());
        try {
            return writer.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Errore serializzazione CSV", e);
        }
    }

    public String filename(LocalDateTime timestamp) {
        return "issues_prioritized_" + FILE_TS.format(timestamp) + ".csv";
    }

    @JsonPropertyOrder({"issue text", "priority score", "occurrence count"})
    static final class CsvRow {
        @JsonProperty("issue text")       public final String text;
        @JsonProperty("priority score")   public final double score;
        @JsonProperty("occurrence count") public final int    occurrences;

        CsvRow(String text, double score, int occurrences) {
            this.text = text;
            this.score = score;
            this.occurrences = occurrences;
        }
    }
}
