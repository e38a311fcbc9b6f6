package it.aw.issueprioritizer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Batch di righe da prioritizzare.
 * <p>
 * Ogni riga è un oggetto con colonne arbitrarie; {@code textField} indica la colonna
 * che contiene il testo della segnalazione. {@code maxRows}, se presente, limita
 * il run alle prime N righe.
 */
public record IngestRequest(
        String                    textField,
        List<Map<String, Object>> rows,
        Integer                   maxRows
) {

    /**
     * Valida la richiesta e la converte in record ordinati.
     * Una riga senza la colonna di testo (o con valore null) diventa un record vuoto.
     *
     * @throws IllegalArgumentException se textField, rows o maxRows non sono validi
     */
    public List<IssueRecord> toRecords() {
        if (textField == null || textField.isBlank()) {
            throw new IllegalArgumentException("textField è obbligatorio");
        }
        if (rows == null) {
            throw new IllegalArgumentException("rows è obbligatorio");
        }
        if (maxRows != null && maxRows < 1) {
            throw new IllegalArgumentException("maxRows deve essere >= 1 (ricevuto: " + maxRows + ")");
        }
        int limit = maxRows == null ? rows.size() : Math.min(maxRows, rows.size());
        List<IssueRecord> records = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Map<String, Object> row = rows.get(i);
            Object value = row == null ? null : row.get(textField);
            records.add(new IssueRecord(value == null ? null : String.valueOf(value), i));
        }
        return records;
    }
}
