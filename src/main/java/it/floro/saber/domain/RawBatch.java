package it.floro.saber.domain;

import it.floro.saber.exception.MalformedInputException;

import java.util.List;

/**
 * Batch tabellare già letto da file: intestazione ordinata più righe di celle testuali.
 *
 * Il parsing del formato (separatori, encoding, scoperta dei file) avviene a monte;
 * qui arrivano solo tabelle, eventualmente con nomi di colonna eterogenei.
 */
public record RawBatch(
        String source,                      // Etichetta del batch (file, anno, periodo)
        List<String> columns,               // Intestazione nell'ordine originale
        List<List<String>> rows             // Celle; null o stringa vuota = valore mancante
) {

    public RawBatch {
        if (columns == null || columns.isEmpty()) {
            throw new MalformedInputException("Batch '" + source + "' senza intestazione");
        }
        columns = List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row == null || row.size() != columns.size()) {
                throw new MalformedInputException(String.format(
                        "Batch '%s', riga %d: attese %d celle, trovate %s",
                        source, i, columns.size(), row == null ? "null" : row.size()));
            }
        }
    }
}
