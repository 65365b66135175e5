package it.floro.saber.domain;

import java.util.Map;
import java.util.Optional;

/**
 * Una prova SABER sostenuta da uno studente, già in schema canonico.
 *
 * Immutabile: tutte le elaborazioni a valle ripartono da questi record.
 * Le mappe contengono solo valori presenti; un punteggio sentinella o illeggibile
 * semplicemente non compare in {@code scores}.
 */
public record StudentRecord(
        String recordId,                    // Identificativo della prova (ESTU_CONSECUTIVO o batch#riga)
        Map<String, String> fields,         // Identificativi, periodo/anno/grado, attributi categorici
        Map<String, Double> scores          // Materia canonica -> punteggio valido
) {

    public StudentRecord {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        scores = scores == null ? Map.of() : Map.copyOf(scores);
    }

    /**
     * Valore testuale di un campo canonico (identificativo, tempo o categorico).
     *
     * @return valore, oppure null se assente
     */
    public String field(String name) {
        if (CanonicalFields.RECORD_ID.equals(name)) return recordId;
        return fields.get(name);
    }

    public boolean has(String name) {
        return field(name) != null;
    }

    public Optional<Double> score(String subject) {
        return Optional.ofNullable(scores.get(subject));
    }

    public boolean hasScore(String subject) {
        return scores.containsKey(subject);
    }

    public String schoolId() {
        return fields.get(CanonicalFields.SCHOOL_ID);
    }

    public String municipality() {
        return fields.get(CanonicalFields.MUNICIPALITY);
    }

    public String department() {
        return fields.get(CanonicalFields.DEPARTMENT);
    }

    public Integer year() {
        String y = fields.get(CanonicalFields.YEAR);
        return y == null ? null : Integer.valueOf(y);
    }
}
