package it.floro.saber.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tupla di valori dei campi di raggruppamento.
 *
 * L'ordinamento naturale confronta i valori posizione per posizione, così le tabelle
 * aggregate escono sempre nello stesso ordine.
 */
public record GroupKey(List<String> fields, List<String> values) implements Comparable<GroupKey> {

    private static final Comparator<List<String>> LEXICOGRAPHIC = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    public GroupKey {
        fields = List.copyOf(fields);
        values = List.copyOf(values);
        if (fields.size() != values.size()) {
            throw new IllegalArgumentException("Campi e valori di lunghezza diversa: " + fields + " / " + values);
        }
    }

    /**
     * Chiave del record per i campi dati.
     *
     * @return chiave, oppure null se almeno un campo manca nel record
     */
    public static GroupKey of(StudentRecord r, List<String> fields) {
        List<String> values = new ArrayList<>(fields.size());
        for (String f : fields) {
            String v = r.field(f);
            if (v == null) return null;
            values.add(v);
        }
        return new GroupKey(fields, values);
    }

    public String value(String field) {
        int i = fields.indexOf(field);
        return i < 0 ? null : values.get(i);
    }

    /**
     * La stessa chiave senza un campo (usato per accoppiare anni diversi della stessa entità).
     */
    public GroupKey without(String field) {
        int i = fields.indexOf(field);
        if (i < 0) return this;
        List<String> f = new ArrayList<>(fields);
        List<String> v = new ArrayList<>(values);
        f.remove(i);
        v.remove(i);
        return new GroupKey(f, v);
    }

    /** Etichetta leggibile; la chiave vuota del livello nazionale diventa "NACIONAL". */
    public String label() {
        return values.isEmpty() ? "NACIONAL" : String.join(" | ", values);
    }

    @Override
    public int compareTo(GroupKey o) {
        return LEXICOGRAPHIC.compare(values, o.values);
    }
}
