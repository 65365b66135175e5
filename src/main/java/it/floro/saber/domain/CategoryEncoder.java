package it.floro.saber.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Codifica ordinale delle variabili categoriche di un singolo fit.
 *
 * Le categorie di ogni campo sono ordinate alfabeticamente e numerate da 0.
 * L'encoder viaggia insieme al modello che lo ha prodotto: ogni previsione derivata
 * da quel fit usa questa mappa, mai una ricostruita altrove.
 */
public final class CategoryEncoder {

    private final List<String> fields;
    private final Map<String, Map<String, Integer>> codes;

    private CategoryEncoder(List<String> fields, Map<String, Map<String, Integer>> codes) {
        this.fields = List.copyOf(fields);
        this.codes = codes;
    }

    /**
     * Costruisce l'encoder dalle categorie osservate nei record.
     * I record devono avere un valore per ogni campo.
     */
    public static CategoryEncoder fit(List<StudentRecord> records, List<String> fields) {
        Map<String, Map<String, Integer>> codes = new LinkedHashMap<>();
        for (String f : fields) {
            TreeSet<String> seen = new TreeSet<>();
            for (StudentRecord r : records) {
                seen.add(Objects.requireNonNull(r.field(f), () -> "valore mancante per " + f));
            }
            Map<String, Integer> m = new LinkedHashMap<>();
            int i = 0;
            for (String v : seen) {
                m.put(v, i++);
            }
            codes.put(f, Map.copyOf(m));
        }
        return new CategoryEncoder(fields, Map.copyOf(codes));
    }

    public List<String> fields() {
        return fields;
    }

    public int code(String field, String value) {
        Map<String, Integer> m = codes.get(field);
        if (m == null) {
            throw new IllegalArgumentException("Campo non codificato: " + field);
        }
        Integer c = m.get(value);
        if (c == null) {
            throw new IllegalArgumentException("Categoria sconosciuta per " + field + ": " + value);
        }
        return c;
    }

    /** Vettore numerico del record, nell'ordine di {@link #fields()}. */
    public double[] encode(StudentRecord r) {
        double[] x = new double[fields.size()];
        for (int j = 0; j < fields.size(); j++) {
            x[j] = code(fields.get(j), r.field(fields.get(j)));
        }
        return x;
    }

    /** Categorie di ogni campo nell'ordine dei codici. */
    public Map<String, List<String>> categories() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String f : fields) {
            List<String> ordered = new ArrayList<>(codes.get(f).size());
            codes.get(f).entrySet().stream()
                    .sorted(Map.Entry.comparingByValue())
                    .forEach(e -> ordered.add(e.getKey()));
            out.put(f, List.copyOf(ordered));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CategoryEncoder other = (CategoryEncoder) o;
        return fields.equals(other.fields) && codes.equals(other.codes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, codes);
    }

    @Override
    public String toString() {
        return "CategoryEncoder" + categories();
    }
}
