package it.floro.saber.service;

import it.floro.saber.domain.CanonicalFields;
import it.floro.saber.domain.StudentRecord;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Componente centralizzato per i filtri geografici e temporali sui record SABER.
 *
 * Responsabilità:
 * - Normalizzazione dei parametri di filtro ricevuti dalle richieste HTTP
 * - Confronto case- e accent-insensitive di etichette (dipartimento, municipio, area...)
 * - Generazione di Predicate su {@link StudentRecord}
 * - Estrazione dei valori disponibili per popolare i filtri (dipartimenti, municipi, anni)
 *
 * Gli stadi di calcolo ricevono sempre la lista già filtrata: filtrare è compito del chiamante.
 */
@Component
public class RecordFilters {

    /**
     * Parametri di filtro normalizzati. Un campo null significa "nessun filtro".
     */
    public record FilterParams(
            String department,
            String municipality,
            Integer year,
            String area,            // Es. "URBANO", "RURAL"
            String schoolType       // Es. "OFICIAL", "NO OFICIAL"
    ) {
        public static FilterParams none() {
            return new FilterParams(null, null, null, null, null);
        }
    }

    /**
     * Costruisce i parametri da valori grezzi di richiesta (trim + blank a null).
     */
    public FilterParams fromRequest(String department, String municipality, Integer year,
                                    String area, String schoolType) {
        return new FilterParams(blankToNull(department), blankToNull(municipality), year,
                blankToNull(area), blankToNull(schoolType));
    }

    /**
     * Predicate che applica tutti i filtri valorizzati.
     * Un record privo del campo filtrato non passa il filtro.
     */
    public Predicate<StudentRecord> predicate(FilterParams p) {
        // Normalizza i valori di filtro una sola volta
        final String deptNorm = normalizeLabel(p.department());
        final String mcpioNorm = normalizeLabel(p.municipality());
        final String areaNorm = normalizeLabel(p.area());
        final String typeNorm = normalizeLabel(p.schoolType());
        final Integer year = p.year();

        return r -> {
            if (r == null) return false;

            // ===== FILTRO 1: DIPARTIMENTO =====
            if (deptNorm != null && !deptNorm.equals(normalizeLabel(r.department()))) return false;

            // ===== FILTRO 2: MUNICIPIO =====
            if (mcpioNorm != null && !mcpioNorm.equals(normalizeLabel(r.municipality()))) return false;

            // ===== FILTRO 3: ANNO =====
            if (year != null && !year.equals(r.year())) return false;

            // ===== FILTRO 4: AREA E NATURALEZA =====
            if (areaNorm != null && !areaNorm.equals(normalizeLabel(r.field(CanonicalFields.AREA)))) return false;
            if (typeNorm != null && !typeNorm.equals(normalizeLabel(r.field(CanonicalFields.SCHOOL_TYPE)))) {
                return false;
            }
            return true;
        };
    }

    public List<StudentRecord> apply(List<StudentRecord> all, FilterParams p) {
        return all.stream().filter(predicate(p)).toList();
    }

    /**
     * Dipartimenti presenti, deduplicati e ordinati alfabeticamente (accent-insensitive).
     */
    public List<String> departmentsFrom(List<StudentRecord> all) {
        return all.stream()
                .map(StudentRecord::department)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(alphaInsensitive())
                .collect(Collectors.toList());
    }

    /**
     * Municipi presenti, opzionalmente ristretti a un dipartimento.
     *
     * @param department dipartimento, null per tutti
     */
    public List<String> municipalitiesFrom(List<StudentRecord> all, String department) {
        String deptNorm = normalizeLabel(blankToNull(department));
        return all.stream()
                .filter(r -> deptNorm == null || deptNorm.equals(normalizeLabel(r.department())))
                .map(StudentRecord::municipality)
                .filter(Objects::nonNull)
                .distinct()
                .sorted(alphaInsensitive())
                .collect(Collectors.toList());
    }

    public List<Integer> yearsFrom(List<StudentRecord> all) {
        return all.stream()
                .map(StudentRecord::year)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Normalizza un'etichetta per confronti case- e accent-insensitive.
     *
     * Esempi:
     * - "BOGOTÁ D.C." → "bogota d c"
     * - "Área Rural" → "area rural"
     *
     * @return etichetta normalizzata, o null se s è null
     */
    public static String normalizeLabel(String s) {
        if (s == null) return null;

        // Decomposizione Unicode (NFD) + rimozione diacritici
        String n = Normalizer.normalize(s, Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toLowerCase();

        // Solo a-z, 0-9 e spazi singoli
        return n.replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    // ========= METODI UTILITY PRIVATI =========

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static Comparator<String> alphaInsensitive() {
        return Comparator.comparing(s -> normalizeLabel(Objects.toString(s, "")));
    }
}
