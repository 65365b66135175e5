package it.floro.saber.domain;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Vocabolario canonico dei record SABER 11.
 *
 * Tutti i nomi di colonna in ingresso vengono ricondotti a una di queste costanti:
 * il confronto ignora maiuscole, accenti, spazi e trattini, per cui
 * "punt_matematicas", "PUNT_MATEMATICAS" e "Punt Matemáticas" coincidono.
 */
public final class CanonicalFields {

    // ========================================================================
    // IDENTIFICATIVI
    // ========================================================================

    public static final String RECORD_ID = "ESTU_CONSECUTIVO";
    public static final String SCHOOL_ID = "COLE_COD_DANE_ESTABLECIMIENTO";
    public static final String SCHOOL_NAME = "COLE_NOMBRE_ESTABLECIMIENTO";
    public static final String MUNICIPALITY_CODE = "COLE_COD_MCPIO_UBICACION";
    public static final String MUNICIPALITY = "COLE_MCPIO_UBICACION";
    public static final String DEPARTMENT = "COLE_DEPTO_UBICACION";

    // ========================================================================
    // TEMPO E GRADO
    // ========================================================================

    public static final String PERIOD = "PERIODO";
    public static final String YEAR = "YEAR";
    public static final String GRADE = "GRADO";

    // ========================================================================
    // MATERIE (PUNTEGGI)
    // ========================================================================

    public static final String CRITICAL_READING = "PUNT_LECTURA_CRITICA";
    public static final String MATH = "PUNT_MATEMATICAS";
    public static final String NATURAL_SCIENCES = "PUNT_C_NATURALES";
    public static final String SOCIAL_CIVICS = "PUNT_SOCIALES_CIUDADANAS";
    public static final String ENGLISH = "PUNT_INGLES";
    public static final String GLOBAL = "PUNT_GLOBAL";

    // ========================================================================
    // ATTRIBUTI CATEGORICI
    // ========================================================================

    public static final String SCHOOL_TYPE = "COLE_NATURALEZA";
    public static final String AREA = "COLE_AREA_UBICACION";
    public static final String SCHOOL_GENDER = "COLE_GENERO";
    public static final String SCHOOL_CHARACTER = "COLE_CARACTER";
    public static final String STRATUM = "FAMI_ESTRATOVIVIENDA";
    public static final String MOTHER_EDUCATION = "FAMI_EDUCACIONMADRE";
    public static final String FATHER_EDUCATION = "FAMI_EDUCACIONPADRE";
    public static final String HAS_INTERNET = "FAMI_TIENEINTERNET";
    public static final String HAS_COMPUTER = "FAMI_TIENECOMPUTADOR";
    public static final String STUDENT_GENDER = "ESTU_GENERO";
    public static final String ETHNICITY = "ESTU_ETNIA";

    public static final List<String> IDENTIFIERS = List.of(
            RECORD_ID, SCHOOL_ID, SCHOOL_NAME, MUNICIPALITY_CODE, MUNICIPALITY, DEPARTMENT);

    public static final List<String> TIME_FIELDS = List.of(PERIOD, YEAR, GRADE);

    public static final List<String> SUBJECTS = List.of(
            CRITICAL_READING, MATH, NATURAL_SCIENCES, SOCIAL_CIVICS, ENGLISH, GLOBAL);

    /** Le cinque prove su scala 0-100; il punteggio globale (0-500) ne è escluso. */
    public static final List<String> TEST_AREAS = List.of(
            CRITICAL_READING, MATH, NATURAL_SCIENCES, SOCIAL_CIVICS, ENGLISH);

    public static final List<String> CATEGORICAL = List.of(
            SCHOOL_TYPE, AREA, SCHOOL_GENDER, SCHOOL_CHARACTER, STRATUM,
            MOTHER_EDUCATION, FATHER_EDUCATION, HAS_INTERNET, HAS_COMPUTER,
            STUDENT_GENDER, ETHNICITY);

    /**
     * Nomi alternativi osservati nei file storici, già in forma normalizzata.
     */
    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("ANO", YEAR),
            Map.entry("ANIO", YEAR),
            Map.entry("PERIOD", PERIOD),
            Map.entry("GRADE", GRADE),
            Map.entry("CODIGO", SCHOOL_ID),
            Map.entry("COLE_CODIGO_ICFES", SCHOOL_ID),
            Map.entry("COLE_MCPIO", MUNICIPALITY),
            Map.entry("COLE_DEPTO", DEPARTMENT),
            Map.entry("PUNT_LENGUAJE", CRITICAL_READING),
            Map.entry("PUNT_CIENCIAS_NATURALES", NATURAL_SCIENCES),
            Map.entry("PUNT_SOCIALES", SOCIAL_CIVICS),
            Map.entry("ESTU_ETNICO", ETHNICITY)
    );

    private static final Map<String, String> CANONICAL = buildCanonical();

    private CanonicalFields() {
    }

    /**
     * Riconduce un nome di colonna grezzo al nome canonico.
     *
     * @param rawColumn nome come appare nell'intestazione del batch
     * @return nome canonico, vuoto se la colonna non appartiene al vocabolario
     */
    public static Optional<String> resolve(String rawColumn) {
        if (rawColumn == null) return Optional.empty();
        String key = normalizeName(rawColumn);
        String hit = CANONICAL.get(key);
        if (hit == null) hit = ALIASES.get(key);
        return Optional.ofNullable(hit);
    }

    /**
     * Vero se il nome grezzo coincide con un nome canonico (non con un alias).
     */
    public static boolean isCanonicalName(String rawColumn) {
        return rawColumn != null && CANONICAL.containsKey(normalizeName(rawColumn));
    }

    public static boolean isKnown(String field) {
        return CANONICAL.containsKey(field);
    }

    public static boolean isSubject(String field) {
        return SUBJECTS.contains(field);
    }

    /**
     * Forma di confronto dei nomi colonna: senza diacritici, maiuscola,
     * separatori ridotti a underscore.
     */
    static String normalizeName(String s) {
        String n = Normalizer.normalize(s.trim(), Normalizer.Form.NFD)
                .replaceAll("\\p{M}+", "")
                .toUpperCase();
        return n.replaceAll("[^A-Z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }

    private static Map<String, String> buildCanonical() {
        Map<String, String> out = new LinkedHashMap<>();
        for (List<String> group : List.of(IDENTIFIERS, TIME_FIELDS, SUBJECTS, CATEGORICAL)) {
            for (String f : group) {
                out.put(f, f);
            }
        }
        return Map.copyOf(out);
    }
}
