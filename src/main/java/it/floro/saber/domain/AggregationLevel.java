package it.floro.saber.domain;

import it.floro.saber.exception.MalformedInputException;

import java.util.List;
import java.util.Locale;

/**
 * Livelli organizzativi a cui si aggregano i record, con le chiavi di raggruppamento
 * predefinite. Le chiavi effettive arrivano da {@link AnalysisConfig#groupKeys(AggregationLevel)}.
 */
public enum AggregationLevel {

    STUDENT(List.of(CanonicalFields.RECORD_ID)),
    SCHOOL(List.of(CanonicalFields.SCHOOL_ID)),
    MUNICIPALITY(List.of(CanonicalFields.DEPARTMENT, CanonicalFields.MUNICIPALITY)),
    DEPARTMENT(List.of(CanonicalFields.DEPARTMENT)),
    NATIONAL(List.of());

    private final List<String> defaultKeys;

    AggregationLevel(List<String> defaultKeys) {
        this.defaultKeys = defaultKeys;
    }

    public List<String> defaultKeys() {
        return defaultKeys;
    }

    /**
     * Conversione tollerante da parametro di richiesta ("school", "Municipio", ...).
     */
    public static AggregationLevel parse(String s) {
        if (s == null || s.isBlank()) {
            throw new MalformedInputException("Livello di aggregazione mancante");
        }
        String n = s.trim().toUpperCase(Locale.ROOT);
        return switch (n) {
            case "STUDENT", "ESTUDIANTE", "STUDENTE" -> STUDENT;
            case "SCHOOL", "SCHOOLS", "COLEGIO", "SCUOLA" -> SCHOOL;
            case "MUNICIPALITY", "MUNICIPALITIES", "MUNICIPIO", "COMUNE" -> MUNICIPALITY;
            case "DEPARTMENT", "DEPARTMENTS", "DEPARTAMENTO", "DIPARTIMENTO" -> DEPARTMENT;
            case "NATIONAL", "NACIONAL", "NAZIONALE" -> NATIONAL;
            default -> throw new MalformedInputException("Livello di aggregazione sconosciuto: " + s);
        };
    }
}
