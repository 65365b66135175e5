package it.floro.saber.domain;

import java.util.List;
import java.util.Set;

/**
 * Campi, materie ed etichette di sottogruppo usati dagli indicatori di equità.
 * Le etichette si confrontano senza distinzione di maiuscole e accenti.
 */
public record KpiSettings(
        String targetSubject,               // EALG: punteggio spiegato da estrato + area
        String stratumField,
        String areaField,
        Set<String> urbanLabels,
        Set<String> ruralLabels,
        String rucdiSubject,
        String errSubject,
        String ethnicityField,
        Set<String> majorityLabels,         // Valori di etnia che NON indicano una minoranza
        String genderField,
        String femaleLabel,
        String maleLabel,
        String gnctpOutcome,
        String gnctpControl,
        String mefSubject,
        List<String> svsSubjects
) {

    public KpiSettings {
        urbanLabels = Set.copyOf(urbanLabels);
        ruralLabels = Set.copyOf(ruralLabels);
        majorityLabels = Set.copyOf(majorityLabels);
        svsSubjects = List.copyOf(svsSubjects);
    }

    public static KpiSettings defaults() {
        return new KpiSettings(
                CanonicalFields.GLOBAL,
                CanonicalFields.STRATUM,
                CanonicalFields.AREA,
                Set.of("URBANO", "URBAN", "CABECERA MUNICIPAL"),
                Set.of("RURAL", "AREA RURAL"),
                CanonicalFields.ENGLISH,
                CanonicalFields.NATURAL_SCIENCES,
                CanonicalFields.ETHNICITY,
                Set.of("NINGUNO", "NINGUNA", "NO APLICA", "NO PERTENECE"),
                CanonicalFields.STUDENT_GENDER,
                "F",
                "M",
                CanonicalFields.CRITICAL_READING,
                CanonicalFields.MATH,
                CanonicalFields.GLOBAL,
                CanonicalFields.TEST_AREAS);
    }

    public KpiSettings withRucdiSubject(String subject) {
        return new KpiSettings(targetSubject, stratumField, areaField, urbanLabels, ruralLabels, subject,
                errSubject, ethnicityField, majorityLabels, genderField, femaleLabel, maleLabel,
                gnctpOutcome, gnctpControl, mefSubject, svsSubjects);
    }
}
