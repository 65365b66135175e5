package it.floro.saber.simulator;

import it.floro.saber.domain.RawBatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Simulatore di risultati SABER 11 realistici, per far girare il servizio senza file esterni.
 *
 * Responsabilità:
 * - Generazione di un batch grezzo per anno e periodo (codici composti come 20232)
 * - Profili di scuola invarianti: dipartimento, municipio, area, naturaleza, calendario, effetto scuola
 * - Attributi socioeconomici degli studenti correlati all'area e all'estrato
 * - Punteggi per materia su scala 0-100 e punteggio globale 0-500
 *
 * Per mettere alla prova la canonicalizzazione i batch hanno intestazioni con
 * maiuscole e accenti variabili, una colonna fuori vocabolario e qualche punteggio
 * sentinella (-1) per prove non sostenute.
 *
 * Stesso seme, stessi batch.
 */
public class ExamDataSimulator {

    /** Punteggio sentinella delle prove non sostenute. */
    public static final String NOT_ATTEMPTED = "-1";

    private final Random rnd;
    private final List<Integer> years;
    private final int schools;
    private final int studentsPerSchool;

    // ========================================================================
    // CATALOGHI
    // ========================================================================

    /** Dipartimento, municipio, codice DANE del municipio, ruralità tipica [0..1]. */
    private static final String[][] MUNICIPALITIES = {
            {"ANTIOQUIA", "MEDELLÍN", "05001", "0.10"},
            {"ANTIOQUIA", "ENVIGADO", "05266", "0.05"},
            {"ANTIOQUIA", "TURBO", "05837", "0.60"},
            {"BOGOTÁ D.C.", "BOGOTÁ D.C.", "11001", "0.02"},
            {"VALLE DEL CAUCA", "CALI", "76001", "0.08"},
            {"VALLE DEL CAUCA", "BUENAVENTURA", "76109", "0.45"},
            {"ATLÁNTICO", "BARRANQUILLA", "08001", "0.05"},
            {"ATLÁNTICO", "SOLEDAD", "08758", "0.10"},
            {"CHOCÓ", "QUIBDÓ", "27001", "0.55"},
            {"NARIÑO", "PASTO", "52001", "0.30"},
            {"NARIÑO", "TUMACO", "52835", "0.65"},
            {"SANTANDER", "BUCARAMANGA", "68001", "0.05"},
            {"SANTANDER", "SAN GIL", "68679", "0.40"},
            {"BOYACÁ", "TUNJA", "15001", "0.15"},
            {"BOYACÁ", "DUITAMA", "15238", "0.30"},
            {"CÓRDOBA", "MONTERÍA", "23001", "0.35"}
    };

    private static final String[] EDUCATION = {
            "Ninguno", "Primaria incompleta", "Primaria completa", "Secundaria (Bachillerato) incompleta",
            "Secundaria (Bachillerato) completa", "Técnica o tecnológica completa",
            "Educación profesional completa", "Postgrado"
    };

    private static final String[] MINORITIES = {
            "Comunidad afrodescendiente", "Indígena", "Raizal", "Palenquero", "Rom"
    };

    /**
     * Intestazione del batch. Le materie seguono l'ordine dei pesi del punteggio globale.
     */
    private static final List<String> HEADER = List.of(
            "ESTU_CONSECUTIVO", "PERIODO", "ESTU_TIPODOCUMENTO",
            "COLE_COD_DANE_ESTABLECIMIENTO", "COLE_NOMBRE_ESTABLECIMIENTO",
            "COLE_COD_MCPIO_UBICACION", "COLE_MCPIO_UBICACION", "COLE_DEPTO_UBICACION",
            "COLE_NATURALEZA", "COLE_AREA_UBICACION", "COLE_GENERO", "COLE_CARACTER",
            "FAMI_ESTRATOVIVIENDA", "FAMI_EDUCACIONMADRE", "FAMI_EDUCACIONPADRE",
            "FAMI_TIENEINTERNET", "FAMI_TIENECOMPUTADOR", "ESTU_GENERO", "ESTU_ETNIA",
            "PUNT_LECTURA_CRITICA", "PUNT_MATEMATICAS", "PUNT_C_NATURALES",
            "PUNT_SOCIALES_CIUDADANAS", "PUNT_INGLES", "PUNT_GLOBAL");

    private static final double SENTINEL_PROBABILITY = 0.01;

    // ========================================================================
    // PROFILI SCUOLA (invarianti tra gli anni)
    // ========================================================================

    private String[] schoolId;
    private String[] schoolName;
    private int[] schoolMunicipality;
    private boolean[] schoolRural;
    private boolean[] schoolPrivate;
    private boolean[] schoolCalendarB;
    private String[] schoolCharacter;
    private double[] schoolEffect;
    private double[] schoolTrend;        // Variazione annua della media, in punti

    /**
     * @param seed              seme del generatore (stesso seme = stessi batch)
     * @param years             anni da simulare, es. [2023, 2024]
     * @param schools           numero di scuole
     * @param studentsPerSchool studenti medi per scuola e anno
     */
    public ExamDataSimulator(long seed, List<Integer> years, int schools, int studentsPerSchool) {
        if (schools < 1 || studentsPerSchool < 1) {
            throw new IllegalArgumentException("Scuole e studenti per scuola devono essere positivi");
        }
        this.rnd = new Random(seed);
        this.years = List.copyOf(years);
        this.schools = schools;
        this.studentsPerSchool = studentsPerSchool;
        initSchoolProfiles();
    }

    /**
     * Genera i batch grezzi: per ogni anno un batch del periodo 1 (calendario B)
     * e uno del periodo 2 (calendario A). Gli anni dispari usano intestazioni minuscole.
     */
    public List<RawBatch> generate() {
        List<RawBatch> batches = new ArrayList<>();
        for (int y = 0; y < years.size(); y++) {
            int year = years.get(y);
            List<String> header = (year % 2 == 0) ? HEADER : decoratedHeader();
            List<List<String>> period1 = new ArrayList<>();
            List<List<String>> period2 = new ArrayList<>();

            for (int s = 0; s < schools; s++) {
                int students = Math.max(1, (int) Math.round(gauss(studentsPerSchool, studentsPerSchool * 0.3)));
                String period = year + (schoolCalendarB[s] ? "1" : "2");
                List<List<String>> target = schoolCalendarB[s] ? period1 : period2;
                for (int i = 0; i < students; i++) {
                    String id = String.format("SB11%s%06d", period, target.size() + 1);
                    target.add(student(id, period, s, y));
                }
            }
            if (!period1.isEmpty()) {
                batches.add(new RawBatch("saber11_" + year + "1", header, period1));
            }
            batches.add(new RawBatch("saber11_" + year + "2", header, period2));
        }
        return batches;
    }

    // ========================================================================
    // GENERAZIONE STUDENTE
    // ========================================================================

    private List<String> student(String id, String period, int s, int yearIndex) {
        boolean rural = schoolRural[s];
        boolean privateSchool = schoolPrivate[s];

        int stratum = stratum(rural, privateSchool);
        int motherEdu = education(stratum);
        int fatherEdu = education(stratum);
        boolean internet = rnd.nextDouble() < 0.25 + 0.12 * stratum - (rural ? 0.15 : 0);
        boolean computer = rnd.nextDouble() < 0.20 + 0.11 * stratum - (rural ? 0.10 : 0);
        boolean female = rnd.nextDouble() < 0.53;
        String ethnicity = ethnicity(s);

        // Abilità latente: effetto scuola + contesto familiare + rumore individuale
        double ability = 48.0
                + schoolEffect[s]
                + schoolTrend[s] * yearIndex
                + 2.2 * (stratum - 2)
                + 0.6 * (motherEdu + fatherEdu - 6)
                + (internet ? 1.5 : 0)
                - (rural ? 2.5 : 0)
                + gauss(0, 7.5);

        int lc = score(ability + (female ? 1.0 : -1.0) + gauss(0, 5));
        int mat = score(ability + (female ? -2.0 : 1.5) + gauss(0, 6));
        int cn = score(ability - 1.0 + gauss(0, 5));
        int sc = score(ability - 2.0 + gauss(0, 6));
        int en = score(ability - 1.5 + (privateSchool ? 6.0 : 0) - (rural ? 3.0 : 0) + gauss(0, 8));
        int global = (int) Math.round(5.0 * (3 * lc + 3 * mat + 3 * cn + 3 * sc + en) / 13.0);

        List<String> row = new ArrayList<>(HEADER.size());
        row.add(id);
        row.add(period);
        row.add(rnd.nextDouble() < 0.8 ? "TI" : "CC");
        row.add(schoolId[s]);
        row.add(schoolName[s]);
        String[] m = MUNICIPALITIES[schoolMunicipality[s]];
        row.add(m[2]);
        row.add(m[1]);
        row.add(m[0]);
        row.add(privateSchool ? "NO OFICIAL" : "OFICIAL");
        row.add(rural ? "RURAL" : "URBANO");
        row.add("MIXTO");
        row.add(schoolCharacter[s]);
        row.add(rnd.nextDouble() < 0.03 ? "" : "Estrato " + stratum);
        row.add(EDUCATION[motherEdu]);
        row.add(EDUCATION[fatherEdu]);
        row.add(internet ? "Si" : "No");
        row.add(computer ? "Si" : "No");
        row.add(female ? "F" : "M");
        row.add(ethnicity);
        row.add(maybeSentinel(lc));
        row.add(maybeSentinel(mat));
        row.add(maybeSentinel(cn));
        row.add(maybeSentinel(sc));
        row.add(maybeSentinel(en));
        row.add(String.valueOf(global));
        return row;
    }

    // ========================================================================
    // INIZIALIZZAZIONE PROFILI SCUOLA
    // ========================================================================

    private void initSchoolProfiles() {
        schoolId = new String[schools];
        schoolName = new String[schools];
        schoolMunicipality = new int[schools];
        schoolRural = new boolean[schools];
        schoolPrivate = new boolean[schools];
        schoolCalendarB = new boolean[schools];
        schoolCharacter = new String[schools];
        schoolEffect = new double[schools];
        schoolTrend = new double[schools];

        for (int s = 0; s < schools; s++) {
            // Copertura: le prime scuole toccano tutti i municipi
            int m = s < MUNICIPALITIES.length ? s : rnd.nextInt(MUNICIPALITIES.length);
            double rurality = Double.parseDouble(MUNICIPALITIES[m][3]);
            schoolMunicipality[s] = m;
            schoolRural[s] = rnd.nextDouble() < rurality;
            schoolPrivate[s] = !schoolRural[s] && rnd.nextDouble() < 0.25;
            schoolCalendarB[s] = schoolPrivate[s] && rnd.nextDouble() < 0.4;
            schoolCharacter[s] = rnd.nextDouble() < 0.7 ? "ACADÉMICO" : "TÉCNICO/ACADÉMICO";
            schoolId[s] = MUNICIPALITIES[m][2] + String.format("%07d", 1000 + s);
            schoolName[s] = (schoolPrivate[s] ? "COLEGIO " : "INSTITUCION EDUCATIVA ")
                    + MUNICIPALITIES[m][1] + " " + (s + 1);
            schoolEffect[s] = gauss(schoolPrivate[s] ? 4.0 : 0.0, 4.0);
            schoolTrend[s] = gauss(0.0, 1.2);
        }
    }

    // ========================================================================
    // METODI UTILITY PRIVATI
    // ========================================================================

    /**
     * Intestazione "sporca": minuscole, con accento su matemáticas e inglés.
     */
    private static List<String> decoratedHeader() {
        List<String> out = new ArrayList<>(HEADER.size());
        for (String c : HEADER) {
            String h = c.toLowerCase(Locale.ROOT);
            if (h.equals("punt_matematicas")) h = "punt_matemáticas";
            if (h.equals("punt_ingles")) h = "Punt Inglés";
            out.add(h);
        }
        return out;
    }

    private int stratum(boolean rural, boolean privateSchool) {
        double base = privateSchool ? 3.5 : (rural ? 1.3 : 2.3);
        return (int) Math.round(clamp(gauss(base, 0.9), 1, 6));
    }

    private int education(int stratum) {
        double base = 1.5 + 0.9 * stratum;
        return (int) Math.round(clamp(gauss(base, 1.4), 0, EDUCATION.length - 1));
    }

    private String ethnicity(int s) {
        double p = schoolRural[s] ? 0.22 : 0.08;
        if (rnd.nextDouble() >= p) return "Ninguno";
        return MINORITIES[rnd.nextInt(MINORITIES.length)];
    }

    private String maybeSentinel(int score) {
        return rnd.nextDouble() < SENTINEL_PROBABILITY ? NOT_ATTEMPTED : String.valueOf(score);
    }

    private static int score(double v) {
        return (int) Math.round(clamp(v, 0, 100));
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    /**
     * Numero casuale gaussiano (Box-Muller).
     */
    private double gauss(double mean, double std) {
        double u1 = Math.max(1e-9, rnd.nextDouble());  // Evita log(0)
        double u2 = Math.max(1e-9, rnd.nextDouble());
        double z0 = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2 * Math.PI * u2);
        return mean + std * z0;
    }

    /** Anni simulati, nell'ordine di generazione. */
    public List<Integer> years() {
        return years;
    }
}
