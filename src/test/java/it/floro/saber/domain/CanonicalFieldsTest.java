package it.floro.saber.domain;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalFieldsTest {

    @Test
    void testResolveIgnoresCaseAccentsAndSeparators() {
        assertEquals(Optional.of(CanonicalFields.MATH), CanonicalFields.resolve("punt_matemáticas"));
        assertEquals(Optional.of(CanonicalFields.ENGLISH), CanonicalFields.resolve("Punt Inglés"));
        assertEquals(Optional.of(CanonicalFields.SCHOOL_ID), CanonicalFields.resolve("cole_cod_dane_establecimiento"));
    }

    @Test
    void testUnknownColumnNotResolved() {
        assertTrue(CanonicalFields.resolve("ESTU_TIPODOCUMENTO").isEmpty());
        assertTrue(CanonicalFields.resolve(null).isEmpty());
    }

    @Test
    void testSubjectsAreKnownFields() {
        for (String s : CanonicalFields.SUBJECTS) {
            assertTrue(CanonicalFields.isKnown(s));
            assertTrue(CanonicalFields.isSubject(s));
        }
        assertFalse(CanonicalFields.isSubject(CanonicalFields.AREA));
    }
}
