package com.ryuqq.fretboard.core.theory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Instrument / StringConfig / Tuning 테스트.
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
class InstrumentTest {

    @Test
    void guitarPreset_StandardTuning() {
        // Given
        Instrument guitar = Instruments.GUITAR;

        // When & Then
        assertEquals(6, guitar.stringCount());
        assertEquals(0, guitar.getCapo());
        assertEquals("Guitar (E2 A2 D3 G3 B3 E4)", guitar.toString());
        assertEquals(22, guitar.maxFret(0));
    }

    @Test
    void soundingPitchClass_AddsFretToOpenNote() {
        // When & Then
        assertEquals(PitchClass.A, Instruments.GUITAR.soundingPitchClass(0, 5));
        assertEquals(PitchClass.C, Instruments.GUITAR.soundingPitchClass(4, 1));
        assertEquals(PitchClass.E, Instruments.GUITAR.soundingPitchClass(5, 12));
    }

    @Test
    void withCapo_ShiftsPitchAndReducesMaxFret() {
        // Given
        Instrument capo3 = Instruments.GUITAR.withCapo(3);

        // When & Then
        assertEquals(3, capo3.getCapo());
        assertEquals(PitchClass.G, capo3.soundingPitchClass(0, 0));
        assertEquals(19, capo3.maxFret(0));
        assertEquals("Guitar (E2 A2 D3 G3 B3 E4, capo 3)", capo3.toString());
        assertEquals(0, Instruments.GUITAR.getCapo());
    }

    @Test
    void withCapo_BeyondFretCount_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Instruments.UKULELE.withCapo(16));
        assertThrows(IllegalArgumentException.class, () -> Instruments.GUITAR.withCapo(-1));
    }

    @Test
    void withTuning_SameStringCount_ReplacesStrings() {
        // When
        Instrument dropD = Instruments.GUITAR.withTuning(Tunings.GUITAR_DROP_D);

        // Then
        assertEquals(PitchClass.D, dropD.soundingPitchClass(0, 0));
        assertEquals("Guitar", dropD.getName());
        assertEquals(dropD, Tunings.GUITAR_DROP_D.applyTo(Instruments.GUITAR));
    }

    @Test
    void withTuning_DifferentStringCount_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> Instruments.GUITAR.withTuning(Tunings.UKULELE_STANDARD)
        );
    }

    @Test
    void of_NoStrings_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Instrument.of("Empty", List.of())
        );
        assertTrue(exception.getMessage().contains("cannot be null or empty"));
    }

    @Test
    void string_OutOfRange_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Instruments.GUITAR.string(6));
        assertThrows(IllegalArgumentException.class, () -> Instruments.GUITAR.soundingPitchClass(0, -1));
    }

    @Test
    void stringConfig_Parse_AcceptsFlats() {
        // When
        StringConfig config = StringConfig.parse("Bb1");

        // Then
        assertEquals(PitchClass.A_SHARP, config.openNote());
        assertEquals(1, config.octave());
        assertEquals(StringConfig.DEFAULT_FRET_COUNT, config.fretCount());
    }

    @Test
    void stringConfig_Parse_InvalidFormat_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StringConfig.parse("H2"));
        assertThrows(IllegalArgumentException.class, () -> StringConfig.parse("E"));
    }

    @Test
    void stringConfig_NoteAtFret_RangeChecked() {
        // Given
        StringConfig low = StringConfig.parse("E2");

        // When & Then
        assertEquals(PitchClass.G, low.noteAtFret(3));
        assertThrows(IllegalArgumentException.class, () -> low.noteAtFret(23));
    }

    @Test
    void tuning_Parse_SplitsOnWhitespace() {
        // When
        Tuning tuning = Tuning.parse("DADGAD", "D2  A2 D3 G3 A3 D4");

        // Then
        assertEquals(6, tuning.stringCount());
        assertEquals(PitchClass.A, tuning.strings().get(4).openNote());
    }

    @Test
    void presets_HaveExpectedStringCounts() {
        // When & Then
        assertEquals(4, Instruments.BASS.stringCount());
        assertEquals(4, Instruments.UKULELE.stringCount());
        assertEquals(5, Instruments.BANJO.stringCount());
        assertEquals(7, Instruments.GUITAR_7_STRING.stringCount());
        assertEquals(15, Instruments.UKULELE.maxFret(0));
    }
}
