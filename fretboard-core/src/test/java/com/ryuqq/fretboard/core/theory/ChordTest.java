package com.ryuqq.fretboard.core.theory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chord / ChordType 테스트.
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
class ChordTest {

    @Test
    void pitchClasses_MajorTriad_RootFirst() {
        // Given
        Chord chord = Chord.major(PitchClass.C);

        // When
        List<PitchClass> pitches = chord.pitchClasses();

        // Then
        assertEquals(List.of(PitchClass.C, PitchClass.E, PitchClass.G), pitches);
    }

    @Test
    void pitchClasses_CompoundInterval_ReducedModOctave() {
        // Given
        Chord chord = Chord.of(PitchClass.C, ChordType.ADD_9);

        // When
        List<PitchClass> pitches = chord.pitchClasses();

        // Then
        assertEquals(List.of(PitchClass.C, PitchClass.E, PitchClass.G, PitchClass.D), pitches);
    }

    @Test
    void pitchClasses_PowerChord_TwoNotes() {
        // When
        List<PitchClass> pitches = Chord.of(PitchClass.E, ChordType.POWER).pitchClasses();

        // Then
        assertEquals(List.of(PitchClass.E, PitchClass.B), pitches);
    }

    @Test
    void symbol_And_Name_IncludeBassNote() {
        // Given
        Chord slash = Chord.of(PitchClass.C, ChordType.MAJOR, PitchClass.G);

        // When & Then
        assertEquals("C/G", slash.symbol());
        assertEquals("C major over G", slash.name());
        assertTrue(slash.hasBassNote());
        assertEquals("Am", Chord.minor(PitchClass.A).symbol());
        assertEquals("G7", Chord.of(PitchClass.G, ChordType.DOMINANT_7).toString());
    }

    @Test
    void transpose_MovesRootAndBass() {
        // Given
        Chord slash = Chord.of(PitchClass.C, ChordType.MAJOR, PitchClass.G);

        // When
        Chord transposed = slash.transpose(-1);

        // Then
        assertEquals("B/F#", transposed.symbol());
        assertEquals(ChordType.MAJOR, transposed.type());
    }

    @Test
    void transpose_WithoutBass_KeepsBassNull() {
        // When
        Chord transposed = Chord.major(PitchClass.F).transpose(-1);

        // Then
        assertEquals(Chord.major(PitchClass.E), transposed);
        assertFalse(transposed.hasBassNote());
    }

    @Test
    void constructor_NullRoot_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Chord.of(null, ChordType.MAJOR)
        );
        assertTrue(exception.getMessage().contains("root cannot be null"));
    }

    @Test
    void chordType_FirstIntervalNotRoot_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalArgumentException.class,
            () -> new ChordType("broken", "x", List.of(4, 7))
        );
    }

    @Test
    void chordType_All_ContainsCuratedTypes() {
        // When
        List<ChordType> all = ChordType.all();

        // Then
        assertEquals(21, all.size());
        assertTrue(all.contains(ChordType.MINOR_7));
        assertTrue(ChordType.MAJOR.isTriad());
        assertEquals(5, ChordType.DOMINANT_9.noteCount());
    }

    @Test
    void chordType_EqualityByNameAndSymbol() {
        // Given
        ChordType copy = new ChordType("major", "", List.of(0, 4, 7));

        // When & Then
        assertEquals(ChordType.MAJOR, copy);
        assertEquals(ChordType.MAJOR.hashCode(), copy.hashCode());
    }
}
