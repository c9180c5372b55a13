package com.ryuqq.fretboard.application.capo;

import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.ChordType;
import com.ryuqq.fretboard.core.theory.Instruments;
import com.ryuqq.fretboard.core.theory.PitchClass;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CuratedShapeDifficulty 테스트.
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
class CuratedShapeDifficultyTest {

    private final CuratedShapeDifficulty estimator = new CuratedShapeDifficulty();

    private double estimate(PitchClass root, ChordType type) {
        return estimator.estimate(Chord.of(root, type), Instruments.GUITAR);
    }

    @Test
    void easyOpenShapes() {
        assertThat(estimate(PitchClass.G, ChordType.MAJOR)).isEqualTo(1.0);
        assertThat(estimate(PitchClass.E, ChordType.MINOR)).isEqualTo(1.0);
        assertThat(estimate(PitchClass.A, ChordType.DOMINANT_7)).isEqualTo(1.0);
        assertThat(estimate(PitchClass.D, ChordType.MINOR_7)).isEqualTo(1.0);
    }

    @Test
    void moderateOpenShapes() {
        assertThat(estimate(PitchClass.F, ChordType.MAJOR)).isEqualTo(2.0);
        assertThat(estimate(PitchClass.B, ChordType.DOMINANT_7)).isEqualTo(2.0);
        assertThat(estimate(PitchClass.C, ChordType.MAJOR_7)).isEqualTo(2.0);
    }

    @Test
    void otherMajorAndMinor_AreSimpleBarre() {
        assertThat(estimate(PitchClass.A_SHARP, ChordType.MAJOR)).isEqualTo(3.0);
        assertThat(estimate(PitchClass.C, ChordType.MINOR)).isEqualTo(3.0);
    }

    @Test
    void everythingElse() {
        assertThat(estimate(PitchClass.C, ChordType.DIMINISHED)).isEqualTo(4.0);
        assertThat(estimate(PitchClass.F_SHARP, ChordType.MINOR_7)).isEqualTo(4.0);
    }

    @Test
    void nullShape_ThrowsException() {
        assertThatThrownBy(() -> estimator.estimate(null, Instruments.GUITAR))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
