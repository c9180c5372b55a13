package com.ryuqq.fretboard.core.spi;

import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.Instrument;

/**
 * Chord-shape difficulty SPI used by capo suggestion.
 *
 * <p>Given the chord shape a player would finger (after the capo has done the
 * transposition), returns a difficulty weight. Lower is easier.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Pure: same input, same output; no I/O</li>
 *   <li>Total: must return a finite, non-negative value for every chord</li>
 *   <li>Cheap: called once per chord per capo position</li>
 * </ul>
 *
 * <p>The default implementation is a curated lookup that ignores the instrument.
 * Implementations that need per-instrument accuracy may run a full voicing search
 * on {@code instrument} instead.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public interface ShapeDifficultyEstimator {

    /**
     * Estimates how hard a chord shape is to finger.
     *
     * @param shape the chord shape to finger (already transposed down by the capo)
     * @param instrument the instrument the shape is played on
     * @return difficulty weight, lower is easier
     */
    double estimate(Chord shape, Instrument instrument);
}
