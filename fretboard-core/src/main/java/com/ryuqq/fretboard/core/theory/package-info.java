/**
 * Music-theory model consumed by the voicing engine.
 *
 * <p>This package defines immutable value objects describing pitches, chords
 * and instruments:</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fretboard.core.theory.PitchClass} - One of 12 pitch classes, closed under transposition</li>
 *   <li>{@link com.ryuqq.fretboard.core.theory.ChordType} - Interval formula (root-relative semitones)</li>
 *   <li>{@link com.ryuqq.fretboard.core.theory.Chord} - Root + type + optional slash bass</li>
 *   <li>{@link com.ryuqq.fretboard.core.theory.StringConfig} - Open note, octave and fret count of one string</li>
 *   <li>{@link com.ryuqq.fretboard.core.theory.Instrument} - Ordered strings plus a uniform capo offset</li>
 *   <li>{@link com.ryuqq.fretboard.core.theory.Tuning} - Named set of string configurations</li>
 * </ul>
 *
 * <h2>Presets</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fretboard.core.theory.Instruments} - Guitar, bass, ukulele, cavaquinho, banjo, 7-string guitar</li>
 *   <li>{@link com.ryuqq.fretboard.core.theory.Tunings} - Common alternate tunings</li>
 * </ul>
 *
 * <p>Chord-symbol parsing and key analysis are not part of this package.</p>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.core.theory;
