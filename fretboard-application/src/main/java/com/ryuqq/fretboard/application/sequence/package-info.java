/**
 * Context-aware voicing selection for chord progressions.
 *
 * <p>{@link com.ryuqq.fretboard.application.sequence.VoicingTransition} prices the hand
 * movement between two voicings; {@link com.ryuqq.fretboard.application.sequence.VoicingSequencer}
 * ranks candidates against their immediate neighbours.</p>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.application.sequence;
