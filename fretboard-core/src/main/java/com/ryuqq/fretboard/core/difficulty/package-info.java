/**
 * Difficulty heuristics for voicings.
 *
 * <p>{@link com.ryuqq.fretboard.core.difficulty.DifficultyModel} holds the scoring
 * weights and the finger-count estimate; {@link com.ryuqq.fretboard.core.difficulty.VoicingDifficulty}
 * is the three-level category derived from the score.</p>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.core.difficulty;
