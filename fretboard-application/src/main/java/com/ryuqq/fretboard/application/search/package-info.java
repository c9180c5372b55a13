/**
 * Voicing search.
 *
 * <p>{@link com.ryuqq.fretboard.application.search.VoicingSearch} enumerates every
 * string-by-string fret assignment in the configured window, filters out
 * unplayable or musically wrong ones, collapses equivalent hand shapes and sorts
 * the survivors by difficulty.</p>
 *
 * <p>Traversal order (string ascending, muted first, then fret ascending) is
 * deterministic and the final sort is stable, so equal-difficulty voicings
 * always come back in the same order.</p>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.application.search;
