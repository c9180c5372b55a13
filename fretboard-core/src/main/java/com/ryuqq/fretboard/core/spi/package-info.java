/**
 * Service Provider Interfaces for pluggable scoring strategies.
 *
 * <p>Application services depend on these abstractions so that callers can swap
 * the coarse built-in heuristics for more accurate ones:</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.fretboard.core.spi.ShapeDifficultyEstimator} - Per-chord-shape difficulty for capo ranking</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.core.spi;
