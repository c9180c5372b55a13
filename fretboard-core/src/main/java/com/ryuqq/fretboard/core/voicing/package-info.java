/**
 * Voicing value objects.
 *
 * <p>A {@link com.ryuqq.fretboard.core.voicing.Voicing} is one concrete fingering of a
 * chord: one {@link com.ryuqq.fretboard.core.voicing.StringPosition} per string
 * ({@link com.ryuqq.fretboard.core.voicing.Muted}, {@link com.ryuqq.fretboard.core.voicing.Open}
 * or {@link com.ryuqq.fretboard.core.voicing.Fretted}) plus at most one
 * {@link com.ryuqq.fretboard.core.voicing.Barre}.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are immutable; derived quantities are computed on demand</li>
 *   <li><strong>Closed variants:</strong> Per-string state is a sealed type, so muted and open can never be confused</li>
 *   <li><strong>Structural equality:</strong> No identity beyond value equality</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.core.voicing;
