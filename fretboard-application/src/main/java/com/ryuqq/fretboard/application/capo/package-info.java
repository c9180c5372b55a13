/**
 * Capo suggestions.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fretboard.application.capo.CapoSuggester} - Ranks every capo offset for a chord progression</li>
 *   <li>{@link com.ryuqq.fretboard.application.capo.CuratedShapeDifficulty} - Default lookup-table shape scorer</li>
 *   <li>{@link com.ryuqq.fretboard.application.capo.CommonCapoPositions} - Explanatory table of well-known capo tricks</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Fretboard Team
 */
package com.ryuqq.fretboard.application.capo;
