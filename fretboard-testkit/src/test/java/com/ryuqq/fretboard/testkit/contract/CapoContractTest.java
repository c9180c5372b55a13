package com.ryuqq.fretboard.testkit.contract;

import com.ryuqq.fretboard.application.capo.CapoSuggester;
import com.ryuqq.fretboard.application.capo.CapoSuggestion;
import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.PitchClass;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for capo suggestions.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Every capo offset from 0 to maxCapoFret is scored exactly once</li>
 *   <li>Suggestions are sorted by score, lowest first</li>
 *   <li>Each shape is its original chord transposed down by the capo offset</li>
 *   <li>The best suggestion is never worse than playing without a capo</li>
 * </ul>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
class CapoContractTest extends AbstractVoicingContractTest {

    private List<List<Chord>> progressions() {
        return List.of(
            List.of(Chord.major(PitchClass.G), Chord.major(PitchClass.C), Chord.major(PitchClass.D)),
            List.of(Chord.major(PitchClass.F), Chord.major(PitchClass.A_SHARP), Chord.major(PitchClass.C)),
            List.of(Chord.minor(PitchClass.A), Chord.major(PitchClass.F), Chord.major(PitchClass.C), Chord.major(PitchClass.G)),
            List.of(Chord.major(PitchClass.D_SHARP), Chord.minor(PitchClass.G_SHARP))
        );
    }

    @Test
    void testCapo_EveryOffsetScoredOnce() {
        for (List<Chord> chords : progressions()) {
            // When
            List<CapoSuggestion> suggestions = capoSuggester.suggest(chords);

            // Then
            assertEquals(CapoSuggester.DEFAULT_MAX_CAPO_FRET + 1, suggestions.size());
            Set<Integer> frets = new HashSet<>();
            for (CapoSuggestion suggestion : suggestions) {
                assertTrue(frets.add(suggestion.capoFret()), "Duplicate capo " + suggestion.capoFret());
            }
            for (int capo = 0; capo <= CapoSuggester.DEFAULT_MAX_CAPO_FRET; capo++) {
                assertTrue(frets.contains(capo), "Missing capo " + capo);
            }
        }
    }

    @Test
    void testCapo_SortedByScore() {
        for (List<Chord> chords : progressions()) {
            List<CapoSuggestion> suggestions = capoSuggester.suggest(chords);
            for (int i = 1; i < suggestions.size(); i++) {
                assertTrue(suggestions.get(i - 1).difficultyScore() <= suggestions.get(i).difficultyScore());
            }
        }
    }

    @Test
    void testCapo_ShapesAreTransposedOriginals() {
        for (List<Chord> chords : progressions()) {
            for (CapoSuggestion suggestion : capoSuggester.suggest(chords)) {
                assertEquals(chords, suggestion.originalChords());
                for (int i = 0; i < chords.size(); i++) {
                    assertEquals(chords.get(i).transpose(-suggestion.capoFret()), suggestion.shapes().get(i));
                }
            }
        }
    }

    @Test
    void testCapo_BestNeverWorseThanNoCapo() {
        for (List<Chord> chords : progressions()) {
            // When
            List<CapoSuggestion> suggestions = capoSuggester.suggest(chords);
            CapoSuggestion noCapo = suggestions.stream()
                    .filter(s -> s.capoFret() == 0)
                    .findFirst()
                    .orElseThrow();

            // Then
            assertTrue(suggestions.get(0).difficultyScore() <= noCapo.difficultyScore());
            assertEquals(suggestions.get(0), capoSuggester.suggestBest(chords).orElseThrow());
        }
    }
}
