package com.ryuqq.fretboard.testkit.contract;

import com.ryuqq.fretboard.application.search.VoicingSearch;
import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.voicing.Voicing;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for hand-shape deduplication.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Search results never share a fretted shape</li>
 *   <li>Deduplicating search results is a no-op</li>
 *   <li>Deduplicating a list concatenated with itself equals deduplicating it once</li>
 * </ul>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
class DeduplicationContractTest extends AbstractVoicingContractTest {

    @Test
    void testDedup_SearchResults_HaveUniqueShapes() {
        for (Chord chord : commonChords()) {
            assertUniqueShapes(guitarSearch.search(chord));
        }
    }

    @Test
    void testDedup_IsIdempotent() {
        for (Chord chord : commonChords()) {
            // Given
            List<Voicing> voicings = guitarSearch.search(chord);

            // When
            List<Voicing> once = VoicingSearch.deduplicate(voicings);
            List<Voicing> twice = VoicingSearch.deduplicate(once);

            // Then
            assertEquals(voicings, once, "Search results changed by dedup for " + chord);
            assertEquals(once, twice);
        }
    }

    @Test
    void testDedup_DoubledInput_CollapsesToSingleCopy() {
        for (Chord chord : commonChords()) {
            // Given
            List<Voicing> voicings = guitarSearch.search(chord);
            List<Voicing> doubled = new ArrayList<>(voicings);
            doubled.addAll(voicings);

            // When
            List<Voicing> deduplicated = VoicingSearch.deduplicate(doubled);

            // Then
            assertEquals(voicings, deduplicated);
        }
    }
}
