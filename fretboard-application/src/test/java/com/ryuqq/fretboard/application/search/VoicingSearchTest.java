package com.ryuqq.fretboard.application.search;

import com.ryuqq.fretboard.core.difficulty.VoicingDifficulty;
import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.ChordType;
import com.ryuqq.fretboard.core.theory.Instrument;
import com.ryuqq.fretboard.core.theory.Instruments;
import com.ryuqq.fretboard.core.theory.PitchClass;
import com.ryuqq.fretboard.core.voicing.Voicing;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * VoicingSearch 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>잘 알려진 개방 코드 운지 탐색</li>
 *   <li>결과가 옵션과 코드 구성음을 모두 만족</li>
 *   <li>난이도 순 정렬 및 손모양 중복 제거</li>
 *   <li>슬래시 코드, 카포, 다른 악기</li>
 * </ul>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
class VoicingSearchTest {

    private static final Instrument GUITAR = Instruments.GUITAR;

    @Nested
    @DisplayName("개방 코드")
    class OpenChords {

        @Test
        void search_AMinor_Beginner_FindsOpenShape() {
            // Given
            VoicingSearch search = new VoicingSearch(GUITAR, VoicingSearchOptions.BEGINNER);

            // When
            List<Voicing> voicings = search.search(Chord.minor(PitchClass.A));

            // Then
            assertThat(voicings).contains(Voicing.parse("X02210"));
            assertThat(voicings).allMatch(v -> v.difficulty() == VoicingDifficulty.BEGINNER);
        }

        @Test
        void search_EMajor_Default_FindsOpenShape() {
            // Given
            VoicingSearch search = new VoicingSearch(GUITAR);

            // When
            List<Voicing> voicings = search.search(Chord.major(PitchClass.E));

            // Then
            assertThat(voicings).contains(Voicing.parse("022100"));
        }

        @Test
        void search_CMajor_Default_FindsOpenShape() {
            // Given
            VoicingSearch search = new VoicingSearch(GUITAR);

            // When
            List<Voicing> voicings = search.search(Chord.major(PitchClass.C));

            // Then
            assertThat(voicings).contains(Voicing.parse("X32010"));
            assertThat(voicings).doesNotContain(Voicing.parse("032010"));
        }

        @Test
        void search_WithCapo_FindsShapeRelativeToCapo() {
            // Given
            VoicingSearch search = new VoicingSearch(GUITAR.withCapo(2), VoicingSearchOptions.BEGINNER);

            // When
            List<Voicing> voicings = search.search(Chord.minor(PitchClass.B));

            // Then
            assertThat(voicings).contains(Voicing.parse("X02210"));
        }

        @Test
        void search_Ukulele_RootInBassDisabled_FindsReentrantC() {
            // Given
            VoicingSearch search = new VoicingSearch(
                Instruments.UKULELE,
                new VoicingSearchOptions().withRootInBass(false)
            );

            // When
            List<Voicing> voicings = search.search(Chord.major(PitchClass.C));

            // Then
            assertThat(voicings).contains(Voicing.parse("0003"));
            assertThat(voicings).doesNotContain(Voicing.parse("X003"));
        }
    }

    @Nested
    @DisplayName("결과 속성")
    class ResultProperties {

        private final VoicingSearchOptions options = new VoicingSearchOptions();
        private final VoicingSearch search = new VoicingSearch(GUITAR, options);

        @Test
        void everyResult_PlaysChordAndRespectsOptions() {
            // Given
            Chord chord = Chord.of(PitchClass.G, ChordType.DOMINANT_7);

            // When
            List<Voicing> voicings = search.search(chord);

            // Then
            assertThat(voicings).isNotEmpty();
            for (Voicing v : voicings) {
                assertThat(v.playsChord(chord, GUITAR)).as(v.toString()).isTrue();
                assertThat(v.bassPitchClassOn(GUITAR)).as(v.toString()).isEqualTo(PitchClass.G);
                assertThat(v.fretSpan()).isLessThanOrEqualTo(options.maxFretSpan());
                assertThat(v.playedStringCount()).isGreaterThanOrEqualTo(options.minStringsPlayed());
                assertThat(v.mutedStringCount()).isLessThanOrEqualTo(options.maxMutedStrings());
                assertThat(v.fingersRequired()).isLessThanOrEqualTo(options.maxFingers());
                assertThat(v.highestFret().orElse(0)).isLessThanOrEqualTo(options.maxFret());
            }
        }

        @Test
        void results_SortedByDifficulty() {
            // When
            List<Voicing> voicings = search.search(Chord.major(PitchClass.D));

            // Then
            assertThat(voicings).extracting(Voicing::difficultyScore).isSorted();
        }

        @Test
        void results_HaveDistinctFrettedShapes() {
            // When
            List<Voicing> voicings = search.search(Chord.major(PitchClass.A));

            // Then
            assertThat(voicings).extracting(Voicing::frettedShape).doesNotHaveDuplicates();
            assertThat(VoicingSearch.deduplicate(voicings)).isEqualTo(voicings);
        }

        @Test
        void search_IsDeterministic() {
            // When
            List<Voicing> first = search.search(Chord.minor(PitchClass.E));
            List<Voicing> second = search.search(Chord.minor(PitchClass.E));

            // Then
            assertThat(first).isEqualTo(second);
        }

        @Test
        void noInteriorMutes_WhenDisallowed() {
            // Given
            VoicingSearch strict = new VoicingSearch(GUITAR, options.withAllowInteriorMutes(false));

            // When
            List<Voicing> voicings = strict.search(Chord.major(PitchClass.G));

            // Then
            assertThat(voicings).isNotEmpty().noneMatch(Voicing::hasInteriorMutes);
        }

        @Test
        void maxDifficulty_FiltersHarderVoicings() {
            // Given
            VoicingSearch limited = new VoicingSearch(GUITAR, options.withMaxDifficulty(VoicingDifficulty.INTERMEDIATE));

            // When
            List<Voicing> voicings = limited.search(Chord.major(PitchClass.F));

            // Then
            assertThat(voicings).allMatch(v -> v.difficulty().isAtMost(VoicingDifficulty.INTERMEDIATE));
        }

        @Test
        void maxFingers_ExcludesVoicingsNeedingMoreFingers() {
            // Given
            Voicing fourFingerG = Voicing.parse("320033");
            VoicingSearch threeFingers = new VoicingSearch(GUITAR, options.withMaxFingers(3));

            // When
            List<Voicing> unrestricted = search.search(Chord.major(PitchClass.G));
            List<Voicing> restricted = threeFingers.search(Chord.major(PitchClass.G));

            // Then
            assertThat(fourFingerG.fingersRequired()).isEqualTo(4);
            assertThat(unrestricted).contains(fourFingerG);
            assertThat(restricted).isNotEmpty().doesNotContain(fourFingerG);
            assertThat(restricted).allMatch(v -> v.fingersRequired() <= 3);
        }

        @Test
        void equalScores_KeepGenerationOrder() {
            // Given
            Voicing fullG = Voicing.parse("320003");
            Voicing fiveStringG = Voicing.parse("32003X");

            // When
            List<Voicing> voicings = search.search(Chord.major(PitchClass.G));

            // Then
            assertThat(fullG.difficultyScore()).isEqualTo(fiveStringG.difficultyScore());
            assertThat(voicings).contains(fullG, fiveStringG);
            assertThat(voicings.indexOf(fullG)).isLessThan(voicings.indexOf(fiveStringG));
        }
    }

    @Nested
    @DisplayName("슬래시 코드와 빈 결과")
    class EdgeCases {

        @Test
        void slashChord_BassNoteIsLowest() {
            // Given
            Chord cOverG = Chord.of(PitchClass.C, ChordType.MAJOR, PitchClass.G);
            VoicingSearch search = new VoicingSearch(GUITAR);

            // When
            List<Voicing> voicings = search.search(cOverG);

            // Then
            assertThat(voicings).contains(Voicing.parse("332010"));
            assertThat(voicings).allMatch(v -> v.bassPitchClassOn(GUITAR) == PitchClass.G);
        }

        @Test
        void impossibleWindow_ReturnsEmpty() {
            // Given
            VoicingSearch openOnly = new VoicingSearch(GUITAR, new VoicingSearchOptions().withFretWindow(0, 0));

            // When
            List<Voicing> voicings = openOnly.search(Chord.major(PitchClass.C));

            // Then
            assertThat(voicings).isEmpty();
        }

        @Test
        void nullArguments_ThrowException() {
            // When & Then
            assertThatThrownBy(() -> new VoicingSearch(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("instrument cannot be null");
            assertThatThrownBy(() -> new VoicingSearch(GUITAR).search(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("chord cannot be null");
        }
    }

    @Nested
    @DisplayName("부가 조회")
    class Helpers {

        private final VoicingSearch search = new VoicingSearch(GUITAR);

        @Test
        void findEasiest_ReturnsPrefixOfSearch() {
            // Given
            Chord chord = Chord.major(PitchClass.G);
            List<Voicing> all = search.search(chord);

            // When
            List<Voicing> easiest = search.findEasiest(chord, 3);

            // Then
            assertThat(easiest).hasSize(Math.min(3, all.size()));
            assertThat(easiest).isEqualTo(all.subList(0, easiest.size()));
        }

        @Test
        void findEasiest_NegativeLimit_ThrowsException() {
            // When & Then
            assertThatThrownBy(() -> search.findEasiest(Chord.major(PitchClass.G), -1))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void findGroupedByPosition_KeysAreLowestFret() {
            // When
            Map<Integer, List<Voicing>> grouped = search.findGroupedByPosition(Chord.major(PitchClass.A));

            // Then
            assertThat(grouped).isNotEmpty();
            assertThat(new ArrayList<>(grouped.keySet())).isSorted();
            grouped.forEach((position, voicings) -> {
                assertThat(voicings).isNotEmpty();
                assertThat(voicings).allMatch(v -> v.lowestFret().orElse(0) == position);
                assertThat(voicings).extracting(Voicing::difficultyScore).isSorted();
            });
        }

        @Test
        void deduplicate_KeepsVoicingWithMorePlayedStrings() {
            // Given
            Voicing fewer = Voicing.parse("XX2210");
            Voicing more = Voicing.parse("X02210");

            // When & Then
            assertThat(VoicingSearch.deduplicate(List.of(fewer, more))).containsExactly(more);
            assertThat(VoicingSearch.deduplicate(List.of(more, fewer))).containsExactly(more);
        }

        @Test
        void deduplicate_EqualPlayedStrings_KeepsFirst() {
            // Given
            Voicing first = Voicing.parse("X02210");
            Voicing second = Voicing.parse("00221X");

            // When & Then
            assertThat(first.frettedShape()).isEqualTo(second.frettedShape());
            assertThat(VoicingSearch.deduplicate(List.of(first, second))).containsExactly(first);
        }

        @Test
        void deduplicate_ReplacingVoicing_TakesItsOwnPosition() {
            // Given
            Voicing fewer = Voicing.parse("XX2210");
            Voicing unrelated = Voicing.parse("577555");
            Voicing more = Voicing.parse("X02210");

            // When
            List<Voicing> unique = VoicingSearch.deduplicate(List.of(fewer, unrelated, more));

            // Then
            assertThat(unique).containsExactly(unrelated, more);
            assertThat(VoicingSearch.deduplicate(unique)).isEqualTo(unique);
        }
    }
}
