package com.ryuqq.fretboard.core.difficulty;

import com.ryuqq.fretboard.core.voicing.Barre;
import com.ryuqq.fretboard.core.voicing.Fretted;
import com.ryuqq.fretboard.core.voicing.StringPosition;
import com.ryuqq.fretboard.core.voicing.Voicing;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * 운지 난이도 점수와 필요 손가락 수 계산.
 *
 * <p>모든 함수는 구조적으로 유효한 Voicing 전체에 대해 정의된 순수 함수입니다.</p>
 *
 * <p><strong>난이도 점수 (낮을수록 쉬움, 최소 0):</strong></p>
 * <pre>
 * + 10 × fretSpan
 * +  5 × 프렛을 누른 현 수
 * + 20 바레 있음 (5현 이상 덮으면 +10 추가)
 * +  3 × (lowestFret - 5)          lowestFret &gt; 5 인 경우만
 * + 15 × 내부 뮤트 현 수           양쪽에 연주 현이 있는 뮤트
 * -  3 × 개방현 수                  lowestFret 없음 또는 1 인 경우만
 * </pre>
 *
 * <p><strong>등급:</strong> 25 이하 BEGINNER, 50 이하 INTERMEDIATE, 그 외 ADVANCED</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class DifficultyModel {

    static final int SPAN_WEIGHT = 10;
    static final int FRETTED_STRING_WEIGHT = 5;
    static final int BARRE_PENALTY = 20;
    static final int FULL_BARRE_PENALTY = 10;
    static final int FULL_BARRE_MIN_STRINGS = 5;
    static final int HIGH_POSITION_START = 5;
    static final int HIGH_POSITION_WEIGHT = 3;
    static final int INTERIOR_MUTE_PENALTY = 15;
    static final int OPEN_STRING_BONUS = 3;

    static final int BEGINNER_MAX_SCORE = 25;
    static final int INTERMEDIATE_MAX_SCORE = 50;

    // Utility class - prevent instantiation
    private DifficultyModel() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 필요 손가락 수 추정.
     *
     * <p>최저 프렛 L에 2개 이상의 현이 있고, 그 범위 안에 L보다 높은 프렛을 누른 현이
     * 없으면 바레로 보고 손가락 1개로 셉니다. 그렇지 않으면 L의 현마다 1개씩 셉니다.
     * L보다 높은 프렛은 합치지 않고 현마다 1개씩 셉니다.</p>
     *
     * <p>예: X02210 → 1 + 2 = 3, 555X7X → 1 + 1 = 2, X2323X → 2 + 2 = 4</p>
     *
     * @param voicing 운지
     * @return 필요 손가락 수 (누른 현이 없으면 0)
     * @throws IllegalArgumentException voicing이 null인 경우
     */
    public static int fingersRequired(Voicing voicing) {
        requireVoicing(voicing);
        List<StringPosition> positions = voicing.getPositions();

        // 프렛 → 해당 프렛을 누른 현 인덱스 (프렛 오름차순)
        TreeMap<Integer, List<Integer>> stringsByFret = new TreeMap<>();
        for (int i = 0; i < positions.size(); i++) {
            if (positions.get(i) instanceof Fretted fretted) {
                stringsByFret.computeIfAbsent(fretted.fret(), k -> new ArrayList<>()).add(i);
            }
        }
        if (stringsByFret.isEmpty()) {
            return 0;
        }

        int lowest = stringsByFret.firstKey();
        List<Integer> atLowest = stringsByFret.get(lowest);

        int fingers = canBarre(positions, lowest, atLowest) ? 1 : atLowest.size();
        for (List<Integer> strings : stringsByFret.tailMap(lowest, false).values()) {
            fingers += strings.size();
        }
        return fingers;
    }

    private static boolean canBarre(List<StringPosition> positions, int lowest, List<Integer> atLowest) {
        if (atLowest.size() < 2) {
            return false;
        }
        int from = atLowest.get(0);
        int to = atLowest.get(atLowest.size() - 1);
        for (int s = from; s <= to; s++) {
            if (positions.get(s) instanceof Fretted fretted && fretted.fret() > lowest) {
                return false;
            }
        }
        return true;
    }

    /**
     * 난이도 점수 계산.
     *
     * @param voicing 운지
     * @return 0 이상의 점수 (낮을수록 쉬움)
     * @throws IllegalArgumentException voicing이 null인 경우
     */
    public static int difficultyScore(Voicing voicing) {
        requireVoicing(voicing);
        int score = 0;

        score += voicing.fretSpan() * SPAN_WEIGHT;
        score += voicing.frettedStringCount() * FRETTED_STRING_WEIGHT;

        Barre barre = voicing.getBarre();
        if (barre != null) {
            score += BARRE_PENALTY;
            if (barre.stringCount() >= FULL_BARRE_MIN_STRINGS) {
                score += FULL_BARRE_PENALTY;
            }
        }

        OptionalInt lowest = voicing.lowestFret();
        if (lowest.isPresent() && lowest.getAsInt() > HIGH_POSITION_START) {
            score += (lowest.getAsInt() - HIGH_POSITION_START) * HIGH_POSITION_WEIGHT;
        }

        score += voicing.interiorMutedStringCount() * INTERIOR_MUTE_PENALTY;

        if (lowest.isEmpty() || lowest.getAsInt() == 1) {
            score -= voicing.openStringCount() * OPEN_STRING_BONUS;
        }

        return Math.max(score, 0);
    }

    /**
     * 점수를 난이도 등급으로 분류.
     *
     * @param score 난이도 점수
     * @return 등급
     */
    public static VoicingDifficulty categorize(int score) {
        if (score <= BEGINNER_MAX_SCORE) {
            return VoicingDifficulty.BEGINNER;
        }
        if (score <= INTERMEDIATE_MAX_SCORE) {
            return VoicingDifficulty.INTERMEDIATE;
        }
        return VoicingDifficulty.ADVANCED;
    }

    /**
     * 운지의 난이도 등급.
     *
     * @param voicing 운지
     * @return 등급
     * @throws IllegalArgumentException voicing이 null인 경우
     */
    public static VoicingDifficulty difficulty(Voicing voicing) {
        return categorize(difficultyScore(voicing));
    }

    private static void requireVoicing(Voicing voicing) {
        if (voicing == null) {
            throw new IllegalArgumentException("voicing cannot be null");
        }
    }
}
