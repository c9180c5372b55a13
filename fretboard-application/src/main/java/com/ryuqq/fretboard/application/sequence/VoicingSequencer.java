package com.ryuqq.fretboard.application.sequence;

import com.ryuqq.fretboard.core.voicing.Voicing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 이웃 코드와의 전환 비용을 기준으로 후보 운지를 고르는 선택기.
 *
 * <p><strong>순위 점수:</strong></p>
 * <pre>
 * score = round(0.6 × cost(previous, candidate) + 0.4 × cost(candidate, next))
 *       + preference 조정값
 *       + difficultyScore / 10   (정수 나눗셈)
 * </pre>
 *
 * <p>점수 오름차순 안정 정렬 후 0번째가 제안 운지입니다.
 * 바로 옆 코드만 고려하는 국소 최적화이며, 진행 전체의 최적해를 보장하지 않습니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class VoicingSequencer {

    private static final Logger log = LoggerFactory.getLogger(VoicingSequencer.class);

    static final double PREVIOUS_WEIGHT = 0.6;
    static final double NEXT_WEIGHT = 0.4;
    static final int DIFFICULTY_DIVISOR = 10;

    // Utility class - prevent instantiation
    private VoicingSequencer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 후보 운지 순위 계산.
     *
     * @param previous 이전 코드의 운지 (첫 코드면 null)
     * @param next 다음 코드의 운지 (마지막 코드면 null)
     * @param candidates 후보 운지 목록
     * @param preference 선호도
     * @return 점수 오름차순 목록 (candidates가 비어 있으면 빈 목록)
     * @throws IllegalArgumentException candidates 또는 preference가 null인 경우
     */
    public static List<RankedVoicing> rank(
        Voicing previous,
        Voicing next,
        List<Voicing> candidates,
        VoicingPreference preference
    ) {
        if (candidates == null) {
            throw new IllegalArgumentException("candidates cannot be null");
        }
        if (preference == null) {
            throw new IllegalArgumentException("preference cannot be null");
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Scored> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Voicing candidate = candidates.get(i);
            if (candidate == null) {
                throw new IllegalArgumentException("candidates cannot contain null (index: " + i + ")");
            }
            int costFromPrevious = VoicingTransition.calculateCost(previous, candidate);
            int costToNext = VoicingTransition.calculateCost(candidate, next);

            int score = (int) Math.round(costFromPrevious * PREVIOUS_WEIGHT + costToNext * NEXT_WEIGHT);
            score += preference.adjustment(candidate.requiresBarre());
            score += candidate.difficultyScore() / DIFFICULTY_DIVISOR;

            scored.add(new Scored(candidate, i, score));
        }

        scored.sort(Comparator.comparingInt(Scored::score));

        List<RankedVoicing> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored s = scored.get(i);
            ranked.add(new RankedVoicing(s.voicing(), s.originalIndex(), s.score(), i == 0));
        }
        return ranked;
    }

    /**
     * BALANCED 선호도로 순위 계산.
     */
    public static List<RankedVoicing> rank(Voicing previous, Voicing next, List<Voicing> candidates) {
        return rank(previous, next, candidates, VoicingPreference.BALANCED);
    }

    /**
     * 제안 운지의 원래 인덱스.
     *
     * @param previous 이전 코드의 운지 (null 가능)
     * @param next 다음 코드의 운지 (null 가능)
     * @param candidates 후보 운지 목록
     * @param preference 선호도
     * @return 제안 운지의 원래 인덱스 (candidates가 비어 있으면 0)
     */
    public static int suggestedIndex(
        Voicing previous,
        Voicing next,
        List<Voicing> candidates,
        VoicingPreference preference
    ) {
        List<RankedVoicing> ranked = rank(previous, next, candidates, preference);
        return ranked.isEmpty() ? 0 : ranked.get(0).originalIndex();
    }

    /**
     * 코드 진행 전체에 대해 운지를 왼쪽부터 차례로 선택.
     *
     * <p>i번째 코드는 (i-1)번째에서 이미 고른 운지와 (i+1)번째 후보의 첫 번째(가장 쉬운) 운지를
     * 이웃으로 삼아 순위를 매깁니다.</p>
     *
     * @param candidatesPerChord 코드별 후보 운지 목록 (보통 난이도 순)
     * @param preference 선호도
     * @return 코드별 선택된 운지 (입력이 비어 있으면 빈 목록)
     * @throws IllegalArgumentException 어떤 코드의 후보 목록이 null이거나 비어 있는 경우
     */
    public static List<Voicing> sequence(List<List<Voicing>> candidatesPerChord, VoicingPreference preference) {
        if (candidatesPerChord == null) {
            throw new IllegalArgumentException("candidatesPerChord cannot be null");
        }
        for (int i = 0; i < candidatesPerChord.size(); i++) {
            List<Voicing> candidates = candidatesPerChord.get(i);
            if (candidates == null || candidates.isEmpty()) {
                throw new IllegalArgumentException("candidates for chord " + i + " cannot be null or empty");
            }
        }

        List<Voicing> chosen = new ArrayList<>(candidatesPerChord.size());
        Voicing previous = null;
        int totalCost = 0;
        for (int i = 0; i < candidatesPerChord.size(); i++) {
            Voicing next = i + 1 < candidatesPerChord.size() ? candidatesPerChord.get(i + 1).get(0) : null;
            List<RankedVoicing> ranked = rank(previous, next, candidatesPerChord.get(i), preference);
            Voicing pick = ranked.get(0).voicing();
            totalCost += VoicingTransition.calculateCost(previous, pick);
            chosen.add(pick);
            previous = pick;
        }

        log.debug("Sequenced {} chords with {} preference, total transition cost {}",
            chosen.size(), preference, totalCost);
        return chosen;
    }

    private record Scored(Voicing voicing, int originalIndex, int score) {
    }
}
