package com.ryuqq.fretboard.application.sequence;

import com.ryuqq.fretboard.core.voicing.Fretted;
import com.ryuqq.fretboard.core.voicing.StringPosition;
import com.ryuqq.fretboard.core.voicing.Voicing;

/**
 * 두 운지 사이의 손 이동 비용 계산.
 *
 * <p><strong>비용 (0 이상, 낮을수록 쉬움):</strong></p>
 * <pre>
 * 10 × |lowestFret(from) - lowestFret(to)|     누른 현이 없으면 0으로 간주
 * + 현마다: 둘 다 누름 2 × |프렛 차이|, 한쪽만 누름 +3, 둘 다 개방/뮤트 0
 * + 15  한쪽만 바레
 * -  5  |fretSpan 차이| &lt;= 1 이고 |fingersRequired 차이| &lt;= 1 (비슷한 손모양)
 * </pre>
 *
 * <p>어느 한쪽이 없으면 (진행의 처음/끝) 비용은 0입니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class VoicingTransition {

    static final int POSITION_WEIGHT = 10;
    static final int FRET_MOVE_WEIGHT = 2;
    static final int FINGER_STATE_CHANGE = 3;
    static final int BARRE_CHANGE = 15;
    static final int SIMILAR_SHAPE_BONUS = 5;

    static final int EASY_BELOW = 20;
    static final int MEDIUM_MAX = 50;

    // Utility class - prevent instantiation
    private VoicingTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전환 비용 계산.
     *
     * @param from 이전 운지 (null 가능)
     * @param to 다음 운지 (null 가능)
     * @return 0 이상의 비용
     */
    public static int calculateCost(Voicing from, Voicing to) {
        if (from == null || to == null) {
            return 0;
        }

        int cost = 0;

        // 1. 넥 위치 이동
        int fromPosition = from.lowestFret().orElse(0);
        int toPosition = to.lowestFret().orElse(0);
        cost += Math.abs(fromPosition - toPosition) * POSITION_WEIGHT;

        // 2. 현별 손가락 이동
        int shared = Math.min(from.stringCount(), to.stringCount());
        for (int i = 0; i < shared; i++) {
            StringPosition fromPos = from.position(i);
            StringPosition toPos = to.position(i);
            if (fromPos instanceof Fretted a && toPos instanceof Fretted b) {
                cost += Math.abs(a.fret() - b.fret()) * FRET_MOVE_WEIGHT;
            } else if (fromPos.isFretted() != toPos.isFretted()) {
                cost += FINGER_STATE_CHANGE;
            }
        }

        // 3. 바레 상태 변화
        if (from.requiresBarre() != to.requiresBarre()) {
            cost += BARRE_CHANGE;
        }

        // 4. 비슷한 손모양
        if (hasSimilarShape(from, to)) {
            cost -= SIMILAR_SHAPE_BONUS;
        }

        return Math.max(cost, 0);
    }

    /**
     * 비용을 난이도로 분류 (20 미만 EASY, 50 이하 MEDIUM, 그 외 HARD).
     *
     * @param cost 전환 비용
     * @return 전환 난이도
     */
    public static TransitionDifficulty categorizeCost(int cost) {
        if (cost < EASY_BELOW) {
            return TransitionDifficulty.EASY;
        }
        if (cost <= MEDIUM_MAX) {
            return TransitionDifficulty.MEDIUM;
        }
        return TransitionDifficulty.HARD;
    }

    private static boolean hasSimilarShape(Voicing from, Voicing to) {
        int spanDiff = Math.abs(from.fretSpan() - to.fretSpan());
        int fingerDiff = Math.abs(from.fingersRequired() - to.fingersRequired());
        return spanDiff <= 1 && fingerDiff <= 1;
    }
}
