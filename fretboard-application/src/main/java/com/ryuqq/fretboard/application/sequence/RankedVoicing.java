package com.ryuqq.fretboard.application.sequence;

import com.ryuqq.fretboard.core.voicing.Voicing;

/**
 * 전환 비용 기준으로 순위가 매겨진 후보 운지.
 *
 * @param voicing 후보 운지
 * @param originalIndex 후보 목록에서의 원래 인덱스
 * @param transitionCost 순위 점수 (낮을수록 좋음)
 * @param isSuggested 1순위 여부
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record RankedVoicing(
    Voicing voicing,
    int originalIndex,
    int transitionCost,
    boolean isSuggested
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException voicing이 null이거나 originalIndex가 음수인 경우
     */
    public RankedVoicing {
        if (voicing == null) {
            throw new IllegalArgumentException("voicing cannot be null");
        }
        if (originalIndex < 0) {
            throw new IllegalArgumentException(
                "originalIndex must be non-negative (current: " + originalIndex + ")"
            );
        }
    }
}
