package com.ryuqq.fretboard.core.difficulty;

/**
 * 운지 난이도 등급.
 *
 * <p>{@link DifficultyModel#difficultyScore}를 기준으로 분류합니다:</p>
 * <ul>
 *   <li>BEGINNER: 점수 25 이하</li>
 *   <li>INTERMEDIATE: 점수 26~50</li>
 *   <li>ADVANCED: 점수 51 이상</li>
 * </ul>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public enum VoicingDifficulty {

    /** 개방 코드, 좁은 폭, 바레 없음. */
    BEGINNER,

    /** 바레나 넓은 스트레치 포함 가능. */
    INTERMEDIATE,

    /** 복잡한 운지, 큰 스트레치, 높은 포지션. */
    ADVANCED;

    /**
     * 이 등급이 상한 등급 이하인지 확인.
     *
     * @param limit 상한 등급
     * @return 이하이면 true
     * @throws IllegalArgumentException limit이 null인 경우
     */
    public boolean isAtMost(VoicingDifficulty limit) {
        if (limit == null) {
            throw new IllegalArgumentException("limit cannot be null");
        }
        return ordinal() <= limit.ordinal();
    }
}
