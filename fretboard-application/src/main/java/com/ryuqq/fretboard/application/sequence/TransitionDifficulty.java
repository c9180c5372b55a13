package com.ryuqq.fretboard.application.sequence;

/**
 * 운지 전환 난이도 (UI 색상 구분용).
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public enum TransitionDifficulty {

    /** 비용 20 미만. */
    EASY,

    /** 비용 20~50. */
    MEDIUM,

    /** 비용 50 초과. */
    HARD
}
