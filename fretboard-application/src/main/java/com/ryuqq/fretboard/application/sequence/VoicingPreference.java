package com.ryuqq.fretboard.application.sequence;

/**
 * 운지 선택 선호도.
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public enum VoicingPreference {

    /** 개방 코드 선호: 바레 +30, 바레 없음 -15. */
    PREFER_OPEN(30, -15),

    /** 바레 코드 선호: 바레 -15, 바레 없음 +25. */
    PREFER_BARRE(-15, 25),

    /** 조정 없음. */
    BALANCED(0, 0);

    private final int barreAdjustment;
    private final int nonBarreAdjustment;

    VoicingPreference(int barreAdjustment, int nonBarreAdjustment) {
        this.barreAdjustment = barreAdjustment;
        this.nonBarreAdjustment = nonBarreAdjustment;
    }

    /**
     * 순위 점수에 더할 조정값.
     *
     * @param requiresBarre 후보 운지의 바레 여부
     * @return 조정값
     */
    public int adjustment(boolean requiresBarre) {
        return requiresBarre ? barreAdjustment : nonBarreAdjustment;
    }
}
