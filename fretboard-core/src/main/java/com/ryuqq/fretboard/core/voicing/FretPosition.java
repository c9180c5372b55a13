package com.ryuqq.fretboard.core.voicing;

/**
 * (현 인덱스, 프렛) 쌍. 프렛을 누른 현만 표현하며 손모양 비교 키로 쓰입니다.
 *
 * @param stringIndex 현 인덱스 (0 이상)
 * @param fret 프렛 번호 (1 이상)
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record FretPosition(int stringIndex, int fret) {

    public FretPosition {
        if (stringIndex < 0) {
            throw new IllegalArgumentException("stringIndex must be non-negative (current: " + stringIndex + ")");
        }
        if (fret < 1) {
            throw new IllegalArgumentException("fret must be >= 1 (current: " + fret + ")");
        }
    }
}
