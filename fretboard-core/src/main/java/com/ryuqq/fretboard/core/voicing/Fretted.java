package com.ryuqq.fretboard.core.voicing;

/**
 * 프렛을 누른 현.
 *
 * @param fret 프렛 번호 (1 이상)
 * @param finger 손가락 1~4 (선택, null 가능)
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record Fretted(
    int fret,
    Integer finger
) implements StringPosition {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException fret이 1 미만이거나 finger가 1~4 범위를 벗어난 경우
     */
    public Fretted {
        if (fret < 1) {
            throw new IllegalArgumentException("fret must be >= 1 (current: " + fret + ")");
        }
        // finger는 null 허용
        if (finger != null && (finger < 1 || finger > 4)) {
            throw new IllegalArgumentException("finger must be between 1 and 4 (current: " + finger + ")");
        }
    }

    public boolean hasFinger() {
        return finger != null;
    }

    @Override
    public String symbol() {
        return fret >= 10 ? "(" + fret + ")" : Integer.toString(fret);
    }

    @Override
    public String toString() {
        return symbol();
    }
}
