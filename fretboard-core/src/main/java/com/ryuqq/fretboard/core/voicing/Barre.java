package com.ryuqq.fretboard.core.voicing;

/**
 * 바레 (한 손가락으로 인접한 여러 현을 같은 프렛에서 누름).
 *
 * <p>Voicing 하나에 최대 하나의 바레만 허용됩니다.</p>
 *
 * @param fret 바레 프렛 (1 이상)
 * @param fromStringIndex 바레 시작 현 (가장 낮은 현, 포함)
 * @param toStringIndex 바레 끝 현 (가장 높은 현, 포함)
 * @param finger 바레 손가락 (1~4, 기본 1 = 검지)
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record Barre(
    int fret,
    int fromStringIndex,
    int toStringIndex,
    int finger
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Barre {
        if (fret < 1) {
            throw new IllegalArgumentException("fret must be >= 1 (current: " + fret + ")");
        }
        if (fromStringIndex < 0) {
            throw new IllegalArgumentException(
                "fromStringIndex must be non-negative (current: " + fromStringIndex + ")"
            );
        }
        if (toStringIndex < fromStringIndex) {
            throw new IllegalArgumentException(
                "toStringIndex must be >= fromStringIndex (from: " + fromStringIndex + ", to: " + toStringIndex + ")"
            );
        }
        if (finger < 1 || finger > 4) {
            throw new IllegalArgumentException("finger must be between 1 and 4 (current: " + finger + ")");
        }
    }

    /**
     * 검지(1) 바레 생성.
     *
     * @param fret 바레 프렛
     * @param fromStringIndex 시작 현
     * @param toStringIndex 끝 현
     * @return Barre 인스턴스
     */
    public static Barre of(int fret, int fromStringIndex, int toStringIndex) {
        return new Barre(fret, fromStringIndex, toStringIndex, 1);
    }

    /**
     * 바레가 덮는 현 개수.
     *
     * @return toStringIndex - fromStringIndex + 1
     */
    public int stringCount() {
        return toStringIndex - fromStringIndex + 1;
    }

    public boolean covers(int stringIndex) {
        return stringIndex >= fromStringIndex && stringIndex <= toStringIndex;
    }

    @Override
    public String toString() {
        return "Barre{fret=" + fret + ", strings=" + fromStringIndex + "-" + toStringIndex + '}';
    }
}
