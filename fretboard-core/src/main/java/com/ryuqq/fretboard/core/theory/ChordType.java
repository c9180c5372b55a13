package com.ryuqq.fretboard.core.theory;

import java.util.List;

/**
 * 근음으로부터의 반음 간격으로 정의되는 코드 타입.
 *
 * <p>간격 목록의 첫 원소는 항상 0 (근음)입니다. 9도처럼 옥타브를 넘는 간격은
 * 12 이상의 값으로 표현되며, 피치 클래스 계산 시 12를 법으로 축약됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class ChordType {

    public static final ChordType MAJOR = new ChordType("major", "", List.of(0, 4, 7));
    public static final ChordType MINOR = new ChordType("minor", "m", List.of(0, 3, 7));
    public static final ChordType DIMINISHED = new ChordType("diminished", "dim", List.of(0, 3, 6));
    public static final ChordType AUGMENTED = new ChordType("augmented", "aug", List.of(0, 4, 8));
    public static final ChordType SUS2 = new ChordType("suspended 2nd", "sus2", List.of(0, 2, 7));
    public static final ChordType SUS4 = new ChordType("suspended 4th", "sus4", List.of(0, 5, 7));

    public static final ChordType DOMINANT_7 = new ChordType("dominant 7th", "7", List.of(0, 4, 7, 10));
    public static final ChordType MAJOR_7 = new ChordType("major 7th", "maj7", List.of(0, 4, 7, 11));
    public static final ChordType MINOR_7 = new ChordType("minor 7th", "m7", List.of(0, 3, 7, 10));
    public static final ChordType MINOR_MAJOR_7 = new ChordType("minor major 7th", "mMaj7", List.of(0, 3, 7, 11));
    public static final ChordType DIMINISHED_7 = new ChordType("diminished 7th", "dim7", List.of(0, 3, 6, 9));
    public static final ChordType HALF_DIMINISHED_7 = new ChordType("half-diminished 7th", "m7b5", List.of(0, 3, 6, 10));
    public static final ChordType AUGMENTED_7 = new ChordType("augmented 7th", "aug7", List.of(0, 4, 8, 10));

    public static final ChordType ADD_9 = new ChordType("add 9", "add9", List.of(0, 4, 7, 14));
    public static final ChordType MINOR_ADD_9 = new ChordType("minor add 9", "madd9", List.of(0, 3, 7, 14));
    public static final ChordType DOMINANT_9 = new ChordType("dominant 9th", "9", List.of(0, 4, 7, 10, 14));
    public static final ChordType MAJOR_9 = new ChordType("major 9th", "maj9", List.of(0, 4, 7, 11, 14));
    public static final ChordType MINOR_9 = new ChordType("minor 9th", "m9", List.of(0, 3, 7, 10, 14));

    public static final ChordType MAJOR_6 = new ChordType("major 6th", "6", List.of(0, 4, 7, 9));
    public static final ChordType MINOR_6 = new ChordType("minor 6th", "m6", List.of(0, 3, 7, 9));

    public static final ChordType POWER = new ChordType("power chord", "5", List.of(0, 7));

    private static final List<ChordType> ALL = List.of(
        MAJOR, MINOR, DIMINISHED, AUGMENTED, SUS2, SUS4,
        DOMINANT_7, MAJOR_7, MINOR_7, MINOR_MAJOR_7, DIMINISHED_7, HALF_DIMINISHED_7, AUGMENTED_7,
        ADD_9, MINOR_ADD_9, DOMINANT_9, MAJOR_9, MINOR_9,
        MAJOR_6, MINOR_6,
        POWER
    );

    private final String name;
    private final String symbol;
    private final List<Integer> intervals;

    /**
     * 코드 타입 생성.
     *
     * @param name 전체 이름 (예: "minor 7th")
     * @param symbol 코드 기호 접미사 (예: "m7", 장3화음은 빈 문자열)
     * @param intervals 근음 기준 반음 간격 (첫 원소는 0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ChordType(String name, String symbol, List<Integer> intervals) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (intervals == null || intervals.isEmpty()) {
            throw new IllegalArgumentException("intervals cannot be null or empty");
        }
        if (intervals.get(0) != 0) {
            throw new IllegalArgumentException(
                "first interval must be the root (0) (current: " + intervals.get(0) + ")"
            );
        }
        for (Integer interval : intervals) {
            if (interval == null || interval < 0) {
                throw new IllegalArgumentException(
                    "intervals must be non-negative (current: " + intervals + ")"
                );
            }
        }
        this.name = name;
        this.symbol = symbol;
        this.intervals = List.copyOf(intervals);
    }

    /**
     * 기본 제공되는 모든 코드 타입.
     *
     * @return 불변 목록
     */
    public static List<ChordType> all() {
        return ALL;
    }

    public String name() {
        return name;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * 근음 기준 반음 간격 (불변, 첫 원소 0).
     *
     * @return 간격 목록
     */
    public List<Integer> intervals() {
        return intervals;
    }

    public int noteCount() {
        return intervals.size();
    }

    public boolean isTriad() {
        return intervals.size() == 3;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChordType other = (ChordType) o;
        return name.equals(other.name) && symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + symbol.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
