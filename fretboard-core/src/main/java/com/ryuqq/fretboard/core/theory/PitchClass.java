package com.ryuqq.fretboard.core.theory;

/**
 * 옥타브를 무시한 12개의 피치 클래스.
 *
 * <p>표기는 샵(#) 기준이며, {@link #parse(String)}는 샵/플랫 표기를 모두 허용합니다.</p>
 *
 * <p><strong>불변식:</strong> {@link #transpose(int)}는 12를 법으로 닫혀 있습니다
 * (음수 반음 이동 포함).</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public enum PitchClass {

    C("C"),
    C_SHARP("C#"),
    D("D"),
    D_SHARP("D#"),
    E("E"),
    F("F"),
    F_SHARP("F#"),
    G("G"),
    G_SHARP("G#"),
    A("A"),
    A_SHARP("A#"),
    B("B");

    private static final int OCTAVE = 12;

    private final String symbol;

    PitchClass(String symbol) {
        this.symbol = symbol;
    }

    /**
     * 표시용 이름 조회 (예: "C#").
     *
     * @return 음 이름
     */
    public String symbol() {
        return symbol;
    }

    /**
     * 반음 단위로 이동한 피치 클래스 반환.
     *
     * @param semitones 이동할 반음 수 (음수 허용)
     * @return 이동된 PitchClass
     */
    public PitchClass transpose(int semitones) {
        int index = Math.floorMod(ordinal() + semitones, OCTAVE);
        return values()[index];
    }

    /**
     * 이 음에서 대상 음까지 위쪽 방향 반음 거리 (0~11).
     *
     * @param target 대상 음
     * @return 0 이상 11 이하의 반음 거리
     * @throws IllegalArgumentException target이 null인 경우
     */
    public int semitonesUpTo(PitchClass target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return Math.floorMod(target.ordinal() - ordinal(), OCTAVE);
    }

    /**
     * 음 이름 파싱.
     *
     * <p>대소문자를 구분하지 않으며, "Bb", "F#", "Cb", "E#" 같은 표기를 허용합니다.</p>
     *
     * @param input 음 이름
     * @return PitchClass
     * @throws IllegalArgumentException 알 수 없는 음 이름인 경우
     */
    public static PitchClass parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("pitch class cannot be null or blank");
        }
        String normalized = input.trim().toLowerCase();
        return switch (normalized) {
            case "c", "b#" -> C;
            case "c#", "db" -> C_SHARP;
            case "d" -> D;
            case "d#", "eb" -> D_SHARP;
            case "e", "fb" -> E;
            case "f", "e#" -> F;
            case "f#", "gb" -> F_SHARP;
            case "g" -> G;
            case "g#", "ab" -> G_SHARP;
            case "a" -> A;
            case "a#", "bb" -> A_SHARP;
            case "b", "cb" -> B;
            default -> throw new IllegalArgumentException("Invalid pitch class: \"" + input + "\"");
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
