package com.ryuqq.fretboard.core.theory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 악기의 단일 현 설정.
 *
 * @param openNote 개방현 피치 클래스
 * @param octave 개방현 옥타브 (예: 기타 6번 현 E2의 2)
 * @param fretCount 사용 가능한 프렛 수 (1 이상)
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record StringConfig(
    PitchClass openNote,
    int octave,
    int fretCount
) {

    /** 별도 지정이 없을 때의 프렛 수. */
    public static final int DEFAULT_FRET_COUNT = 22;

    private static final Pattern NOTE_PATTERN = Pattern.compile("^([A-Ga-g][#b]?)(-?\\d+)$");

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException openNote가 null이거나 fretCount가 양수가 아닌 경우
     */
    public StringConfig {
        if (openNote == null) {
            throw new IllegalArgumentException("openNote cannot be null");
        }
        if (fretCount <= 0) {
            throw new IllegalArgumentException(
                "fretCount must be positive (current: " + fretCount + ")"
            );
        }
    }

    /**
     * 기본 프렛 수(22)로 생성.
     *
     * @param openNote 개방현 피치 클래스
     * @param octave 개방현 옥타브
     */
    public StringConfig(PitchClass openNote, int octave) {
        this(openNote, octave, DEFAULT_FRET_COUNT);
    }

    /**
     * "E2", "F#3", "Bb1" 형식의 음 표기 파싱.
     *
     * @param note 음 표기
     * @param fretCount 프렛 수
     * @return StringConfig
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static StringConfig parse(String note, int fretCount) {
        if (note == null) {
            throw new IllegalArgumentException("note cannot be null");
        }
        Matcher matcher = NOTE_PATTERN.matcher(note.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "Invalid note format: \"" + note + "\". Expected \"E2\", \"G#3\", etc."
            );
        }
        PitchClass pitchClass = PitchClass.parse(matcher.group(1));
        int octave = Integer.parseInt(matcher.group(2));
        return new StringConfig(pitchClass, octave, fretCount);
    }

    public static StringConfig parse(String note) {
        return parse(note, DEFAULT_FRET_COUNT);
    }

    /**
     * 주어진 프렛에서 나는 피치 클래스 (카포 미적용).
     *
     * @param fret 프렛 번호 (0 = 개방현)
     * @return 피치 클래스
     * @throws IllegalArgumentException fret이 [0, fretCount] 범위를 벗어난 경우
     */
    public PitchClass noteAtFret(int fret) {
        if (fret < 0 || fret > fretCount) {
            throw new IllegalArgumentException(
                "fret must be between 0 and " + fretCount + " (current: " + fret + ")"
            );
        }
        return openNote.transpose(fret);
    }

    @Override
    public String toString() {
        return openNote.symbol() + octave;
    }
}
