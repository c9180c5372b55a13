package com.ryuqq.fretboard.core.theory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 근음 + 코드 타입 + (선택) 베이스 음으로 구성된 코드.
 *
 * <p>베이스 음이 있으면 슬래시 코드입니다 (예: C/G).</p>
 *
 * @param root 근음
 * @param type 코드 타입
 * @param bassNote 슬래시 코드의 베이스 음 (선택, null 가능)
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record Chord(
    PitchClass root,
    ChordType type,
    PitchClass bassNote
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException root 또는 type이 null인 경우
     */
    public Chord {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        // bassNote는 null 허용
    }

    /**
     * 베이스 음 없는 코드 생성.
     *
     * @param root 근음
     * @param type 코드 타입
     * @return Chord 인스턴스
     */
    public static Chord of(PitchClass root, ChordType type) {
        return new Chord(root, type, null);
    }

    /**
     * 슬래시 코드 생성.
     *
     * @param root 근음
     * @param type 코드 타입
     * @param bassNote 베이스 음
     * @return Chord 인스턴스
     */
    public static Chord of(PitchClass root, ChordType type, PitchClass bassNote) {
        return new Chord(root, type, bassNote);
    }

    public static Chord major(PitchClass root) {
        return new Chord(root, ChordType.MAJOR, null);
    }

    public static Chord minor(PitchClass root) {
        return new Chord(root, ChordType.MINOR, null);
    }

    /**
     * 코드 구성음 (근음부터, 중복 제거, 간격 순서 유지).
     *
     * @return 불변 피치 클래스 목록
     */
    public List<PitchClass> pitchClasses() {
        Set<PitchClass> tones = new LinkedHashSet<>();
        for (int interval : type.intervals()) {
            tones.add(root.transpose(interval));
        }
        return List.copyOf(tones);
    }

    public boolean hasBassNote() {
        return bassNote != null;
    }

    /**
     * 반음 단위 이조 (근음과 베이스 음 모두 이동).
     *
     * @param semitones 이동할 반음 수 (음수 허용)
     * @return 이조된 Chord
     */
    public Chord transpose(int semitones) {
        return new Chord(
            root.transpose(semitones),
            type,
            bassNote == null ? null : bassNote.transpose(semitones)
        );
    }

    /**
     * 코드 기호 (예: "Am", "G7", "C/G").
     *
     * @return 코드 기호
     */
    public String symbol() {
        String base = root.symbol() + type.symbol();
        return bassNote == null ? base : base + "/" + bassNote.symbol();
    }

    /**
     * 전체 이름 (예: "C major over G").
     *
     * @return 코드 이름
     */
    public String name() {
        String base = root.symbol() + " " + type.name();
        return bassNote == null ? base : base + " over " + bassNote.symbol();
    }

    @Override
    public String toString() {
        return symbol();
    }
}
