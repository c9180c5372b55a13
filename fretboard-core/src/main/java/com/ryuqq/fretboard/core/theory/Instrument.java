package com.ryuqq.fretboard.core.theory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 특정 조율과 카포 위치를 가진 현악기.
 *
 * <p>현은 낮은 음 → 높은 음 순서이며 (index 0 = 가장 낮은 현),
 * 카포는 모든 현의 실제 소리를 동일한 반음 수만큼 올립니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. {@code withXxx} 메서드는 새 인스턴스를 반환합니다.</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>현이 하나 이상이어야 함</li>
 *   <li>카포: 0 이상, 모든 현의 프렛 수 이하</li>
 * </ul>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class Instrument {

    private final String name;
    private final List<StringConfig> strings;
    private final int capo;

    private Instrument(String name, List<StringConfig> strings, int capo) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (strings == null || strings.isEmpty()) {
            throw new IllegalArgumentException("strings cannot be null or empty");
        }
        if (strings.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("strings cannot contain null");
        }
        if (capo < 0) {
            throw new IllegalArgumentException("capo must be non-negative (current: " + capo + ")");
        }
        for (StringConfig string : strings) {
            if (capo > string.fretCount()) {
                throw new IllegalArgumentException(
                    "capo must not exceed fretCount " + string.fretCount() + " (current: " + capo + ")"
                );
            }
        }
        this.name = name;
        this.strings = List.copyOf(strings);
        this.capo = capo;
    }

    /**
     * 카포 없는 악기 생성.
     *
     * @param name 악기 이름
     * @param strings 현 설정 (낮은 현 → 높은 현)
     * @return Instrument 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Instrument of(String name, List<StringConfig> strings) {
        return new Instrument(name, strings, 0);
    }

    /**
     * 조율로부터 악기 생성.
     *
     * @param name 악기 이름
     * @param tuning 조율
     * @return Instrument 인스턴스
     */
    public static Instrument of(String name, Tuning tuning) {
        if (tuning == null) {
            throw new IllegalArgumentException("tuning cannot be null");
        }
        return new Instrument(name, tuning.strings(), 0);
    }

    public String getName() {
        return name;
    }

    public List<StringConfig> getStrings() {
        return strings;
    }

    public int getCapo() {
        return capo;
    }

    public int stringCount() {
        return strings.size();
    }

    /**
     * 현 설정 조회.
     *
     * @param stringIndex 현 인덱스 (0 = 가장 낮은 현)
     * @return StringConfig
     * @throws IllegalArgumentException 인덱스가 범위를 벗어난 경우
     */
    public StringConfig string(int stringIndex) {
        checkStringIndex(stringIndex);
        return strings.get(stringIndex);
    }

    /**
     * 카포 위에서 사용 가능한 최대 프렛 (카포 기준 상대 프렛).
     *
     * @param stringIndex 현 인덱스
     * @return fretCount - capo
     */
    public int maxFret(int stringIndex) {
        return string(stringIndex).fretCount() - capo;
    }

    /**
     * 카포를 반영한 실제 소리의 피치 클래스.
     *
     * <p>fret은 카포 기준 상대 프렛입니다 (0 = 카포 위치의 개방현).</p>
     *
     * @param stringIndex 현 인덱스
     * @param fret 카포 기준 프렛 (0 이상)
     * @return 실제 소리의 피치 클래스
     * @throws IllegalArgumentException 인덱스 또는 프렛이 범위를 벗어난 경우
     */
    public PitchClass soundingPitchClass(int stringIndex, int fret) {
        if (fret < 0) {
            throw new IllegalArgumentException("fret must be non-negative (current: " + fret + ")");
        }
        return string(stringIndex).openNote().transpose(fret + capo);
    }

    /**
     * 카포 위치만 바꾼 새 인스턴스 생성.
     *
     * @param capo 카포 프렛 (0 = 카포 없음)
     * @return 새 Instrument
     * @throws IllegalArgumentException 카포 범위가 유효하지 않은 경우
     */
    public Instrument withCapo(int capo) {
        return new Instrument(name, strings, capo);
    }

    /**
     * 현 설정만 바꾼 새 인스턴스 생성 (카포 유지).
     *
     * @param newStrings 새 현 설정
     * @return 새 Instrument
     * @throws IllegalArgumentException 현 개수가 다른 경우
     */
    public Instrument withTuning(List<StringConfig> newStrings) {
        if (newStrings == null || newStrings.size() != strings.size()) {
            throw new IllegalArgumentException(
                "Tuning must have " + strings.size() + " strings (current: "
                    + (newStrings == null ? null : newStrings.size()) + ")"
            );
        }
        return new Instrument(name, newStrings, capo);
    }

    public Instrument withTuning(Tuning tuning) {
        if (tuning == null) {
            throw new IllegalArgumentException("tuning cannot be null");
        }
        return withTuning(tuning.strings());
    }

    private void checkStringIndex(int stringIndex) {
        if (stringIndex < 0 || stringIndex >= strings.size()) {
            throw new IllegalArgumentException(
                "stringIndex must be between 0 and " + (strings.size() - 1) + " (current: " + stringIndex + ")"
            );
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Instrument other = (Instrument) o;
        return capo == other.capo && name.equals(other.name) && strings.equals(other.strings);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + strings.hashCode();
        result = 31 * result + capo;
        return result;
    }

    @Override
    public String toString() {
        String tuning = strings.stream().map(StringConfig::toString).collect(Collectors.joining(" "));
        return capo == 0
            ? name + " (" + tuning + ")"
            : name + " (" + tuning + ", capo " + capo + ")";
    }
}
