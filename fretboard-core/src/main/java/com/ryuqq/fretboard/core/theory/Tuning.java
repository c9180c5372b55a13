package com.ryuqq.fretboard.core.theory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 이름이 붙은 조율 설정 (낮은 현 → 높은 현).
 *
 * @param name 조율 이름 (예: "Drop D")
 * @param strings 현 설정 목록
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record Tuning(
    String name,
    List<StringConfig> strings
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비어 있거나 strings가 비어 있는 경우
     */
    public Tuning {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (strings == null || strings.isEmpty()) {
            throw new IllegalArgumentException("strings cannot be null or empty");
        }
        if (strings.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("strings cannot contain null");
        }
        strings = List.copyOf(strings);
    }

    /**
     * 공백으로 구분된 음 표기 파싱.
     *
     * <p>예: {@code Tuning.parse("Drop D", "D2 A2 D3 G3 B3 E4", 22)}</p>
     *
     * @param name 조율 이름
     * @param notes 공백 구분 음 표기
     * @param fretCount 모든 현에 적용할 프렛 수
     * @return Tuning
     * @throws IllegalArgumentException 음 표기가 올바르지 않은 경우
     */
    public static Tuning parse(String name, String notes, int fretCount) {
        if (notes == null || notes.isBlank()) {
            throw new IllegalArgumentException("notes cannot be null or blank");
        }
        List<StringConfig> strings = new ArrayList<>();
        for (String note : notes.trim().split("\\s+")) {
            strings.add(StringConfig.parse(note, fretCount));
        }
        return new Tuning(name, strings);
    }

    public static Tuning parse(String name, String notes) {
        return parse(name, notes, StringConfig.DEFAULT_FRET_COUNT);
    }

    public int stringCount() {
        return strings.size();
    }

    /**
     * 악기에 조율 적용.
     *
     * @param instrument 대상 악기
     * @return 조율이 바뀐 새 Instrument (카포 유지)
     * @throws IllegalArgumentException 현 개수가 다른 경우
     */
    public Instrument applyTo(Instrument instrument) {
        if (instrument == null) {
            throw new IllegalArgumentException("instrument cannot be null");
        }
        return instrument.withTuning(this);
    }

    @Override
    public String toString() {
        return name + " (" + strings.stream().map(StringConfig::toString).collect(Collectors.joining(" ")) + ")";
    }
}
