package com.ryuqq.fretboard.application.capo;

import com.ryuqq.fretboard.core.theory.Chord;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 카포 위치 제안.
 *
 * <p>shapes는 원래 코드를 capoFret 반음만큼 내린 "잡는 모양"이며,
 * 카포가 나머지 이조를 담당합니다.</p>
 *
 * @param capoFret 카포 프렛 (0 = 카포 없음)
 * @param shapes 연주할 코드 모양 (원래 코드와 같은 순서)
 * @param originalChords 원래 코드 목록
 * @param difficultyScore 모양 난이도 합계 (낮을수록 쉬움)
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record CapoSuggestion(
    int capoFret,
    List<Chord> shapes,
    List<Chord> originalChords,
    double difficultyScore
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CapoSuggestion {
        if (capoFret < 0) {
            throw new IllegalArgumentException("capoFret must be non-negative (current: " + capoFret + ")");
        }
        if (shapes == null) {
            throw new IllegalArgumentException("shapes cannot be null");
        }
        if (originalChords == null) {
            throw new IllegalArgumentException("originalChords cannot be null");
        }
        if (shapes.size() != originalChords.size()) {
            throw new IllegalArgumentException(
                "shapes must match originalChords (shapes: " + shapes.size()
                    + ", originalChords: " + originalChords.size() + ")"
            );
        }
        shapes = List.copyOf(shapes);
        originalChords = List.copyOf(originalChords);
    }

    /**
     * 모양 코드 기호 목록 (예: ["E", "Am"]).
     *
     * @return 코드 기호 목록
     */
    public List<String> shapeSymbols() {
        return shapes.stream().map(Chord::symbol).collect(Collectors.toList());
    }

    /**
     * 사람이 읽는 설명 ("Capo fret 3: play C, G" 또는 "No capo needed").
     *
     * @return 설명
     */
    public String description() {
        if (capoFret == 0) {
            return "No capo needed";
        }
        return "Capo fret " + capoFret + ": play " + String.join(", ", shapeSymbols());
    }

    @Override
    public String toString() {
        return description();
    }
}
