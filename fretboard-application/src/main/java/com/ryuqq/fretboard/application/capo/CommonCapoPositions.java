package com.ryuqq.fretboard.application.capo;

import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.ChordType;
import com.ryuqq.fretboard.core.theory.PitchClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.ryuqq.fretboard.core.theory.PitchClass.A;
import static com.ryuqq.fretboard.core.theory.PitchClass.A_SHARP;
import static com.ryuqq.fretboard.core.theory.PitchClass.B;
import static com.ryuqq.fretboard.core.theory.PitchClass.C;
import static com.ryuqq.fretboard.core.theory.PitchClass.C_SHARP;
import static com.ryuqq.fretboard.core.theory.PitchClass.D;
import static com.ryuqq.fretboard.core.theory.PitchClass.D_SHARP;
import static com.ryuqq.fretboard.core.theory.PitchClass.E;
import static com.ryuqq.fretboard.core.theory.PitchClass.F;
import static com.ryuqq.fretboard.core.theory.PitchClass.F_SHARP;
import static com.ryuqq.fretboard.core.theory.PitchClass.G;
import static com.ryuqq.fretboard.core.theory.PitchClass.G_SHARP;

/**
 * 어려운 코드를 쉬운 모양으로 바꾸는 대표적인 카포 위치 (설명용).
 *
 * <p>어려운 장3화음 근음 7개에 대해 {쉬운 모양 근음 → 카포 프렛}을 표로 제공합니다
 * (예: F → {E:1, D:3, C:5}). 표에 없는 근음이나 장3화음이 아닌 코드는
 * 쉬운 근음 집합으로부터의 위쪽 반음 거리로 계산합니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class CommonCapoPositions {

    private static final Map<PitchClass, Map<PitchClass, Integer>> MAJOR_TRANSFORMATIONS;

    static {
        Map<PitchClass, Map<PitchClass, Integer>> table = new EnumMap<>(PitchClass.class);
        table.put(F, Map.of(E, 1, D, 3, C, 5));
        table.put(A_SHARP, Map.of(A, 1, G, 3));
        table.put(D_SHARP, Map.of(D, 1, C, 3));
        table.put(G_SHARP, Map.of(G, 1));
        table.put(C_SHARP, Map.of(C, 1));
        table.put(F_SHARP, Map.of(E, 2));
        table.put(B, Map.of(A, 2));
        MAJOR_TRANSFORMATIONS = Collections.unmodifiableMap(table);
    }

    private static final List<PitchClass> EASY_MINOR_ROOTS = List.of(A, E, D);
    private static final List<PitchClass> EASY_ROOTS = List.of(C, G, D, E, A);

    // Utility class - prevent instantiation
    private CommonCapoPositions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 장3화음 변환표 (원래 근음 → {모양 근음 → 카포 프렛}).
     *
     * @return 불변 맵
     */
    public static Map<PitchClass, Map<PitchClass, Integer>> majorTransformations() {
        return MAJOR_TRANSFORMATIONS;
    }

    /**
     * 코드를 쉬운 모양으로 바꾸는 카포 프렛 목록 (오름차순).
     *
     * <ul>
     *   <li>표에 있는 장3화음: 표의 카포 프렛</li>
     *   <li>표에 없는 장3화음: [0] (이미 쉬운 코드)</li>
     *   <li>그 외: 쉬운 근음({A,E,D} 단조 / {C,G,D,E,A} 그 외)에서 코드 근음까지의 위쪽 반음 거리 (0 제외)</li>
     * </ul>
     *
     * @param chord 코드
     * @return 카포 프렛 목록
     * @throws IllegalArgumentException chord가 null인 경우
     */
    public static List<Integer> forChord(Chord chord) {
        if (chord == null) {
            throw new IllegalArgumentException("chord cannot be null");
        }
        if (!chord.type().equals(ChordType.MAJOR)) {
            return calculateCapoPositions(chord);
        }

        Map<PitchClass, Integer> transformations = MAJOR_TRANSFORMATIONS.get(chord.root());
        if (transformations == null) {
            return List.of(0);
        }
        List<Integer> positions = new ArrayList<>(transformations.values());
        Collections.sort(positions);
        return positions;
    }

    private static List<Integer> calculateCapoPositions(Chord chord) {
        List<PitchClass> easyRoots = chord.type().equals(ChordType.MINOR) ? EASY_MINOR_ROOTS : EASY_ROOTS;

        List<Integer> positions = new ArrayList<>();
        for (PitchClass easyRoot : easyRoots) {
            int semitones = easyRoot.semitonesUpTo(chord.root());
            if (semitones > 0) {
                positions.add(semitones);
            }
        }
        Collections.sort(positions);
        return positions;
    }
}
