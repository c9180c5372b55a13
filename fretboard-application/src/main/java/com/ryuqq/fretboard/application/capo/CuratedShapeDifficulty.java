package com.ryuqq.fretboard.application.capo;

import com.ryuqq.fretboard.core.spi.ShapeDifficultyEstimator;
import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.ChordType;
import com.ryuqq.fretboard.core.theory.Instrument;
import com.ryuqq.fretboard.core.theory.PitchClass;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.fretboard.core.theory.PitchClass.A;
import static com.ryuqq.fretboard.core.theory.PitchClass.B;
import static com.ryuqq.fretboard.core.theory.PitchClass.C;
import static com.ryuqq.fretboard.core.theory.PitchClass.D;
import static com.ryuqq.fretboard.core.theory.PitchClass.E;
import static com.ryuqq.fretboard.core.theory.PitchClass.F;
import static com.ryuqq.fretboard.core.theory.PitchClass.G;

/**
 * 고정 조회표 기반 코드 모양 난이도 (기본 {@link ShapeDifficultyEstimator} 구현).
 *
 * <p>전체 운지 탐색 대신 코드 타입과 근음만 보고 점수를 매깁니다 (악기 무시):</p>
 * <ul>
 *   <li>1.0 쉬운 개방 코드: C G D E A / Am Em Dm / G7 C7 D7 E7 A7 / Am7 Em7 Dm7</li>
 *   <li>2.0 중간 개방 코드: F, B7, Fmaj7, Cmaj7, Dmaj7, Amaj7</li>
 *   <li>3.0 그 외 장/단3화음 (E형 또는 A형 바레로 가정)</li>
 *   <li>4.0 나머지</li>
 * </ul>
 *
 * <p>슬래시 코드의 베이스 음은 점수에 반영하지 않습니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class CuratedShapeDifficulty implements ShapeDifficultyEstimator {

    static final double EASY_OPEN = 1.0;
    static final double MODERATE_OPEN = 2.0;
    static final double SIMPLE_BARRE = 3.0;
    static final double OTHER = 4.0;

    private static final Map<ChordType, Set<PitchClass>> EASY_OPEN_SHAPES = Map.of(
        ChordType.MAJOR, EnumSet.of(C, G, D, E, A),
        ChordType.MINOR, EnumSet.of(A, E, D),
        ChordType.DOMINANT_7, EnumSet.of(G, C, D, E, A),
        ChordType.MINOR_7, EnumSet.of(A, E, D)
    );

    private static final Map<ChordType, Set<PitchClass>> MODERATE_OPEN_SHAPES = Map.of(
        ChordType.MAJOR, EnumSet.of(F),
        ChordType.DOMINANT_7, EnumSet.of(B),
        ChordType.MAJOR_7, EnumSet.of(F, C, D, A)
    );

    @Override
    public double estimate(Chord shape, Instrument instrument) {
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }
        ChordType type = shape.type();
        PitchClass root = shape.root();

        if (contains(EASY_OPEN_SHAPES, type, root)) {
            return EASY_OPEN;
        }
        if (contains(MODERATE_OPEN_SHAPES, type, root)) {
            return MODERATE_OPEN;
        }
        if (type.equals(ChordType.MAJOR) || type.equals(ChordType.MINOR)) {
            return SIMPLE_BARRE;
        }
        return OTHER;
    }

    private static boolean contains(Map<ChordType, Set<PitchClass>> table, ChordType type, PitchClass root) {
        Set<PitchClass> roots = table.get(type);
        return roots != null && roots.contains(root);
    }
}
