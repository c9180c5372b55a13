package com.ryuqq.fretboard.application.capo;

import com.ryuqq.fretboard.core.spi.ShapeDifficultyEstimator;
import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 코드 진행의 잡는 모양을 쉽게 만드는 카포 위치 제안.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * For capo = 0 .. maxCapoFret:
 *   1. 모든 코드를 capo 반음만큼 내려 잡는 모양 계산
 *   2. 모양마다 ShapeDifficultyEstimator 점수, 합계가 제안 점수
 * 점수 오름차순 안정 정렬 (동점이면 낮은 카포가 앞)
 * </pre>
 *
 * <p>항상 maxCapoFret + 1개의 제안을 반환하며, 코드 목록이 비어 있으면 빈 목록을 반환합니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class CapoSuggester {

    private static final Logger log = LoggerFactory.getLogger(CapoSuggester.class);

    /** 기본 최대 카포 프렛. */
    public static final int DEFAULT_MAX_CAPO_FRET = 12;

    private final Instrument instrument;
    private final int maxCapoFret;
    private final ShapeDifficultyEstimator estimator;

    /**
     * 기본 설정(maxCapoFret=12, 조회표 난이도)으로 생성.
     *
     * @param instrument 악기
     */
    public CapoSuggester(Instrument instrument) {
        this(instrument, DEFAULT_MAX_CAPO_FRET, new CuratedShapeDifficulty());
    }

    /**
     * maxCapoFret 지정 생성.
     *
     * @param instrument 악기
     * @param maxCapoFret 최대 카포 프렛 (0 이상)
     */
    public CapoSuggester(Instrument instrument, int maxCapoFret) {
        this(instrument, maxCapoFret, new CuratedShapeDifficulty());
    }

    /**
     * 생성자.
     *
     * @param instrument 악기
     * @param maxCapoFret 최대 카포 프렛 (0 이상)
     * @param estimator 모양 난이도 추정기
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CapoSuggester(Instrument instrument, int maxCapoFret, ShapeDifficultyEstimator estimator) {
        if (instrument == null) {
            throw new IllegalArgumentException("instrument cannot be null");
        }
        if (maxCapoFret < 0) {
            throw new IllegalArgumentException(
                "maxCapoFret must be non-negative (current: " + maxCapoFret + ")"
            );
        }
        if (estimator == null) {
            throw new IllegalArgumentException("estimator cannot be null");
        }
        this.instrument = instrument;
        this.maxCapoFret = maxCapoFret;
        this.estimator = estimator;
    }

    public Instrument getInstrument() {
        return instrument;
    }

    public int getMaxCapoFret() {
        return maxCapoFret;
    }

    /**
     * 카포 위치별 제안 (쉬운 순).
     *
     * @param chords 원래 코드 목록 (순서 유지)
     * @return maxCapoFret + 1개의 제안 (chords가 비어 있으면 빈 목록)
     * @throws IllegalArgumentException chords가 null이거나 null을 포함하는 경우
     */
    public List<CapoSuggestion> suggest(List<Chord> chords) {
        if (chords == null) {
            throw new IllegalArgumentException("chords cannot be null");
        }
        if (chords.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("chords cannot contain null");
        }
        if (chords.isEmpty()) {
            return List.of();
        }

        List<CapoSuggestion> suggestions = new ArrayList<>(maxCapoFret + 1);
        for (int capo = 0; capo <= maxCapoFret; capo++) {
            List<Chord> shapes = new ArrayList<>(chords.size());
            double score = 0.0;
            for (Chord chord : chords) {
                Chord shape = chord.transpose(-capo);
                shapes.add(shape);
                score += estimator.estimate(shape, instrument);
            }
            suggestions.add(new CapoSuggestion(capo, shapes, chords, score));
        }

        suggestions.sort(Comparator.comparingDouble(CapoSuggestion::difficultyScore));

        log.debug("Capo suggestion for {}: best={} ({})",
            chords, suggestions.get(0).capoFret(), suggestions.get(0).difficultyScore());
        return suggestions;
    }

    /**
     * 가장 쉬운 제안.
     *
     * @param chords 원래 코드 목록
     * @return 최선의 제안 (chords가 비어 있으면 empty)
     */
    public Optional<CapoSuggestion> suggestBest(List<Chord> chords) {
        List<CapoSuggestion> suggestions = suggest(chords);
        return suggestions.isEmpty() ? Optional.empty() : Optional.of(suggestions.get(0));
    }
}
