package com.ryuqq.fretboard.application.search;

import com.ryuqq.fretboard.core.difficulty.VoicingDifficulty;

/**
 * VoicingSearch 설정 (불변 record).
 *
 * <p>이 record는 운지 탐색 범위와 필터 조건을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxFretSpan: 최저~최고 누른 프렛 간 최대 거리 (기본 4)</li>
 *   <li>minFret / maxFret: 탐색할 프렛 창 (기본 0~12, 카포 기준 상대 프렛)</li>
 *   <li>rootInBass: 가장 낮은 연주 현이 근음이어야 하는지 (기본 true)</li>
 *   <li>allowInteriorMutes: 연주 현 사이의 뮤트 허용 여부 (기본 true)</li>
 *   <li>minStringsPlayed: 최소 연주 현 수 (기본 3)</li>
 *   <li>maxMutedStrings: 최대 뮤트 현 수 (기본 2)</li>
 *   <li>maxFingers: 최대 필요 손가락 수 (기본 4)</li>
 *   <li>maxDifficulty: 난이도 상한 (기본 없음, null)</li>
 * </ul>
 *
 * <p><strong>프리셋:</strong></p>
 * <ul>
 *   <li>{@link #BEGINNER}: 폭 3, 0~5프렛, 내부 뮤트 금지, 4현 이상, 뮤트 1개 이하, 초급 난이도</li>
 *   <li>{@link #INTERMEDIATE}: 0~9프렛, 4현 이상, 중급 난이도 이하</li>
 *   <li>{@link #ADVANCED}: 폭 5, 근음 베이스 불필요, 뮤트 3개 이하</li>
 * </ul>
 *
 * @author Fretboard Team
 * @since 1.0.0
 * @param maxFretSpan 최대 프렛 폭 (0 이상)
 * @param minFret 탐색 시작 프렛 (0 이상)
 * @param maxFret 탐색 끝 프렛 (minFret 이상)
 * @param rootInBass 근음 베이스 필수 여부
 * @param allowInteriorMutes 내부 뮤트 허용 여부
 * @param minStringsPlayed 최소 연주 현 수 (1 이상)
 * @param maxMutedStrings 최대 뮤트 현 수 (0 이상)
 * @param maxFingers 최대 손가락 수 (1 이상)
 * @param maxDifficulty 난이도 상한 (선택, null 가능)
 */
public record VoicingSearchOptions(
    int maxFretSpan,
    int minFret,
    int maxFret,
    boolean rootInBass,
    boolean allowInteriorMutes,
    int minStringsPlayed,
    int maxMutedStrings,
    int maxFingers,
    VoicingDifficulty maxDifficulty
) {

    /** 초보자용: 좁은 폭, 낮은 포지션, 깔끔한 운지. */
    public static final VoicingSearchOptions BEGINNER =
        new VoicingSearchOptions(3, 0, 5, true, false, 4, 1, 4, VoicingDifficulty.BEGINNER);

    /** 중급자용: 9프렛까지, 4현 이상. */
    public static final VoicingSearchOptions INTERMEDIATE =
        new VoicingSearchOptions(4, 0, 9, true, true, 4, 2, 4, VoicingDifficulty.INTERMEDIATE);

    /** 고급자용: 자리바꿈 포함, 넓은 폭. */
    public static final VoicingSearchOptions ADVANCED =
        new VoicingSearchOptions(5, 0, 12, false, true, 3, 3, 4, null);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxFretSpan=4, minFret=0, maxFret=12, rootInBass=true,
     * allowInteriorMutes=true, minStringsPlayed=3, maxMutedStrings=2, maxFingers=4,
     * maxDifficulty=null</p>
     */
    public VoicingSearchOptions() {
        this(4, 0, 12, true, true, 3, 2, 4, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public VoicingSearchOptions {
        if (maxFretSpan < 0) {
            throw new IllegalArgumentException(
                "maxFretSpan must be non-negative (current: " + maxFretSpan + ")"
            );
        }
        if (minFret < 0) {
            throw new IllegalArgumentException(
                "minFret must be non-negative (current: " + minFret + ")"
            );
        }
        if (maxFret < minFret) {
            throw new IllegalArgumentException(
                "maxFret must be >= minFret (min: " + minFret + ", max: " + maxFret + ")"
            );
        }
        if (minStringsPlayed <= 0) {
            throw new IllegalArgumentException(
                "minStringsPlayed must be positive (current: " + minStringsPlayed + ")"
            );
        }
        if (maxMutedStrings < 0) {
            throw new IllegalArgumentException(
                "maxMutedStrings must be non-negative (current: " + maxMutedStrings + ")"
            );
        }
        if (maxFingers <= 0) {
            throw new IllegalArgumentException(
                "maxFingers must be positive (current: " + maxFingers + ")"
            );
        }
        // maxDifficulty는 null 허용
    }

    /**
     * maxFretSpan만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withMaxFretSpan(int maxFretSpan) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }

    /**
     * 프렛 창만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withFretWindow(int minFret, int maxFret) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }

    /**
     * rootInBass만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withRootInBass(boolean rootInBass) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }

    /**
     * allowInteriorMutes만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withAllowInteriorMutes(boolean allowInteriorMutes) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }

    /**
     * minStringsPlayed만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withMinStringsPlayed(int minStringsPlayed) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }

    /**
     * maxMutedStrings만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withMaxMutedStrings(int maxMutedStrings) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }

    /**
     * maxFingers만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withMaxFingers(int maxFingers) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }

    /**
     * maxDifficulty만 변경한 새 인스턴스 생성.
     */
    public VoicingSearchOptions withMaxDifficulty(VoicingDifficulty maxDifficulty) {
        return new VoicingSearchOptions(maxFretSpan, minFret, maxFret, rootInBass, allowInteriorMutes,
            minStringsPlayed, maxMutedStrings, maxFingers, maxDifficulty);
    }
}
