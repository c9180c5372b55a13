package com.ryuqq.fretboard.application.search;

import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.Instrument;
import com.ryuqq.fretboard.core.theory.PitchClass;
import com.ryuqq.fretboard.core.voicing.FretPosition;
import com.ryuqq.fretboard.core.voicing.Voicing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * 코드의 연주 가능한 운지를 모두 찾는 탐색기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 현마다 후보 프렛 계산 (뮤트 + 창 안에서 코드 구성음/베이스 음이 나는 프렛)
 * 2. 현 0 → N-1, 현 안에서는 뮤트 → 낮은 프렛 순으로 깊이 우선 조합 생성
 * 3. 조합마다 Voicing 생성 후 필터 검증
 * 4. 같은 손모양(누른 (현, 프렛) 집합)끼리 묶어 연주 현이 가장 많은 것만 유지
 * 5. 난이도 점수 오름차순 안정 정렬 (동점이면 생성 순서 유지)
 * </pre>
 *
 * <p><strong>필터 (모두 만족해야 통과):</strong></p>
 * <ul>
 *   <li>연주 현 수 &gt;= minStringsPlayed, 뮤트 현 수 &lt;= maxMutedStrings</li>
 *   <li>fretSpan &lt;= maxFretSpan, fingersRequired &lt;= maxFingers</li>
 *   <li>allowInteriorMutes가 false이면 내부 뮤트 없음</li>
 *   <li>근음 포함, 코드 구성음 외의 음 없음 (베이스 음 제외), 모든 구성음 포함</li>
 *   <li>rootInBass 또는 슬래시 베이스가 있으면 가장 낮은 연주 현이 베이스 음</li>
 *   <li>서로 다른 피치 클래스 2개 이상</li>
 *   <li>maxDifficulty가 있으면 그 등급 이하</li>
 * </ul>
 *
 * <p>조건을 만족하는 조합이 없으면 빈 목록을 반환합니다 (예외 아님).
 * 탐색은 동기적이며 상태가 없으므로 여러 스레드에서 공유해도 안전합니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class VoicingSearch {

    private static final Logger log = LoggerFactory.getLogger(VoicingSearch.class);

    private final Instrument instrument;
    private final VoicingSearchOptions options;

    /**
     * 기본 설정으로 생성.
     *
     * @param instrument 악기 (카포 포함)
     * @throws IllegalArgumentException instrument가 null인 경우
     */
    public VoicingSearch(Instrument instrument) {
        this(instrument, new VoicingSearchOptions());
    }

    /**
     * 생성자.
     *
     * @param instrument 악기 (카포 포함)
     * @param options 탐색 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public VoicingSearch(Instrument instrument, VoicingSearchOptions options) {
        if (instrument == null) {
            throw new IllegalArgumentException("instrument cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.instrument = instrument;
        this.options = options;
    }

    public Instrument getInstrument() {
        return instrument;
    }

    public VoicingSearchOptions getOptions() {
        return options;
    }

    /**
     * 코드의 유효한 운지를 모두 찾아 난이도 순으로 반환.
     *
     * @param chord 코드
     * @return 중복 제거 후 난이도 오름차순 운지 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException chord가 null인 경우
     */
    public List<Voicing> search(Chord chord) {
        if (chord == null) {
            throw new IllegalArgumentException("chord cannot be null");
        }

        // 1. 현별 후보 프렛
        Set<PitchClass> chordTones = new HashSet<>(chord.pitchClasses());
        Set<PitchClass> targets = new HashSet<>(chordTones);
        if (chord.hasBassNote()) {
            targets.add(chord.bassNote());
        }
        List<List<Integer>> fretOptions = new ArrayList<>(instrument.stringCount());
        for (int i = 0; i < instrument.stringCount(); i++) {
            fretOptions.add(fretOptionsFor(i, targets));
        }
        log.debug("Fret options for {} on {}: {}", chord, instrument, fretOptions);

        // 2~3. 조합 생성 및 필터
        List<Voicing> accepted = new ArrayList<>();
        int[] combinations = {0};
        enumerate(fretOptions, 0, new Integer[fretOptions.size()], 0, frets -> {
            combinations[0]++;
            Voicing voicing = Voicing.fromFrets(frets);
            if (isValid(voicing, chord, chordTones)) {
                accepted.add(voicing);
            }
        });

        // 4. 손모양 중복 제거
        List<Voicing> unique = deduplicate(accepted);

        // 5. 난이도 정렬 (List.sort는 안정 정렬)
        unique.sort(Comparator.comparingInt(Voicing::difficultyScore));

        log.debug("Voicing search for {} completed: {} unique, {} accepted out of {} combinations",
            chord, unique.size(), accepted.size(), combinations[0]);
        return unique;
    }

    /**
     * 가장 쉬운 운지 N개.
     *
     * @param chord 코드
     * @param limit 최대 개수 (0 이상)
     * @return 난이도 오름차순 운지 목록
     * @throws IllegalArgumentException limit이 음수인 경우
     */
    public List<Voicing> findEasiest(Chord chord, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
        List<Voicing> voicings = search(chord);
        return new ArrayList<>(voicings.subList(0, Math.min(limit, voicings.size())));
    }

    /**
     * 넥 위치(최저 누른 프렛, 개방 코드는 0)별로 묶은 운지.
     *
     * @param chord 코드
     * @return 위치 오름차순 맵 (각 목록은 난이도 순)
     */
    public Map<Integer, List<Voicing>> findGroupedByPosition(Chord chord) {
        Map<Integer, List<Voicing>> grouped = new TreeMap<>();
        for (Voicing voicing : search(chord)) {
            int position = voicing.lowestFret().orElse(0);
            grouped.computeIfAbsent(position, k -> new ArrayList<>()).add(voicing);
        }
        return Collections.unmodifiableMap(grouped);
    }

    /**
     * 같은 손모양(누른 (현, 프렛) 집합)의 운지 중 연주 현이 가장 많은 것만 유지.
     *
     * <p>동률이면 먼저 나온 것을 유지합니다. 결과 순서는 유지된 운지 자신이 입력에 나온 순서입니다
     * (더 풍부한 운지가 이전 운지를 대체하면 대체한 운지의 위치로 옮겨집니다).
     * 멱등: {@code deduplicate(deduplicate(x)).equals(deduplicate(x))}</p>
     *
     * @param voicings 운지 목록
     * @return 중복 제거된 새 목록
     * @throws IllegalArgumentException voicings가 null인 경우
     */
    public static List<Voicing> deduplicate(List<Voicing> voicings) {
        if (voicings == null) {
            throw new IllegalArgumentException("voicings cannot be null");
        }
        Map<Set<FretPosition>, Voicing> byShape = new LinkedHashMap<>();
        for (Voicing voicing : voicings) {
            Set<FretPosition> shape = voicing.frettedShape();
            Voicing existing = byShape.get(shape);
            if (existing == null) {
                byShape.put(shape, voicing);
            } else if (voicing.playedStringCount() > existing.playedStringCount()) {
                byShape.remove(shape);
                byShape.put(shape, voicing);
            }
        }
        return new ArrayList<>(byShape.values());
    }

    private List<Integer> fretOptionsFor(int stringIndex, Set<PitchClass> targets) {
        List<Integer> frets = new ArrayList<>();
        frets.add(null); // 뮤트는 항상 후보

        int upper = Math.min(options.maxFret(), instrument.maxFret(stringIndex));
        for (int fret = options.minFret(); fret <= upper; fret++) {
            if (targets.contains(instrument.soundingPitchClass(stringIndex, fret))) {
                frets.add(fret);
            }
        }
        return frets;
    }

    private void enumerate(
        List<List<Integer>> fretOptions,
        int stringIndex,
        Integer[] current,
        int mutedSoFar,
        Consumer<List<Integer>> onCombination
    ) {
        if (stringIndex == fretOptions.size()) {
            onCombination.accept(new ArrayList<>(Arrays.asList(current)));
            return;
        }
        for (Integer fret : fretOptions.get(stringIndex)) {
            int muted = fret == null ? mutedSoFar + 1 : mutedSoFar;
            // 뮤트 한도 초과 서브트리는 어떤 조합도 통과할 수 없음
            if (muted > options.maxMutedStrings()) {
                continue;
            }
            current[stringIndex] = fret;
            enumerate(fretOptions, stringIndex + 1, current, muted, onCombination);
        }
    }

    private boolean isValid(Voicing voicing, Chord chord, Set<PitchClass> chordTones) {
        if (voicing.playedStringCount() < options.minStringsPlayed()) {
            return false;
        }
        if (voicing.mutedStringCount() > options.maxMutedStrings()) {
            return false;
        }
        if (voicing.fretSpan() > options.maxFretSpan()) {
            return false;
        }
        if (voicing.fingersRequired() > options.maxFingers()) {
            return false;
        }
        if (!options.allowInteriorMutes() && voicing.hasInteriorMutes()) {
            return false;
        }

        List<PitchClass> played = voicing.pitchClassesOn(instrument);
        if (played.isEmpty() || !played.contains(chord.root())) {
            return false;
        }

        if (options.rootInBass() || chord.hasBassNote()) {
            PitchClass requiredBass = chord.hasBassNote() ? chord.bassNote() : chord.root();
            if (voicing.bassPitchClassOn(instrument) != requiredBass) {
                return false;
            }
        }

        Set<PitchClass> sounding = new HashSet<>(played);
        for (PitchClass pitch : sounding) {
            if (!chordTones.contains(pitch) && pitch != chord.bassNote()) {
                return false;
            }
        }
        if (!sounding.containsAll(chordTones)) {
            return false;
        }
        if (sounding.size() < 2) {
            return false;
        }

        return options.maxDifficulty() == null || voicing.difficulty().isAtMost(options.maxDifficulty());
    }
}
