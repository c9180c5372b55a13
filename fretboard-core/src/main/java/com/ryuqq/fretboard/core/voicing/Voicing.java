package com.ryuqq.fretboard.core.voicing;

import com.ryuqq.fretboard.core.difficulty.DifficultyModel;
import com.ryuqq.fretboard.core.difficulty.VoicingDifficulty;
import com.ryuqq.fretboard.core.theory.Chord;
import com.ryuqq.fretboard.core.theory.Instrument;
import com.ryuqq.fretboard.core.theory.PitchClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 특정 악기에서 코드를 잡는 하나의 구체적인 운지.
 *
 * <p>현마다 {@link StringPosition}을 하나씩 가지며 (낮은 현 → 높은 현),
 * 선택적으로 {@link Barre} 하나를 가질 수 있습니다.</p>
 *
 * <pre>
 * // Am: X02210
 * Voicing am = Voicing.of(List.of(
 *     StringPosition.muted(),      // E
 *     StringPosition.open(),       // A
 *     StringPosition.fretted(2),   // D
 *     StringPosition.fretted(2),   // G
 *     StringPosition.fretted(1),   // B
 *     StringPosition.open()        // e
 * ));
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 프렛 폭, 최저 프렛, 필요 손가락 수,
 * 난이도 점수는 저장하지 않고 매번 계산합니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class Voicing {

    private static final Pattern FRET_PATTERN = Pattern.compile("\\d+");

    private final List<StringPosition> positions;
    private final Barre barre;

    private Voicing(List<StringPosition> positions, Barre barre) {
        if (positions == null || positions.isEmpty()) {
            throw new IllegalArgumentException("positions cannot be null or empty");
        }
        if (positions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("positions cannot contain null");
        }
        if (barre != null && barre.toStringIndex() >= positions.size()) {
            throw new IllegalArgumentException(
                "barre must be within " + positions.size() + " strings (current: " + barre + ")"
            );
        }
        this.positions = List.copyOf(positions);
        this.barre = barre;
    }

    /**
     * 바레 없는 Voicing 생성.
     *
     * @param positions 현별 상태 (낮은 현 → 높은 현)
     * @return Voicing 인스턴스
     * @throws IllegalArgumentException positions가 비어 있거나 null을 포함하는 경우
     */
    public static Voicing of(List<StringPosition> positions) {
        return new Voicing(positions, null);
    }

    /**
     * 바레를 포함한 Voicing 생성.
     *
     * @param positions 현별 상태
     * @param barre 바레 (선택, null 가능)
     * @return Voicing 인스턴스
     * @throws IllegalArgumentException 바레 범위가 현 개수를 벗어난 경우
     */
    public static Voicing of(List<StringPosition> positions, Barre barre) {
        return new Voicing(positions, barre);
    }

    /**
     * 프렛 번호 목록으로 생성.
     *
     * @param frets null 또는 음수 = 뮤트, 0 = 개방현, 1 이상 = 프렛
     * @return Voicing 인스턴스
     */
    public static Voicing fromFrets(List<Integer> frets) {
        if (frets == null) {
            throw new IllegalArgumentException("frets cannot be null");
        }
        List<StringPosition> positions = new ArrayList<>(frets.size());
        for (Integer fret : frets) {
            positions.add(StringPosition.ofFret(fret));
        }
        return new Voicing(positions, null);
    }

    public static Voicing fromFrets(Integer... frets) {
        if (frets == null) {
            throw new IllegalArgumentException("frets cannot be null");
        }
        return fromFrets(Arrays.asList(frets));
    }

    /**
     * "X02210", "X-0-2-2-1-0", "x o 2 2 1 o", "X0(10)(10)90" 형식 파싱.
     *
     * <ul>
     *   <li>X/x = 뮤트, 0/O/o = 개방현</li>
     *   <li>구분자(-, 공백)가 있으면 토큰 단위, 없으면 문자 단위</li>
     *   <li>구분자가 없을 때 10 이상의 프렛은 괄호로 감쌈</li>
     * </ul>
     *
     * @param input 운지 표기
     * @return Voicing 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static Voicing parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("voicing cannot be null or blank");
        }
        String trimmed = input.trim();
        List<Integer> frets = new ArrayList<>();

        if (trimmed.contains("-") || trimmed.chars().anyMatch(Character::isWhitespace)) {
            for (String token : trimmed.split("[-\\s]+")) {
                frets.add(parseToken(token, input));
            }
        } else {
            int i = 0;
            while (i < trimmed.length()) {
                char c = trimmed.charAt(i);
                if (c == '(') {
                    int close = trimmed.indexOf(')', i);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unclosed parenthesis in voicing: \"" + input + "\"");
                    }
                    frets.add(parseToken(trimmed.substring(i + 1, close), input));
                    i = close + 1;
                } else {
                    frets.add(parseToken(String.valueOf(c), input));
                    i++;
                }
            }
        }
        return fromFrets(frets);
    }

    private static Integer parseToken(String token, String input) {
        String stripped = token.replace("(", "").replace(")", "");
        if (stripped.equalsIgnoreCase("x")) {
            return null;
        }
        if (stripped.equalsIgnoreCase("o")) {
            return 0;
        }
        if (!FRET_PATTERN.matcher(stripped).matches()) {
            throw new IllegalArgumentException("Invalid fret \"" + token + "\" in voicing: \"" + input + "\"");
        }
        try {
            return Integer.parseInt(stripped);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid fret \"" + token + "\" in voicing: \"" + input + "\"", e);
        }
    }

    public List<StringPosition> getPositions() {
        return positions;
    }

    /**
     * 현 상태 조회.
     *
     * @param stringIndex 현 인덱스
     * @return StringPosition
     */
    public StringPosition position(int stringIndex) {
        return positions.get(stringIndex);
    }

    /**
     * 바레 조회.
     *
     * @return 바레 (없으면 null)
     */
    public Barre getBarre() {
        return barre;
    }

    public boolean requiresBarre() {
        return barre != null;
    }

    public int stringCount() {
        return positions.size();
    }

    public int playedStringCount() {
        return (int) positions.stream().filter(StringPosition::isPlayed).count();
    }

    public int mutedStringCount() {
        return (int) positions.stream().filter(StringPosition::isMuted).count();
    }

    public int frettedStringCount() {
        return (int) positions.stream().filter(StringPosition::isFretted).count();
    }

    public int openStringCount() {
        return (int) positions.stream().filter(StringPosition::isOpen).count();
    }

    /**
     * 개방현/뮤트만으로 이루어졌는지 확인.
     *
     * @return 프렛을 누른 현이 없으면 true
     */
    public boolean isAllOpen() {
        return positions.stream().noneMatch(StringPosition::isFretted);
    }

    /**
     * 누른 프렛 중 가장 낮은 프렛 (개방현 제외).
     *
     * @return 최저 프렛 (누른 현이 없으면 empty)
     */
    public OptionalInt lowestFret() {
        return positions.stream()
            .filter(Fretted.class::isInstance)
            .mapToInt(p -> ((Fretted) p).fret())
            .min();
    }

    /**
     * 누른 프렛 중 가장 높은 프렛.
     *
     * @return 최고 프렛 (누른 현이 없으면 empty)
     */
    public OptionalInt highestFret() {
        return positions.stream()
            .filter(Fretted.class::isInstance)
            .mapToInt(p -> ((Fretted) p).fret())
            .max();
    }

    /**
     * 최고 프렛 - 최저 프렛. 누른 현이 하나 이하이면 0.
     *
     * @return 프렛 폭
     */
    public int fretSpan() {
        OptionalInt low = lowestFret();
        OptionalInt high = highestFret();
        if (low.isEmpty() || high.isEmpty()) {
            return 0;
        }
        return high.getAsInt() - low.getAsInt();
    }

    /**
     * 양쪽에 연주되는 현이 있는 뮤트 현의 개수.
     *
     * @return 내부 뮤트 현 개수
     */
    public int interiorMutedStringCount() {
        int first = -1;
        int last = -1;
        for (int i = 0; i < positions.size(); i++) {
            if (positions.get(i).isPlayed()) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        int count = 0;
        for (int i = first + 1; i < last; i++) {
            if (positions.get(i).isMuted()) {
                count++;
            }
        }
        return count;
    }

    public boolean hasInteriorMutes() {
        return interiorMutedStringCount() > 0;
    }

    /**
     * 프렛을 누른 현의 (현, 프렛) 집합. 개방현/뮤트/손가락 정보는 무시합니다.
     *
     * @return 불변 집합
     */
    public Set<FretPosition> frettedShape() {
        Set<FretPosition> shape = new HashSet<>();
        for (int i = 0; i < positions.size(); i++) {
            if (positions.get(i) instanceof Fretted fretted) {
                shape.add(new FretPosition(i, fretted.fret()));
            }
        }
        return Set.copyOf(shape);
    }

    public int fingersRequired() {
        return DifficultyModel.fingersRequired(this);
    }

    public int difficultyScore() {
        return DifficultyModel.difficultyScore(this);
    }

    public VoicingDifficulty difficulty() {
        return DifficultyModel.difficulty(this);
    }

    /**
     * 악기에서 실제로 나는 피치 클래스 (연주되는 현, 낮은 현 → 높은 현).
     *
     * @param instrument 악기 (카포 반영)
     * @return 피치 클래스 목록
     * @throws IllegalArgumentException 현 개수가 다른 경우
     */
    public List<PitchClass> pitchClassesOn(Instrument instrument) {
        checkStringCount(instrument);
        List<PitchClass> pitches = new ArrayList<>();
        for (int i = 0; i < positions.size(); i++) {
            StringPosition position = positions.get(i);
            if (position.isPlayed()) {
                pitches.add(instrument.soundingPitchClass(i, fretOf(position)));
            }
        }
        return pitches;
    }

    /**
     * 가장 낮은 연주 현의 피치 클래스.
     *
     * @param instrument 악기
     * @return 베이스 피치 클래스 (연주되는 현이 없으면 null)
     * @throws IllegalArgumentException 현 개수가 다른 경우
     */
    public PitchClass bassPitchClassOn(Instrument instrument) {
        checkStringCount(instrument);
        for (int i = 0; i < positions.size(); i++) {
            StringPosition position = positions.get(i);
            if (position.isPlayed()) {
                return instrument.soundingPitchClass(i, fretOf(position));
            }
        }
        return null;
    }

    /**
     * 이 운지가 해당 코드를 정확히 연주하는지 확인.
     *
     * <ul>
     *   <li>코드 구성음 외의 음이 없음 (슬래시 코드의 베이스 음은 허용)</li>
     *   <li>모든 코드 구성음이 포함됨</li>
     *   <li>근음이 포함됨</li>
     * </ul>
     *
     * @param chord 코드
     * @param instrument 악기
     * @return 연주 여부
     * @throws IllegalArgumentException 현 개수가 다른 경우
     */
    public boolean playsChord(Chord chord, Instrument instrument) {
        if (chord == null) {
            throw new IllegalArgumentException("chord cannot be null");
        }
        Set<PitchClass> sounding = new LinkedHashSet<>(pitchClassesOn(instrument));
        Set<PitchClass> allowed = new HashSet<>(chord.pitchClasses());
        if (chord.hasBassNote()) {
            allowed.add(chord.bassNote());
        }
        return allowed.containsAll(sounding)
            && sounding.containsAll(chord.pitchClasses())
            && sounding.contains(chord.root());
    }

    /**
     * 컴팩트 표기 (예: "X02210", "X0(10)(10)90").
     *
     * @return 컴팩트 문자열
     */
    public String toCompactString() {
        StringBuilder sb = new StringBuilder();
        for (StringPosition position : positions) {
            sb.append(position.symbol());
        }
        return sb.toString();
    }

    private void checkStringCount(Instrument instrument) {
        if (instrument == null) {
            throw new IllegalArgumentException("instrument cannot be null");
        }
        if (instrument.stringCount() != positions.size()) {
            throw new IllegalArgumentException(
                "Voicing has " + positions.size() + " positions but instrument has "
                    + instrument.stringCount() + " strings"
            );
        }
    }

    private static int fretOf(StringPosition position) {
        return position instanceof Fretted fretted ? fretted.fret() : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Voicing other = (Voicing) o;
        return positions.equals(other.positions) && Objects.equals(barre, other.barre);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positions, barre);
    }

    @Override
    public String toString() {
        return toCompactString();
    }
}
