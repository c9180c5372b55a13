package com.ryuqq.fretboard.core.voicing;

/**
 * 한 현의 운지 상태.
 *
 * <p>StringPosition은 세 가지 상태 중 정확히 하나입니다:</p>
 * <ul>
 *   <li>{@link Muted}: 연주하지 않음 (X)</li>
 *   <li>{@link Open}: 누르지 않고 연주 (0)</li>
 *   <li>{@link Fretted}: 1번 이상 프렛을 누름 (선택적으로 손가락 1~4 지정)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 "뮤트"와 "0번 프렛(개방현)"이 혼동되지 않으며,
 * 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public sealed interface StringPosition permits Muted, Open, Fretted {

    /**
     * 뮤트 상태 생성.
     *
     * @return Muted 인스턴스
     */
    static StringPosition muted() {
        return Muted.INSTANCE;
    }

    /**
     * 개방현 상태 생성.
     *
     * @return Open 인스턴스
     */
    static StringPosition open() {
        return Open.INSTANCE;
    }

    /**
     * 손가락 지정 없이 프렛 상태 생성.
     *
     * @param fret 프렛 번호 (1 이상)
     * @return Fretted 인스턴스
     * @throws IllegalArgumentException fret이 1 미만인 경우
     */
    static StringPosition fretted(int fret) {
        return new Fretted(fret, null);
    }

    /**
     * 손가락을 지정한 프렛 상태 생성.
     *
     * @param fret 프렛 번호 (1 이상)
     * @param finger 손가락 (1=검지 ~ 4=새끼)
     * @return Fretted 인스턴스
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    static StringPosition fretted(int fret, int finger) {
        return new Fretted(fret, finger);
    }

    /**
     * 프렛 번호로부터 상태 생성.
     *
     * @param fret null 또는 음수 = 뮤트, 0 = 개방현, 1 이상 = 프렛
     * @return StringPosition
     */
    static StringPosition ofFret(Integer fret) {
        if (fret == null || fret < 0) {
            return Muted.INSTANCE;
        }
        return fret == 0 ? Open.INSTANCE : new Fretted(fret, null);
    }

    default boolean isMuted() {
        return this instanceof Muted;
    }

    default boolean isOpen() {
        return this instanceof Open;
    }

    default boolean isFretted() {
        return this instanceof Fretted;
    }

    /**
     * 소리가 나는 현인지 확인 (개방현 또는 프렛).
     *
     * @return 연주 여부
     */
    default boolean isPlayed() {
        return !isMuted();
    }

    /**
     * 컴팩트 표기용 기호 (뮤트 "X", 개방현 "0", 10 이상 프렛은 괄호 표기).
     *
     * @return 기호
     */
    String symbol();
}
