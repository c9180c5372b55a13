package com.ryuqq.fretboard.core.theory;

import java.util.List;

/**
 * 자주 쓰이는 현악기 프리셋.
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class Instruments {

    /** 6현 기타, 표준 조율 (E A D G B E). */
    public static final Instrument GUITAR = Instrument.of("Guitar", Tuning.parse("Standard", "E2 A2 D3 G3 B3 E4"));

    /** 4현 베이스, 표준 조율 (E A D G). */
    public static final Instrument BASS = Instrument.of("Bass", Tuning.parse("Standard", "E1 A1 D2 G2", 20));

    /** 우쿨렐레, C 조율 리엔트런트 (G C E A). */
    public static final Instrument UKULELE = Instrument.of("Ukulele", Tuning.parse("Standard", "G4 C4 E4 A4", 15));

    /** 카바키뉴, 표준 조율 (D G B D). */
    public static final Instrument CAVAQUINHO = Instrument.of("Cavaquinho", Tuning.parse("Standard", "D4 G4 B4 D5", 17));

    /** 5현 밴조, 오픈 G (G D G B D). */
    public static final Instrument BANJO = Instrument.of("Banjo", Tuning.parse("Open G", "G2 D3 G3 B3 D4"));

    /** 7현 기타, 표준 조율 (B E A D G B E). */
    public static final Instrument GUITAR_7_STRING =
        Instrument.of("7-String Guitar", Tuning.parse("Standard", "B1 E2 A2 D3 G3 B3 E4"));

    private static final List<Instrument> ALL = List.of(GUITAR, BASS, UKULELE, CAVAQUINHO, BANJO, GUITAR_7_STRING);

    // Utility class - prevent instantiation
    private Instruments() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<Instrument> all() {
        return ALL;
    }
}
