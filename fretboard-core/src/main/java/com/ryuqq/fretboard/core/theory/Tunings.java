package com.ryuqq.fretboard.core.theory;

/**
 * 자주 쓰이는 조율 프리셋.
 *
 * <p>{@code Tunings.GUITAR_DROP_D.applyTo(Instruments.GUITAR)}처럼 사용합니다.</p>
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public final class Tunings {

    public static final Tuning GUITAR_STANDARD = Tuning.parse("Standard", "E2 A2 D3 G3 B3 E4");
    public static final Tuning GUITAR_DROP_D = Tuning.parse("Drop D", "D2 A2 D3 G3 B3 E4");
    public static final Tuning GUITAR_OPEN_G = Tuning.parse("Open G", "D2 G2 D3 G3 B3 D4");
    public static final Tuning GUITAR_OPEN_D = Tuning.parse("Open D", "D2 A2 D3 F#3 A3 D4");
    public static final Tuning GUITAR_DADGAD = Tuning.parse("DADGAD", "D2 A2 D3 G3 A3 D4");
    public static final Tuning GUITAR_HALF_STEP_DOWN = Tuning.parse("Half Step Down", "Eb2 Ab2 Db3 Gb3 Bb3 Eb4");

    public static final Tuning UKULELE_STANDARD = Tuning.parse("Standard", "G4 C4 E4 A4", 15);
    public static final Tuning UKULELE_LOW_G = Tuning.parse("Low G", "G3 C4 E4 A4", 15);

    // Utility class - prevent instantiation
    private Tunings() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
