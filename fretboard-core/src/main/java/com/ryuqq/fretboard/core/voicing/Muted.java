package com.ryuqq.fretboard.core.voicing;

/**
 * 뮤트된 현 (연주하지 않음).
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record Muted() implements StringPosition {

    static final Muted INSTANCE = new Muted();

    @Override
    public String symbol() {
        return "X";
    }

    @Override
    public String toString() {
        return symbol();
    }
}
