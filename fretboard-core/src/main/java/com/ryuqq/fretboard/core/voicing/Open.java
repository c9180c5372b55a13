package com.ryuqq.fretboard.core.voicing;

/**
 * 개방현 (누르지 않고 연주).
 *
 * @author Fretboard Team
 * @since 1.0.0
 */
public record Open() implements StringPosition {

    static final Open INSTANCE = new Open();

    @Override
    public String symbol() {
        return "0";
    }

    @Override
    public String toString() {
        return symbol();
    }
}
