package com.hindsight.setforget.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Playing positions, carrying the FPL {@code element_type} code.
 */
public enum Position {
    GK(1), DEF(2), MID(3), FWD(4);

    private final int code;

    Position(int code) {
        this.code = code;
    }

    public boolean isOutfield() { return this != GK; }

    public static Optional<Position> fromCode(int code) {
        return Arrays.stream(values()).filter(p -> p.code == code).findFirst();
    }
}
