package com.loteca.riskengine.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum Outcome {
    HOME('1'),
    DRAW('X'),
    AWAY('2');

    private static final Set<Outcome> ALL = Collections.unmodifiableSet(EnumSet.allOf(Outcome.class));

    private final char code;

    Outcome(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public int index() {
        return ordinal();
    }

    public int mask() {
        return 1 << ordinal();
    }

    public static Outcome fromCode(char code) {
        return switch (Character.toUpperCase(code)) {
            case '1' -> HOME;
            case 'X' -> DRAW;
            case '2' -> AWAY;
            default -> null;
        };
    }

    public static Set<Outcome> fullCover() {
        return ALL;
    }
}
