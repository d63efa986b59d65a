package com.opinion.builder.entity;

/**
 * Which binary result a price or trade refers to. The feed encodes it as 1 (Yes) or 2 (No).
 */
public enum OutcomeSide {
    YES(1),
    NO(2);

    private final int code;

    OutcomeSide(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static OutcomeSide fromCode(int code) {
        for (OutcomeSide side : values()) {
            if (side.code == code) {
                return side;
            }
        }
        throw new IllegalArgumentException("unknown outcomeSide " + code);
    }
}
