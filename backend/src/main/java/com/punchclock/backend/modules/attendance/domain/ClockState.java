package com.punchclock.backend.modules.attendance.domain;

/**
 * Two-valued clock state, stored as a one-letter code in {@code user_states.state}.
 */
public enum ClockState {
    OUT("O"),
    IN("I");

    private final String code;

    ClockState(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isIn() {
        return this == IN;
    }

    public static ClockState fromCode(String code) {
        for (ClockState state : values()) {
            if (state.code.equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown clock state code: " + code);
    }
}
