package com.flagship.wager_ledger.wager;

import java.util.Arrays;
import java.util.Optional;

public enum LineType {
    GAME_LINE("game_line", "Game Line"),
    PLAYER_PROP("player_prop", "Player Prop");

    private final String code;
    private final String label;

    LineType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<LineType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code))
                .findFirst();
    }
}
