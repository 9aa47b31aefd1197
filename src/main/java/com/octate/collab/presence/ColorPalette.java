package com.octate.collab.presence;

import java.util.List;

/** Deterministic user colours: every participant computes the same colour for a user id. */
public final class ColorPalette {

    private static final List<String> COLORS = List.of(
        "#FF6B6B", "#4ECDC4", "#45B7D1", "#FFA07A",
        "#98D8C8", "#F7DC6F", "#BB8FCE", "#85C1E2"
    );

    private ColorPalette() {
    }

    public static String colorFor(String userId) {
        int hash = 0;
        for (int i = 0; i < userId.length(); i++) {
            hash = 31 * hash + userId.charAt(i);
        }
        return COLORS.get(Math.floorMod(hash, COLORS.size()));
    }
}
