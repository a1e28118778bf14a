package io.dagmesh.util;

import java.util.UUID;

public final class Ids {
    private Ids() {
    }

    public static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }

    public static String orNew(String raw, String prefix) {
        return raw == null || raw.isBlank() ? newId(prefix) : raw.trim();
    }
}
