package info.isaksson.erland.hackoutline.core;

import java.util.Locale;

/** Output shape of an outline request. */
public enum OutlineMode {
    /** Flat list of functions, classes and methods ({@code [{name, type, line, ...}]}). */
    LEGACY("legacy"),
    /** Structured tree with positions, spans and modifiers. */
    JSON("json"),
    /** Indented text dump. */
    DEBUG("debug");

    public final String cliValue;

    OutlineMode(String cliValue) {
        this.cliValue = cliValue;
    }

    public boolean isJson() {
        return switch (this) {
            case LEGACY, JSON -> true;
            case DEBUG -> false;
        };
    }

    public static OutlineMode parseCli(String v) {
        if (v == null) return JSON;
        String s = v.trim().toLowerCase(Locale.ROOT);
        for (OutlineMode m : values()) {
            if (m.cliValue.equals(s)) return m;
        }
        throw new IllegalArgumentException("Invalid value for --mode: " + v + " (expected one of: legacy|json|debug)");
    }
}
