package work.lcod.choiceimport.model;

import java.util.Locale;

/**
 * Declared type of a source selection node. Raw source tags are case-insensitive.
 */
public enum SourceKind {
    CHOICE("choice"),
    LANGUAGE_CHOICE("language choice"),
    PERK_CHOICE("perk"),
    SKILL_CHOICE("skill choice"),
    CLASS_ABILITY("class ability"),
    DOMAIN("domain"),
    DOMAIN_FEATURE("domain feature"),
    MULTIPLE_FEATURES("multiple features"),
    SUBCLASS("subclass"),
    DEITY("deity"),
    KIT("kit"),
    UNKNOWN("");

    private final String tag;

    SourceKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static SourceKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("ability".equals(normalized)) {
            return CLASS_ABILITY;
        }
        for (SourceKind kind : values()) {
            if (kind != UNKNOWN && kind.tag.equals(normalized)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
