package work.lcod.choiceimport.shared;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Fuzzy name equality used for every cross-schema comparison: case folding, synonym translation,
 * accent folding and punctuation stripping.
 */
public final class NameNormalizer {
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9\\s;:!@#$%^&*()\\-+=?,]");
    private static final String DAMAGE_MODIFIER = "damage modifier";
    private static final String IMMUNITY = "Immunity";
    private static final Map<Character, String> FOLDS = Map.ofEntries(
        Map.entry('á', "a"), Map.entry('à', "a"), Map.entry('â', "a"), Map.entry('ä', "a"),
        Map.entry('é', "e"), Map.entry('è', "e"), Map.entry('ê', "e"), Map.entry('ë', "e"),
        Map.entry('í', "i"), Map.entry('ì', "i"), Map.entry('î', "i"), Map.entry('ï', "i"),
        Map.entry('ó', "o"), Map.entry('ò', "o"), Map.entry('ô', "o"), Map.entry('ö', "o"),
        Map.entry('ú', "u"), Map.entry('ù', "u"), Map.entry('û', "u"), Map.entry('ü', "u"),
        Map.entry('ñ', "n"), Map.entry('ç', "c"), Map.entry('ý', "y"),
        Map.entry('Á', "A"), Map.entry('À', "A"), Map.entry('Â', "A"), Map.entry('Ä', "A"),
        Map.entry('É', "E"), Map.entry('È', "E"), Map.entry('Ê', "E"), Map.entry('Ë', "E"),
        Map.entry('Í', "I"), Map.entry('Ì', "I"), Map.entry('Î', "I"), Map.entry('Ï', "I"),
        Map.entry('Ó', "O"), Map.entry('Ò', "O"), Map.entry('Ô', "O"), Map.entry('Ö', "O"),
        Map.entry('Ú', "U"), Map.entry('Ù', "U"), Map.entry('Û', "U"), Map.entry('Ü', "U"),
        Map.entry('Ñ', "N"), Map.entry('Ç', "C"), Map.entry('Ý', "Y"),
        Map.entry('Æ', "AE"), Map.entry('æ', "ae"),
        Map.entry('Ð', "D"), Map.entry('ð', "d"), Map.entry('Þ', "Th"), Map.entry('þ', "th"),
        Map.entry('Œ', "OE"), Map.entry('œ', "oe"), Map.entry('ß', "ss"),
        Map.entry('Ø', "O"), Map.entry('ø', "o"), Map.entry('Å', "A"), Map.entry('å', "a"),
        Map.entry('\u2013', "-"), Map.entry('\u2014', "-"), Map.entry('\u00AD', "-"),
        Map.entry('\u2018', "'"), Map.entry('\u2019', "'"),
        Map.entry('\u201C', "\""), Map.entry('\u201D', "\""),
        Map.entry('\u2026', "...")
    );

    private final SynonymTable synonyms;

    public NameNormalizer(SynonymTable synonyms) {
        this.synonyms = Objects.requireNonNull(synonyms, "synonyms");
    }

    public static NameNormalizer withDefaults() {
        return new NameNormalizer(SynonymTable.loadDefault());
    }

    public static String sanitize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        var folded = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement = FOLDS.get(c);
            if (replacement != null) {
                folded.append(replacement);
            } else {
                folded.append(c);
            }
        }
        return DISALLOWED.matcher(folded).replaceAll("").trim();
    }

    public String translate(String value) {
        return synonyms.translate(value);
    }

    /**
     * Comparison key: translated, sanitized and lower-cased.
     */
    public String normalize(String value) {
        return sanitize(translate(value == null ? "" : value.toLowerCase(Locale.ROOT))).toLowerCase(Locale.ROOT);
    }

    public boolean matches(String left, String right) {
        return normalize(left).equals(normalize(right));
    }

    public boolean startsWith(String value, String prefix) {
        return normalize(value).startsWith(normalize(prefix));
    }

    /**
     * Name used to find a feature-choice option. "Damage Modifier" selections carry the real
     * discriminator at the head of their description, up to the last "Immunity".
     */
    public String featureChoiceName(String name, String description) {
        String raw = name == null ? "" : name;
        if (DAMAGE_MODIFIER.equals(raw.toLowerCase(Locale.ROOT))) {
            if (description != null) {
                int at = description.lastIndexOf(IMMUNITY);
                if (at >= 0) {
                    return description.substring(0, at + IMMUNITY.length());
                }
            }
            return raw;
        }
        return translate(raw);
    }
}
