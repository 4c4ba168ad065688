package work.lcod.choiceimport.shared;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Static source-name to catalog-name renames, loaded from the {@code translations.toml} resource.
 * Keys are matched case-insensitively.
 */
public final class SynonymTable {
    private static final String DEFAULT_RESOURCE = "/translations.toml";
    private static final String TABLE_KEY = "translations";

    private final Map<String, String> entries;

    private SynonymTable(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static SynonymTable of(Map<String, String> renames) {
        var normalized = new LinkedHashMap<String, String>();
        if (renames != null) {
            renames.forEach((from, to) -> {
                if (from != null && to != null) {
                    normalized.put(from.toLowerCase(Locale.ROOT), to);
                }
            });
        }
        return new SynonymTable(normalized);
    }

    public static SynonymTable loadDefault() {
        try (InputStream in = SynonymTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing synonym resource " + DEFAULT_RESOURCE);
            }
            TomlParseResult result = Toml.parse(in);
            if (result.hasErrors()) {
                throw new IllegalStateException("Invalid synonym resource: " + result.errors().get(0).toString());
            }
            return of(readTable(result.getTable(TABLE_KEY)));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read synonym resource " + DEFAULT_RESOURCE, ex);
        }
    }

    /**
     * Reads a {@code [translations]} style table; non-string values are skipped.
     */
    public static Map<String, String> readTable(TomlTable table) {
        var renames = new LinkedHashMap<String, String>();
        if (table == null || table.isEmpty()) {
            return renames;
        }
        for (var entry : table.toMap().entrySet()) {
            if (entry.getValue() instanceof String value) {
                renames.put(entry.getKey(), value);
            }
        }
        return renames;
    }

    public SynonymTable withOverrides(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<String, String>(entries);
        overrides.forEach((from, to) -> {
            if (from != null && to != null) {
                merged.put(from.toLowerCase(Locale.ROOT), to);
            }
        });
        return new SynonymTable(merged);
    }

    public String translate(String name) {
        if (name == null) {
            return "";
        }
        return entries.getOrDefault(name.toLowerCase(Locale.ROOT), name);
    }

    public int size() {
        return entries.size();
    }
}
