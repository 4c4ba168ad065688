package work.lcod.choiceimport.catalog;

import java.util.Objects;
import java.util.Optional;
import work.lcod.choiceimport.shared.LogContext;
import work.lcod.choiceimport.shared.NameNormalizer;

/**
 * Resolves a source name to a catalog row: the catalog's exact index first, then a fuzzy
 * scan over every visible row.
 */
public final class CatalogLookup {
    private final Catalog catalog;
    private final NameNormalizer normalizer;

    public CatalogLookup(Catalog catalog, NameNormalizer normalizer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public NameNormalizer normalizer() {
        return normalizer;
    }

    public Optional<CatalogRow> resolve(CatalogTable table, String name, LogContext log) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String translated = normalizer.translate(name);
        log.debug("Lookup [{}] as [{}] in [{}].", name, translated, table.tableName());

        Optional<CatalogRow> exact = catalog.exactLookup(table, translated);
        if (exact.isPresent()) {
            return exact;
        }

        log.debug("Lookup fallthrough [{}]->[{}].", table.tableName(), translated);
        for (CatalogRow row : catalog.rows(table)) {
            if (!row.hidden() && normalizer.matches(row.name(), translated)) {
                return Optional.of(row);
            }
        }
        return Optional.empty();
    }

    public Optional<String> resolveId(CatalogTable table, String name, LogContext log) {
        return resolve(table, name, log).map(CatalogRow::id);
    }
}
