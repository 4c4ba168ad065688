package work.lcod.choiceimport.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Row storage for the target catalog.
 */
public interface Catalog {
    List<CatalogRow> rows(CatalogTable table);

    /**
     * Fast-path lookup maintained by the catalog itself. May miss names that only match under
     * fuzzy comparison.
     */
    Optional<CatalogRow> exactLookup(CatalogTable table, String name);
}
