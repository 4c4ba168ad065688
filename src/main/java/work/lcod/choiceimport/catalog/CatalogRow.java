package work.lcod.choiceimport.catalog;

import java.util.Objects;

public record CatalogRow(String id, String name, boolean hidden, String category) {
    public CatalogRow {
        Objects.requireNonNull(id, "id");
        name = name == null ? "" : name;
    }
}
