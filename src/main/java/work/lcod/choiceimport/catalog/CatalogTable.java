package work.lcod.choiceimport.catalog;

/**
 * Named catalog tables consulted during an import.
 */
public enum CatalogTable {
    SKILLS("skills"),
    LANGUAGES("languages"),
    FEATS("feats"),
    CLASSES("classes"),
    SUBCLASSES("subclasses"),
    DOMAINS("deityDomains"),
    DEITIES("deities"),
    KITS("kits"),
    RACES("races"),
    CULTURE_ASPECTS("cultureAspects"),
    BACKGROUNDS("backgrounds"),
    INCITING_INCIDENTS("incitingIncidents");

    private final String tableName;

    CatalogTable(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }

    public static CatalogTable fromTableName(String tableName) {
        for (CatalogTable table : values()) {
            if (table.tableName.equalsIgnoreCase(tableName)) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown catalog table: " + tableName);
    }
}
