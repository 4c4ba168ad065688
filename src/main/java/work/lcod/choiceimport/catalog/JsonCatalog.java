package work.lcod.choiceimport.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.parse.TargetTreeReader;

/**
 * In-memory catalog loaded from a JSON or YAML document:
 * <pre>
 * tables:   { skills: [{id, name, hidden, category}], ... }
 * features: { &lt;entityId&gt;: [{level, features: [...]}] }
 * </pre>
 */
public final class JsonCatalog implements Catalog, LeveledFeatureLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonCatalog.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<CatalogTable, List<CatalogRow>> tables;
    private final Map<CatalogTable, Map<String, CatalogRow>> exactIndex;
    private final Map<String, List<LeveledFeatures<TargetFeatureNode>>> features;

    private JsonCatalog(
        Map<CatalogTable, List<CatalogRow>> tables,
        Map<String, List<LeveledFeatures<TargetFeatureNode>>> features
    ) {
        this.tables = new EnumMap<>(CatalogTable.class);
        this.exactIndex = new EnumMap<>(CatalogTable.class);
        tables.forEach((table, rows) -> {
            this.tables.put(table, List.copyOf(rows));
            var index = new HashMap<String, CatalogRow>();
            for (CatalogRow row : rows) {
                if (!row.hidden()) {
                    index.putIfAbsent(row.name().toLowerCase(Locale.ROOT), row);
                }
            }
            this.exactIndex.put(table, index);
        });
        this.features = new HashMap<>(features);
    }

    public static JsonCatalog load(Path path) {
        var fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        var mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (var in = Files.newInputStream(path)) {
            var catalog = fromTree(mapper.readTree(in));
            log.debug("Loaded catalog {} ({} tables, {} feature trees)", path, catalog.tables.size(), catalog.features.size());
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read catalog: " + path, ex);
        }
    }

    public static JsonCatalog parse(String json) {
        try {
            return fromTree(JSON_MAPPER.readTree(json));
        } catch (IOException ex) {
            throw new IllegalStateException("Invalid catalog document", ex);
        }
    }

    static JsonCatalog fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Catalog document must be an object");
        }
        var builder = builder();
        var tablesNode = root.path("tables");
        var tableNames = tablesNode.fieldNames();
        while (tableNames.hasNext()) {
            var tableName = tableNames.next();
            CatalogTable table;
            try {
                table = CatalogTable.fromTableName(tableName);
            } catch (IllegalArgumentException ex) {
                log.warn("Ignoring unknown catalog table [{}]", tableName);
                continue;
            }
            for (JsonNode row : tablesNode.get(tableName)) {
                var id = row.path("id").asText(null);
                if (id == null) {
                    continue;
                }
                builder.row(
                    table,
                    new CatalogRow(id, row.path("name").asText(""), row.path("hidden").asBoolean(false), row.path("category").asText(null))
                );
            }
        }
        var featuresNode = root.path("features");
        var entityIds = featuresNode.fieldNames();
        while (entityIds.hasNext()) {
            var entityId = entityIds.next();
            builder.features(entityId, TargetTreeReader.readLeveled(featuresNode.get(entityId)));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<CatalogRow> rows(CatalogTable table) {
        return tables.getOrDefault(table, List.of());
    }

    @Override
    public Optional<CatalogRow> exactLookup(CatalogTable table, String name) {
        if (name == null) {
            return Optional.empty();
        }
        var index = exactIndex.get(table);
        return index == null ? Optional.empty() : Optional.ofNullable(index.get(name.toLowerCase(Locale.ROOT)));
    }

    @Override
    public List<LeveledFeatures<TargetFeatureNode>> expand(CatalogRow entity, int levelCap) {
        if (entity == null) {
            return List.of();
        }
        var levels = features.getOrDefault(entity.id(), List.of());
        var result = new ArrayList<LeveledFeatures<TargetFeatureNode>>();
        for (var bucket : levels) {
            if (bucket.level() <= levelCap) {
                result.add(bucket);
            }
        }
        return result;
    }

    public static final class Builder {
        private final Map<CatalogTable, List<CatalogRow>> tables = new EnumMap<>(CatalogTable.class);
        private final Map<String, List<LeveledFeatures<TargetFeatureNode>>> features = new LinkedHashMap<>();

        public Builder row(CatalogTable table, CatalogRow row) {
            tables.computeIfAbsent(table, key -> new ArrayList<>()).add(row);
            return this;
        }

        public Builder row(CatalogTable table, String id, String name) {
            return row(table, new CatalogRow(id, name, false, null));
        }

        public Builder features(String entityId, List<LeveledFeatures<TargetFeatureNode>> levels) {
            features.computeIfAbsent(entityId, key -> new ArrayList<>()).addAll(levels);
            return this;
        }

        public JsonCatalog build() {
            return new JsonCatalog(tables, features);
        }
    }
}
