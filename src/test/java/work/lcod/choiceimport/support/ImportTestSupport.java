package work.lcod.choiceimport.support;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import work.lcod.choiceimport.catalog.Catalog;
import work.lcod.choiceimport.catalog.CatalogLookup;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.model.TargetOption;
import work.lcod.choiceimport.model.TargetType;
import work.lcod.choiceimport.shared.NameNormalizer;

/**
 * Small builders for catalog slot trees so engine and importer suites can describe targets
 * inline instead of through JSON files.
 */
public final class ImportTestSupport {
    public static final Path FIXTURES = Path.of("src", "test", "resources", "fixtures").toAbsolutePath();

    private ImportTestSupport() {}

    public static Path fixture(String name) {
        return FIXTURES.resolve(name);
    }

    public static String readFixture(String name) {
        try {
            return Files.readString(fixture(name), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Missing fixture " + name, ex);
        }
    }

    public static CatalogLookup lookup(Catalog catalog) {
        return new CatalogLookup(catalog, NameNormalizer.withDefaults());
    }

    public static TargetFeatureNode slot(TargetType type, String guid, String name, List<String> categories) {
        return new TargetFeatureNode(type.typeName(), guid, name, null, TargetFeatureNode.normalizeCategories(categories), List.of(), List.of(), false);
    }

    public static TargetFeatureNode slot(TargetType type, String guid, String... categories) {
        return slot(type, guid, null, Arrays.asList(categories));
    }

    public static TargetFeatureNode featureChoice(String guid, String name, TargetOption... options) {
        return new TargetFeatureNode(
            TargetType.FEATURE_CHOICE.typeName(), guid, name, null, Set.of(), Arrays.asList(options), List.of(), false
        );
    }

    public static TargetFeatureNode deitySlot(String guid, boolean useSubclass) {
        return new TargetFeatureNode(TargetType.DEITY_CHOICE.typeName(), guid, "Deity", null, Set.of(), List.of(), List.of(), useSubclass);
    }

    /**
     * Untyped grouping node, the way catalogs wrap related slots.
     */
    public static TargetFeatureNode wrapper(String name, TargetFeatureNode... children) {
        return new TargetFeatureNode("CharacterFeature", null, name, null, Set.of(), List.of(), Arrays.asList(children), false);
    }

    public static LeveledFeatures<TargetFeatureNode> level(int level, TargetFeatureNode... nodes) {
        return new LeveledFeatures<>(level, Arrays.asList(nodes));
    }
}
