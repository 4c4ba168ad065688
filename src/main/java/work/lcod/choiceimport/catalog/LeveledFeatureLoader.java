package work.lcod.choiceimport.catalog;

import java.util.List;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.TargetFeatureNode;

/**
 * Expands a class, subclass, domain or similar catalog entity into its leveled slot tree.
 */
@FunctionalInterface
public interface LeveledFeatureLoader {
    List<LeveledFeatures<TargetFeatureNode>> expand(CatalogRow entity, int levelCap);
}
