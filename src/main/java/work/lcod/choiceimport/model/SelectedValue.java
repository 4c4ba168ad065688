package work.lcod.choiceimport.model;

import java.util.List;

/**
 * One entry of a source node's selection list. Plain string selections only carry a name;
 * richer selections may also carry a nested feature (domain features) or their own leveled
 * features (domains).
 */
public record SelectedValue(
    String name,
    String description,
    String id,
    SourceFeatureNode feature,
    List<LeveledFeatures<SourceFeatureNode>> featuresByLevel
) {
    public SelectedValue {
        featuresByLevel = featuresByLevel == null ? List.of() : List.copyOf(featuresByLevel);
    }

    public static SelectedValue ofName(String name) {
        return new SelectedValue(name, null, null, null, List.of());
    }

    public static SelectedValue of(String name, String description, String id) {
        return new SelectedValue(name, description, id, null, List.of());
    }

    public SelectedValue withFeaturesByLevel(List<LeveledFeatures<SourceFeatureNode>> levels) {
        return new SelectedValue(name, description, id, feature, levels);
    }

    public boolean hasFeature() {
        return feature != null;
    }
}
