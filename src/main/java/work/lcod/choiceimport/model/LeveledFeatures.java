package work.lcod.choiceimport.model;

import java.util.List;

/**
 * One level bucket of a leveled tree. Buckets are not assumed to be sorted or contiguous.
 */
public record LeveledFeatures<T>(int level, List<T> features) {
    public LeveledFeatures {
        features = features == null ? List.of() : List.copyOf(features);
    }
}
