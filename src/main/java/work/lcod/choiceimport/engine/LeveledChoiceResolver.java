package work.lcod.choiceimport.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import work.lcod.choiceimport.model.Filter;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.model.TargetType;
import work.lcod.choiceimport.shared.LogContext;

/**
 * Drives the resolver over source selections against one expanded target tree.
 *
 * <p>Source levels and target levels are not paired: every source feature is matched against the
 * slots of all target levels at once. Results accumulate across calls, so one instance can serve
 * several differently filtered passes over the same tree.
 */
public final class LeveledChoiceResolver {
    private final ChoiceResolver resolver;
    private final List<LeveledFeatures<TargetFeatureNode>> available;
    private final List<TargetFeatureNode> scope;
    private final LogContext log;
    private final ResolutionResult result = new ResolutionResult();
    private Filter filter = Filter.none();

    LeveledChoiceResolver(ChoiceResolver resolver, List<LeveledFeatures<TargetFeatureNode>> available, LogContext log) {
        this.resolver = resolver;
        this.available = available == null ? List.of() : List.copyOf(available);
        this.log = log;
        var flattened = new ArrayList<TargetFeatureNode>();
        for (var level : this.available) {
            flattened.addAll(level.features());
        }
        this.scope = List.copyOf(flattened);
    }

    public List<LeveledFeatures<TargetFeatureNode>> availableFeatures() {
        return available;
    }

    public boolean isEmpty() {
        return scope.isEmpty();
    }

    public Filter filter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter == null ? Filter.none() : filter;
    }

    public void clearFilter() {
        this.filter = Filter.none();
    }

    public ResolutionResult processFeature(SourceFeatureNode feature) {
        if (scope.isEmpty()) {
            if (feature.hasSelections()) {
                log.warn("!!!! No target slots for [{}], its selections are discarded.", feature.label());
                result.addIssue(ResolutionIssue.unmatchedSlot(feature.label(), feature.kind().tag()));
            } else {
                log.debug("No target slots for [{}].", feature.label());
            }
            return result;
        }
        resolver.resolve(feature, scope, filter, result, log);
        return result;
    }

    public ResolutionResult process(List<SourceFeatureNode> features) {
        for (SourceFeatureNode feature : features) {
            processFeature(feature);
        }
        return result;
    }

    public ResolutionResult processLeveled(List<LeveledFeatures<SourceFeatureNode>> levels) {
        for (var level : levels) {
            log.debug("Source level {} ({} features)", level.level(), level.features().size());
            process(level.features());
        }
        return result;
    }

    /**
     * First slot of {@code type} under the current filter, without recording anything.
     */
    public Optional<TargetFeatureNode> findSlot(TargetType type, Predicate<TargetFeatureNode> accept) {
        return resolver.findSlot(scope, type, filter, accept, result, log);
    }

    public ResolutionResult result() {
        return result;
    }
}
