package work.lcod.choiceimport.engine;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import work.lcod.choiceimport.catalog.CatalogLookup;
import work.lcod.choiceimport.model.Filter;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.shared.LogContext;

/**
 * Entry point of the reconciliation engine. Each call returns a fresh {@link ResolutionResult};
 * nothing is shared between calls.
 */
public final class ChoiceEngine {
    public static final int DEFAULT_MAX_DEPTH = 32;

    private final ChoiceResolver resolver;
    private final LogContext log;

    public ChoiceEngine(CatalogLookup lookup) {
        this(lookup, Clock.systemUTC(), DEFAULT_MAX_DEPTH, LogContext.root(ChoiceEngine.class));
    }

    public ChoiceEngine(CatalogLookup lookup, Clock clock, int maxDepth, LogContext log) {
        Objects.requireNonNull(lookup, "lookup");
        Objects.requireNonNull(clock, "clock");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.resolver = new ChoiceResolver(lookup, clock, maxDepth);
        this.log = Objects.requireNonNull(log, "log");
    }

    public LeveledChoiceResolver orchestrator(List<LeveledFeatures<TargetFeatureNode>> available) {
        return orchestrator(available, log);
    }

    public LeveledChoiceResolver orchestrator(List<LeveledFeatures<TargetFeatureNode>> available, LogContext context) {
        return new LeveledChoiceResolver(resolver, available, context);
    }

    public ResolutionResult resolveOne(SourceFeatureNode node, List<LeveledFeatures<TargetFeatureNode>> target, Filter filter) {
        var orchestrator = orchestrator(target);
        orchestrator.setFilter(filter);
        return orchestrator.processFeature(node);
    }

    public ResolutionResult resolveLeveled(
        List<LeveledFeatures<SourceFeatureNode>> source,
        List<LeveledFeatures<TargetFeatureNode>> target,
        Filter filter
    ) {
        var orchestrator = orchestrator(target);
        orchestrator.setFilter(filter);
        return orchestrator.processLeveled(source);
    }
}
