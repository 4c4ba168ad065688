package work.lcod.choiceimport.engine;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import work.lcod.choiceimport.model.Filter;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.model.TargetType;
import work.lcod.choiceimport.shared.LogContext;
import work.lcod.choiceimport.shared.NameNormalizer;

/**
 * Locates the first slot of a given type in a target tree.
 *
 * <p>Every node of a scope is tried before any of their children, so declaration order at the
 * shallowest depth wins. A node that passes the filter lets all of its descendants pass too.
 */
final class TargetSearch {
    private final NameNormalizer normalizer;
    private final int maxDepth;

    TargetSearch(NameNormalizer normalizer, int maxDepth) {
        this.normalizer = normalizer;
        this.maxDepth = maxDepth;
    }

    Optional<TargetFeatureNode> findFirst(
        List<TargetFeatureNode> scope,
        TargetType type,
        Collection<String> categories,
        Filter filter,
        Predicate<TargetFeatureNode> accept,
        ResolutionResult result,
        LogContext log
    ) {
        var query = new Query(type, TargetFeatureNode.normalizeCategories(categories), filter, accept);
        var match = search(scope, query, filter.isEmpty(), 0, result, log);
        if (match != null) {
            log.debug("Matched {} [{}] ({})", type.typeName(), match.label(), match.guid());
        }
        return Optional.ofNullable(match);
    }

    private TargetFeatureNode search(
        List<TargetFeatureNode> nodes,
        Query query,
        boolean inheritedPass,
        int depth,
        ResolutionResult result,
        LogContext log
    ) {
        if (nodes.isEmpty()) {
            return null;
        }
        if (depth > maxDepth) {
            log.warn("!!!! Slot search for {} stopped at depth {}", query.type().typeName(), depth);
            result.addIssue(new ResolutionIssue(
                ResolutionIssue.Kind.DEPTH_EXCEEDED,
                query.type().typeName(),
                "Target tree nested deeper than " + maxDepth + " levels"
            ));
            return null;
        }
        for (TargetFeatureNode node : nodes) {
            if (passes(node, query.filter(), inheritedPass) && accepts(node, query)) {
                return node;
            }
        }
        for (TargetFeatureNode node : nodes) {
            var nested = search(node.children(), query, passes(node, query.filter(), inheritedPass), depth + 1, result, log);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private boolean accepts(TargetFeatureNode node, Query query) {
        return node.guid() != null
            && node.is(query.type())
            && categoriesMatch(node.categories(), query.categories())
            && query.accept().test(node);
    }

    boolean passes(TargetFeatureNode node, Filter filter, boolean inheritedPass) {
        if (inheritedPass || filter.isEmpty()) {
            return true;
        }
        for (var entry : filter.prefixes().entrySet()) {
            var value = filter.fieldValue(node, entry.getKey());
            if (value == null || !normalizer.startsWith(value, entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    static boolean categoriesMatch(Set<String> available, Set<String> requested) {
        if (requested.isEmpty()) {
            return true;
        }
        for (String category : requested) {
            if (available.contains(category)) {
                return true;
            }
        }
        return false;
    }

    private record Query(TargetType type, Set<String> categories, Filter filter, Predicate<TargetFeatureNode> accept) {}
}
