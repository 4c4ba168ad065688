package work.lcod.choiceimport.engine;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import work.lcod.choiceimport.catalog.CatalogLookup;
import work.lcod.choiceimport.catalog.CatalogRow;
import work.lcod.choiceimport.catalog.CatalogTable;
import work.lcod.choiceimport.extract.DomainExtractors;
import work.lcod.choiceimport.model.Filter;
import work.lcod.choiceimport.model.SelectedValue;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.model.TargetOption;
import work.lcod.choiceimport.model.TargetType;
import work.lcod.choiceimport.shared.LogContext;

/**
 * Matches one source selection node against a target scope and records what it finds.
 *
 * <p>Unresolvable selections are dropped whole: they leave no key in the choices table, only a
 * warning and an issue. The one exception is the synthetic domain key used when a class has no
 * deity slot.
 */
final class ChoiceResolver {
    static final String DEFAULT_DEITY = "All Domains";
    static final String DOMAINS_SUFFIX = "-domains";
    static final String SYNTHETIC_DEITY_PREFIX = "forge-steel-deity-";

    private final CatalogLookup lookup;
    private final TargetSearch search;
    private final Clock clock;
    private final int maxDepth;

    ChoiceResolver(CatalogLookup lookup, Clock clock, int maxDepth) {
        this.lookup = lookup;
        this.search = new TargetSearch(lookup.normalizer(), maxDepth);
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    void resolve(SourceFeatureNode node, List<TargetFeatureNode> scope, Filter filter, ResolutionResult result, LogContext log) {
        resolve(node, scope, filter, result, log, 0);
    }

    private void resolve(
        SourceFeatureNode node,
        List<TargetFeatureNode> scope,
        Filter filter,
        ResolutionResult result,
        LogContext log,
        int depth
    ) {
        if (depth > maxDepth) {
            log.warn("!!!! Feature [{}] nested deeper than {} levels, skipping.", node.label(), maxDepth);
            result.addIssue(new ResolutionIssue(ResolutionIssue.Kind.DEPTH_EXCEEDED, node.label(), "Source tree nested deeper than " + maxDepth + " levels"));
            return;
        }
        log.debug("Process [{}] [{}] filter {}", node.kind(), node.label(), filter);
        switch (node.kind()) {
            case CHOICE, CLASS_ABILITY -> resolveFeatureChoice(node, scope, filter, result, log);
            case LANGUAGE_CHOICE -> resolveTableChoice(node, node.selectedNames(), "Language", CatalogTable.LANGUAGES, TargetType.LANGUAGE_CHOICE, scope, filter, result, log);
            case SKILL_CHOICE -> resolveTableChoice(node, node.selectedNames(), "Skill", CatalogTable.SKILLS, TargetType.SKILL_CHOICE, scope, filter, result, log);
            case PERK_CHOICE -> resolveTableChoice(node, node.selectedNames(), "Perk", CatalogTable.FEATS, TargetType.FEAT_CHOICE, scope, filter, result, log);
            case DEITY -> resolveTableChoice(node, singleNames(node), "Deity", CatalogTable.DEITIES, TargetType.DEITY_CHOICE, scope, filter, result, log);
            case SUBCLASS -> resolveTableChoice(node, singleNames(node), "Subclass", CatalogTable.SUBCLASSES, TargetType.SUBCLASS_CHOICE, scope, filter, result, log);
            case DOMAIN -> resolveDomains(node, scope, filter, result, log, depth);
            case DOMAIN_FEATURE -> resolveDomainFeatures(node, scope, result, log, depth);
            case MULTIPLE_FEATURES -> {
                for (SourceFeatureNode child : node.children()) {
                    resolve(child, scope, filter, result, log.nested(), depth + 1);
                }
            }
            case KIT -> log.debug("Kit [{}] is imported with the class.", node.label());
            case UNKNOWN -> log.info("Skipping feature [{}] of type [{}].", node.label(), node.rawType());
        }
    }

    private void resolveFeatureChoice(
        SourceFeatureNode node,
        List<TargetFeatureNode> scope,
        Filter filter,
        ResolutionResult result,
        LogContext log
    ) {
        for (String selectedId : node.selectedIds()) {
            if (node.selectedValues().stream().noneMatch(value -> selectedId.equalsIgnoreCase(value.id()))) {
                log.warn("!!!! Feature [{}] selection [{}] has no known ability name.", node.label(), selectedId);
                result.addIssue(ResolutionIssue.unresolvedName(selectedId, "abilities"));
            }
        }
        var normalizer = lookup.normalizer();
        for (SelectedValue value : node.selectedValues()) {
            var choiceName = normalizer.featureChoiceName(value.name(), value.description());
            log.info("Found Feature [{}] in import.", choiceName);
            var slot = search.findFirst(
                scope,
                TargetType.FEATURE_CHOICE,
                List.of(),
                filter,
                candidate -> findOption(candidate, choiceName).isPresent(),
                result,
                log
            );
            if (slot.isEmpty()) {
                log.warn("!!!! Matching Feature not found for [{}]!", choiceName);
                result.addIssue(ResolutionIssue.unmatchedSlot(choiceName, TargetType.FEATURE_CHOICE.typeName()));
                continue;
            }
            var option = findOption(slot.get(), choiceName).orElseThrow();
            log.info("Adding Feature [{}].", choiceName);
            record(slot.get(), option.guid(), result);
        }
    }

    private Optional<TargetOption> findOption(TargetFeatureNode node, String choiceName) {
        var normalizer = lookup.normalizer();
        return node.options().stream()
            .filter(option -> option.guid() != null && normalizer.matches(choiceName, option.name()))
            .findFirst();
    }

    private void resolveTableChoice(
        SourceFeatureNode node,
        List<String> names,
        String label,
        CatalogTable table,
        TargetType slotType,
        List<TargetFeatureNode> scope,
        Filter filter,
        ResolutionResult result,
        LogContext log
    ) {
        if (!node.listOptions().isEmpty()) {
            log.debug("{} choice [{}] scoped to [{}]", label, node.label(), CategoryIndex.key(node.listOptions()));
        }
        for (String name : names) {
            log.info("Found {} [{}] in import.", label, name);
            var row = lookup.resolve(table, name, log);
            if (row.isEmpty()) {
                log.warn("!!!! {} [{}] not found in catalog.", label, name);
                result.addIssue(ResolutionIssue.unresolvedName(name, table.tableName()));
                continue;
            }
            var slot = search.findFirst(scope, slotType, node.listOptions(), filter, candidate -> true, result, log);
            if (slot.isEmpty()) {
                log.warn("!!!! Matching {} slot not found for [{}]!", label, name);
                result.addIssue(ResolutionIssue.unmatchedSlot(name, slotType.typeName()));
                continue;
            }
            log.info("Adding {} [{}].", label, name);
            record(slot.get(), row.get().id(), result);
        }
    }

    /**
     * Records the default deity, every selected domain under {@code <deity slot>-domains}, then
     * resolves each domain's own features restricted to slots named after the domain.
     */
    private void resolveDomains(
        SourceFeatureNode node,
        List<TargetFeatureNode> scope,
        Filter filter,
        ResolutionResult result,
        LogContext log,
        int depth
    ) {
        var domains = node.selectedValues().stream().filter(value -> value.name() != null).toList();
        if (domains.isEmpty()) {
            log.debug("Domain node [{}] has no selection.", node.label());
            return;
        }

        String domainsKey;
        var deitySlot = search.findFirst(scope, TargetType.DEITY_CHOICE, List.of(), filter, candidate -> true, result, log);
        if (deitySlot.isPresent()) {
            var slot = deitySlot.get();
            result.recordMatch(slot);
            lookup.resolve(CatalogTable.DEITIES, DEFAULT_DEITY, log).ifPresentOrElse(
                deity -> {
                    log.info("Adding Deity [{}].", DEFAULT_DEITY);
                    result.choices().add(slot.guid(), deity.id());
                },
                () -> {
                    log.warn("!!!! Deity [{}] not found in catalog.", DEFAULT_DEITY);
                    result.addIssue(ResolutionIssue.unresolvedName(DEFAULT_DEITY, CatalogTable.DEITIES.tableName()));
                }
            );
            domainsKey = slot.guid() + DOMAINS_SUFFIX;
        } else {
            // Nothing downstream knows this key; kept so the domains are not lost outright.
            var synthetic = SYNTHETIC_DEITY_PREFIX + clock.instant().getEpochSecond();
            log.warn("!!!! Could not find deity choice slot, using synthetic id [{}].", synthetic);
            result.addIssue(new ResolutionIssue(
                ResolutionIssue.Kind.AMBIGUOUS_FALLBACK,
                synthetic,
                "No " + TargetType.DEITY_CHOICE.typeName() + " slot; domains recorded under a synthetic key"
            ));
            domainsKey = synthetic + DOMAINS_SUFFIX;
        }

        for (SelectedValue domain : domains) {
            log.info("Found Domain [{}] in import.", domain.name());
            Optional<CatalogRow> row = lookup.resolve(CatalogTable.DOMAINS, domain.name(), log);
            if (row.isEmpty()) {
                log.warn("!!!! Domain [{}] not found in catalog.", domain.name());
                result.addIssue(ResolutionIssue.unresolvedName(domain.name(), CatalogTable.DOMAINS.tableName()));
                continue;
            }
            log.info("Adding Domain [{}].", domain.name());
            result.choices().append(domainsKey, row.get().id());

            var domainFilter = Filter.byName(domain.name() + " Domain");
            var nested = log.nested();
            for (var level : domain.featuresByLevel()) {
                for (SourceFeatureNode feature : level.features()) {
                    resolve(feature, scope, domainFilter, result, nested, depth + 1);
                }
            }
        }
    }

    private void resolveDomainFeatures(
        SourceFeatureNode node,
        List<TargetFeatureNode> scope,
        ResolutionResult result,
        LogContext log,
        int depth
    ) {
        for (SelectedValue value : node.selectedValues()) {
            if (!value.hasFeature()) {
                log.debug("Domain feature [{}] carries no nested selection.", value.name());
                continue;
            }
            var feature = value.feature();
            var slug = DomainExtractors.domainSlug(value.id() != null ? value.id() : feature.id());
            var scoped = slug.map(domain -> Filter.byName(domain + " Domain")).orElse(Filter.none());
            if (slug.isEmpty()) {
                log.debug("No domain in id [{}], resolving unfiltered.", value.id());
            }
            resolve(feature, scope, scoped, result, log.nested(), depth + 1);
        }
    }

    Optional<TargetFeatureNode> findSlot(
        List<TargetFeatureNode> scope,
        TargetType type,
        Filter filter,
        Predicate<TargetFeatureNode> accept,
        ResolutionResult result,
        LogContext log
    ) {
        return search.findFirst(scope, type, List.of(), filter, accept, result, log);
    }

    /**
     * Deity and subclass nodes name their pick either as a selection or as the node itself.
     */
    private static List<String> singleNames(SourceFeatureNode node) {
        if (node.selectedNames().isEmpty() && node.name() != null) {
            return List.of(node.name());
        }
        return node.selectedNames();
    }

    private static void record(TargetFeatureNode slot, String value, ResolutionResult result) {
        result.choices().add(slot.guid(), value);
        result.recordMatch(slot);
    }
}
