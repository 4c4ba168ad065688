package work.lcod.choiceimport.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.SelectedValue;
import work.lcod.choiceimport.model.SourceCharacter.Reference;
import work.lcod.choiceimport.model.SourceCharacter.Subclass;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.SourceKind;

/**
 * Reshapes source class trees before they are resolved: kit names, per-domain feature groups,
 * class abilities translated from ids to names. Nothing here looks at the catalog.
 */
public final class DomainExtractors {
    private static final String DOMAIN_PREFIX = "domain-";
    private static final Pattern DOMAIN_SLUG = Pattern.compile("^domain-([^-]+)");

    private DomainExtractors() {}

    public static List<String> extractKits(List<LeveledFeatures<SourceFeatureNode>> levels) {
        var kits = new ArrayList<String>();
        for (var level : levels) {
            for (SourceFeatureNode feature : level.features()) {
                if (feature.kind() == SourceKind.KIT) {
                    kits.addAll(feature.selectedNames());
                }
            }
        }
        return kits;
    }

    /**
     * Every domain selected by a Domain node, in declaration order.
     */
    public static List<SelectedValue> selectedDomains(List<LeveledFeatures<SourceFeatureNode>> levels) {
        var domains = new ArrayList<SelectedValue>();
        for (var level : levels) {
            for (SourceFeatureNode feature : level.features()) {
                if (feature.kind() == SourceKind.DOMAIN) {
                    for (SelectedValue value : feature.selectedValues()) {
                        if (value.name() != null) {
                            domains.add(value);
                        }
                    }
                }
            }
        }
        return domains;
    }

    /**
     * Domain name to the Domain Feature selections that belong to it. Domains without any
     * feature selection are left out.
     */
    public static Map<String, List<LeveledFeatures<SourceFeatureNode>>> extractDomains(
        List<LeveledFeatures<SourceFeatureNode>> levels
    ) {
        var domains = new LinkedHashMap<String, List<LeveledFeatures<SourceFeatureNode>>>();
        for (SelectedValue domain : selectedDomains(levels)) {
            var features = extractDomainFeatures(domain.name(), levels);
            if (!features.isEmpty()) {
                domains.put(domain.name(), features);
            }
        }
        return domains;
    }

    public static List<LeveledFeatures<SourceFeatureNode>> extractDomainFeatures(
        String domainName,
        List<LeveledFeatures<SourceFeatureNode>> levels
    ) {
        var result = new ArrayList<LeveledFeatures<SourceFeatureNode>>();
        var domainKey = DOMAIN_PREFIX + domainName.toLowerCase(Locale.ROOT);
        for (var level : levels) {
            var features = new ArrayList<SourceFeatureNode>();
            for (SourceFeatureNode feature : level.features()) {
                if (feature.kind() != SourceKind.DOMAIN_FEATURE) {
                    continue;
                }
                for (SelectedValue value : feature.selectedValues()) {
                    if (value.id() != null && value.id().toLowerCase(Locale.ROOT).startsWith(domainKey)) {
                        features.add(asNode(value));
                    }
                }
            }
            if (!features.isEmpty()) {
                result.add(new LeveledFeatures<>(level.level(), features));
            }
        }
        return result;
    }

    /**
     * Flattens the class tree, rewriting Class Ability nodes so their {@code selectedIds} become
     * named selections looked up in {@code abilities}. Nodes with no known id keep their raw ids so
     * the resolver can report them.
     */
    public static List<SourceFeatureNode> translateClassAbilitySelections(
        List<LeveledFeatures<SourceFeatureNode>> levels,
        List<Reference> abilities
    ) {
        var translated = new ArrayList<SourceFeatureNode>();
        for (var level : levels) {
            for (SourceFeatureNode feature : level.features()) {
                if (feature.kind() == SourceKind.CLASS_ABILITY && !feature.selectedIds().isEmpty()) {
                    var selected = new ArrayList<SelectedValue>();
                    for (String selectedId : feature.selectedIds()) {
                        abilities.stream()
                            .filter(ability -> selectedId.equals(ability.id()))
                            .findFirst()
                            .ifPresent(ability -> selected.add(SelectedValue.of(ability.name(), ability.description(), ability.id())));
                    }
                    translated.add(selected.isEmpty() ? feature : feature.withSelectedValues(selected));
                } else {
                    translated.add(feature);
                }
            }
        }
        return translated;
    }

    public static Optional<Subclass> selectedSubclass(List<Subclass> subclasses) {
        return subclasses.stream().filter(Subclass::selected).findFirst();
    }

    /**
     * Capitalised domain name encoded in a feature id such as {@code domain-war-1}.
     */
    public static Optional<String> domainSlug(String featureId) {
        if (featureId == null) {
            return Optional.empty();
        }
        var matcher = DOMAIN_SLUG.matcher(featureId.toLowerCase(Locale.ROOT));
        if (!matcher.find()) {
            return Optional.empty();
        }
        var slug = matcher.group(1);
        return Optional.of(Character.toUpperCase(slug.charAt(0)) + slug.substring(1));
    }

    private static SourceFeatureNode asNode(SelectedValue value) {
        if (value.hasFeature()) {
            return value.feature();
        }
        return SourceFeatureNode.builder(SourceKind.UNKNOWN)
            .id(value.id())
            .name(value.name())
            .description(value.description())
            .build();
    }
}
