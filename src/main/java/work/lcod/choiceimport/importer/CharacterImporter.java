package work.lcod.choiceimport.importer;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.choiceimport.catalog.CatalogLookup;
import work.lcod.choiceimport.catalog.CatalogRow;
import work.lcod.choiceimport.catalog.CatalogTable;
import work.lcod.choiceimport.catalog.LeveledFeatureLoader;
import work.lcod.choiceimport.engine.CategoryIndex;
import work.lcod.choiceimport.engine.ChoiceEngine;
import work.lcod.choiceimport.engine.LeveledChoiceResolver;
import work.lcod.choiceimport.engine.ResolutionIssue;
import work.lcod.choiceimport.engine.ResolutionResult;
import work.lcod.choiceimport.extract.DomainExtractors;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.SelectedValue;
import work.lcod.choiceimport.model.SourceCharacter;
import work.lcod.choiceimport.model.SourceCharacter.ClassSection;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.SourceKind;
import work.lcod.choiceimport.model.TargetFeatureNode;
import work.lcod.choiceimport.model.TargetType;
import work.lcod.choiceimport.parse.SourceDocumentParser;
import work.lcod.choiceimport.shared.LogContext;

/**
 * Imports a whole character section by section. Each section runs on its own; a missing or
 * unresolvable section is reported and the remaining sections still run.
 */
public final class CharacterImporter {
    private static final Map<String, String> ATTRIBUTE_KEYS = Map.of(
        "Might", "mgt",
        "Agility", "agl",
        "Reason", "rea",
        "Intuition", "inu",
        "Presence", "prs"
    );
    private static final Set<SourceKind> SEPARATELY_IMPORTED = Set.of(SourceKind.DOMAIN, SourceKind.DOMAIN_FEATURE, SourceKind.KIT);
    private static final int MAX_KITS = 2;
    private static final int MAX_DOMAIN_SUBCLASSES = 2;

    private final CatalogLookup lookup;
    private final LeveledFeatureLoader loader;
    private final ChoiceEngine engine;
    private final LogContext log;

    public CharacterImporter(CatalogLookup lookup, LeveledFeatureLoader loader, ChoiceEngine engine) {
        this(lookup, loader, engine, LogContext.root(CharacterImporter.class));
    }

    public CharacterImporter(CatalogLookup lookup, LeveledFeatureLoader loader, ChoiceEngine engine, LogContext log) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * @param levelCapOverride caps every expanded catalog tree; the class level is used when empty
     */
    public ImportedCharacter importCharacter(SourceCharacter source, Optional<Integer> levelCapOverride) {
        log.info("Importing character [{}].", source.name());
        var character = ImportedCharacter.builder(source.name());
        var total = new ResolutionResult();
        var classLevel = source.characterClass() == null ? 1 : Math.max(1, source.characterClass().level());
        int levelCap = levelCapOverride.orElse(classLevel);

        importAttributes(source, character, total);
        importAncestry(source, levelCap, character, total);
        importCulture(source, levelCap, character, total);
        importCareer(source, levelCap, character, total);
        importClass(source, levelCap, character, total);

        log.info("Import complete: {} choices, {} issues.", total.choices().size(), total.issues().size());
        return character.build(total.choices().toMap(), total.issues());
    }

    void importAttributes(SourceCharacter source, ImportedCharacter.Builder character, ResolutionResult total) {
        var section = log.nested();
        var cls = source.characterClass();
        if (cls == null || cls.characteristics().isEmpty()) {
            missingSection("class.characteristics", section, total);
            return;
        }
        for (var entry : cls.characteristics()) {
            var key = ATTRIBUTE_KEYS.get(entry.characteristic());
            if (key == null) {
                section.warn("!!!! Unknown characteristic [{}] in import.", entry.characteristic());
                continue;
            }
            section.info("Setting Attribute {} to {}.", key, String.format("%+d", entry.value()));
            character.attribute(key, entry.value());
        }
    }

    void importAncestry(SourceCharacter source, int levelCap, ImportedCharacter.Builder character, ResolutionResult total) {
        var section = log.nested();
        var ancestry = source.ancestry();
        if (ancestry == null) {
            missingSection("ancestry", section, total);
            return;
        }
        section.info("Ancestry [{}] found in import.", ancestry.name());
        var race = resolveRow(CatalogTable.RACES, ancestry.name(), "Ancestry", section, total);
        if (race.isEmpty()) {
            return;
        }
        character.lookup(ImportedCharacter.RACE, race.get().id());
        var orchestrator = orchestrator(race.get(), levelCap, section);
        total.mergeFrom(orchestrator.process(ancestry.features()));
    }

    void importCulture(SourceCharacter source, int levelCap, ImportedCharacter.Builder character, ResolutionResult total) {
        var section = log.nested();
        var culture = source.culture();
        if (culture == null) {
            missingSection("culture", section, total);
            return;
        }
        if (!culture.languages().isEmpty()) {
            var primary = culture.languages().get(0);
            section.info("Setting primary culture language [{}].", primary);
            resolveRow(CatalogTable.LANGUAGES, primary, "Language", section, total)
                .ifPresent(row -> character.lookup(ImportedCharacter.LANGUAGE, row.id()));
        }
        for (String aspectName : SourceDocumentParser.CULTURE_ASPECTS) {
            var aspect = culture.aspects().get(aspectName);
            if (aspect == null) {
                section.warn("!!!! Culture Aspect [{}] not found in import!", aspectName);
                total.addIssue(ResolutionIssue.malformedSection("culture." + aspectName, "Culture aspect missing from import"));
                continue;
            }
            section.info("Processing Culture Aspect [{}] [{}].", aspectName, aspect.label());
            var row = resolveRow(CatalogTable.CULTURE_ASPECTS, aspect.name(), "Culture Aspect", section, total);
            if (row.isEmpty()) {
                continue;
            }
            character.lookup(aspectName, row.get().id());
            var orchestrator = orchestrator(row.get(), levelCap, section.nested());
            total.mergeFrom(orchestrator.processFeature(aspect));
        }
    }

    void importCareer(SourceCharacter source, int levelCap, ImportedCharacter.Builder character, ResolutionResult total) {
        var section = log.nested();
        var career = source.career();
        if (career == null) {
            missingSection("career", section, total);
            return;
        }
        section.info("Found Career [{}] in import.", career.name());
        var background = resolveRow(CatalogTable.BACKGROUNDS, career.name(), "Career", section, total);
        background.ifPresent(row -> {
            character.lookup(ImportedCharacter.BACKGROUND, row.id());
            total.mergeFrom(orchestrator(row, levelCap, section).process(career.features()));
        });

        var incident = career.incitingIncident();
        if (incident == null || incident.selectedId() == null) {
            section.warn("!!!! No inciting incident selected.");
            return;
        }
        incident.options().stream()
            .filter(option -> option.id() != null && option.id().equalsIgnoreCase(incident.selectedId()))
            .findFirst()
            .ifPresentOrElse(
                option -> {
                    var name = lookup.normalizer().translate(option.name());
                    section.info("Found Inciting Incident [{}] in import.", name);
                    resolveRow(CatalogTable.INCITING_INCIDENTS, name, "Inciting Incident", section, total)
                        .ifPresent(row -> character.lookup(ImportedCharacter.INCITING_INCIDENT, row.id()));
                },
                () -> {
                    section.warn("!!!! Inciting incident [{}] is not among the listed options.", incident.selectedId());
                    total.addIssue(ResolutionIssue.malformedSection("career.incitingIncidents", "Selected id " + incident.selectedId() + " has no option"));
                }
            );
    }

    void importClass(SourceCharacter source, int levelCap, ImportedCharacter.Builder character, ResolutionResult total) {
        var section = log.nested();
        var cls = source.characterClass();
        if (cls == null || cls.name() == null) {
            missingSection("class", section, total);
            return;
        }
        section.info("Found Class [{}] Level [{}] in import.", cls.name(), cls.level());
        var classRow = resolveRow(CatalogTable.CLASSES, cls.name(), "Class", section, total);
        if (classRow.isEmpty()) {
            return;
        }
        section.info("Adding Class [{}] to character.", cls.name());
        character.lookup(ImportedCharacter.CLASS, classRow.get().id()).classLevel(cls.level());

        importKits(cls.featuresByLevel(), character, section, total);

        var classFill = orchestrator(classRow.get(), levelCap, section);
        if (classFill.isEmpty()) {
            section.warn("!!!! Class [{}] has no features up to level {}.", cls.name(), levelCap);
        }
        logSkillSlots(classFill.availableFeatures(), section);

        var deitySlot = classFill.findSlot(TargetType.DEITY_CHOICE, node -> true);
        boolean domainsAsSubclasses = deitySlot.map(TargetFeatureNode::useSubclass).orElse(false);
        if (domainsAsSubclasses) {
            importDomainsAsSubclasses(cls, classFill, levelCap, section, total);
        } else {
            importDomains(cls, classFill, section);
            importSubclass(cls, classFill, levelCap, character, section, total);
        }

        var classFeatures = DomainExtractors.translateClassAbilitySelections(cls.featuresByLevel(), cls.abilities()).stream()
            .filter(feature -> !SEPARATELY_IMPORTED.contains(feature.kind()))
            .toList();
        section.info("Class features start ({}).", classFeatures.size());
        classFill.process(classFeatures);
        total.mergeFrom(classFill.result());
    }

    private void importKits(
        List<LeveledFeatures<SourceFeatureNode>> levels,
        ImportedCharacter.Builder character,
        LogContext section,
        ResolutionResult total
    ) {
        for (String kit : DomainExtractors.extractKits(levels)) {
            section.info("Kit [{}] found in import.", kit);
            var row = resolveRow(CatalogTable.KITS, kit, "Kit", section, total);
            if (row.isEmpty()) {
                continue;
            }
            if (character.kitCount() >= MAX_KITS) {
                section.warn("!!!! Too many kits, ignoring [{}].", kit);
                total.addIssue(ResolutionIssue.unmatchedSlot(kit, "kit"));
                continue;
            }
            character.kit(row.get().id());
            section.info("Adding Kit {} [{}].", character.kitCount(), kit);
        }
    }

    /**
     * Hands every Domain node to the engine, each selected domain carrying the Domain Feature
     * selections that belong to it.
     */
    private void importDomains(ClassSection cls, LeveledChoiceResolver classFill, LogContext section) {
        var domainFeatures = DomainExtractors.extractDomains(cls.featuresByLevel());
        for (var level : cls.featuresByLevel()) {
            for (SourceFeatureNode feature : level.features()) {
                if (feature.kind() != SourceKind.DOMAIN) {
                    continue;
                }
                var enriched = feature.selectedValues().stream()
                    .map(value -> value.name() != null && domainFeatures.containsKey(value.name())
                        ? value.withFeaturesByLevel(domainFeatures.get(value.name()))
                        : value)
                    .toList();
                section.debug("Domains {} with features for {}", feature.selectedNames(), domainFeatures.keySet());
                classFill.processFeature(feature.withSelectedValues(enriched));
            }
        }
    }

    /**
     * Classes whose deity slot is flagged {@code useSubclass} take their domains as subclasses,
     * filling the "1st Domain" and "2nd Domain" subclass slots.
     */
    private void importDomainsAsSubclasses(
        ClassSection cls,
        LeveledChoiceResolver classFill,
        int levelCap,
        LogContext section,
        ResolutionResult total
    ) {
        var normalizer = lookup.normalizer();
        int domainCount = 0;
        for (SelectedValue domain : DomainExtractors.selectedDomains(cls.featuresByLevel())) {
            section.info("Domain [{}] found.", domain.name());
            var subclassName = domain.name() + " Domain";
            var row = resolveRow(CatalogTable.SUBCLASSES, subclassName, "Domain", section, total);
            if (row.isEmpty()) {
                continue;
            }
            domainCount++;
            if (domainCount > MAX_DOMAIN_SUBCLASSES) {
                section.warn("!!!! Too many domains, ignoring [{}].", domain.name());
                total.addIssue(ResolutionIssue.unmatchedSlot(subclassName, TargetType.SUBCLASS_CHOICE.typeName()));
                return;
            }
            var slotName = (domainCount == 2 ? "2nd" : "1st") + " Domain";
            var slot = classFill.findSlot(TargetType.SUBCLASS_CHOICE, node -> normalizer.matches(slotName, node.name()));
            if (slot.isEmpty()) {
                section.warn("!!!! Subclass slot [{}] not found for domain [{}].", slotName, domain.name());
                total.addIssue(ResolutionIssue.unmatchedSlot(subclassName, TargetType.SUBCLASS_CHOICE.typeName()));
                continue;
            }
            section.info("Adding Domain [{}] as [{}].", domain.name(), slotName);
            total.choices().append(slot.get().guid(), row.get().id());

            var domainLevels = domain.featuresByLevel().isEmpty()
                ? DomainExtractors.extractDomainFeatures(domain.name(), cls.featuresByLevel())
                : domain.featuresByLevel();
            var domainFeatures = DomainExtractors.translateClassAbilitySelections(domainLevels, cls.abilities());
            total.mergeFrom(orchestrator(row.get(), levelCap, section.nested()).process(domainFeatures));
        }
    }

    private void importSubclass(
        ClassSection cls,
        LeveledChoiceResolver classFill,
        int levelCap,
        ImportedCharacter.Builder character,
        LogContext section,
        ResolutionResult total
    ) {
        var selected = DomainExtractors.selectedSubclass(cls.subclasses());
        if (selected.isEmpty() || selected.get().name() == null) {
            section.debug("No subclass selected.");
            return;
        }
        var subclass = selected.get();
        classFill.processFeature(SourceFeatureNode.builder(SourceKind.SUBCLASS).name(subclass.name()).build());

        var row = lookup.resolve(CatalogTable.SUBCLASSES, subclass.name(), section);
        if (row.isEmpty()) {
            // The engine has already reported the unresolved name.
            return;
        }
        character.lookup(ImportedCharacter.SUBCLASS, row.get().id());
        var subclassFeatures = DomainExtractors.translateClassAbilitySelections(subclass.featuresByLevel(), cls.abilities());
        total.mergeFrom(orchestrator(row.get(), levelCap, section.nested()).process(subclassFeatures));
        importKits(subclass.featuresByLevel(), character, section, total);
    }

    private LeveledChoiceResolver orchestrator(CatalogRow entity, int levelCap, LogContext context) {
        return engine.orchestrator(loader.expand(entity, levelCap), context);
    }

    private Optional<CatalogRow> resolveRow(
        CatalogTable table,
        String name,
        String label,
        LogContext section,
        ResolutionResult total
    ) {
        var row = lookup.resolve(table, name, section);
        if (row.isEmpty()) {
            section.warn("!!!! {} [{}] not found in catalog.", label, name);
            total.addIssue(ResolutionIssue.unresolvedName(name == null ? "" : name, table.tableName()));
        }
        return row;
    }

    private void logSkillSlots(List<LeveledFeatures<TargetFeatureNode>> levels, LogContext section) {
        var slots = CategoryIndex.build(levels, TargetType.SKILL_CHOICE);
        if (!slots.isEmpty()) {
            section.debug("Skill slots by category {}", slots);
        }
    }

    private static void missingSection(String section, LogContext log, ResolutionResult total) {
        log.warn("!!!! {} not found in import.", section);
        total.addIssue(ResolutionIssue.malformedSection(section, "Section missing or malformed"));
    }
}
