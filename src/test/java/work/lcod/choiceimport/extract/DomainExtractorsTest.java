package work.lcod.choiceimport.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.choiceimport.model.LeveledFeatures;
import work.lcod.choiceimport.model.SelectedValue;
import work.lcod.choiceimport.model.SourceCharacter.Reference;
import work.lcod.choiceimport.model.SourceCharacter.Subclass;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.SourceKind;

class DomainExtractorsTest {
    private final SourceFeatureNode sacredGround = SourceFeatureNode.builder(SourceKind.CHOICE)
        .id("domain-war-1")
        .selectedNames("Sacred Ground")
        .build();

    private final List<LeveledFeatures<SourceFeatureNode>> levels = List.of(
        new LeveledFeatures<>(1, List.of(
            SourceFeatureNode.builder(SourceKind.KIT).selectedNames("Mountain").build(),
            SourceFeatureNode.builder(SourceKind.DOMAIN).selectedNames("War", "Life").build(),
            SourceFeatureNode.builder(SourceKind.DOMAIN_FEATURE)
                .selected(List.of(new SelectedValue("Sacred Ground", null, "domain-war-1", sacredGround, List.of())))
                .build(),
            SourceFeatureNode.builder(SourceKind.CLASS_ABILITY).name("Prayer").selectedIds(List.of("p1", "missing")).build()
        )),
        new LeveledFeatures<>(4, List.of(
            SourceFeatureNode.builder(SourceKind.KIT).selectedNames("Panther").build(),
            SourceFeatureNode.builder(SourceKind.DOMAIN_FEATURE)
                .selected(List.of(SelectedValue.of("Warding Aura", "plain", "Domain-War-4")))
                .build(),
            SourceFeatureNode.builder(SourceKind.CLASS_ABILITY).name("Unknown").selectedIds(List.of("missing")).build()
        ))
    );

    @Test
    void collectsKitsInOrder() {
        assertEquals(List.of("Mountain", "Panther"), DomainExtractors.extractKits(levels));
    }

    @Test
    void groupsDomainFeaturesByDomain() {
        var domains = DomainExtractors.extractDomains(levels);

        assertEquals(List.of("War"), List.copyOf(domains.keySet()));
        var war = domains.get("War");
        assertEquals(List.of(1, 4), war.stream().map(LeveledFeatures::level).toList());
        assertEquals(sacredGround, war.get(0).features().get(0));
        var plain = war.get(1).features().get(0);
        assertEquals(SourceKind.UNKNOWN, plain.kind());
        assertEquals("Warding Aura", plain.name());
    }

    @Test
    void listsSelectedDomains() {
        assertEquals(List.of("War", "Life"), DomainExtractors.selectedDomains(levels).stream().map(SelectedValue::name).toList());
        assertTrue(DomainExtractors.extractDomainFeatures("Life", levels).isEmpty());
    }

    @Test
    void translatesAbilityIdsToNames() {
        var abilities = List.of(new Reference("p1", "Prayer of Speed", "fast"));
        var translated = DomainExtractors.translateClassAbilitySelections(levels, abilities);

        assertEquals(7, translated.size());
        var prayer = translated.stream().filter(node -> "Prayer".equals(node.name())).findFirst().orElseThrow();
        assertEquals(List.of("Prayer of Speed"), prayer.selectedNames());
        assertEquals("fast", prayer.selectedValues().get(0).description());
        var unknown = translated.stream().filter(node -> "Unknown".equals(node.name())).findFirst().orElseThrow();
        assertTrue(unknown.selectedValues().isEmpty());
        assertFalse(unknown.selectedIds().isEmpty());
    }

    @Test
    void derivesDomainSlugFromFeatureIds() {
        assertEquals(Optional.of("War"), DomainExtractors.domainSlug("domain-war-1"));
        assertEquals(Optional.of("Life"), DomainExtractors.domainSlug("DOMAIN-LIFE"));
        assertEquals(Optional.empty(), DomainExtractors.domainSlug("kit-mountain"));
        assertEquals(Optional.empty(), DomainExtractors.domainSlug(null));
    }

    @Test
    void picksTheSelectedSubclass() {
        var subclasses = List.of(new Subclass("Exorcist", false, List.of()), new Subclass("Oracle", true, List.of()));
        assertEquals("Oracle", DomainExtractors.selectedSubclass(subclasses).orElseThrow().name());
        assertTrue(DomainExtractors.selectedSubclass(List.of()).isEmpty());
    }
}
