package work.lcod.choiceimport.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.choiceimport.support.ImportTestSupport.deitySlot;
import static work.lcod.choiceimport.support.ImportTestSupport.level;
import static work.lcod.choiceimport.support.ImportTestSupport.lookup;
import static work.lcod.choiceimport.support.ImportTestSupport.slot;
import static work.lcod.choiceimport.support.ImportTestSupport.wrapper;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.choiceimport.catalog.CatalogTable;
import work.lcod.choiceimport.catalog.JsonCatalog;
import work.lcod.choiceimport.model.Filter;
import work.lcod.choiceimport.model.SourceFeatureNode;
import work.lcod.choiceimport.model.SourceKind;
import work.lcod.choiceimport.model.TargetType;

class LeveledChoiceResolverTest {
    private final ChoiceEngine engine = new ChoiceEngine(lookup(
        JsonCatalog.builder()
            .row(CatalogTable.SKILLS, "skill-sneak", "Sneak")
            .row(CatalogTable.SKILLS, "skill-lore", "Lore")
            .build()
    ));

    @Test
    void accumulatesAcrossFilteredPasses() {
        var orchestrator = engine.orchestrator(List.of(
            level(1, wrapper("War Domain", slot(TargetType.SKILL_CHOICE, "war"))),
            level(2, wrapper("Life Domain", slot(TargetType.SKILL_CHOICE, "life")))
        ));

        orchestrator.setFilter(Filter.byName("Life Domain"));
        orchestrator.processFeature(skill("Lore"));
        orchestrator.setFilter(Filter.byName("War Domain"));
        orchestrator.processFeature(skill("Sneak"));
        orchestrator.clearFilter();

        assertEquals("skill-lore", orchestrator.result().choices().get("life"));
        assertEquals("skill-sneak", orchestrator.result().choices().get("war"));
        assertTrue(orchestrator.filter().isEmpty());
    }

    @Test
    void emptyTargetTreeReportsDiscardedSelections() {
        var orchestrator = engine.orchestrator(List.of());
        assertTrue(orchestrator.isEmpty());
        var result = orchestrator.process(List.of(skill("Sneak")));
        assertTrue(result.choices().isEmpty());
        assertEquals(1, result.issues().size());
        assertEquals(ResolutionIssue.Kind.UNMATCHED_SLOT, result.issues().get(0).kind());
    }

    @Test
    void emptyTargetTreeIgnoresNodesWithoutSelections() {
        var result = engine.orchestrator(List.of()).process(List.of(
            SourceFeatureNode.builder(SourceKind.SKILL_CHOICE).name("Labor").build(),
            SourceFeatureNode.builder(SourceKind.KIT).selectedNames("Mountain").build()
        ));
        assertTrue(result.choices().isEmpty());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void findSlotHonoursTheCurrentFilter() {
        var orchestrator = engine.orchestrator(List.of(
            level(1, deitySlot("plain", false), wrapper("Clergy", deitySlot("clergy", true)))
        ));
        assertEquals("plain", orchestrator.findSlot(TargetType.DEITY_CHOICE, node -> true).orElseThrow().guid());
        assertEquals("clergy", orchestrator.findSlot(TargetType.DEITY_CHOICE, node -> node.useSubclass()).orElseThrow().guid());

        orchestrator.setFilter(Filter.byName("Clergy"));
        assertEquals("clergy", orchestrator.findSlot(TargetType.DEITY_CHOICE, node -> true).orElseThrow().guid());
        assertTrue(orchestrator.result().choices().isEmpty());
    }

    @Test
    void returnsTheSameAccumulatingResult() {
        var orchestrator = engine.orchestrator(List.of(level(1, slot(TargetType.SKILL_CHOICE, "S"))));
        assertSame(orchestrator.result(), orchestrator.processFeature(skill("Sneak")));
        assertEquals(1, orchestrator.availableFeatures().size());
    }

    private static SourceFeatureNode skill(String name) {
        return SourceFeatureNode.builder(SourceKind.SKILL_CHOICE).selectedNames(name).build();
    }
}
