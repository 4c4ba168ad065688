package work.lcod.choiceimport.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.choiceimport.support.ImportTestSupport.readFixture;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.choiceimport.model.SourceKind;

class SourceDocumentParserTest {
    @Test
    void parsesEverySectionOfTheSampleCharacter() {
        var character = SourceDocumentParser.parse(readFixture("character.json"));

        assertEquals("Vessa", character.name());
        assertEquals("Elf (high)", character.ancestry().name());
        assertEquals(SourceKind.CHOICE, character.ancestry().features().get(0).kind());
        assertEquals(List.of("Caelian", "Anjali"), character.culture().languages());
        assertEquals(3, character.culture().aspects().size());
        assertEquals(List.of("intrigue"), character.culture().aspects().get("environment").listOptions());
        assertEquals("II-1", character.career().incitingIncident().selectedId());
        assertEquals(2, character.career().incitingIncident().options().size());

        var cls = character.characterClass();
        assertEquals("Conduit", cls.name());
        assertEquals(2, cls.level());
        assertEquals(5, cls.characteristics().size());
        assertEquals(2, cls.abilities().size());
        assertEquals(2, cls.featuresByLevel().size());
        assertTrue(cls.subclasses().isEmpty());
    }

    @Test
    void readsNestedSelectionsAndIds() {
        var cls = SourceDocumentParser.parse(readFixture("character.json")).characterClass();
        var levelOne = cls.featuresByLevel().get(0).features();

        var kit = levelOne.get(0);
        assertEquals(SourceKind.KIT, kit.kind());
        assertEquals(List.of("Mountain"), kit.selectedNames());
        assertFalse(kit.selectedValues().get(0).hasFeature());

        var domainFeature = levelOne.get(2);
        assertEquals(SourceKind.DOMAIN_FEATURE, domainFeature.kind());
        var nested = domainFeature.selectedValues().get(0);
        assertEquals("domain-war-1", nested.id());
        assertTrue(nested.hasFeature());
        assertEquals(SourceKind.CHOICE, nested.feature().kind());
        assertEquals(List.of("Sacred Ground"), nested.feature().selectedNames());

        var ability = levelOne.get(3);
        assertEquals(SourceKind.CLASS_ABILITY, ability.kind());
        assertEquals(List.of("prayer-speed"), ability.selectedIds());
        assertTrue(ability.selectedValues().isEmpty());
    }

    @Test
    void sourceTypesAreCaseInsensitive() {
        var character = SourceDocumentParser.parse(
            "{\"name\": \"A\", \"class\": {\"name\": \"Censor\", \"featuresByLevel\": [{\"level\": 1, \"features\": ["
                + "{\"type\": \"SKILL CHOICE\", \"data\": {\"selected\": [\"Sneak\"]}},"
                + "{\"type\": \"Ability\", \"data\": {\"selectedIDs\": [\"a\"]}},"
                + "{\"type\": \"Treasure\", \"name\": \"Gold\"}"
                + "]}]}}"
        );
        var features = character.characterClass().featuresByLevel().get(0).features();
        assertEquals(SourceKind.SKILL_CHOICE, features.get(0).kind());
        assertEquals(SourceKind.CLASS_ABILITY, features.get(1).kind());
        assertEquals(SourceKind.UNKNOWN, features.get(2).kind());
        assertEquals("Treasure", features.get(2).rawType());
    }

    @Test
    void malformedSectionsAreDropped() {
        var character = SourceDocumentParser.parse(
            "{\"name\": \"A\", \"ancestry\": \"Elf\", \"culture\": [], \"class\": {\"name\": \"Censor\"}}"
        );
        assertNull(character.ancestry());
        assertNull(character.culture());
        assertNull(character.career());
        assertEquals(1, character.characterClass().level());
        assertTrue(character.characterClass().featuresByLevel().isEmpty());
    }

    @Test
    void rejectsDocumentsThatAreNotCharacters() {
        assertThrows(IllegalArgumentException.class, () -> SourceDocumentParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> SourceDocumentParser.parse("{broken"));
        assertThrows(IllegalArgumentException.class, () -> SourceDocumentParser.parse("[]"));
        assertThrows(IllegalArgumentException.class, () -> SourceDocumentParser.parse("{\"name\": \"A\"}"));
        var ex = assertThrows(IllegalArgumentException.class, () -> SourceDocumentParser.parse("{\"class\": {}}"));
        assertTrue(ex.getMessage().contains("missing name or class"));
    }
}
