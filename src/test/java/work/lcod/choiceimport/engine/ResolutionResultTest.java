package work.lcod.choiceimport.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResolutionResultTest {
    @Test
    void mergeCarriesChoicesAndIssues() {
        var total = new ResolutionResult();
        total.choices().add("skill", "sneak");
        var pass = new ResolutionResult();
        pass.choices().add("skill", "lore");
        pass.addIssue(ResolutionIssue.unresolvedName("Juggling", "skills"));

        total.mergeFrom(pass);

        assertEquals(List.of("sneak", "lore"), total.choices().get("skill"));
        assertTrue(total.hasIssues(ResolutionIssue.Kind.UNRESOLVED_NAME));
        assertFalse(total.hasIssues(ResolutionIssue.Kind.DEPTH_EXCEEDED));
    }

    @Test
    void issuesSerializeWithLowerCaseKinds() {
        var issue = ResolutionIssue.unmatchedSlot("Sneak", "CharacterSkillChoice");
        assertEquals(
            Map.of("kind", "unmatched_slot", "subject", "Sneak", "message", "No CharacterSkillChoice slot accepts [Sneak]"),
            issue.toMap()
        );
    }
}
