package work.lcod.choiceimport.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChoiceTableTest {
    @Test
    void singleValueStaysScalar() {
        var table = new ChoiceTable();
        table.add("slot", "a");
        assertEquals("a", table.get("slot"));
        assertEquals(List.of("a"), table.values("slot"));
    }

    @Test
    void secondValuePromotesToOrderedList() {
        var table = new ChoiceTable();
        table.add("slot", "a");
        table.add("slot", "b");
        table.add("slot", "c");
        assertEquals(List.of("a", "b", "c"), table.get("slot"));
    }

    @Test
    void appendAlwaysUsesListForm() {
        var table = new ChoiceTable();
        table.append("domains", "war");
        assertEquals(List.of("war"), table.get("domains"));
        table.append("domains", "life");
        assertEquals(List.of("war", "life"), table.get("domains"));
    }

    @Test
    void repeatedValueIsKeptOnceWithinAndAcrossPasses() {
        var onePass = new ChoiceTable();
        onePass.add("slot", "x");
        onePass.add("slot", "x");
        onePass.append("domains", "war");
        onePass.append("domains", "war");

        var twoPasses = new ChoiceTable();
        twoPasses.add("slot", "x");
        twoPasses.append("domains", "war");
        var later = new ChoiceTable();
        later.add("slot", "x");
        later.append("domains", "war");
        twoPasses.mergeFrom(later);

        assertEquals("x", onePass.get("slot"));
        assertEquals(List.of("war"), onePass.get("domains"));
        assertEquals(onePass.toMap(), twoPasses.toMap());
    }

    @Test
    void mergeNeverClobbersEarlierPasses() {
        var first = new ChoiceTable();
        first.add("skill", "sneak");
        first.add("same", "x");
        var second = new ChoiceTable();
        second.add("skill", "lore");
        second.add("skill", "sneak");
        second.add("same", "x");
        second.add("fresh", "y");

        first.mergeFrom(second);

        assertEquals(List.of("sneak", "lore"), first.get("skill"));
        assertEquals("x", first.get("same"));
        assertEquals("y", first.get("fresh"));
        assertEquals(3, first.size());
    }

    @Test
    void snapshotsAreDetached() {
        var table = new ChoiceTable();
        table.add("slot", "a");
        table.add("slot", "b");
        var snapshot = table.toMap();
        table.add("slot", "c");

        assertEquals(List.of("a", "b"), snapshot.get("slot"));
        assertThrows(UnsupportedOperationException.class, () -> table.keys().clear());
    }

    @Test
    void emptyTableHasNoKeys() {
        var table = new ChoiceTable();
        assertTrue(table.isEmpty());
        assertFalse(table.containsKey("slot"));
        assertTrue(table.values("slot").isEmpty());
        assertThrows(NullPointerException.class, () -> table.add(null, "a"));
    }
}
