package work.lcod.choiceimport.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

class LogContextTest {
    @Test
    void nestingNeverMutatesTheParent() {
        var root = LogContext.root(LogContextTest.class);
        var child = root.nested();
        var grandChild = child.nested().forOwner(NameNormalizer.class);

        assertEquals(0, root.depth());
        assertEquals(1, child.depth());
        assertEquals(2, grandChild.depth());
    }

    @Test
    void thresholdSilencesLowerLevelsAndIsInherited() {
        var quiet = LogContext.root(LogContextTest.class, Level.ERROR);
        var nested = quiet.nested().forOwner(NameNormalizer.class);

        assertFalse(quiet.isEnabled(Level.WARN));
        assertFalse(nested.isEnabled(Level.INFO));
        assertEquals(Level.ERROR, nested.threshold());
        assertEquals(Level.TRACE, LogContext.root(LogContextTest.class).threshold());
    }
}
