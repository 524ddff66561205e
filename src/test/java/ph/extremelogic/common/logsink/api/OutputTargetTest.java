package ph.extremelogic.common.logsink.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputTargetTest {

    @Test
    @DisplayName("BOTH should include console and file")
    void testBothIncludesEach() {
        assertTrue(OutputTarget.BOTH.includes(OutputTarget.CONSOLE));
        assertTrue(OutputTarget.BOTH.includes(OutputTarget.FILE));
        assertEquals(OutputTarget.CONSOLE.getMask() | OutputTarget.FILE.getMask(),
                OutputTarget.BOTH.getMask());
    }

    @Test
    @DisplayName("Single destinations should not include each other")
    void testSingleTargets() {
        assertTrue(OutputTarget.CONSOLE.includes(OutputTarget.CONSOLE));
        assertFalse(OutputTarget.CONSOLE.includes(OutputTarget.FILE));
        assertFalse(OutputTarget.FILE.includes(OutputTarget.CONSOLE));
        assertFalse(OutputTarget.FILE.includes(OutputTarget.BOTH));
    }

    @Test
    @DisplayName("Should map masks back to targets")
    void testFromMask() {
        assertEquals(OutputTarget.CONSOLE, OutputTarget.fromMask(1));
        assertEquals(OutputTarget.FILE, OutputTarget.fromMask(2));
        assertEquals(OutputTarget.BOTH, OutputTarget.fromMask(3));
        assertThrows(IllegalArgumentException.class, () -> OutputTarget.fromMask(4));
    }
}
