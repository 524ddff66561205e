package ph.extremelogic.common.logsink.message;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageTextTest {

    @Test
    @DisplayName("Should concatenate values without separators")
    void testJoin() {
        assertEquals("Debug message: value x = 123", MessageText.join("Debug message: value x = ", 123));
        assertEquals("User error Alice with code -404",
                MessageText.join("User error ", "Alice", " with code ", -404));
        assertEquals("pi 3.14", MessageText.join("pi ", 3.14));
    }

    @Test
    @DisplayName("Should render null values as null")
    void testJoinNulls() {
        assertEquals("value null", MessageText.join("value ", null));
        assertEquals("null", MessageText.join((Object) null));
        assertEquals("null", MessageText.join((Object[]) null));
    }

    @Test
    @DisplayName("Should join nothing to an empty string")
    void testJoinEmpty() {
        assertEquals("", MessageText.join());
    }

    @Test
    @DisplayName("Should substitute {} placeholders in order")
    void testFormat() {
        assertEquals("User john logged in with role admin",
                MessageText.format("User {} logged in with role {}", "john", "admin"));
        assertEquals("User null logged in", MessageText.format("User {} logged in", (Object) null));
    }

    @Test
    @DisplayName("Should keep surplus placeholders and append surplus arguments")
    void testFormatMismatchedArguments() {
        assertEquals("a 1 and {}", MessageText.format("a {} and {}", 1));
        assertEquals("a 1 [2, 3]", MessageText.format("a {}", 1, 2, 3));
        assertEquals("plain", MessageText.format("plain"));
        assertNull(MessageText.format(null, 1));
    }

    @Test
    @DisplayName("A value whose toString() builds message text should not corrupt the outer message")
    void testNestedToString() {
        Object nestedJoin = new Object() {
            @Override
            public String toString() {
                return MessageText.join("in", "ner");
            }
        };
        Object nestedFormat = new Object() {
            @Override
            public String toString() {
                return MessageText.format("{}-{}", "x", "y");
            }
        };

        assertEquals("outer-inner-end", MessageText.join("outer-", nestedJoin, "-end"));
        assertEquals("outer inner x-y", MessageText.format("outer {} {}", nestedJoin, nestedFormat));
    }
}
