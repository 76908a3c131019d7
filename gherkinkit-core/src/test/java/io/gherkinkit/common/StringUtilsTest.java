package io.gherkinkit.common;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringUtilsTest {

    @Test
    void testTrim() {
        assertEquals("", StringUtils.trimToEmpty(null));
        assertEquals("a", StringUtils.trimToEmpty(" a\t"));
        assertNull(StringUtils.trimToNull("   "));
        assertNull(StringUtils.trimToNull(null));
        assertEquals("x", StringUtils.trimToNull(" x "));
    }

    @Test
    void testSplit() {
        assertEquals(List.of("a", "b"), StringUtils.split("a,b", ',', false));
        assertEquals(List.of("a", "b"), StringUtils.split(",a,,b,", ',', false));
        assertEquals(List.of("a,b", "c"), StringUtils.split("a\\,b,c", ',', true));
        assertEquals(List.of("abc"), StringUtils.split("abc", ',', false));
    }

    @Test
    void testToStringLines() {
        assertEquals(List.of("a", "", "b"), StringUtils.toStringLines("a\n\r\nb\n"));
        assertEquals(List.of("a", "b"), StringUtils.toStringLines("a\rb"));
        assertTrue(StringUtils.toStringLines("").isEmpty());
    }

    @Test
    void testTruncateAndJoin() {
        assertEquals("abc ...", StringUtils.truncate("abcdef", 3, true));
        assertEquals("abc", StringUtils.truncate("abcdef", 3, false));
        assertEquals("ab", StringUtils.truncate("ab", 3, true));
        assertEquals("a\nb", StringUtils.join(List.of("a", "b"), "\n"));
        assertEquals("", StringUtils.join(List.of(), ","));
    }

}
