package com.owldsl.application;

import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

import static org.junit.jupiter.api.Assertions.*;

class OwlDslApplicationTest {

    @Test
    void testOptionValues() {
        ApplicationArguments args = new DefaultApplicationArguments(
                "--action=find_classes", "--query=part of=skull", "--regex", "stray");

        assertEquals("find_classes", OwlDslApplication.option(args, OwlDslApplication.ACTION));
        assertEquals("part of=skull", OwlDslApplication.option(args, "query"));
        assertNull(OwlDslApplication.option(args, "regex"));
        assertNull(OwlDslApplication.option(args, "ontology"));
        assertEquals(1, args.getNonOptionArgs().size());
    }

    @Test
    void testFlags() {
        ApplicationArguments args = new DefaultApplicationArguments(
                "--regex", "--explain=true", "--show-property-definition-usage=false");

        assertTrue(OwlDslApplication.flag(args, "regex"));
        assertTrue(OwlDslApplication.flag(args, "explain"));
        assertFalse(OwlDslApplication.flag(args, "show-property-definition-usage"));
        assertFalse(OwlDslApplication.flag(args, "missing"));
    }

    @Test
    void testIntOption() {
        ApplicationArguments args = new DefaultApplicationArguments("--limit=3", "--depth=deep");

        assertEquals(3, OwlDslApplication.intOption(args, "limit", 1));
        assertEquals(1, OwlDslApplication.intOption(args, "other", 1));
        assertThrows(IllegalArgumentException.class, () -> OwlDslApplication.intOption(args, "depth", 1));
    }

    @Test
    void testNoOptions() {
        ApplicationArguments args = new DefaultApplicationArguments();

        assertNull(OwlDslApplication.option(args, OwlDslApplication.ACTION));
        assertTrue(args.getOptionNames().isEmpty());
    }
}
