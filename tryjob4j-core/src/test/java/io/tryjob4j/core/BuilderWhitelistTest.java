package io.tryjob4j.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BuilderWhitelistTest {

    private final BuilderWhitelist whitelist = new BuilderWhitelist(List.of("a", "b", "c"));

    @Test
    void emptyRequestSelectsEveryBuilder() {
        assertEquals(List.of("a", "b", "c"), whitelist.resolve(List.of()));
        assertEquals(List.of("a", "b", "c"), whitelist.resolve(null));
    }

    @Test
    void requestKeepsItsOwnOrder() {
        assertEquals(List.of("c", "a"), whitelist.resolve(List.of("c", "a")));
    }

    @Test
    void unknownNamesRejectTheWholeRequest() {
        UnknownBuilderException e = assertThrows(UnknownBuilderException.class,
                () -> whitelist.resolve(List.of("a", "x", "y")));
        assertEquals(List.of("x", "y"), e.getUnknownBuilders());
    }

    @Test
    void emptyWhitelistRejectsEverything() {
        BuilderWhitelist none = new BuilderWhitelist(List.of());
        assertThrows(UnknownBuilderException.class, () -> none.resolve(List.of()));
        assertThrows(UnknownBuilderException.class, () -> none.resolve(List.of("a")));
    }

    @Test
    void duplicatesAreRejectedAtConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new BuilderWhitelist(List.of("a", "a")));
    }
}
