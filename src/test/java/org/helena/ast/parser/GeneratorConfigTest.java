package org.helena.ast.parser;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorConfigTest {

    @Test
    void default_isUnlimitedForEveryKind() {
        for (var kind : TopLevelKind.values()) {
            assertEquals(GeneratorConfig.UNLIMITED, GeneratorConfig.DEFAULT.maxLeafing(kind));
        }
    }

    @Test
    void missingKinds_areUnlimited() {
        var config = new GeneratorConfig(Map.of(TopLevelKind.NEWLINE, 0));

        assertEquals(0, config.maxLeafing(TopLevelKind.NEWLINE));
        assertEquals(GeneratorConfig.UNLIMITED, config.maxLeafing(TopLevelKind.FUNCTION));
    }

    @Test
    void withMaxLeafing_leavesOriginalUntouched() {
        var config = GeneratorConfig.DEFAULT.withMaxLeafing(TopLevelKind.FUNCTION, 1);

        assertEquals(1, config.maxLeafing(TopLevelKind.FUNCTION));
        assertEquals(GeneratorConfig.UNLIMITED, GeneratorConfig.DEFAULT.maxLeafing(TopLevelKind.FUNCTION));
    }

    @Test
    void negativeLimit_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GeneratorConfig(Map.of(TopLevelKind.NEWLINE, -1)));
    }

    @Test
    void limits_cannotBeModified() {
        var limits = GeneratorConfig.DEFAULT.maxLeafing();

        assertThrows(UnsupportedOperationException.class, () -> limits.put(TopLevelKind.NEWLINE, 0));
    }
}
