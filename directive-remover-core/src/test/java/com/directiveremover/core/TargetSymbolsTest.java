package com.directiveremover.core;

import com.directiveremover.core.analysis.TargetSymbols;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetSymbolsTest {

    @Test
    void insertsUnderscoreBeforeFirstDigit() {
        assertEquals(List.of("NET8_0_OR_GREATER", "NET_8_0_OR_GREATER"), TargetSymbols.of("NET8_0_OR_GREATER"));
    }

    @Test
    void removesUnderscoreBeforeFirstDigit() {
        assertEquals(List.of("NET_8_0_OR_GREATER", "NET8_0_OR_GREATER"), TargetSymbols.of("NET_8_0_OR_GREATER"));
    }

    @Test
    void symbolWithoutDigitsHasNoAlias() {
        assertEquals(List.of("DEBUG"), TargetSymbols.of("DEBUG"));
    }

    @Test
    void blankSymbolIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TargetSymbols.of(" "));
    }
}
