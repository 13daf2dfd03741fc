package com.example.sourcecleaner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceCleanerApplicationTest {

    @Test
    void fileArgumentsSelectCommandLineMode() {
        assertTrue(SourceCleanerApplication.isCommandLineRun(new String[] {"--in-place", "m.py"}));
        assertTrue(SourceCleanerApplication.isCommandLineRun(new String[] {"--version"}));
        assertFalse(SourceCleanerApplication.isCommandLineRun(new String[] {"--server.port=9090"}));
        assertFalse(SourceCleanerApplication.isCommandLineRun(new String[0]));
    }
}
