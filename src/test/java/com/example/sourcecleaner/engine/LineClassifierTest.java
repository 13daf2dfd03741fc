package com.example.sourcecleaner.engine;

import com.example.sourcecleaner.domain.LineRole;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier(new PythonTokenizer());

    @Test
    void classifiesImports() {
        assertEquals(LineRole.PLAIN_IMPORT, classifier.classify("import os\n", ""));
        assertEquals(LineRole.PLAIN_IMPORT, classifier.classify("    import os, sys\n", ""));
        assertEquals(LineRole.FROM_IMPORT, classifier.classify("from a import b, c\n", ""));
    }

    @Test
    void importsThatMaySpanLinesAreContinuations() {
        assertEquals(LineRole.CONTINUATION, classifier.classify("from a import (b,\n", ""));
        assertEquals(LineRole.CONTINUATION, classifier.classify("from a import (b)\n", ""));
        assertEquals(LineRole.CONTINUATION, classifier.classify("import os; import sys\n", ""));
        assertEquals(LineRole.CONTINUATION, classifier.classify("import os\n", "import sys, \\\n"));
        assertTrue(classifier.isMultilineImport(">>> import os\n", ""));
    }

    @Test
    void commentWins() {
        assertEquals(LineRole.COMMENT, classifier.classify("import os  # noqa\n", ""));
        assertEquals(LineRole.COMMENT, classifier.classify("x = 1 # keep\n", ""));
    }

    @Test
    void classifiesAssignments() {
        assertEquals(LineRole.ASSIGNMENT, classifier.classify("x = 1\n", ""));
        assertEquals(LineRole.ASSIGNMENT, classifier.classify("    result = compute()\n", ""));
        assertEquals(LineRole.OTHER, classifier.classify("x += 1\n", ""));
        assertEquals(LineRole.OTHER, classifier.classify("x == 1\n", ""));
        assertEquals(LineRole.OTHER, classifier.classify("a.b = 1\n", ""));
        assertEquals(LineRole.OTHER, classifier.classify("x, y = 1, 2\n", ""));
    }

    @Test
    void assignmentsThatMaySpanLinesAreContinuations() {
        assertEquals(LineRole.CONTINUATION, classifier.classify("x = f(\n", ""));
        assertEquals(LineRole.CONTINUATION, classifier.classify("x = {'a': 1}\n", ""));
        assertEquals(LineRole.CONTINUATION, classifier.classify("    y = 2\n", "x = 1 + \\\n"));
    }

    @Test
    void classifiesExceptBinding() {
        assertEquals(LineRole.EXCEPT_BINDING, classifier.classify("except ValueError as e:\n", ""));
        assertEquals(
                LineRole.EXCEPT_BINDING,
                classifier.classify("    except (KeyError, TypeError) as err:\r\n", ""));
        assertEquals(LineRole.CONTINUATION, classifier.classify("except ValueError:\n", ""));
    }

    @Test
    void multilineStatementChecks() {
        assertTrue(classifier.isMultilineStatement("x = '''\n", ""));
        assertTrue(classifier.isMultilineStatement("if x: pass\n", ""));
        assertFalse(classifier.isMultilineStatement("x = 1\n", ""));
        assertFalse(classifier.isMultilineStatement("x = 1\n", null));
    }

    @Test
    void lineHelpers() {
        assertEquals("  \n", LineClassifier.lineEnding("x = 1  \n"));
        assertEquals("", LineClassifier.lineEnding("x = 1"));
        assertEquals("    ", LineClassifier.indentation("    x = 1\n"));
        assertEquals("", LineClassifier.indentation("    \n"));
        assertEquals("    pass\n", LineClassifier.placeholderFor("    import os\n"));
        assertEquals("pass", LineClassifier.placeholderFor("import os"));
        assertEquals("\tpass\r\n", LineClassifier.placeholderFor("\tx = 1\r\n"));
    }
}
