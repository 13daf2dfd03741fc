package com.example.sourcecleaner.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VariableRewriterTest {

    private final PythonTokenizer tokenizer = new PythonTokenizer();
    private final VariableRewriter rewriter =
            new VariableRewriter(new LineClassifier(tokenizer), new LiteralExpressions(tokenizer));

    @Test
    void literalValueBecomesPlaceholder() {
        assertEquals("pass\n", rewriter.rewrite("x = 1\n", ""));
        assertEquals("    pass\n", rewriter.rewrite("    x = other\n", ""));
        assertEquals("pass\n", rewriter.rewrite("x = dict()\n", ""));
        assertEquals("pass", rewriter.rewrite("x = 1", ""));
    }

    @Test
    void expressionWithPossibleSideEffectsIsKept() {
        assertEquals("compute()\n", rewriter.rewrite("x = compute()\n", ""));
        assertEquals("    obj.attr\n", rewriter.rewrite("    x = obj.attr\n", ""));
    }

    @Test
    void exceptBindingIsDropped() {
        assertEquals("except ValueError:\n", rewriter.rewrite("except ValueError as e:\n", ""));
        assertEquals(
                "    except (KeyError, TypeError):\r\n",
                rewriter.rewrite("    except (KeyError, TypeError) as err:\r\n", ""));
    }

    @Test
    void unsafeLinesAreUntouched() {
        assertEquals("x = f(\n", rewriter.rewrite("x = f(\n", ""));
        assertEquals("x, y = 1, 2\n", rewriter.rewrite("x, y = 1, 2\n", ""));
        assertEquals("x = 1  # note\n", rewriter.rewrite("x = 1  # note\n", ""));
        assertEquals("x += 1\n", rewriter.rewrite("x += 1\n", ""));
        assertEquals("x = y = 1\n", rewriter.rewrite("x = y = 1\n", ""));
        assertEquals("    y = 2\n", rewriter.rewrite("    y = 2\n", "x = 1 + \\\n"));
    }
}
