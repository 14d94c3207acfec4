/*
 * Copyright 2024-2025, Seqera Labs
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package nixfmt.formatter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LayoutTest {

    @Test
    void testMeasuringCountsText() {
        var measure = new MeasuringLayout();
        measure.text("abc");
        measure.indent(() -> measure.text("de"));
        assertEquals(5, measure.length());
        assertTrue(measure.fits(Integer.MAX_VALUE));
    }

    @Test
    void testMeasuringHardBreakIsUnbounded() {
        var measure = new MeasuringLayout();
        measure.text("abc");
        measure.newline();
        assertEquals(MeasuringLayout.UNBOUNDED, measure.length());
    }

    @Test
    void testRenderingTracksColumn() {
        var out = new RenderingLayout(10);
        out.text("abcd");
        assertEquals(4, out.column());
        assertTrue(out.fits(6));
        assertFalse(out.fits(7));
        assertFalse(out.fits(MeasuringLayout.UNBOUNDED));
    }

    @Test
    void testRenderingIndent() {
        var out = new RenderingLayout(80);
        out.text("{");
        out.indent(() -> {
            out.newline();
            out.text("a");
            out.indent(() -> {
                out.newline();
                out.text("b");
            });
            out.newline();
            assertEquals(2, out.column());
            out.text("c");
        });
        out.newline();
        assertEquals(0, out.column());
        out.text("}");
        assertEquals("{\n  a\n    b\n  c\n}", out.toString());
    }

    @Test
    void testBlankLinesHaveNoIndentation() {
        var out = new RenderingLayout(80);
        out.indent(() -> {
            out.newline();
            out.text("a");
            out.newline();
            out.newline();
            out.text("b");
        });
        assertEquals("\n  a\n\n  b", out.toString());
    }

    @Test
    void testIndentIsRestoredOnFailure() {
        var out = new RenderingLayout(80);
        assertThrows(IllegalStateException.class, () -> out.indent(() -> {
            out.newline();
            throw new IllegalStateException("boom");
        }));
        out.newline();
        assertEquals(0, out.column());
        out.text("x");
        assertEquals("\n\nx", out.toString());
    }

    @Test
    void testTryOneLine() {
        LayoutRule rule = (o, oneLine) -> {
            o.text("[");
            if( oneLine ) {
                o.text(" 1 2 ");
            }
            else {
                o.indent(() -> {
                    o.newline();
                    o.text("1");
                    o.newline();
                    o.text("2");
                });
                o.newline();
            }
            o.text("]");
        };

        var wide = new RenderingLayout(7);
        wide.tryOneLine(rule);
        assertEquals("[ 1 2 ]", wide.toString());

        var narrow = new RenderingLayout(6);
        narrow.tryOneLine(rule);
        assertEquals("[\n  1\n  2\n]", narrow.toString());
    }

    @Test
    void testTryOneLineUsesCurrentColumn() {
        LayoutRule rule = (o, oneLine) -> o.text(oneLine ? "one-line" : "broken");
        var out = new RenderingLayout(10);
        out.text("abc");
        out.tryOneLine(rule);
        assertEquals("abcbroken", out.toString());
    }

    @Test
    void testNestedDecisionsAreIndependent() {
        LayoutRule inner = (o, oneLine) -> o.text(oneLine ? "(inner)" : "(INNER)");
        LayoutRule outer = (o, oneLine) -> {
            o.text(oneLine ? "outer " : "OUTER");
            if( !oneLine )
                o.newline();
            o.tryOneLine(inner);
            o.text(" tail");
        };
        var out = new RenderingLayout(12);
        out.tryOneLine(outer);
        assertEquals("OUTER\n(inner) tail", out.toString());
    }

    @Test
    void testTryOneLineReservesSuffix() {
        LayoutRule rule = (o, oneLine) -> o.text(oneLine ? "[ 1 ]" : "[]");
        var fits = new RenderingLayout(6);
        fits.tryOneLine(1, rule);
        assertEquals("[ 1 ]", fits.toString());

        var tooWide = new RenderingLayout(6);
        tooWide.tryOneLine(2, rule);
        assertEquals("[]", tooWide.toString());
    }

    @Test
    void testSuffixAfterHardBreakNeverFits() {
        LayoutRule rule = (o, oneLine) -> {
            o.text(oneLine ? "one" : "two");
            o.newline();
        };
        var out = new RenderingLayout(80);
        out.tryOneLine(1, rule);
        assertEquals("two\n", out.toString());
    }
}
