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
package nixfmt.parser;

import java.util.List;

import nixfmt.ast.AttrPath;
import nixfmt.ast.Expression;
import nixfmt.ast.KeyName;
import nixfmt.ast.NamedBinding;
import nixfmt.ast.SelectExpression;
import nixfmt.ast.SetParameter;
import nixfmt.ast.StringPart;
import org.junit.jupiter.api.Test;

import static nixfmt.ast.ASTUtils.*;
import static nixfmt.ast.BinaryOperator.*;
import static org.junit.jupiter.api.Assertions.*;

class NixAstBuilderTest {

    private static Expression parse(String source) {
        return new NixAstBuilder("test.nix", source).buildAST();
    }

    @Test
    void testOperatorPrecedence() {
        assertEquals(binX(constX(1), ADD, binX(constX(2), MULTIPLY, constX(3))), parse("1 + 2 * 3"));
        assertEquals(binX(binX(constX(1), ADD, constX(2)), MULTIPLY, constX(3)), parse("(1 + 2) * 3"));
        assertEquals(binX(varX("a"), OR, binX(varX("b"), AND, varX("c"))), parse("a || b && c"));
    }

    @Test
    void testOperatorAssociativity() {
        assertEquals(binX(binX(varX("a"), SUBTRACT, varX("b")), SUBTRACT, varX("c")), parse("a - b - c"));
        assertEquals(binX(varX("a"), CONCAT, binX(varX("b"), CONCAT, varX("c"))), parse("a ++ b ++ c"));
        assertEquals(binX(varX("a"), UPDATE, binX(varX("b"), UPDATE, varX("c"))), parse("a // b // c"));
        assertEquals(binX(varX("a"), IMPLICATION, binX(varX("b"), IMPLICATION, varX("c"))), parse("a -> b -> c"));
    }

    @Test
    void testUnaryOperators() {
        assertEquals(negX(varX("a")), parse("-a"));
        assertEquals(binX(notX(varX("a")), EQUAL, varX("b")), parse("!a == b"));
        assertEquals(notX(binX(varX("a"), ADD, varX("b"))), parse("!a + b"));
        assertEquals(binX(varX("a"), SUBTRACT, negX(varX("b"))), parse("a - -b"));
    }

    @Test
    void testApplicationAndSelection() {
        assertEquals(applyX(varX("f"), varX("x"), varX("y")), parse("f x y"));
        assertEquals(applyX(varX("f"), selectX(varX("x"), "y")), parse("f x.y"));
        assertEquals(selectX(varX("a"), "b.c", varX("d")), parse("a.b.c or d"));
        assertEquals(hasAttrX(varX("a"), "b.c"), parse("a ? b.c"));
    }

    @Test
    void testDynamicSelection() {
        var path = new AttrPath(List.of(new KeyName.Interpolated(varX("b")), new KeyName.Static("c")));
        assertEquals(new SelectExpression(varX("a"), path), parse("a.${b}.c"));
    }

    @Test
    void testFunctions() {
        assertEquals(lambdaX("x", lambdaX("y", varX("x"))), parse("x: y: x"));

        var formals = new SetParameter(List.of(formal("a"), formal("b", constX(1))), true, null);
        assertEquals(lambdaX(formals, varX("a")), parse("{ a, b ? 1, ... }: a"));

        var aliased = new SetParameter(List.of(formal("a")), false, "args");
        assertEquals(lambdaX(aliased, varX("a")), parse("args @ { a }: a"));
        assertEquals(lambdaX(aliased, varX("a")), parse("{ a } @ args: a"));

        assertEquals(lambdaX(new SetParameter(List.of(), false, null), constX(1)), parse("{}: 1"));
    }

    @Test
    void testGreedyForms() {
        assertEquals(letX(List.of(bindX("a", constX(1))), varX("a")), parse("let a = 1; in a"));
        assertEquals(ifX(varX("a"), varX("b"), varX("c")), parse("if a then b else c"));
        assertEquals(withX(varX("a"), varX("b")), parse("with a; b"));
        assertEquals(assertX(varX("a"), varX("b")), parse("assert a; b"));
    }

    @Test
    void testSets() {
        var expected = setX(bindX("a.b", constX(1)), inheritX(null, "c"), inheritX(varX("d"), "e", "f"));
        assertEquals(expected, parse("{ a.b = 1; inherit c; inherit (d) e f; }"));
        assertEquals(recSetX(), parse("rec { }"));
        assertEquals(setX(), parse("{ }"));
    }

    @Test
    void testDynamicKeys() {
        var quoted = new NamedBinding(new AttrPath(List.of(new KeyName.Quoted(strX("a b")))), constX(1));
        var interpolated = new NamedBinding(new AttrPath(List.of(new KeyName.Interpolated(varX("x")))), constX(2));
        assertEquals(setX(quoted, interpolated), parse("{ \"a b\" = 1; ${x} = 2; }"));
    }

    @Test
    void testAtoms() {
        var expected = listX(
            constX(1), strX("s"), pathX("./p"), envPathX("nixpkgs"), pathX("~/x"),
            uriX("https://example.org/x"), floatX("1.5"), constX(true), nullX());
        assertEquals(expected, parse("[ 1 \"s\" ./p <nixpkgs> ~/x https://example.org/x 1.5 true null ]"));
    }

    @Test
    void testQuotedStrings() {
        assertEquals(strX("a\nb\"c"), parse("\"a\\nb\\\"c\""));
        assertEquals(strX("x", varX("y"), "z"), parse("\"x${y}z\""));
        assertEquals(strX("$${a}"), parse("\"$${a}\""));
        assertEquals(strX("${a}"), parse("\"\\${a}\""));
        assertEquals(strX(), parse("\"\""));
    }

    @Test
    void testIndentedStrings() {
        assertEquals(indStrX("a\n  b\n"), parse("''\n  a\n    b\n''"));
        assertEquals(indStrX("a''b${c}"), parse("''a'''b''${c}''"));
        assertEquals(indStrX("x ", varX("y"), "\n"), parse("''\n  x ${y}\n''"));
        assertEquals(indStrX("a\n"), parse("''\n  a\n  ''"));
        assertEquals(indStrX("a\n\nb"), parse("''\n  a\n\n  b''"));
        assertEquals(indStrX(), parse("''''"));
    }

    @Test
    void testStripIndentation() {
        var segments = List.of(
            NixAstBuilder.IndentedSegment.raw("    a\n  "),
            NixAstBuilder.IndentedSegment.interpolation(varX("b")),
            NixAstBuilder.IndentedSegment.raw("\n  "));
        var expected = List.of(
            new StringPart.Text("  a\n"),
            new StringPart.Interpolation(varX("b")),
            new StringPart.Text("\n"));
        assertEquals(expected, NixAstBuilder.stripIndentation(segments));
    }

    @Test
    void testCommentsAreDiscarded() {
        assertEquals(binX(constX(1), ADD, constX(2)), parse("# comment\n1 /* inline */ + 2"));
    }

    @Test
    void testSyntaxErrors() {
        var e = assertThrows(SyntaxException.class, () -> parse("1 +"));
        assertEquals("test.nix", e.getSourceName());
        assertEquals(1, e.getLine());

        e = assertThrows(SyntaxException.class, () -> parse("{\n  a = 1\n}"));
        assertEquals(3, e.getLine());
        assertEquals(1, e.getColumn());
        assertTrue(e.getLocatedMessage().startsWith("test.nix:3:1: "));

        assertThrows(SyntaxException.class, () -> parse("1 ` 2"));
        assertThrows(SyntaxException.class, () -> parse("99999999999999999999"));
    }
}
