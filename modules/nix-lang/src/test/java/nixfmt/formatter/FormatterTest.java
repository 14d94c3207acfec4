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

import java.util.List;

import nixfmt.ast.AttrPath;
import nixfmt.ast.Expression;
import nixfmt.ast.KeyName;
import nixfmt.ast.NamedBinding;
import nixfmt.ast.SetParameter;
import org.junit.jupiter.api.Test;

import static nixfmt.ast.ASTUtils.*;
import static nixfmt.ast.BinaryOperator.*;
import static org.junit.jupiter.api.Assertions.*;

class FormatterTest {

    private static String format(Expression node) {
        return format(node, FormattingOptions.DEFAULT_MAX_WIDTH);
    }

    private static String format(Expression node, int width) {
        return new Formatter(new FormattingOptions(width)).format(node);
    }

    @Test
    void testAtoms() {
        assertEquals("42", format(constX(42)));
        assertEquals("true", format(constX(true)));
        assertEquals("null", format(nullX()));
        assertEquals("1.5", format(floatX("1.5")));
        assertEquals("https://nixos.org", format(uriX("https://nixos.org")));
        assertEquals("pkgs", format(varX("pkgs")));
        assertEquals("./default.nix", format(pathX("./default.nix")));
        assertEquals("<nixpkgs>", format(envPathX("nixpkgs")));
    }

    @Test
    void testPrecedenceWithoutParens() {
        assertEquals("1 + 2 * 3", format(binX(constX(1), ADD, binX(constX(2), MULTIPLY, constX(3)))));
    }

    @Test
    void testPrecedenceKeepsParens() {
        assertEquals("(1 + 2) * 3", format(binX(binX(constX(1), ADD, constX(2)), MULTIPLY, constX(3))));
    }

    @Test
    void testLeftAssociativeOperators() {
        var a = varX("a");
        var b = varX("b");
        var c = varX("c");
        assertEquals("a - b - c", format(binX(binX(a, SUBTRACT, b), SUBTRACT, c)));
        assertEquals("a - (b - c)", format(binX(a, SUBTRACT, binX(b, SUBTRACT, c))));
        assertEquals("a / b * c", format(binX(binX(a, DIVIDE, b), MULTIPLY, c)));
        assertEquals("a * (b / c)", format(binX(a, MULTIPLY, binX(b, DIVIDE, c))));
        assertEquals("a && b && c", format(binX(binX(a, AND, b), AND, c)));
    }

    @Test
    void testRightAssociativeOperators() {
        var a = varX("a");
        var b = varX("b");
        var c = varX("c");
        assertEquals("a ++ b ++ c", format(binX(a, CONCAT, binX(b, CONCAT, c))));
        assertEquals("(a ++ b) ++ c", format(binX(binX(a, CONCAT, b), CONCAT, c)));
        assertEquals("a // b // c", format(binX(a, UPDATE, binX(b, UPDATE, c))));
        assertEquals("a -> b -> c", format(binX(a, IMPLICATION, binX(b, IMPLICATION, c))));
    }

    @Test
    void testNonAssociativeOperators() {
        var a = varX("a");
        var b = varX("b");
        var c = varX("c");
        assertEquals("(a == b) == c", format(binX(binX(a, EQUAL, b), EQUAL, c)));
        assertEquals("a != (b == c)", format(binX(a, NOT_EQUAL, binX(b, EQUAL, c))));
        assertEquals("(a < b) > c", format(binX(binX(a, LESS, b), GREATER, c)));
    }

    @Test
    void testUnaryOperators() {
        var a = varX("a");
        var b = varX("b");
        assertEquals("-a", format(negX(a)));
        assertEquals("-(a + b)", format(negX(binX(a, ADD, b))));
        assertEquals("-f a", format(negX(applyX(varX("f"), a))));
        assertEquals("!(a && b)", format(notX(binX(a, AND, b))));
        assertEquals("!a == b", format(binX(notX(a), EQUAL, b)));
        assertEquals("a - -b", format(binX(a, SUBTRACT, negX(b))));
    }

    @Test
    void testGreedyFormsAsOperands() {
        assertEquals("1 + (if a then b else c)", format(binX(constX(1), ADD, ifX(varX("a"), varX("b"), varX("c")))));
        assertEquals("(x: x) + 1", format(binX(lambdaX("x", varX("x")), ADD, constX(1))));
        assertEquals("(with a; b) ++ c", format(binX(withX(varX("a"), varX("b")), CONCAT, varX("c"))));
        assertEquals("(assert a; b) || c", format(binX(assertX(varX("a"), varX("b")), OR, varX("c"))));
        assertEquals("(let a = 1; in a) // b", format(binX(letX(List.of(bindX("a", constX(1))), varX("a")), UPDATE, varX("b"))));
    }

    @Test
    void testGreedyFormsInBodyPosition() {
        assertEquals("if a then b else 1 + 2", format(ifX(varX("a"), varX("b"), binX(constX(1), ADD, constX(2)))));
        assertEquals("x: let a = 1; in a", format(lambdaX("x", letX(List.of(bindX("a", constX(1))), varX("a")))));
        assertEquals("with pkgs; x: if x then a else b", format(withX(varX("pkgs"), lambdaX("x", ifX(varX("x"), varX("a"), varX("b"))))));
    }

    @Test
    void testApplication() {
        var f = varX("f");
        var x = varX("x");
        assertEquals("f x y", format(applyX(f, x, varX("y"))));
        assertEquals("f (g x)", format(applyX(f, applyX(varX("g"), x))));
        assertEquals("lib.id 1", format(applyX(selectX(varX("lib"), "id"), constX(1))));
        assertEquals("f (-1)", format(applyX(f, negX(constX(1)))));
        assertEquals("(x: x) 1", format(applyX(lambdaX("x", x), constX(1))));
        assertEquals("f x.y", format(applyX(f, selectX(x, "y"))));
    }

    @Test
    void testSelection() {
        assertEquals("a.b.c", format(selectX(varX("a"), "b.c")));
        assertEquals("(f x).y", format(selectX(applyX(varX("f"), varX("x")), "y")));
        assertEquals("a.b or 1", format(selectX(varX("a"), "b", constX(1))));
        assertEquals("a.b or (f x)", format(selectX(varX("a"), "b", applyX(varX("f"), varX("x")))));
        assertEquals("(a.b or c).d", format(selectX(selectX(varX("a"), "b", varX("c")), "d")));
        assertEquals("(./a).b", format(selectX(pathX("./a"), "b")));
        assertEquals("{ a = 1; }.a", format(selectX(setX(bindX("a", constX(1))), "a")));
    }

    @Test
    void testHasAttr() {
        assertEquals("a ? b.c", format(hasAttrX(varX("a"), "b.c")));
        assertEquals("f x ? y", format(hasAttrX(applyX(varX("f"), varX("x")), "y")));
        assertEquals("(a // b) ? c", format(hasAttrX(binX(varX("a"), UPDATE, varX("b")), "c")));
    }

    @Test
    void testLists() {
        assertEquals("[]", format(listX()));
        assertEquals("[ 1 a (f x) ]", format(listX(constX(1), varX("a"), applyX(varX("f"), varX("x")))));
        assertEquals("[ a.b (-1) ]", format(listX(selectX(varX("a"), "b"), negX(constX(1)))));
    }

    @Test
    void testSets() {
        assertEquals("{}", format(setX()));
        assertEquals("rec { a = 1; }", format(recSetX(bindX("a", constX(1)))));
        assertEquals("{ a.b = 1; }", format(setX(bindX("a.b", constX(1)))));
        assertEquals("{ inherit a b; inherit (pkgs) c; }", format(setX(inheritX(null, "a", "b"), inheritX(varX("pkgs"), "c"))));
    }

    @Test
    void testDynamicKeys() {
        var quoted = new NamedBinding(new AttrPath(List.of(new KeyName.Quoted(strX("a b")))), constX(1));
        var interpolated = new NamedBinding(new AttrPath(List.of(new KeyName.Interpolated(varX("n")))), constX(2));
        assertEquals("{ \"a b\" = 1; ${n} = 2; }", format(setX(quoted, interpolated)));
    }

    @Test
    void testBrokenSet() {
        var node = setX(bindX("alpha", constX(1)), bindX("beta", strX("two")));
        assertEquals("{ alpha = 1; beta = \"two\"; }", format(node, 28));
        assertEquals("{\n  alpha = 1;\n  beta = \"two\";\n}", format(node, 27));
    }

    @Test
    void testNestedGroupsFitIndependently() {
        var node = setX(
            bindX("xs", listX(constX(1), constX(2), constX(3))),
            bindX("name", strX("some-long-package-name")));
        assertEquals("{\n  xs = [ 1 2 3 ];\n  name = \"some-long-package-name\";\n}", format(node, 30));
    }

    @Test
    void testFunctionParameters() {
        var variadic = new SetParameter(List.of(formal("a"), formal("b", constX(1))), true, null);
        assertEquals("{ a, b ? 1, ... }: a", format(lambdaX(variadic, varX("a"))));

        var aliased = new SetParameter(List.of(formal("a")), false, "args");
        assertEquals("{ a } @ args: a", format(lambdaX(aliased, varX("a"))));

        assertEquals("{}: 1", format(lambdaX(new SetParameter(List.of(), false, null), constX(1))));
        assertEquals("{ ... }: 1", format(lambdaX(new SetParameter(List.of(), true, null), constX(1))));
        assertEquals("x: y: x", format(lambdaX("x", lambdaX("y", varX("x")))));
    }

    @Test
    void testBrokenFunctionParameters() {
        var parameter = new SetParameter(List.of(formal("stdenv"), formal("fetchurl"), formal("lib")), true, null);
        var expected = "{\n  stdenv,\n  fetchurl,\n  lib,\n  ...\n}: stdenv";
        assertEquals(expected, format(lambdaX(parameter, varX("stdenv")), 20));
    }

    @Test
    void testLet() {
        var node = letX(List.of(bindX("a", constX(1)), bindX("b", constX(2))), binX(varX("a"), ADD, varX("b")));
        assertEquals("let a = 1; b = 2; in a + b", format(node));
        assertEquals("let\n  a = 1;\n  b = 2;\nin a + b", format(node, 15));
    }

    @Test
    void testConditional() {
        var node = ifX(varX("condition"), strX("then-value"), strX("else-value"));
        assertEquals("if condition then \"then-value\" else \"else-value\"", format(node));
        assertEquals("if condition then\n  \"then-value\"\nelse\n  \"else-value\"", format(node, 20));
    }

    @Test
    void testElseIfChain() {
        var node = ifX(varX("a"), varX("b"), ifX(varX("c"), varX("d"), varX("e")));
        assertEquals("if a then b else if c then d else e", format(node));
        assertEquals("if a then\n  b\nelse if c then\n  d\nelse\n  e", format(node, 20));
    }

    @Test
    void testScopes() {
        assertEquals("with pkgs; [ hello ]", format(withX(varX("pkgs"), listX(varX("hello")))));
        assertEquals("assert a; b", format(assertX(varX("a"), varX("b"))));
    }

    @Test
    void testBindingTerminatorCountsTowardsWidth() {
        var node = setX(bindX("abcdefgh", listX(constX(1), constX(2))));
        assertEquals("{\n  abcdefgh = [ 1 2 ];\n}", format(node, 21));
        assertEquals("{\n  abcdefgh = [\n    1\n    2\n  ];\n}", format(node, 20));
    }

    @Test
    void testClosingParenCountsTowardsWidth() {
        var value = applyX(varX("f"), applyX(varX("g"), listX(constX(1), constX(2))));
        var node = setX(bindX("abc", value));
        assertEquals("{\n  abc = f (g [ 1 2 ]);\n}", format(node, 22));
        assertEquals("{\n  abc = f (g [\n    1\n    2\n  ]);\n}", format(node, 21));
    }

    @Test
    void testParameterSeparatorCountsTowardsWidth() {
        var parameter = new SetParameter(List.of(formal("abc", listX(constX(1), constX(2))), formal("d")), false, null);
        var node = lambdaX(parameter, varX("abc"));
        assertEquals("{\n  abc ? [ 1 2 ],\n  d\n}: abc", format(node, 16));
        assertEquals("{\n  abc ? [\n    1\n    2\n  ],\n  d\n}: abc", format(node, 15));
    }

    @Test
    void testBrokenListRespectsWidth() {
        var node = listX(strX("alpha"), strX("beta"), strX("gamma"));
        var result = format(node, 16);
        assertEquals("[\n  \"alpha\"\n  \"beta\"\n  \"gamma\"\n]", result);
        for( var line : result.split("\n") )
            assertTrue(line.length() <= 16, line);
    }

    @Test
    void testLongAtomIsNotSplit() {
        var node = listX(strX("a-very-long-string-that-does-not-fit"));
        assertEquals("[\n  \"a-very-long-string-that-does-not-fit\"\n]", format(node, 10));
    }
}
