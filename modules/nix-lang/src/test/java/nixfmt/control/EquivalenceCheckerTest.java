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
package nixfmt.control;

import java.util.List;

import org.junit.jupiter.api.Test;

import static nixfmt.ast.ASTUtils.*;
import static nixfmt.ast.BinaryOperator.*;
import static org.junit.jupiter.api.Assertions.*;

class EquivalenceCheckerTest {

    private final EquivalenceChecker checker = new EquivalenceChecker();

    @Test
    void testStringQuotingIsIgnored() {
        assertTrue(EquivalenceChecker.equivalent(strX("a\n"), indStrX("a\n")));
        assertTrue(EquivalenceChecker.equivalent(
            setX(bindX("a", listX(strX("x", varX("y"))))),
            setX(bindX("a", listX(indStrX("x", varX("y")))))));
        assertTrue(EquivalenceChecker.equivalent(
            lambdaX("x", indStrX(varX("x"))),
            lambdaX("x", strX(varX("x")))));
    }

    @Test
    void testStructuralDifferences() {
        assertFalse(EquivalenceChecker.equivalent(constX(1), constX(2)));
        assertFalse(EquivalenceChecker.equivalent(strX("a"), strX("b")));
        assertFalse(EquivalenceChecker.equivalent(setX(), recSetX()));
        assertFalse(EquivalenceChecker.equivalent(
            binX(binX(varX("a"), SUBTRACT, varX("b")), SUBTRACT, varX("c")),
            binX(varX("a"), SUBTRACT, binX(varX("b"), SUBTRACT, varX("c")))));
        assertFalse(EquivalenceChecker.equivalent(
            letX(List.of(bindX("a", constX(1)), bindX("b", constX(2))), varX("a")),
            letX(List.of(bindX("b", constX(2)), bindX("a", constX(1))), varX("a"))));
    }

    @Test
    void testVerify() {
        var tree = binX(constX(1), ADD, binX(constX(2), MULTIPLY, constX(3)));
        assertTrue(checker.verify(tree, "1 + 2 * 3"));
        assertFalse(checker.verify(tree, "(1 + 2) * 3"));
        assertFalse(checker.verify(tree, "1 +"));
    }

    @Test
    void testCheckReportsBothTrees() {
        var tree = binX(binX(constX(1), ADD, constX(2)), MULTIPLY, constX(3));
        checker.check("test.nix", tree, "(1 + 2) * 3");

        var e = assertThrows(VerificationException.class, () -> checker.check("test.nix", tree, "1 + 2 * 3"));
        assertEquals(tree.toString(), e.getOriginalDump());
        assertTrue(e.getRenderedDump().contains("BinaryExpression"));
        assertTrue(e.getMessage().contains("test.nix"));
    }

    @Test
    void testCheckRejectsUnparsableOutput() {
        var e = assertThrows(VerificationException.class, () -> checker.check("test.nix", constX(1), "1 +"));
        assertNotNull(e.getCause());
    }
}
