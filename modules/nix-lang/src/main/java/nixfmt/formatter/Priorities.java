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

import java.util.EnumMap;
import java.util.Map;

import nixfmt.ast.ApplyExpression;
import nixfmt.ast.AssertExpression;
import nixfmt.ast.BinaryExpression;
import nixfmt.ast.BinaryOperator;
import nixfmt.ast.ConstantExpression;
import nixfmt.ast.EnvPathExpression;
import nixfmt.ast.Expression;
import nixfmt.ast.FunctionExpression;
import nixfmt.ast.HasAttrExpression;
import nixfmt.ast.IfExpression;
import nixfmt.ast.LetExpression;
import nixfmt.ast.ListExpression;
import nixfmt.ast.PathExpression;
import nixfmt.ast.SelectExpression;
import nixfmt.ast.SetExpression;
import nixfmt.ast.SpecialOperator;
import nixfmt.ast.StringExpression;
import nixfmt.ast.UnaryExpression;
import nixfmt.ast.UnaryOperator;
import nixfmt.ast.VariableExpression;
import nixfmt.ast.WithExpression;

import static nixfmt.ast.BinaryOperator.*;

/**
 * Decide where parentheses are required, based on the priority of
 * each construct and on a pairwise associativity table for operators
 * that share a precedence level.
 */
public class Priorities {

    /**
     * On which side of a parent operator an operand with the same
     * precedence may appear without parentheses.
     */
    public enum Associativity {
        LEFT,
        RIGHT,
        NONE
    }

    public static final Priority SELECT = Priority.of(SpecialOperator.SELECT.precedence());

    public static final Priority APPLY = Priority.of(SpecialOperator.APPLY.precedence());

    public static final Priority HAS_ATTR = Priority.of(SpecialOperator.HAS_ATTR.precedence());

    private static final Map<BinaryOperator, Map<BinaryOperator, Associativity>> ASSOCIATIVITY = new EnumMap<>(BinaryOperator.class);

    static {
        rule(Associativity.RIGHT, CONCAT);
        rule(Associativity.LEFT, MULTIPLY, DIVIDE);
        rule(Associativity.LEFT, ADD, SUBTRACT);
        rule(Associativity.RIGHT, UPDATE);
        rule(Associativity.NONE, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL);
        rule(Associativity.NONE, EQUAL, NOT_EQUAL);
        rule(Associativity.LEFT, AND);
        rule(Associativity.LEFT, OR);
        rule(Associativity.RIGHT, IMPLICATION);
        checkComplete();
    }

    /**
     * Register the same associativity for every ordered pair of the
     * given operators, which must share a precedence level.
     */
    private static void rule(Associativity associativity, BinaryOperator... operators) {
        for( var parent : operators ) {
            for( var child : operators ) {
                if( parent.precedence() != child.precedence() )
                    throw new IllegalStateException("Operators " + parent + " and " + child + " do not share a precedence level");
                ASSOCIATIVITY
                    .computeIfAbsent(parent, k -> new EnumMap<>(BinaryOperator.class))
                    .put(child, associativity);
            }
        }
    }

    /**
     * Fail if two operators with equal precedence have no entry in
     * the associativity table.
     */
    static void checkComplete() {
        for( var parent : BinaryOperator.values() ) {
            for( var child : BinaryOperator.values() ) {
                if( parent.precedence() == child.precedence() )
                    associativity(parent, child);
            }
        }
    }

    public static Associativity associativity(BinaryOperator parent, BinaryOperator child) {
        var row = ASSOCIATIVITY.get(parent);
        var result = row != null ? row.get(child) : null;
        if( result == null )
            throw new IllegalStateException("No associativity rule for '" + child.symbol() + "' nested in '" + parent.symbol() + "'");
        return result;
    }

    public static Priority of(UnaryOperator operator) {
        return Priority.of(operator.precedence());
    }

    public static Priority of(BinaryOperator operator) {
        return Priority.of(operator);
    }

    public static Priority of(Expression node) {
        if( node instanceof BinaryExpression be )
            return of(be.operator());

        if( node instanceof UnaryExpression ue )
            return of(ue.operator());

        if( node instanceof SelectExpression )
            return SELECT;

        if( node instanceof ApplyExpression )
            return APPLY;

        if( node instanceof HasAttrExpression )
            return HAS_ATTR;

        if( node instanceof FunctionExpression
                || node instanceof LetExpression
                || node instanceof IfExpression
                || node instanceof WithExpression
                || node instanceof AssertExpression )
            return Priority.MAXIMAL;

        if( node instanceof ConstantExpression
                || node instanceof StringExpression
                || node instanceof VariableExpression
                || node instanceof ListExpression
                || node instanceof SetExpression
                || node instanceof PathExpression
                || node instanceof EnvPathExpression )
            return Priority.ATOMIC;

        throw new IllegalStateException("Unknown expression: " + node);
    }

    /**
     * Whether an operand of a binary operator must be parenthesized.
     *
     * @param context the priority of the enclosing operator
     * @param isLeft whether the operand is on the left side
     * @param child the priority of the operand
     */
    public static boolean needsParens(Priority context, boolean isLeft, Priority child) {
        var cmp = child.compareTo(context);
        if( cmp != 0 )
            return cmp > 0;
        if( child.kind() != Priority.Kind.OPERATOR )
            return child.kind() == Priority.Kind.MAXIMAL;
        if( context.operator() == null || child.operator() == null )
            throw new IllegalStateException("No associativity rule for " + child + " nested in " + context);

        var associativity = associativity(context.operator(), child.operator());
        return isLeft
            ? associativity != Associativity.LEFT
            : associativity != Associativity.RIGHT;
    }

    /**
     * Whether the child binds more loosely than the context.
     */
    public static boolean isLooser(Priority child, Priority context) {
        return child.compareTo(context) > 0;
    }

    /**
     * Whether the child is not atomic and does not bind more tightly
     * than the context.
     */
    public static boolean isLooserOrEqual(Priority child, Priority context) {
        return !child.isAtomic() && child.compareTo(context) >= 0;
    }

}
