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

import java.util.Objects;

import nixfmt.ast.BinaryOperator;

/**
 * How loosely a construct binds, i.e. how much protection it needs
 * when it is embedded in another construct.
 *
 * <p>Priorities are totally ordered: atomic forms come first and never
 * need parentheses, operators follow in order of their precedence
 * number (a tighter operator compares smaller), and greedy forms that
 * extend as far right as possible come last. Two operator priorities
 * compare equal when their precedence is equal, regardless of which
 * operator they were derived from.
 */
public final class Priority implements Comparable<Priority> {

    public enum Kind {
        ATOMIC,
        OPERATOR,
        MAXIMAL
    }

    public static final Priority ATOMIC = new Priority(Kind.ATOMIC, 0, null);

    public static final Priority MAXIMAL = new Priority(Kind.MAXIMAL, 0, null);

    private final Kind kind;

    private final int precedence;

    private final BinaryOperator operator;

    private Priority(Kind kind, int precedence, BinaryOperator operator) {
        this.kind = kind;
        this.precedence = precedence;
        this.operator = operator;
    }

    public static Priority of(int precedence) {
        return new Priority(Kind.OPERATOR, precedence, null);
    }

    public static Priority of(BinaryOperator operator) {
        return new Priority(Kind.OPERATOR, operator.precedence(), operator);
    }

    public Kind kind() {
        return kind;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * The binary operator this priority was derived from, or
     * {@code null} for any other construct.
     */
    public BinaryOperator operator() {
        return operator;
    }

    public boolean isAtomic() {
        return kind == Kind.ATOMIC;
    }

    @Override
    public int compareTo(Priority other) {
        var result = kind.compareTo(other.kind);
        return result != 0
            ? result
            : Integer.compare(precedence, other.precedence);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Priority p && compareTo(p) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, precedence);
    }

    @Override
    public String toString() {
        return switch( kind ) {
            case ATOMIC -> "atomic";
            case MAXIMAL -> "maximal";
            case OPERATOR -> operator != null
                ? "operator(" + precedence + ", " + operator.symbol() + ")"
                : "operator(" + precedence + ")";
        };
    }
}
