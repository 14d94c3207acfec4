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
package nixfmt.ast;

/**
 * Infix operators. Lower precedence numbers bind tighter.
 *
 * <p>Associativity is not recorded here: the formatter keeps its own
 * pairwise table for operators that share a precedence level.
 */
public enum BinaryOperator {
    CONCAT("++", 5),
    MULTIPLY("*", 6),
    DIVIDE("/", 6),
    ADD("+", 7),
    SUBTRACT("-", 7),
    UPDATE("//", 9),
    LESS("<", 10),
    GREATER(">", 10),
    LESS_EQUAL("<=", 10),
    GREATER_EQUAL(">=", 10),
    EQUAL("==", 11),
    NOT_EQUAL("!=", 11),
    AND("&&", 12),
    OR("||", 13),
    IMPLICATION("->", 14);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for( var op : values() ) {
            if( op.symbol.equals(symbol) )
                return op;
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
