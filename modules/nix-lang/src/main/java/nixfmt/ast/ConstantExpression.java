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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A literal atom. The source text is kept verbatim so that
 * numbers are reproduced exactly as they were written.
 */
public record ConstantExpression(Kind kind, String text) implements Expression {

    public enum Kind {
        INTEGER,
        FLOAT,
        BOOLEAN,
        NULL,
        URI
    }

    public ConstantExpression {
        checkNotNull(kind);
        checkNotNull(text);
    }

    public static ConstantExpression ofInteger(long value) {
        if( value < 0 )
            throw new IllegalArgumentException("Integer literals cannot be negative: " + value);
        return new ConstantExpression(Kind.INTEGER, Long.toString(value));
    }

    public static ConstantExpression ofBoolean(boolean value) {
        return new ConstantExpression(Kind.BOOLEAN, Boolean.toString(value));
    }

    public static ConstantExpression ofNull() {
        return new ConstantExpression(Kind.NULL, "null");
    }
}
