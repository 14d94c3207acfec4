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

import java.util.List;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A string literal, written either in double quotes or as an
 * indented {@code ''...''} block.
 *
 * <p>The quoting style is a display choice only: two literals with
 * equal parts denote the same string.
 */
public record StringExpression(Quoting quoting, List<StringPart> parts) implements Expression {

    public enum Quoting {
        QUOTED,
        INDENTED
    }

    public StringExpression {
        checkNotNull(quoting);
        parts = ImmutableList.copyOf(parts);
    }
}
