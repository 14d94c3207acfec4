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
 * An attribute set pattern, as in {@code { a, b ? 1, ... } @ args: body}.
 *
 * <p>A variadic pattern accepts attributes beyond the listed formals.
 * The alias is {@code null} when the whole set is not bound to a name.
 */
public record SetParameter(List<Formal> formals, boolean variadic, String alias) implements Parameter {

    public SetParameter {
        formals = ImmutableList.copyOf(formals);
    }

    public boolean hasAlias() {
        return alias != null;
    }

    /**
     * A named entry of the pattern with an optional default value.
     */
    public record Formal(String name, Expression defaultValue) {
        public Formal {
            checkNotNull(name);
        }

        public boolean hasDefault() {
            return defaultValue != null;
        }
    }
}
