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
 * An attribute selection {@code base.a.b}, optionally followed by
 * {@code or default}. The default is {@code null} when absent.
 */
public record SelectExpression(Expression base, AttrPath path, Expression defaultValue) implements Expression {

    public SelectExpression {
        checkNotNull(base);
        checkNotNull(path);
    }

    public SelectExpression(Expression base, AttrPath path) {
        this(base, path, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
