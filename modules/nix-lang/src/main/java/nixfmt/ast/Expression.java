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
 * A node of the Nix expression tree.
 *
 * <p>The set of expression forms is closed. Trees are immutable and
 * owned top-down: a node is never shared between two parents.
 */
public sealed interface Expression permits
        ApplyExpression,
        AssertExpression,
        BinaryExpression,
        ConstantExpression,
        EnvPathExpression,
        FunctionExpression,
        HasAttrExpression,
        IfExpression,
        LetExpression,
        ListExpression,
        PathExpression,
        SelectExpression,
        SetExpression,
        StringExpression,
        UnaryExpression,
        VariableExpression,
        WithExpression {
}
