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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A dotted attribute path such as {@code a."b c".${d}}.
 */
public record AttrPath(List<KeyName> keys) {

    public AttrPath {
        keys = ImmutableList.copyOf(keys);
        checkArgument(!keys.isEmpty(), "Attribute path cannot be empty");
    }

    public static AttrPath of(String... names) {
        var keys = ImmutableList.<KeyName>builder();
        for( var name : names )
            keys.add(new KeyName.Static(name));
        return new AttrPath(keys.build());
    }
}
