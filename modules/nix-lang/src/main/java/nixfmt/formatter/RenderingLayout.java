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

import java.util.ArrayList;
import java.util.List;

/**
 * Layout that records positioned text and tracks the current column
 * against a fixed line width.
 */
public class RenderingLayout implements Layout {

    public static final int INDENT_WIDTH = 2;

    private sealed interface Token {}

    private record Text(String text) implements Token {}

    private record Break(int indent) implements Token {
        Break deeper() {
            return new Break(indent + INDENT_WIDTH);
        }
    }

    private final List<Token> tokens = new ArrayList<>();

    private final int maxWidth;

    private int column = 0;

    private int depth = 0;

    public RenderingLayout(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    @Override
    public void text(String fragment) {
        tokens.add(new Text(fragment));
        column += fragment.length();
    }

    @Override
    public void newline() {
        tokens.add(new Break(0));
        column = depth * INDENT_WIDTH;
    }

    @Override
    public void indent(Runnable body) {
        var start = tokens.size();
        depth++;
        try {
            body.run();
        }
        finally {
            depth--;
            for( int i = start; i < tokens.size(); i++ ) {
                if( tokens.get(i) instanceof Break b )
                    tokens.set(i, b.deeper());
            }
        }
    }

    @Override
    public boolean fits(int length) {
        return length <= maxWidth - column;
    }

    public int column() {
        return column;
    }

    /**
     * Flatten the recorded tokens into text. Indentation is written
     * only in front of a non-empty fragment, so blank lines carry no
     * trailing whitespace.
     */
    @Override
    public String toString() {
        var builder = new StringBuilder();
        var pendingIndent = 0;
        for( var token : tokens ) {
            if( token instanceof Break b ) {
                builder.append('\n');
                pendingIndent = b.indent();
            }
            else if( token instanceof Text t && !t.text().isEmpty() ) {
                if( pendingIndent > 0 ) {
                    builder.append(" ".repeat(pendingIndent));
                    pendingIndent = 0;
                }
                builder.append(t.text());
            }
        }
        return builder.toString();
    }

}
