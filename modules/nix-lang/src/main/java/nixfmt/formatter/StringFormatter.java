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

import java.util.List;

import com.google.common.base.Splitter;
import nixfmt.ast.StringExpression;
import nixfmt.ast.StringPart;

/**
 * Render string literals, escaping plain text and delegating
 * interpolated expressions back to the formatter.
 */
public class StringFormatter {

    private static final Splitter LINES = Splitter.on('\n');

    private final Formatter formatter;

    public StringFormatter(Formatter formatter) {
        this.formatter = formatter;
    }

    public void visitString(Layout out, StringExpression node) {
        if( node.quoting() == StringExpression.Quoting.INDENTED && canIndent(node.parts()) )
            new IndentedStringWriter(out).write(node.parts());
        else
            visitQuoted(out, node.parts());
    }

    private void visitQuoted(Layout out, List<StringPart> parts) {
        out.text("\"");
        for( int i = 0; i < parts.size(); i++ ) {
            var part = parts.get(i);
            if( part instanceof StringPart.Text t ) {
                out.text(escapeQuoted(t.text(), i + 1 < parts.size()));
            }
            else if( part instanceof StringPart.Interpolation ip ) {
                visitInterpolation(out, ip);
            }
        }
        out.text("\"");
    }

    private void visitInterpolation(Layout out, StringPart.Interpolation node) {
        out.text("${");
        formatter.visit(out, node.expression(), 1);
        out.text("}");
    }

    /**
     * Escape text for a double-quoted string. A dollar sign is escaped
     * when it could start an interpolation, including at the end of a
     * fragment that is followed by another part.
     */
    public static String escapeQuoted(String text, boolean followedByPart) {
        var builder = new StringBuilder(text.length());
        for( int i = 0; i < text.length(); i++ ) {
            var c = text.charAt(i);
            switch( c ) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                case '$' -> builder.append(startsInterpolation(text, i, followedByPart) ? "\\$" : "$");
                default -> builder.append(c);
            }
        }
        return builder.toString();
    }

    private static boolean startsInterpolation(String text, int index, boolean followedByPart) {
        return index + 1 < text.length()
            ? text.charAt(index + 1) == '{'
            : followedByPart;
    }

    /**
     * Whether the parts survive the indentation stripping applied to
     * indented strings when they are read back. This requires at least
     * one non-blank line that does not start with a space, and a last
     * line that is not made of spaces only.
     */
    public static boolean canIndent(List<StringPart> parts) {
        var lineStart = true;
        var lineLength = 0;
        var sawContent = false;
        var allIndented = true;
        for( var part : parts ) {
            if( part instanceof StringPart.Interpolation ) {
                if( lineStart ) {
                    sawContent = true;
                    allIndented &= lineLength > 0;
                    lineStart = false;
                }
                lineLength++;
                continue;
            }
            var text = ((StringPart.Text) part).text();
            for( int i = 0; i < text.length(); i++ ) {
                var c = text.charAt(i);
                if( c == '\n' ) {
                    lineStart = true;
                    lineLength = 0;
                    continue;
                }
                if( lineStart && c != ' ' ) {
                    sawContent = true;
                    allIndented &= lineLength > 0;
                    lineStart = false;
                }
                lineLength++;
            }
        }
        if( lineStart && lineLength > 0 )
            return false;
        return !sawContent || !allIndented;
    }

    /**
     * Escape one line of an indented string.
     *
     * @param beforeInterpolation whether an interpolation follows the line
     * @param endOfLiteral whether the closing delimiter follows the line
     */
    public static String escapeIndented(String line, boolean beforeInterpolation, boolean endOfLiteral) {
        var builder = new StringBuilder(line.length());
        for( int i = 0; i < line.length(); i++ ) {
            var c = line.charAt(i);
            var last = i + 1 == line.length();
            if( c == '\'' && !last && line.charAt(i + 1) == '\'' ) {
                builder.append("'''");
                i++;
            }
            else if( c == '\'' ) {
                // a lone quote must not merge with a following escape or the closing delimiter
                var escape = last ? endOfLiteral : isEscaped(line, i + 1, beforeInterpolation);
                builder.append(escape ? "''\\'" : "'");
            }
            else if( isEscaped(line, i, beforeInterpolation) ) {
                builder.append(c == '$' ? "''$" : "''\\r");
            }
            else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private static boolean isEscaped(String line, int index, boolean beforeInterpolation) {
        var c = line.charAt(index);
        if( c == '\r' )
            return true;
        if( c != '$' )
            return false;
        return index + 1 < line.length()
            ? line.charAt(index + 1) == '{'
            : beforeInterpolation;
    }

    /**
     * Write the parts of an indented string line by line.
     */
    private class IndentedStringWriter {

        private final Layout out;

        // whether the previous fragment ended exactly at a line break
        private boolean pendingBreak = false;

        IndentedStringWriter(Layout out) {
            this.out = out;
        }

        void write(List<StringPart> parts) {
            if( parts.isEmpty() ) {
                out.text("''''");
                return;
            }
            out.text("''");
            out.indent(() -> {
                out.newline();
                for( int i = 0; i < parts.size(); i++ ) {
                    var part = parts.get(i);
                    var next = i + 1 < parts.size() ? parts.get(i + 1) : null;
                    if( part instanceof StringPart.Text t ) {
                        writeText(t.text(), next instanceof StringPart.Interpolation, next == null);
                    }
                    else if( part instanceof StringPart.Interpolation ip ) {
                        flushBreak();
                        visitInterpolation(out, ip);
                    }
                }
            });
            if( pendingBreak )
                out.newline();
            out.text("''");
        }

        private void writeText(String text, boolean beforeInterpolation, boolean endOfLiteral) {
            var lines = LINES.splitToList(text);
            for( int i = 0; i < lines.size(); i++ ) {
                if( i > 0 ) {
                    if( pendingBreak )
                        out.newline();
                    pendingBreak = true;
                }
                var line = lines.get(i);
                if( line.isEmpty() )
                    continue;
                flushBreak();
                var lastLine = i + 1 == lines.size();
                out.text(escapeIndented(line, lastLine && beforeInterpolation, lastLine && endOfLiteral));
            }
        }

        private void flushBreak() {
            if( pendingBreak ) {
                out.newline();
                pendingBreak = false;
            }
        }
    }

}
