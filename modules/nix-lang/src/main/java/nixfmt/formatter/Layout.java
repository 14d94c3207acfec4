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

/**
 * The capabilities used by the formatter to lay out text.
 *
 * <p>There are two interpretations: {@link MeasuringLayout} computes
 * the length of a rendering forced onto a single line, and
 * {@link RenderingLayout} produces the actual output.
 */
public interface Layout {

    /**
     * Emit a fragment of text on the current line.
     */
    void text(String fragment);

    /**
     * Start a new line at the current indentation.
     */
    void newline();

    /**
     * Run the given body with one extra level of indentation. The
     * previous indentation is restored when the body completes,
     * normally or not.
     */
    void indent(Runnable body);

    /**
     * Whether {@code length} more characters fit on the current line.
     */
    boolean fits(int length);

    /**
     * Lay out a group on a single line if it fits, or in its broken
     * form otherwise. The rule is measured once and rendered once.
     */
    default void tryOneLine(LayoutRule rule) {
        tryOneLine(0, rule);
    }

    /**
     * Like {@link #tryOneLine(LayoutRule)}, but the single-line form
     * must also leave room for {@code suffix} characters written
     * after the group on the same line, such as a closing {@code ;}.
     */
    default void tryOneLine(int suffix, LayoutRule rule) {
        var measure = new MeasuringLayout();
        rule.layout(measure, true);
        var length = measure.length();
        var required = length == MeasuringLayout.UNBOUNDED ? length : length + suffix;
        rule.layout(this, fits(required));
    }

}
