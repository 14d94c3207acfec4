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
 * Layout that only counts the characters a single-line rendering
 * would occupy.
 *
 * <p>Line breaks and indentation emit nothing. A line break can only
 * reach this layout when a construct cannot be written on one line
 * at all (e.g. an indented string), in which case the measured length
 * is unbounded.
 */
public class MeasuringLayout implements Layout {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private int length = 0;

    private boolean broken = false;

    @Override
    public void text(String fragment) {
        length += fragment.length();
    }

    @Override
    public void newline() {
        broken = true;
    }

    @Override
    public void indent(Runnable body) {
        body.run();
    }

    @Override
    public boolean fits(int length) {
        return true;
    }

    @Override
    public void tryOneLine(int suffix, LayoutRule rule) {
        rule.layout(this, true);
    }

    public int length() {
        return broken ? UNBOUNDED : length;
    }

}
