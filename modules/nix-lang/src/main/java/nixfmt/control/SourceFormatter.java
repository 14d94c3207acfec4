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
package nixfmt.control;

import nixfmt.formatter.Formatter;
import nixfmt.formatter.FormattingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Format Nix source text: parse it, render the tree and optionally
 * check that the result parses back into an equivalent tree.
 */
public class SourceFormatter {

    private static final Logger log = LoggerFactory.getLogger(SourceFormatter.class);

    private final FormattingOptions options;

    private final SourceParser parser;

    // null when the output is not verified
    private final EquivalenceChecker checker;

    /**
     * Create a formatter that checks its output with the given
     * checker, or does not check it when the checker is {@code null}.
     */
    public SourceFormatter(FormattingOptions options, EquivalenceChecker checker) {
        this.options = options;
        this.parser = new SourceParser();
        this.checker = checker;
    }

    public SourceFormatter(FormattingOptions options, boolean verify) {
        this(options, verify ? new EquivalenceChecker() : null);
    }

    public SourceFormatter(FormattingOptions options) {
        this(options, false);
    }

    /**
     * Format the given source text.
     *
     * @param name name of the source, used in error messages
     * @param contents source text
     * @return the formatted text, ending with a newline
     * @throws nixfmt.parser.SyntaxException if the source cannot be parsed
     * @throws VerificationException if verification is enabled and fails
     */
    public String format(String name, String contents) {
        var ast = parser.parse(name, contents);
        var result = new Formatter(options).format(ast);
        if( checker != null )
            checker.check(name, ast, result);
        log.debug("Formatted {} with line width {}", name, options.maxWidth());
        return result + "\n";
    }
}
