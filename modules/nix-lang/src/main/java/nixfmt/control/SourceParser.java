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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import nixfmt.ast.Expression;
import nixfmt.parser.NixAstBuilder;
import nixfmt.parser.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parse Nix source text into an expression tree.
 */
public class SourceParser {

    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    /**
     * Parse the given source text.
     *
     * @param name name of the source, used in error messages
     * @param contents source text
     * @throws SyntaxException if the text is not a valid expression
     */
    public Expression parse(String name, String contents) {
        log.debug("Parsing {} ({} characters)", name, contents.length());
        return new NixAstBuilder(name, contents).buildAST();
    }

    public Expression parse(Path file) throws IOException {
        return parse(file.toString(), Files.readString(file));
    }
}
