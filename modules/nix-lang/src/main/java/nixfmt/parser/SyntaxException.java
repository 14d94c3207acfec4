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
package nixfmt.parser;

/**
 * Raised when a Nix source cannot be parsed.
 *
 * Lines and columns are 1-based.
 */
public class SyntaxException extends RuntimeException {

    private final String sourceName;
    private final int line;
    private final int column;

    public SyntaxException(String message, String sourceName, int line, int column) {
        super(message);
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public SyntaxException(String message, String sourceName, int line, int column, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * The message prefixed with the source location, e.g. {@code default.nix:3:7: ...}.
     */
    public String getLocatedMessage() {
        return sourceName + ":" + line + ":" + column + ": " + getMessage();
    }
}
