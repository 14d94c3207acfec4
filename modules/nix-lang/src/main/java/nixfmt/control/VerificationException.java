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

/**
 * Raised when formatted output does not parse back into a tree
 * equivalent to the original one.
 */
public class VerificationException extends RuntimeException {

    private final String originalDump;
    private final String renderedDump;

    public VerificationException(String sourceName, String originalDump, String renderedDump) {
        this(sourceName, originalDump, renderedDump, null);
    }

    public VerificationException(String sourceName, String originalDump, String renderedDump, Throwable cause) {
        super(String.format("Formatted output of %s is not equivalent to the input%n  original: %s%n  rendered: %s", sourceName, originalDump, renderedDump), cause);
        this.originalDump = originalDump;
        this.renderedDump = renderedDump;
    }

    public String getOriginalDump() {
        return originalDump;
    }

    public String getRenderedDump() {
        return renderedDump;
    }
}
