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
package nixfmt.ui.console;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;

/**
 * Console layout for the command-line tool: informational messages are
 * printed as they are, other levels are prefixed with the level name.
 * Debug messages also name the class that logged them.
 */
public class SimpleConsoleLayout extends LayoutBase<ILoggingEvent> {

    @Override
    public String doLayout(ILoggingEvent event) {
        var buffer = new StringBuilder(128);
        var level = event.getLevel();

        if( level == Level.INFO ) {
            buffer.append(event.getFormattedMessage());
        }
        else if( level.toInt() <= Level.DEBUG_INT ) {
            buffer
                .append(level.toString()).append(" [")
                .append(simpleName(event.getLoggerName())).append("] ")
                .append(event.getFormattedMessage());
        }
        else {
            buffer
                .append(level.toString()).append(": ")
                .append(event.getFormattedMessage());
        }

        buffer.append(CoreConstants.LINE_SEPARATOR);
        return buffer.toString();
    }

    private static String simpleName(String loggerName) {
        var dot = loggerName.lastIndexOf('.');
        return dot >= 0 ? loggerName.substring(dot + 1) : loggerName;
    }
}
