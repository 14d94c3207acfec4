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
package nixfmt.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

import ch.qos.logback.classic.Level;
import nixfmt.control.SourceFormatter;
import nixfmt.control.VerificationException;
import nixfmt.parser.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code nixfmt} command.
 *
 * <p>Formats each given file, or the standard input when no file is
 * given. When several files fail, the exit status is that of the most
 * severe failure.
 */
public class Launcher {

    private static final Logger log = LoggerFactory.getLogger(Launcher.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_UNFORMATTED = 1;
    public static final int EXIT_PARSE_ERROR = 2;
    public static final int EXIT_VERIFICATION_ERROR = 3;
    public static final int EXIT_USAGE_ERROR = 4;

    private static final String STDIN_NAME = "<stdin>";

    private final CommandLineOptions commandLine = new CommandLineOptions();

    private final Function<CommandLineOptions.LauncherParameters, SourceFormatter> formatterFactory;

    public Launcher() {
        this(params -> new SourceFormatter(params.formatting(), params.verify()));
    }

    /**
     * @param formatterFactory creates the formatter used for a run
     */
    public Launcher(Function<CommandLineOptions.LauncherParameters, SourceFormatter> formatterFactory) {
        this.formatterFactory = formatterFactory;
    }

    public static void main(String[] args) {
        System.exit(new Launcher().run(args, System.in, System.out));
    }

    /**
     * Run the tool and return its exit status.
     */
    public int run(String[] args, InputStream in, PrintStream out) {
        CommandLineOptions.LauncherParameters params;
        try {
            params = commandLine.parseCommandLineArguments(args);
        }
        catch( IllegalArgumentException e ) {
            log.error(e.getMessage());
            commandLine.printHelp(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
            return EXIT_USAGE_ERROR;
        }

        if( params.help() ) {
            commandLine.printHelp(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
            return EXIT_OK;
        }

        configureLogging(params);
        var formatter = formatterFactory.apply(params);

        if( params.files().isEmpty() )
            return formatStdin(formatter, params, in, out);

        var result = EXIT_OK;
        for( var file : params.files() )
            result = Math.max(result, formatFile(formatter, params, file, out));
        return result;
    }

    private int formatStdin(SourceFormatter formatter, CommandLineOptions.LauncherParameters params, InputStream in, PrintStream out) {
        String contents;
        try {
            contents = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        catch( IOException e ) {
            log.error("Unable to read standard input: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        return format(formatter, params, STDIN_NAME, contents, formatted -> {
            out.print(formatted);
            out.flush();
        });
    }

    private int formatFile(SourceFormatter formatter, CommandLineOptions.LauncherParameters params, Path file, PrintStream out) {
        String contents;
        try {
            contents = Files.readString(file);
        }
        catch( IOException e ) {
            log.error("Unable to read {}: {}", file, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        return format(formatter, params, file.toString(), contents, formatted -> {
            if( params.inPlace() ) {
                if( !formatted.equals(contents) ) {
                    Files.writeString(file, formatted);
                    log.info("Formatted {}", file);
                }
            }
            else {
                out.print(formatted);
                out.flush();
            }
        });
    }

    private int format(SourceFormatter formatter, CommandLineOptions.LauncherParameters params, String name, String contents, OutputAction action) {
        String formatted;
        try {
            formatted = formatter.format(name, contents);
        }
        catch( SyntaxException e ) {
            log.error("Unable to parse {}", e.getLocatedMessage());
            return EXIT_PARSE_ERROR;
        }
        catch( VerificationException e ) {
            log.error(e.getMessage());
            return EXIT_VERIFICATION_ERROR;
        }

        if( params.check() ) {
            if( formatted.equals(contents) )
                return EXIT_OK;
            log.info("{} is not formatted", name);
            return EXIT_UNFORMATTED;
        }

        try {
            action.accept(formatted);
        }
        catch( IOException e ) {
            log.error("Unable to write {}: {}", name, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        return EXIT_OK;
    }

    private static void configureLogging(CommandLineOptions.LauncherParameters params) {
        var level = params.debug() ? Level.DEBUG
            : params.quiet() ? Level.WARN
            : Level.INFO;
        var root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if( root instanceof ch.qos.logback.classic.Logger logger )
            logger.setLevel(level);
    }

    @FunctionalInterface
    private interface OutputAction {
        void accept(String formatted) throws IOException;
    }
}
