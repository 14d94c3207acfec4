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

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

import nixfmt.formatter.FormattingOptions;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Parse the command line arguments and present the help page.
 */
public class CommandLineOptions {

    private static final String WIDTH_OPTION = "width";
    private static final String VERIFY_OPTION = "verify";
    private static final String IN_PLACE_OPTION = "in-place";
    private static final String CHECK_OPTION = "check";
    private static final String QUIET_OPTION = "quiet";
    private static final String DEBUG_OPTION = "debug";
    private static final String HELP_OPTION = "help";

    private final Options options = createOptions();

    private static Options createOptions() {
        var options = new Options();

        options.addOption(Option.builder("w")
                .hasArg(true)
                .argName("n")
                .desc("Maximum line width (default: " + FormattingOptions.DEFAULT_MAX_WIDTH + ").")
                .longOpt(WIDTH_OPTION)
                .build());

        options.addOption(Option.builder("v")
                .hasArg(false)
                .desc("Parse the formatted output again and check that it is equivalent to the input.")
                .longOpt(VERIFY_OPTION)
                .build());

        options.addOption(Option.builder("i")
                .hasArg(false)
                .desc("Rewrite the given files instead of printing the result.")
                .longOpt(IN_PLACE_OPTION)
                .build());

        options.addOption(Option.builder("c")
                .hasArg(false)
                .desc("Only report the files that are not formatted.")
                .longOpt(CHECK_OPTION)
                .build());

        options.addOption(Option.builder("q")
                .hasArg(false)
                .desc("Only log warnings and errors.")
                .longOpt(QUIET_OPTION)
                .build());

        options.addOption(Option.builder()
                .hasArg(false)
                .desc("Log debugging information.")
                .longOpt(DEBUG_OPTION)
                .build());

        options.addOption(Option.builder("h")
                .hasArg(false)
                .desc("Show this help page.")
                .longOpt(HELP_OPTION)
                .build());

        return options;
    }

    public void printHelp(PrintWriter writer) {
        var formatter = new HelpFormatter();
        formatter.printHelp(writer, formatter.getWidth(), "nixfmt [options] [FILE...]",
                "Format Nix expressions. Reads standard input when no file is given.",
                options, formatter.getLeftPadding(), formatter.getDescPadding(), "", false);
        writer.flush();
    }

    /**
     * @throws IllegalArgumentException if the arguments are not valid
     */
    public LauncherParameters parseCommandLineArguments(String[] args) {
        CommandLine cl;
        try {
            CommandLineParser clp = new DefaultParser();
            cl = clp.parse(options, args);
        }
        catch( ParseException e ) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }

        var width = FormattingOptions.DEFAULT_MAX_WIDTH;
        if( cl.hasOption(WIDTH_OPTION) ) {
            var value = cl.getOptionValue(WIDTH_OPTION);
            try {
                width = Integer.parseInt(value);
            }
            catch( NumberFormatException e ) {
                throw new IllegalArgumentException("Invalid line width: " + value, e);
            }
            if( width <= 0 )
                throw new IllegalArgumentException("Line width must be positive: " + value);
        }

        var files = cl.getArgList().stream()
            .map(Path::of)
            .toList();

        var params = new LauncherParameters(
            new FormattingOptions(width),
            cl.hasOption(VERIFY_OPTION),
            cl.hasOption(IN_PLACE_OPTION),
            cl.hasOption(CHECK_OPTION),
            cl.hasOption(QUIET_OPTION),
            cl.hasOption(DEBUG_OPTION),
            cl.hasOption(HELP_OPTION),
            files);

        if( params.inPlace() && params.check() )
            throw new IllegalArgumentException("Options --in-place and --check cannot be used together");
        if( params.inPlace() && files.isEmpty() )
            throw new IllegalArgumentException("Option --in-place requires at least one file");
        return params;
    }

    /**
     * The settings of one run of the tool.
     */
    public record LauncherParameters(
        FormattingOptions formatting,
        boolean verify,
        boolean inPlace,
        boolean check,
        boolean quiet,
        boolean debug,
        boolean help,
        List<Path> files
    ) {}
}
