package org.minic.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.minic.cli.config.ConfigLoader;
import org.minic.cli.config.LoggingConfigurator;
import org.minic.cli.rendering.TokenFormat;
import org.minic.compiler.frontend.lexer.Lexer;
import org.minic.compiler.frontend.lexer.LexerException;
import org.minic.compiler.frontend.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "minic",
    mixinStandardHelpOptions = true,
    version = "minic 1.0",
    description = "Tokenizes a minic source file and prints the token sequence."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String OUTPUT_FORMAT_PATH = "minic.output-format";

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to tokenize.")
    private File file;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: from configuration)"
    )
    private TokenFormat format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final Config config;
        final TokenFormat outputFormat;
        try {
            config = ConfigLoader.load(configFile);
            outputFormat = format != null ? format : configuredFormat(config);
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config);

        final List<Token> tokens;
        try {
            tokens = new Lexer(file.getPath()).tokenize(file.toPath());
        } catch (LexerException e) {
            spec.commandLine().getErr().println(e.toDiagnostic());
            return 1;
        }

        spec.commandLine().getOut().println(outputFormat.render(tokens));
        return 0;
    }

    /**
     * Reads the output format from the configuration, case-insensitively like {@code --format}.
     */
    private static TokenFormat configuredFormat(final Config config) {
        final String name = config.getString(OUTPUT_FORMAT_PATH);
        try {
            return TokenFormat.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), OUTPUT_FORMAT_PATH,
                    "expected one of " + Arrays.toString(TokenFormat.values()) + " but was '" + name + "'");
        }
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
