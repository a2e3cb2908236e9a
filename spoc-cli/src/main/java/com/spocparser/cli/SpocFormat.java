package com.spocparser.cli;

import ch.qos.logback.classic.Level;
import com.spocparser.Parser;
import com.spocparser.SyntaxException;
import com.spocparser.ast.Toplevel;
import com.spocparser.json.AstJsonProvider;
import com.spocparser.printer.Printer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints a policy file in canonical form.
 *
 * <pre>{@code
 * spoc-format netspoc/rules/web
 * spoc-format --json netspoc/rules/web
 * }</pre>
 */
@Command(
    name = "spoc-format",
    mixinStandardHelpOptions = true,
    version = "spoc-format 1.0.0-SNAPSHOT",
    description = "Parses a policy file and prints it in canonical form"
)
public class SpocFormat implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SpocFormat.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-j", "--json"}, description = "Print the syntax tree as JSON")
    private boolean json;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Parameters(index = "0", paramLabel = "FILE", description = "Policy file to format")
    private Path file;

    @Override
    public Integer call() {
        configureLogging();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        byte[] source;
        try {
            source = Files.readAllBytes(file);
        } catch (IOException e) {
            log.debug("Reading {} failed", file, e);
            err.println("Error: Can't read " + file + ": " + e.getMessage());
            return 1;
        }

        List<Toplevel> toplevels;
        try {
            toplevels = Parser.parseFile(source, file.toString());
        } catch (SyntaxException e) {
            err.println(e.getMessage());
            return 1;
        }

        if (json) {
            out.println(AstJsonProvider.getProvider().getSerializer().serializeToplevels(toplevels, true));
        } else {
            out.print(Printer.render(toplevels, source));
        }
        out.flush();
        return 0;
    }

    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(verbose ? Level.DEBUG : Level.WARN);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SpocFormat()).execute(args);
        System.exit(exitCode);
    }
}
