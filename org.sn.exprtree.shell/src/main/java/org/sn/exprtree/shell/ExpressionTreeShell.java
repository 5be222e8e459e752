package org.sn.exprtree.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.lang.System.Logger.Level;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.sn.exprtree.ExpressionPipeline;
import org.sn.exprtree.ExpressionTreeEvaluator;
import org.sn.exprtree.ExpressionTreeException;
import org.sn.exprtree.ParsedExpression;
import org.sn.exprtree.annotations.NotNull;
import org.sn.exprtree.render.DotFormatter;
import org.sn.exprtree.render.JsonFormatter;
import org.sn.exprtree.render.RenderFormatter;
import org.sn.exprtree.render.RenderGraph;


/**
 * Read expressions one line at a time, and print the notation, the three conversions, and the value of each.
 * Type exit or quit, or end the input, to stop.
 */
public class ExpressionTreeShell {
    private static final System.Logger LOGGER = System.getLogger(ExpressionTreeShell.class.getName());

    static final String PROMPT = "Enter a mathematical expression (tokens separated by spaces): ";

    private final @NotNull BufferedReader in;
    private final @NotNull PrintStream out;
    private final @NotNull ExpressionTreeEvaluator evaluator;
    private final @NotNull List<RenderTarget> renderTargets = new ArrayList<>();

    public ExpressionTreeShell(@NotNull ShellOptions options, @NotNull BufferedReader in, @NotNull PrintStream out) {
        this.in = in;
        this.out = out;
        this.evaluator = ExpressionTreeEvaluator.builder().setArithmeticPolicy(options.getArithmeticPolicy()).build();
        if (options.getDotFile() != null) {
            renderTargets.add(new RenderTarget(new DotFormatter(), options.getDotFile()));
        }
        if (options.getJsonFile() != null) {
            renderTargets.add(new RenderTarget(new JsonFormatter(true), options.getJsonFile()));
        }
    }

    public static void main(String[] args) throws IOException {
        ShellOptions options;
        try {
            options = ShellOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.print(ShellOptions.USAGE);
            System.exit(2);
            return;
        }
        if (options.isHelp()) {
            System.out.print(ShellOptions.USAGE);
            return;
        }
        var in = new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset()));
        new ExpressionTreeShell(options, in, System.out).run();
    }

    /**
     * Process lines until end of input or until the user types exit or quit.
     *
     * @return the number of expressions that failed
     * @throws IOException if reading the input fails
     */
    public int run() throws IOException {
        out.println();
        out.println("=== Expression Tree Builder ===");
        int failures = 0;
        while (true) {
            out.println();
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equalsIgnoreCase("exit") || trimmed.equalsIgnoreCase("quit")) {
                break;
            }
            if (!process(trimmed)) {
                failures++;
            }
        }
        return failures;
    }

    /**
     * Run one expression through the whole pipeline and print the results.
     * Nothing but the error is printed if any step fails.
     *
     * @return true if the expression was evaluated
     */
    boolean process(@NotNull String line) {
        Result result;
        try {
            ParsedExpression parsed = ExpressionPipeline.parse(line);
            result = new Result(parsed, evaluator.evaluate(parsed.getTree()));
        } catch (ExpressionTreeException e) {
            LOGGER.log(Level.DEBUG, "Failed to process '" + line + "': " + e.getKind(), e);
            out.println();
            out.println("Error: " + e.getMessage());
            return false;
        }
        print(result);
        render(result.parsed);
        return true;
    }

    private void print(Result result) {
        ParsedExpression parsed = result.parsed;
        out.println();
        out.println("--- Detecting Expression Type ---");
        out.println("Detected Expression Type: " + parsed.getNotation().getDisplayName());

        out.println();
        out.println("--- Expression Conversions ---");
        out.println("Infix Notation   : " + parsed.toInfix());
        out.println("Postfix Notation : " + String.join(" ", parsed.toPostfix()));
        out.println("Prefix Notation  : " + String.join(" ", parsed.toPrefix()));

        out.println();
        out.println("--- Evaluating Expression Tree ---");
        out.println("Evaluated Result : " + formatValue(result.value));
    }

    private void render(ParsedExpression parsed) {
        if (renderTargets.isEmpty()) {
            return;
        }
        out.println();
        out.println("--- Visualizing Expression Tree ---");
        RenderGraph graph = RenderGraph.of(parsed.getTree());
        for (RenderTarget target : renderTargets) {
            try {
                target.formatter.write(graph, target.file);
                out.println("Visualization: Expression tree saved as '" + target.file + "'.");
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Unable to write " + target.file, e);
                out.println("Error: Unable to write '" + target.file + "': " + e.getMessage());
            }
        }
    }

    static @NotNull String formatValue(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static final class Result {
        private final ParsedExpression parsed;
        private final double value;

        private Result(ParsedExpression parsed, double value) {
            this.parsed = parsed;
            this.value = value;
        }
    }

    private static final class RenderTarget {
        private final RenderFormatter formatter;
        private final Path file;

        private RenderTarget(RenderFormatter formatter, Path file) {
            this.formatter = formatter;
            this.file = file;
        }
    }
}
