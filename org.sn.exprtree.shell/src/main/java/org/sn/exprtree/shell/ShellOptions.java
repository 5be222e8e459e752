package org.sn.exprtree.shell;

import java.nio.file.Path;
import org.sn.exprtree.ArithmeticPolicy;
import org.sn.exprtree.annotations.NotNull;
import org.sn.exprtree.annotations.Nullable;


/**
 * Command line options of the shell.
 */
public final class ShellOptions {
    static final String USAGE = """
            Usage: ExpressionTreeShell [--dot FILE] [--json FILE] [--ieee]
              --dot FILE   write each tree in Graphviz DOT format to FILE
              --json FILE  write each tree as JSON nodes and edges to FILE
              --ieee       give Infinity or NaN instead of failing on division by zero or invalid powers
            """;

    private final @Nullable Path dotFile;
    private final @Nullable Path jsonFile;
    private final @NotNull ArithmeticPolicy arithmeticPolicy;
    private final boolean help;

    private ShellOptions(Path dotFile, Path jsonFile, ArithmeticPolicy arithmeticPolicy, boolean help) {
        this.dotFile = dotFile;
        this.jsonFile = jsonFile;
        this.arithmeticPolicy = arithmeticPolicy;
        this.help = help;
    }

    /**
     * Parse the command line.
     *
     * @throws IllegalArgumentException if an option is unknown or is missing its file name
     */
    public static @NotNull ShellOptions parse(@NotNull String... args) {
        Path dotFile = null;
        Path jsonFile = null;
        ArithmeticPolicy arithmeticPolicy = ArithmeticPolicy.STRICT;
        boolean help = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dot" -> dotFile = Path.of(requireValue(args, ++i, "--dot"));
                case "--json" -> jsonFile = Path.of(requireValue(args, ++i, "--json"));
                case "--ieee" -> arithmeticPolicy = ArithmeticPolicy.IEEE_754;
                case "-h", "--help" -> help = true;
                default -> throw new IllegalArgumentException("Unknown option " + args[i]);
            }
        }
        return new ShellOptions(dotFile, jsonFile, arithmeticPolicy, help);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing file name after " + option);
        }
        return args[index];
    }

    public @Nullable Path getDotFile() {
        return dotFile;
    }

    public @Nullable Path getJsonFile() {
        return jsonFile;
    }

    public @NotNull ArithmeticPolicy getArithmeticPolicy() {
        return arithmeticPolicy;
    }

    public boolean isHelp() {
        return help;
    }
}
