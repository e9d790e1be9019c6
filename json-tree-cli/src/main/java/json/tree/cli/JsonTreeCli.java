package json.tree.cli;

import json.tree.JsonTree;
import json.tree.JsonTreeException;
import json.tree.Token;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/// CLI entry point that parses a JSON file and prints it back indented.
///
/// Usage:
/// `java -jar json-tree-cli.jar data.json`
///
/// System properties:
/// - `json.tree.indent`: spaces per nesting level in the output, default 4
/// - `json.tree.tokens`: when `true`, print the token list before the tree
///
/// Exit status is 0 on success, 1 when the file cannot be read or parsed, and 2 on
/// bad usage.
public final class JsonTreeCli {

    private static final Logger LOG = Logger.getLogger(JsonTreeCli.class.getName());

    static final String USAGE = "Usage: java -jar json-tree-cli.jar <file.json>";
    static final String INDENT_PROPERTY = "json.tree.indent";
    static final String TOKENS_PROPERTY = "json.tree.tokens";
    static final int DEFAULT_INDENT = 4;

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private JsonTreeCli() {}

    public static void main(String[] args) {
        final var out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        final int status = run(args, out, err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintWriter out, PrintWriter err) {
        if (args == null || args.length != 1) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        final var file = args[0];
        if (!file.toLowerCase(Locale.ROOT).endsWith(".json")) {
            err.println("ERROR: expected a .json file but got " + file);
            return EXIT_USAGE;
        }

        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(Path.of(file));
        } catch (IOException | InvalidPathException e) {
            LOG.warning(() -> "Could not read " + file + ": " + e);
            err.println("ERROR: could not read file " + file + ": " + reason(e));
            return EXIT_FAILURE;
        }
        LOG.fine(() -> "Read " + bytes.length + " bytes from " + file);

        try {
            final var text = new String(bytes, StandardCharsets.UTF_8);
            final var tokens = JsonTree.tokenize(text);
            if (Boolean.getBoolean(TOKENS_PROPERTY)) {
                printTokens(tokens, out);
            }
            out.println(JsonTree.serialize(JsonTree.parse(tokens, text.length()), indent()));
            return EXIT_OK;
        } catch (JsonTreeException e) {
            LOG.warning(() -> "Could not parse " + file + ": " + e.getMessage());
            err.println("ERROR: " + file + ": " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            out.flush();
        }
    }

    private static void printTokens(List<Token> tokens, PrintWriter out) {
        for (int i = 0; i < tokens.size(); i++) {
            out.println(String.format("Token %03d: %s", i, tokens.get(i).text()));
        }
    }

    static int indent() {
        final var prop = System.getProperty(INDENT_PROPERTY);
        if (prop == null || prop.isBlank()) {
            return DEFAULT_INDENT;
        }
        try {
            final int value = Integer.parseInt(prop.trim());
            if (value >= 0) {
                return value;
            }
            LOG.warning(() -> "Negative " + INDENT_PROPERTY + "=" + prop + ", using " + DEFAULT_INDENT);
        } catch (NumberFormatException e) {
            LOG.warning(() -> "Invalid " + INDENT_PROPERTY + "=" + prop + ", using " + DEFAULT_INDENT);
        }
        return DEFAULT_INDENT;
    }

    private static String reason(Exception e) {
        if (e instanceof NoSuchFileException) {
            return "no such file";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
