package json.tree.cli;

import json.tree.JsonTree;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class JsonTreeCliTest extends JsonTreeCliLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonTreeCliTest.class.getName());

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void clearProperties() {
        System.clearProperty(JsonTreeCli.INDENT_PROPERTY);
        System.clearProperty(JsonTreeCli.TOKENS_PROPERTY);
    }

    private int run(String... args) {
        final int status = JsonTreeCli.run(args, new PrintWriter(out, true), new PrintWriter(err, true));
        LOG.fine(() -> "exit=" + status + " out=" + out + " err=" + err);
        return status;
    }

    private Path write(String name, String content) throws Exception {
        final var file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static Path fixture() throws URISyntaxException {
        return Path.of(Objects.requireNonNull(
                JsonTreeCliTest.class.getResource("/fixtures/library.json")).toURI());
    }

    @Test
    void testNoArgumentsPrintsUsage() {
        LOG.info(() -> "TEST: testNoArgumentsPrintsUsage");
        assertThat(run()).isEqualTo(JsonTreeCli.EXIT_USAGE);
        assertThat(err.toString()).contains(JsonTreeCli.USAGE);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testTwoArgumentsPrintsUsage() {
        LOG.info(() -> "TEST: testTwoArgumentsPrintsUsage");
        assertThat(run("a.json", "b.json")).isEqualTo(JsonTreeCli.EXIT_USAGE);
        assertThat(err.toString()).contains(JsonTreeCli.USAGE);
    }

    @Test
    void testWrongExtensionIsRejected() throws Exception {
        LOG.info(() -> "TEST: testWrongExtensionIsRejected");
        final var file = write("data.txt", "{}");
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_USAGE);
        assertThat(err.toString()).contains("expected a .json file");
    }

    @Test
    void testUppercaseExtensionIsAccepted() throws Exception {
        LOG.info(() -> "TEST: testUppercaseExtensionIsAccepted");
        final var file = write("DATA.JSON", "[]");
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_OK);
        assertThat(out.toString()).isEqualTo("[]" + System.lineSeparator());
    }

    @Test
    void testMissingFileFails() {
        LOG.info(() -> "TEST: testMissingFileFails");
        final var missing = tempDir.resolve("missing.json").toString();
        assertThat(run(missing)).isEqualTo(JsonTreeCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("ERROR: could not read file " + missing + ": no such file");
    }

    @Test
    void testMalformedDocumentFails() throws Exception {
        LOG.info(() -> "TEST: testMalformedDocumentFails");
        final var file = write("bad.json", "{\"a\":}");
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("ERROR: " + file + ": Expected a value but found '}' at position 5");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testTokenizeFailureFails() throws Exception {
        LOG.info(() -> "TEST: testTokenizeFailureFails");
        final var file = write("open.json", "[\"abc");
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("Unterminated string at position 1");
    }

    @Test
    void testTruncatedDocumentReportsEndOfText() throws Exception {
        LOG.info(() -> "TEST: testTruncatedDocumentReportsEndOfText");
        final var file = write("truncated.json", "{\"a\":1  ");
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("Unexpected end of input at position 8");
    }

    @Test
    void testDeeplyNestedDocumentFails() throws Exception {
        LOG.info(() -> "TEST: testDeeplyNestedDocumentFails");
        final var file = write("deep.json", "[".repeat(100_000) + "]".repeat(100_000));
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("Nesting deeper than " + JsonTree.MAX_NESTING_DEPTH
                + " levels at position " + JsonTree.MAX_NESTING_DEPTH);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testPrintsIndentedTree() throws Exception {
        LOG.info(() -> "TEST: testPrintsIndentedTree");
        final var fixture = fixture();
        assertThat(run(fixture.toString())).isEqualTo(JsonTreeCli.EXIT_OK);

        final var printed = out.toString();
        final var expected = JsonTree.serialize(JsonTree.parse(Files.readAllBytes(fixture)));
        assertThat(printed).isEqualTo(expected + System.lineSeparator());
        assertThat(printed).startsWith("{\n    \"library\": \"Central\",");
        assertThat(JsonTree.parse(printed)).isEqualTo(JsonTree.parse(Files.readAllBytes(fixture)));
    }

    @Test
    void testIndentProperty() throws Exception {
        LOG.info(() -> "TEST: testIndentProperty");
        final var file = write("small.json", "{\"a\":[true]}");
        System.setProperty(JsonTreeCli.INDENT_PROPERTY, "2");
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_OK);
        assertThat(out.toString()).isEqualTo("{\n  \"a\": [\n    true\n  ]\n}" + System.lineSeparator());
    }

    @Test
    void testInvalidIndentFallsBackToDefault() {
        LOG.info(() -> "TEST: testInvalidIndentFallsBackToDefault");
        System.setProperty(JsonTreeCli.INDENT_PROPERTY, "wide");
        assertThat(JsonTreeCli.indent()).isEqualTo(JsonTreeCli.DEFAULT_INDENT);
        System.setProperty(JsonTreeCli.INDENT_PROPERTY, "-3");
        assertThat(JsonTreeCli.indent()).isEqualTo(JsonTreeCli.DEFAULT_INDENT);
        System.setProperty(JsonTreeCli.INDENT_PROPERTY, " 0 ");
        assertThat(JsonTreeCli.indent()).isZero();
    }

    @Test
    void testTokensPropertyListsTokens() throws Exception {
        LOG.info(() -> "TEST: testTokensPropertyListsTokens");
        final var file = write("tokens.json", "{\"a\":1}");
        System.setProperty(JsonTreeCli.TOKENS_PROPERTY, "true");
        assertThat(run(file.toString())).isEqualTo(JsonTreeCli.EXIT_OK);
        assertThat(out.toString().lines()).startsWith(
                "Token 000: {",
                "Token 001: \"",
                "Token 002: a",
                "Token 003: \"",
                "Token 004: :",
                "Token 005: 1",
                "Token 006: }",
                "{");
    }
}
