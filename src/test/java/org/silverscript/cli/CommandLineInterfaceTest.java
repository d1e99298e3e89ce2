package org.silverscript.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs the command line interface in-process and inspects exit codes and the JSON it prints.
 */
@Tag("unit")
class CommandLineInterfaceTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final String PAIR = """
            contract Pair(int limit) {
                entrypoint function first(int a) { require(a < limit); }
                entrypoint function second(bool ok) { require(ok); }
            }
            """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    @Test
    void testCliInitialization() {
        assertEquals("silverscript", cmd.getCommandName());
        assertThat(cmd.getSubcommands()).containsKeys("trace", "outline", "input", "keygen", "help");
    }

    @Test
    @DisplayName("outline prints the bundled contract when no file is given")
    void outlineOfBundledContract() throws Exception {
        int exitCode = cmd.execute("outline");

        assertEquals(0, exitCode);
        JsonNode outline = JSON.readTree(out.toString());
        assertThat(outline.path("contract_name").asText()).isEqualTo("DebugPoC");
        assertThat(outline.path("without_selector").asBoolean()).isTrue();
        assertThat(outline.path("functions").get(0).path("inputs")).hasSize(2);
    }

    @Test
    @DisplayName("trace runs the bundled contract with the given arguments")
    void traceOfBundledContract() throws Exception {
        int exitCode = cmd.execute("trace", "--ctor-arg", "0", "-a", "1", "-a", "2");

        assertEquals(0, exitCode);
        JsonNode trace = JSON.readTree(out.toString());
        assertThat(trace.path("meta").path("sigscript_hex").asText()).isEqualTo("5152");
        JsonNode steps = trace.path("opcode_steps");
        assertThat(steps.get(steps.size() - 1).path("is_executing").asBoolean()).isFalse();
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @DisplayName("--max-steps overrides the configured step ceiling")
    void traceWithStepCeiling() throws Exception {
        int exitCode = cmd.execute("trace", "--max-steps", "1", "-a", "1", "-a", "2");

        assertEquals(0, exitCode);
        JsonNode steps = JSON.readTree(out.toString()).path("opcode_steps");
        assertThat(steps).hasSize(3);
        assertThat(steps.get(2).path("error").asText()).contains("step limit");
    }

    @Test
    @DisplayName("input selects a function of a contract file")
    void inputForContractFile() throws Exception {
        Path file = tempDir.resolve("pair.sil");
        Files.writeString(file, PAIR);

        int exitCode = cmd.execute("input", file.toString(), "-f", "second", "--ctor-arg", "3", "-a", "true");

        assertEquals(0, exitCode);
        JsonNode input = JSON.readTree(out.toString());
        assertThat(input.path("sigscript_hex").asText()).isEqualTo("5151");
        assertThat(input.path("selector_index").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("request errors are printed as JSON with exit code 1")
    void requestErrors() throws Exception {
        int exitCode = cmd.execute("trace", "-a", "x");

        assertEquals(1, exitCode);
        assertThat(out.toString()).isEmpty();
        JsonNode error = JSON.readTree(err.toString());
        assertThat(error.path("kind").asText()).isEqualTo("argument");
        assertThat(error.path("error").asText()).contains("malformed integer");
    }

    @Test
    void noSelectorRejectsSeveralEntrypoints() throws Exception {
        Path file = tempDir.resolve("pair.sil");
        Files.writeString(file, PAIR);

        assertEquals(1, cmd.execute("trace", file.toString(), "--no-selector"));
        assertThat(JSON.readTree(err.toString()).path("error").asText()).contains("--no-selector");
    }

    @Test
    void missingContractFile() {
        assertEquals(2, cmd.execute("outline", tempDir.resolve("missing.sil").toString()));
    }

    @Test
    void missingConfigFile() {
        assertEquals(2, cmd.execute("-c", tempDir.resolve("missing.conf").toString(), "outline"));
    }

    /**
     * keygen derives the x-only public key of the secret key 1, i.e. the generator's x coordinate.
     */
    @Test
    void keygenFromSecretKey() throws Exception {
        int exitCode = cmd.execute("keygen", "-k", "0x" + "00".repeat(31) + "01");

        assertEquals(0, exitCode);
        JsonNode pair = JSON.readTree(out.toString());
        assertThat(pair.path("public_key").asText())
                .isEqualTo("0x79be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798");
        assertThat(pair.path("public_key_hash").asText()).hasSize(66);
    }

    @Test
    void keygenRejectsShortKey() {
        assertEquals(1, cmd.execute("keygen", "-k", "0x01"));
        assertThat(err.toString()).contains("invalid secret key");
    }

    @Test
    void keygenGeneratesFreshPair() throws Exception {
        assertEquals(0, cmd.execute("keygen"));
        assertThat(JSON.readTree(out.toString()).path("secret_key").asText()).startsWith("0x").hasSize(66);
    }
}
