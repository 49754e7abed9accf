package dev.pathways.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pathways.model.Flow;
import dev.pathways.model.Procedure;
import dev.pathways.model.WalkLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathwaysCliTest {

    private static final String PANCAKES = """
        {
          "id": "pancakes",
          "label": "Pancakes",
          "description": "Weekend pancakes",
          "slots": { "0": "classic", "1": "vegan" },
          "flow": "* flour [ #0 * egg , beaten | #1 * flax ; soaked ] = whisk"
        }
        """;

    @TempDir
    Path dir;

    private Path file;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void writeProcedure() throws IOException {
        file = dir.resolve("pancakes.json");
        Files.writeString(file, PANCAKES);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        var cmd = new CommandLine(new PathwaysCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void resolvesVariantBySlotName() {
        int exit = run(file.toString(), "--slots", "vegan");

        assertThat(exit).isZero();
        assertThat(out.toString()).isEqualTo("* flour\n* flax\n; soaked\n= whisk\n");
    }

    @Test
    void resolvesVariantBySlotNumberAndFolds() {
        int exit = run(file.toString(), "--variant", "0", "--fold");

        assertThat(exit).isZero();
        assertThat(out.toString()).isEqualTo("* flour\n* egg (beaten)\n= whisk\n");
    }

    @Test
    void emitsJson() throws IOException {
        int exit = run(file.toString(), "--slots", "classic", "--json");

        assertThat(exit).isZero();
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertThat(root.get("procedure").asText()).isEqualTo("pancakes");
        assertThat(root.get("slots").get(0).asInt()).isZero();
        assertThat(root.get("walks").get(0).get(1).asText()).isEqualTo("* egg");
    }

    @Test
    void printsTree() {
        int exit = run(file.toString(), "--tree");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("#vegan", "#!classic,vegan (skip)");
    }

    @Test
    void reportsMissingSlotChoice() {
        int exit = run(file.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("malformed variant selection []", "depth 0");
    }

    @Test
    void reportsLeftoverSlotChoices() {
        int exit = run(file.toString(), "--slots", "0,1");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("unused [1]");
    }

    @Test
    void reportsUnknownSlotName() {
        int exit = run(file.toString(), "--slots", "keto");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown slot 'keto'");
    }

    @Test
    void maxWalksOverrideApplies() throws IOException {
        Path wide = dir.resolve("wide.proc");
        Files.writeString(wide, "[ * a | * b ] [ * c | * d ]");

        assertThat(run(wide.toString(), "--slots", "0", "--max-walks", "3")).isEqualTo(1);
        assertThat(err.toString()).contains("more than 3 walks");
        assertThat(run(wide.toString(), "--slots", "0")).isZero();
        assertThat(out.toString()).contains("-- walk 4 of 4");
    }

    @Test
    void failsValidationForUndeclaredSlot() throws IOException {
        Path bad = dir.resolve("bad.json");
        Files.writeString(bad, """
            { "id": "bad", "slots": { "0": "classic" }, "flow": "[ #5 * milk ]" }
            """);

        assertThat(run(bad.toString(), "--slots", "0")).isEqualTo(1);
        assertThat(err.toString()).contains("undeclared slot 5");
    }

    @Test
    void reportsParseErrors() throws IOException {
        Path bad = dir.resolve("bad.proc");
        Files.writeString(bad, "* flour [");

        assertThat(run(bad.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Unclosed '['");
    }

    @Test
    void listsProceduresInDirectory() {
        int exit = run("--list", dir.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Available procedures:", "pancakes", "Pancakes");
    }

    @Test
    void requiresProcedureFile() {
        assertThat(run()).isEqualTo(1);
        assertThat(err.toString()).contains("procedure file required");
    }

    @Test
    void slotNamesResolveToNumbers() {
        var procedure = new Procedure("p", "P", "", Map.of(0, "classic", 1, "vegan"), Flow.empty(), WalkLimits.defaults());

        assertThat(PathwaysCli.resolveSlots(procedure, List.of("vegan", " 0", "7"))).containsExactly(1, 0, 7);
        assertThatThrownBy(() -> PathwaysCli.resolveSlots(procedure, List.of("keto")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
