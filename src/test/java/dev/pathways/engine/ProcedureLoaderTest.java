package dev.pathways.engine;

import dev.pathways.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcedureLoaderTest {

    @Test
    void loadsProcedureWithTextFlow() throws Exception {
        String json = """
            {
              "id": "pancakes",
              "label": "Pancakes",
              "description": "Weekend pancakes",
              "slots": { "0": "classic", "1": "vegan" },
              "limits": { "maxWalks": 50 },
              "flow": "* flour [ #0 * milk | #1 * oat milk ] = whisk"
            }
            """;

        Procedure procedure = ProcedureLoader.loadFromString(json);

        assertThat(procedure.id()).isEqualTo("pancakes");
        assertThat(procedure.label()).isEqualTo("Pancakes");
        assertThat(procedure.description()).isEqualTo("Weekend pancakes");
        assertThat(procedure.slotNames()).containsExactly(Map.entry(0, "classic"), Map.entry(1, "vegan"));
        assertThat(procedure.limits().maxWalks()).isEqualTo(50);
        assertThat(procedure.flow().items()).hasSize(3);
        assertThat(procedure.flow().depth()).isEqualTo(1);
    }

    @Test
    void loadsProcedureWithItemArrayFlow() throws Exception {
        String json = """
            {
              "id": "omelette",
              "flow": [
                { "ingredient": "eggs" },
                { "modifier": "beaten" },
                { "split": [
                    { "allow": [0], "flow": [ { "ingredient": "cheese" } ] },
                    { "block": [0, 2], "flow": "* herbs" },
                    { "allow": [] , "flow": [ { "ingredient": "ham" } ] }
                ] },
                { "action": "fold" }
              ]
            }
            """;

        Procedure procedure = ProcedureLoader.loadFromString(json);

        Flow expected = Flow.of(
            FlowItem.of(Token.ingredient("eggs")),
            FlowItem.of(Token.modifier("beaten")),
            FlowItem.of(SplitSet.of(
                new Split(Flow.ofTokens(Token.ingredient("cheese")), Gate.allow(0)),
                new Split(Flow.ofTokens(Token.ingredient("herbs")), Gate.block(0, 2))
            )),
            FlowItem.of(Token.action("fold"))
        );
        assertThat(procedure.flow()).isEqualTo(expected);
        assertThat(procedure.label()).isEqualTo("omelette");
        assertThat(procedure.slotNames()).isEmpty();
    }

    @Test
    void defaultsLimitsWhenMissing() throws Exception {
        Procedure procedure = ProcedureLoader.loadFromString("""
            { "id": "toast", "label": "Toast", "flow": "* bread = toast" }
            """);

        assertThat(procedure.limits().maxWalks()).isEqualTo(WalkLimits.DEFAULT_MAX_WALKS);
    }

    @Test
    void rejectsMissingFlow() {
        assertThatThrownBy(() -> ProcedureLoader.loadFromString("{ \"id\": \"x\" }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'flow'");
    }

    @Test
    void rejectsUnknownItem() {
        assertThatThrownBy(() -> ProcedureLoader.loadFromString("{ \"id\": \"x\", \"flow\": [ { \"tool\": \"pan\" } ] }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown flow item");
    }

    @Test
    void rejectsAlternativeWithTwoGates() {
        String json = "{ \"id\": \"x\", \"flow\": [ { \"split\": [ { \"allow\": [0], \"block\": [1] } ] } ] }";

        assertThatThrownBy(() -> ProcedureLoader.loadFromString(json))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("both allow and block");
    }

    @Test
    void rejectsScalarGate() {
        String json = """
            { "id": "x", "flow": [ { "split": [ { "allow": 1, "flow": "* milk" } ] } ] }
            """;

        assertThatThrownBy(() -> ProcedureLoader.loadFromString(json))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be an array");
    }

    @Test
    void rejectsNonIntegerGateSlot() {
        String json = """
            { "id": "x", "flow": [ { "split": [ { "allow": ["vegan"], "flow": "* tofu" } ] } ] }
            """;

        assertThatThrownBy(() -> ProcedureLoader.loadFromString(json))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be an integer");
    }

    @Test
    void rejectsFractionalGateSlot() {
        String json = """
            { "id": "x", "flow": [ { "split": [ { "block": [1.5], "flow": "* tofu" } ] } ] }
            """;

        assertThatThrownBy(() -> ProcedureLoader.loadFromString(json))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be an integer");
    }

    @Test
    void reportsGrammarErrorsInTextFlow() {
        assertThatThrownBy(() -> ProcedureLoader.loadFromString("{ \"id\": \"x\", \"flow\": \"* flour [\" }"))
            .isInstanceOf(ProcedureParseException.class);
    }

    @Test
    void loadsTextFileUsingFileNameAsId(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("porridge.proc");
        Files.writeString(file, "* oats [ #1 * milk | #! * water ] = simmer\n");

        Procedure procedure = ProcedureLoader.loadFromFile(file);

        assertThat(procedure.id()).isEqualTo("porridge");
        assertThat(procedure.limits()).isEqualTo(WalkLimits.defaults());
        assertThat(FlowWalker.walks(procedure, List.of(1))).isEqualTo(new WalkResult.Success(List.of(
            List.of(Token.ingredient("oats"), Token.ingredient("milk"), Token.action("simmer")),
            List.of(Token.ingredient("oats"), Token.ingredient("water"), Token.action("simmer"))
        )));
        assertThat(FlowWalker.walks(procedure, List.of(0))).isEqualTo(new WalkResult.Success(List.of(
            List.of(Token.ingredient("oats"), Token.ingredient("water"), Token.action("simmer"))
        )));
    }

    @Test
    void loadsEveryProcedureInDirectory(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("b.json"), "{ \"id\": \"bread\", \"flow\": \"* flour = knead\" }");
        Files.writeString(dir.resolve("a.proc"), "* water");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        Map<String, Procedure> procedures = ProcedureLoader.loadFromDirectory(dir);

        assertThat(procedures).containsOnlyKeys("a", "bread");
        assertThat(procedures.keySet()).containsExactly("a", "bread");
    }

    @Test
    void directoryLoadWrapsGrammarErrors(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("broken.proc"), "* flour ]");

        assertThatThrownBy(() -> ProcedureLoader.loadFromDirectory(dir))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("broken.proc")
            .hasCauseInstanceOf(ProcedureParseException.class);
    }
}
