package dev.pathways.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pathways.engine.FlowPrinter;
import dev.pathways.engine.FlowWalker;
import dev.pathways.engine.MetaProcessor;
import dev.pathways.engine.ProcedureLoader;
import dev.pathways.engine.ProcedureParseException;
import dev.pathways.engine.ProcedureValidator;
import dev.pathways.engine.ProcessException;
import dev.pathways.engine.WalkException;
import dev.pathways.model.ProcessItem;
import dev.pathways.model.Procedure;
import dev.pathways.model.Token;
import dev.pathways.model.WalkLimits;
import dev.pathways.model.WalkResult;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point: resolve one variant of a procedure file into its steps.
 */
@Command(
    name = "recipe-pathways",
    mixinStandardHelpOptions = true,
    description = "Resolve a variant of a procedure with gated alternative pathways."
)
public class PathwaysCli implements Callable<Integer> {

    private static final Logger log = LogManager.getLogger(PathwaysCli.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Procedure file (.json or .proc)")
    private Path procedureFile;

    @Option(names = {"--slots", "--variant"}, split = ",",
        description = "Slot choices, outermost branch first; numbers or declared slot names")
    private List<String> slots = new ArrayList<>();

    @Option(names = "--list", description = "List the procedures in a directory")
    private Path listDir;

    @Option(names = "--tree", description = "Print the normalized procedure tree instead of resolving")
    private boolean tree;

    @Option(names = "--fold", description = "Fold modifiers and annotations onto the items they follow")
    private boolean fold;

    @Option(names = "--json", description = "Print walks as JSON")
    private boolean json;

    @Option(names = "--max-walks", description = "Override the maxWalks limit")
    private Integer maxWalks;

    @Option(names = "--verbose", description = "Log resolution details")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setLevel("dev.pathways", Level.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            if (listDir != null) {
                return list(out);
            }
            if (procedureFile == null) {
                err.println("Error: procedure file required. Use --list <dir> to see available procedures.");
                return 1;
            }

            Procedure procedure = ProcedureLoader.loadFromFile(procedureFile);
            if (maxWalks != null) {
                procedure = new Procedure(procedure.id(), procedure.label(), procedure.description(),
                    procedure.slotNames(), procedure.flow(), new WalkLimits(maxWalks));
            }

            List<String> errors = ProcedureValidator.validate(procedure);
            if (!errors.isEmpty()) {
                log.warn("Procedure {} failed validation with {} error(s)", procedure.id(), errors.size());
                errors.forEach(e -> err.println("Error: " + e));
                return 1;
            }

            if (tree) {
                out.print(FlowPrinter.printTree(procedure.flow(), procedure.slotNames()));
                return 0;
            }
            return resolve(procedure, out, err);
        } catch (IOException | ProcedureParseException | ProcessException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private int list(PrintWriter out) throws IOException {
        Map<String, Procedure> procedures = ProcedureLoader.loadFromDirectory(listDir);
        out.println("Available procedures:");
        for (Procedure procedure : procedures.values()) {
            out.printf("  %-24s %s (up to %d slot choice(s))%n",
                procedure.id(), procedure.label(), procedure.flow().depth());
        }
        return 0;
    }

    private int resolve(Procedure procedure, PrintWriter out, PrintWriter err)
            throws ProcessException, JsonProcessingException {
        List<Integer> choices = resolveSlots(procedure, slots);
        WalkResult result = FlowWalker.walks(procedure, choices);

        if (!(result instanceof WalkResult.Success success)) {
            err.println("Error: malformed variant selection " + choices + ": " + WalkException.describe(result));
            return 1;
        }

        if (json) {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(procedure, choices, success)));
            return 0;
        }

        List<List<Token>> walks = success.walks();
        for (int i = 0; i < walks.size(); i++) {
            if (walks.size() > 1) {
                out.printf("-- walk %d of %d%n", i + 1, walks.size());
            }
            out.print(fold
                ? FlowPrinter.printItems(MetaProcessor.process(walks.get(i)))
                : FlowPrinter.printWalk(walks.get(i)));
        }
        return 0;
    }

    private Map<String, Object> toJson(Procedure procedure, List<Integer> choices, WalkResult.Success success)
            throws ProcessException {
        var walks = new ArrayList<Object>();
        for (List<Token> walk : success.walks()) {
            if (fold) {
                List<ProcessItem> items = MetaProcessor.process(walk);
                walks.add(items);
            } else {
                walks.add(walk.stream().map(Token::toString).toList());
            }
        }
        var root = new LinkedHashMap<String, Object>();
        root.put("procedure", procedure.id());
        root.put("slots", choices);
        root.put("walks", walks);
        return root;
    }

    /**
     * Turn slot arguments into slot numbers, looking names up in the procedure's slot names.
     */
    static List<Integer> resolveSlots(Procedure procedure, List<String> args) {
        var byName = new LinkedHashMap<String, Integer>();
        procedure.slotNames().forEach((slot, name) -> byName.put(name, slot));

        var choices = new ArrayList<Integer>();
        for (String arg : args) {
            String trimmed = arg.trim();
            Integer slot = byName.get(trimmed);
            if (slot == null) {
                try {
                    slot = Integer.parseInt(trimmed);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                        "Unknown slot '%s'. Declared slots: %s".formatted(trimmed, procedure.slotNames()), e);
                }
            }
            choices.add(slot);
        }
        return choices;
    }
}
