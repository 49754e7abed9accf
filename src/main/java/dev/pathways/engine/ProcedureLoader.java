package dev.pathways.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pathways.model.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads procedure definitions from JSON files, or from plain procedure text ({@code .proc}).
 *
 * <pre>
 * {
 *   "id": "pancakes",
 *   "label": "Pancakes",
 *   "description": "Weekend pancakes",
 *   "slots": { "0": "classic", "1": "vegan" },
 *   "limits": { "maxWalks": 100 },
 *   "flow": "* flour [ #0 * milk | #1 * oat milk ] = whisk"
 * }
 * </pre>
 *
 * The flow may also be given as a JSON array of items: {@code {"ingredient": "flour"}} for a token
 * (keyed by its lower-case kind) or {@code {"split": [{"allow": [0], "flow": [...]}, ...]}} for a
 * branch point, each alternative gated by {@code allow} or {@code block} (allow-all when neither).
 */
public final class ProcedureLoader {

    public static final String TEXT_EXTENSION = ".proc";
    public static final String JSON_EXTENSION = ".json";

    private static final Logger log = LogManager.getLogger(ProcedureLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProcedureLoader() {}

    /**
     * Load a single procedure from a JSON or {@code .proc} file.
     */
    public static Procedure loadFromFile(Path path) throws IOException, ProcedureParseException {
        String name = path.getFileName().toString();
        log.debug("Loading procedure from {}", path);
        if (name.endsWith(TEXT_EXTENSION)) {
            String id = name.substring(0, name.length() - TEXT_EXTENSION.length());
            return fromText(id, Files.readString(path));
        }
        return parseProcedure(MAPPER.readTree(path.toFile()));
    }

    /**
     * Load a single procedure from a JSON string.
     */
    public static Procedure loadFromString(String json) throws IOException, ProcedureParseException {
        return parseProcedure(MAPPER.readTree(json));
    }

    /**
     * Build a procedure from bare procedure text, with default limits and no slot names.
     */
    public static Procedure fromText(String id, String text) throws ProcedureParseException {
        Flow flow = ProcedureParser.parse(text);
        return new Procedure(id, id, "", Map.of(), flow, WalkLimits.defaults());
    }

    /**
     * Load all procedures from a directory of JSON and {@code .proc} files, keyed by id.
     */
    public static Map<String, Procedure> loadFromDirectory(Path dir) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                .filter(p -> p.toString().endsWith(JSON_EXTENSION) || p.toString().endsWith(TEXT_EXTENSION))
                .sorted()
                .toList();
        }

        var procedures = new LinkedHashMap<String, Procedure>();
        for (Path file : files) {
            try {
                Procedure procedure = loadFromFile(file);
                procedures.put(procedure.id(), procedure);
            } catch (ProcedureParseException e) {
                throw new IOException("Failed to load procedure from " + file, e);
            }
        }
        return procedures;
    }

    private static Procedure parseProcedure(JsonNode root) throws ProcedureParseException {
        String id = required(root, "id").asText();
        String label = root.has("label") ? root.get("label").asText() : id;
        String description = root.has("description") ? root.get("description").asText() : "";

        Map<Integer, String> slotNames = parseSlotNames(root.get("slots"));
        WalkLimits limits = parseLimits(root.get("limits"));
        Flow flow = parseFlow(required(root, "flow"));

        return new Procedure(id, label, description, slotNames, flow, limits);
    }

    private static Map<Integer, String> parseSlotNames(JsonNode node) {
        if (node == null) {
            return Map.of();
        }
        var names = new TreeMap<Integer, String>();
        for (var entry : node.properties()) {
            int slot;
            try {
                slot = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Slot key is not a number: " + entry.getKey(), e);
            }
            names.put(Gate.checkSlot(slot), entry.getValue().asText());
        }
        return Collections.unmodifiableMap(names);
    }

    private static WalkLimits parseLimits(JsonNode node) {
        if (node == null) {
            return WalkLimits.defaults();
        }
        int maxWalks = node.has("maxWalks")
            ? node.get("maxWalks").asInt() : WalkLimits.DEFAULT_MAX_WALKS;
        return new WalkLimits(maxWalks);
    }

    private static Flow parseFlow(JsonNode node) throws ProcedureParseException {
        if (node.isTextual()) {
            return ProcedureParser.parse(node.asText());
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("Flow must be procedure text or an array of items: " + node);
        }
        var items = new ArrayList<FlowItem>();
        for (JsonNode item : node) {
            items.add(parseItem(item));
        }
        return new Flow(items);
    }

    private static FlowItem parseItem(JsonNode node) throws ProcedureParseException {
        if (node.has("split")) {
            var splits = new ArrayList<Split>();
            for (JsonNode alternative : node.get("split")) {
                splits.add(parseSplit(alternative));
            }
            return FlowItem.of(new SplitSet(splits));
        }
        for (TokenKind kind : TokenKind.values()) {
            String key = kind.name().toLowerCase(Locale.ROOT);
            if (node.has(key)) {
                return FlowItem.of(new Token(kind, node.get(key).asText()));
            }
        }
        throw new IllegalArgumentException("Unknown flow item format: " + node);
    }

    private static Split parseSplit(JsonNode node) throws ProcedureParseException {
        Gate gate;
        if (node.has("allow") && node.has("block")) {
            throw new IllegalArgumentException("Alternative has both allow and block gates: " + node);
        } else if (node.has("allow")) {
            gate = Gate.allow(parseSlots(node.get("allow")));
        } else if (node.has("block")) {
            gate = Gate.block(parseSlots(node.get("block")));
        } else {
            gate = Gate.allowAll();
        }
        Flow flow = node.has("flow") ? parseFlow(node.get("flow")) : Flow.empty();
        return new Split(flow, gate);
    }

    private static List<Integer> parseSlots(JsonNode node) {
        if (!node.isArray()) {
            throw new IllegalArgumentException("Gate slots must be an array of integers: " + node);
        }
        var slots = new ArrayList<Integer>();
        for (JsonNode slot : node) {
            if (!slot.isIntegralNumber() || !slot.canConvertToInt()) {
                throw new IllegalArgumentException("Gate slot must be an integer, was " + slot);
            }
            slots.add(slot.intValue());
        }
        return slots;
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Missing required field '" + field + "'");
        }
        return node;
    }
}
