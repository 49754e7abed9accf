package dev.pathways.engine;

import dev.pathways.model.Flow;
import dev.pathways.model.FlowItem;
import dev.pathways.model.Procedure;
import dev.pathways.model.Split;
import dev.pathways.model.SplitSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Validates procedure definitions before resolution.
 */
public final class ProcedureValidator {

    private ProcedureValidator() {}

    /**
     * Validate a procedure definition. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(Procedure procedure) {
        var errors = new ArrayList<String>();

        if (procedure.id() == null || procedure.id().isBlank()) {
            errors.add("Procedure has missing or empty id");
        }
        if (procedure.label() == null || procedure.label().isBlank()) {
            errors.add("Procedure '%s' has missing or empty label".formatted(procedure.id()));
        }
        if (procedure.flow() == null || procedure.flow().isEmpty()) {
            errors.add("Procedure '%s' has an empty flow".formatted(procedure.id()));
        }
        if (procedure.limits() != null && procedure.limits().maxWalks() <= 0) {
            errors.add("maxWalks must be positive, was %d".formatted(procedure.limits().maxWalks()));
        }

        Map<Integer, String> names = procedure.slotNames() == null ? Map.of() : procedure.slotNames();
        var seen = new HashSet<String>();
        for (var entry : names.entrySet()) {
            String name = entry.getValue();
            if (name == null || name.isBlank()) {
                errors.add("Slot %d has an empty name".formatted(entry.getKey()));
            } else if (!seen.add(name)) {
                errors.add("Slot name '%s' is used by more than one slot".formatted(name));
            }
        }

        if (procedure.flow() != null) {
            validateFlow(procedure.flow(), names, "flow", errors);
        }
        return errors;
    }

    private static void validateFlow(Flow flow, Map<Integer, String> names, String path, List<String> errors) {
        for (int i = 0; i < flow.items().size(); i++) {
            if (!(flow.items().get(i) instanceof FlowItem.SplitItem splitItem)) {
                continue;
            }
            String here = path + "[" + i + "]";
            SplitSet splits = splitItem.splitSet();
            for (int s = 0; s < splits.size(); s++) {
                Split split = splits.splits().get(s);
                if (!names.isEmpty()) {
                    for (Integer slot : split.gate().slots()) {
                        if (!names.containsKey(slot)) {
                            errors.add("%s: gate %s refers to undeclared slot %d"
                                .formatted(here, split.gate(), slot));
                        }
                    }
                }
                validateFlow(split.flow(), names, here + "/" + s, errors);
            }
        }
    }
}
