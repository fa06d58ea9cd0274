package com.cloudname.generator.naming.budget;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cloudname.generator.naming.model.NamePart;
import com.cloudname.generator.naming.model.PartRole;

import lombok.NoArgsConstructor;

/**
 * Fits name parts into a length budget.
 *
 * Over budget, the prefix, stage and service parts are each cut to a third of
 * the overflow; region, literal suffix and timestamp are left alone. Under
 * budget, the service part grows back from its full value. The policy is the
 * one existing deployments were named with, so it must not change.
 *
 * Delimiters are not counted here; callers pass a budget that already
 * excludes them.
 */
@NoArgsConstructor
public class BudgetAllocator {

    private static final Logger log = LoggerFactory.getLogger(BudgetAllocator.class);

    private static final Set<PartRole> SHRINKABLE = EnumSet.of(PartRole.PREFIX, PartRole.STAGE, PartRole.SERVICE_HASH);

    // Last-resort trim order when the proportional cut alone does not fit
    private static final List<PartRole> TRIM_ORDER = List.of(
            PartRole.PREFIX, PartRole.STAGE, PartRole.SERVICE_HASH,
            PartRole.REGION, PartRole.LITERAL_SUFFIX, PartRole.TIMESTAMP);

    /**
     * Adjusts the parts so that their summed length is at most maxLength. Never throws;
     * parts may end up empty when the budget is tiny.
     */
    public List<NamePart> allocate(List<NamePart> parts, int maxLength) {
        if (parts == null || parts.isEmpty()) {
            return List.of();
        }
        int budget = Math.max(0, maxLength);
        List<NamePart> result = new ArrayList<>(parts);

        int remaining = budget - totalLength(result);

        if (remaining < 0) {
            int cut = Math.abs(remaining) / 3;
            log.debug("Over budget by {} (limit {}), cutting prefix/stage/service to {} chars", -remaining, budget, cut);
            for (int i = 0; i < result.size(); i++) {
                NamePart part = result.get(i);
                if (SHRINKABLE.contains(part.getRole())) {
                    result.set(i, part.withValue(head(part.getValue(), cut)));
                }
            }
            enforceCeiling(result, budget);
        } else if (remaining > 0) {
            for (int i = 0; i < result.size(); i++) {
                NamePart part = result.get(i);
                if (part.getRole() == PartRole.SERVICE_HASH) {
                    // Slice length keeps the historical "- 1"; names already deployed depend on it
                    int sliceLength = remaining + part.length() - 1;
                    result.set(i, part.withValue(head(part.getFullValue(), sliceLength)));
                    log.debug("Under budget by {} (limit {}), service part extended to {} chars",
                            remaining, budget, result.get(i).length());
                }
            }
        }

        return List.copyOf(result);
    }

    private void enforceCeiling(List<NamePart> parts, int budget) {
        int excess = totalLength(parts) - budget;
        for (PartRole role : TRIM_ORDER) {
            for (int i = 0; i < parts.size() && excess > 0; i++) {
                NamePart part = parts.get(i);
                if (part.getRole() != role || part.isEmpty()) {
                    continue;
                }
                int keep = Math.max(0, part.length() - excess);
                excess -= part.length() - keep;
                parts.set(i, part.withValue(head(part.getValue(), keep)));
            }
        }
    }

    private static int totalLength(List<NamePart> parts) {
        return parts.stream().mapToInt(NamePart::length).sum();
    }

    private static String head(String value, int length) {
        return value.substring(0, Math.max(0, Math.min(length, value.length())));
    }
}
