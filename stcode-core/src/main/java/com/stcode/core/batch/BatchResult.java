package com.stcode.core.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of a batch in submission order.
 *
 * @param outcomes one outcome per submitted item
 */
public record BatchResult(List<ItemOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * @return whether every item parsed
     */
    public boolean success() {
        return outcomes.stream().allMatch(ItemOutcome::success);
    }

    public List<ItemOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.success()).toList();
    }

    public List<ItemOutcome> successes() {
        return outcomes.stream().filter(ItemOutcome::success).toList();
    }

    /**
     * @return outcomes keyed by item name, in submission order
     */
    public Map<String, ItemOutcome> byName() {
        Map<String, ItemOutcome> byName = new LinkedHashMap<>();
        for (ItemOutcome outcome : outcomes) {
            byName.put(outcome.item().name(), outcome);
        }
        return Collections.unmodifiableMap(byName);
    }
}
