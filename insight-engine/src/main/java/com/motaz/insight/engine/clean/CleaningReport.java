package com.motaz.insight.engine.clean;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class CleaningReport {

    int recordsIn;
    int recordsOut;
    List<CleaningAction> actions;
    Map<DropReason, Integer> drops;
    int imputations;
    int clears;
    int clips;

    public int dropped(DropReason reason) {
        return drops.getOrDefault(reason, 0);
    }

    public int droppedTotal() {
        return drops.values().stream().mapToInt(Integer::intValue).sum();
    }

    public List<CleaningAction> actionsOf(CleaningAction.Type type) {
        return actions.stream().filter(action -> action.getType() == type).toList();
    }
}
