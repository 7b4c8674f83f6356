package com.motaz.insight.engine.clean;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
class CleaningLedger {

    private static final String STAGE = "clean";

    private final List<CleaningAction> actions = new ArrayList<>();
    private final Map<DropReason, Integer> drops = new EnumMap<>(DropReason.class);
    private int imputations;
    private int clears;
    private int clips;

    void duplicate(String recordId, String keptRecordId, String key) {
        record(new CleaningAction(recordId, null, CleaningAction.Type.DUPLICATE_DROPPED, DropReason.DUPLICATE,
                null, null, "duplicate of " + keptRecordId + " (key " + key + ")"));
        drops.merge(DropReason.DUPLICATE, 1, Integer::sum);
    }

    void drop(String recordId, String field, DropReason reason, String detail) {
        record(new CleaningAction(recordId, field, CleaningAction.Type.RECORD_DROPPED, reason, null, null, detail));
        drops.merge(reason, 1, Integer::sum);
    }

    void imputed(String recordId, String field, String before, String after, String detail) {
        record(new CleaningAction(recordId, field, CleaningAction.Type.VALUE_IMPUTED, null, before, after, detail));
        imputations++;
    }

    void cleared(String recordId, String field, String before, String detail) {
        record(new CleaningAction(recordId, field, CleaningAction.Type.VALUE_CLEARED, null, before, null, detail));
        clears++;
    }

    void clipped(String recordId, String field, double before, double after, String detail) {
        record(new CleaningAction(recordId, field, CleaningAction.Type.VALUE_CLIPPED, null,
                String.valueOf(before), String.valueOf(after), detail));
        clips++;
    }

    CleaningReport toReport(int recordsIn, int recordsOut) {
        return new CleaningReport(recordsIn, recordsOut, List.copyOf(actions), Map.copyOf(drops), imputations, clears, clips);
    }

    private void record(CleaningAction action) {
        actions.add(action);
        log.info("stage={} record={} action={} field={} reason={} before={} after={} detail=\"{}\"",
                STAGE, action.getRecordId(), action.getType(), action.getField(), action.getReason(),
                action.getBefore(), action.getAfter(), action.getDetail());
    }
}
