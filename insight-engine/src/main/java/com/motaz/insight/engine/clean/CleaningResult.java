package com.motaz.insight.engine.clean;

import com.motaz.insight.engine.model.CleanedRecord;
import lombok.Value;

import java.util.List;

@Value
public class CleaningResult {
    List<CleanedRecord> records;
    CleaningReport report;
}
