package com.motaz.insight.engine.clean;

import com.motaz.insight.engine.config.CleaningPolicy;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.model.CleanedRecord;
import com.motaz.insight.engine.model.NormalizedRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Resolves duplicates, then invalid values, then outliers. The order is fixed:
 * outlier bounds assume a batch without duplicate identities or holes.
 */
@Slf4j
public class QualityCleaner {

    private final DuplicateResolver duplicates = new DuplicateResolver();
    private final MissingValueResolver missingValues = new MissingValueResolver();
    private final OutlierResolver outliers = new OutlierResolver();

    public CleaningResult clean(List<NormalizedRecord> records, RecordSchema schema, CleaningPolicy policy) {
        CleaningLedger ledger = new CleaningLedger();

        List<NormalizedRecord> unique = duplicates.resolve(records, schema, policy.duplicateKey(), ledger);
        List<NormalizedRecord> complete = missingValues.resolve(unique, schema, policy, ledger);
        List<NormalizedRecord> bounded = outliers.resolve(complete, schema, policy, ledger);

        List<CleanedRecord> cleaned = bounded.stream().map(NormalizedRecord::toCleaned).toList();
        CleaningReport report = ledger.toReport(records.size(), cleaned.size());
        log.info("Cleaned {} -> {} records: drops={}, imputations={}, clears={}, clips={}",
                report.getRecordsIn(), report.getRecordsOut(), report.getDrops(),
                report.getImputations(), report.getClears(), report.getClips());
        return new CleaningResult(cleaned, report);
    }
}
