package com.motaz.insight.engine.clean;

import com.motaz.insight.engine.Fixtures;
import com.motaz.insight.engine.config.CleaningPolicy;
import com.motaz.insight.engine.config.DuplicateKey;
import com.motaz.insight.engine.config.FieldDefinition;
import com.motaz.insight.engine.config.MissingValueStrategy;
import com.motaz.insight.engine.config.OutlierStrategy;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.error.ParseErrorLog;
import com.motaz.insight.engine.model.CleanedRecord;
import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.model.RawRecord;
import com.motaz.insight.engine.normalize.RecordNormalizer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class QualityCleanerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer();
    private final QualityCleaner cleaner = new QualityCleaner();
    private final RecordSchema schema = Fixtures.schema();

    @Test
    void resolvesDuplicatesMissingValuesAndOutliersInOnePass() {
        List<RawRecord> raws = scenarioBatch();

        CleaningResult result = cleaner.clean(normalize(raws), schema,
                Fixtures.policy(MissingValueStrategy.IMPUTE_MEDIAN, OutlierStrategy.CLIP_TO_PERCENTILE));

        CleaningReport report = result.getReport();
        assertThat(report.getRecordsIn()).isEqualTo(100);
        assertThat(report.getRecordsOut()).isEqualTo(95);
        assertThat(report.dropped(DropReason.DUPLICATE)).isEqualTo(5);
        assertThat(report.getImputations()).isEqualTo(3);
        assertThat(report.getClips()).isEqualTo(1);
        assertThat(report.actionsOf(CleaningAction.Type.DUPLICATE_DROPPED))
                .extracting(CleaningAction::getRecordId)
                .containsExactly("sensors#96", "sensors#97", "sensors#98", "sensors#99", "sensors#100");

        // p99 over 94 values in [10, 19] plus the outlier: index 93.06 between 19 and 1000
        double p99 = 19 * 0.94 + 1000 * 0.06;
        CleaningAction clip = report.actionsOf(CleaningAction.Type.VALUE_CLIPPED).get(0);
        assertThat(clip.getRecordId()).isEqualTo("sensors#51");
        assertThat(Double.parseDouble(clip.getAfter())).isCloseTo(p99, within(1e-9));
        CleanedRecord clipped = find(result, "sensors#51");
        assertThat(clipped.number("value")).isCloseTo(p99, within(1e-9));

        CleanedRecord kept = find(result, "sensors#1");
        assertThat(kept.field("sensor").getValue()).isEqualTo("a");
        assertThat(result.getRecords()).allSatisfy(record -> assertThat(record.number("value")).isNotNull());
    }

    @Test
    void meanImputationFeedsThePercentileThatClipsTheOutlier() {
        CleaningResult result = cleaner.clean(normalize(scenarioBatch()), schema,
                Fixtures.policy(MissingValueStrategy.IMPUTE_MEAN, OutlierStrategy.CLIP_TO_PERCENTILE));

        CleaningReport report = result.getReport();
        assertThat(report.getRecordsOut()).isEqualTo(95);
        assertThat(report.dropped(DropReason.DUPLICATE)).isEqualTo(5);
        assertThat(report.getImputations()).isEqualTo(3);
        assertThat(report.getClips()).isEqualTo(1);

        double sum = 1000;
        for (int i = 0; i < 95; i++) {
            if (i != 10 && i != 20 && i != 30 && i != 50) {
                sum += 10 + (i % 10);
            }
        }
        double mean = sum / 92;
        assertThat(find(result, "sensors#11").number("value")).isCloseTo(mean, within(1e-9));
        // the three imputed means sit below p99, which interpolates between the mean and the outlier
        double p99 = mean * 0.94 + 1000 * 0.06;
        assertThat(find(result, "sensors#51").number("value")).isCloseTo(p99, within(1e-9));
        assertThat(result.getRecords()).extracting(record -> record.number("value"))
                .allSatisfy(value -> assertThat(value).isLessThanOrEqualTo(p99 + 1e-9));
    }

    @Test
    void recordsWithABlankKeyAreDroppedInsteadOfImputed() {
        List<RawRecord> raws = List.of(
                Fixtures.raw(1, Fixtures.row("R0", "a", 1, 0)),
                Fixtures.raw(2, Fixtures.row("R1", "a", 2, 1)),
                Fixtures.raw(3, Fixtures.row("", "a", 3, 2)),
                Fixtures.raw(4, Fixtures.row("R0", "b", 4, 3)));

        CleaningResult result = cleaner.clean(normalize(raws), schema,
                Fixtures.policy(MissingValueStrategy.IMPUTE_MEAN, OutlierStrategy.NONE));

        assertThat(result.getRecords()).extracting(record -> record.field("id").getValue())
                .containsExactly("R0", "R1");
        assertThat(result.getReport().getImputations()).isZero();
        assertThat(result.getReport().dropped(DropReason.DUPLICATE)).isEqualTo(1);
        assertThat(result.getReport().dropped(DropReason.UNRESOLVABLE_FIELD)).isEqualTo(1);
        CleaningAction drop = result.getReport().actionsOf(CleaningAction.Type.RECORD_DROPPED).get(0);
        assertThat(drop.getRecordId()).isEqualTo("sensors#3");
        assertThat(drop.getField()).isEqualTo("id");
    }

    @Test
    void imputesNumericMedianAndCategoricalMode() {
        RecordSchema withNote = new RecordSchema(List.of(
                new FieldDefinition("id", FieldType.CATEGORICAL, true),
                new FieldDefinition("value", FieldType.NUMERIC, true),
                new FieldDefinition("colour", FieldType.CATEGORICAL, true)), List.of("id"), null, List.of());
        List<RawRecord> raws = List.of(
                Fixtures.raw(1, Map.of("id", "1", "value", 1, "colour", "red")),
                Fixtures.raw(2, Map.of("id", "2", "value", 2, "colour", "blue")),
                Fixtures.raw(3, Map.of("id", "3", "value", 10, "colour", "blue")),
                Fixtures.raw(4, Map.of("id", "4", "value", 7, "colour", "red")),
                Fixtures.raw(5, Map.of("id", "5", "value", "oops")));

        CleaningResult result = cleaner.clean(normalizer.normalizeAll(raws, withNote, new ParseErrorLog()), withNote,
                Fixtures.policy(MissingValueStrategy.IMPUTE_MEDIAN, OutlierStrategy.NONE));

        CleanedRecord imputed = find(result, "sensors#5");
        assertThat(imputed.number("value")).isEqualTo(4.5);
        assertThat(imputed.field("colour").getValue()).isEqualTo("red");
        assertThat(result.getReport().actionsOf(CleaningAction.Type.VALUE_IMPUTED))
                .extracting(CleaningAction::getField, CleaningAction::getBefore)
                .containsExactly(tuple("value", "oops"),
                        tuple("colour", null));
    }

    @Test
    void dropStrategyRemovesRecordsWithInvalidFields() {
        List<RawRecord> raws = Fixtures.series(1, 2, 3);
        Map<String, Object> broken = Fixtures.row("R9", "a", "not a number", 9);
        List<RawRecord> all = new ArrayList<>(raws);
        all.add(Fixtures.raw(4, broken));

        CleaningResult result = cleaner.clean(normalize(all), schema,
                Fixtures.policy(MissingValueStrategy.DROP_RECORD, OutlierStrategy.NONE));

        assertThat(result.getRecords()).hasSize(3);
        assertThat(result.getReport().dropped(DropReason.MISSING_VALUE)).isEqualTo(1);
        assertThat(result.getReport().actionsOf(CleaningAction.Type.RECORD_DROPPED).get(0).getRecordId())
                .isEqualTo("sensors#4");
    }

    @Test
    void timestampsCannotBeImputedSoRequiredOnesDropAndOptionalOnesClear() {
        RecordSchema optionalTime = new RecordSchema(List.of(
                new FieldDefinition("id", FieldType.CATEGORICAL, true),
                new FieldDefinition("seen", FieldType.TIMESTAMP, false),
                new FieldDefinition("ts", FieldType.TIMESTAMP, true)), List.of("id"), "ts", List.of("yyyy-MM-dd"));
        Map<String, Object> badSeen = new HashMap<>(Map.of("id", "1", "seen", "soon", "ts", "2024-01-01"));
        Map<String, Object> badTs = new HashMap<>(Map.of("id", "2", "ts", "later"));
        List<NormalizedRecord> normalized = normalizer.normalizeAll(
                List.of(Fixtures.raw(1, badSeen), Fixtures.raw(2, badTs)), optionalTime, new ParseErrorLog());

        CleaningResult result = cleaner.clean(normalized, optionalTime,
                Fixtures.policy(MissingValueStrategy.IMPUTE_MEAN, OutlierStrategy.NONE));

        assertThat(result.getRecords()).extracting(CleanedRecord::getRecordId).containsExactly("sensors#1");
        assertThat(result.getRecords().get(0).field("seen").isPresent()).isFalse();
        assertThat(result.getReport().getClears()).isEqualTo(1);
        assertThat(result.getReport().dropped(DropReason.UNRESOLVABLE_FIELD)).isEqualTo(1);
    }

    @Test
    void fullRowDuplicatesNeedEveryValueToMatch() {
        List<RawRecord> raws = List.of(
                Fixtures.raw(1, Fixtures.row("R1", "a", 5, 1)),
                Fixtures.raw(2, Fixtures.row("R1", "a", 5, 1)),
                Fixtures.raw(3, Fixtures.row("R1", "a", 6, 1)));
        CleaningPolicy fullRow = new CleaningPolicy(MissingValueStrategy.DROP_RECORD, DuplicateKey.FULL_ROW,
                OutlierStrategy.NONE, null, false, List.of(), Map.of());

        CleaningResult result = cleaner.clean(normalize(raws), schema, fullRow);

        assertThat(result.getRecords()).extracting(CleanedRecord::getRecordId)
                .containsExactly("sensors#1", "sensors#3");
    }

    @Test
    void outlierDropUsesUpperPercentileOnly() {
        List<RawRecord> raws = Fixtures.series(-500, 1, 2, 3, 4, 5, 6, 7, 8, 9, 500);
        CleaningPolicy drop = new CleaningPolicy(MissingValueStrategy.DROP_RECORD, DuplicateKey.EXPLICIT_KEY_FIELDS,
                OutlierStrategy.DROP_RECORD, 95.0, false, List.of("value"), Map.of());

        CleaningResult result = cleaner.clean(normalize(raws), schema, drop);

        assertThat(result.getReport().dropped(DropReason.OUTLIER)).isEqualTo(1);
        assertThat(result.getRecords()).extracting(record -> record.number("value")).contains(-500.0).doesNotContain(500.0);
    }

    @Test
    void lowerTailIsClippedWhenEnabled() {
        List<RawRecord> raws = Fixtures.series(-500, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        CleaningPolicy clip = new CleaningPolicy(MissingValueStrategy.DROP_RECORD, DuplicateKey.EXPLICIT_KEY_FIELDS,
                OutlierStrategy.CLIP_TO_PERCENTILE, 90.0, true, List.of(), Map.of());

        CleaningResult result = cleaner.clean(normalize(raws), schema, clip);

        // p10 over 11 points sits at index 1.0, p90 at index 9.0
        assertThat(find(result, "sensors#1").number("value")).isEqualTo(1.0);
        assertThat(find(result, "sensors#11").number("value")).isEqualTo(9.0);
        assertThat(result.getReport().getClips()).isEqualTo(2);
    }

    /** 95 readings with three blanks and one spike, then five re-sent keys. */
    private static List<RawRecord> scenarioBatch() {
        List<RawRecord> raws = new ArrayList<>();
        for (int i = 0; i < 95; i++) {
            Object value = 10 + (i % 10);
            if (i == 10 || i == 20 || i == 30) {
                value = "";
            }
            if (i == 50) {
                value = 1000;
            }
            raws.add(Fixtures.raw(i + 1, Fixtures.row("R" + i, "a", value, i)));
        }
        for (int i = 0; i < 5; i++) {
            raws.add(Fixtures.raw(96 + i, Fixtures.row("R" + i, "b", 99, 200 + i)));
        }
        return raws;
    }

    private List<NormalizedRecord> normalize(List<RawRecord> raws) {
        return normalizer.normalizeAll(raws, schema, new ParseErrorLog());
    }

    private static CleanedRecord find(CleaningResult result, String recordId) {
        return result.getRecords().stream()
                .filter(record -> record.getRecordId().equals(recordId))
                .findFirst()
                .orElseThrow();
    }
}
