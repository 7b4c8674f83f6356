package com.motaz.insight.engine;

import com.motaz.insight.engine.config.AnomalyConfig;
import com.motaz.insight.engine.config.AnomalyStrategy;
import com.motaz.insight.engine.config.CleaningPolicy;
import com.motaz.insight.engine.config.ClusterConfig;
import com.motaz.insight.engine.config.DuplicateKey;
import com.motaz.insight.engine.config.FeatureSpec;
import com.motaz.insight.engine.config.FieldDefinition;
import com.motaz.insight.engine.config.MissingValueStrategy;
import com.motaz.insight.engine.config.OutlierStrategy;
import com.motaz.insight.engine.config.PipelineConfig;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.config.Scaling;
import com.motaz.insight.engine.config.TrendConfig;
import com.motaz.insight.engine.feature.FeatureSet;
import com.motaz.insight.engine.model.FeatureVector;
import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.FindingKind;
import com.motaz.insight.engine.model.RawRecord;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Sensor-reading batches shared by the engine tests. */
public final class Fixtures {

    public static final String SOURCE = "sensors";
    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Fixtures() {
    }

    public static RecordSchema schema() {
        return new RecordSchema(List.of(
                new FieldDefinition("id", FieldType.CATEGORICAL, true),
                new FieldDefinition("sensor", FieldType.CATEGORICAL, true),
                new FieldDefinition("value", FieldType.NUMERIC, true),
                new FieldDefinition("note", FieldType.CATEGORICAL, false),
                new FieldDefinition("ts", FieldType.TIMESTAMP, true)),
                List.of("id"), "ts", List.of("yyyy-MM-dd HH:mm:ss"));
    }

    public static CleaningPolicy policy(MissingValueStrategy missing, OutlierStrategy outliers) {
        return new CleaningPolicy(missing, DuplicateKey.EXPLICIT_KEY_FIELDS, outliers,
                outliers == OutlierStrategy.NONE ? null : 99.0, false, List.of(), Map.of());
    }

    public static PipelineConfig config() {
        return new PipelineConfig(schema(),
                policy(MissingValueStrategy.IMPUTE_MEDIAN, OutlierStrategy.NONE),
                List.of(FeatureSpec.scale("value_z", "value", Scaling.Z_SCORE), FeatureSpec.oneHot("sensor", "sensor")),
                new AnomalyConfig(AnomalyStrategy.STATISTICAL, 0.6, 3.0,
                        null, null, null, List.of("value_z")),
                new ClusterConfig(2, null, null, 100, 1e-4, 7L, List.of("value_z")),
                new TrendConfig(List.of("value_z"), 10, 0.5, 6, 0.5, null),
                Set.of(FindingKind.ANOMALY));
    }

    public static Map<String, Object> row(String id, String sensor, Object value, int hour) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("sensor", sensor);
        row.put("value", value);
        row.put("ts", T0.plus(hour, ChronoUnit.HOURS).toString());
        return row;
    }

    public static RawRecord raw(long rowNumber, Map<String, Object> values) {
        return new RawRecord(SOURCE, rowNumber, T0, values);
    }

    /** One record per value, sensor alternating a/b, one hour apart. */
    public static List<RawRecord> series(double... values) {
        List<RawRecord> records = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            records.add(raw(i + 1, row("R" + i, i % 2 == 0 ? "a" : "b", values[i], i)));
        }
        return records;
    }

    /** A feature set with one vector per row, named {@code f0, f1, ...}, each spec producing one output. */
    public static FeatureSet features(double[][] rows) {
        int width = rows.length == 0 ? 0 : rows[0].length;
        List<String> names = new ArrayList<>();
        Map<String, List<String>> outputs = new LinkedHashMap<>();
        for (int j = 0; j < width; j++) {
            names.add("f" + j);
            outputs.put("f" + j, List.of("f" + j));
        }
        List<FeatureVector> vectors = new ArrayList<>();
        for (int i = 0; i < rows.length; i++) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (int j = 0; j < width; j++) {
                values.put(names.get(j), rows[i][j]);
            }
            vectors.add(new FeatureVector("R" + i, T0.plus(i, ChronoUnit.HOURS), values));
        }
        return new FeatureSet(vectors, names, outputs, Map.of());
    }
}
