package com.motaz.insight.engine.feature;

import com.motaz.insight.engine.Fixtures;
import com.motaz.insight.engine.config.Aggregation;
import com.motaz.insight.engine.config.DatePart;
import com.motaz.insight.engine.config.FeatureSpec;
import com.motaz.insight.engine.config.FieldDefinition;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.config.Scaling;
import com.motaz.insight.engine.config.TransformKind;
import com.motaz.insight.engine.error.ConfigurationError;
import com.motaz.insight.engine.error.ParseErrorLog;
import com.motaz.insight.engine.model.CleanedRecord;
import com.motaz.insight.engine.model.FeatureVector;
import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.model.RawRecord;
import com.motaz.insight.engine.normalize.RecordNormalizer;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureTransformerTest {

    private final RecordNormalizer normalizer = new RecordNormalizer();
    private final FeatureTransformer transformer = new FeatureTransformer();

    @Test
    void buildsFeaturesInTimeOrder() {
        List<RawRecord> raws = List.of(
                Fixtures.raw(1, Fixtures.row("R0", "a", 3, 2)),
                Fixtures.raw(2, Fixtures.row("R1", "b", 1, 0)),
                Fixtures.raw(3, Fixtures.row("R2", "a", 2, 1)));
        List<FeatureSpec> specs = List.of(
                FeatureSpec.scale("value_z", "value", Scaling.Z_SCORE),
                FeatureSpec.scale("value_mm", "value", Scaling.MIN_MAX),
                FeatureSpec.oneHot("sensor", "sensor"),
                FeatureSpec.windowed("value_sum2", "value", Aggregation.SUM, 2),
                FeatureSpec.datePart("hour", "ts", DatePart.HOUR));

        FeatureSet set = transformer.transform(clean(raws, Fixtures.schema()), Fixtures.schema(), specs);

        assertThat(set.getVectors()).extracting(FeatureVector::getRecordId)
                .containsExactly("sensors#2", "sensors#3", "sensors#1");
        assertThat(set.getFeatureNames())
                .containsExactly("value_z", "value_mm", "sensor_a", "sensor_b", "value_sum2", "hour");
        assertThat(set.getOutputsBySpec().get("sensor")).containsExactly("sensor_a", "sensor_b");
        assertThat(column(set, "value_mm")).containsExactly(0.0, 0.5, 1.0);
        assertThat(column(set, "value_sum2")).containsExactly(1.0, 3.0, 5.0);
        assertThat(column(set, "hour")).containsExactly(0.0, 1.0, 2.0);
        assertThat(column(set, "sensor_b")).containsExactly(1.0, 0.0, 0.0);
        assertThat(set.getVectors().get(2).get("value_z")).isCloseTo(1.0 / Math.sqrt(2.0 / 3.0), within(1e-9));
        assertThat(set.getVectors().get(0).getTimestamp()).isEqualTo(Fixtures.T0);
        assertThat(set.getScaling().get("value_z").mean()).isEqualTo(2.0);
    }

    @Test
    void multiSourceOutputsAreSuffixedAndGapsFilledWithTheMean() {
        RecordSchema schema = new RecordSchema(List.of(
                new FieldDefinition("id", FieldType.CATEGORICAL, true),
                new FieldDefinition("x", FieldType.NUMERIC, false),
                new FieldDefinition("y", FieldType.NUMERIC, false)), List.of("id"), null, List.of());
        Map<String, Object> gap = new HashMap<>(Map.of("id", "2", "y", 5));
        List<RawRecord> raws = List.of(
                Fixtures.raw(1, Map.of("id", "1", "x", 1, "y", 5)),
                Fixtures.raw(2, gap),
                Fixtures.raw(3, Map.of("id", "3", "x", 3, "y", 5)));
        FeatureSpec both = new FeatureSpec("s", List.of("x", "y"), TransformKind.SCALE, Scaling.MIN_MAX, null, null, null);

        FeatureSet set = transformer.transform(clean(raws, schema), schema, List.of(both));

        assertThat(set.getFeatureNames()).containsExactly("s_x", "s_y");
        assertThat(column(set, "s_x")).containsExactly(0.0, 0.5, 1.0);
        assertThat(column(set, "s_y")).containsExactly(0.0, 0.0, 0.0);
        assertThat(set.outputsOf(List.of("s"))).containsExactly("s_x", "s_y");
    }

    @Test
    void windowedCountAndStddevUseTrailingWindow() {
        List<RawRecord> raws = Fixtures.series(2, 4, 4, 4);
        List<FeatureSpec> specs = List.of(
                FeatureSpec.windowed("n", "value", Aggregation.COUNT, 3),
                FeatureSpec.windowed("sd", "value", Aggregation.STDDEV, 2));

        FeatureSet set = transformer.transform(clean(raws, Fixtures.schema()), Fixtures.schema(), specs);

        assertThat(column(set, "n")).containsExactly(1.0, 2.0, 3.0, 3.0);
        assertThat(column(set, "sd").get(0)).isEqualTo(0.0);
        assertThat(column(set, "sd").get(1)).isCloseTo(Math.sqrt(2.0), within(1e-9));
        assertThat(column(set, "sd").get(3)).isEqualTo(0.0);
    }

    @Test
    void windowedFeatureWithoutTimeAxisIsAConfigurationError() {
        RecordSchema untimed = new RecordSchema(List.of(
                new FieldDefinition("id", FieldType.CATEGORICAL, true),
                new FieldDefinition("x", FieldType.NUMERIC, true)), List.of("id"), null, List.of());
        List<RawRecord> raws = List.of(Fixtures.raw(1, Map.of("id", "1", "x", 1)));

        assertThatThrownBy(() -> transformer.transform(clean(raws, untimed), untimed,
                List.of(FeatureSpec.windowed("w", "x", Aggregation.MEAN, 3))))
                .isInstanceOf(ConfigurationError.class);
    }

    @Test
    void aOneHotCategoryMayNotReplaceAnEarlierColumn() {
        List<RawRecord> raws = List.of(
                Fixtures.raw(1, Fixtures.row("R0", "z", 1, 0)),
                Fixtures.raw(2, Fixtures.row("R1", "y", 2, 1)));
        List<FeatureSpec> specs = List.of(
                FeatureSpec.scale("sensor_z", "value", Scaling.Z_SCORE),
                FeatureSpec.oneHot("sensor", "sensor"));

        assertThatThrownBy(() -> transformer.transform(clean(raws, Fixtures.schema()), Fixtures.schema(), specs))
                .isInstanceOf(ConfigurationError.class)
                .hasMessageContaining("feature sensor produces sensor_z which an earlier feature already produced");
    }

    private List<CleanedRecord> clean(List<RawRecord> raws, RecordSchema schema) {
        return normalizer.normalizeAll(raws, schema, new ParseErrorLog()).stream()
                .map(NormalizedRecord::toCleaned)
                .toList();
    }

    private static List<Double> column(FeatureSet set, String name) {
        return set.getVectors().stream().map(vector -> vector.get(name)).toList();
    }
}
