package com.motaz.insight.engine.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.motaz.insight.engine.aggregate.RunReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileResultPublisherTest {

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    @TempDir
    Path dir;

    @Test
    void writesOneFilePerRun() throws IOException {
        Path reports = dir.resolve("reports");
        RunReport report = RunReport.failure("run-42", "anomaly.seed must be provided for ISOLATION");

        new JsonFileResultPublisher(reports, mapper).publish(report);

        JsonNode written = mapper.readTree(reports.resolve("run-42.json").toFile());
        assertThat(written.get("runId").asText()).isEqualTo("run-42");
        assertThat(written.get("outcome").asText()).isEqualTo("FAILURE");
        assertThat(written.get("reason").asText()).contains("anomaly.seed");
        assertThat(written.get("result").isNull()).isTrue();
    }

    @Test
    void unwritableDirectoryIsReported() throws IOException {
        Path blocker = Files.writeString(dir.resolve("blocker"), "not a directory");

        assertThatThrownBy(() -> new JsonFileResultPublisher(blocker, mapper).publish(RunReport.failure("run-1", "x")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("run-1.json");
    }
}
