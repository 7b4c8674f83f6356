package com.motaz.insight.engine.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.motaz.insight.engine.aggregate.RunReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
public class JsonFileResultPublisher implements ResultPublisher {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileResultPublisher(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void publish(RunReport report) {
        Path target = directory.resolve(report.getRunId() + ".json");
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(target.toFile(), report);
            log.info("Run {} report written to {}", report.getRunId(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run report " + target, e);
        }
    }
}
