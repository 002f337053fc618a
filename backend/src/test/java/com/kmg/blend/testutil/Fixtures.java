package com.kmg.blend.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.model.BlendMode;
import com.kmg.blend.model.BlendSettings;
import com.kmg.blend.model.InitializeMode;
import com.kmg.blend.service.TimeService;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public final class Fixtures {
    public static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private Fixtures() {
    }

    /**
     * Same settings as the Spring Boot auto-configured mapper.
     */
    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public static TimeService fixedTime() {
        return new TimeService(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    public static BlendSettings settings(BlendMode mode) {
        return new BlendSettings(mode, 15, 2, 1, 7, 5, 10.0, InitializeMode.IDENTITY);
    }

    public static BlendProperties properties(Path baseDir) {
        BlendProperties properties = new BlendProperties();
        properties.setBaseDir(baseDir.toString());
        properties.getSource().setDir(baseDir.resolve("sources").toString());
        properties.getOutput().setDir(baseDir.resolve("results").toString());
        properties.getCheckpoint().setDir(baseDir.resolve("checkpoints").toString());
        properties.getLogs().setDir(baseDir.resolve("logs").toString());
        return properties;
    }
}
