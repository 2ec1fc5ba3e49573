package io.github.hongjungwan.fastlog.api.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.fastlog.api.Cycle;
import io.github.hongjungwan.fastlog.api.Level;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSON 설정 로더 (snake_case 키).
 *
 * <pre>{@code
 * {
 *   "file": "logs/app.log",
 *   "level": "info",
 *   "rotate_bytes": 104857600,
 *   "rotate_cycle": "daily",
 *   "buffer_period": "5s",
 *   "discard_threshold": 4096
 * }
 * }</pre>
 *
 * <p>{@code buffer_period}는 ISO-8601 ({@code PT15S}), 축약형 ({@code 500ms}, {@code 15s}, {@code 2m}, {@code 1h})
 * 또는 밀리초 숫자를 받는다. 알 수 없는 키는 무시한다.</p>
 */
public final class FileLoggerConfigs {

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)");

    private static final ObjectMapper MAPPER = createObjectMapper();

    private FileLoggerConfigs() {}

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static FileLoggerConfig fromJson(String json) {
        try {
            return toConfig(MAPPER.readValue(json, RawConfig.class));
        } catch (IOException e) {
            throw new ConfigException("Failed to parse logger config", e);
        }
    }

    public static FileLoggerConfig fromJson(InputStream in) {
        try {
            return toConfig(MAPPER.readValue(in, RawConfig.class));
        } catch (IOException e) {
            throw new ConfigException("Failed to parse logger config", e);
        }
    }

    public static FileLoggerConfig fromJson(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        } catch (IOException e) {
            throw new ConfigException("Failed to read logger config: " + path, e);
        }
    }

    private static FileLoggerConfig toConfig(RawConfig raw) {
        if (raw == null) {
            throw new ConfigException("Logger config is empty", null);
        }
        FileLoggerConfig.FileLoggerConfigBuilder builder = FileLoggerConfig.builder();
        try {
            if (raw.file != null) {
                builder.file(raw.file);
            }
            if (raw.level != null) {
                builder.level(Level.parse(raw.level));
            }
            if (raw.rotateCycle != null) {
                builder.rotateCycle(Cycle.parse(raw.rotateCycle));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        if (raw.rotateBytes != null) {
            builder.rotateBytes(raw.rotateBytes);
        }
        if (raw.bufferLength != null) {
            builder.bufferLength(raw.bufferLength);
        }
        if (raw.bufferPeriod != null && !raw.bufferPeriod.isNull()) {
            builder.bufferPeriod(parseDuration(raw.bufferPeriod));
        }
        if (raw.recordLength != null) {
            builder.recordLength(raw.recordLength);
        }
        if (raw.recordFactor != null) {
            builder.recordFactor(raw.recordFactor);
        }
        if (raw.discardThreshold != null) {
            builder.discardThreshold(raw.discardThreshold);
        }
        return builder.build();
    }

    /**
     * 숫자는 밀리초, 문자열은 축약형("500ms", "15s", "1m", "2h") 또는 ISO-8601.
     *
     * <p>주의: 나노초 단위 숫자로 기록된 설정과는 호환되지 않는다. 예를 들어 {@code 15000000000}(15초)은
     * 약 173일로 읽힌다. 그런 설정은 {@code "15s"}처럼 문자열로 옮겨야 한다.</p>
     */
    static Duration parseDuration(JsonNode node) {
        if (node.isNumber()) {
            return Duration.ofMillis(node.asLong());
        }
        String text = node.asText().trim().toLowerCase(Locale.ROOT);
        Matcher matcher = SHORT_DURATION.matcher(text);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            };
        }
        try {
            return MAPPER.treeToValue(node, Duration.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("invalid buffer_period value: " + node.asText(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class RawConfig {
        @JsonProperty("file")
        private String file;

        @JsonProperty("level")
        private String level;

        @JsonProperty("rotate_bytes")
        private Long rotateBytes;

        @JsonProperty("rotate_cycle")
        private String rotateCycle;

        @JsonProperty("buffer_length")
        private Integer bufferLength;

        @JsonProperty("buffer_period")
        private JsonNode bufferPeriod;

        @JsonProperty("record_length")
        private Integer recordLength;

        @JsonProperty("record_factor")
        private Integer recordFactor;

        @JsonProperty("discard_threshold")
        private Integer discardThreshold;
    }

    /** 설정 파싱 실패 */
    public static class ConfigException extends RuntimeException {
        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
