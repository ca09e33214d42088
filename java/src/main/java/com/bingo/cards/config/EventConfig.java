package com.bingo.cards.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Caller-supplied description of one event: the round label printed on the
 * cards, how many cards to produce and how to produce them.
 *
 * <pre>
 * {
 *   "round": "9",
 *   "total_cards": 8000,
 *   "batch_size": 1000,
 *   "seed": null,
 *   "workers": 1
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventConfig(
        @JsonProperty("round") String round,
        @JsonProperty("total_cards") int totalCards,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("seed") Long seed,
        @JsonProperty("workers") int workers
) {
    public static final String DEFAULTS_RESOURCE = "event-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public EventConfig {
        if (round == null || round.isBlank()) {
            round = "1";
        }
    }

    /**
     * JSON entry point. Only absent fields take defaults; an explicit zero
     * is kept and rejected by validation.
     */
    @JsonCreator
    static EventConfig fromJsonFields(
            @JsonProperty("round") String round,
            @JsonProperty("total_cards") Integer totalCards,
            @JsonProperty("batch_size") Integer batchSize,
            @JsonProperty("seed") Long seed,
            @JsonProperty("workers") Integer workers) {
        return new EventConfig(
                round,
                totalCards != null ? totalCards : 0,
                batchSize != null ? batchSize : GeneratorSettings.DEFAULT_BATCH_SIZE,
                seed,
                workers != null ? workers : 1);
    }

    /**
     * Load an event configuration from a JSON file.
     */
    public static EventConfig fromFile(String path) throws EventConfigException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new EventConfigException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load an event configuration from a classpath resource.
     */
    public static EventConfig fromResource(String resourcePath) throws EventConfigException {
        try (InputStream is = EventConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new EventConfigException("Resource not found: " + resourcePath);
            }
            return validate(MAPPER.readValue(is, EventConfig.class));
        } catch (IOException e) {
            throw new EventConfigException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load an event configuration from a JSON string.
     */
    public static EventConfig fromJson(String json) throws EventConfigException {
        try {
            return validate(MAPPER.readValue(json, EventConfig.class));
        } catch (IOException e) {
            throw new EventConfigException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Built-in defaults shipped on the classpath.
     */
    public static EventConfig defaults() throws EventConfigException {
        return fromResource(DEFAULTS_RESOURCE);
    }

    public EventConfig withRound(String round) {
        return new EventConfig(round, totalCards, batchSize, seed, workers);
    }

    public EventConfig withTotalCards(int totalCards) {
        return new EventConfig(round, totalCards, batchSize, seed, workers);
    }

    public EventConfig withBatchSize(int batchSize) {
        return new EventConfig(round, totalCards, batchSize, seed, workers);
    }

    public EventConfig withSeed(Long seed) {
        return new EventConfig(round, totalCards, batchSize, seed, workers);
    }

    public EventConfig withWorkers(int workers) {
        return new EventConfig(round, totalCards, batchSize, seed, workers);
    }

    /**
     * Generator settings for this event; retry budgets keep their defaults.
     * @throws IllegalArgumentException if batch size or workers are not positive
     */
    public GeneratorSettings toSettings() {
        return GeneratorSettings.defaults()
                .withBatchSize(batchSize)
                .withWorkers(workers);
    }

    private static EventConfig validate(EventConfig config) throws EventConfigException {
        if (config.totalCards() < 0) {
            throw new EventConfigException("total_cards must not be negative: " + config.totalCards());
        }
        if (config.batchSize() < 1) {
            throw new EventConfigException("batch_size must be positive: " + config.batchSize());
        }
        if (config.workers() < 1) {
            throw new EventConfigException("workers must be positive: " + config.workers());
        }
        return config;
    }
}
