package com.williamcallahan.webingest.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Ingest ingest = new Ingest();
    private Quality quality = new Quality();
    private Store store = new Store();

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Quality getQuality() {
        return quality;
    }

    public void setQuality(Quality quality) {
        this.quality = quality;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    /**
     * Fails fast on settings that would make the gate or the worker pool meaningless.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(ingest.getWorkers(), "app.ingest.workers");
        requirePositive(quality.getMinWords(), "app.quality.min-words");
        requirePositive(quality.getMaxTextLength(), "app.quality.max-text-length");
        requirePositive(quality.getRepetitionMinWords(), "app.quality.repetition-min-words");
        requireRatio(quality.getMinAlphaRatio(), "app.quality.min-alpha-ratio");
        requireRatio(quality.getMinDistinctWordRatio(), "app.quality.min-distinct-word-ratio");
        requirePositive(store.getMaxAttempts(), "app.store.max-attempts");
        if (store.getInitialBackoff() == null || store.getInitialBackoff().isNegative()) {
            throw new IllegalArgumentException("app.store.initial-backoff must not be negative");
        }
        if (store.getCollection() == null || store.getCollection().isBlank()) {
            throw new IllegalArgumentException("app.store.collection must not be blank");
        }
    }

    private static void requirePositive(long value, String propertyName) {
        if (value <= 0) {
            throw new IllegalArgumentException(propertyName + " must be positive (was " + value + ")");
        }
    }

    private static void requireRatio(double value, String propertyName) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(propertyName + " must be within [0, 1] (was " + value + ")");
        }
    }

    public static class Ingest {
        private int workers = 1;
        private boolean runOnStartup = true;

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
    }

    public static class Quality {
        private int minWords = 1;
        private int maxTextLength = 1_000_000;
        private double minAlphaRatio = 0.4;
        private int repetitionMinWords = 8;
        private double minDistinctWordRatio = 0.2;

        public int getMinWords() { return minWords; }
        public void setMinWords(int minWords) { this.minWords = minWords; }

        public int getMaxTextLength() { return maxTextLength; }
        public void setMaxTextLength(int maxTextLength) { this.maxTextLength = maxTextLength; }

        public double getMinAlphaRatio() { return minAlphaRatio; }
        public void setMinAlphaRatio(double minAlphaRatio) { this.minAlphaRatio = minAlphaRatio; }

        public int getRepetitionMinWords() { return repetitionMinWords; }
        public void setRepetitionMinWords(int repetitionMinWords) { this.repetitionMinWords = repetitionMinWords; }

        public double getMinDistinctWordRatio() { return minDistinctWordRatio; }
        public void setMinDistinctWordRatio(double minDistinctWordRatio) {
            this.minDistinctWordRatio = minDistinctWordRatio;
        }
    }

    public static class Store {
        /** Either {@code mongo} or {@code memory}. */
        private String type = "mongo";
        private String collection = "web_content";
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getCollection() { return collection; }
        public void setCollection(String collection) { this.collection = collection; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    }
}
