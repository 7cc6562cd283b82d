package cinder;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import cinder.utils.Log;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Immutable server configuration. Built with {@link Builder} or loaded from YAML.
 */
@JsonDeserialize(builder = Config.Builder.class)
public final class Config {
    public static final int DEFAULT_PORT = 6380;

    private final String host;
    private final int port;
    private final int maxClients;
    private final int ioThreads;
    private final int shards;
    private final int maxBulkLength;
    private final int maxInlineLength;
    private final int maxMultiBulkLength;
    private final int writeBufferLowWaterMark;
    private final int writeBufferHighWaterMark;
    private final ActiveExpire activeExpire;
    private final String snapshotFile;
    private final long snapshotIntervalSeconds;
    private final long slowlogThresholdMicros;
    private final String logLevel;

    private Config(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.maxClients = b.maxClients;
        this.ioThreads = b.ioThreads;
        this.shards = b.shards;
        this.maxBulkLength = b.maxBulkLength;
        this.maxInlineLength = b.maxInlineLength;
        this.maxMultiBulkLength = b.maxMultiBulkLength;
        this.writeBufferLowWaterMark = b.writeBufferLowWaterMark;
        this.writeBufferHighWaterMark = b.writeBufferHighWaterMark;
        this.activeExpire = b.activeExpire;
        this.snapshotFile = b.snapshotFile;
        this.snapshotIntervalSeconds = b.snapshotIntervalSeconds;
        this.slowlogThresholdMicros = b.slowlogThresholdMicros;
        this.logLevel = b.logLevel;
    }

    public static Config defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .maxClients(maxClients)
                .ioThreads(ioThreads)
                .shards(shards)
                .maxBulkLength(maxBulkLength)
                .maxInlineLength(maxInlineLength)
                .maxMultiBulkLength(maxMultiBulkLength)
                .writeBufferLowWaterMark(writeBufferLowWaterMark)
                .writeBufferHighWaterMark(writeBufferHighWaterMark)
                .activeExpire(activeExpire)
                .snapshotFile(snapshotFile)
                .snapshotIntervalSeconds(snapshotIntervalSeconds)
                .slowlogThresholdMicros(slowlogThresholdMicros)
                .logLevel(logLevel);
    }

    public static Config load(String filename) throws IOException {
        return load(filename, System.getenv());
    }

    static Config load(String filename, Map<String, String> env) throws IOException {
        File f = new File(filename);
        Config config;
        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
            config = defaults();
        } else {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            config = mapper.readValue(f, Config.class);
            Log.info("Loaded config from " + f.getAbsolutePath());
        }
        return config.withEnvironment(env);
    }

    public static Config parse(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(in, Config.class);
    }

    Config withEnvironment(Map<String, String> env) {
        String port = env.get("CINDER_PORT");
        if (port == null) return this;
        try {
            return toBuilder().port(Integer.parseInt(port.trim())).build();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("CINDER_PORT is not a number: " + port, e);
        }
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public int getMaxClients() { return maxClients; }
    public int getIoThreads() { return ioThreads; }
    public int getShards() { return shards; }
    public int getMaxBulkLength() { return maxBulkLength; }
    public int getMaxInlineLength() { return maxInlineLength; }
    public int getMaxMultiBulkLength() { return maxMultiBulkLength; }
    public int getWriteBufferLowWaterMark() { return writeBufferLowWaterMark; }
    public int getWriteBufferHighWaterMark() { return writeBufferHighWaterMark; }
    public ActiveExpire getActiveExpire() { return activeExpire; }
    public String getSnapshotFile() { return snapshotFile; }
    public long getSnapshotIntervalSeconds() { return snapshotIntervalSeconds; }
    public long getSlowlogThresholdMicros() { return slowlogThresholdMicros; }
    public String getLogLevel() { return logLevel; }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String host = "0.0.0.0";
        private int port = DEFAULT_PORT;
        private int maxClients = 10000;
        private int ioThreads = 0;
        private int shards = 64;
        private int maxBulkLength = 512 * 1024 * 1024;
        private int maxInlineLength = 64 * 1024;
        private int maxMultiBulkLength = 1024 * 1024;
        private int writeBufferLowWaterMark = 32 * 1024;
        private int writeBufferHighWaterMark = 64 * 1024;
        private ActiveExpire activeExpire = ActiveExpire.defaults();
        private String snapshotFile = "cinder.snapshot";
        private long snapshotIntervalSeconds = 60;
        private long slowlogThresholdMicros = 10_000;
        private String logLevel = "INFO";

        public Builder host(String host) { this.host = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder maxClients(int maxClients) { this.maxClients = maxClients; return this; }
        public Builder ioThreads(int ioThreads) { this.ioThreads = ioThreads; return this; }
        public Builder shards(int shards) { this.shards = shards; return this; }
        public Builder maxBulkLength(int maxBulkLength) { this.maxBulkLength = maxBulkLength; return this; }
        public Builder maxInlineLength(int maxInlineLength) { this.maxInlineLength = maxInlineLength; return this; }
        public Builder maxMultiBulkLength(int maxMultiBulkLength) { this.maxMultiBulkLength = maxMultiBulkLength; return this; }
        public Builder writeBufferLowWaterMark(int low) { this.writeBufferLowWaterMark = low; return this; }
        public Builder writeBufferHighWaterMark(int high) { this.writeBufferHighWaterMark = high; return this; }
        public Builder activeExpire(ActiveExpire activeExpire) { this.activeExpire = activeExpire; return this; }
        public Builder snapshotFile(String snapshotFile) { this.snapshotFile = snapshotFile; return this; }
        public Builder snapshotIntervalSeconds(long seconds) { this.snapshotIntervalSeconds = seconds; return this; }
        public Builder slowlogThresholdMicros(long micros) { this.slowlogThresholdMicros = micros; return this; }
        public Builder logLevel(String logLevel) { this.logLevel = logLevel; return this; }

        public Config build() {
            if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            if (maxClients <= 0) throw new IllegalArgumentException("maxClients must be positive");
            if (ioThreads < 0) throw new IllegalArgumentException("ioThreads must not be negative");
            if (shards <= 0 || Integer.bitCount(shards) != 1) {
                throw new IllegalArgumentException("shards must be a power of two: " + shards);
            }
            if (maxBulkLength <= 0 || maxInlineLength <= 0 || maxMultiBulkLength <= 0) {
                throw new IllegalArgumentException("protocol limits must be positive");
            }
            if (writeBufferLowWaterMark <= 0 || writeBufferLowWaterMark > writeBufferHighWaterMark) {
                throw new IllegalArgumentException("need 0 < writeBufferLowWaterMark <= writeBufferHighWaterMark");
            }
            if (activeExpire == null) activeExpire = ActiveExpire.defaults();
            return new Config(this);
        }
    }

    /**
     * Tuning for the sampled background expiry sweep.
     */
    @JsonDeserialize(builder = ActiveExpire.Builder.class)
    public static final class ActiveExpire {
        private final long intervalMillis;
        private final int sampleSize;
        private final double resampleThreshold;
        private final int maxIterations;

        private ActiveExpire(Builder b) {
            this.intervalMillis = b.intervalMillis;
            this.sampleSize = b.sampleSize;
            this.resampleThreshold = b.resampleThreshold;
            this.maxIterations = b.maxIterations;
        }

        public static ActiveExpire defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public long getIntervalMillis() { return intervalMillis; }
        public int getSampleSize() { return sampleSize; }
        public double getResampleThreshold() { return resampleThreshold; }
        public int getMaxIterations() { return maxIterations; }

        @JsonPOJOBuilder(withPrefix = "")
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class Builder {
            private long intervalMillis = 100;
            private int sampleSize = 20;
            private double resampleThreshold = 0.25;
            private int maxIterations = 16;

            public Builder intervalMillis(long intervalMillis) { this.intervalMillis = intervalMillis; return this; }
            public Builder sampleSize(int sampleSize) { this.sampleSize = sampleSize; return this; }
            public Builder resampleThreshold(double threshold) { this.resampleThreshold = threshold; return this; }
            public Builder maxIterations(int maxIterations) { this.maxIterations = maxIterations; return this; }

            public ActiveExpire build() {
                if (intervalMillis <= 0) throw new IllegalArgumentException("activeExpire.intervalMillis must be positive");
                if (sampleSize <= 0) throw new IllegalArgumentException("activeExpire.sampleSize must be positive");
                if (resampleThreshold <= 0 || resampleThreshold > 1) {
                    throw new IllegalArgumentException("activeExpire.resampleThreshold must be in (0, 1]");
                }
                if (maxIterations <= 0) throw new IllegalArgumentException("activeExpire.maxIterations must be positive");
                return new ActiveExpire(this);
            }
        }
    }
}
