package com.cairnsystems.persistence.jdbc;

import com.cairnsystems.Pid;
import com.cairnsystems.persistence.journal.EventAdapter;
import com.cairnsystems.persistence.serialization.JavaPayloadSerializer;
import com.cairnsystems.persistence.serialization.PayloadSerializer;

import java.sql.Connection;
import java.time.Duration;

/**
 * Configuration of a {@link BatchingJournal}.
 */
public class JournalSettings {

    // Connection
    private String connectionUrl;
    private String user = "SA";
    private String password = "";
    private Duration connectionTimeout = Duration.ofSeconds(30);
    private boolean keepAnchorConnection = false;

    // Batching
    private int maxConcurrentOperations = 64;
    private int maxBatchSize = 100;
    private int maxBufferSize = Integer.MAX_VALUE;

    // Storage
    private boolean autoInitialize = false;
    private boolean transactional = true;
    private int isolationLevel = Connection.TRANSACTION_READ_COMMITTED;
    private NamingConventions namingConventions = NamingConventions.defaults();
    private CircuitBreakerSettings circuitBreaker = CircuitBreakerSettings.defaults();

    // Collaborators
    private PayloadSerializer serializer = new JavaPayloadSerializer();
    private EventAdapter eventAdapter = EventAdapter.IDENTITY;
    private Pid requestTap = null;

    public static JournalSettings.Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final JournalSettings settings = new JournalSettings();

        public Builder connectionUrl(String url) {
            settings.connectionUrl = url;
            return this;
        }

        public Builder user(String user) {
            settings.user = user;
            return this;
        }

        public Builder password(String password) {
            settings.password = password;
            return this;
        }

        public Builder connectionTimeout(Duration timeout) {
            settings.connectionTimeout = timeout;
            return this;
        }

        /**
         * Holds one connection open for the lifetime of the journal. Needed by in-memory databases
         * that discard their content when the last connection closes.
         */
        public Builder keepAnchorConnection(boolean keep) {
            settings.keepAnchorConnection = keep;
            return this;
        }

        public Builder maxConcurrentOperations(int max) {
            settings.maxConcurrentOperations = max;
            return this;
        }

        public Builder maxBatchSize(int max) {
            settings.maxBatchSize = max;
            return this;
        }

        public Builder maxBufferSize(int max) {
            settings.maxBufferSize = max;
            return this;
        }

        public Builder autoInitialize(boolean autoInitialize) {
            settings.autoInitialize = autoInitialize;
            return this;
        }

        public Builder transactional(boolean transactional) {
            settings.transactional = transactional;
            return this;
        }

        /**
         * @param level one of the {@code Connection.TRANSACTION_*} constants
         */
        public Builder isolationLevel(int level) {
            settings.isolationLevel = level;
            return this;
        }

        public Builder namingConventions(NamingConventions naming) {
            settings.namingConventions = naming;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerSettings circuitBreaker) {
            settings.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder serializer(PayloadSerializer serializer) {
            settings.serializer = serializer;
            return this;
        }

        public Builder eventAdapter(EventAdapter adapter) {
            settings.eventAdapter = adapter;
            return this;
        }

        /**
         * Every request of a successfully executed chunk is also sent to this actor.
         */
        public Builder requestTap(Pid tap) {
            settings.requestTap = tap;
            return this;
        }

        public JournalSettings build() {
            settings.validate();
            return settings;
        }
    }

    private void validate() {
        if (connectionUrl == null || connectionUrl.isBlank()) {
            throw new IllegalArgumentException("Connection url cannot be empty");
        }
        if (maxConcurrentOperations <= 0) {
            throw new IllegalArgumentException("Max concurrent operations must be positive");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("Max batch size must be positive");
        }
        if (maxBufferSize <= 0) {
            throw new IllegalArgumentException("Max buffer size must be positive");
        }
        if (connectionTimeout == null || connectionTimeout.isNegative()) {
            throw new IllegalArgumentException("Connection timeout must not be negative");
        }
        if (isolationLevel != Connection.TRANSACTION_READ_UNCOMMITTED
                && isolationLevel != Connection.TRANSACTION_READ_COMMITTED
                && isolationLevel != Connection.TRANSACTION_REPEATABLE_READ
                && isolationLevel != Connection.TRANSACTION_SERIALIZABLE) {
            throw new IllegalArgumentException("Unsupported isolation level " + isolationLevel);
        }
        if (namingConventions == null || circuitBreaker == null || serializer == null || eventAdapter == null) {
            throw new IllegalArgumentException("Naming conventions, circuit breaker, serializer and event adapter are required");
        }
    }

    public String getConnectionUrl() { return connectionUrl; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public boolean isKeepAnchorConnection() { return keepAnchorConnection; }
    public int getMaxConcurrentOperations() { return maxConcurrentOperations; }
    public int getMaxBatchSize() { return maxBatchSize; }
    public int getMaxBufferSize() { return maxBufferSize; }
    public boolean isAutoInitialize() { return autoInitialize; }
    public boolean isTransactional() { return transactional; }
    public int getIsolationLevel() { return isolationLevel; }
    public NamingConventions getNamingConventions() { return namingConventions; }
    public CircuitBreakerSettings getCircuitBreaker() { return circuitBreaker; }
    public PayloadSerializer getSerializer() { return serializer; }
    public EventAdapter getEventAdapter() { return eventAdapter; }
    public Pid getRequestTap() { return requestTap; }

    @Override
    public String toString() {
        return "JournalSettings{" +
                "connectionUrl=" + connectionUrl +
                ", maxConcurrentOperations=" + maxConcurrentOperations +
                ", maxBatchSize=" + maxBatchSize +
                ", maxBufferSize=" + maxBufferSize +
                ", autoInitialize=" + autoInitialize +
                ", transactional=" + transactional +
                ", isolationLevel=" + isolationLevel +
                ", keepAnchorConnection=" + keepAnchorConnection +
                ", connectionTimeout=" + connectionTimeout +
                ", circuitBreaker=" + circuitBreaker +
                ", namingConventions=" + namingConventions +
                '}';
    }
}
