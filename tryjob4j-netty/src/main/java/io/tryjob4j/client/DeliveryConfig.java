package io.tryjob4j.client;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Options of one try client run.
 *
 * <p>Typical usage:
 * <pre>{@code
 * DeliveryConfig config = DeliveryConfig.builder()
 *         .connectMethod(ConnectMethod.PB)
 *         .master("localhost:8031")
 *         .username("alice").password("secret")
 *         .builder("a")
 *         .wait(true)
 *         .build();
 * }</pre>
 */
public final class DeliveryConfig {

    public static final Duration DEFAULT_WAIT_CHECK_INTERVAL = Duration.ofMillis(50);

    private final ConnectMethod connectMethod;
    private final String masterHost;
    private final int masterPort;
    private final Path jobdir;
    private final String username;
    private final String password;
    private final boolean wait;
    private final boolean getBuilderNames;
    private final List<String> builders;
    private final String comment;
    private final String who;
    private final Map<String, String> properties;
    private final Duration waitTimeout;
    private final Duration waitCheckInterval;

    private DeliveryConfig(Builder b) {
        this.connectMethod = b.connectMethod;
        this.masterHost = b.masterHost;
        this.masterPort = b.masterPort;
        this.jobdir = b.jobdir;
        this.username = b.username;
        this.password = b.password;
        this.wait = b.wait;
        this.getBuilderNames = b.getBuilderNames;
        this.builders = List.copyOf(b.builders);
        this.comment = b.comment;
        this.who = b.who;
        this.properties = Map.copyOf(b.properties);
        this.waitTimeout = b.waitTimeout;
        this.waitCheckInterval = b.waitCheckInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConnectMethod connectMethod() {
        return connectMethod;
    }

    public String masterHost() {
        return masterHost;
    }

    public int masterPort() {
        return masterPort;
    }

    public Path jobdir() {
        return jobdir;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public boolean isWait() {
        return wait;
    }

    public boolean isGetBuilderNames() {
        return getBuilderNames;
    }

    public List<String> builders() {
        return builders;
    }

    public String comment() {
        return comment;
    }

    public String who() {
        return who;
    }

    public Map<String, String> properties() {
        return properties;
    }

    /**
     * Null waits until every build finished.
     */
    public Duration waitTimeout() {
        return waitTimeout;
    }

    public Duration waitCheckInterval() {
        return waitCheckInterval;
    }

    public static final class Builder {
        private ConnectMethod connectMethod;
        private String masterHost;
        private int masterPort;
        private Path jobdir;
        private String username;
        private String password;
        private boolean wait;
        private boolean getBuilderNames;
        private final List<String> builders = new ArrayList<>();
        private String comment;
        private String who;
        private final Map<String, String> properties = new TreeMap<>();
        private Duration waitTimeout;
        private Duration waitCheckInterval = DEFAULT_WAIT_CHECK_INTERVAL;

        private Builder() {
        }

        public Builder connectMethod(ConnectMethod connectMethod) {
            this.connectMethod = connectMethod;
            return this;
        }

        /**
         * @param master {@code host:port} of the userpass scheduler
         */
        public Builder master(String master) {
            Objects.requireNonNull(master, "master must not be null");
            int colon = master.lastIndexOf(':');
            if (colon <= 0 || colon == master.length() - 1) {
                throw new IllegalArgumentException("master must be host:port, got: " + master);
            }
            int port;
            try {
                port = Integer.parseInt(master.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("master port is not a number: " + master, e);
            }
            return master(master.substring(0, colon), port);
        }

        public Builder master(String host, int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("master port out of range: " + port);
            }
            this.masterHost = Objects.requireNonNull(host, "host must not be null");
            this.masterPort = port;
            return this;
        }

        public Builder jobdir(Path jobdir) {
            this.jobdir = jobdir;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder wait(boolean wait) {
            this.wait = wait;
            return this;
        }

        public Builder getBuilderNames(boolean getBuilderNames) {
            this.getBuilderNames = getBuilderNames;
            return this;
        }

        public Builder builders(List<String> builders) {
            this.builders.clear();
            if (builders != null) {
                this.builders.addAll(builders);
            }
            return this;
        }

        public Builder builder(String builderName) {
            this.builders.add(Objects.requireNonNull(builderName, "builderName must not be null"));
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public Builder who(String who) {
            this.who = who;
            return this;
        }

        public Builder property(String key, String value) {
            this.properties.put(
                    Objects.requireNonNull(key, "key must not be null"),
                    Objects.requireNonNull(value, "value must not be null")
            );
            return this;
        }

        public Builder waitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
            return this;
        }

        public Builder waitCheckInterval(Duration waitCheckInterval) {
            this.waitCheckInterval = waitCheckInterval;
            return this;
        }

        /**
         * @throws TryClientException when the options required by the connect method are missing
         */
        public DeliveryConfig build() {
            if (connectMethod == null) {
                throw new TryClientException("connectMethod is required");
            }
            if (connectMethod == ConnectMethod.PB) {
                if (masterHost == null) {
                    throw new TryClientException("pb connect method requires master host:port");
                }
                if (username == null || password == null) {
                    throw new TryClientException("pb connect method requires username and password");
                }
            }
            if (connectMethod == ConnectMethod.SSH && jobdir == null) {
                throw new TryClientException("ssh connect method requires a jobdir");
            }
            if (waitCheckInterval == null || waitCheckInterval.isZero() || waitCheckInterval.isNegative()) {
                throw new TryClientException("waitCheckInterval must be a positive duration");
            }
            if (waitTimeout != null && waitTimeout.isNegative()) {
                throw new TryClientException("waitTimeout must not be negative");
            }
            return new DeliveryConfig(this);
        }
    }

    @Override
    public String toString() {
        return "DeliveryConfig{connectMethod=" + connectMethod
                + ", master=" + masterHost + ":" + masterPort
                + ", jobdir=" + jobdir
                + ", username=" + username
                + ", wait=" + wait
                + ", getBuilderNames=" + getBuilderNames
                + ", builders=" + builders + "}";
    }
}
