package io.tryjob4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration for the try schedulers.
 */
@ConfigurationProperties(prefix = "tryjob")
public class TryJobProperties {

    public enum StoreType {
        MONGO,
        MEMORY
    }

    private boolean enabled = true;
    private int eventLoopThreads = 0; // 0 = Netty default
    private StoreType store = StoreType.MONGO;
    private Duration statusPollInterval = Duration.ofSeconds(1);
    private boolean ensureIndexesOnStartup = false;
    private final Jobdir jobdir = new Jobdir();
    private final Userpass userpass = new Userpass();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getEventLoopThreads() {
        return eventLoopThreads;
    }

    public void setEventLoopThreads(int eventLoopThreads) {
        this.eventLoopThreads = eventLoopThreads;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Duration getStatusPollInterval() {
        return statusPollInterval;
    }

    public void setStatusPollInterval(Duration statusPollInterval) {
        this.statusPollInterval = statusPollInterval;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Jobdir getJobdir() {
        return jobdir;
    }

    public Userpass getUserpass() {
        return userpass;
    }

    /**
     * Mailbox-fed scheduler.
     */
    public static class Jobdir {
        private boolean enabled = false;
        private String name = "try-jobdir";
        private List<String> builders = new ArrayList<>();
        private Path directory;
        private Duration pollInterval = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getBuilders() {
            return builders;
        }

        public void setBuilders(List<String> builders) {
            this.builders = builders;
        }

        public Path getDirectory() {
            return directory;
        }

        public void setDirectory(Path directory) {
            this.directory = directory;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    /**
     * Network scheduler with username/password login.
     */
    public static class Userpass {
        private boolean enabled = false;
        private String name = "try-userpass";
        private List<String> builders = new ArrayList<>();
        private String bindHost;
        private int port = 8031;
        private Map<String, String> users = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getBuilders() {
            return builders;
        }

        public void setBuilders(List<String> builders) {
            this.builders = builders;
        }

        public String getBindHost() {
            return bindHost;
        }

        public void setBindHost(String bindHost) {
            this.bindHost = bindHost;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public Map<String, String> getUsers() {
            return users;
        }

        public void setUsers(Map<String, String> users) {
            this.users = users;
        }
    }
}
