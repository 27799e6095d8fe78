package com.micronote.backend.global.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "micronote.cache")
public class CacheProperties {

    private boolean enabled = true;

    private String keyPrefix = "cache:";

    private Duration ttl = Duration.ofSeconds(300);

    /**
     * Resource roots whose GET responses are cached and whose writes invalidate.
     */
    private List<String> paths = new ArrayList<>(List.of("/api/notes", "/api/todos", "/api/users/me"));

    /**
     * Writes below this root drop every cached entry of the caller, not just the root's.
     */
    private String accountRoot = "/api/users/me";

    /**
     * Cached reads computed from other roots' data, dropped on every write outside the account root.
     */
    private List<String> aggregatePaths = new ArrayList<>(List.of("/api/users/me/stats"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public List<String> getPaths() {
        return paths;
    }

    public void setPaths(List<String> paths) {
        this.paths = paths;
    }

    public String getAccountRoot() {
        return accountRoot;
    }

    public void setAccountRoot(String accountRoot) {
        this.accountRoot = accountRoot;
    }

    public List<String> getAggregatePaths() {
        return aggregatePaths;
    }

    public void setAggregatePaths(List<String> aggregatePaths) {
        this.aggregatePaths = aggregatePaths;
    }
}
