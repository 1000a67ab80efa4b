package com.findinpath.hierarchy.service;

import com.findinpath.hierarchy.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Tuning knobs of the {@link HierarchyStore}.
 * <ul>
 *     <li><code>hierarchy.lockTimeoutMillis</code> - how long a structural mutation waits for the lock of its kind, at least 1</li>
 *     <li><code>hierarchy.verifyAfterMutation</code> - whether the invariants of the kind are verified before committing</li>
 * </ul>
 */
public class HierarchySettings {

    public static final String DEFAULT_RESOURCE_NAME = "hierarchy.properties";
    public static final String LOCK_TIMEOUT_MILLIS_PROPERTY = "hierarchy.lockTimeoutMillis";
    public static final String VERIFY_AFTER_MUTATION_PROPERTY = "hierarchy.verifyAfterMutation";

    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final Duration lockTimeout;
    private final boolean verifyAfterMutation;

    public HierarchySettings(Duration lockTimeout, boolean verifyAfterMutation) {
        // PostgreSQL reads a lock_timeout of 0 as waiting forever
        if (lockTimeout.toMillis() < 1) {
            throw new IllegalArgumentException("The lock timeout must be at least one millisecond: " + lockTimeout);
        }
        this.lockTimeout = lockTimeout;
        this.verifyAfterMutation = verifyAfterMutation;
    }

    public static HierarchySettings defaults() {
        return new HierarchySettings(DEFAULT_LOCK_TIMEOUT, true);
    }

    public static HierarchySettings fromProperties(Properties properties) {
        var lockTimeoutMillis = properties.getProperty(LOCK_TIMEOUT_MILLIS_PROPERTY);
        var verifyAfterMutation = properties.getProperty(VERIFY_AFTER_MUTATION_PROPERTY);
        try {
            return new HierarchySettings(
                    lockTimeoutMillis == null ? DEFAULT_LOCK_TIMEOUT : Duration.ofMillis(Long.parseLong(lockTimeoutMillis.trim())),
                    verifyAfterMutation == null || Boolean.parseBoolean(verifyAfterMutation.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + LOCK_TIMEOUT_MILLIS_PROPERTY + ": " + lockTimeoutMillis, e);
        }
    }

    /**
     * Loads the settings from the given classpath resource. Missing resources and missing keys fall back to the defaults.
     */
    public static HierarchySettings fromClasspathResource(String resourceName) {
        var properties = new Properties();
        try (InputStream inputStream = HierarchySettings.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream != null) {
                properties.load(inputStream);
            }
        } catch (IOException e) {
            Utils.sneakyThrow(e);
        }
        return fromProperties(properties);
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public boolean isVerifyAfterMutation() {
        return verifyAfterMutation;
    }

    @Override
    public String toString() {
        return "HierarchySettings{" +
                "lockTimeout=" + lockTimeout +
                ", verifyAfterMutation=" + verifyAfterMutation +
                '}';
    }
}
