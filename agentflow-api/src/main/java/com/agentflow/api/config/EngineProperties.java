package com.agentflow.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine settings bound from the {@code agentflow.engine.*} namespace.
 *
 * @param store              where execution records live
 * @param stateDirectory     directory of the file store
 * @param jdbc               connection settings of the jdbc store
 * @param workflowsDirectory definitions loaded at startup; null to skip
 * @param shutdownTimeout    how long shutdown waits for active executions
 * @param recovery           automatic resume of interrupted executions
 */
@ConfigurationProperties(prefix = "agentflow.engine")
public record EngineProperties(
    StoreType store,
    Path stateDirectory,
    Jdbc jdbc,
    Path workflowsDirectory,
    Duration shutdownTimeout,
    Recovery recovery
) {
    public EngineProperties {
        if (store == null) {
            store = StoreType.MEMORY;
        }
        if (stateDirectory == null) {
            stateDirectory = Path.of("./state");
        }
        if (jdbc == null) {
            jdbc = new Jdbc(null, null, null, false);
        }
        if (shutdownTimeout == null) {
            shutdownTimeout = Duration.ofSeconds(30);
        }
        if (recovery == null) {
            recovery = new Recovery(true, null);
        }
    }

    public enum StoreType {
        MEMORY,
        FILE,
        JDBC
    }

    /**
     * @param initializeSchema create the executions table on startup
     */
    public record Jdbc(String url, String username, String password, boolean initializeSchema) {}

    public record Recovery(boolean enabled, Duration scanInterval) {
        public Recovery {
            if (scanInterval == null) {
                scanInterval = Duration.ofSeconds(60);
            }
        }
    }
}
