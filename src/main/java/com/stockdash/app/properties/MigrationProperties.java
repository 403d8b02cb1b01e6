package com.stockdash.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "migration")
public class MigrationProperties {
    private String dbPath = "data/stockdash.db";
    private int batchSize = 5;
    private int maxRetries = 3;
    private String backupDir = "./backups";
    private long retryBackoffMs = 1000L;
    private long batchPauseMs = 10L;
    private long timeoutMs = 30_000L;
    private long enhancedTimeoutMs = 60_000L;
    /** Apply pending migrations when the runner bean is created. */
    private boolean runOnStartup = true;
    private SqlLog sqlLog = new SqlLog();

    @Getter
    @Setter
    public static class SqlLog {
        private boolean enabled = false;
    }
}
