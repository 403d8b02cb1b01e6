package com.stockdash.config;

import com.stockdash.db.Database;
import com.stockdash.migration.MigrationSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Layered configuration: built-in defaults, classpath {@code config.properties}, then a
 * {@code config.properties} in the working directory. Environment variables
 * {@value #ENV_DB_PATH} and {@value #ENV_BACKUP_DIR} win over all files.
 */
public final class Config {
    public static final String ENV_DB_PATH = "STOCKDASH_DB_PATH";
    public static final String ENV_BACKUP_DIR = MigrationSettings.BACKUP_DIR_ENV;

    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;
    private final Map<String, String> env;

/**
 * 方法说明：Config，负责绑定工作目录与环境变量快照。
 * 处理流程：环境变量在构造时复制为不可变映射，之后的读取不受进程环境变化影响。
 * 维护提示：新增环境覆盖项时需同时更新 sourceOf 的来源判断。
 */
    private Config(Path workingDir, Map<String, String> env) {
        this.workingDir = workingDir;
        this.env = env == null ? Map.of() : Map.copyOf(env);
    }

/**
 * 方法说明：load，负责以当前进程环境加载配置。
 * 处理流程：委托给带环境参数的重载，环境取自 System.getenv()。
 * 维护提示：测试中请使用带环境参数的重载，避免依赖真实环境变量。
 */
    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

/**
 * 方法说明：load，负责按层级合并 classpath 与工作目录下的 config.properties。
 * 处理流程：先读取 classpath 资源，再用工作目录文件覆盖；文件不可读时记录 warn 日志并保留已有值。
 * 维护提示：层级顺序变更会影响 sourceOf 的返回值，请同步调整 ConfigTest。
 */
    public static Config load(Path workingDir, Map<String, String> env) {
        Config config = new Config(workingDir, env);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("Classpath config.properties unreadable, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }
        return config;
    }

/**
 * 方法说明：workingDir，负责返回相对路径的解析基准目录。
 * 处理流程：直接返回构造时传入的目录。
 * 维护提示：数据库路径与备份目录均基于该目录解析。
 */
    public Path workingDir() {
        return workingDir;
    }

/**
 * 方法说明：getString，负责读取去除首尾空白后的配置值。
 * 处理流程：配置值为空或仅含空白时回退到内置默认值，默认值缺失时返回空串。
 * 维护提示：新增配置键时请在 buildDefaults 中补充默认值。
 */
    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

/**
 * 方法说明：getString，负责读取配置值并在为空时使用调用方给定的回退值。
 * 处理流程：先走单参数版本的默认值逻辑，结果仍为空时返回 fallback。
 * 维护提示：回退值只在内置默认值也缺失时生效。
 */
    public String getString(String key, String fallback) {
        String value = getString(key);
        return value.isEmpty() ? fallback : value;
    }

/**
 * 方法说明：getBoolean，负责把配置值解析为布尔开关。
 * 处理流程：true、1、yes、y（忽略大小写）视为开启，其余非空值视为关闭，空值返回 fallback。
 * 维护提示：扩展可接受的写法时请同步更新配置文件中的注释示例。
 */
    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

/**
 * 方法说明：getInt，负责把配置值解析为整数。
 * 处理流程：解析失败时返回 fallback，不抛出异常。
 * 维护提示：取值范围校验由 MigrationSettings.check 负责，此处不做限制。
 */
    public int getInt(String key, int fallback) {
        String value = getString(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

/**
 * 方法说明：getLong，负责把配置值解析为长整数，多用于毫秒时长。
 * 处理流程：解析失败时返回 fallback，不抛出异常。
 * 维护提示：时长类配置统一以 _ms 结尾，新增时保持该约定。
 */
    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    /**
     * Database location: {@value #ENV_DB_PATH}, else {@code db.path}. {@code :memory:} passes through,
     * anything else resolves against the working directory.
     */
    public String dbPath() {
        String raw = firstNonBlank(env.get(ENV_DB_PATH), getString("db.path"));
        if (Database.MEMORY.equals(raw)) {
            return raw;
        }
        return workingDir.resolve(raw).normalize().toString();
    }

/**
 * 方法说明：backupDir，负责确定迁移备份文件的存放目录。
 * 处理流程：环境变量 BACKUP_DIR 优先，其次为 migration.backup_dir，结果基于工作目录规范化。
 * 维护提示：该目录同时用于备份创建与过期清理，修改解析规则需回归两条路径。
 */
    public Path backupDir() {
        String raw = firstNonBlank(env.get(ENV_BACKUP_DIR), getString("migration.backup_dir"));
        return workingDir.resolve(raw).normalize();
    }

/**
 * 方法说明：sqlLogEnabled，负责判断是否输出 SQL 执行日志。
 * 处理流程：读取 db.sql_log.enabled，默认关闭。
 */
    public boolean sqlLogEnabled() {
        return getBoolean("db.sql_log.enabled", false);
    }

/**
 * 方法说明：backupRetainDays，负责提供备份清理的默认保留天数。
 * 处理流程：读取 backup.retain_days，缺省为 7 天。
 * 维护提示：命令行未指定天数时使用该值。
 */
    public int backupRetainDays() {
        return getInt("backup.retain_days", 7);
    }

/**
 * 方法说明：migrationSettings，负责把配置项装配为迁移运行参数。
 * 处理流程：逐项读取 migration.* 配置并构建 MigrationSettings，合法性在 MigrationRunner 构造时校验。
 * 维护提示：新增运行参数时需同时补充默认值、此处装配与配置文件说明。
 */
    public MigrationSettings migrationSettings() {
        return MigrationSettings.builder()
                .batchSize(getInt("migration.batch_size", 5))
                .maxRetries(getInt("migration.max_retries", 3))
                .backupDir(backupDir())
                .retryBackoffUnit(Duration.ofMillis(getLong("migration.retry_backoff_ms", 1000L)))
                .batchPause(Duration.ofMillis(getLong("migration.batch_pause_ms", 10L)))
                .defaultTimeout(Duration.ofMillis(getLong("migration.timeout_ms", 30_000L)))
                .enhancedTimeout(Duration.ofMillis(getLong("migration.enhanced_timeout_ms", 60_000L)))
                .build();
    }

    /**
     * Where the effective value of {@code key} came from: {@code env}, {@code override},
     * {@code resource} or {@code default}.
     */
    public String sourceOf(String key) {
        if ("db.path".equals(key) && !nonBlank(env.get(ENV_DB_PATH)).isEmpty()) {
            return "env";
        }
        if ("migration.backup_dir".equals(key) && !nonBlank(env.get(ENV_BACKUP_DIR)).isEmpty()) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            String trimmed = nonBlank(value);
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }

    private static String nonBlank(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> m = new HashMap<>();
        m.put("db.path", "data/stockdash.db");
        m.put("db.sql_log.enabled", "false");
        m.put("migration.batch_size", "5");
        m.put("migration.max_retries", "3");
        m.put("migration.backup_dir", "./backups");
        m.put("migration.retry_backoff_ms", "1000");
        m.put("migration.batch_pause_ms", "10");
        m.put("migration.timeout_ms", "30000");
        m.put("migration.enhanced_timeout_ms", "60000");
        m.put("backup.retain_days", "7");
        return Collections.unmodifiableMap(m);
    }
}
