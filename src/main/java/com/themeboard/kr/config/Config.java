package com.themeboard.kr.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：扁平化的 key/value 配置，优先级为 本地 config.properties &gt; classpath &gt; 内置默认值。
 * 使用建议：新增配置项时同步在 buildDefaults 中登记默认值。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置或数据。
 * 处理流程：先读 classpath 下的 config.properties，再用工作目录中的同名文件覆盖。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.props.load(in);
            }
        } catch (IOException ignored) {
            // Ignore broken classpath config and continue with defaults/local file.
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            Properties override = new Properties();
            try (InputStream in = Files.newInputStream(local)) {
                override.load(in);
                config.props.putAll(override);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

/**
 * 方法说明：getString，负责获取数据并返回结果。
 * 处理流程：空白值视为未配置，回退到内置默认值。
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

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value)
                || "on".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (Exception ignored) {
            return fallback;
        }
    }

/**
 * 方法说明：getPath，负责获取数据并返回结果。
 * 处理流程：相对路径基于 workingDir 解析；未配置时返回 workingDir。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        config.props.setProperty(key.trim(), value == null ? "" : value);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

/**
 * 方法说明：buildDefaults，负责构建目标对象或输出内容。
 * 维护提示：查询参数的上下限同样在这里登记，调用方只做 clamp。
 */
    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("app.zone", "Asia/Seoul");
        defaults.put("app.log_routing", "true");

        defaults.put("theme.root", "tema");
        defaults.put("theme.housekeeping_prefixes", "00_,00.");
        defaults.put("theme.dominant.names", "SK하이닉스");
        defaults.put("theme.dominant.prefixes", "삼성전자");
        defaults.put("theme.preview.sort", "changerate");
        defaults.put("theme.cache.enabled", "true");

        defaults.put("calendar.reference_code", "005930");
        defaults.put("calendar.scan_days", "60");

        defaults.put("price.daily_url", "https://stooq.com/q/d/l/?s={code}.kr&d1={date}&d2={date}&i=d");
        defaults.put("price.bulk_url", "");
        defaults.put("price.request_timeout_sec", "8");
        defaults.put("price.retry_count", "1");
        defaults.put("price.retry_sleep_ms", "500");
        defaults.put("price.request_pause_ms", "0");
        defaults.put("price.circuit_breaker.timeout_streak", "10");
        defaults.put("price.circuit_breaker.cooldown_sec", "60");

        defaults.put("forward.fallback.threads", "4");
        defaults.put("forward.bulk.cache_days", "16");

        defaults.put("query.themes.limit.default", "4");
        defaults.put("query.themes.limit.max", "100");
        defaults.put("query.themes.preview.default", "4");
        defaults.put("query.themes.preview.max", "50");
        defaults.put("query.insights.lookback.default", "20");
        defaults.put("query.insights.lookback.min", "5");
        defaults.put("query.insights.lookback.max", "120");
        defaults.put("query.insights.top_n.default", "10");
        defaults.put("query.insights.top_n.min", "3");
        defaults.put("query.insights.top_n.max", "30");
        defaults.put("query.history.lookback.default", "60");
        defaults.put("query.history.lookback.min", "10");
        defaults.put("query.history.lookback.max", "240");
        defaults.put("query.insights.max_entries", "20");

        return Collections.unmodifiableMap(defaults);
    }
}
