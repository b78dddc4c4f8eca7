package alertquery.config;

import alertquery.filter.AlertFilter;
import alertquery.filter.FilterKind;
import alertquery.model.ResourceType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 过滤器配置 - 从YAML配置构建过滤器
 *
 * <pre>
 * filters:
 *   - kind: query_alert_type
 *     resource_type: volume
 *     alert_type: 5
 *   - kind: time
 *     start: 2024-01-01T00:00:00Z
 *     stop: 2024-01-02T00:00:00Z
 * </pre>
 */
public final class FilterSpecs {
    private static final Logger logger = LoggerFactory.getLogger(FilterSpecs.class);

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private FilterSpecs() {
    }

    /**
     * 加载YAML文件中的 filters 列表
     */
    @SuppressWarnings("unchecked")
    public static List<AlertFilter> load(Path path) {
        Map<String, Object> config;
        try {
            config = yamlMapper.readValue(path.toFile(), Map.class);
        } catch (IOException e) {
            throw new ConfigurationException("加载过滤器配置失败: " + path, e);
        }
        if (config == null || config.get("filters") == null) {
            logger.warn("过滤器配置为空: {}", path);
            return Collections.emptyList();
        }
        Object filters = config.get("filters");
        if (!(filters instanceof List)) {
            throw new ConfigurationException("filters 必须是列表: " + path);
        }
        return fromMaps((List<Map<String, Object>>) filters);
    }

    public static List<AlertFilter> fromMaps(List<Map<String, Object>> specs) {
        List<AlertFilter> filters = new ArrayList<>();
        for (Map<String, Object> spec : specs) {
            filters.add(fromMap(spec));
        }
        return filters;
    }

    public static AlertFilter fromMap(Map<String, Object> spec) {
        Object kindName = spec.get("kind");
        if (kindName == null) {
            throw new ConfigurationException("过滤器配置必须指定kind");
        }
        FilterKind kind = FilterKind.fromName(kindName.toString());
        if (kind == null) {
            throw new ConfigurationException("不支持的过滤器类型: " + kindName);
        }

        switch (kind) {
            case TIME:
                try {
                    return AlertFilter.time(getInstant(spec, "start"), getInstant(spec, "stop"));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(e.getMessage(), e);
                }
            case ALERT_TYPE:
                return AlertFilter.alertType(getLong(spec, "alert_type"));
            case RESOURCE_ID:
                return AlertFilter.resourceId(getString(spec, "resource_id"));
            case COUNT:
                return AlertFilter.count(getLong(spec, "count"));
            case QUERY_RESOURCE_TYPE:
                return AlertFilter.queryResourceType(getResourceType(spec));
            case QUERY_ALERT_TYPE:
                return AlertFilter.queryAlertType(getLong(spec, "alert_type"), getResourceType(spec));
            case QUERY_RESOURCE_ID:
                return AlertFilter.queryResourceId(getString(spec, "resource_id"),
                        getResourceType(spec), getLong(spec, "alert_type"));
            default:
                throw new ConfigurationException("过滤器类型不支持配置: " + kind);
        }
    }

    private static Object require(Map<String, Object> spec, String field) {
        Object value = spec.get(field);
        if (value == null) {
            throw new ConfigurationException(
                    String.format("过滤器配置缺少必需字段 '%s': %s", field, spec));
        }
        return value;
    }

    private static String getString(Map<String, Object> spec, String field) {
        return require(spec, field).toString();
    }

    private static long getLong(Map<String, Object> spec, String field) {
        Object value = require(spec, field);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            String text = value.toString().trim();
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return Long.parseLong(text.substring(2), 16);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    String.format("字段 '%s' 不是有效的整数: %s", field, value), e);
        }
    }

    private static ResourceType getResourceType(Map<String, Object> spec) {
        String name = getString(spec, "resource_type");
        try {
            return ResourceType.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    /**
     * 支持ISO-8601字符串或epoch秒
     */
    private static Instant getInstant(Map<String, Object> spec, String field) {
        Object value = require(spec, field);
        if (value instanceof Number) {
            return Instant.ofEpochSecond(((Number) value).longValue());
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(
                    String.format("字段 '%s' 不是有效的时间: %s", field, value), e);
        }
    }

    /**
     * 配置异常
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
