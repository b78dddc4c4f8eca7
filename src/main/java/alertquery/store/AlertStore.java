package alertquery.store;

import alertquery.filter.AlertException;
import alertquery.filter.AlertFilter;
import alertquery.filter.AlertKeys;
import alertquery.filter.Filters;
import alertquery.model.Alert;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 告警存储 - 负责告警的写入、按过滤器查询与删除
 *
 * <p>查询时先由 {@link AlertKeys} 计算需要遍历的子树, 再对取出的每条记录应用全部过滤器.
 */
public class AlertStore {
    private static final Logger logger = LoggerFactory.getLogger(AlertStore.class);

    private static final String DATA_SUFFIX = "/data";
    private static final Comparator<Alert> BY_TIMESTAMP =
            Comparator.comparing(Alert::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final KvStore kvStore;
    private final AlertKeys alertKeys;
    private final ObjectMapper objectMapper;

    public AlertStore(KvStore kvStore, AlertKeys alertKeys) {
        this.kvStore = kvStore;
        this.alertKeys = alertKeys;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 写入告警. 同一数据键下已有记录时累加计数并沿用原ID
     */
    public synchronized Alert raise(Alert alert) {
        checkNotNull(alert.getResource(), "resource");
        checkArgument(StringUtils.isNotEmpty(alert.getResourceId()), "resourceId不能为空");

        String key = alertKeys.keyOf(alert);
        Alert.AlertBuilder builder = alert.toBuilder();
        if (alert.getTimestamp() == null) {
            builder.timestamp(Instant.now());
        }

        Optional<Alert> existing = kvStore.get(key).flatMap(value -> decode(key, value));
        if (existing.isPresent()) {
            builder.id(existing.get().getId()).count(existing.get().getCount() + 1);
        } else {
            builder.id(StringUtils.defaultIfEmpty(alert.getId(), UUID.randomUUID().toString())).count(1);
        }

        Alert stored = builder.build();
        kvStore.put(key, encode(stored));
        logger.debug("告警已写入: {} count={}", key, stored.getCount());
        return stored;
    }

    /**
     * 查询满足全部过滤器的告警, 按时间排序
     */
    public List<Alert> enumerate(AlertFilter... filters) {
        Filters all = Filters.of(filters);
        Set<String> keys = alertKeys.fromFilters(all);

        List<Alert> alerts = new ArrayList<>();
        for (String key : keys) {
            for (Map.Entry<String, String> entry : kvStore.enumerate(key).entrySet()) {
                if (!entry.getKey().endsWith(DATA_SUFFIX)) {
                    continue;
                }
                Optional<Alert> alert = decode(entry.getKey(), entry.getValue());
                if (alert.isPresent() && all.matchAll(alert.get())) {
                    alerts.add(alert.get());
                }
            }
        }

        alerts.sort(BY_TIMESTAMP);
        logger.debug("查询键 {} 共匹配 {} 条告警", keys, alerts.size());
        return alerts;
    }

    /**
     * 在内存中过滤告警列表
     */
    public List<Alert> filter(List<Alert> alerts, AlertFilter... filters) {
        Filters all = Filters.of(filters);
        List<Alert> matched = new ArrayList<>();
        for (Alert alert : alerts) {
            if (all.matchAll(alert)) {
                matched.add(alert);
            }
        }
        return matched;
    }

    /**
     * 删除满足全部过滤器的告警, 返回删除数量
     */
    public synchronized int delete(AlertFilter... filters) {
        int deleted = 0;
        for (Alert alert : enumerate(filters)) {
            if (kvStore.delete(alertKeys.keyOf(alert))) {
                deleted++;
            }
        }
        logger.info("已删除 {} 条告警", deleted);
        return deleted;
    }

    private String encode(Alert alert) {
        try {
            return objectMapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new AlertException("告警序列化失败: " + alert.getId(), e);
        }
    }

    private Optional<Alert> decode(String key, String value) {
        try {
            return Optional.of(objectMapper.readValue(value, Alert.class));
        } catch (JsonProcessingException e) {
            logger.warn("无法解析告警记录, 已跳过: {}", key, e);
            return Optional.empty();
        }
    }
}
