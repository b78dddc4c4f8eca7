package alertquery.filter;

import alertquery.model.Alert;
import alertquery.model.ResourceType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * 告警过滤器 - 过滤器类型和对应取值的不可变组合
 *
 * <p>通过类型化的工厂方法创建的过滤器取值一定符合类型要求;
 * {@link #of(FilterKind, Object)} 不做校验, 取值不符时在匹配或计算查询键时抛出
 * {@link ValueShapeMismatchException}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AlertFilter {
    private final FilterKind kind;
    private final Object value;

    private AlertFilter(FilterKind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static AlertFilter of(FilterKind kind, Object value) {
        return new AlertFilter(kind, value);
    }

    public static AlertFilter custom(AlertMatcher matcher) {
        return new AlertFilter(FilterKind.CUSTOM, checkNotNull(matcher, "matcher"));
    }

    public static AlertFilter time(Instant start, Instant stop) {
        checkNotNull(start, "start");
        checkNotNull(stop, "stop");
        checkArgument(!stop.isBefore(start), "时间窗口结束早于开始: %s > %s", start, stop);
        return new AlertFilter(FilterKind.TIME, new TimeWindow(start, stop));
    }

    public static AlertFilter alertType(long alertType) {
        return new AlertFilter(FilterKind.ALERT_TYPE, alertType);
    }

    public static AlertFilter resourceId(String resourceId) {
        return new AlertFilter(FilterKind.RESOURCE_ID, checkNotNull(resourceId, "resourceId"));
    }

    public static AlertFilter count(long count) {
        return new AlertFilter(FilterKind.COUNT, count);
    }

    public static AlertFilter queryResourceType(ResourceType resourceType) {
        return new AlertFilter(FilterKind.QUERY_RESOURCE_TYPE, checkNotNull(resourceType, "resourceType"));
    }

    public static AlertFilter queryAlertType(long alertType, ResourceType resourceType) {
        checkNotNull(resourceType, "resourceType");
        return new AlertFilter(FilterKind.QUERY_ALERT_TYPE, new AlertTypeKey(alertType, resourceType));
    }

    public static AlertFilter queryResourceId(String resourceId, ResourceType resourceType, long alertType) {
        checkArgument(StringUtils.isNotEmpty(resourceId), "resourceId不能为空");
        checkNotNull(resourceType, "resourceType");
        return new AlertFilter(FilterKind.QUERY_RESOURCE_ID, new ResourceKey(alertType, resourceType, resourceId));
    }

    public boolean isQueryCapable() {
        return kind != null && kind.isQueryCapable();
    }

    public boolean match(Alert alert) {
        return FilterMatcher.match(this, alert);
    }

    /**
     * 按指定类型取值, 不符时抛出 {@link ValueShapeMismatchException}
     */
    <T> T valueAs(Class<T> type) {
        if (!type.isInstance(value)) {
            throw new ValueShapeMismatchException(kind, type, value);
        }
        return type.cast(value);
    }
}
