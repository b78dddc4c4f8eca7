package alertquery.filter;

import alertquery.model.Alert;
import alertquery.model.ResourceType;

import java.util.Objects;

/**
 * 判断单条告警是否满足过滤条件
 */
public final class FilterMatcher {

    private FilterMatcher() {
    }

    public static boolean match(AlertFilter filter, Alert alert) {
        FilterKind kind = filter.getKind();
        if (kind == null) {
            throw new UnknownFilterKindException(null);
        }

        switch (kind) {
            case CUSTOM:
                return filter.valueAs(AlertMatcher.class).matches(alert);
            case TIME:
                return filter.valueAs(TimeWindow.class).contains(alert.getTimestamp());
            case ALERT_TYPE:
                return alert.getAlertType() == filter.valueAs(Long.class);
            case RESOURCE_ID:
                return Objects.equals(alert.getResourceId(), filter.valueAs(String.class));
            case COUNT:
                return alert.getCount() == filter.valueAs(Long.class);
            case QUERY_RESOURCE_TYPE:
                return alert.getResource() == filter.valueAs(ResourceType.class);
            case QUERY_ALERT_TYPE: {
                AlertTypeKey key = filter.valueAs(AlertTypeKey.class);
                return alert.getAlertType() == key.getAlertType()
                        && alert.getResource() == key.getResourceType();
            }
            case QUERY_RESOURCE_ID: {
                ResourceKey key = filter.valueAs(ResourceKey.class);
                return alert.getAlertType() == key.getAlertType()
                        && alert.getResource() == key.getResourceType()
                        && Objects.equals(alert.getResourceId(), key.getResourceId());
            }
            default:
                throw new UnknownFilterKindException(kind);
        }
    }
}
