package alertquery.filter;

import alertquery.model.Alert;
import alertquery.model.ResourceType;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 告警存储键 - 负责告警数据键的生成, 以及根据过滤器计算需要遍历的最小子树集合
 *
 * <p>键结构: {@code <root>/<resourceType>/<alertType>/<resourceId>/data},
 * alertType 以十六进制表示, resourceId 原样使用.
 */
@Slf4j
public class AlertKeys {
    public static final String DEFAULT_ROOT = "alerts";

    private static final String SEPARATOR = "/";
    private static final String DATA = "data";
    private static final Joiner JOINER = Joiner.on(SEPARATOR);

    private final String root;

    public AlertKeys() {
        this(DEFAULT_ROOT);
    }

    public AlertKeys(String root) {
        String stripped = StringUtils.strip(root, SEPARATOR);
        checkArgument(StringUtils.isNotBlank(stripped), "告警根路径不能为空");
        this.root = stripped;
    }

    public String getRoot() {
        return root;
    }

    /**
     * 告警记录的完整数据键
     */
    public String keyOf(Alert alert) {
        return dataKey(alert.getResource(), alert.getAlertType(), alert.getResourceId());
    }

    public String dataKey(ResourceType resourceType, long alertType, String resourceId) {
        return JOINER.join(root, resourceType.getPathSegment(), alertTypeSegment(alertType), resourceId, DATA);
    }

    public Set<String> fromFilters(AlertFilter... filters) {
        return fromFilters(Filters.of(filters));
    }

    public Set<String> fromFilters(Collection<AlertFilter> filters) {
        return fromFilters(Filters.of(filters));
    }

    /**
     * 计算需要遍历的键集合, 集合中任意两个键互不为祖先.
     *
     * <p>没有过滤器或只有不可查询的过滤器时返回根路径.
     */
    public Set<String> fromFilters(Filters filters) {
        Set<String> candidates = new TreeSet<>();
        for (AlertFilter filter : filters.sorted()) {
            if (filter.isQueryCapable()) {
                candidates.add(keyOf(filter));
            }
        }

        if (candidates.isEmpty()) {
            log.debug("过滤器 {} 无法缩小查询范围, 遍历全部告警", filters);
            return ImmutableSortedSet.of(root);
        }

        // 已有祖先键时, 子树键重复读取同一批告警
        ImmutableSortedSet.Builder<String> keys = ImmutableSortedSet.naturalOrder();
        for (String key : candidates) {
            boolean covered = false;
            for (String other : candidates) {
                if (isAncestor(other, key)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                keys.add(key);
            }
        }

        Set<String> result = keys.build();
        log.debug("过滤器 {} 对应查询键: {}", filters, result);
        return result;
    }

    /**
     * 可查询过滤器对应的子树键, 使用过滤器自身的取值构造全部层级
     */
    String keyOf(AlertFilter filter) {
        switch (filter.getKind()) {
            case QUERY_RESOURCE_TYPE: {
                ResourceType resourceType = filter.valueAs(ResourceType.class);
                return JOINER.join(root, resourceType.getPathSegment());
            }
            case QUERY_ALERT_TYPE: {
                AlertTypeKey key = filter.valueAs(AlertTypeKey.class);
                return JOINER.join(root, key.getResourceType().getPathSegment(),
                        alertTypeSegment(key.getAlertType()));
            }
            case QUERY_RESOURCE_ID: {
                ResourceKey key = filter.valueAs(ResourceKey.class);
                if (key.getResourceId().isEmpty()) {
                    throw new ValueShapeMismatchException(filter.getKind(), ResourceKey.class, key);
                }
                return JOINER.join(root, key.getResourceType().getPathSegment(),
                        alertTypeSegment(key.getAlertType()), key.getResourceId());
            }
            default:
                return root;
        }
    }

    /**
     * ancestor 是否为 key 的严格祖先路径
     */
    public static boolean isAncestor(String ancestor, String key) {
        return key.length() > ancestor.length()
                && key.startsWith(ancestor)
                && key.charAt(ancestor.length()) == '/';
    }

    private static String alertTypeSegment(long alertType) {
        return Long.toString(alertType, 16);
    }
}
