package alertquery.filter;

import lombok.Getter;

import java.util.Comparator;

/**
 * 过滤器类型
 *
 * <p>排序优先级决定过滤器的处理顺序. 存储中的告警按
 * {@code <root>/<resourceType>/<alertType>/<resourceId>/data} 组织,
 * 可查询类型的 treeDepth 即其能定位到的子树层级, 按优先级升序处理时层级由浅到深.
 * 其余类型不能缩小查询范围, 只在取出记录后逐条匹配.
 */
@Getter
public enum FilterKind {
    CUSTOM(0, 0),
    TIME(1, 0),
    ALERT_TYPE(2, 0),
    RESOURCE_ID(3, 0),
    COUNT(4, 0),
    QUERY_RESOURCE_TYPE(5, 1),
    QUERY_ALERT_TYPE(6, 2),
    QUERY_RESOURCE_ID(7, 3);

    public static final Comparator<FilterKind> BY_PRIORITY = Comparator.comparingInt(FilterKind::getPriority);

    private final int priority;
    private final int treeDepth;

    FilterKind(int priority, int treeDepth) {
        this.priority = priority;
        this.treeDepth = treeDepth;
    }

    public boolean isQueryCapable() {
        return treeDepth > 0;
    }

    /**
     * 按名称解析, 忽略大小写, 允许使用 '-' 代替 '_'
     */
    public static FilterKind fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().replace('-', '_');
        for (FilterKind kind : values()) {
            if (kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
