package alertquery.filter;

import alertquery.model.Alert;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 可排序的过滤器列表
 *
 * <p>排序按过滤器类型优先级进行, 同类型保持原有顺序.
 */
public final class Filters implements Iterable<AlertFilter> {

    public static final Comparator<AlertFilter> BY_KIND_PRIORITY =
            Comparator.comparing(AlertFilter::getKind, Comparator.nullsLast(FilterKind.BY_PRIORITY));

    private static final Filters EMPTY = new Filters(ImmutableList.of());

    private final ImmutableList<AlertFilter> filters;

    private Filters(ImmutableList<AlertFilter> filters) {
        this.filters = filters;
    }

    public static Filters of(AlertFilter... filters) {
        return filters == null || filters.length == 0 ? EMPTY : of(Arrays.asList(filters));
    }

    public static Filters of(Collection<AlertFilter> filters) {
        return new Filters(ImmutableList.copyOf(filters));
    }

    public static Filters empty() {
        return EMPTY;
    }

    public Filters sorted() {
        return new Filters(ImmutableList.sortedCopyOf(BY_KIND_PRIORITY, filters));
    }

    public List<AlertFilter> queryFilters() {
        return filters.stream().filter(AlertFilter::isQueryCapable).collect(ImmutableList.toImmutableList());
    }

    public List<AlertFilter> postFilters() {
        return filters.stream().filter(f -> !f.isQueryCapable()).collect(ImmutableList.toImmutableList());
    }

    /**
     * 告警需满足全部过滤器, 任一过滤器出错直接抛出
     */
    public boolean matchAll(Alert alert) {
        for (AlertFilter filter : filters) {
            if (!filter.match(alert)) {
                return false;
            }
        }
        return true;
    }

    public List<AlertFilter> asList() {
        return filters;
    }

    public int size() {
        return filters.size();
    }

    public boolean isEmpty() {
        return filters.isEmpty();
    }

    @Override
    public Iterator<AlertFilter> iterator() {
        return filters.iterator();
    }

    @Override
    public String toString() {
        return filters.stream().map(f -> String.valueOf(f.getKind())).collect(Collectors.joining(",", "[", "]"));
    }
}
