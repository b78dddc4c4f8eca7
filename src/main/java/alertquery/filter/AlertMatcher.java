package alertquery.filter;

import alertquery.model.Alert;

/**
 * 自定义过滤逻辑, 抛出的异常原样传递给调用方
 */
@FunctionalInterface
public interface AlertMatcher {
    boolean matches(Alert alert);
}
