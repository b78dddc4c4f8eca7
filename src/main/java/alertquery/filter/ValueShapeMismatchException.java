package alertquery.filter;

import lombok.Getter;

/**
 * 过滤器的取值与其类型要求的结构不一致
 */
@Getter
public class ValueShapeMismatchException extends AlertException {
    private final FilterKind kind;
    private final Class<?> expectedType;

    public ValueShapeMismatchException(FilterKind kind, Class<?> expectedType, Object actual) {
        super(String.format("过滤器 %s 需要 %s 类型的值, 实际为: %s",
                kind, expectedType.getSimpleName(),
                actual == null ? "null" : actual.getClass().getName()));
        this.kind = kind;
        this.expectedType = expectedType;
    }
}
