package alertquery.filter;

import lombok.Getter;

/**
 * 过滤器类型不在已知类型之内
 */
@Getter
public class UnknownFilterKindException extends AlertException {
    private final FilterKind kind;

    public UnknownFilterKindException(FilterKind kind) {
        super("无效的过滤器类型: " + kind);
        this.kind = kind;
    }
}
