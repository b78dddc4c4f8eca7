package alertquery.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 告警记录 - 由告警产生方写入, 过滤与查询只读取
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    private String id;
    private long alertType;
    private ResourceType resource;
    private String resourceId;
    private long count;
    private Instant timestamp;

    // 以下字段不参与过滤
    private Severity severity;
    private String message;
    private boolean cleared;
    private long ttl;
    private String uniqueTag;
}
