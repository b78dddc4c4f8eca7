package alertquery.model;

import lombok.Getter;

/**
 * 告警所属资源类型
 */
@Getter
public enum ResourceType {
    NONE("None"),
    VOLUME("Volume"),
    NODE("Node"),
    CLUSTER("Cluster"),
    DRIVE("Drive");

    // 存储路径中使用的名称
    private final String pathSegment;

    ResourceType(String pathSegment) {
        this.pathSegment = pathSegment;
    }

    /**
     * 按名称解析, 同时接受枚举名和路径名(忽略大小写)
     */
    public static ResourceType fromName(String name) {
        for (ResourceType type : values()) {
            if (type.name().equalsIgnoreCase(name) || type.pathSegment.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的资源类型: " + name);
    }
}
