package alertquery.store;

import java.util.Map;
import java.util.Optional;

/**
 * 层级键值存储接口, 键以 '/' 分隔
 */
public interface KvStore {
    /**
     * 写入键值
     */
    void put(String key, String value);

    /**
     * 读取键值
     */
    Optional<String> get(String key);

    /**
     * 遍历前缀下的所有键值, 包括前缀本身及其子树, 按键排序
     */
    Map<String, String> enumerate(String prefix);

    /**
     * 删除键
     */
    boolean delete(String key);
}
