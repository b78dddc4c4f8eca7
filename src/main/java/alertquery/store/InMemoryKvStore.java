package alertquery.store;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 内存实现的键值存储
 */
@Slf4j
public class InMemoryKvStore implements KvStore {
    private final ConcurrentNavigableMap<String, String> entries = new ConcurrentSkipListMap<>();

    @Override
    public void put(String key, String value) {
        entries.put(key, value);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Map<String, String> enumerate(String prefix) {
        Map<String, String> result = new LinkedHashMap<>();
        String childPrefix = prefix + "/";
        for (Map.Entry<String, String> entry : entries.tailMap(prefix, true).entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(prefix)) {
                break;
            }
            if (key.equals(prefix) || key.startsWith(childPrefix)) {
                result.put(key, entry.getValue());
            }
        }
        log.trace("遍历前缀 {} 得到 {} 条记录", prefix, result.size());
        return result;
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    public int size() {
        return entries.size();
    }
}
