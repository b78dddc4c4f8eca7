package alertquery.filter;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * 时间窗口, 两端均包含, 按秒比较
 */
@Value
public class TimeWindow {
    @NonNull
    Instant start;
    @NonNull
    Instant stop;

    public boolean contains(Instant timestamp) {
        if (timestamp == null) {
            return false;
        }
        long seconds = timestamp.getEpochSecond();
        return seconds >= start.getEpochSecond() && seconds <= stop.getEpochSecond();
    }
}
