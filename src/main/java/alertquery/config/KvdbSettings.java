package alertquery.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class KvdbSettings {

    @Value("${alerts.kvdb.root:alerts}")
    public String alertsRoot;
}
