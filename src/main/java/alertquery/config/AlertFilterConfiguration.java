package alertquery.config;

import alertquery.filter.AlertKeys;
import alertquery.store.AlertStore;
import alertquery.store.InMemoryKvStore;
import alertquery.store.KvStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AlertFilterConfiguration {

    @Autowired
    private KvdbSettings kvdbSettings;

    @Bean
    public AlertKeys alertKeys() {
        log.info("告警根路径: {}", kvdbSettings.alertsRoot);
        return new AlertKeys(kvdbSettings.alertsRoot);
    }

    @Bean
    @ConditionalOnMissingBean(KvStore.class)
    public KvStore kvStore() {
        return new InMemoryKvStore();
    }

    @Bean
    public AlertStore alertStore(KvStore kvStore, AlertKeys alertKeys) {
        return new AlertStore(kvStore, alertKeys);
    }
}
