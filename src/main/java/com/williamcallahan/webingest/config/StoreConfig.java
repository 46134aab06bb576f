package com.williamcallahan.webingest.config;

import com.williamcallahan.webingest.store.InMemoryWebContentStore;
import com.williamcallahan.webingest.store.MongoWebContentStore;
import com.williamcallahan.webingest.store.WebContentStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Selects the content store from {@code app.store.type}. The store handle is owned by the
 * application context and released when the context closes.
 */
@Configuration
public class StoreConfig {
    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public Clock storeClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
    public WebContentStore mongoWebContentStore(MongoTemplate mongoTemplate, AppProperties appProperties, Clock storeClock) {
        log.info("Content store: MongoDB database '{}', collection '{}'",
            mongoTemplate.getDb().getName(), appProperties.getStore().getCollection());
        return new MongoWebContentStore(mongoTemplate, appProperties, storeClock);
    }

    @Bean
    @ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
    public WebContentStore inMemoryWebContentStore(Clock storeClock) {
        return new InMemoryWebContentStore(storeClock);
    }
}
