package com.rescontrol.selection;

import com.rescontrol.admission.AdmissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SelectionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SelectionConfiguration.class);

    /**
     * Catalog seeded from {@code admission.pools}.
     */
    @Bean
    public InMemoryPoolCatalog poolCatalog(AdmissionProperties properties) {
        InMemoryPoolCatalog catalog = new InMemoryPoolCatalog();
        properties.getPools().forEach(definition -> catalog.put(definition.toResourcePool()));
        log.info("Loaded {} resource pools for tenants {}", properties.getPools().size(), catalog.tenants());
        return catalog;
    }

    @Bean
    public FilterEvaluator filterEvaluator() {
        return new InlineFilterEvaluator();
    }

    @Bean
    public PoolSelector poolSelector(PoolCatalog catalog, FilterEvaluator filterEvaluator,
                                     AdmissionProperties properties, Clock clock) {
        return new PoolSelector(catalog, filterEvaluator, properties.getBlockerPolicy(), clock);
    }
}
