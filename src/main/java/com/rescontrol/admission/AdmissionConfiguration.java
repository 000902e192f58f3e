package com.rescontrol.admission;

import com.rescontrol.ledger.ResourceBackup;
import com.rescontrol.ledger.UsageLedger;
import com.rescontrol.ledger.UsageSweeper;
import com.rescontrol.lock.LockManager;
import com.rescontrol.observer.AsyncObserverHook;
import com.rescontrol.observer.ResourceEventListener;
import com.rescontrol.selection.PoolCatalog;
import com.rescontrol.store.ResourceStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
@EnableConfigurationProperties(AdmissionProperties.class)
public class AdmissionConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One ledger per application context; its lifecycle is the service's.
     */
    @Bean
    public UsageLedger usageLedger(ResourceStore store, Clock clock) {
        return new UsageLedger(store, clock);
    }

    @Bean
    public ResourceBackup resourceBackup(ResourceStore store, UsageLedger ledger, LockManager lockManager,
                                         AdmissionProperties properties, Clock clock) {
        return new ResourceBackup(store, ledger, lockManager, properties.getLockTimeout(),
            properties.getStore().isDeferred(), clock);
    }

    @Bean
    public UsageSweeper usageSweeper(UsageLedger ledger, LockManager lockManager, ResourceBackup backup,
                                     PoolCatalog catalog, AdmissionProperties properties, Clock clock) {
        return new UsageSweeper(ledger, lockManager, backup, catalog, properties.getLockTimeout(), clock);
    }

    @Bean
    public AsyncObserverHook observerHook(List<ResourceEventListener> listeners, AdmissionProperties properties) {
        return new AsyncObserverHook(listeners, properties.getObserver().getQueueCapacity());
    }
}
