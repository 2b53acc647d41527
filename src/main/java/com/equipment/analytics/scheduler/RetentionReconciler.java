package com.equipment.analytics.scheduler;

import com.equipment.analytics.service.RetentionManager;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Periodically re-applies the retention limit to owners holding more datasets
 * than {@code equipment.retention.max-datasets} allows.
 *
 * <p>Ingest already evicts within its own transaction, so this only matters
 * after the limit has been lowered: owners who have not uploaded since keep
 * their old, larger retention set until this job trims it.
 *
 * <p>Each owner is reconciled independently so that a single failure cannot
 * block the rest of the batch.
 */
@Singleton
public class RetentionReconciler {

    private static final Logger log = LoggerFactory.getLogger(RetentionReconciler.class);

    @Inject
    private RetentionManager retentionManager;

    // -----------------------------------------------------------------------
    // Scheduled task
    // -----------------------------------------------------------------------

    /**
     * The {@code initialDelay} gives Flyway time to migrate before the first run.
     */
    @Scheduled(fixedDelay = "${equipment.retention.reconcile-interval:1h}", initialDelay = "30s")
    public void reconcileOwners() {
        List<String> owners;
        try {
            owners = retentionManager.findOwnersOverLimit();
        } catch (Exception e) {
            log.error("RetentionReconciler failed to query owners over limit: {}", e.getMessage(), e);
            return;
        }

        if (owners.isEmpty()) {
            log.debug("RetentionReconciler found no owners over limit={}", retentionManager.getMaxDatasets());
            return;
        }

        log.info("RetentionReconciler found {} owners over limit={}", owners.size(), retentionManager.getMaxDatasets());
        int evicted = 0;
        int failed = 0;
        for (String ownerId : owners) {
            try {
                evicted += retentionManager.reconcile(ownerId);
            } catch (Exception e) {
                failed++;
                log.error("RetentionReconciler failed for owner={}: {}", ownerId, e.getMessage(), e);
            }
        }
        log.info("RetentionReconciler completed: owners={} evicted={} failed={}", owners.size(), evicted, failed);
    }
}
