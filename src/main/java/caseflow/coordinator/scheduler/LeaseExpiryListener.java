package caseflow.coordinator.scheduler;

import caseflow.coordinator.model.Job;

/**
 * Told about each job whose lease the reaper expired, after the job was failed.
 */
@FunctionalInterface
public interface LeaseExpiryListener {

    LeaseExpiryListener NONE = job -> {
    };

    void onLeaseExpired(Job job);
}
