package caseflow.coordinator.service;

import caseflow.coordinator.model.Job;

/**
 * Processes one claimed job. Returning normally completes the job with the
 * returned result JSON (may be null); throwing records a failed attempt.
 */
@FunctionalInterface
public interface JobHandler {

    String handle(Job job) throws Exception;
}
