package caseflow.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("environment") String environment,
        @JsonProperty("statusChannel") String statusChannel,
        @JsonProperty("pendingJobs") Integer pendingJobs,
        @JsonProperty("processingJobs") Integer processingJobs,
        @JsonProperty("failedJobs") Integer failedJobs) {

    public static HealthResponse healthy(String uptime, String version, String environment, String statusChannel,
            int pendingJobs, int processingJobs, int failedJobs) {
        return new HealthResponse("healthy", "ok", uptime, version, environment, statusChannel,
                pendingJobs, processingJobs, failedJobs);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null, null);
    }
}
