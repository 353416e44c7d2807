package caseflow.coordinator.repository;

import caseflow.coordinator.model.Admission;
import caseflow.coordinator.model.RateWindow;

import java.util.Optional;

/**
 * Shared rate-window state. Admission must be an increment-if-under-limit
 * conditional update so concurrent callers cannot over-admit.
 */
public interface RateWindowRepository {

    /**
     * Try to admit one call.
     *
     * @param resourceKey    external resource (model name, service name)
     * @param nowMillis      current time, epoch millis
     * @param requestLimit   requests allowed per window
     * @param tokenLimit     token estimate allowed per window
     * @param tokens         token estimate of this call
     * @param minDelayMillis minimum gap since the previous admitted call
     * @param windowMillis   window length
     * @return granted, or how long to wait before re-evaluating
     */
    Admission tryAdmit(String resourceKey, long nowMillis, int requestLimit, long tokenLimit, long tokens,
            long minDelayMillis, long windowMillis);

    Optional<RateWindow> find(String resourceKey);
}
