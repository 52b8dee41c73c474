package org.Aayush.delivery.batch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.delivery.core.PlanningStatus;

import java.util.List;

/**
 * Result of turning a batch into routes.
 */
@Value
@Builder
public class BatchRouteResult {
    String batchId;
    PlanningStatus status;
    /** Primary route first, then sub-routes created by an intake split. */
    @Singular
    List<Long> routeIds;
    /** Orders that alone exceed vehicle capacity. */
    @Singular
    List<String> oversizedOrderIds;
    String message;
}
