package org.Aayush.delivery.batch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.delivery.core.PlanningStatus;
import org.Aayush.delivery.model.Demand;

import java.util.List;

/**
 * Pre-route capacity check of a batch.
 */
@Value
@Builder
public class CapacityCheckResult {
    String batchId;
    PlanningStatus status;
    Demand totalDemand;
    /** Whether the batch as a whole needs more than one vehicle. */
    boolean splitRequired;
    @Singular
    List<String> oversizedOrderIds;
    String message;
}
