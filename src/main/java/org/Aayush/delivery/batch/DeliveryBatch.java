package org.Aayush.delivery.batch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.delivery.model.Vehicle;

import java.util.List;

/**
 * Picking batch: orders released together and the vehicle planned for them.
 */
@Value
@Builder
public class DeliveryBatch {
    String batchId;
    /** Planned vehicle, may be null. */
    Vehicle vehicle;
    @Singular
    List<DeliveryOrder> orders;
}
