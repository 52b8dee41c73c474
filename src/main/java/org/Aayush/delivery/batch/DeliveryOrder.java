package org.Aayush.delivery.batch;

import lombok.Builder;
import lombok.Value;
import org.Aayush.delivery.geo.Coordinate;
import org.Aayush.delivery.model.Demand;

import java.time.Instant;

/**
 * One picked order handed over by the warehouse for delivery.
 */
@Value
@Builder
public class DeliveryOrder {
    String orderId;
    String customerId;
    /** Delivery address coordinate of the customer. */
    Coordinate location;
    /** Coverage area code; when null the customer's registered area is used. */
    String areaCode;
    @Builder.Default
    Demand demand = Demand.ZERO;
    /** Deadline or scheduled date, used as the stop's window start. */
    Instant deadline;
    /** Sales priority {@code 0..4}, higher is more urgent. */
    int priority;
}
