package com.meltwater.rxinflight.impl;

import com.google.common.collect.Collections2;
import com.meltwater.rxinflight.util.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps track of the delivery tags that have been dispatched but not yet acked or nacked.
 *
 * Removal is by exact tag, so deliveries may complete in any order.
 * All methods are safe to call concurrently and none of them block.
 */
public class DeliveryTracker {

    private static final Logger log = new Logger(DeliveryTracker.class);

    //deliveryTag -> time received
    private final Map<Long, Long> outstanding = new ConcurrentHashMap<>();

    /**
     * @return false if the tag was already outstanding, in which case nothing changes
     */
    public boolean record(long deliveryTag) {
        boolean added = outstanding.putIfAbsent(deliveryTag, System.currentTimeMillis()) == null;
        if (!added) {
            log.warnWithParams("Delivery tag is already outstanding, ignoring duplicate record.",
                    "deliveryTag", deliveryTag);
        }
        return added;
    }

    /**
     * @return false if the tag was not outstanding, in which case nothing changes
     */
    public boolean clear(long deliveryTag) {
        boolean removed = outstanding.remove(deliveryTag) != null;
        if (!removed) {
            log.debugWithParams("Delivery tag is not outstanding, ignoring clear.",
                    "deliveryTag", deliveryTag,
                    "outstanding", outstanding.size());
        }
        return removed;
    }

    public int outstandingCount() {
        return outstanding.size();
    }

    public boolean isOutstanding(long deliveryTag) {
        return outstanding.containsKey(deliveryTag);
    }

    /**
     * @return the number of outstanding deliveries that were recorded more than ageMillis ago
     */
    public int outstandingOlderThan(long ageMillis) {
        final long threshold = System.currentTimeMillis() - ageMillis;
        return Collections2.filter(outstanding.values(), recordedAt -> recordedAt <= threshold).size();
    }

    @Override
    public String toString() {
        return "DeliveryTracker{outstanding=" + outstanding.size() + "}";
    }
}
