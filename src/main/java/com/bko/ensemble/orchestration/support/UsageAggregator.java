package com.bko.ensemble.orchestration.support;

import com.bko.ensemble.orchestration.model.MessageUsage;
import com.bko.ensemble.orchestration.model.UsageCarrier;
import org.springframework.lang.Nullable;

import java.util.Collection;

public final class UsageAggregator {

    private UsageAggregator() {
    }

    public static MessageUsage aggregate(Collection<? extends UsageCarrier> items, @Nullable MessageUsage... extra) {
        MessageUsage total = MessageUsage.ZERO;
        for (UsageCarrier item : items) {
            if (item != null) {
                total = total.plus(item.usage());
            }
        }
        if (extra != null) {
            for (MessageUsage usage : extra) {
                total = total.plus(usage);
            }
        }
        return total;
    }
}
