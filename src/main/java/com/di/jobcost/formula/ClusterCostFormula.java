package com.di.jobcost.formula;

import com.di.jobcost.pricing.UnitPrice;
import com.di.jobcost.usage.ClusterUsage;
import com.di.jobcost.usage.JobEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * cost = sum over instance types of (price + service fee) x count x hours.
 * Only running instance types (count above zero) are priced. An empty instance map costs 0.0.
 */
@Slf4j
@Component
public class ClusterCostFormula implements CostFormula<ClusterUsage> {

    @Override
    public JobEnvironment getEnvironment() {
        return JobEnvironment.EMR;
    }

    @Override
    public Class<ClusterUsage> getUsageType() {
        return ClusterUsage.class;
    }

    @Override
    public Set<String> resourceClasses(ClusterUsage usage) {
        return usage.runningInstanceCounts().keySet();
    }

    @Override
    public double compute(ClusterUsage usage, double durationSeconds, Map<String, UnitPrice> prices) {
        double hours = CostFormula.hours(durationSeconds);
        double total = 0.0;
        for (Map.Entry<String, Integer> entry : usage.runningInstanceCounts().entrySet()) {
            String instanceType = entry.getKey();
            int count = entry.getValue();
            UnitPrice price = CostFormula.requirePrice(prices, instanceType);
            double cost = price.getTotalPerHour() * count * hours;
            total += cost;
            log.info("[COST] Cluster cost for {}: {} instances at (price: {}, fee: {}) for {} sec = {}",
                    instanceType, count, price.getPricePerHour(), price.getFeePerHour(), durationSeconds,
                    String.format("%.4f", cost));
        }
        return total;
    }
}
