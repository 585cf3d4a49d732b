package me.golemcore.tokens.port.outbound;

import me.golemcore.tokens.domain.model.Cost;
import me.golemcore.tokens.domain.model.ModelPricing;
import me.golemcore.tokens.domain.model.UsageRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Model pricing lookup.
 *
 * @since 1.0
 */
public interface PricingLookup {

    Optional<ModelPricing> find(String model);

    default Cost costForRecord(UsageRecord record) {
        return find(record.getModel())
                .map(pricing -> pricing.costOf(record))
                .orElse(Cost.undefined());
    }

    /**
     * @return sorted distinct model ids with no pricing entry
     */
    default List<String> unpricedModels(Collection<UsageRecord> records) {
        TreeSet<String> unpriced = new TreeSet<>();
        for (UsageRecord record : records) {
            if (find(record.getModel()).isEmpty()) {
                unpriced.add(record.getModel());
            }
        }
        return List.copyOf(unpriced);
    }
}
