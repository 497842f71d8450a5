package com.di.jobcost.formula;

import com.di.jobcost.usage.JobEnvironment;
import com.di.jobcost.usage.ResourceUsageRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the {@link CostFormula} for a usage record by its {@link JobEnvironment}.
 * All formula beans are registered at construction; two formulas for one environment is a wiring error.
 */
@Slf4j
@Component
public class CostFormulaRegistry {

    private final Map<JobEnvironment, CostFormula<?>> formulas;

    public CostFormulaRegistry(List<CostFormula<?>> formulas) {
        Map<JobEnvironment, CostFormula<?>> byEnvironment = new EnumMap<>(JobEnvironment.class);
        for (CostFormula<?> formula : formulas) {
            CostFormula<?> previous = byEnvironment.putIfAbsent(formula.getEnvironment(), formula);
            if (previous != null) {
                throw new IllegalStateException("Duplicate cost formula for " + formula.getEnvironment() + ": "
                        + previous.getClass().getSimpleName() + " and " + formula.getClass().getSimpleName());
            }
        }
        this.formulas = Collections.unmodifiableMap(byEnvironment);
        log.info("Registered cost formula(s) for {}", this.formulas.keySet());
    }

    /**
     * @throws IllegalArgumentException when no formula handles the record's environment or type
     */
    @SuppressWarnings("unchecked")
    public <R extends ResourceUsageRecord> CostFormula<R> getFormula(R usage) {
        if (usage == null) {
            throw new IllegalArgumentException("Resource usage record must not be null");
        }
        CostFormula<?> formula = formulas.get(usage.getEnvironment());
        if (formula == null || !formula.getUsageType().isInstance(usage)) {
            throw new IllegalArgumentException("No cost formula for " + usage.getClass().getSimpleName()
                    + " (" + usage.getEnvironment() + ")");
        }
        return (CostFormula<R>) formula;
    }
}
