package com.optionsvalidator.risk;

import org.springframework.stereotype.Component;

/** Opens independent {@link RiskMonitor} sessions sharing the configured limits. */
@Component
public class RiskMonitorFactory {

    private final RiskLimits riskLimits;
    private final VaRCalculator varCalculator;

    public RiskMonitorFactory(RiskLimits riskLimits, VaRCalculator varCalculator) {
        this.riskLimits = riskLimits;
        this.varCalculator = varCalculator;
    }

    public RiskMonitor create() {
        return new RiskMonitor(riskLimits, varCalculator);
    }

    public RiskMonitor create(RiskLimits limits) {
        return new RiskMonitor(limits, varCalculator);
    }
}
