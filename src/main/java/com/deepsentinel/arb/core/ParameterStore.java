package com.deepsentinel.arb.core;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.DynamicParameters;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holder of the live {@link DynamicParameters}. Readers always see a complete value.
 */
@Component
public class ParameterStore {

    private final AtomicReference<DynamicParameters> current;

    @Autowired
    public ParameterStore(ArbProperties properties) {
        this(DynamicParameters.builder()
                .minSpreadThreshold(properties.getMonitoring().getMinSpreadThreshold())
                .minProfitThreshold(properties.getMonitoring().getMinProfitThreshold())
                .maxSlippage(properties.getArbitrage().getMaxSlippage())
                .optimalTradeSize(properties.getArbitrage().getDefaultTradeAmount())
                .riskTolerance(properties.getRisk().getInitialTolerance())
                .build());
    }

    public ParameterStore(DynamicParameters initial) {
        this.current = new AtomicReference<>(initial);
    }

    public DynamicParameters get() {
        return current.get();
    }

    public DynamicParameters update(UnaryOperator<DynamicParameters> change) {
        return current.updateAndGet(change);
    }
}
