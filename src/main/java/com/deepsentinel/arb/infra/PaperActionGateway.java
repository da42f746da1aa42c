package com.deepsentinel.arb.infra;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.core.ActionGateway;
import com.deepsentinel.arb.core.ParameterStore;
import com.deepsentinel.arb.domain.ArbitrageAction;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.SimulationResult;
import com.deepsentinel.arb.domain.SubmissionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fills trades on paper against the snapshot prices. Price impact is modelled as
 * {@code tradeSize / minLiquidity}; fills whose impact exceeds the live slippage cap fail simulation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "arb.execution", name = "mode", havingValue = "paper", matchIfMissing = true)
public class PaperActionGateway implements ActionGateway {

    private final ArbProperties properties;
    private final ParameterStore parameterStore;
    private final Clock clock;

    private final AtomicLong fills = new AtomicLong();

    @Override
    public ArbitrageAction buildAction(ArbitrageOpportunity opportunity, double tradeSize) {
        String payload = String.format("paper:buy=%s@%.6f:sell=%s@%.6f:size=%.4f",
                opportunity.buyPool().getPoolId(), opportunity.buyPrice(),
                opportunity.sellPool().getPoolId(), opportunity.sellPrice(), tradeSize);
        return ArbitrageAction.builder()
                .opportunityId(opportunity.getId())
                .opportunity(opportunity)
                .tradeSize(tradeSize)
                .payload(payload)
                .builtAt(clock.instant())
                .build();
    }

    @Override
    public SimulationResult simulate(ArbitrageAction action) {
        ArbitrageOpportunity opp = action.getOpportunity();
        double size = action.getTradeSize();
        if (size <= 0) {
            return SimulationResult.failed("Trade size must be positive");
        }
        double slippage = priceImpact(opp, size);
        double maxSlippage = parameterStore.get().getMaxSlippage();
        if (slippage > maxSlippage) {
            return SimulationResult.failed(String.format("Slippage %.4f exceeds limit %.4f", slippage, maxSlippage));
        }

        double gas = properties.getArbitrage().getGasEstimate();
        return SimulationResult.builder()
                .success(true)
                .estimatedProfit(netBeforeGas(opp, size, slippage) - gas)
                .estimatedGas(gas)
                .estimatedSlippage(slippage)
                .build();
    }

    @Override
    public SubmissionResult submit(ArbitrageAction action) {
        ArbitrageOpportunity opp = action.getOpportunity();
        double size = action.getTradeSize();
        double realized = netBeforeGas(opp, size, priceImpact(opp, size));
        String fillId = "paper-" + fills.incrementAndGet();

        log.info("[PAPER-EXECUTION] {} filled {} units: buy {} @ {} sell {} @ {} -> {}", fillId, size,
                opp.buyPool().getPoolId(), opp.buyPrice(), opp.sellPool().getPoolId(), opp.sellPrice(),
                String.format("%.4f", realized));
        return SubmissionResult.builder()
                .success(true)
                .referenceId(fillId)
                .realizedProfit(realized)
                .gasCost(properties.getArbitrage().getGasEstimate())
                .build();
    }

    private static double priceImpact(ArbitrageOpportunity opp, double size) {
        double liquidity = opp.minLiquidity();
        return liquidity <= 0 ? Double.POSITIVE_INFINITY : size / liquidity;
    }

    // Spread capture less flash-loan fee and price impact
    private double netBeforeGas(ArbitrageOpportunity opp, double size, double slippage) {
        double gross = size * opp.getSpread();
        double fee = size * properties.getArbitrage().getFlashLoanFeeRate();
        return gross - fee - gross * slippage;
    }
}
