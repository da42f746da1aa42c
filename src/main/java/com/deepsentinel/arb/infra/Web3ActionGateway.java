package com.deepsentinel.arb.infra;

import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.core.ActionGateway;
import com.deepsentinel.arb.domain.ArbitrageAction;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.SimulationResult;
import com.deepsentinel.arb.domain.SubmissionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.StaticGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Executes through an on-chain executor contract exposing
 * {@code executeArbitrage(address buyPool, address sellPool, uint256 amount) returns (uint256 profit)}
 * and emitting {@code ArbitrageExecuted(uint256 profit)}. Pool ids are pool contract addresses.
 *
 * <p>Without a private key the gateway is WATCH-ONLY: simulation still runs, submission is refused.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "arb.execution", name = "mode", havingValue = "chain")
public class Web3ActionGateway implements ActionGateway {

    static final String EXECUTE_FUNCTION = "executeArbitrage";

    static final Event ARBITRAGE_EXECUTED = new Event("ArbitrageExecuted",
            Collections.<TypeReference<?>>singletonList(new TypeReference<Uint256>() {
            }));

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Web3j web3j;
    private final Credentials credentials;
    private final ArbProperties.Chain chain;
    private final Clock clock;
    private final StaticGasProvider gasProvider;

    @Autowired
    public Web3ActionGateway(@Value("${app.private-key:}") String privateKey, ArbProperties properties,
            Clock clock) {
        this(Web3j.build(new HttpService(properties.getChain().getRpcUrl())), privateKey, properties, clock);
    }

    Web3ActionGateway(Web3j web3j, String privateKey, ArbProperties properties, Clock clock) {
        this.web3j = web3j;
        this.chain = properties.getChain();
        this.clock = clock;

        if (chain.getExecutorAddress() == null || chain.getExecutorAddress().isBlank()) {
            throw new IllegalStateException("arb.chain.executor-address is required in chain mode");
        }
        this.gasProvider = new StaticGasProvider(
                BigInteger.valueOf(chain.getGasPriceGwei()).multiply(BigInteger.valueOf(1_000_000_000L)),
                BigInteger.valueOf(chain.getGasLimit()));

        if (privateKey != null && !privateKey.isEmpty()) {
            this.credentials = Credentials.create(privateKey);
            log.info("Wallet loaded: {}", credentials.getAddress());
        } else {
            this.credentials = null;
            log.warn("No Private Key provided. Execution will be in WATCH-ONLY mode.");
        }
    }

    @Override
    public ArbitrageAction buildAction(ArbitrageOpportunity opportunity, double tradeSize) {
        Function function = executeFunction(opportunity.buyPool().getPoolId(),
                opportunity.sellPool().getPoolId(), toBaseUnits(tradeSize));
        return ArbitrageAction.builder()
                .opportunityId(opportunity.getId())
                .opportunity(opportunity)
                .tradeSize(tradeSize)
                .payload(FunctionEncoder.encode(function))
                .builtAt(clock.instant())
                .build();
    }

    @Override
    public SimulationResult simulate(ArbitrageAction action) {
        Transaction call = Transaction.createEthCallTransaction(fromAddress(), chain.getExecutorAddress(),
                action.getPayload());
        try {
            EthCall result = web3j.ethCall(call, DefaultBlockParameterName.LATEST).send();
            if (result.hasError() || result.isReverted()) {
                String reason = result.hasError() ? result.getError().getMessage() : result.getRevertReason();
                return SimulationResult.failed("eth_call reverted: " + reason);
            }

            List<Type> decoded = FunctionReturnDecoder.decode(result.getValue(),
                    executeFunction(ZERO_ADDRESS, ZERO_ADDRESS, BigInteger.ZERO).getOutputParameters());
            if (decoded.isEmpty()) {
                return SimulationResult.failed("eth_call returned no profit value");
            }
            double expectedProfit = fromBaseUnits((BigInteger) decoded.get(0).getValue());

            EthEstimateGas estimate = web3j.ethEstimateGas(call).send();
            if (estimate.hasError()) {
                return SimulationResult.failed("Gas estimation failed: " + estimate.getError().getMessage());
            }
            double gasCost = gasCostInQuote(estimate.getAmountUsed());

            return SimulationResult.builder()
                    .success(true)
                    .estimatedProfit(expectedProfit - gasCost)
                    .estimatedGas(gasCost)
                    .estimatedSlippage(action.getTradeSize() / action.getOpportunity().minLiquidity())
                    .build();
        } catch (IOException e) {
            log.error("[REAL-EXECUTION] Simulation RPC failed for {}", action.getOpportunityId(), e);
            return SimulationResult.failed("RPC error: " + e.getMessage());
        }
    }

    @Override
    public SubmissionResult submit(ArbitrageAction action) {
        if (credentials == null) {
            log.info("[WATCH-ONLY] Would submit {} to executor {} for {} units", action.getOpportunityId(),
                    chain.getExecutorAddress(), action.getTradeSize());
            return SubmissionResult.failed("watch-only: no private key configured", 0);
        }

        try {
            TransactionManager txManager = new RawTransactionManager(web3j, credentials, chain.getChainId());
            log.info("[REAL-EXECUTION] Sending {} transaction for {}...", EXECUTE_FUNCTION, action.getOpportunityId());
            EthSendTransaction sent = txManager.sendTransaction(
                    gasProvider.getGasPrice(EXECUTE_FUNCTION),
                    gasProvider.getGasLimit(EXECUTE_FUNCTION),
                    chain.getExecutorAddress(),
                    action.getPayload(),
                    BigInteger.ZERO);
            if (sent.hasError()) {
                return SubmissionResult.failed("Transaction rejected: " + sent.getError().getMessage(), 0);
            }

            String txHash = sent.getTransactionHash();
            log.info("[REAL-EXECUTION] Transaction Sent! Hash: {}", txHash);
            TransactionReceipt receipt = receiptProcessor().waitForTransactionReceipt(txHash);
            double gasCost = gasCostInQuote(receipt.getGasUsed());

            if (!receipt.isStatusOK()) {
                log.error("[REAL-EXECUTION] Transaction {} reverted (status {})", txHash, receipt.getStatus());
                return SubmissionResult.builder()
                        .success(false)
                        .referenceId(txHash)
                        .gasCost(gasCost)
                        .error("Transaction reverted: " + receipt.getRevertReason())
                        .build();
            }

            return SubmissionResult.builder()
                    .success(true)
                    .referenceId(txHash)
                    .realizedProfit(realizedProfit(receipt))
                    .gasCost(gasCost)
                    .build();
        } catch (IOException | TransactionException e) {
            log.error("[REAL-EXECUTION] FATAL ERROR during submission of {}", action.getOpportunityId(), e);
            return SubmissionResult.failed("Submission failed: " + e.getMessage(), 0);
        }
    }

    TransactionReceiptProcessor receiptProcessor() {
        return new PollingTransactionReceiptProcessor(web3j, chain.getReceiptPollMs(), chain.getReceiptAttempts());
    }

    private double realizedProfit(TransactionReceipt receipt) {
        String topic = EventEncoder.encode(ARBITRAGE_EXECUTED);
        for (Log entry : receipt.getLogs()) {
            if (entry.getTopics().isEmpty() || !topic.equals(entry.getTopics().get(0))) {
                continue;
            }
            List<Type> values = FunctionReturnDecoder.decode(entry.getData(),
                    ARBITRAGE_EXECUTED.getNonIndexedParameters());
            if (!values.isEmpty()) {
                return fromBaseUnits((BigInteger) values.get(0).getValue());
            }
        }
        log.warn("[REAL-EXECUTION] No ArbitrageExecuted event in {}, realized profit unknown",
                receipt.getTransactionHash());
        return 0.0;
    }

    static Function executeFunction(String buyPool, String sellPool, BigInteger amount) {
        return new Function(
                EXECUTE_FUNCTION,
                Arrays.<Type>asList(new Address(buyPool), new Address(sellPool), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Uint256>() {
                }));
    }

    private String fromAddress() {
        return credentials != null ? credentials.getAddress() : ZERO_ADDRESS;
    }

    BigInteger toBaseUnits(double amount) {
        return BigDecimal.valueOf(amount).movePointRight(chain.getTokenDecimals()).toBigInteger();
    }

    double fromBaseUnits(BigInteger raw) {
        return new BigDecimal(raw).movePointLeft(chain.getTokenDecimals()).doubleValue();
    }

    private double gasCostInQuote(BigInteger gasUsed) {
        BigDecimal wei = new BigDecimal(gasUsed.multiply(gasProvider.getGasPrice(EXECUTE_FUNCTION)));
        return wei.movePointLeft(18).doubleValue() * chain.getNativeTokenPrice();
    }
}
