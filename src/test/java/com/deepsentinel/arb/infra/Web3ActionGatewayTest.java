package com.deepsentinel.arb.infra;

import com.deepsentinel.arb.MutableClock;
import com.deepsentinel.arb.config.ArbProperties;
import com.deepsentinel.arb.domain.ArbitrageAction;
import com.deepsentinel.arb.domain.ArbitrageOpportunity;
import com.deepsentinel.arb.domain.PoolSnapshot;
import com.deepsentinel.arb.domain.SimulationResult;
import com.deepsentinel.arb.domain.SubmissionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.deepsentinel.arb.Fixtures.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class Web3ActionGatewayTest {

    private static final String PRIVATE_KEY = "0x8f2a55949038a9610f50fb23b5883af3b4ecb3c3bb792cbcefbd1542c692be63";
    private static final String EXECUTOR = "0x00000000000000000000000000000000000000e1";
    private static final String BUY_POOL = "0x00000000000000000000000000000000000000a1";
    private static final String SELL_POOL = "0x00000000000000000000000000000000000000b2";

    private Web3j web3j;
    private ArbProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        web3j = mock(Web3j.class);
        properties = new ArbProperties();
        properties.getChain().setExecutorAddress(EXECUTOR);
        clock = new MutableClock(T0);
    }

    @Test
    void missingExecutorAddressFailsFast() {
        properties.getChain().setExecutorAddress("");

        assertThrows(IllegalStateException.class, () -> new Web3ActionGateway(web3j, "", properties, clock));
    }

    @Test
    void encodesExecuteCallWithBuyPoolFirst() {
        Web3ActionGateway gateway = new Web3ActionGateway(web3j, "", properties, clock);

        ArbitrageAction action = gateway.buildAction(opportunity(), 1000);

        String expected = FunctionEncoder.encode(Web3ActionGateway.executeFunction(BUY_POOL, SELL_POOL,
                new BigInteger("1000000000000000000000")));
        assertEquals(expected, action.getPayload());
        assertTrue(action.getPayload().startsWith(
                FunctionEncoder.buildMethodId("executeArbitrage(address,address,uint256)")));
    }

    @Test
    void simulationNetsGasOffTheCallResult() throws Exception {
        stubEthCall(ethCall(units(28.8)));
        EthEstimateGas estimate = new EthEstimateGas();
        estimate.setResult("0x30d40"); // 200000 gas at 100 gwei = 0.02
        stubEstimateGas(estimate);
        Web3ActionGateway gateway = new Web3ActionGateway(web3j, "", properties, clock);

        SimulationResult simulation = gateway.simulate(gateway.buildAction(opportunity(), 1000));

        assertTrue(simulation.isSuccess(), simulation.getError());
        assertEquals(0.02, simulation.getEstimatedGas(), 1e-12);
        assertEquals(28.78, simulation.getEstimatedProfit(), 1e-9);
    }

    @Test
    void revertedCallFailsSimulation() throws Exception {
        EthCall reverted = new EthCall();
        reverted.setError(new Response.Error(3, "execution reverted: no profit"));
        stubEthCall(reverted);
        Web3ActionGateway gateway = new Web3ActionGateway(web3j, "", properties, clock);

        SimulationResult simulation = gateway.simulate(gateway.buildAction(opportunity(), 1000));

        assertFalse(simulation.isSuccess());
        assertTrue(simulation.getError().contains("no profit"));
        verify(web3j, never()).ethEstimateGas(any());
    }

    @Test
    void watchOnlyRefusesToSubmit() {
        Web3ActionGateway gateway = new Web3ActionGateway(web3j, "", properties, clock);

        SubmissionResult result = gateway.submit(gateway.buildAction(opportunity(), 1000));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("watch-only"));
        assertEquals(0.0, result.getGasCost());
        verifyNoInteractions(web3j);
    }

    @Test
    @SuppressWarnings("unchecked")
    void submissionReadsRealizedProfitFromEvent() throws Exception {
        EthGetTransactionCount nonce = new EthGetTransactionCount();
        nonce.setResult("0x7");
        Request<?, EthGetTransactionCount> nonceRequest = mock(Request.class);
        when(nonceRequest.send()).thenReturn(nonce);
        doReturn(nonceRequest).when(web3j).ethGetTransactionCount(anyString(), any(DefaultBlockParameter.class));

        // The transaction manager checks the node's hash against its own
        AtomicReference<String> signed = new AtomicReference<>();
        Request<?, EthSendTransaction> sendRequest = mock(Request.class);
        when(sendRequest.send()).thenAnswer(inv -> {
            EthSendTransaction sent = new EthSendTransaction();
            sent.setResult(Hash.sha3(signed.get()));
            return sent;
        });
        doAnswer(inv -> {
            signed.set(inv.getArgument(0));
            return sendRequest;
        }).when(web3j).ethSendRawTransaction(anyString());

        Log executed = new Log();
        executed.setTopics(List.of(EventEncoder.encode(Web3ActionGateway.ARBITRAGE_EXECUTED)));
        executed.setData("0x" + TypeEncoder.encode(new Uint256(units(27.5))));
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setStatus("0x1");
        receipt.setGasUsed("0x30d40");
        receipt.setTransactionHash("0xfeed");
        receipt.setLogs(List.of(executed));

        TransactionReceiptProcessor processor = mock(TransactionReceiptProcessor.class);
        when(processor.waitForTransactionReceipt(anyString())).thenReturn(receipt);

        Web3ActionGateway gateway = new Web3ActionGateway(web3j, PRIVATE_KEY, properties, clock) {
            @Override
            TransactionReceiptProcessor receiptProcessor() {
                return processor;
            }
        };

        SubmissionResult result = gateway.submit(gateway.buildAction(opportunity(), 1000));

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(27.5, result.getRealizedProfit(), 1e-9);
        assertEquals(0.02, result.getGasCost(), 1e-12);
        assertNotNull(result.getReferenceId());
    }

    @Test
    void baseUnitConversionUsesTokenDecimals() {
        properties.getChain().setTokenDecimals(6);
        Web3ActionGateway gateway = new Web3ActionGateway(web3j, "", properties, clock);

        assertEquals(BigInteger.valueOf(1_500_000), gateway.toBaseUnits(1.5));
        assertEquals(2.25, gateway.fromBaseUnits(BigInteger.valueOf(2_250_000)), 1e-12);
    }

    private static BigInteger units(double amount) {
        return new BigDecimal(String.valueOf(amount)).movePointRight(18).toBigInteger();
    }

    private static EthCall ethCall(BigInteger profit) {
        EthCall call = new EthCall();
        call.setResult("0x" + TypeEncoder.encode(new Uint256(profit)));
        return call;
    }

    @SuppressWarnings("unchecked")
    private void stubEthCall(EthCall response) throws Exception {
        Request<?, EthCall> request = mock(Request.class);
        when(request.send()).thenReturn(response);
        doReturn(request).when(web3j).ethCall(any(Transaction.class), any(DefaultBlockParameter.class));
    }

    @SuppressWarnings("unchecked")
    private void stubEstimateGas(EthEstimateGas response) throws Exception {
        Request<?, EthEstimateGas> request = mock(Request.class);
        when(request.send()).thenReturn(response);
        doReturn(request).when(web3j).ethEstimateGas(any(Transaction.class));
    }

    private static ArbitrageOpportunity opportunity() {
        PoolSnapshot buy = PoolSnapshot.builder().poolId(BUY_POOL).tokenA("WETH").tokenB("USDC")
                .priceA(1.00).priceB(1.00).liquidityA(100_000).liquidityB(100_000).observedAt(T0).build();
        PoolSnapshot sell = PoolSnapshot.builder().poolId(SELL_POOL).tokenA("WETH").tokenB("USDC")
                .priceA(1.03).priceB(1 / 1.03).liquidityA(100_000).liquidityB(100_000).observedAt(T0).build();
        return ArbitrageOpportunity.builder()
                .id(ArbitrageOpportunity.idFor(SELL_POOL, BUY_POOL, T0))
                .poolA(sell)
                .poolB(buy)
                .spread(0.03)
                .spreadPercentage(0.03)
                .estimatedProfit(29.099)
                .gasEstimate(0.001)
                .tradeAmount(1000)
                .approved(true)
                .createdAt(T0)
                .build();
    }
}
