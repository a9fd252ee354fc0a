package com.work.bundler.core.chain;

import com.work.bundler.core.exception.ChainAccessException;
import com.work.bundler.core.hash.UserOperationHasher;
import com.work.bundler.core.model.FeeParameters;
import com.work.bundler.core.model.UserOperation;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版 EntryPoint，便于本地联调与测试，真实部署请使用 chain.mode=web3j。
 *
 * 模拟规则：
 * - signature 为空（0x）视为签名校验失败，simulateValidation 返回 validationData=1
 * - verificationGasLimit 超过模拟 gas 上限时 revert
 * - handleOps 发送后立即“上链”，每个 op 产生一条 success=true 的 UserOperationEvent
 */
public class MockEntryPointClient implements EntryPointClient {

    public static final long DEFAULT_CHAIN_ID = 1337L;

    private static final BigInteger BASE_TX_GAS = BigInteger.valueOf(21_000L);
    private static final BigInteger PER_OP_GAS = BigInteger.valueOf(50_000L);
    private static final BigInteger GAS_PRICE = BigInteger.valueOf(2_000_000_000L);
    private static final BigInteger PRIORITY_FEE = BigInteger.valueOf(1_000_000_000L);

    private final String entryPointAddress;
    private final long chainId;
    private final UserOperationHasher hasher;

    private final Map<String, SentBundle> sent = new ConcurrentHashMap<>();
    private final AtomicLong blockNumber = new AtomicLong(1);
    private final AtomicLong txCounter = new AtomicLong();

    private static class SentBundle {
        final List<UserOperation> ops;
        final FeeParameters fees;

        SentBundle(List<UserOperation> ops, FeeParameters fees) {
            this.ops = ops;
            this.fees = fees;
        }
    }

    public MockEntryPointClient(String entryPointAddress, long chainId, UserOperationHasher hasher) {
        this.entryPointAddress = entryPointAddress;
        this.chainId = chainId > 0 ? chainId : DEFAULT_CHAIN_ID;
        this.hasher = hasher;
    }

    @Override
    public long getChainId() {
        return chainId;
    }

    @Override
    public SimulationResult simulateValidation(UserOperation op, BigInteger gasLimit) {
        if (gasLimit != null && op.getVerificationGasLimit().compareTo(gasLimit) > 0) {
            return SimulationResult.reverted("AA40 over verificationGasLimit");
        }
        if ("0x".equals(op.getSignature())) {
            return SimulationResult.validated(BigInteger.ONE);
        }
        return SimulationResult.validated(BigInteger.ZERO);
    }

    @Override
    public BigInteger estimateHandleOpsGas(List<UserOperation> ops, String beneficiary) {
        return BASE_TX_GAS.add(PER_OP_GAS.multiply(BigInteger.valueOf(ops.size())));
    }

    @Override
    public FeeData getFeeData() {
        return new FeeData(GAS_PRICE, PRIORITY_FEE);
    }

    @Override
    public String sendHandleOps(List<UserOperation> ops, String beneficiary, FeeParameters fees) {
        String seed = "handleOps:" + txCounter.incrementAndGet() + ":" + beneficiary + ":" + ops.size();
        String txHash = Hash.sha3String(seed);
        sent.put(txHash, new SentBundle(new ArrayList<>(ops), fees));
        return txHash;
    }

    @Override
    public ChainReceipt waitForInclusion(String txHash, Duration timeout) {
        SentBundle bundle = sent.remove(txHash);
        if (bundle == null) {
            throw new ChainAccessException("transaction not found: " + txHash);
        }
        long bn = blockNumber.getAndIncrement();
        String blockHash = Hash.sha3String("block:" + bn);
        BigInteger gasUsed = estimateHandleOpsGas(bundle.ops, null);
        BigInteger price = bundle.fees == null ? GAS_PRICE : bundle.fees.getMaxFeePerGas();

        List<ChainLog> logs = new ArrayList<>(bundle.ops.size());
        for (int i = 0; i < bundle.ops.size(); i++) {
            UserOperation op = bundle.ops.get(i);
            UserOperationEvent event = new UserOperationEvent(
                    hasher.hash(op, entryPointAddress, chainId),
                    op.getSender(),
                    op.paymaster(),
                    op.getNonce(),
                    true,
                    PER_OP_GAS.multiply(price),
                    PER_OP_GAS);
            logs.add(event.toLog(entryPointAddress, Numeric.encodeQuantity(BigInteger.valueOf(i))));
        }
        return new ChainReceipt(txHash, BigInteger.ZERO, blockHash, BigInteger.valueOf(bn),
                gasUsed, gasUsed, price, true, logs);
    }

    /**
     * 已发送但尚未被 waitForInclusion 取走的交易数。
     */
    public int pendingCount() {
        return sent.size();
    }
}
