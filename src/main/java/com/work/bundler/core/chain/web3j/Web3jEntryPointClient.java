package com.work.bundler.core.chain.web3j;

import com.work.bundler.core.chain.ChainLog;
import com.work.bundler.core.chain.ChainReceipt;
import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.chain.FeeData;
import com.work.bundler.core.chain.SimulationResult;
import com.work.bundler.core.exception.ChainAccessException;
import com.work.bundler.core.model.FeeParameters;
import com.work.bundler.core.model.UserOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthMaxPriorityFeePerGas;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Web3j 的 EntryPoint 客户端：
 * - simulateValidation：eth_call，解析 ValidationResult / FailedOp revert 数据
 * - estimateHandleOpsGas：eth_estimateGas
 * - getFeeData：eth_gasPrice + eth_maxPriorityFeePerGas（节点不支持时字段为 null）
 * - sendHandleOps：本地私钥签名 EIP-1559 交易后 eth_sendRawTransaction
 * - waitForInclusion：轮询 eth_getTransactionReceipt，有界等待
 *
 * IOException 等节点错误统一转换为 ChainAccessException。
 */
public class Web3jEntryPointClient implements EntryPointClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jEntryPointClient.class);

    private final Web3j web3j;
    private final String entryPointAddress;
    private final Credentials credentials;
    private final Duration pollInterval;
    private final long configuredChainId;

    private volatile Long chainId;
    private volatile RawTransactionManager txManager;

    public Web3jEntryPointClient(Web3j web3j,
                                 String entryPointAddress,
                                 Credentials credentials,
                                 Duration pollInterval,
                                 long configuredChainId) {
        this.web3j = web3j;
        this.entryPointAddress = entryPointAddress;
        this.credentials = credentials;
        this.pollInterval = pollInterval;
        this.configuredChainId = configuredChainId;
    }

    @Override
    public long getChainId() {
        Long cached = chainId;
        if (cached != null) {
            return cached;
        }
        if (configuredChainId > 0) {
            chainId = configuredChainId;
            return configuredChainId;
        }
        EthChainId resp = send("eth_chainId", () -> web3j.ethChainId().send());
        long id = resp.getChainId().longValue();
        chainId = id;
        log.info("chainId resolved from node chainId={}", id);
        return id;
    }

    @Override
    public SimulationResult simulateValidation(UserOperation op, BigInteger gasLimit) {
        Transaction call = new Transaction(fromAddress(), null, null, gasLimit, entryPointAddress, null,
                EntryPointAbi.encodeSimulateValidation(op));
        EthCall resp = send("simulateValidation", () -> web3j.ethCall(call, DefaultBlockParameterName.LATEST).send());

        // v0.6 的 simulateValidation 总是 revert：成功时 revert 数据是 ValidationResult
        String data = resp.hasError() ? resp.getError().getData() : resp.getValue();
        BigInteger validationData = EntryPointAbi.decodeValidationData(data);
        if (validationData != null) {
            return SimulationResult.validated(validationData);
        }
        String reason = EntryPointAbi.decodeRevertReason(data);
        if (reason != null) {
            return SimulationResult.reverted(reason);
        }
        if (resp.hasError()) {
            return SimulationResult.reverted(resp.getError().getMessage());
        }
        return SimulationResult.reverted("unexpected simulateValidation result");
    }

    @Override
    public BigInteger estimateHandleOpsGas(List<UserOperation> ops, String beneficiary) {
        Transaction tx = Transaction.createEthCallTransaction(fromAddress(), entryPointAddress,
                EntryPointAbi.encodeHandleOps(ops, beneficiary));
        EthEstimateGas resp = send("eth_estimateGas", () -> web3j.ethEstimateGas(tx).send());
        if (resp.hasError()) {
            throw new ChainAccessException("eth_estimateGas failed: " + resp.getError().getMessage());
        }
        return resp.getAmountUsed();
    }

    @Override
    public FeeData getFeeData() {
        EthGasPrice gasPrice = send("eth_gasPrice", () -> web3j.ethGasPrice().send());
        BigInteger priority = null;
        try {
            EthMaxPriorityFeePerGas resp = web3j.ethMaxPriorityFeePerGas().send();
            if (!resp.hasError()) {
                priority = resp.getMaxPriorityFeePerGas();
            }
        } catch (IOException e) {
            // 部分 L2 节点不支持该方法，交给上层使用兜底值
            log.debug("eth_maxPriorityFeePerGas unavailable err={}", e.getMessage());
        }
        return new FeeData(gasPrice.hasError() ? null : gasPrice.getGasPrice(), priority);
    }

    @Override
    public String sendHandleOps(List<UserOperation> ops, String beneficiary, FeeParameters fees) {
        if (credentials == null) {
            throw new ChainAccessException("bundler private key is not configured");
        }
        String data = EntryPointAbi.encodeHandleOps(ops, beneficiary);
        BigInteger gasLimit = estimateHandleOpsGas(ops, beneficiary);
        long id = getChainId();
        EthSendTransaction resp = send("eth_sendRawTransaction", () -> transactionManager(id).sendEIP1559Transaction(
                id, fees.getMaxPriorityFeePerGas(), fees.getMaxFeePerGas(), gasLimit, entryPointAddress, data,
                BigInteger.ZERO));
        if (resp.hasError()) {
            throw new ChainAccessException("handleOps rejected by node: " + resp.getError().getMessage());
        }
        return resp.getTransactionHash();
    }

    @Override
    public ChainReceipt waitForInclusion(String txHash, Duration timeout) {
        long sleepMs = Math.max(1L, pollInterval.toMillis());
        int attempts = (int) Math.max(1L, timeout.toMillis() / sleepMs);
        PollingTransactionReceiptProcessor processor = new PollingTransactionReceiptProcessor(web3j, sleepMs, attempts);
        try {
            return toChainReceipt(processor.waitForTransactionReceipt(txHash));
        } catch (IOException e) {
            throw new ChainAccessException("eth_getTransactionReceipt failed: " + e.getMessage(), e);
        } catch (TransactionException e) {
            throw new ChainAccessException("transaction not included within " + timeout + ": " + txHash, e);
        }
    }

    private ChainReceipt toChainReceipt(TransactionReceipt r) {
        List<ChainLog> logs = new ArrayList<>();
        if (r.getLogs() != null) {
            for (Log l : r.getLogs()) {
                logs.add(new ChainLog(l.getAddress(), l.getTopics(), l.getData(),
                        l.getLogIndexRaw()));
            }
        }
        BigInteger effectiveGasPrice = r.getEffectiveGasPrice() == null ? null : Numeric.decodeQuantity(r.getEffectiveGasPrice());
        return new ChainReceipt(r.getTransactionHash(), r.getTransactionIndex(), r.getBlockHash(), r.getBlockNumber(),
                r.getCumulativeGasUsed(), r.getGasUsed(), effectiveGasPrice, r.isStatusOK(), logs);
    }

    private synchronized RawTransactionManager transactionManager(long id) {
        if (txManager == null) {
            txManager = new RawTransactionManager(web3j, credentials, id);
        }
        return txManager;
    }

    private String fromAddress() {
        return credentials == null ? null : credentials.getAddress();
    }

    @FunctionalInterface
    private interface NodeCall<T extends Response<?>> {
        T send() throws IOException;
    }

    private static <T extends Response<?>> T send(String method, NodeCall<T> call) {
        try {
            return call.send();
        } catch (IOException e) {
            log.warn("Web3j {} failed err={}", method, e.getMessage());
            throw new ChainAccessException(method + " failed: " + e.getMessage(), e);
        }
    }
}
