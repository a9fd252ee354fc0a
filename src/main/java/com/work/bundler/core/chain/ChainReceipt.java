package com.work.bundler.core.chain;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * bundle 交易上链后的回执（只保留组装 UserOperationReceipt 需要的字段）。
 */
public class ChainReceipt {

    private final String transactionHash;
    private final BigInteger transactionIndex;
    private final String blockHash;
    private final BigInteger blockNumber;
    private final BigInteger cumulativeGasUsed;
    private final BigInteger gasUsed;
    private final BigInteger effectiveGasPrice;
    private final boolean success;
    private final List<ChainLog> logs;

    public ChainReceipt(String transactionHash,
                        BigInteger transactionIndex,
                        String blockHash,
                        BigInteger blockNumber,
                        BigInteger cumulativeGasUsed,
                        BigInteger gasUsed,
                        BigInteger effectiveGasPrice,
                        boolean success,
                        List<ChainLog> logs) {
        this.transactionHash = transactionHash;
        this.transactionIndex = transactionIndex;
        this.blockHash = blockHash;
        this.blockNumber = blockNumber;
        this.cumulativeGasUsed = cumulativeGasUsed;
        this.gasUsed = gasUsed;
        this.effectiveGasPrice = effectiveGasPrice;
        this.success = success;
        this.logs = logs == null ? Collections.emptyList() : Collections.unmodifiableList(logs);
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public BigInteger getTransactionIndex() {
        return transactionIndex;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public BigInteger getBlockNumber() {
        return blockNumber;
    }

    public BigInteger getCumulativeGasUsed() {
        return cumulativeGasUsed;
    }

    public BigInteger getGasUsed() {
        return gasUsed;
    }

    /**
     * 可能为 null（老节点不返回 effectiveGasPrice）。
     */
    public BigInteger getEffectiveGasPrice() {
        return effectiveGasPrice;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<ChainLog> getLogs() {
        return logs;
    }
}
