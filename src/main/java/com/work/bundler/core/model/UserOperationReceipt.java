package com.work.bundler.core.model;

import com.work.bundler.core.chain.ChainLog;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个 UserOperation 的上链结果（eth_getUserOperationReceipt 返回值）。
 *
 * 只在 bundle 交易确认上链后写入一次，之后只读。
 * success=false 表示 op 在 bundle 内被 EntryPoint 判为失败，属于正常结果而非提交失败。
 * 数值字段均为 0x quantity 字符串。
 */
public class UserOperationReceipt {

    private String userOpHash;
    private String entryPoint;
    private String sender;
    private String nonce;
    private String paymaster;
    private String actualGasCost;
    private String actualGasUsed;
    private boolean success;
    private String reason;
    private List<ChainLog> logs = new ArrayList<>();
    private TransactionInfo receipt;

    /**
     * 所在 bundle 交易的回执摘要。
     */
    public static class TransactionInfo {
        private String transactionHash;
        private String transactionIndex;
        private String blockHash;
        private String blockNumber;
        private String cumulativeGasUsed;
        private String gasUsed;
        private String status;
        private List<ChainLog> logs = new ArrayList<>();

        public String getTransactionHash() {
            return transactionHash;
        }

        public void setTransactionHash(String transactionHash) {
            this.transactionHash = transactionHash;
        }

        public String getTransactionIndex() {
            return transactionIndex;
        }

        public void setTransactionIndex(String transactionIndex) {
            this.transactionIndex = transactionIndex;
        }

        public String getBlockHash() {
            return blockHash;
        }

        public void setBlockHash(String blockHash) {
            this.blockHash = blockHash;
        }

        public String getBlockNumber() {
            return blockNumber;
        }

        public void setBlockNumber(String blockNumber) {
            this.blockNumber = blockNumber;
        }

        public String getCumulativeGasUsed() {
            return cumulativeGasUsed;
        }

        public void setCumulativeGasUsed(String cumulativeGasUsed) {
            this.cumulativeGasUsed = cumulativeGasUsed;
        }

        public String getGasUsed() {
            return gasUsed;
        }

        public void setGasUsed(String gasUsed) {
            this.gasUsed = gasUsed;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public List<ChainLog> getLogs() {
            return logs;
        }

        public void setLogs(List<ChainLog> logs) {
            this.logs = logs;
        }
    }

    public String getUserOpHash() {
        return userOpHash;
    }

    public void setUserOpHash(String userOpHash) {
        this.userOpHash = userOpHash;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public void setEntryPoint(String entryPoint) {
        this.entryPoint = entryPoint;
    }

    public String getSender() {
        return sender;
    }

    public void setSender(String sender) {
        this.sender = sender;
    }

    public String getNonce() {
        return nonce;
    }

    public void setNonce(String nonce) {
        this.nonce = nonce;
    }

    public String getPaymaster() {
        return paymaster;
    }

    public void setPaymaster(String paymaster) {
        this.paymaster = paymaster;
    }

    public String getActualGasCost() {
        return actualGasCost;
    }

    public void setActualGasCost(String actualGasCost) {
        this.actualGasCost = actualGasCost;
    }

    public String getActualGasUsed() {
        return actualGasUsed;
    }

    public void setActualGasUsed(String actualGasUsed) {
        this.actualGasUsed = actualGasUsed;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public List<ChainLog> getLogs() {
        return logs;
    }

    public void setLogs(List<ChainLog> logs) {
        this.logs = logs;
    }

    public TransactionInfo getReceipt() {
        return receipt;
    }

    public void setReceipt(TransactionInfo receipt) {
        this.receipt = receipt;
    }
}
