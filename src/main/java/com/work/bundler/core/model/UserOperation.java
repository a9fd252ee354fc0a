package com.work.bundler.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.bundler.core.support.ValidationUtils;

import java.math.BigInteger;
import java.util.Objects;

/**
 * ERC-4337 UserOperation（不可变）。
 *
 * 字节类字段统一保存为小写 0x hex；数值字段为 BigInteger。
 * 入池后不再修改：提价等变更必须作为新的 op 重新提交（得到新的 userOpHash）。
 */
public final class UserOperation {

    private final String sender;
    private final BigInteger nonce;
    private final String initCode;
    private final String callData;
    private final BigInteger callGasLimit;
    private final BigInteger verificationGasLimit;
    private final BigInteger preVerificationGas;
    private final BigInteger maxFeePerGas;
    private final BigInteger maxPriorityFeePerGas;
    private final String paymasterAndData;
    private final String signature;

    @JsonCreator
    public UserOperation(@JsonProperty("sender") String sender,
                         @JsonProperty("nonce") BigInteger nonce,
                         @JsonProperty("initCode") String initCode,
                         @JsonProperty("callData") String callData,
                         @JsonProperty("callGasLimit") BigInteger callGasLimit,
                         @JsonProperty("verificationGasLimit") BigInteger verificationGasLimit,
                         @JsonProperty("preVerificationGas") BigInteger preVerificationGas,
                         @JsonProperty("maxFeePerGas") BigInteger maxFeePerGas,
                         @JsonProperty("maxPriorityFeePerGas") BigInteger maxPriorityFeePerGas,
                         @JsonProperty("paymasterAndData") String paymasterAndData,
                         @JsonProperty("signature") String signature) {
        this.sender = ValidationUtils.requireAddress(sender, "sender");
        this.nonce = ValidationUtils.requireNonNegative(nonce, "nonce");
        this.initCode = ValidationUtils.requireBytes(initCode, "initCode");
        this.callData = ValidationUtils.requireBytes(callData, "callData");
        this.callGasLimit = ValidationUtils.requireNonNegative(callGasLimit, "callGasLimit");
        this.verificationGasLimit = ValidationUtils.requireNonNegative(verificationGasLimit, "verificationGasLimit");
        this.preVerificationGas = ValidationUtils.requireNonNegative(preVerificationGas, "preVerificationGas");
        this.maxFeePerGas = ValidationUtils.requireNonNegative(maxFeePerGas, "maxFeePerGas");
        this.maxPriorityFeePerGas = ValidationUtils.requireNonNegative(maxPriorityFeePerGas, "maxPriorityFeePerGas");
        this.paymasterAndData = ValidationUtils.requireBytes(paymasterAndData, "paymasterAndData");
        this.signature = ValidationUtils.requireBytes(signature, "signature");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以当前字段为初值构造一个新 op（用于提价重提等场景，原对象保持不变）。
     */
    public Builder toBuilder() {
        return new Builder()
                .sender(sender)
                .nonce(nonce)
                .initCode(initCode)
                .callData(callData)
                .callGasLimit(callGasLimit)
                .verificationGasLimit(verificationGasLimit)
                .preVerificationGas(preVerificationGas)
                .maxFeePerGas(maxFeePerGas)
                .maxPriorityFeePerGas(maxPriorityFeePerGas)
                .paymasterAndData(paymasterAndData)
                .signature(signature);
    }

    public String getSender() {
        return sender;
    }

    public BigInteger getNonce() {
        return nonce;
    }

    public String getInitCode() {
        return initCode;
    }

    public String getCallData() {
        return callData;
    }

    public BigInteger getCallGasLimit() {
        return callGasLimit;
    }

    public BigInteger getVerificationGasLimit() {
        return verificationGasLimit;
    }

    public BigInteger getPreVerificationGas() {
        return preVerificationGas;
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    public String getPaymasterAndData() {
        return paymasterAndData;
    }

    public String getSignature() {
        return signature;
    }

    /**
     * paymasterAndData 的前 20 字节；未使用 paymaster 时返回 null。
     */
    public String paymaster() {
        if (paymasterAndData.length() < 42) {
            return null;
        }
        return paymasterAndData.substring(0, 42);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserOperation)) return false;
        UserOperation that = (UserOperation) o;
        return sender.equals(that.sender)
                && nonce.equals(that.nonce)
                && initCode.equals(that.initCode)
                && callData.equals(that.callData)
                && callGasLimit.equals(that.callGasLimit)
                && verificationGasLimit.equals(that.verificationGasLimit)
                && preVerificationGas.equals(that.preVerificationGas)
                && maxFeePerGas.equals(that.maxFeePerGas)
                && maxPriorityFeePerGas.equals(that.maxPriorityFeePerGas)
                && paymasterAndData.equals(that.paymasterAndData)
                && signature.equals(that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sender, nonce, initCode, callData, callGasLimit, verificationGasLimit,
                preVerificationGas, maxFeePerGas, maxPriorityFeePerGas, paymasterAndData, signature);
    }

    @Override
    public String toString() {
        return "UserOperation{sender=" + sender + ", nonce=" + nonce + "}";
    }

    public static final class Builder {
        private String sender;
        private BigInteger nonce = BigInteger.ZERO;
        private String initCode = "0x";
        private String callData = "0x";
        private BigInteger callGasLimit = BigInteger.ZERO;
        private BigInteger verificationGasLimit = BigInteger.ZERO;
        private BigInteger preVerificationGas = BigInteger.ZERO;
        private BigInteger maxFeePerGas = BigInteger.ZERO;
        private BigInteger maxPriorityFeePerGas = BigInteger.ZERO;
        private String paymasterAndData = "0x";
        private String signature = "0x";

        private Builder() {
        }

        public Builder sender(String sender) {
            this.sender = sender;
            return this;
        }

        public Builder nonce(BigInteger nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder initCode(String initCode) {
            this.initCode = initCode;
            return this;
        }

        public Builder callData(String callData) {
            this.callData = callData;
            return this;
        }

        public Builder callGasLimit(BigInteger callGasLimit) {
            this.callGasLimit = callGasLimit;
            return this;
        }

        public Builder verificationGasLimit(BigInteger verificationGasLimit) {
            this.verificationGasLimit = verificationGasLimit;
            return this;
        }

        public Builder preVerificationGas(BigInteger preVerificationGas) {
            this.preVerificationGas = preVerificationGas;
            return this;
        }

        public Builder maxFeePerGas(BigInteger maxFeePerGas) {
            this.maxFeePerGas = maxFeePerGas;
            return this;
        }

        public Builder maxPriorityFeePerGas(BigInteger maxPriorityFeePerGas) {
            this.maxPriorityFeePerGas = maxPriorityFeePerGas;
            return this;
        }

        public Builder paymasterAndData(String paymasterAndData) {
            this.paymasterAndData = paymasterAndData;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public UserOperation build() {
            return new UserOperation(sender, nonce, initCode, callData, callGasLimit, verificationGasLimit,
                    preVerificationGas, maxFeePerGas, maxPriorityFeePerGas, paymasterAndData, signature);
        }
    }
}
