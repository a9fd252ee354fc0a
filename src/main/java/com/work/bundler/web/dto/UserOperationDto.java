package com.work.bundler.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.work.bundler.core.model.UserOperation;

import java.math.BigInteger;

/**
 * UserOperation 的 RPC 形态：全部字段为字符串。
 * 数值字段接受 0x quantity 或十进制；字节字段为 0x hex。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserOperationDto {

    private String sender;
    private String nonce;
    private String initCode;
    private String callData;
    private String callGasLimit;
    private String verificationGasLimit;
    private String preVerificationGas;
    private String maxFeePerGas;
    private String maxPriorityFeePerGas;
    private String paymasterAndData;
    private String signature;

    /**
     * 转换为领域对象；格式错误抛 IllegalArgumentException。
     */
    public UserOperation toOperation() {
        if (nonce == null) {
            throw new IllegalArgumentException("nonce 不能为空");
        }
        return new UserOperation(
                sender,
                quantity(nonce, "nonce"),
                initCode,
                callData,
                quantity(callGasLimit, "callGasLimit"),
                quantity(verificationGasLimit, "verificationGasLimit"),
                quantity(preVerificationGas, "preVerificationGas"),
                quantity(maxFeePerGas, "maxFeePerGas"),
                quantity(maxPriorityFeePerGas, "maxPriorityFeePerGas"),
                paymasterAndData,
                signature);
    }

    static BigInteger quantity(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            return BigInteger.ZERO;
        }
        String v = value.trim();
        try {
            if (v.startsWith("0x") || v.startsWith("0X")) {
                String hex = v.substring(2);
                return hex.isEmpty() ? BigInteger.ZERO : new BigInteger(hex, 16);
            }
            return new BigInteger(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " 不是合法数值: " + value, e);
        }
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

    public String getInitCode() {
        return initCode;
    }

    public void setInitCode(String initCode) {
        this.initCode = initCode;
    }

    public String getCallData() {
        return callData;
    }

    public void setCallData(String callData) {
        this.callData = callData;
    }

    public String getCallGasLimit() {
        return callGasLimit;
    }

    public void setCallGasLimit(String callGasLimit) {
        this.callGasLimit = callGasLimit;
    }

    public String getVerificationGasLimit() {
        return verificationGasLimit;
    }

    public void setVerificationGasLimit(String verificationGasLimit) {
        this.verificationGasLimit = verificationGasLimit;
    }

    public String getPreVerificationGas() {
        return preVerificationGas;
    }

    public void setPreVerificationGas(String preVerificationGas) {
        this.preVerificationGas = preVerificationGas;
    }

    public String getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public void setMaxFeePerGas(String maxFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
    }

    public String getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    public void setMaxPriorityFeePerGas(String maxPriorityFeePerGas) {
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    public String getPaymasterAndData() {
        return paymasterAndData;
    }

    public void setPaymasterAndData(String paymasterAndData) {
        this.paymasterAndData = paymasterAndData;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }
}
