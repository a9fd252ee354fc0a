package com.work.bundler.core.model;

import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * eth_estimateUserOperationGas 的估算结果。
 */
public class GasEstimate {

    private final BigInteger preVerificationGas;
    private final BigInteger verificationGasLimit;
    private final BigInteger callGasLimit;

    public GasEstimate(BigInteger preVerificationGas, BigInteger verificationGasLimit, BigInteger callGasLimit) {
        this.preVerificationGas = preVerificationGas;
        this.verificationGasLimit = verificationGasLimit;
        this.callGasLimit = callGasLimit;
    }

    public BigInteger getPreVerificationGas() {
        return preVerificationGas;
    }

    public BigInteger getVerificationGasLimit() {
        return verificationGasLimit;
    }

    public BigInteger getCallGasLimit() {
        return callGasLimit;
    }

    /**
     * RPC 输出形态：各字段为 0x 开头的 quantity。
     */
    public Map<String, String> toHex() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("preVerificationGas", Numeric.encodeQuantity(preVerificationGas));
        out.put("verificationGasLimit", Numeric.encodeQuantity(verificationGasLimit));
        out.put("callGasLimit", Numeric.encodeQuantity(callGasLimit));
        return out;
    }
}
