package com.work.bundler.core.model;

import java.math.BigInteger;

/**
 * bundle 交易使用的 EIP-1559 费率参数。
 */
public class FeeParameters {

    private final BigInteger maxFeePerGas;
    private final BigInteger maxPriorityFeePerGas;

    public FeeParameters(BigInteger maxFeePerGas, BigInteger maxPriorityFeePerGas) {
        this.maxFeePerGas = maxFeePerGas;
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    public BigInteger getMaxFeePerGas() {
        return maxFeePerGas;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }

    @Override
    public String toString() {
        return "FeeParameters{maxFeePerGas=" + maxFeePerGas + ", maxPriorityFeePerGas=" + maxPriorityFeePerGas + "}";
    }
}
