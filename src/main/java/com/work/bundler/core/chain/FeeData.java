package com.work.bundler.core.chain;

import java.math.BigInteger;

/**
 * 链上费率查询结果；节点不返回某项时对应字段为 null。
 */
public class FeeData {

    private final BigInteger gasPrice;
    private final BigInteger maxPriorityFeePerGas;

    public FeeData(BigInteger gasPrice, BigInteger maxPriorityFeePerGas) {
        this.gasPrice = gasPrice;
        this.maxPriorityFeePerGas = maxPriorityFeePerGas;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public BigInteger getMaxPriorityFeePerGas() {
        return maxPriorityFeePerGas;
    }
}
