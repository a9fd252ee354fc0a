package com.work.bundler.core.chain;

import java.math.BigInteger;

/**
 * simulateValidation 的结果：要么 revert（带原因），要么给出 validationData。
 */
public class SimulationResult {

    private final boolean reverted;
    private final String revertReason;
    private final BigInteger validationData;

    private SimulationResult(boolean reverted, String revertReason, BigInteger validationData) {
        this.reverted = reverted;
        this.revertReason = revertReason;
        this.validationData = validationData;
    }

    public static SimulationResult validated(BigInteger validationData) {
        return new SimulationResult(false, null, validationData == null ? BigInteger.ZERO : validationData);
    }

    public static SimulationResult reverted(String reason) {
        return new SimulationResult(true, reason, null);
    }

    public boolean isReverted() {
        return reverted;
    }

    public String getRevertReason() {
        return revertReason;
    }

    public BigInteger getValidationData() {
        return validationData;
    }
}
