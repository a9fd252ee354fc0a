package com.work.bundler;

import com.work.bundler.core.model.UserOperation;

import java.math.BigInteger;

/**
 * 测试用 UserOperation 样例。
 */
public final class TestOperations {

    public static final String ENTRY_POINT = "0x5FF137D4b0FDCD49DcA30c7CF57E578a026d2789";
    public static final String OTHER_ENTRY_POINT = "0x0000000071727De22E5E9d8BAf0edAc6f37da032";
    public static final String SENDER_A = "0x1111111111111111111111111111111111111111";
    public static final String SENDER_B = "0x2222222222222222222222222222222222222222";

    private TestOperations() {
    }

    public static UserOperation.Builder base(String sender, long nonce) {
        return UserOperation.builder()
                .sender(sender)
                .nonce(BigInteger.valueOf(nonce))
                .callData("0xb61d27f6")
                .callGasLimit(BigInteger.valueOf(100_000L))
                .verificationGasLimit(BigInteger.valueOf(150_000L))
                .preVerificationGas(BigInteger.valueOf(50_000L))
                .maxFeePerGas(BigInteger.valueOf(2_000_000_000L))
                .maxPriorityFeePerGas(BigInteger.valueOf(1_000_000_000L))
                .signature("0x1234");
    }

    public static UserOperation op(String sender, long nonce) {
        return base(sender, nonce).build();
    }
}
