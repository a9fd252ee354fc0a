package com.work.bundler.core.chain.web3j;

import com.work.bundler.TestOperations;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class EntryPointAbiTest {

    @Test
    public void failed_op_reason_is_decoded() {
        String data = EntryPointAbi.FAILED_OP + FunctionEncoder.encodeConstructor(Arrays.<Type>asList(
                new Uint256(BigInteger.ZERO), new Utf8String("AA21 didn't pay prefund")));

        assertEquals("AA21 didn't pay prefund", EntryPointAbi.decodeRevertReason(data));
        assertNull(EntryPointAbi.decodeValidationData(data));
    }

    @Test
    public void validation_result_sig_failed_maps_to_validation_data() {
        assertEquals(BigInteger.ZERO, EntryPointAbi.decodeValidationData(validationResult(false)));
        assertEquals(BigInteger.ONE, EntryPointAbi.decodeValidationData(validationResult(true)));
        assertNull(EntryPointAbi.decodeRevertReason(validationResult(false)));
    }

    @Test
    public void unknown_or_empty_data_is_not_decoded() {
        assertNull(EntryPointAbi.decodeRevertReason(null));
        assertNull(EntryPointAbi.decodeRevertReason("0x"));
        assertNull(EntryPointAbi.decodeValidationData("0xdeadbeef"));
    }

    @Test
    public void handle_ops_call_data_starts_with_selector() {
        String data = EntryPointAbi.encodeHandleOps(
                Collections.singletonList(TestOperations.op(TestOperations.SENDER_A, 0)), TestOperations.SENDER_B);

        assertTrue(data.startsWith(EntryPointAbi.HANDLE_OPS));
        // head: offset(ops) + beneficiary
        String body = data.substring(10);
        assertEquals(BigInteger.valueOf(64), new BigInteger(body.substring(0, 64), 16));
        assertEquals("0000000000000000000000002222222222222222222222222222222222222222", body.substring(64, 128));
    }

    // ValidationResult(returnInfo, senderInfo, factoryInfo, paymasterInfo)，returnInfo 是动态 tuple
    private static String validationResult(boolean sigFailed) {
        long[] words = {
                7 * 32,
                0, 0, 0, 0, 0, 0,
                100_000, 1_000, sigFailed ? 1 : 0, 0, 0, 6 * 32, 0
        };
        StringBuilder sb = new StringBuilder(EntryPointAbi.VALIDATION_RESULT);
        for (long w : words) {
            sb.append(Numeric.toHexStringNoPrefixZeroPadded(BigInteger.valueOf(w), 64));
        }
        return sb.toString();
    }
}
