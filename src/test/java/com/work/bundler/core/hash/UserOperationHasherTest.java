package com.work.bundler.core.hash;

import com.work.bundler.TestOperations;
import com.work.bundler.core.model.UserOperation;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class UserOperationHasherTest {

    private final UserOperationHasher hasher = new UserOperationHasher();

    @Test
    public void same_operation_hashes_identically() {
        UserOperation a = TestOperations.op(TestOperations.SENDER_A, 1);
        UserOperation b = TestOperations.op(TestOperations.SENDER_A, 1);

        String h1 = hasher.hash(a, TestOperations.ENTRY_POINT, 1337L);
        String h2 = hasher.hash(b, TestOperations.ENTRY_POINT, 1337L);

        assertEquals(h1, h2);
        assertTrue(h1.matches("^0x[0-9a-f]{64}$"), h1);
    }

    @Test
    public void one_wei_fee_change_changes_hash() {
        UserOperation a = TestOperations.op(TestOperations.SENDER_A, 1);
        UserOperation b = a.toBuilder().maxFeePerGas(a.getMaxFeePerGas().add(BigInteger.ONE)).build();

        assertNotEquals(hasher.hash(a, TestOperations.ENTRY_POINT, 1337L),
                hasher.hash(b, TestOperations.ENTRY_POINT, 1337L));
    }

    @Test
    public void hash_is_bound_to_chain_and_entry_point() {
        UserOperation op = TestOperations.op(TestOperations.SENDER_A, 1);
        String base = hasher.hash(op, TestOperations.ENTRY_POINT, 1L);

        assertNotEquals(base, hasher.hash(op, TestOperations.ENTRY_POINT, 10L));
        assertNotEquals(base, hasher.hash(op, TestOperations.OTHER_ENTRY_POINT, 1L));
    }

    @Test
    public void entry_point_case_does_not_affect_hash() {
        UserOperation op = TestOperations.op(TestOperations.SENDER_A, 1);

        assertEquals(hasher.hash(op, TestOperations.ENTRY_POINT, 1L),
                hasher.hash(op, TestOperations.ENTRY_POINT.toLowerCase(), 1L));
    }

    @Test
    public void fields_are_abi_encoded_in_entry_point_order() {
        UserOperation op = TestOperations.op(TestOperations.SENDER_A, 7);

        String encoded = hasher.encodeFields(op);

        // sender | nonce | offset(initCode) = 11 个头部字
        assertEquals("0000000000000000000000001111111111111111111111111111111111111111", encoded.substring(0, 64));
        assertEquals(new BigInteger("7"), new BigInteger(encoded.substring(64, 128), 16));
        assertEquals(BigInteger.valueOf(11 * 32), new BigInteger(encoded.substring(128, 192), 16));
    }
}
