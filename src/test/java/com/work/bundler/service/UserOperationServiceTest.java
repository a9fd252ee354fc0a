package com.work.bundler.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.bundler.TestOperations;
import com.work.bundler.config.BundlerProperties;
import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.chain.SimulationResult;
import com.work.bundler.core.exception.InvalidEntryPointException;
import com.work.bundler.core.exception.OperationRejectedException;
import com.work.bundler.core.exception.StoreAccessException;
import com.work.bundler.core.hash.UserOperationHasher;
import com.work.bundler.core.model.UserOperation;
import com.work.bundler.core.pool.PooledOperation;
import com.work.bundler.core.pool.RequeueOutcome;
import com.work.bundler.core.pool.UserOperationPool;
import com.work.bundler.core.store.InMemoryKeyValueStore;
import com.work.bundler.core.store.KeyValueStore;
import com.work.bundler.core.store.UserOperationRepository;
import com.work.bundler.service.bundle.BundleScheduler;
import com.work.bundler.service.gas.GasEstimator;
import com.work.bundler.service.validation.ValidationGate;
import com.work.bundler.support.metrics.BundlerMetrics;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class UserOperationServiceTest {

    private final BundlerProperties props = new BundlerProperties();
    private final EntryPointClient entryPoint = mock(EntryPointClient.class);
    private final UserOperationHasher hasher = new UserOperationHasher();
    private final UserOperationPool pool = new UserOperationPool();
    private final BundleScheduler scheduler = mock(BundleScheduler.class);
    private final BundlerMetrics metrics = mock(BundlerMetrics.class);

    private UserOperationService service(KeyValueStore store) {
        when(entryPoint.getChainId()).thenReturn(1337L);
        when(entryPoint.simulateValidation(any(), any())).thenReturn(SimulationResult.validated(BigInteger.ZERO));
        when(scheduler.onAdmitted()).thenReturn(Optional.empty());
        return new UserOperationService(props, entryPoint, hasher, new ValidationGate(entryPoint, props, metrics),
                pool, scheduler, new GasEstimator(entryPoint, props),
                new UserOperationRepository(store, new ObjectMapper()), metrics);
    }

    @Test
    public void send_returns_hash_bound_to_configured_entry_point_and_chain() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        UserOperationService service = service(store);
        UserOperation op = TestOperations.op(TestOperations.SENDER_A, 0);

        String hash = service.sendUserOperation(op, TestOperations.ENTRY_POINT.toLowerCase());

        assertEquals(hasher.hash(op, TestOperations.ENTRY_POINT, 1337L), hash);
        assertTrue(pool.contains(hash));
        assertNotNull(store.get("op:" + hash));
        verify(scheduler).onAdmitted();
    }

    @Test
    public void wrong_entry_point_never_reaches_validation_or_pool() {
        UserOperationService service = service(new InMemoryKeyValueStore());

        InvalidEntryPointException e = assertThrows(InvalidEntryPointException.class,
                () -> service.sendUserOperation(TestOperations.op(TestOperations.SENDER_A, 0), TestOperations.OTHER_ENTRY_POINT));

        assertTrue(e.getMessage().startsWith("Invalid entry point"));
        assertEquals(0, pool.size());
        verify(entryPoint, never()).simulateValidation(any(), any());
        verify(scheduler, never()).onAdmitted();
    }

    @Test
    public void rejected_operation_is_not_admitted() {
        UserOperationService service = service(new InMemoryKeyValueStore());
        when(entryPoint.simulateValidation(any(), any())).thenReturn(SimulationResult.validated(BigInteger.ONE));

        assertThrows(OperationRejectedException.class,
                () -> service.sendUserOperation(TestOperations.op(TestOperations.SENDER_A, 0), TestOperations.ENTRY_POINT));

        assertEquals(0, pool.size());
        verify(metrics).operationReceived("invalid");
    }

    @Test
    public void resubmission_with_higher_fee_replaces_pooled_entry() {
        UserOperationService service = service(new InMemoryKeyValueStore());
        UserOperation original = TestOperations.op(TestOperations.SENDER_A, 4);
        UserOperation bumped = original.toBuilder().maxFeePerGas(original.getMaxFeePerGas().add(BigInteger.ONE)).build();

        String first = service.sendUserOperation(original, TestOperations.ENTRY_POINT);
        String second = service.sendUserOperation(bumped, TestOperations.ENTRY_POINT);

        assertNotEquals(first, second);
        assertEquals(1, pool.size());
        assertFalse(pool.contains(first));
        assertTrue(pool.contains(second));
    }

    @Test
    public void replacement_of_in_flight_operation_wins_over_failed_requeue() {
        UserOperationService service = service(new InMemoryKeyValueStore());
        UserOperation original = TestOperations.op(TestOperations.SENDER_A, 7);
        UserOperation bumped = original.toBuilder().maxFeePerGas(original.getMaxFeePerGas().add(BigInteger.ONE)).build();

        String first = service.sendUserOperation(original, TestOperations.ENTRY_POINT);
        List<PooledOperation> inflight = pool.drainAll();
        String second = service.sendUserOperation(bumped, TestOperations.ENTRY_POINT);
        RequeueOutcome outcome = pool.requeue(inflight, 5, "send failed");

        assertEquals(1, pool.size());
        assertTrue(pool.contains(second));
        assertFalse(pool.contains(first));
        assertEquals(1, outcome.getSuperseded().size());
        assertTrue(outcome.getRequeued().isEmpty());
    }

    @Test
    public void identical_resubmission_is_idempotent() {
        UserOperationService service = service(new InMemoryKeyValueStore());
        UserOperation op = TestOperations.op(TestOperations.SENDER_A, 4);

        String first = service.sendUserOperation(op, TestOperations.ENTRY_POINT);
        String second = service.sendUserOperation(op, TestOperations.ENTRY_POINT);

        assertEquals(first, second);
        assertEquals(1, pool.size());
    }

    @Test
    public void staging_failure_does_not_fail_admission() {
        KeyValueStore store = mock(KeyValueStore.class);
        doThrow(new StoreAccessException("redis down", null)).when(store).set(anyString(), anyString(), any(Duration.class));
        UserOperationService service = service(store);

        String hash = service.sendUserOperation(TestOperations.op(TestOperations.SENDER_A, 0), TestOperations.ENTRY_POINT);

        assertTrue(pool.contains(hash));
    }

    @Test
    public void receipt_lookup_for_unknown_or_malformed_hash_is_null() {
        UserOperationService service = service(new InMemoryKeyValueStore());

        assertNull(service.getUserOperationReceipt("0x" + "de".repeat(32)));
        assertNull(service.getUserOperationReceipt("not-a-hash"));
        assertNull(service.getUserOperationReceipt(null));
    }

    @Test
    public void supported_entry_points_lists_configured_address() {
        UserOperationService service = service(new InMemoryKeyValueStore());

        assertEquals(1, service.supportedEntryPoints().size());
        assertEquals(props.getEntryPointAddress(), service.supportedEntryPoints().get(0));
    }
}
