package com.work.bundler.service.bundle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.bundler.TestOperations;
import com.work.bundler.config.BundlerProperties;
import com.work.bundler.core.chain.MockEntryPointClient;
import com.work.bundler.core.hash.UserOperationHasher;
import com.work.bundler.core.pool.PooledOperation;
import com.work.bundler.core.pool.UserOperationPool;
import com.work.bundler.core.store.KeyValueStore;
import com.work.bundler.core.store.UserOperationRepository;
import com.work.bundler.service.gas.GasEstimator;
import com.work.bundler.support.metrics.BundlerMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class BundleSchedulerTest {

    private final BundlerProperties props = new BundlerProperties();
    private final UserOperationPool pool = new UserOperationPool();
    private final BundleSubmitter submitter = mock(BundleSubmitter.class);
    private final BundlerMetrics metrics = mock(BundlerMetrics.class);

    @Test
    public void size_threshold_triggers_synchronous_cycle() {
        props.setMaxBundleSize(2);
        when(submitter.submit(anyList())).thenReturn(BundleResult.submitted("0x01", Collections.emptyList()));
        BundleScheduler scheduler = new BundleScheduler(props, pool, submitter, metrics);

        pool.admit("0xaa", TestOperations.op(TestOperations.SENDER_A, 0));
        assertFalse(scheduler.onAdmitted().isPresent());
        verify(submitter, never()).submit(anyList());

        pool.admit("0xbb", TestOperations.op(TestOperations.SENDER_B, 0));
        Optional<BundleResult> result = scheduler.onAdmitted();

        assertTrue(result.isPresent());
        assertEquals(BundleResult.Status.SUBMITTED, result.get().getStatus());
        verify(submitter, times(1)).submit(argThat(batch -> batch.size() == 2));
        assertEquals(0, pool.size());
    }

    @Test
    public void empty_cycle_never_contacts_submitter() {
        BundleScheduler scheduler = new BundleScheduler(props, pool, submitter, metrics);

        BundleResult result = scheduler.runCycle("interval");

        assertEquals(BundleResult.Status.EMPTY, result.getStatus());
        verifyNoInteractions(submitter);
        assertEquals(BundleScheduler.State.IDLE, scheduler.getState());
    }

    @Test
    public void trigger_during_draining_is_coalesced() {
        BundleScheduler scheduler = new BundleScheduler(props, pool, submitter, metrics);
        AtomicReference<BundleResult> nested = new AtomicReference<>();
        AtomicReference<BundleScheduler.State> stateDuringSubmit = new AtomicReference<>();
        when(submitter.submit(anyList())).thenAnswer(inv -> {
            stateDuringSubmit.set(scheduler.getState());
            // 提交期间入池的 op 留给下一轮
            pool.admit("0xcc", TestOperations.op(TestOperations.SENDER_B, 1));
            nested.set(scheduler.runCycle("size"));
            return BundleResult.submitted("0x01", Collections.emptyList());
        });
        pool.admit("0xaa", TestOperations.op(TestOperations.SENDER_A, 0));

        scheduler.runCycle("interval");

        assertEquals(BundleScheduler.State.DRAINING, stateDuringSubmit.get());
        assertEquals(BundleResult.Status.COALESCED, nested.get().getStatus());
        assertEquals(BundleScheduler.State.IDLE, scheduler.getState());
        assertTrue(pool.contains("0xcc"));
        verify(submitter, times(1)).submit(anyList());
    }

    @Test
    public void unexpected_submit_error_returns_operations_to_pool() {
        when(submitter.submit(anyList())).thenThrow(new IllegalStateException("bug"));
        BundleScheduler scheduler = new BundleScheduler(props, pool, submitter, metrics);
        pool.admit("0xaa", TestOperations.op(TestOperations.SENDER_A, 0));

        BundleResult result = scheduler.runCycle("interval");

        assertEquals(BundleResult.Status.FAILED, result.getStatus());
        assertTrue(pool.contains("0xaa"));
        assertEquals(BundleScheduler.State.IDLE, scheduler.getState());
    }

    @Test
    public void receipt_store_error_after_inclusion_does_not_resubmit() {
        MockEntryPointClient chain = new MockEntryPointClient(props.getEntryPointAddress(),
                MockEntryPointClient.DEFAULT_CHAIN_ID, new UserOperationHasher());
        KeyValueStore store = mock(KeyValueStore.class);
        doThrow(new IllegalArgumentException("ttl must be positive"))
                .when(store).set(anyString(), anyString(), any(Duration.class));
        BundleSubmitter realSubmitter = new BundleSubmitter(props, chain, new GasEstimator(chain, props), pool,
                new UserOperationRepository(store, new ObjectMapper()), metrics);
        BundleScheduler scheduler = new BundleScheduler(props, pool, realSubmitter, metrics);
        pool.admit("0xaa", TestOperations.op(TestOperations.SENDER_A, 0));

        BundleResult result = scheduler.runCycle("interval");

        assertEquals(BundleResult.Status.SUBMITTED, result.getStatus());
        assertEquals(0, pool.size());
        assertEquals(0, chain.pendingCount());
    }

    @Test
    public void timer_drains_pool_until_stopped() throws Exception {
        props.setBundleInterval(Duration.ofMillis(20));
        when(submitter.submit(anyList())).thenAnswer(inv -> {
            List<PooledOperation> batch = inv.getArgument(0);
            return BundleResult.submitted("0x01", Collections.singletonList(batch.get(0).getUserOpHash()));
        });
        BundleScheduler scheduler = new BundleScheduler(props, pool, submitter, metrics);
        pool.admit("0xaa", TestOperations.op(TestOperations.SENDER_A, 0));

        scheduler.start();
        try {
            verify(submitter, timeout(2000).atLeastOnce()).submit(anyList());
        } finally {
            scheduler.stop();
        }

        assertEquals(0, pool.size());
        assertEquals(BundleScheduler.State.IDLE, scheduler.getState());
    }
}
