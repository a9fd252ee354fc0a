package com.work.bundler.service.bundle;

import com.work.bundler.config.BundlerProperties;
import com.work.bundler.core.pool.PooledOperation;
import com.work.bundler.core.pool.RequeueOutcome;
import com.work.bundler.core.pool.UserOperationPool;
import com.work.bundler.support.metrics.BundlerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 打包调度：IDLE / DRAINING 两态。
 *
 * 触发源：
 * - 固定周期（自有单线程 timer）
 * - 入池后池内数量 >= maxBundleSize（在调用线程上同步执行一轮）
 *
 * DRAINING 期间到达的触发直接合并（不排队），期间入池的 op 由下一轮处理；
 * 同一时刻最多一个 drain+submit 周期，避免多笔 bundle 争用同一个 bundler 账户 nonce。
 */
public class BundleScheduler {

    private static final Logger log = LoggerFactory.getLogger(BundleScheduler.class);

    public enum State {
        IDLE,
        DRAINING
    }

    private final BundlerProperties props;
    private final UserOperationPool pool;
    private final BundleSubmitter submitter;
    private final BundlerMetrics metrics;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private ScheduledExecutorService timer;
    private ScheduledFuture<?> tick;

    public BundleScheduler(BundlerProperties props, UserOperationPool pool, BundleSubmitter submitter, BundlerMetrics metrics) {
        this.props = props;
        this.pool = pool;
        this.submitter = submitter;
        this.metrics = metrics;
    }

    @PostConstruct
    public synchronized void start() {
        if (timer != null) {
            return;
        }
        long intervalMs = Math.max(1L, props.getBundleInterval().toMillis());
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bundle-timer");
            t.setDaemon(true);
            return t;
        });
        this.tick = timer.scheduleWithFixedDelay(this::onInterval, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("BundleScheduler started intervalMs={} maxBundleSize={}", intervalMs, props.getMaxBundleSize());
    }

    /**
     * 停机顺序：先停 timer，再有界等待在途周期结束，避免丢失“已发送未确认”的 bundle。
     */
    @PreDestroy
    public synchronized void stop() {
        if (timer == null) {
            return;
        }
        tick.cancel(false);
        timer.shutdown();
        long deadline = System.currentTimeMillis() + props.getShutdownTimeout().toMillis();
        try {
            if (!timer.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("bundle timer did not terminate within {}", props.getShutdownTimeout());
            }
            while (draining.get() && System.currentTimeMillis() < deadline) {
                Thread.sleep(50L);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (draining.get()) {
            log.warn("BundleScheduler stopped with an in-flight bundle cycle");
        } else {
            log.info("BundleScheduler stopped");
        }
        timer = null;
    }

    /**
     * 入池成功后调用：达到阈值时同步执行一轮打包。
     */
    public Optional<BundleResult> onAdmitted() {
        int size = pool.size();
        metrics.poolSize(size);
        if (size < Math.max(1, props.getMaxBundleSize())) {
            return Optional.empty();
        }
        return Optional.of(runCycle("size"));
    }

    public State getState() {
        return draining.get() ? State.DRAINING : State.IDLE;
    }

    /**
     * 执行一轮 drain+submit；已有周期在执行时立即返回 COALESCED。
     */
    public BundleResult runCycle(String trigger) {
        if (!draining.compareAndSet(false, true)) {
            log.debug("bundle trigger coalesced trigger={}", trigger);
            return BundleResult.coalesced();
        }
        try {
            List<PooledOperation> batch = pool.drainAll();
            metrics.poolSize(pool.size());
            if (batch.isEmpty()) {
                return BundleResult.empty();
            }
            log.debug("bundle cycle trigger={} size={}", trigger, batch.size());
            try {
                return submitter.submit(batch);
            } catch (RuntimeException e) {
                // submit 在交易上链后不会抛出，走到这里说明 bundle 未能上链，回池保证 op 不丢
                log.error("bundle cycle error trigger={} size={}", trigger, batch.size(), e);
                RequeueOutcome outcome = pool.requeue(batch, props.getMaxSubmitAttempts(), e.toString());
                return BundleResult.failed(hashes(outcome.getRequeued()), hashes(outcome.getExhausted()), e.toString());
            }
        } finally {
            draining.set(false);
        }
    }

    private static List<String> hashes(List<PooledOperation> entries) {
        List<String> out = new ArrayList<>(entries.size());
        for (PooledOperation p : entries) {
            out.add(p.getUserOpHash());
        }
        return out;
    }

    private void onInterval() {
        try {
            runCycle("interval");
        } catch (Throwable t) {
            // 周期任务抛出异常会被 executor 取消后续调度
            log.error("bundle timer tick failed", t);
        }
    }
}
