package com.work.bundler.service;

import com.work.bundler.config.BundlerProperties;
import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.exception.BundlerException;
import com.work.bundler.core.exception.InvalidEntryPointException;
import com.work.bundler.core.exception.OperationRejectedException;
import com.work.bundler.core.hash.UserOperationHasher;
import com.work.bundler.core.model.GasEstimate;
import com.work.bundler.core.model.UserOperation;
import com.work.bundler.core.model.UserOperationReceipt;
import com.work.bundler.core.pool.AdmitOutcome;
import com.work.bundler.core.pool.PooledOperation;
import com.work.bundler.core.pool.UserOperationPool;
import com.work.bundler.core.store.UserOperationRepository;
import com.work.bundler.core.support.ValidationUtils;
import com.work.bundler.service.bundle.BundleScheduler;
import com.work.bundler.service.gas.GasEstimator;
import com.work.bundler.service.validation.ValidationGate;
import com.work.bundler.support.metrics.BundlerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * RPC 方法背后的业务编排：entryPoint 校验 -> 计算 hash -> 模拟校验 -> 入池 -> 阈值检查。
 *
 * 无状态（池、调度器均为注入的组件），可被任意数量的请求线程并发调用。
 */
public class UserOperationService {

    private static final Logger log = LoggerFactory.getLogger(UserOperationService.class);

    private final BundlerProperties props;
    private final EntryPointClient entryPoint;
    private final UserOperationHasher hasher;
    private final ValidationGate validationGate;
    private final UserOperationPool pool;
    private final BundleScheduler scheduler;
    private final GasEstimator gasEstimator;
    private final UserOperationRepository repository;
    private final BundlerMetrics metrics;

    public UserOperationService(BundlerProperties props,
                                EntryPointClient entryPoint,
                                UserOperationHasher hasher,
                                ValidationGate validationGate,
                                UserOperationPool pool,
                                BundleScheduler scheduler,
                                GasEstimator gasEstimator,
                                UserOperationRepository repository,
                                BundlerMetrics metrics) {
        this.props = props;
        this.entryPoint = entryPoint;
        this.hasher = hasher;
        this.validationGate = validationGate;
        this.pool = pool;
        this.scheduler = scheduler;
        this.gasEstimator = gasEstimator;
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * eth_sendUserOperation：返回 userOpHash。
     *
     * 同一 (sender, nonce) 已有不同内容的 op 在池内时，新 op 替换旧 op（旧 hash 被驱逐）。
     */
    public String sendUserOperation(UserOperation op, String requestedEntryPoint) {
        requireSupportedEntryPoint(requestedEntryPoint);
        String userOpHash = hash(op);

        try {
            validationGate.validate(op);
        } catch (OperationRejectedException e) {
            metrics.operationReceived("invalid");
            throw e;
        }
        metrics.operationReceived("valid");

        AdmitOutcome outcome = pool.admitReplacing(userOpHash, op);
        Optional<PooledOperation> replaced = outcome.getReplaced();
        if (replaced.isPresent()) {
            log.info("userOp replaced sender={} nonce={} old={} new={}", op.getSender(), op.getNonce(),
                    replaced.get().getUserOpHash(), userOpHash);
        }
        stage(userOpHash, op);
        log.info("userOp admitted userOpHash={} sender={} nonce={} new={} poolSize={}", userOpHash,
                op.getSender(), op.getNonce(), outcome.isAdded(), pool.size());

        scheduler.onAdmitted();
        return userOpHash;
    }

    /**
     * eth_estimateUserOperationGas
     */
    public GasEstimate estimateUserOperationGas(UserOperation op, String requestedEntryPoint) {
        return gasEstimator.estimate(op);
    }

    /**
     * eth_getUserOperationReceipt：未找到（含格式不合法的 hash）返回 null，不报错。
     */
    public UserOperationReceipt getUserOperationReceipt(String userOpHash) {
        if (!ValidationUtils.isHash(userOpHash)) {
            return null;
        }
        return repository.findReceipt(userOpHash.toLowerCase()).orElse(null);
    }

    /**
     * eth_supportedEntryPoints
     */
    public List<String> supportedEntryPoints() {
        return Collections.singletonList(props.getEntryPointAddress());
    }

    public String hash(UserOperation op) {
        return hasher.hash(op, props.getEntryPointAddress(), entryPoint.getChainId());
    }

    public int poolSize() {
        return pool.size();
    }

    public BundleScheduler.State schedulerState() {
        return scheduler.getState();
    }

    private void requireSupportedEntryPoint(String requestedEntryPoint) {
        if (!ValidationUtils.sameAddress(requestedEntryPoint, props.getEntryPointAddress())) {
            metrics.rejected("entry_point");
            throw new InvalidEntryPointException(requestedEntryPoint);
        }
    }

    // op:<hash> 暂存只用于排障；op 已入池，写失败不影响本次请求结果
    private void stage(String userOpHash, UserOperation op) {
        try {
            repository.stageOperation(userOpHash, op, props.getStagedOperationTtl());
        } catch (BundlerException e) {
            log.warn("stage userOp failed userOpHash={} err={}", userOpHash, e.toString());
        }
    }
}
