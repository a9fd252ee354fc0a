package com.work.bundler.service.validation;

import com.work.bundler.config.BundlerProperties;
import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.chain.SimulationResult;
import com.work.bundler.core.exception.BundlerException;
import com.work.bundler.core.exception.ChainAccessException;
import com.work.bundler.core.exception.OperationRejectedException;
import com.work.bundler.core.model.UserOperation;
import com.work.bundler.support.metrics.BundlerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 入池前的准入校验：在固定 gas 上限下调用 EntryPoint.simulateValidation。
 *
 * - 正常返回：通过
 * - validationData != 0 或模拟 revert：{@link OperationRejectedException}（不重试）
 * - 链访问失败：{@link ChainAccessException}（可重试，与拒绝区分）
 */
public class ValidationGate {

    private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);

    private final EntryPointClient entryPoint;
    private final BundlerProperties props;
    private final BundlerMetrics metrics;

    public ValidationGate(EntryPointClient entryPoint, BundlerProperties props, BundlerMetrics metrics) {
        this.entryPoint = entryPoint;
        this.props = props;
        this.metrics = metrics;
    }

    public void validate(UserOperation op) {
        long start = System.currentTimeMillis();
        SimulationResult result;
        try {
            result = entryPoint.simulateValidation(op, props.getSimulationGasLimit());
        } catch (BundlerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ChainAccessException("simulateValidation failed: " + e.getMessage(), e);
        } finally {
            metrics.validationDuration(System.currentTimeMillis() - start);
        }

        if (result.isReverted()) {
            String reason = result.getRevertReason() == null ? "simulation reverted" : result.getRevertReason();
            log.info("userOp rejected sender={} nonce={} reason={}", op.getSender(), op.getNonce(), reason);
            metrics.rejected("revert");
            throw new OperationRejectedException(reason);
        }
        if (result.getValidationData().compareTo(BigInteger.ZERO) != 0) {
            log.info("userOp rejected sender={} nonce={} validationData={}", op.getSender(), op.getNonce(),
                    result.getValidationData());
            metrics.rejected("validation_data");
            throw new OperationRejectedException("User operation validation failed");
        }
    }
}
