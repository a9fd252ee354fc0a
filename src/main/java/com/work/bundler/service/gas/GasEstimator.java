package com.work.bundler.service.gas;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.bundler.config.BundlerProperties;
import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.chain.FeeData;
import com.work.bundler.core.exception.BundlerException;
import com.work.bundler.core.exception.ChainAccessException;
import com.work.bundler.core.model.FeeParameters;
import com.work.bundler.core.model.GasEstimate;
import com.work.bundler.core.model.UserOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Collections;
import java.util.function.Supplier;

/**
 * 保守的 gas 估算与当前费率查询。
 *
 * estimate：preVerificationGas 取固定基线；一次 handleOps 的 eth_estimateGas 结果 g，
 * callGasLimit = g，verificationGasLimit = g * 分子 / 分母（默认 1.5 倍，吸收估算噪声）。
 * currentFees：节点不返回数据时使用配置的兜底常量，不会仅因为预言机“沉默”而失败。
 */
public class GasEstimator {

    private static final Logger log = LoggerFactory.getLogger(GasEstimator.class);
    private static final String FEES_KEY = "fees";

    private final EntryPointClient entryPoint;
    private final BundlerProperties props;
    private final Cache<String, FeeParameters> feeCache;

    public GasEstimator(EntryPointClient entryPoint, BundlerProperties props) {
        this.entryPoint = entryPoint;
        this.props = props;
        Duration ttl = props.getFeeCacheTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            this.feeCache = null;
        } else {
            this.feeCache = Caffeine.newBuilder()
                    .maximumSize(1)
                    .expireAfterWrite(ttl)
                    .build();
        }
    }

    public GasEstimate estimate(UserOperation op) {
        BigInteger gas = call(() -> entryPoint.estimateHandleOpsGas(Collections.singletonList(op), props.getBeneficiary()),
                "estimateHandleOpsGas");
        BigInteger verification = gas
                .multiply(BigInteger.valueOf(props.getVerificationGasMultiplierNumerator()))
                .divide(BigInteger.valueOf(Math.max(1, props.getVerificationGasMultiplierDenominator())));
        return new GasEstimate(props.getPreVerificationGas(), verification, gas);
    }

    public FeeParameters currentFees() {
        if (feeCache == null) {
            return loadFees();
        }
        return feeCache.get(FEES_KEY, k -> loadFees());
    }

    private FeeParameters loadFees() {
        FeeData data = call(entryPoint::getFeeData, "getFeeData");
        BigInteger maxFee = data == null ? null : data.getGasPrice();
        BigInteger priority = data == null ? null : data.getMaxPriorityFeePerGas();
        if (maxFee == null) {
            log.debug("fee oracle returned no gasPrice, fallback={}", props.getFallbackMaxFeePerGas());
            maxFee = props.getFallbackMaxFeePerGas();
        }
        if (priority == null) {
            log.debug("fee oracle returned no maxPriorityFeePerGas, fallback={}", props.getFallbackMaxPriorityFeePerGas());
            priority = props.getFallbackMaxPriorityFeePerGas();
        }
        return new FeeParameters(maxFee, priority);
    }

    private static <T> T call(Supplier<T> supplier, String op) {
        try {
            return supplier.get();
        } catch (BundlerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ChainAccessException(op + " failed: " + e.getMessage(), e);
        }
    }
}
