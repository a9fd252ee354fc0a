package com.work.bundler.core.chain;

import com.work.bundler.core.model.FeeParameters;
import com.work.bundler.core.model.UserOperation;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

/**
 * EntryPoint 合约与链节点的最小交互端口。
 *
 * 约定：所有网络/节点错误统一抛 {@link com.work.bundler.core.exception.ChainAccessException}；
 * 合约层面的拒绝通过返回值表达（例如 {@link SimulationResult#isReverted()}）。
 */
public interface EntryPointClient {

    /**
     * 链 ID（eth_chainId），实现可缓存。
     */
    long getChainId();

    /**
     * 在固定 gas 上限下模拟校验（只读，不产生链上副作用）。
     */
    SimulationResult simulateValidation(UserOperation op, BigInteger gasLimit);

    /**
     * 对 handleOps(ops, beneficiary) 做一次 eth_estimateGas。
     */
    BigInteger estimateHandleOpsGas(List<UserOperation> ops, String beneficiary);

    /**
     * 当前费率（eth_gasPrice / eth_maxPriorityFeePerGas）。
     */
    FeeData getFeeData();

    /**
     * 签名并发送一笔 handleOps 交易，返回 txHash。
     */
    String sendHandleOps(List<UserOperation> ops, String beneficiary, FeeParameters fees);

    /**
     * 阻塞等待交易上链，超过 timeout 抛 ChainAccessException。
     */
    ChainReceipt waitForInclusion(String txHash, Duration timeout);
}
