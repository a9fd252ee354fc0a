package com.work.bundler.service.bundle;

import com.work.bundler.config.BundlerProperties;
import com.work.bundler.core.chain.ChainLog;
import com.work.bundler.core.chain.ChainReceipt;
import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.chain.UserOperationEvent;
import com.work.bundler.core.exception.BundlerException;
import com.work.bundler.core.model.DroppedOperation;
import com.work.bundler.core.model.FeeParameters;
import com.work.bundler.core.model.UserOperation;
import com.work.bundler.core.model.UserOperationReceipt;
import com.work.bundler.core.pool.PooledOperation;
import com.work.bundler.core.pool.RequeueOutcome;
import com.work.bundler.core.pool.UserOperationPool;
import com.work.bundler.core.store.UserOperationRepository;
import com.work.bundler.core.support.ValidationUtils;
import com.work.bundler.service.gas.GasEstimator;
import com.work.bundler.support.metrics.BundlerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 提交引擎：把一批 op 作为一笔 handleOps 交易发送并等待上链。
 *
 * 步骤：查询费率 -> 签名发送 -> 有界等待上链 -> 每个 op 写一条 receipt。
 * 1~3 任一步失败：不写任何 receipt，全部 op 按原 userOpHash 回池（attempts+1），
 * 达到上限的 op 转入死信。bundle 内单个 op 失败（UserOperationEvent.success=false）
 * 是正常结果，照常写 receipt。
 */
public class BundleSubmitter {

    private static final Logger log = LoggerFactory.getLogger(BundleSubmitter.class);

    private final BundlerProperties props;
    private final EntryPointClient entryPoint;
    private final GasEstimator gasEstimator;
    private final UserOperationPool pool;
    private final UserOperationRepository repository;
    private final BundlerMetrics metrics;

    public BundleSubmitter(BundlerProperties props,
                           EntryPointClient entryPoint,
                           GasEstimator gasEstimator,
                           UserOperationPool pool,
                           UserOperationRepository repository,
                           BundlerMetrics metrics) {
        this.props = props;
        this.entryPoint = entryPoint;
        this.gasEstimator = gasEstimator;
        this.pool = pool;
        this.repository = repository;
        this.metrics = metrics;
    }

    public BundleResult submit(List<PooledOperation> batch) {
        if (batch == null || batch.isEmpty()) {
            return BundleResult.empty();
        }
        long start = System.currentTimeMillis();
        List<UserOperation> ops = new ArrayList<>(batch.size());
        for (PooledOperation p : batch) {
            ops.add(p.getOperation());
        }

        String txHash = null;
        ChainReceipt receipt;
        try {
            FeeParameters fees = gasEstimator.currentFees();
            txHash = entryPoint.sendHandleOps(ops, props.getBeneficiary(), fees);
            log.info("bundle sent txHash={} size={} fees={}", txHash, ops.size(), fees);
            receipt = entryPoint.waitForInclusion(txHash, props.getInclusionTimeout());
            if (!receipt.isSuccess()) {
                throw new BundlerException("bundle transaction reverted: " + txHash);
            }
        } catch (Exception e) {
            return onFailure(batch, txHash, e, start);
        }

        // 交易已上链：之后的任何异常都不能让 op 回池
        List<String> included = persistReceipts(batch, receipt);
        long cost = System.currentTimeMillis() - start;
        try {
            metrics.bundleSubmitted(batch.size(), "submitted", cost);
        } catch (RuntimeException e) {
            log.warn("record bundle metrics failed txHash={} err={}", receipt.getTransactionHash(), e.toString());
        }
        log.info("bundle included txHash={} block={} size={} costMs={}", receipt.getTransactionHash(),
                receipt.getBlockNumber(), batch.size(), cost);
        return BundleResult.submitted(receipt.getTransactionHash(), included);
    }

    private BundleResult onFailure(List<PooledOperation> batch, String txHash, Exception e, long start) {
        String err = e.getMessage() == null ? e.toString() : e.getMessage();
        RequeueOutcome outcome = pool.requeue(batch, props.getMaxSubmitAttempts(), err);
        log.warn("bundle submission failed txHash={} size={} requeued={} exhausted={} superseded={} err={}",
                txHash, batch.size(), outcome.getRequeued().size(), outcome.getExhausted().size(),
                outcome.getSuperseded().size(), err);
        metrics.bundleSubmitted(batch.size(), "failed", System.currentTimeMillis() - start);

        List<String> dropped = new ArrayList<>();
        for (PooledOperation p : outcome.getExhausted()) {
            dropped.add(p.getUserOpHash());
            deadLetter(p);
        }
        List<String> requeued = new ArrayList<>();
        for (PooledOperation p : outcome.getRequeued()) {
            requeued.add(p.getUserOpHash());
        }
        return BundleResult.failed(requeued, dropped, err);
    }

    private void deadLetter(PooledOperation p) {
        log.error("userOp dropped after {} failed submissions userOpHash={} sender={} nonce={} lastError={}",
                p.getAttempts(), p.getUserOpHash(), p.getOperation().getSender(), p.getOperation().getNonce(),
                p.getLastError());
        metrics.operationDropped();
        try {
            repository.saveDropped(new DroppedOperation(p.getUserOpHash(), p.getOperation(), p.getAttempts(),
                    p.getLastError(), System.currentTimeMillis()), props.getDroppedOperationTtl());
        } catch (BundlerException e) {
            log.warn("save dropped record failed userOpHash={} err={}", p.getUserOpHash(), e.toString());
        }
    }

    /**
     * bundle 已上链：逐个写 receipt。单条构建或写入失败只记录日志，不影响其他 op，也不能回池（已在链上执行）。
     * 只采信 EntryPoint 合约自己发出的 UserOperationEvent，bundle 内其他合约伪造的同名日志一律忽略。
     */
    private List<String> persistReceipts(List<PooledOperation> batch, ChainReceipt receipt) {
        Map<String, UserOperationEvent> events = new HashMap<>();
        Map<String, ChainLog> eventLogs = new HashMap<>();
        for (ChainLog chainLog : receipt.getLogs()) {
            if (!ValidationUtils.sameAddress(chainLog.getAddress(), props.getEntryPointAddress())) {
                continue;
            }
            Optional<UserOperationEvent> ev = UserOperationEvent.decode(chainLog);
            if (ev.isPresent() && !events.containsKey(ev.get().getUserOpHash())) {
                events.put(ev.get().getUserOpHash(), ev.get());
                eventLogs.put(ev.get().getUserOpHash(), chainLog);
            }
        }

        List<String> included = new ArrayList<>(batch.size());
        for (PooledOperation p : batch) {
            String hash = p.getUserOpHash();
            try {
                UserOperationReceipt r = buildReceipt(p, receipt, events.get(hash), eventLogs.get(hash));
                repository.saveReceipt(r, props.getReceiptTtl());
                included.add(hash);
            } catch (RuntimeException e) {
                log.error("save receipt failed userOpHash={} txHash={} err={}", hash, receipt.getTransactionHash(), e.toString());
            }
        }
        return included;
    }

    UserOperationReceipt buildReceipt(PooledOperation p, ChainReceipt receipt, UserOperationEvent event, ChainLog eventLog) {
        UserOperation op = p.getOperation();
        UserOperationReceipt r = new UserOperationReceipt();
        r.setUserOpHash(p.getUserOpHash());
        r.setEntryPoint(props.getEntryPointAddress());
        r.setSender(op.getSender());
        r.setNonce(Numeric.encodeQuantity(op.getNonce()));
        r.setPaymaster(op.paymaster());
        if (event != null) {
            r.setSuccess(event.isSuccess());
            r.setActualGasCost(Numeric.encodeQuantity(event.getActualGasCost()));
            r.setActualGasUsed(Numeric.encodeQuantity(event.getActualGasUsed()));
            r.setLogs(Collections.singletonList(eventLog));
            if (!event.isSuccess()) {
                r.setReason("execution reverted");
            }
        } else {
            // 节点未返回 UserOperationEvent：按 bundle 交易整体结果记账
            BigInteger gasUsed = receipt.getGasUsed() == null ? BigInteger.ZERO : receipt.getGasUsed();
            BigInteger cost = receipt.getEffectiveGasPrice() == null ? gasUsed : gasUsed.multiply(receipt.getEffectiveGasPrice());
            r.setSuccess(receipt.isSuccess());
            r.setActualGasCost(Numeric.encodeQuantity(cost));
            r.setActualGasUsed(Numeric.encodeQuantity(gasUsed));
            r.setLogs(new ArrayList<>());
        }

        UserOperationReceipt.TransactionInfo tx = new UserOperationReceipt.TransactionInfo();
        tx.setTransactionHash(receipt.getTransactionHash());
        tx.setTransactionIndex(quantity(receipt.getTransactionIndex()));
        tx.setBlockHash(receipt.getBlockHash());
        tx.setBlockNumber(quantity(receipt.getBlockNumber()));
        tx.setCumulativeGasUsed(quantity(receipt.getCumulativeGasUsed()));
        tx.setGasUsed(quantity(receipt.getGasUsed()));
        tx.setStatus(receipt.isSuccess() ? "0x1" : "0x0");
        tx.setLogs(new ArrayList<>(receipt.getLogs()));
        r.setReceipt(tx);
        return r;
    }

    private static String quantity(BigInteger v) {
        return v == null ? null : Numeric.encodeQuantity(v);
    }
}
