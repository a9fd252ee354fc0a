package com.work.bundler.service.bundle;

import java.util.Collections;
import java.util.List;

/**
 * 一次打包周期的结果（不持久化）。
 */
public class BundleResult {

    public enum Status {
        /**
         * bundle 交易已上链，receipt 已写入。
         */
        SUBMITTED,
        /**
         * 整体提交失败，op 已回池（或转入死信）。
         */
        FAILED,
        /**
         * 池为空，未接触链。
         */
        EMPTY,
        /**
         * 已有周期在执行，本次触发被合并。
         */
        COALESCED
    }

    private final Status status;
    private final String transactionHash;
    private final List<String> included;
    private final List<String> requeued;
    private final List<String> dropped;
    private final String error;

    private BundleResult(Status status, String transactionHash, List<String> included,
                         List<String> requeued, List<String> dropped, String error) {
        this.status = status;
        this.transactionHash = transactionHash;
        this.included = Collections.unmodifiableList(included);
        this.requeued = Collections.unmodifiableList(requeued);
        this.dropped = Collections.unmodifiableList(dropped);
        this.error = error;
    }

    public static BundleResult submitted(String transactionHash, List<String> included) {
        return new BundleResult(Status.SUBMITTED, transactionHash, included,
                Collections.emptyList(), Collections.emptyList(), null);
    }

    public static BundleResult failed(List<String> requeued, List<String> dropped, String error) {
        return new BundleResult(Status.FAILED, null, Collections.emptyList(), requeued, dropped, error);
    }

    public static BundleResult empty() {
        return new BundleResult(Status.EMPTY, null, Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList(), null);
    }

    public static BundleResult coalesced() {
        return new BundleResult(Status.COALESCED, null, Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList(), null);
    }

    public Status getStatus() {
        return status;
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public List<String> getIncluded() {
        return included;
    }

    public List<String> getRequeued() {
        return requeued;
    }

    public List<String> getDropped() {
        return dropped;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "BundleResult{status=" + status + ", tx=" + transactionHash + ", included=" + included.size()
                + ", requeued=" + requeued.size() + ", dropped=" + dropped.size() + "}";
    }
}
