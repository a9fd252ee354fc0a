package com.work.bundler.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台侧可提供自定义 Bean 接入具体实现。
 */
public interface BundlerMetrics {

    /**
     * @param status valid / invalid
     */
    default void operationReceived(String status) {
    }

    default void rejected(String reason) {
    }

    /**
     * @param result submitted / failed
     */
    default void bundleSubmitted(int size, String result, long durationMillis) {
    }

    default void operationDropped() {
    }

    default void poolSize(int size) {
    }

    default void validationDuration(long durationMillis) {
    }
}
