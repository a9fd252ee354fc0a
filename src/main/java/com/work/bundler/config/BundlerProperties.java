package com.work.bundler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Bundler 配置项（application.yml 中 bundler.* 前缀，每项都可由同名环境变量覆盖）。
 */
@Validated
@ConfigurationProperties(prefix = "bundler")
public class BundlerProperties {

    /**
     * 唯一支持的 EntryPoint 合约地址。
     */
    @NotBlank
    private String entryPointAddress = "0x5FF137D4b0FDCD49DcA30c7CF57E578a026d2789";

    /**
     * handleOps 手续费收款地址。
     */
    @NotBlank
    private String beneficiary = "0x0000000000000000000000000000000000000000";

    /**
     * bundler 签名私钥（hex），仅 chain.mode=web3j 时需要。
     */
    private String privateKey = "";

    /**
     * 池内数量达到该值时立即同步打包（软上限，不拒绝入池）。
     */
    @Min(1)
    private int maxBundleSize = 10;

    /**
     * 定时打包周期。
     */
    private Duration bundleInterval = Duration.ofMillis(2000);

    /**
     * 单个 op 最多参与多少次失败的提交，超过则转入 dropped（死信）。
     */
    @Min(1)
    private int maxSubmitAttempts = 5;

    /**
     * 等待 bundle 交易上链的上限，超时按提交失败处理。
     */
    private Duration inclusionTimeout = Duration.ofMinutes(2);

    private Duration receiptTtl = Duration.ofHours(24);

    private Duration stagedOperationTtl = Duration.ofHours(1);

    private Duration droppedOperationTtl = Duration.ofHours(24);

    /**
     * simulateValidation 的固定 gas 上限，保证模拟不会无界执行。
     */
    private BigInteger simulationGasLimit = BigInteger.valueOf(10_000_000L);

    /**
     * preVerificationGas 的固定基线。
     */
    private BigInteger preVerificationGas = BigInteger.valueOf(50_000L);

    /**
     * verificationGasLimit 安全系数（分子/分母），默认 1.5 倍。
     */
    private int verificationGasMultiplierNumerator = 3;

    private int verificationGasMultiplierDenominator = 2;

    /**
     * 费率预言机无数据时的兜底值（wei）。
     */
    private BigInteger fallbackMaxFeePerGas = BigInteger.valueOf(1_000_000_000L);

    private BigInteger fallbackMaxPriorityFeePerGas = BigInteger.valueOf(1_000_000_000L);

    /**
     * 费率查询结果的本地缓存时长（<=0 表示不缓存）。
     */
    private Duration feeCacheTtl = Duration.ofSeconds(2);

    /**
     * 停机时等待在途打包周期完成的上限。
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private Store store = new Store();

    public static class Store {

        /**
         * redis 或 memory
         */
        private String mode = "redis";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public String getEntryPointAddress() {
        return entryPointAddress;
    }

    public void setEntryPointAddress(String entryPointAddress) {
        this.entryPointAddress = entryPointAddress;
    }

    public String getBeneficiary() {
        return beneficiary;
    }

    public void setBeneficiary(String beneficiary) {
        this.beneficiary = beneficiary;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public int getMaxBundleSize() {
        return maxBundleSize;
    }

    public void setMaxBundleSize(int maxBundleSize) {
        this.maxBundleSize = maxBundleSize;
    }

    public Duration getBundleInterval() {
        return bundleInterval;
    }

    public void setBundleInterval(Duration bundleInterval) {
        this.bundleInterval = bundleInterval;
    }

    public int getMaxSubmitAttempts() {
        return maxSubmitAttempts;
    }

    public void setMaxSubmitAttempts(int maxSubmitAttempts) {
        this.maxSubmitAttempts = maxSubmitAttempts;
    }

    public Duration getInclusionTimeout() {
        return inclusionTimeout;
    }

    public void setInclusionTimeout(Duration inclusionTimeout) {
        this.inclusionTimeout = inclusionTimeout;
    }

    public Duration getReceiptTtl() {
        return receiptTtl;
    }

    public void setReceiptTtl(Duration receiptTtl) {
        this.receiptTtl = receiptTtl;
    }

    public Duration getStagedOperationTtl() {
        return stagedOperationTtl;
    }

    public void setStagedOperationTtl(Duration stagedOperationTtl) {
        this.stagedOperationTtl = stagedOperationTtl;
    }

    public Duration getDroppedOperationTtl() {
        return droppedOperationTtl;
    }

    public void setDroppedOperationTtl(Duration droppedOperationTtl) {
        this.droppedOperationTtl = droppedOperationTtl;
    }

    public BigInteger getSimulationGasLimit() {
        return simulationGasLimit;
    }

    public void setSimulationGasLimit(BigInteger simulationGasLimit) {
        this.simulationGasLimit = simulationGasLimit;
    }

    public BigInteger getPreVerificationGas() {
        return preVerificationGas;
    }

    public void setPreVerificationGas(BigInteger preVerificationGas) {
        this.preVerificationGas = preVerificationGas;
    }

    public int getVerificationGasMultiplierNumerator() {
        return verificationGasMultiplierNumerator;
    }

    public void setVerificationGasMultiplierNumerator(int verificationGasMultiplierNumerator) {
        this.verificationGasMultiplierNumerator = verificationGasMultiplierNumerator;
    }

    public int getVerificationGasMultiplierDenominator() {
        return verificationGasMultiplierDenominator;
    }

    public void setVerificationGasMultiplierDenominator(int verificationGasMultiplierDenominator) {
        this.verificationGasMultiplierDenominator = verificationGasMultiplierDenominator;
    }

    public BigInteger getFallbackMaxFeePerGas() {
        return fallbackMaxFeePerGas;
    }

    public void setFallbackMaxFeePerGas(BigInteger fallbackMaxFeePerGas) {
        this.fallbackMaxFeePerGas = fallbackMaxFeePerGas;
    }

    public BigInteger getFallbackMaxPriorityFeePerGas() {
        return fallbackMaxPriorityFeePerGas;
    }

    public void setFallbackMaxPriorityFeePerGas(BigInteger fallbackMaxPriorityFeePerGas) {
        this.fallbackMaxPriorityFeePerGas = fallbackMaxPriorityFeePerGas;
    }

    public Duration getFeeCacheTtl() {
        return feeCacheTtl;
    }

    public void setFeeCacheTtl(Duration feeCacheTtl) {
        this.feeCacheTtl = feeCacheTtl;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }
}
