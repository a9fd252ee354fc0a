package com.work.bundler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.chain.MockEntryPointClient;
import com.work.bundler.core.hash.UserOperationHasher;
import com.work.bundler.core.pool.UserOperationPool;
import com.work.bundler.core.store.InMemoryKeyValueStore;
import com.work.bundler.core.store.KeyValueStore;
import com.work.bundler.core.store.RedisKeyValueStore;
import com.work.bundler.core.store.UserOperationRepository;
import com.work.bundler.service.UserOperationService;
import com.work.bundler.service.bundle.BundleScheduler;
import com.work.bundler.service.bundle.BundleSubmitter;
import com.work.bundler.service.gas.GasEstimator;
import com.work.bundler.service.validation.ValidationGate;
import com.work.bundler.support.metrics.BundlerMetrics;
import com.work.bundler.support.metrics.NoopBundlerMetrics;
import com.work.bundler.web.JsonRpcDispatcher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 将 bundler 各组件装配为 Spring Bean。
 *
 * 组件本身不依赖 Spring（构造器注入），测试中可直接 new 出来组合。
 */
@Configuration
@EnableConfigurationProperties({BundlerProperties.class, ChainProperties.class})
public class BundlerConfiguration {

    /**
     * EntryPointClient 默认使用 mock；若设置 chain.mode=web3j，将由 Web3jConfiguration 提供实现
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public EntryPointClient entryPointClient(BundlerProperties props, ChainProperties chain, UserOperationHasher hasher) {
        return new MockEntryPointClient(props.getEntryPointAddress(), chain.getChainId(), hasher);
    }

    @Bean
    @ConditionalOnMissingBean(BundlerMetrics.class)
    public BundlerMetrics bundlerMetrics() {
        return new NoopBundlerMetrics();
    }

    @Bean
    @ConditionalOnProperty(prefix = "bundler.store", name = "mode", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueStore(redisTemplate);
    }

    /**
     * 单机/联调用：数据随进程消失。
     */
    @Bean
    @ConditionalOnProperty(prefix = "bundler.store", name = "mode", havingValue = "memory")
    public KeyValueStore inMemoryKeyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    public UserOperationRepository userOperationRepository(KeyValueStore store, ObjectMapper objectMapper) {
        return new UserOperationRepository(store, objectMapper);
    }

    @Bean
    public UserOperationHasher userOperationHasher() {
        return new UserOperationHasher();
    }

    @Bean
    public UserOperationPool userOperationPool() {
        return new UserOperationPool();
    }

    @Bean
    public ValidationGate validationGate(EntryPointClient entryPoint, BundlerProperties props, BundlerMetrics metrics) {
        return new ValidationGate(entryPoint, props, metrics);
    }

    @Bean
    public GasEstimator gasEstimator(EntryPointClient entryPoint, BundlerProperties props) {
        return new GasEstimator(entryPoint, props);
    }

    @Bean
    public BundleSubmitter bundleSubmitter(BundlerProperties props,
                                           EntryPointClient entryPoint,
                                           GasEstimator gasEstimator,
                                           UserOperationPool pool,
                                           UserOperationRepository repository,
                                           BundlerMetrics metrics) {
        return new BundleSubmitter(props, entryPoint, gasEstimator, pool, repository, metrics);
    }

    /**
     * start/stop 由 @PostConstruct / @PreDestroy 驱动。
     */
    @Bean
    public BundleScheduler bundleScheduler(BundlerProperties props,
                                           UserOperationPool pool,
                                           BundleSubmitter submitter,
                                           BundlerMetrics metrics) {
        return new BundleScheduler(props, pool, submitter, metrics);
    }

    @Bean
    public UserOperationService userOperationService(BundlerProperties props,
                                                     EntryPointClient entryPoint,
                                                     UserOperationHasher hasher,
                                                     ValidationGate validationGate,
                                                     UserOperationPool pool,
                                                     BundleScheduler scheduler,
                                                     GasEstimator gasEstimator,
                                                     UserOperationRepository repository,
                                                     BundlerMetrics metrics) {
        return new UserOperationService(props, entryPoint, hasher, validationGate, pool, scheduler,
                gasEstimator, repository, metrics);
    }

    @Bean
    public JsonRpcDispatcher jsonRpcDispatcher(UserOperationService service, ObjectMapper objectMapper) {
        return new JsonRpcDispatcher(service, objectMapper);
    }
}
