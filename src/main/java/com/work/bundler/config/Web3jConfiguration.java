package com.work.bundler.config;

import com.work.bundler.core.chain.EntryPointClient;
import com.work.bundler.core.chain.web3j.Web3jEntryPointClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    private static final Logger log = LoggerFactory.getLogger(Web3jConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean
    public EntryPointClient web3jEntryPointClient(Web3j web3j, BundlerProperties props, ChainProperties chain) {
        Credentials credentials = null;
        if (props.getPrivateKey() != null && !props.getPrivateKey().trim().isEmpty()) {
            credentials = Credentials.create(props.getPrivateKey().trim());
            log.info("bundler signer address={}", credentials.getAddress());
        } else {
            // 未配置私钥时仍可提供模拟与估算，发送 handleOps 会失败并回池
            log.warn("bundler.private-key is empty, bundles cannot be submitted");
        }
        return new Web3jEntryPointClient(web3j, props.getEntryPointAddress(), credentials,
                chain.getPollInterval(), chain.getChainId());
    }
}
