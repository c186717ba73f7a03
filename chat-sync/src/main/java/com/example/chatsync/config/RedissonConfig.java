package com.example.chatsync.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson client carrying the chat channels. Connection coordinates come from
 * {@code spring.data.redis}, pub/sub tuning from {@code chat.transport}.
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(
            RedisProperties redisProperties,
            ChatSyncProperties chatSyncProperties,
            @Value("${spring.application.name:chat-sync}") String applicationName) {
        ChatSyncProperties.Transport transport = chatSyncProperties.getTransport();
        Config config = new Config();
        config.useSingleServer()
                .setAddress(buildAddress(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setUsername(redisProperties.getUsername())
                .setPassword(
                        StringUtils.hasText(redisProperties.getPassword())
                                ? redisProperties.getPassword()
                                : null)
                .setClientName(applicationName)
                .setConnectTimeout(Math.toIntExact(transport.getConnectTimeout().toMillis()))
                .setPingConnectionInterval(Math.toIntExact(transport.getPingInterval().toMillis()))
                .setSubscriptionConnectionPoolSize(transport.getSubscriptionConnections())
                .setSubscriptionsPerConnection(transport.getSubscriptionsPerConnection());
        return Redisson.create(config);
    }

    private String buildAddress(RedisProperties redisProperties) {
        boolean sslEnabled = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        String scheme = sslEnabled ? "rediss://" : "redis://";
        return scheme + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
