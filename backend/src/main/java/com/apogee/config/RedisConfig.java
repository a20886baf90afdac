package com.apogee.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.support.RetryTemplate;

/**
 * Redis connection for the job broker. Job hashes and queue lists are plain strings so the
 * external workers can read them without knowing any Java serialization format.
 */
@Slf4j
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.url:redis://localhost:6379}")
    private String redisUrl;

    @Value("${spring.data.redis.timeout:2000ms}")
    private Duration timeout;

    @Value("${spring.data.redis.lettuce.pool.max-active:8}")
    private int maxActive;

    @Value("${spring.data.redis.lettuce.pool.max-idle:8}")
    private int maxIdle;

    @Value("${spring.data.redis.lettuce.pool.min-idle:0}")
    private int minIdle;

    @Value("${spring.data.redis.lettuce.pool.max-wait:-1ms}")
    private Duration maxWait;

    @Value("${spring.data.redis.lettuce.shutdown-timeout:100ms}")
    private Duration shutdownTimeout;

    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        RedisURI uri = RedisURI.create(redisUrl);

        RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
        redisConfig.setHostName(uri.getHost());
        redisConfig.setPort(uri.getPort());
        redisConfig.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            redisConfig.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            redisConfig.setPassword(uri.getPassword());
        }

        GenericObjectPoolConfig<?> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setMaxWait(maxWait);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setBlockWhenExhausted(true);

        SocketOptions socketOptions =
                SocketOptions.builder().connectTimeout(timeout).keepAlive(true).build();

        ClientOptions clientOptions =
                ClientOptions.builder()
                        .socketOptions(socketOptions)
                        .autoReconnect(true)
                        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                        .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder clientConfig =
                LettucePoolingClientConfiguration.builder()
                        .poolConfig(poolConfig)
                        .clientOptions(clientOptions)
                        .commandTimeout(timeout)
                        .shutdownTimeout(shutdownTimeout);
        if (uri.isSsl()) {
            clientConfig.useSsl();
        }

        LettuceConnectionFactory factory =
                new LettuceConnectionFactory(redisConfig, clientConfig.build());
        factory.setValidateConnection(true);

        log.info(
                "Job broker connection configured - host: {}, port: {}, database: {}, maxActive:"
                        + " {}",
                uri.getHost(),
                uri.getPort(),
                uri.getDatabase(),
                maxActive);

        return factory;
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(connectionFactory);
        template.setEnableTransactionSupport(false);
        return template;
    }

    /** Retries a single broker read a few times before the queue counts as unavailable. */
    @Bean("jobQueueRetryTemplate")
    public RetryTemplate jobQueueRetryTemplate(PipelineProperties properties) {
        return RetryTemplate.builder()
                .maxAttempts(properties.getQueue().getReadRetryAttempts())
                .exponentialBackoff(200, 2.0, 2000)
                .retryOn(RedisConnectionFailureException.class)
                .retryOn(TransientDataAccessException.class)
                .traversingCauses()
                .build();
    }
}
