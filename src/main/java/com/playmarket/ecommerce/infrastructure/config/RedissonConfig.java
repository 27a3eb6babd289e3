package com.playmarket.ecommerce.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Redisson 설정 (분산 락)
 *
 * Redisson은 spring.data.redis 설정을 자동으로 읽지 않으므로 같은 값으로 직접 구성한다.
 * 용도: 고객별 checkout 직렬화
 */
@Configuration
public class RedissonConfig {

    @Value("${spring.data.redis.host}")
    private String host;

    @Value("${spring.data.redis.port}")
    private int port;

    @Value("${spring.data.redis.database:0}")
    private int database;

    // "2000ms", "2s" 모두 Duration으로 바인딩
    @Value("${spring.data.redis.timeout:2s}")
    private Duration timeout;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        return Redisson.create(singleServerConfig(host, port, database, timeout));
    }

    static Config singleServerConfig(String host, int port, int database, Duration timeout) {
        Config config = new Config();
        config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setDatabase(database)
                .setTimeout(Math.toIntExact(timeout.toMillis()))
                .setConnectionPoolSize(16)
                .setConnectionMinimumIdleSize(4);
        return config;
    }
}
