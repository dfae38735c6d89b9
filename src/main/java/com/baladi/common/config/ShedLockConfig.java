package com.baladi.common.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.redis.spring.RedisLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

/**
 * ShedLock on Redis: a {@code @Scheduled} job runs on one instance at a time.
 *
 * <pre>
 * instance A: period rollover fires -> lock acquired -> runs
 * instance B: period rollover fires -> lock busy     -> skipped
 * </pre>
 *
 * <p>{@code defaultLockAtMostFor = "30s"}: a crashed holder releases after 30 seconds.</p>
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "30s")
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(RedisConnectionFactory connectionFactory) {
        return new RedisLockProvider(connectionFactory, "baladi-settlement");
    }
}
