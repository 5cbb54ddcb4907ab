package org.jaffre.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool partagé par les minuteurs de partie (tours, plis, reconnexion, sauvegarde différée).
 */
@Configuration
public class SchedulerConfig {

    @Value("${scheduler.clock.core-pool-size:2}")
    private int corePoolSize;

    @Bean(name = "gameEventScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor gameEventScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "game-timer-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        // un minuteur annulé quitte la file tout de suite
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
