package com.streameast.captcha.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Configuration
public class ThreadPoolConfig {

    static final String RENDER_THREAD_PREFIX = "captcha-render-";

    @Bean(name = "captchaRenderExecutor")
    public ThreadPoolTaskExecutor captchaRenderExecutor(AppSettings appSettings) {
        // CPU bound, one render per thread
        AppSettings.ExecutorParams params = appSettings.getRenderExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(params.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(params.getCorePoolSize(), params.getMaxPoolSize()));
        executor.setQueueCapacity(params.getQueueCapacity());
        executor.setKeepAliveSeconds(params.getKeepAliveSeconds());
        executor.setThreadNamePrefix(RENDER_THREAD_PREFIX);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(appSettings.getTransport().getTimeoutSeconds());
        executor.setRejectedExecutionHandler((runnable, pool) -> {
            log.warn("Render queue full: {} active, {} queued", pool.getActiveCount(), pool.getQueue().size());
            throw new RejectedExecutionException("Render executor is saturated");
        });
        return executor;
    }
}
