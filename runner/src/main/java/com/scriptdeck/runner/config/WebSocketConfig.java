package com.scriptdeck.runner.config;

import com.scriptdeck.runner.stream.JobStreamWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final JobStreamWebSocketHandler jobStreamHandler;

    @Value("${scriptdeck.stream.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(JobStreamWebSocketHandler jobStreamHandler) {
        this.jobStreamHandler = jobStreamHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(jobStreamHandler, "/ws/{jobId}")
                .setAllowedOrigins(allowedOrigins);
    }

    /**
     * Runs viewer polls. Polls are short and never sleep, so a few threads
     * serve many viewers.
     */
    @Bean(name = "viewerPollScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler viewerPollScheduler(
            @Value("${scriptdeck.stream.scheduler-threads:4}") int threads) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threads);
        scheduler.setThreadNamePrefix("viewer-poll-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
