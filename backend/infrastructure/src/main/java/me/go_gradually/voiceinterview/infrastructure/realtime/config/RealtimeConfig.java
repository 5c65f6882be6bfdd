package me.go_gradually.voiceinterview.infrastructure.realtime.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RealtimeConfig {
    @Bean(name = "audioExecutor", destroyMethod = "shutdownNow")
    public ExecutorService audioExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "voiceinterview-audio-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
