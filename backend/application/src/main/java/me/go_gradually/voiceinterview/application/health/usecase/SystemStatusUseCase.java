package me.go_gradually.voiceinterview.application.health.usecase;

import me.go_gradually.voiceinterview.application.health.model.HealthStatus;
import me.go_gradually.voiceinterview.application.health.policy.SystemStatusPolicy;
import me.go_gradually.voiceinterview.application.health.port.HealthPort;
import me.go_gradually.voiceinterview.application.shared.async.Timeouts;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.view.model.MessageArea;
import me.go_gradually.voiceinterview.application.view.model.MessageLevel;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

public class SystemStatusUseCase {
    private static final Logger log = Logger.getLogger(SystemStatusUseCase.class.getName());

    private final HealthPort healthPort;
    private final SystemStatusPolicy policy;
    private final EventLoop loop;
    private final InterviewView view;

    public SystemStatusUseCase(HealthPort healthPort, SystemStatusPolicy policy, EventLoop loop, InterviewView view) {
        this.healthPort = healthPort;
        this.policy = policy;
        this.loop = loop;
        this.view = view;
    }

    public CompletableFuture<MessageLevel> check() {
        return Timeouts.within(healthPort::check, policy.healthCheckTimeout(), loop,
                        () -> new CompletionException(new TimeoutException("Health check timed out")))
                .handleAsync(this::publish, loop.asExecutor());
    }

    private MessageLevel publish(HealthStatus status, Throwable error) {
        if (error != null) {
            Throwable cause = Timeouts.unwrap(error);
            log.warning("system.status check failure reason=" + Timeouts.messageOf(cause));
            if (cause instanceof TimeoutException) {
                view.systemStatus(MessageLevel.DANGER, "Connection Timeout",
                        "Backend server may be starting up. Please wait and refresh.");
            } else {
                view.systemStatus(MessageLevel.DANGER, "System Check Failed",
                        "Please verify backend connection and refresh the page");
            }
            return MessageLevel.DANGER;
        }
        if (status == null || !status.healthy()) {
            view.systemStatus(MessageLevel.WARNING, "System Partially Ready", "Some services may not be available");
            return MessageLevel.WARNING;
        }
        view.systemStatus(MessageLevel.SUCCESS, "System Ready", "All services configured");
        if (!status.realtimeConfigured()) {
            view.showMessage(MessageArea.SETUP, MessageLevel.WARNING,
                    "Real-time interview service is not available. Please refresh the page.");
        }
        return MessageLevel.SUCCESS;
    }
}
