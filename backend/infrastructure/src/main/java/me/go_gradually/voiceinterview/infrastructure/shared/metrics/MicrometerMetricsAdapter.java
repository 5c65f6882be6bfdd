package me.go_gradually.voiceinterview.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.voiceinterview.application.shared.port.MetricsPort;
import me.go_gradually.voiceinterview.domain.connection.ConnectionFailureCause;
import me.go_gradually.voiceinterview.domain.report.ReportDispatchOutcome;
import me.go_gradually.voiceinterview.domain.setup.SetupStep;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordSetupStepLatency(SetupStep step, Duration duration) {
        Timer.builder("setup.step.latency")
                .tag("step", step.code())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }

    @Override
    public void incrementSetupFailure(SetupStep step) {
        meterRegistry.counter("setup.failures", "step", step.code()).increment();
    }

    @Override
    public void incrementConnectionAttempt() {
        meterRegistry.counter("connection.attempts").increment();
    }

    @Override
    public void incrementConnectionRetry() {
        meterRegistry.counter("connection.retries").increment();
    }

    @Override
    public void incrementConnectionFailure(ConnectionFailureCause cause) {
        meterRegistry.counter("connection.failures", "cause", tagOf(cause)).increment();
    }

    @Override
    public void incrementStatusPoll() {
        meterRegistry.counter("status.polls").increment();
    }

    @Override
    public void incrementStatusPollError() {
        meterRegistry.counter("status.poll_errors").increment();
    }

    @Override
    public void incrementReportDispatch(ReportDispatchOutcome outcome) {
        meterRegistry.counter("report.dispatches", "outcome", tagOf(outcome)).increment();
    }

    private String tagOf(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
