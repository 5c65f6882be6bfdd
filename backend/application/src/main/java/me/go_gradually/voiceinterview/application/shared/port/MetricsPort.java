package me.go_gradually.voiceinterview.application.shared.port;

import me.go_gradually.voiceinterview.domain.connection.ConnectionFailureCause;
import me.go_gradually.voiceinterview.domain.report.ReportDispatchOutcome;
import me.go_gradually.voiceinterview.domain.setup.SetupStep;

import java.time.Duration;

public interface MetricsPort {
    void recordSetupStepLatency(SetupStep step, Duration duration);

    void incrementSetupFailure(SetupStep step);

    void incrementConnectionAttempt();

    void incrementConnectionRetry();

    void incrementConnectionFailure(ConnectionFailureCause cause);

    void incrementStatusPoll();

    void incrementStatusPollError();

    void incrementReportDispatch(ReportDispatchOutcome outcome);
}
