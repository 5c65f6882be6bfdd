package me.go_gradually.voiceinterview.bootstrap;

import me.go_gradually.voiceinterview.application.connection.policy.ConnectionPolicy;
import me.go_gradually.voiceinterview.application.connection.port.MicrophoneProbe;
import me.go_gradually.voiceinterview.application.connection.port.RealtimeTransport;
import me.go_gradually.voiceinterview.application.connection.usecase.ConnectionSupervisor;
import me.go_gradually.voiceinterview.application.connection.usecase.SessionConnector;
import me.go_gradually.voiceinterview.application.console.usecase.InterviewConsoleUseCase;
import me.go_gradually.voiceinterview.application.form.policy.FormPolicy;
import me.go_gradually.voiceinterview.application.form.usecase.FormGateUseCase;
import me.go_gradually.voiceinterview.application.health.policy.SystemStatusPolicy;
import me.go_gradually.voiceinterview.application.health.port.HealthPort;
import me.go_gradually.voiceinterview.application.health.usecase.SystemStatusUseCase;
import me.go_gradually.voiceinterview.application.report.policy.CompletionPolicy;
import me.go_gradually.voiceinterview.application.report.port.ReportPort;
import me.go_gradually.voiceinterview.application.report.usecase.CompletionDispatcher;
import me.go_gradually.voiceinterview.application.report.usecase.ReportArchive;
import me.go_gradually.voiceinterview.application.session.port.SessionStatusPort;
import me.go_gradually.voiceinterview.application.setup.policy.SetupPolicy;
import me.go_gradually.voiceinterview.application.setup.port.InterviewSetupPort;
import me.go_gradually.voiceinterview.application.setup.usecase.SetupPipelineUseCase;
import me.go_gradually.voiceinterview.application.shared.port.EventLoop;
import me.go_gradually.voiceinterview.application.shared.port.MetricsPort;
import me.go_gradually.voiceinterview.application.status.policy.StatusPollPolicy;
import me.go_gradually.voiceinterview.application.status.usecase.StatusReconciler;
import me.go_gradually.voiceinterview.application.view.usecase.InterviewView;
import me.go_gradually.voiceinterview.infrastructure.shared.loop.ScheduledEventLoop;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.logging.Logger;

@Configuration
public class UseCaseConfig {
    private static final Logger log = Logger.getLogger(UseCaseConfig.class.getName());

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService interviewLoopScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "voiceinterview-loop");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public EventLoop eventLoop(ScheduledExecutorService interviewLoopScheduler) {
        return new ScheduledEventLoop(interviewLoopScheduler);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InterviewView interviewView() {
        return new InterviewView();
    }

    @Bean
    public ReportArchive reportArchive() {
        return new ReportArchive();
    }

    @Bean
    public FormGateUseCase formGateUseCase(FormPolicy formPolicy, EventLoop eventLoop, InterviewView interviewView) {
        return new FormGateUseCase(formPolicy, eventLoop, interviewView);
    }

    @Bean
    public CompletionDispatcher completionDispatcher(ReportPort reportPort,
                                                     ReportArchive reportArchive,
                                                     CompletionPolicy completionPolicy,
                                                     EventLoop eventLoop,
                                                     InterviewView interviewView,
                                                     MetricsPort metricsPort) {
        return new CompletionDispatcher(reportPort, reportArchive, completionPolicy, eventLoop, interviewView, metricsPort);
    }

    @Bean
    public StatusReconciler statusReconciler(SessionStatusPort sessionStatusPort,
                                             CompletionDispatcher completionDispatcher,
                                             StatusPollPolicy statusPollPolicy,
                                             EventLoop eventLoop,
                                             InterviewView interviewView,
                                             MetricsPort metricsPort) {
        return new StatusReconciler(sessionStatusPort, completionDispatcher, statusPollPolicy, eventLoop,
                interviewView, metricsPort);
    }

    @Bean
    public SessionConnector sessionConnector(MicrophoneProbe microphoneProbe,
                                             RealtimeTransport realtimeTransport,
                                             SessionStatusPort sessionStatusPort,
                                             ConnectionPolicy connectionPolicy,
                                             EventLoop eventLoop,
                                             Clock clock) {
        return new SessionConnector(microphoneProbe, realtimeTransport, sessionStatusPort, connectionPolicy,
                eventLoop, clock);
    }

    @Bean
    public ConnectionSupervisor connectionSupervisor(SessionConnector sessionConnector,
                                                     StatusReconciler statusReconciler,
                                                     ConnectionPolicy connectionPolicy,
                                                     EventLoop eventLoop,
                                                     InterviewView interviewView,
                                                     MetricsPort metricsPort) {
        return new ConnectionSupervisor(sessionConnector, statusReconciler, connectionPolicy, eventLoop,
                interviewView, metricsPort);
    }

    @Bean
    public SetupPipelineUseCase setupPipelineUseCase(InterviewSetupPort interviewSetupPort,
                                                     FormGateUseCase formGateUseCase,
                                                     ConnectionSupervisor connectionSupervisor,
                                                     SetupPolicy setupPolicy,
                                                     EventLoop eventLoop,
                                                     InterviewView interviewView,
                                                     MetricsPort metricsPort) {
        return new SetupPipelineUseCase(interviewSetupPort, formGateUseCase, connectionSupervisor, setupPolicy,
                eventLoop, interviewView, metricsPort);
    }

    @Bean
    public SystemStatusUseCase systemStatusUseCase(HealthPort healthPort,
                                                   SystemStatusPolicy systemStatusPolicy,
                                                   EventLoop eventLoop,
                                                   InterviewView interviewView) {
        return new SystemStatusUseCase(healthPort, systemStatusPolicy, eventLoop, interviewView);
    }

    @Bean
    public InterviewConsoleUseCase interviewConsoleUseCase(EventLoop eventLoop,
                                                           FormGateUseCase formGateUseCase,
                                                           SetupPipelineUseCase setupPipelineUseCase,
                                                           ConnectionSupervisor connectionSupervisor,
                                                           CompletionDispatcher completionDispatcher,
                                                           ReportArchive reportArchive,
                                                           SystemStatusUseCase systemStatusUseCase,
                                                           InterviewView interviewView) {
        return new InterviewConsoleUseCase(
                eventLoop,
                formGateUseCase,
                setupPipelineUseCase,
                connectionSupervisor,
                completionDispatcher,
                reportArchive,
                systemStatusUseCase,
                interviewView
        );
    }

    @Bean
    public ApplicationRunner systemStatusOnStartup(InterviewConsoleUseCase interviewConsoleUseCase) {
        return args -> interviewConsoleUseCase.checkSystemStatus().whenComplete((level, error) -> {
            if (error != null) {
                log.warning("system_status.startup failed reason=" + error.getMessage());
                return;
            }
            log.info("system_status.startup level=" + level.code());
        });
    }
}
