package me.go_gradually.voiceinterview.infrastructure.realtime.audio;

import me.go_gradually.voiceinterview.application.connection.port.MicrophoneProbe;
import me.go_gradually.voiceinterview.infrastructure.shared.config.AppProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.sound.sampled.TargetDataLine;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Opens the capture device once and releases it, so permission and device problems surface before the room join.
 */
@Component
public class JavaSoundMicrophoneProbe implements MicrophoneProbe {
    private static final Logger log = Logger.getLogger(JavaSoundMicrophoneProbe.class.getName());

    private final AudioLineSource lineSource;
    private final AppProperties properties;
    private final Executor audioExecutor;

    public JavaSoundMicrophoneProbe(AudioLineSource lineSource,
                                    AppProperties properties,
                                    @Qualifier("audioExecutor") Executor audioExecutor) {
        this.lineSource = lineSource;
        this.properties = properties;
        this.audioExecutor = audioExecutor;
    }

    @Override
    public CompletableFuture<Void> probe() {
        return CompletableFuture.runAsync(() -> {
            TargetDataLine line = lineSource.open(MicrophoneCapture.formatOf(properties.getAudio()));
            line.close();
            log.fine("microphone.probe ok");
        }, audioExecutor);
    }
}
