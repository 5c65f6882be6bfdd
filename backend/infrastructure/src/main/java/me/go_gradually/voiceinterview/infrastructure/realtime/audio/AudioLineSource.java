package me.go_gradually.voiceinterview.infrastructure.realtime.audio;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.TargetDataLine;

public interface AudioLineSource {
    /**
     * Opens a capture line in {@code format}. Fails with
     * {@link me.go_gradually.voiceinterview.application.connection.model.MicrophoneAccessException}.
     */
    TargetDataLine open(AudioFormat format);
}
