package me.go_gradually.voiceinterview.infrastructure.realtime.audio;

import me.go_gradually.voiceinterview.application.connection.model.MicrophoneAccessException;
import me.go_gradually.voiceinterview.application.connection.model.MicrophoneAccessException.Kind;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;

@Component
public class JavaSoundLineSource implements AudioLineSource {

    @Override
    public TargetDataLine open(AudioFormat format) {
        DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
        if (!AudioSystem.isLineSupported(info)) {
            throw new MicrophoneAccessException(Kind.NOT_FOUND, "No microphone supports " + format);
        }
        try {
            TargetDataLine line = (TargetDataLine) AudioSystem.getLine(info);
            line.open(format);
            return line;
        } catch (SecurityException e) {
            throw new MicrophoneAccessException(Kind.PERMISSION_DENIED, "Microphone access was denied", e);
        } catch (IllegalArgumentException e) {
            throw new MicrophoneAccessException(Kind.NOT_FOUND, "No microphone found", e);
        } catch (LineUnavailableException e) {
            throw new MicrophoneAccessException(Kind.OTHER, "Microphone is unavailable: " + e.getMessage(), e);
        }
    }
}
