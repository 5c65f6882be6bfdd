package me.go_gradually.voiceinterview.infrastructure.realtime.audio;

import me.go_gradually.voiceinterview.infrastructure.shared.config.AppProperties;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.TargetDataLine;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Reads 16-bit mono PCM frames from an open line, tracks their RMS level and hands each frame to a sink.
 */
public class MicrophoneCapture {
    private static final Logger log = Logger.getLogger(MicrophoneCapture.class.getName());

    private final TargetDataLine line;
    private final int frameBytes;
    private final Consumer<byte[]> frameSink;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile double level;
    private boolean released;

    public MicrophoneCapture(TargetDataLine line, int frameBytes, Consumer<byte[]> frameSink) {
        if (frameBytes <= 0 || frameBytes % 2 != 0) {
            throw new IllegalArgumentException("frameBytes must be a positive even number");
        }
        this.line = line;
        this.frameBytes = frameBytes;
        this.frameSink = frameSink;
    }

    public static AudioFormat formatOf(AppProperties.Audio audio) {
        return new AudioFormat(audio.getSampleRate(), 16, 1, true, false);
    }

    public static int frameBytesOf(AppProperties.Audio audio) {
        int samples = Math.max(1, Math.round(audio.getSampleRate() * audio.getFrameMs() / 1000f));
        return samples * 2;
    }

    public synchronized void start(Executor executor) {
        if (released || !running.compareAndSet(false, true)) {
            return;
        }
        line.start();
        executor.execute(this::captureLoop);
    }

    /**
     * Closes the line whether or not capture ever started. A stopped capture cannot be started again.
     */
    public synchronized void stop() {
        if (released) {
            return;
        }
        released = true;
        running.set(false);
        line.stop();
        line.close();
        level = 0.0;
    }

    public boolean isRunning() {
        return running.get();
    }

    public double level() {
        return level;
    }

    private void captureLoop() {
        byte[] buffer = new byte[frameBytes];
        while (running.get()) {
            int read = line.read(buffer, 0, buffer.length);
            if (read <= 0) {
                continue;
            }
            level = rms(buffer, read);
            try {
                frameSink.accept(Arrays.copyOf(buffer, read));
            } catch (RuntimeException e) {
                log.warning("microphone.capture sink_failure reason=" + e.getMessage());
                stop();
            }
        }
    }

    /**
     * Root mean square of little-endian signed 16-bit samples, scaled to [0, 1].
     */
    static double rms(byte[] pcm, int length) {
        int samples = length / 2;
        if (samples == 0) {
            return 0.0;
        }
        double sum = 0;
        for (int i = 0; i < samples; i++) {
            int sample = (short) ((pcm[2 * i] & 0xff) | (pcm[2 * i + 1] << 8));
            sum += (double) sample * sample;
        }
        return Math.min(1.0, Math.sqrt(sum / samples) / 32768.0);
    }
}
