package com.etphysics.omnimeasure.audio;

import com.etphysics.omnimeasure.alerts.AlertService;
import com.etphysics.omnimeasure.alerts.AudioCrashedEvent;
import com.etphysics.omnimeasure.alerts.GlobalUncaughtHandler;
import com.etphysics.omnimeasure.engine.EngineConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Background microphone capture.
 *
 * Runs on its own thread, independent of the sensor frame path. Fills one block of exactly
 * {@code audioFftSize} samples and publishes it into the {@link AudioHandoff} only when complete.
 * Open/read failures raise AUDIO_UNAVAILABLE, close the source, back off and retry.
 */
@Slf4j
@Service
public class AudioCaptureService {

    public static final String ALERT_UNAVAILABLE = "AUDIO_UNAVAILABLE";

    // ==== Config ====
    @Value("${omnimeasure.audio.enabled:true}")          private boolean enabled;
    @Value("${omnimeasure.audio.reopenBackoffMs:2000}")  private long reopenBackoffMs;

    // ==== Infra ====
    private final AudioSource source;
    private final AudioHandoff handoff;
    private final AlertService alerts;
    private final GlobalUncaughtHandler uncaughtHandler;
    private final int sampleRate;
    private final short[] block;

    // ==== State ====
    private final Object sourceLock = new Object();
    private volatile boolean opened = false;
    private volatile boolean stopping = false;
    private volatile Thread worker;
    @Getter private volatile boolean available = false;
    @Getter private volatile long lastBlockAtMs = 0L;
    @Getter private volatile String lastError = "";

    public AudioCaptureService(AudioSource source,
                               AudioHandoff handoff,
                               AlertService alerts,
                               EngineConfig engineConfig,
                               GlobalUncaughtHandler uncaughtHandler) {
        this.source = source;
        this.handoff = handoff;
        this.alerts = alerts;
        this.uncaughtHandler = uncaughtHandler;
        this.sampleRate = engineConfig.getAudioSampleRate();
        this.block = new short[engineConfig.getAudioFftSize()];
    }

    // ---- Lifecycle ----
    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("audio capture disabled (source={})", source.describe());
            return;
        }
        stopping = false;
        Thread t = new Thread(this::captureLoop, GlobalUncaughtHandler.AUDIO_THREAD_PREFIX + "-" + source.describe());
        t.setDaemon(true);
        t.setUncaughtExceptionHandler(uncaughtHandler);
        worker = t;
        t.start();
        log.info("audio capture started: source={} rate={} block={}", source.describe(), sampleRate, block.length);
    }

    @PreDestroy
    public void shutdown() {
        stopping = true;
        Thread t = worker;
        if (t != null) {
            t.interrupt();
            try {
                t.join(500);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        closeQuietly();
    }

    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    public AudioStatus status() {
        return new AudioStatus(source.describe(), enabled, isRunning(), available, lastBlockAtMs, lastError);
    }

    public record AudioStatus(String source, boolean enabled, boolean running, boolean available,
                              long lastBlockAtMs, String lastError) {}

    // ---- Capture loop ----
    private void captureLoop() {
        while (!stopping && !Thread.currentThread().isInterrupted()) {
            if (!captureOnce()) sleepQuiet(reopenBackoffMs);
        }
    }

    /**
     * One full block: open if needed, read until the block is complete, publish.
     * @return false when the source failed and the caller should back off
     */
    boolean captureOnce() {
        try {
            ensureOpen();
            int filled = 0;
            while (filled < block.length) {
                int got = source.read(block, filled, block.length - filled);
                if (got <= 0) throw new AudioUnavailableException("capture stalled after " + filled + " samples");
                filled += got;
            }
            handoff.publish(block);
            lastBlockAtMs = System.currentTimeMillis();
            if (!available) {
                available = true;
                lastError = "";
                alerts.resolve(ALERT_UNAVAILABLE);
            }
            return true;

        } catch (AudioUnavailableException e) {
            markUnavailable(e.getMessage());
            return false;
        } catch (RuntimeException e) {
            markUnavailable(e.toString());
            return false;
        }
    }

    private void markUnavailable(String why) {
        available = false;
        lastError = why == null ? "" : why;
        if (!stopping) alerts.raise(ALERT_UNAVAILABLE, "Audio capture failed: " + why, AlertService.Severity.WARN);
        closeQuietly();
    }

    private void ensureOpen() throws AudioUnavailableException {
        if (opened) return;
        synchronized (sourceLock) {
            if (opened) return;
            source.open(sampleRate);
            opened = true;
            log.info("audio_source_opened source={} rate={}", source.describe(), sampleRate);
        }
    }

    private void closeQuietly() {
        synchronized (sourceLock) {
            if (!opened) return;
            try {
                source.close();
            } catch (RuntimeException e) {
                log.debug("audio_close_failed: {}", e.toString());
            } finally {
                opened = false;
                log.info("audio_source_closed source={}", source.describe());
            }
        }
    }

    @EventListener
    public void onAudioCrash(AudioCrashedEvent evt) {
        if (stopping || !enabled) return;
        log.warn("audio_crash_event → restarting capture (cause: {})", evt.cause().toString());
        available = false;
        closeQuietly();
        start();
    }

    private void sleepQuiet(long ms) {
        try {
            Thread.sleep(Math.min(10_000, Math.max(200, ms)));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
