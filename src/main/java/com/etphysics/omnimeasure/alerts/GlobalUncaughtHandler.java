package com.etphysics.omnimeasure.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    public static final String AUDIO_THREAD_PREFIX = "audio-capture";

    private final AlertService alerts;
    private final ApplicationEventPublisher publisher;

    private volatile boolean stopping = false;

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        String key = classify(t, e);
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(key, e.toString(), AlertService.Severity.CRITICAL);

        if ("AUDIO_UNCAUGHT".equals(key)) {
            publisher.publishEvent(new AudioCrashedEvent(e));
        }
    }

    private String classify(Thread t, Throwable e) {
        String name = t.getName() == null ? "" : t.getName();
        if (name.startsWith(AUDIO_THREAD_PREFIX) || fromJavaSound(e)) return "AUDIO_UNCAUGHT";
        return "UNCAUGHT";
    }

    private boolean fromJavaSound(Throwable e) {
        for (StackTraceElement st : e.getStackTrace()) {
            if (st.getClassName().startsWith("javax.sound") || st.getClassName().startsWith("com.sun.media.sound")) {
                return true;
            }
        }
        return false;
    }
}
