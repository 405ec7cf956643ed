package com.etphysics.omnimeasure.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process condition tracker. A key is raised when a condition starts (or persists) and resolved
 * when it clears; each raise→resolve span is one episode.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long firstSeen;   // epoch ms, start of the current episode
        long lastSeen;    // epoch ms
        int count;        // raises within the episode
        boolean active;
    }

    @Value @Builder
    public static class EventView {
        String key;
        String message;
        Severity severity;
        long ts;          // epoch ms
        String type;      // "RAISE" or "RESOLVE"
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;
        List<EventView> recent; // newest first
    }

    private final Map<String, MutableAlert> alerts = new ConcurrentHashMap<>();
    private final Deque<EventView> recent = new ArrayDeque<>();
    private final int recentCapacity = 50;

    /** Raise or refresh. Only the first raise of an episode is logged at WARN and recorded as an event. */
    public void raise(String key, String message, Severity sev) {
        long now = System.currentTimeMillis();
        MutableAlert a = alerts.computeIfAbsent(key, k -> new MutableAlert(k));

        boolean newEpisode;
        synchronized (a) {
            newEpisode = !a.active;
            if (newEpisode) {
                a.firstSeen = now;
                a.count.set(0);
            }
            a.active = true;
            a.severity = sev;
            a.message = message;
            a.lastSeen = now;
            a.count.incrementAndGet();
        }

        if (newEpisode) {
            log.warn("ALERT RAISE key={} sev={} msg={}", key, sev, message);
            record(key, message, sev, "RAISE", now);
        } else if (log.isDebugEnabled()) {
            log.debug("alert_refresh key={} msg={}", key, message);
        }
    }

    public void resolve(String key) {
        MutableAlert a = alerts.get(key);
        if (a == null) return;

        long now = System.currentTimeMillis();
        boolean wasActive;
        Severity sev;
        synchronized (a) {
            wasActive = a.active;
            sev = a.severity;
            a.active = false;
            a.lastSeen = now;
        }
        if (wasActive) {
            log.info("ALERT RESOLVE key={}", key);
            record(key, "recovered", sev, "RESOLVE", now);
        }
    }

    public boolean isActive(String key) {
        MutableAlert a = alerts.get(key);
        return a != null && a.active;
    }

    public AlertsSnapshot snapshot() {
        List<AlertView> active = alerts.values().stream()
                .filter(a -> a.active)
                .sorted(Comparator.comparingLong((MutableAlert a) -> a.lastSeen).reversed())
                .map(MutableAlert::view)
                .toList();

        List<EventView> events;
        synchronized (recent) {
            events = new ArrayList<>(recent);
        }
        Collections.reverse(events);
        return AlertsSnapshot.builder().active(active).recent(events).build();
    }

    private void record(String key, String msg, Severity sev, String type, long ts) {
        EventView ev = EventView.builder().key(key).message(msg).severity(sev).type(type).ts(ts).build();
        synchronized (recent) {
            recent.addLast(ev);
            while (recent.size() > recentCapacity) recent.removeFirst();
        }
    }

    private static class MutableAlert {
        final String key;
        volatile String message = "";
        volatile Severity severity = Severity.INFO;
        volatile boolean active;
        volatile long firstSeen;
        volatile long lastSeen;
        final AtomicInteger count = new AtomicInteger(0);

        MutableAlert(String key) {
            this.key = key;
        }

        AlertView view() {
            return AlertView.builder()
                    .key(key).message(message).severity(severity).active(active)
                    .firstSeen(firstSeen).lastSeen(lastSeen).count(count.get())
                    .build();
        }
    }
}
