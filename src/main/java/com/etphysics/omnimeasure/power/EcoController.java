package com.etphysics.omnimeasure.power;

import com.etphysics.omnimeasure.domain.EcoState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Motion-driven sampling-rate state machine.
 *
 * - Motion above the wake threshold refreshes the last-motion time and wakes ECO → ACTIVE.
 * - No motion for longer than the timeout moves ACTIVE → ECO.
 * - Ultra-eco override pins ULTRA_ECO and suppresses the automatic transitions until released.
 * - Thermal throttle (hysteresis on/off temperatures) holds ECO and blocks waking while hot.
 *
 * Motion samples come from the frame path, overrides from the control path; state changes happen
 * under one lock and listeners are notified outside it, only on edges.
 */
@Slf4j
public class EcoController {

    private final EcoConfig cfg;
    private final List<PowerStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private EcoState state = EcoState.ACTIVE;
    private boolean ultraEco = false;
    private boolean throttled = false;
    private boolean clockStarted = false;
    private long lastMotionNs;

    public EcoController(EcoConfig cfg) {
        this.cfg = cfg;
    }

    public void addListener(PowerStateListener l) { listeners.add(l); }

    public EcoState state() {
        synchronized (lock) { return state; }
    }

    public boolean isUltraEco() {
        synchronized (lock) { return ultraEco; }
    }

    public boolean isThrottled() {
        synchronized (lock) { return throttled; }
    }

    public int samplingRateHz() {
        synchronized (lock) { return rateFor(state); }
    }

    /** Feeds one vibration-magnitude sample taken at {@code nowNs} (monotonic). */
    public void onMotion(double vibrationMag, long nowNs) {
        EcoState from;
        EcoState to;
        synchronized (lock) {
            if (!clockStarted) {
                clockStarted = true;
                lastMotionNs = nowNs;
            }
            from = state;
            if (vibrationMag > cfg.getWakeThreshold()) {
                lastMotionNs = nowNs;
                if (state == EcoState.ECO && !ultraEco && !throttled) state = EcoState.ACTIVE;
            } else if (state == EcoState.ACTIVE && !ultraEco
                    && (nowNs - lastMotionNs) > cfg.getEcoTimeoutMs() * 1_000_000L) {
                state = EcoState.ECO;
            }
            to = state;
        }
        fireIfChanged(from, to, "motion");
    }

    /** Explicit override: pins the minimum rate, or hands control back to the motion logic. */
    public void setUltraEco(boolean enabled) {
        EcoState from;
        EcoState to;
        synchronized (lock) {
            from = state;
            ultraEco = enabled;
            if (enabled) {
                state = EcoState.ULTRA_ECO;
            } else if (state == EcoState.ULTRA_ECO) {
                state = throttled ? EcoState.ECO : EcoState.ACTIVE;
                clockStarted = false; // restart the inactivity window
            }
            to = state;
        }
        fireIfChanged(from, to, enabled ? "ultra_eco_on" : "ultra_eco_off");
    }

    /** Device temperature sample; engages the throttle at the on-threshold, releases below the off-threshold. */
    public void onTemperature(double celsius) {
        if (!Double.isFinite(celsius)) return;
        EcoState from;
        EcoState to;
        boolean changedThrottle = false;
        boolean nowThrottled;
        synchronized (lock) {
            from = state;
            if (!throttled && celsius >= cfg.getThrottleOnCelsius()) {
                throttled = true;
                changedThrottle = true;
                if (state == EcoState.ACTIVE) state = EcoState.ECO;
            } else if (throttled && celsius < cfg.getThrottleOffCelsius()) {
                throttled = false;
                changedThrottle = true;
            }
            nowThrottled = throttled;
            to = state;
        }
        if (changedThrottle) log.info("thermal_throttle {} at {}°C", nowThrottled ? "ENGAGED" : "RELEASED", celsius);
        fireIfChanged(from, to, "thermal");
    }

    private void fireIfChanged(EcoState from, EcoState to, String cause) {
        if (from == to) return;
        int rate = rateFor(to);
        log.info("power_state_change {} → {} ({} Hz, cause={})", from, to, rate, cause);
        for (PowerStateListener l : listeners) {
            try {
                l.onPowerStateChanged(from, to, rate);
            } catch (RuntimeException e) {
                log.warn("power_listener_failed: {}", e.toString());
            }
        }
    }

    private int rateFor(EcoState s) {
        return switch (s) {
            case ACTIVE -> cfg.getActiveRateHz();
            case ECO -> cfg.getEcoRateHz();
            case ULTRA_ECO -> cfg.getUltraEcoRateHz();
        };
    }
}
