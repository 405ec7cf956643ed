package com.etphysics.omnimeasure.audio;

import com.etphysics.omnimeasure.alerts.AlertService;
import com.etphysics.omnimeasure.alerts.GlobalUncaughtHandler;
import com.etphysics.omnimeasure.engine.EngineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class AudioCaptureServiceTest {

    private AudioSource source;
    private AudioHandoff handoff;
    private AlertService alerts;
    private AudioCaptureService service;

    @BeforeEach
    void setUp() {
        source = mock(AudioSource.class);
        when(source.describe()).thenReturn("mock");
        handoff = new AudioHandoff();
        alerts = new AlertService();
        EngineConfig cfg = EngineConfig.builder().audioFftSize(256).build();
        service = new AudioCaptureService(source, handoff, alerts, cfg, mock(GlobalUncaughtHandler.class));
    }

    @Test
    void publishes_only_complete_blocks() throws Exception {
        // the source hands out at most 100 samples per read
        when(source.read(any(short[].class), anyInt(), anyInt()))
                .thenAnswer(inv -> Math.min(100, inv.<Integer>getArgument(2)));

        assertThat(service.captureOnce()).isTrue();

        short[] block = handoff.take();
        assertThat(block).hasSize(256);
        assertThat(service.isAvailable()).isTrue();
        verify(source, times(1)).open(16_000);
        verify(source, times(3)).read(any(short[].class), anyInt(), anyInt());
    }

    @Test
    void open_failure_raises_alert_and_recovery_resolves_it() throws Exception {
        doThrow(new AudioUnavailableException("no microphone")).when(source).open(anyInt());

        assertThat(service.captureOnce()).isFalse();
        assertThat(alerts.isActive(AudioCaptureService.ALERT_UNAVAILABLE)).isTrue();
        assertThat(service.isAvailable()).isFalse();
        assertThat(service.status().lastError()).contains("no microphone");
        assertThat(handoff.take()).isNull();

        doNothing().when(source).open(anyInt());
        when(source.read(any(short[].class), anyInt(), anyInt())).thenAnswer(inv -> inv.getArgument(2));

        assertThat(service.captureOnce()).isTrue();
        assertThat(alerts.isActive(AudioCaptureService.ALERT_UNAVAILABLE)).isFalse();
        assertThat(service.isAvailable()).isTrue();
    }

    @Test
    void stalled_read_closes_source_and_reopens_next_time() throws Exception {
        when(source.read(any(short[].class), anyInt(), anyInt())).thenReturn(0);

        assertThat(service.captureOnce()).isFalse();
        verify(source).close();
        assertThat(handoff.take()).isNull();

        when(source.read(any(short[].class), anyInt(), anyInt())).thenAnswer(inv -> inv.getArgument(2));
        assertThat(service.captureOnce()).isTrue();
        verify(source, times(2)).open(anyInt());
    }

    @Test
    void runtime_failure_in_source_is_contained() throws Exception {
        when(source.read(any(short[].class), anyInt(), anyInt())).thenThrow(new IllegalStateException("line lost"));

        assertThat(service.captureOnce()).isFalse();
        assertThat(alerts.isActive(AudioCaptureService.ALERT_UNAVAILABLE)).isTrue();
    }

    @Test
    void no_audio_source_is_always_unavailable() {
        AudioCaptureService none = new AudioCaptureService(new NoAudioSource(), handoff, alerts,
                EngineConfig.defaults(), mock(GlobalUncaughtHandler.class));

        assertThat(none.captureOnce()).isFalse();
        assertThat(none.status().source()).isEqualTo("none");
        assertThat(alerts.isActive(AudioCaptureService.ALERT_UNAVAILABLE)).isTrue();
    }
}
