package com.etphysics.omnimeasure.web;

import com.etphysics.omnimeasure.alerts.AlertService;
import com.etphysics.omnimeasure.domain.CalibrationProfile;
import com.etphysics.omnimeasure.domain.Vector3;
import com.etphysics.omnimeasure.power.EcoController;
import com.etphysics.omnimeasure.service.MeasurementService;
import com.etphysics.omnimeasure.service.StatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
public class StatusController {

    private final AlertService alerts;

    private final StatusService status;

    private final MeasurementService measurement;

    private final EcoController eco;

    public StatusController(AlertService alerts, StatusService status, MeasurementService measurement, EcoController eco) {
        this.alerts = alerts;
        this.status = status;
        this.measurement = measurement;
        this.eco = eco;
    }

    @GetMapping("/status")
    public StatusService.StatusView getStatus() {
        return status.buildStatusView();
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }

    // ---------------------- Calibration ----------------------

    @GetMapping("/calibration")
    public CalibrationProfile getCalibration() {
        return measurement.calibration();
    }

    @PutMapping("/calibration")
    public ResponseEntity<?> putCalibration(@RequestBody CalibrationRequest req) {
        double spl = req.splOffsetDb() != null ? req.splOffsetDb() : measurement.calibration().splOffsetDb();
        try {
            return ResponseEntity.ok(measurement.setCalibration(req.accelZero(), req.gyroZero(), spl));
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }
    }

    @PostMapping("/calibration/tilt-zero")
    public CalibrationProfile zeroTilt() {
        return measurement.zeroTilt();
    }

    @PostMapping("/calibration/reference-level")
    public ResponseEntity<?> referenceLevel(@RequestParam("db") double db) {
        try {
            return ResponseEntity.ok(measurement.setReferenceLevel(db));
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }
    }

    @PostMapping("/calibration/accel-rest")
    public ResponseEntity<?> accelRest(@RequestParam(name = "samples", defaultValue = "50") int samples) {
        try {
            measurement.startRestCalibration(samples);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("samples", samples));
        } catch (IllegalArgumentException e) {
            return badRequest(e);
        }
    }

    // ---------------------- Power ----------------------

    @PostMapping("/power/ultra-eco")
    public Map<String, Object> ultraEco(@RequestParam("enabled") boolean enabled) {
        eco.setUltraEco(enabled);
        return powerView();
    }

    @PostMapping("/power/temperature")
    public ResponseEntity<?> temperature(@RequestParam("celsius") double celsius) {
        if (!Double.isFinite(celsius)) {
            return ResponseEntity.badRequest().body(Map.of("error", "celsius must be finite"));
        }
        eco.onTemperature(celsius);
        return ResponseEntity.ok(powerView());
    }

    private Map<String, Object> powerView() {
        return Map.of(
                "state", eco.state(),
                "samplingRateHz", eco.samplingRateHz(),
                "throttled", eco.isThrottled(),
                "ultraEco", eco.isUltraEco());
    }

    private static ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    /** Body of {@code PUT /calibration}; missing vectors mean zero, a missing SPL offset keeps the current one. */
    public record CalibrationRequest(Vector3 accelZero, Vector3 gyroZero, Double splOffsetDb) {}
}
