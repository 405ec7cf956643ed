package com.etphysics.omnimeasure.domain;

/**
 * Display rotation of the device. Each value carries a fixed axis permutation that maps
 * the sensor frame onto the screen frame:
 * <pre>
 *   0°:   ( x,  y, z)
 *   90°:  (-y,  x, z)
 *   180°: (-x, -y, z)
 *   270°: ( y, -x, z)
 * </pre>
 */
public enum DisplayRotation {
    ROTATION_0(0),
    ROTATION_90(90),
    ROTATION_180(180),
    ROTATION_270(270);

    private final int degrees;

    DisplayRotation(int degrees) { this.degrees = degrees; }

    public int degrees() { return degrees; }

    public Vector3 remap(Vector3 v) {
        return switch (this) {
            case ROTATION_0   -> v;
            case ROTATION_90  -> new Vector3(-v.y(),  v.x(), v.z());
            case ROTATION_180 -> new Vector3(-v.x(), -v.y(), v.z());
            case ROTATION_270 -> new Vector3( v.y(), -v.x(), v.z());
        };
    }

    /** Unknown angles fall back to the natural orientation. */
    public static DisplayRotation fromDegrees(int degrees) {
        for (DisplayRotation r : values()) {
            if (r.degrees == Math.floorMod(degrees, 360)) return r;
        }
        return ROTATION_0;
    }
}
