package com.etphysics.omnimeasure.domain;

/**
 * Fixed-capacity circular buffer of doubles. The newest sample overwrites the oldest once full.
 * Statistics are derived on demand. Single writer, no locking.
 */
public final class RingBuffer {

    private final double[] data;
    private int head = 0;   // next write position
    private int size = 0;

    public RingBuffer(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0: " + capacity);
        this.data = new double[capacity];
    }

    public void add(double v) {
        data[head] = v;
        head = (head + 1) % data.length;
        if (size < data.length) size++;
    }

    public int size()     { return size; }
    public int capacity() { return data.length; }
    public boolean isEmpty() { return size == 0; }
    public boolean isFull()  { return size == data.length; }

    public void clear() {
        head = 0;
        size = 0;
    }

    /** i = 0 is the oldest retained sample, i = size-1 the newest. */
    public double get(int i) {
        if (i < 0 || i >= size) throw new IndexOutOfBoundsException("index " + i + " size " + size);
        int start = (head - size + data.length) % data.length;
        return data[(start + i) % data.length];
    }

    public double newest() {
        return get(size - 1);
    }

    /** Oldest-first copy of the retained samples. */
    public double[] toArray() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) out[i] = get(i);
        return out;
    }

    public double sum(int fromInclusive, int toExclusive) {
        double s = 0.0;
        for (int i = fromInclusive; i < toExclusive; i++) s += get(i);
        return s;
    }

    public double mean() {
        return size == 0 ? 0.0 : sum(0, size) / size;
    }

    public double meanSquare() {
        if (size == 0) return 0.0;
        double s = 0.0;
        for (int i = 0; i < size; i++) { double v = get(i); s += v * v; }
        return s / size;
    }

    /** Population variance (divisor n). */
    public double variance() {
        if (size == 0) return 0.0;
        double m = mean();
        double s = 0.0;
        for (int i = 0; i < size; i++) { double d = get(i) - m; s += d * d; }
        return s / size;
    }

    /** Bessel-corrected standard deviation (divisor n-1); 0 with fewer than two samples. */
    public double sampleStdDev() {
        if (size < 2) return 0.0;
        double m = mean();
        double s = 0.0;
        for (int i = 0; i < size; i++) { double d = get(i) - m; s += d * d; }
        return Math.sqrt(s / (size - 1));
    }
}
