package com.etphysics.omnimeasure.engine.spectral;

import com.etphysics.omnimeasure.domain.Maths;

/**
 * In-place iterative radix-2 FFT over separate real / imaginary arrays.
 * Bit-reversal permutation followed by log2(N) butterfly stages. Bounded and allocation-free.
 */
public final class Fft {

    private Fft() {}

    public static void forward(double[] re, double[] im) {
        transform(re, im);
    }

    /** Inverse transform via conjugation, including the 1/N scaling. */
    public static void inverse(double[] re, double[] im) {
        int n = re.length;
        for (int i = 0; i < n; i++) im[i] = -im[i];
        transform(re, im);
        for (int i = 0; i < n; i++) {
            re[i] = re[i] / n;
            im[i] = -im[i] / n;
        }
    }

    private static void transform(double[] re, double[] im) {
        if (re == null || im == null) throw new IllegalArgumentException("fft arrays must not be null");
        int n = re.length;
        if (im.length != n) {
            throw new IllegalArgumentException("real/imag length mismatch: " + n + " vs " + im.length);
        }
        if (!Maths.isPowerOfTwo(n)) {
            throw new IllegalArgumentException("fft length must be a power of two: " + n);
        }

        // bit reversal
        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >>> 1;
            for (; j >= bit; bit >>>= 1) j -= bit;
            j += bit;
            if (i < j) {
                double tr = re[i]; re[i] = re[j]; re[j] = tr;
                double ti = im[i]; im[i] = im[j]; im[j] = ti;
            }
        }

        // butterflies
        for (int len = 2; len <= n; len <<= 1) {
            double ang = -2 * Math.PI / len;
            double wlenR = Math.cos(ang);
            double wlenI = Math.sin(ang);
            int half = len >>> 1;

            for (int i = 0; i < n; i += len) {
                double wr = 1.0, wi = 0.0;
                for (int j = 0; j < half; j++) {
                    int u = i + j, v = u + half;

                    double vr = re[v] * wr - im[v] * wi;
                    double vi = re[v] * wi + im[v] * wr;

                    re[v] = re[u] - vr; im[v] = im[u] - vi;
                    re[u] += vr;        im[u] += vi;

                    double nwr = wr * wlenR - wi * wlenI;
                    wi = wr * wlenI + wi * wlenR;
                    wr = nwr;
                }
            }
        }
    }
}
