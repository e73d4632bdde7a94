package com.pathfinder.common.model;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable close/volume history supplied to one evaluation, oldest sample first.
 *
 * <p>Volumes are optional. They are kept only when there is exactly one volume per close;
 * any other length is treated as "no volume data".
 */
public final class PriceWindow {

    private static final double[] NO_VOLUMES = new double[0];

    private final double[] closes;
    private final double[] volumes;

    private PriceWindow(double[] closes, double[] volumes) {
        this.closes = closes;
        this.volumes = volumes;
    }

    public static PriceWindow of(double[] closes) {
        return of(closes, null);
    }

    public static PriceWindow of(double[] closes, double[] volumes) {
        double[] c = closes == null ? new double[0] : closes.clone();
        double[] v = volumes != null && volumes.length == c.length && c.length > 0
            ? volumes.clone()
            : NO_VOLUMES;
        return new PriceWindow(c, v);
    }

    /** Builds a window from boxed lists; null entries become NaN. */
    public static PriceWindow of(List<Double> closes, List<Double> volumes) {
        return of(toArray(closes), volumes == null ? null : toArray(volumes));
    }

    public static PriceWindow empty() {
        return new PriceWindow(new double[0], NO_VOLUMES);
    }

    public int size() {
        return closes.length;
    }

    public boolean hasVolumes() {
        return volumes.length > 0;
    }

    public double[] closes() {
        return closes.clone();
    }

    /** Volumes aligned with {@link #closes()}, or {@code null} without volume data. */
    public double[] volumes() {
        return hasVolumes() ? volumes.clone() : null;
    }

    /**
     * Simple returns {@code (p[i] - p[i-1]) / p[i-1]} over the whole window.
     * A zero previous close yields a non-finite return, which callers must sanitize.
     */
    public double[] returns() {
        if (closes.length < 2) return new double[0];
        double[] r = new double[closes.length - 1];
        for (int i = 1; i < closes.length; i++) {
            r[i - 1] = (closes[i] - closes[i - 1]) / closes[i - 1];
        }
        return r;
    }

    private static double[] toArray(List<Double> values) {
        if (values == null) return new double[0];
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            out[i] = v == null ? Double.NaN : v;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceWindow other)) return false;
        return Arrays.equals(closes, other.closes) && Arrays.equals(volumes, other.volumes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(closes) + Arrays.hashCode(volumes);
    }

    @Override
    public String toString() {
        return "PriceWindow[size=" + closes.length + ", volumes=" + hasVolumes() + "]";
    }
}
