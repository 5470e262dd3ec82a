/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.stats;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winbuf.config.WinBufProperties;
import org.winbuf.config.exception.ConfigException;

import java.util.Arrays;

/**
 * An N-dimensional array of running means and variances, using Welford's online algorithm.
 * See https://en.wikipedia.org/wiki/Algorithms_for_calculating_variance
 * <p>
 * Each element holds the number of values accumulated into it, their running mean and M2, the sum of squared differences from the current mean.
 * New data is accumulated into the whole array or into a sub-range of it; elements outside the range are not touched.
 * The structural operations (sub-range, concatenation, reshape, permute, replicate) are applied to count, mean and M2 together so that each element keeps its own triple.
 * <p>
 * Elements are stored in column-major order. Axes are 0 based.
 * Instances are not thread safe; callers accumulating from several threads must serialise access.
 * <p>
 * Example: a random variable with N components sampled under M conditions is tracked by a [N, M] array;
 * after each trial, the sample for condition m is accumulated into the range [0, m] to [N, m + 1].
 */
public class WelfordArray {
    private static final Logger logger = LogManager.getLogger(WelfordArray.class.getName());
    public static final double DEFAULT_CONFIDENCE = 0.95;

    private final ArrayShape shape;
    private final long[] count;
    private final double[] mean;
    private final double[] m2;

    /**
     * A freshly initialised array without any accumulated data.
     * A single size gives a vector: {@code new WelfordArray(5)} has 5 elements, not 5 x 5.
     * Pass {@code (5, 5)} for a square array.
     * @param dims Size along each dimension; no arguments gives a scalar
     */
    public WelfordArray(int... dims) {
        this(new ArrayShape(dims.length == 0 ? new int[] { 1 } : dims));
    }

    public WelfordArray(ArrayShape shape) {
        this(shape, new long[shape.numel()], new double[shape.numel()], new double[shape.numel()]);
    }

    private WelfordArray(ArrayShape shape, long[] count, double[] mean, double[] m2) {
        this.shape = shape;
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    /**
     * Create an array from existing contents. All three arrays are in column-major order and are copied.
     * @param shape  &emsp;
     * @param count  Number of values per element, non-negative
     * @param mean  Running mean per element
     * @param m2  Sum of squared differences per element, non-negative
     * @return WelfordArray
     */
    public static WelfordArray fromArrays(ArrayShape shape, long[] count, double[] mean, double[] m2) {
        if (count.length != shape.numel() || mean.length != shape.numel() || m2.length != shape.numel()) {
            throw new IllegalArgumentException("count, mean and M2 must all have " + shape.numel() + " elements for shape " + shape);
        }
        for (int i = 0; i < count.length; i++) {
            if (count[i] < 0 || m2[i] < 0) {
                throw new IllegalArgumentException("Negative count or M2 at element " + i);
            }
        }
        return new WelfordArray(shape, count.clone(), mean.clone(), m2.clone());
    }

    public ArrayShape getShape() {
        return shape;
    }

    public int[] size() {
        return shape.getDims();
    }

    public int size(int axis) {
        return shape.dim(axis);
    }

    public int numel() {
        return shape.numel();
    }

    public boolean isEmpty() {
        return shape.numel() == 0;
    }

    public boolean isScalar() {
        return shape.numel() == 1;
    }

    public boolean isMatrix() {
        return shape.getRank() <= 2;
    }

    public boolean isVector() {
        return isMatrix() && (shape.dim(0) == 1 || shape.dim(1) == 1);
    }

    /**
     * Accumulate one sample into every element.
     * @param x One value per element, column-major
     */
    public void accumulate(double... x) {
        if (x.length != numel()) {
            throw new IllegalArgumentException("Sample has " + x.length + " values, Welford array " + shape + " has " + numel());
        }
        checkFinite(x);
        for (int i = 0; i < x.length; i++) {
            update(i, x[i]);
        }
    }

    /**
     * Accumulate one sample into the elements of the range [from, to) only.
     * @param from Inclusive start per dimension
     * @param to Exclusive end per dimension
     * @param x One value per element of the range, column-major within the range
     */
    public void accumulate(int[] from, int[] to, double... x) {
        ArrayShape range = shape.rangeShape(from, to);
        if (x.length != range.numel()) {
            throw new IllegalArgumentException("Sample has " + x.length + " values, range " + range + " has " + range.numel());
        }
        checkFinite(x);
        int[] next = { 0 };
        shape.forEachInRange(from, to, i -> update(i, x[next[0]++]));
    }

    private void update(int i, double x) {
        count[i] += 1;
        double delta = x - mean[i];
        mean[i] += delta / count[i];
        double delta2 = x - mean[i];
        m2[i] += delta * delta2;
    }

    private static void checkFinite(double[] x) {
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i])) {
                throw new IllegalArgumentException("Cannot accumulate non-finite value " + x[i] + " at " + i);
            }
        }
    }

    public long getCount(int... subscript) {
        return count[shape.linearIndex(subscript)];
    }

    public double getMean(int... subscript) {
        return mean[shape.linearIndex(subscript)];
    }

    public double getM2(int... subscript) {
        return m2[shape.linearIndex(subscript)];
    }

    /**
     * @return Sample variance of one element; NaN if fewer than two values were accumulated
     */
    public double getVariance(int... subscript) {
        return variance(shape.linearIndex(subscript));
    }

    public double getStandardDeviation(int... subscript) {
        return Math.sqrt(getVariance(subscript));
    }

    public double getStandardError(int... subscript) {
        int i = shape.linearIndex(subscript);
        return Math.sqrt(variance(i)) / Math.sqrt(count[i]);
    }

    private double variance(int i) {
        return count[i] < 2 ? Double.NaN : m2[i] / (count[i] - 1);
    }

    public long[] getCounts() {
        return count.clone();
    }

    public double[] getMeans() {
        return mean.clone();
    }

    public double[] getM2() {
        return m2.clone();
    }

    public double[] variance() {
        double[] ret = new double[count.length];
        for (int i = 0; i < ret.length; i++) {
            ret[i] = variance(i);
        }
        return ret;
    }

    public double[] std() {
        double[] ret = variance();
        for (int i = 0; i < ret.length; i++) {
            ret[i] = Math.sqrt(ret[i]);
        }
        return ret;
    }

    /**
     * @return Standard error of the mean per element
     */
    public double[] sem() {
        double[] ret = std();
        for (int i = 0; i < ret.length; i++) {
            ret[i] = ret[i] / Math.sqrt(count[i]);
        }
        return ret;
    }

    /**
     * Half width at the confidence level of the installation properties.
     * @return Half width per element
     */
    public double[] bernoulliHalfWidth() {
        return bernoulliHalfWidth(ConfidenceHolder.CONFIDENCE);
    }

    private static class ConfidenceHolder {
        static final double CONFIDENCE = loadConfidence();

        private static double loadConfidence() {
            try {
                return WinBufProperties.load().getConfidence();
            } catch (ConfigException ex) {
                logger.warn("Cannot load the installation properties, using a confidence level of " + DEFAULT_CONFIDENCE, ex);
                return DEFAULT_CONFIDENCE;
            }
        }
    }

    /**
     * Half width of the normal approximation confidence interval of a proportion, z * sqrt(mean (1 - mean) / count).
     * Only meaningful if every accumulated value was 0 or 1; for such data M2 equals count * mean * (1 - mean), which is checked here.
     * @param confidence Confidence level p, from (0, 1)
     * @return Half width per element; NaN where nothing was accumulated
     */
    public double[] bernoulliHalfWidth(double confidence) {
        if (!(confidence > 0 && confidence < 1)) {
            throw new IllegalArgumentException("Confidence level must be from range (0,1), got " + confidence);
        }
        double z = -new NormalDistribution().inverseCumulativeProbability((1 - confidence) / 2);
        double[] ret = new double[count.length];
        for (int i = 0; i < ret.length; i++) {
            if (count[i] == 0) {
                ret[i] = Double.NaN;
                continue;
            }
            double p = mean[i];
            double bernoulliM2 = count[i] * p * (1 - p);
            if (p < -1e-12 || p > 1 + 1e-12 || Math.abs(m2[i] - bernoulliM2) > 1e-9 * Math.max(1.0, count[i])) {
                throw new IllegalStateException("Element " + i + " did not accumulate only 0s and 1s; mean " + p + ", M2 " + m2[i]);
            }
            ret[i] = z * Math.sqrt(p * (1 - p) / count[i]);
        }
        return ret;
    }

    /**
     * @param from Inclusive start per dimension
     * @param to Exclusive end per dimension
     * @return A copy of the range [from, to)
     */
    public WelfordArray getRange(int[] from, int[] to) {
        WelfordArray ret = new WelfordArray(shape.rangeShape(from, to));
        int[] next = { 0 };
        shape.forEachInRange(from, to, i -> {
            int j = next[0]++;
            ret.count[j] = count[i];
            ret.mean[j] = mean[i];
            ret.m2[j] = m2[i];
        });
        return ret;
    }

    /**
     * Overwrite the range starting at from with the contents of source.
     * @param from Inclusive start per dimension
     * @param source Shape must equal the shape of the range
     */
    public void setRange(int[] from, WelfordArray source) {
        int[] to = new int[from.length];
        for (int i = 0; i < from.length; i++) {
            to[i] = from[i] + source.shape.dim(i);
        }
        ArrayShape range = shape.rangeShape(from, to);
        if (!range.equals(source.shape)) {
            throw new IllegalArgumentException("Cannot assign Welford array " + source.shape + " to range " + range);
        }
        int[] next = { 0 };
        shape.forEachInRange(from, to, i -> {
            int j = next[0]++;
            count[i] = source.count[j];
            mean[i] = source.mean[j];
            m2[i] = source.m2[j];
        });
    }

    /**
     * @param dims New size; must hold the same number of elements
     * @return A reshaped copy; column-major element order is kept
     */
    public WelfordArray reshape(int... dims) {
        ArrayShape newShape = new ArrayShape(dims);
        if (newShape.numel() != numel()) {
            throw new IllegalArgumentException("Cannot reshape " + numel() + " elements into " + newShape);
        }
        return new WelfordArray(newShape, count.clone(), mean.clone(), m2.clone());
    }

    /**
     * @param order A permutation of 0 .. n-1, n at least the rank; axis i of the result is axis order[i] of this array
     * @return A permuted copy
     */
    public WelfordArray permute(int... order) {
        int rank = order.length;
        if (rank < shape.getRank()) {
            throw new IllegalArgumentException("Permutation " + Arrays.toString(order) + " has fewer than " + shape.getRank() + " axes");
        }
        boolean[] seen = new boolean[rank];
        for (int axis : order) {
            if (axis < 0 || axis >= rank || seen[axis]) {
                throw new IllegalArgumentException("Not a permutation: " + Arrays.toString(order));
            }
            seen[axis] = true;
        }
        int[] newDims = new int[rank];
        for (int i = 0; i < rank; i++) {
            newDims[i] = shape.dim(order[i]);
        }
        WelfordArray ret = new WelfordArray(new ArrayShape(newDims));
        int[] oldSub = new int[rank];
        for (int n = 0; n < ret.numel(); n++) {
            int[] newSub = ret.shape.subscript(n, rank);
            for (int i = 0; i < rank; i++) {
                oldSub[order[i]] = newSub[i];
            }
            ret.copyElement(n, this, shape.linearIndex(oldSub));
        }
        return ret;
    }

    /**
     * Tile this array, like repmat.
     * @param reps Copies along each axis; missing axes get one copy
     * @return WelfordArray
     */
    public WelfordArray replicate(int... reps) {
        int rank = Math.max(reps.length, shape.getRank());
        int[] newDims = new int[rank];
        for (int i = 0; i < rank; i++) {
            int r = i < reps.length ? reps[i] : 1;
            if (r < 0) {
                throw new IllegalArgumentException("Negative replication " + Arrays.toString(reps));
            }
            newDims[i] = shape.dim(i) * r;
        }
        WelfordArray ret = new WelfordArray(new ArrayShape(newDims));
        int[] oldSub = new int[rank];
        for (int n = 0; n < ret.numel(); n++) {
            int[] newSub = ret.shape.subscript(n, rank);
            for (int i = 0; i < rank; i++) {
                oldSub[i] = newSub[i] % shape.dim(i);
            }
            ret.copyElement(n, this, shape.linearIndex(oldSub));
        }
        return ret;
    }

    /**
     * Concatenate along an axis. All other axes must agree in length.
     * @param axis 0 based; may be beyond the rank of the inputs
     * @param arrays  &emsp;
     * @return WelfordArray
     */
    public static WelfordArray concat(int axis, WelfordArray... arrays) {
        if (axis < 0) {
            throw new IllegalArgumentException("Negative axis " + axis);
        }
        if (ArrayUtils.isEmpty(arrays)) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        int rank = axis + 1;
        for (WelfordArray a : arrays) {
            rank = Math.max(rank, a.shape.getRank());
        }
        int[] dims = arrays[0].shape.getDims(rank);
        dims[axis] = 0;
        for (WelfordArray a : arrays) {
            int[] other = a.shape.getDims(rank);
            for (int i = 0; i < rank; i++) {
                if (i != axis && other[i] != dims[i]) {
                    throw new IllegalArgumentException("Dimensions of arrays being concatenated are not consistent: "
                            + arrays[0].shape + " and " + a.shape + " along axis " + axis);
                }
            }
            dims[axis] += other[axis];
        }
        WelfordArray ret = new WelfordArray(new ArrayShape(dims));
        int[] from = new int[rank];
        for (WelfordArray a : arrays) {
            ret.setRange(from, a);
            from[axis] += a.shape.dim(axis);
        }
        return ret;
    }

    public static WelfordArray vertcat(WelfordArray... arrays) {
        return concat(0, arrays);
    }

    public static WelfordArray horzcat(WelfordArray... arrays) {
        return concat(1, arrays);
    }

    private void copyElement(int to, WelfordArray source, int from) {
        count[to] = source.count[from];
        mean[to] = source.mean[from];
        m2[to] = source.m2[from];
    }

    @Override
    public String toString() {
        return "WelfordArray" + shape + "{count=" + Arrays.toString(count) + ", mean=" + Arrays.toString(mean) + ", M2=" + Arrays.toString(m2) + '}';
    }
}
