/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.stats;

import java.util.Arrays;
import java.util.function.IntConsumer;

/**
 * The size of an N-dimensional array stored in column-major order; the first dimension varies fastest.
 * <p>
 * Trailing singleton dimensions carry no information and are dropped, so [3, 1] and [3] are the same shape.
 * Every dimension beyond the rank has length 1.
 */
public final class ArrayShape {
    private final int[] dims;
    private final int numel;

    public ArrayShape(int... dims) {
        if (dims == null || dims.length == 0) {
            throw new IllegalArgumentException("An array shape needs at least one dimension");
        }
        long total = 1;
        for (int dim : dims) {
            if (dim < 0) {
                throw new IllegalArgumentException("Size inputs must be non-negative, got " + Arrays.toString(dims));
            }
            total *= dim;
            if (total > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Array of size " + Arrays.toString(dims) + " is too large");
            }
        }
        int rank = dims.length;
        while (rank > 1 && dims[rank - 1] == 1) {
            rank--;
        }
        this.dims = Arrays.copyOf(dims, rank);
        this.numel = (int) total;
    }

    public int getRank() {
        return dims.length;
    }

    /**
     * @param axis 0 based
     * @return Length along the axis; 1 beyond the rank
     */
    public int dim(int axis) {
        if (axis < 0) {
            throw new IllegalArgumentException("Negative axis " + axis);
        }
        return axis < dims.length ? dims[axis] : 1;
    }

    public int[] getDims() {
        return dims.clone();
    }

    /**
     * @param rank  &emsp;
     * @return The dimensions padded with ones up to rank
     */
    public int[] getDims(int rank) {
        int[] ret = new int[Math.max(rank, dims.length)];
        for (int i = 0; i < ret.length; i++) {
            ret[i] = dim(i);
        }
        return ret;
    }

    public int numel() {
        return numel;
    }

    /**
     * @param subscript 0 based, one per dimension; dimensions beyond the rank must be 0
     * @return Column-major linear index
     */
    public int linearIndex(int... subscript) {
        if (subscript.length < dims.length) {
            throw new IllegalArgumentException("Expected at least " + dims.length + " subscripts, got " + subscript.length);
        }
        int index = 0;
        int stride = 1;
        for (int i = 0; i < subscript.length; i++) {
            int d = dim(i);
            if (subscript[i] < 0 || subscript[i] >= d) {
                throw new IndexOutOfBoundsException("Subscript " + Arrays.toString(subscript) + " outside of " + this);
            }
            index += subscript[i] * stride;
            stride *= d;
        }
        return index;
    }

    /**
     * @param linear Column-major linear index
     * @param rank  Number of subscripts wanted, at least the rank of this shape
     * @return Subscripts of the element
     */
    public int[] subscript(int linear, int rank) {
        int[] ret = new int[Math.max(rank, dims.length)];
        int rest = linear;
        for (int i = 0; i < ret.length; i++) {
            int d = dim(i);
            ret[i] = rest % d;
            rest /= d;
        }
        return ret;
    }

    /**
     * Check a range [from, to) given per dimension.
     * @param from Inclusive start per dimension
     * @param to Exclusive end per dimension
     * @return The shape of the range
     */
    public ArrayShape rangeShape(int[] from, int[] to) {
        if (from.length != to.length) {
            throw new IllegalArgumentException("Range start " + Arrays.toString(from) + " and end " + Arrays.toString(to) + " differ in length");
        }
        if (from.length < dims.length) {
            throw new IllegalArgumentException("Range needs " + dims.length + " dimensions, got " + from.length);
        }
        int[] size = new int[from.length];
        for (int i = 0; i < from.length; i++) {
            if (from[i] < 0 || to[i] < from[i] || to[i] > dim(i)) {
                throw new IndexOutOfBoundsException("Range " + Arrays.toString(from) + " to " + Arrays.toString(to) + " outside of " + this);
            }
            size[i] = to[i] - from[i];
        }
        return new ArrayShape(size);
    }

    /**
     * Visit the linear indices of all elements in the range [from, to), in column-major order of the range.
     * @param from  &emsp;
     * @param to  &emsp;
     * @param visitor Called with the linear index of each element in this shape
     */
    public void forEachInRange(int[] from, int[] to, IntConsumer visitor) {
        ArrayShape range = rangeShape(from, to);
        if (range.numel() == 0) {
            return;
        }
        int[] sub = from.clone();
        for (int n = 0; n < range.numel(); n++) {
            visitor.accept(linearIndex(sub));
            for (int i = 0; i < sub.length; i++) {
                sub[i]++;
                if (sub[i] < to[i]) {
                    break;
                }
                sub[i] = from[i];
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(dims, ((ArrayShape) o).dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        return Arrays.toString(dims);
    }
}
