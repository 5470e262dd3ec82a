/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.engine.membuf;

/**
 * A contiguous run [offset, offset + length) of one circular buffer.
 * The values are null until the segment has been fetched from the device.
 */
public class RawSegment {
    private final int offset;
    private final int length;
    private final double[] values;

    public RawSegment(int offset, int length) {
        this(offset, length, null);
    }

    private RawSegment(int offset, int length, double[] values) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid segment offset " + offset + " length " + length);
        }
        this.offset = offset;
        this.length = length;
        this.values = values;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    public boolean isFetched() {
        return values != null;
    }

    public double[] getValues() {
        return values;
    }

    public RawSegment fetched(double[] values) {
        if (values == null || values.length != length) {
            throw new IllegalArgumentException("Expected " + length + " values for segment at offset " + offset
                    + ", got " + (values == null ? "null" : Integer.toString(values.length)));
        }
        return new RawSegment(offset, length, values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawSegment that = (RawSegment) o;
        return offset == that.offset && length == that.length;
    }

    @Override
    public int hashCode() {
        return 31 * offset + length;
    }

    @Override
    public String toString() {
        return "[" + offset + "," + (offset + length) + ")";
    }
}
