/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.common;

import org.winbuf.config.exception.ValidationException;

/**
 * An inclusive window [lo, hi] in seconds relative to the trigger event.
 * Infinite bounds are allowed and keep everything before or after the trigger.
 */
public class TimeWindow {
    public static final TimeWindow ALL = new TimeWindow(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    private final double lo;
    private final double hi;

    public TimeWindow(double lo, double hi) {
        if (Double.isNaN(lo) || Double.isNaN(hi)) {
            throw new ValidationException("Time window bounds must not be NaN, got [" + lo + "," + hi + "]");
        }
        if (lo >= hi) {
            throw new ValidationException("Time window must be increasing, got [" + lo + "," + hi + "]");
        }
        this.lo = lo;
        this.hi = hi;
    }

    public double getLo() {
        return lo;
    }

    public double getHi() {
        return hi;
    }

    /**
     * @param time  Seconds relative to the trigger
     * @return true if lo &lt;= time &lt;= hi; edges are kept.
     */
    public boolean contains(double time) {
        return lo <= time && time <= hi;
    }

    /**
     * @return true if both bounds are infinite, in which case nothing can be cropped.
     */
    public boolean isUnbounded() {
        return Double.isInfinite(lo) && Double.isInfinite(hi);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeWindow that = (TimeWindow) o;
        return Double.compare(lo, that.lo) == 0 && Double.compare(hi, that.hi) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(lo) + Double.hashCode(hi);
    }

    @Override
    public String toString() {
        return "[" + lo + "," + hi + "]";
    }
}
