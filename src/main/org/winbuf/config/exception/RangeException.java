/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config.exception;

/**
 * A numeric argument lies outside the range the buffer entity supports.
 */
public class RangeException extends ValidationException {
    private static final long serialVersionUID = -2904877154870236914L;

    private final double lower;
    private final double upper;

    public RangeException(String what, double value, double lower, double upper) {
        super(what + " must be from range [" + format(lower) + "," + format(upper) + "], got " + format(value));
        this.lower = lower;
        this.upper = upper;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    private static String format(double v) {
        return (v == Math.rint(v) && !Double.isInfinite(v)) ? Long.toString((long) v) : Double.toString(v);
    }
}
