/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config;

import org.winbuf.ParameterInfo;
import org.winbuf.ParameterType;

/**
 * The numeric type that one buffered word really holds.
 * The device returns every buffered value as a double; integer buffers are cast back into their native type before they are unpacked.
 */
public enum NativeWordType {
    SIGNED_INT(true, true),
    UNSIGNED_INT(true, false),
    FLOAT(false, true);

    private final boolean integer;
    private final boolean signed;

    private NativeWordType(boolean integer, boolean signed) {
        this.integer = integer;
        this.signed = signed;
    }

    public boolean isInteger() {
        return integer;
    }

    public boolean isSigned() {
        return signed;
    }

    /**
     * Infer the native type from the declaration of the sample buffer control.
     * Integer buffers whose declared minimum is not negative hold unsigned words.
     * @param sampleInfo  Metadata of the sample buffer
     * @return NativeWordType
     */
    public static NativeWordType fromSampleInfo(ParameterInfo sampleInfo) {
        if (sampleInfo.getType() != ParameterType.INT) {
            return FLOAT;
        }
        return sampleInfo.getMin() >= 0 ? UNSIGNED_INT : SIGNED_INT;
    }

    /**
     * Cast a double into an integer word of this type; rounds half away from zero and saturates at the limits of the type. NaN becomes 0.
     * @param raw  &emsp;
     * @param wordBits Width of the word, at most 32
     * @return The value of the word; unsigned words are never negative.
     */
    public long castToWord(double raw, int wordBits) {
        if (!integer) {
            throw new IllegalStateException("Cannot cast to word for a floating point type " + this);
        }
        if (Double.isNaN(raw)) {
            return 0L;
        }
        double rounded = Math.signum(raw) * Math.floor(Math.abs(raw) + 0.5);
        double lo = signed ? -Math.pow(2, wordBits - 1) : 0.0;
        double hi = signed ? Math.pow(2, wordBits - 1) - 1 : Math.pow(2, wordBits) - 1;
        if (rounded < lo) {
            rounded = lo;
        } else if (rounded > hi) {
            rounded = hi;
        }
        return (long) rounded;
    }
}
