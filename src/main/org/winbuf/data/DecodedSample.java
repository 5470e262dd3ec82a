/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.data;

import java.util.Arrays;

/**
 * One decoded multi-channel sample and its time relative to the trigger event, in seconds.
 */
public class DecodedSample {
    private final double time;
    private final double[] values;

    public DecodedSample(double time, double[] values) {
        this.time = time;
        this.values = values;
    }

    public double getTime() {
        return time;
    }

    /**
     * @return One value per channel; a copy of the owning block's row.
     */
    public double[] getValues() {
        return values;
    }

    public double getValue(int channel) {
        return values[channel];
    }

    public int getChannelCount() {
        return values.length;
    }

    @Override
    public String toString() {
        return time + "=" + Arrays.toString(values);
    }
}
