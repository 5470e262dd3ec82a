/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.data;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The decoded result of one acquisition cycle: a column of sample times and a samples x channels matrix.
 */
public class SampleBlock implements Iterable<DecodedSample> {
    private final double[] times;
    private final double[][] values;
    private final int channelCount;

    /**
     * @param times Seconds relative to the trigger, one per sample
     * @param values Indexed as [sample][channel]
     * @param channelCount Number of channels, needed when there are no samples
     */
    public SampleBlock(double[] times, double[][] values, int channelCount) {
        if (times.length != values.length) {
            throw new AlignmentException("Time-stamp to sample mismatch, " + times.length + " time stamps for " + values.length + " samples");
        }
        for (double[] sample : values) {
            if (sample.length != channelCount) {
                throw new AlignmentException("Expected " + channelCount + " channels per sample, got " + sample.length);
            }
        }
        this.times = times;
        this.values = values;
        this.channelCount = channelCount;
    }

    public static SampleBlock empty(int channelCount) {
        return new SampleBlock(new double[0], new double[0][], channelCount);
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public int getChannelCount() {
        return channelCount;
    }

    /**
     * @return A copy of the sample times
     */
    public double[] getTimes() {
        return times.clone();
    }

    /**
     * @return A copy of the [sample][channel] matrix; changing it leaves the block as it was.
     */
    public double[][] getValues() {
        double[][] ret = new double[values.length][];
        for (int s = 0; s < values.length; s++) {
            ret[s] = values[s].clone();
        }
        return ret;
    }

    public DecodedSample get(int i) {
        return new DecodedSample(times[i], values[i].clone());
    }

    /**
     * @param channel  &emsp;
     * @return The values of one channel across all samples
     */
    public double[] getChannel(int channel) {
        double[] ret = new double[values.length];
        for (int s = 0; s < values.length; s++) {
            ret[s] = values[s][channel];
        }
        return ret;
    }

    @Override
    public Iterator<DecodedSample> iterator() {
        return new Iterator<DecodedSample>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < times.length;
            }

            @Override
            public DecodedSample next() {
                if (next >= times.length) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }
}
