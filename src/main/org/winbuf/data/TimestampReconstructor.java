/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.data;

import org.winbuf.common.MinuteSecondTimestamp;
import org.winbuf.config.BufferSessionConfig;
import org.winbuf.config.CompressionDomain;

/**
 * Converts buffered Minute and Second stamps into times in seconds relative to the trigger event.
 * <p>
 * With compression across time, only the stamp of the last sample in each word is buffered.
 * If that stamp is T, slot k of N has stamp T - (N - 1 - k) * P where P is the down sampling factor; both in parent clock samples.
 */
public class TimestampReconstructor {
    private final long secondsPerMinute;
    private final double parentRate;
    private final int factor;
    private final int downsample;

    public TimestampReconstructor(BufferSessionConfig config) {
        this(config.getSecondsPerMinute(), config.getParentRate(),
                config.getCompressionDomain() == CompressionDomain.TIME ? config.getCompressionFactor() : 1,
                config.getDownsampleFactor());
    }

    public TimestampReconstructor(long secondsPerMinute, double parentRate, int factor, int downsample) {
        this.secondsPerMinute = secondsPerMinute;
        this.parentRate = parentRate;
        this.factor = factor;
        this.downsample = downsample;
    }

    /**
     * @param minutes  Buffered Minute stamps
     * @param seconds  Buffered Second stamps
     * @param trigger  Stamp of the trigger event
     * @return Parent clock samples relative to the trigger, one per decompressed sample, in chronological order
     */
    public long[] relativeSampleIndices(double[] minutes, double[] seconds, MinuteSecondTimestamp trigger) {
        if (minutes.length != seconds.length) {
            throw new AlignmentException("Buffered " + minutes.length + " Minutes but " + seconds.length + " Seconds");
        }
        long t0 = trigger.toSampleIndex(secondsPerMinute);
        long[] ret = new long[minutes.length * factor];
        int pos = 0;
        for (int i = 0; i < minutes.length; i++) {
            long stamp = MinuteSecondTimestamp.fromDeviceValues(minutes[i], seconds[i]).toSampleIndex(secondsPerMinute) - t0;
            for (int k = 0; k < factor; k++) {
                ret[pos++] = stamp - (long) (factor - 1 - k) * downsample;
            }
        }
        return ret;
    }

    /**
     * @param minutes  Buffered Minute stamps
     * @param seconds  Buffered Second stamps
     * @param trigger  Stamp of the trigger event
     * @return Seconds relative to the trigger, one per decompressed sample
     */
    public double[] reconstruct(double[] minutes, double[] seconds, MinuteSecondTimestamp trigger) {
        long[] indices = relativeSampleIndices(minutes, seconds, trigger);
        double[] ret = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            ret[i] = indices[i] / parentRate;
        }
        return ret;
    }
}
