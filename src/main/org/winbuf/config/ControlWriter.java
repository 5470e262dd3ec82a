/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config;

import org.winbuf.ParameterInfo;
import org.winbuf.RemoteCallException;
import org.winbuf.RemoteDevice;
import org.winbuf.config.exception.RangeException;
import org.winbuf.config.exception.ValidationException;

/**
 * Writes the device side settings of a bound buffer entity and records the values the device applied.
 * This is the only way the buffer size and response window of a {@link BufferSessionConfig} change.
 */
public class ControlWriter {
    private final RemoteDevice device;
    private final BufferSessionConfig config;

    /**
     * The requested and applied sample counts of one write.
     */
    public static class AppliedCount {
        private final long requested;
        private final double applied;

        AppliedCount(long requested, double applied) {
            this.requested = requested;
            this.applied = applied;
        }

        public long getRequested() {
            return requested;
        }

        public double getApplied() {
            return applied;
        }

        public boolean isClamped() {
            return applied != requested;
        }
    }

    public ControlWriter(RemoteDevice device, BufferSessionConfig config) {
        this.device = device;
        this.config = config;
    }

    /**
     * Write BuffSize, rounded up to the next sample, and read back the applied value.
     * The compressed capacity is re-derived, re-reading BuffSizeMC when the entity supports compression.
     * @param seconds  Buffer duration, &gt; 0
     * @param rate Expected buffering rate in Hz, from (0, parent rate]
     * @return AppliedCount in samples at the buffering rate
     * @throws RemoteCallException  &emsp;
     */
    public AppliedCount writeBufferSize(double seconds, double rate) throws RemoteCallException {
        checkSeconds("Buffer size", seconds, false);
        checkRate(rate);
        String name = config.getEntityName();

        long requested = ceilSamples(seconds * rate);
        long n = requested;
        double max = config.getInfo(RequiredControl.BUFF_SIZE).getMax();
        if (Double.isFinite(max) && n > max) {
            n = (long) Math.floor(max);
        }

        device.setParameterValue(name, RequiredControl.BUFF_SIZE.getDeviceName(), n);
        double applied = device.getParameterValue(name, RequiredControl.BUFF_SIZE.getDeviceName());
        config.updateValue(RequiredControl.BUFF_SIZE, applied);
        if (config.isSupportsCompression()) {
            config.updateValue(RequiredControl.BUFF_SIZE_MC, device.getParameterValue(name, RequiredControl.BUFF_SIZE_MC.getDeviceName()));
        }
        config.recomputeCompressedCapacity();
        config.setBufferSizeSeconds(applied / rate);
        return new AppliedCount(requested, applied);
    }

    /**
     * Write RespWin, rounded up to the next sample of the parent clock, and read back the applied value.
     * The window cannot be longer than the largest buffer the entity supports at the given rate.
     * @param seconds  Response window duration, &gt;= 0
     * @param rate Expected buffering rate in Hz, from (0, parent rate]
     * @return AppliedCount in parent clock samples
     * @throws RemoteCallException  &emsp;
     */
    public AppliedCount writeResponseWindow(double seconds, double rate) throws RemoteCallException {
        checkSeconds("Response window", seconds, true);
        checkRate(rate);
        String name = config.getEntityName();
        double parentRate = config.getParentRate();

        long requested = ceilSamples(seconds * parentRate);
        double maxWindow = config.getInfo(RequiredControl.BUFF_SIZE).getMax() / rate;
        long n = ceilSamples(Math.min(seconds, maxWindow) * parentRate);
        ParameterInfo respInfo = config.getInfo(RequiredControl.RESP_WIN);
        if (Double.isFinite(respInfo.getMax()) && n > respInfo.getMax()) {
            n = (long) Math.floor(respInfo.getMax());
        }

        device.setParameterValue(name, RequiredControl.RESP_WIN.getDeviceName(), n);
        double applied = device.getParameterValue(name, RequiredControl.RESP_WIN.getDeviceName());
        config.updateValue(RequiredControl.RESP_WIN, applied);
        config.setResponseWindowSeconds(applied / parentRate);
        return new AppliedCount(requested, applied);
    }

    private static void checkSeconds(String what, double seconds, boolean allowZero) {
        if (!Double.isFinite(seconds) || seconds < 0 || (!allowZero && seconds == 0)) {
            throw new ValidationException(what + " must be a finite number of seconds " + (allowZero ? ">= 0" : "> 0") + ", got " + seconds);
        }
    }

    private void checkRate(double rate) {
        double parentRate = config.getParentRate();
        if (!Double.isFinite(rate) || rate <= 0 || rate > parentRate) {
            throw new RangeException("Buffering rate", rate, 0, parentRate);
        }
    }

    /**
     * Round up to the next whole sample. Products that miss an integer by floating point noise are not rounded up.
     */
    static long ceilSamples(double samples) {
        double nearest = Math.rint(samples);
        if (Math.abs(samples - nearest) <= 1e-9 * Math.max(1.0, Math.abs(samples))) {
            return (long) nearest;
        }
        return (long) Math.ceil(samples);
    }
}
