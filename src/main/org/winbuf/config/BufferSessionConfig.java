/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config;

import org.json.simple.JSONObject;
import org.winbuf.ParameterInfo;
import org.winbuf.common.TimeWindow;
import org.winbuf.config.exception.RangeException;
import org.winbuf.config.exception.ValidationException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static configuration of one bound buffer entity, derived once at bind time by the {@link SchemaResolver}.
 * <p>
 * The device side values (buffer size, response window) only change through a {@link ControlWriter}, which writes to the device and reads the applied value back.
 * The client side values (channel sub-selection and time window) are validated here.
 */
public class BufferSessionConfig {
    private final String entityName;
    private final String parentName;
    private final double parentRate;
    private final long secondsPerMinute;
    private final int wordBits;
    private final EnumMap<RequiredControl, ParameterInfo> infos;
    private final EnumMap<RequiredControl, Double> values;
    private final boolean supportsCompression;
    private final CompressionDomain domain;
    private final int bitsPerValue;
    private final int compFactor;
    private final double scaleFactor;
    private final NativeWordType nativeType;

    private int compressedCapacity;
    private int channelSubselection;
    private double bufferSizeSeconds;
    private double responseWindowSeconds;
    private TimeWindow timeWindow = TimeWindow.ALL;

    BufferSessionConfig(String entityName, String parentName, double parentRate, long secondsPerMinute, int wordBits,
            Map<RequiredControl, ParameterInfo> infos, Map<RequiredControl, Double> values, boolean supportsCompression,
            CompressionDomain domain, int bitsPerValue, double scaleFactor, NativeWordType nativeType) {
        this.entityName = entityName;
        this.parentName = parentName;
        this.parentRate = parentRate;
        this.secondsPerMinute = secondsPerMinute;
        this.wordBits = wordBits;
        this.infos = new EnumMap<RequiredControl, ParameterInfo>(infos);
        this.values = new EnumMap<RequiredControl, Double>(values);
        this.supportsCompression = supportsCompression;
        this.domain = domain;
        this.bitsPerValue = bitsPerValue;
        this.compFactor = wordBits / bitsPerValue;
        this.scaleFactor = scaleFactor;
        this.nativeType = nativeType;
        this.compressedCapacity = deriveCompressedCapacity();
        this.channelSubselection = getMaxChannels();
        this.bufferSizeSeconds = getRawCapacity() / getBufferingRate();
        this.responseWindowSeconds = getValue(RequiredControl.RESP_WIN) / parentRate;
    }

    public String getEntityName() {
        return entityName;
    }

    /**
     * @return Name of the processing unit hosting the entity; time stamps count samples of its clock.
     */
    public String getParentName() {
        return parentName;
    }

    public double getParentRate() {
        return parentRate;
    }

    /**
     * @return Rate at which multi-channel samples are buffered; the parent rate divided by the down sampling factor.
     */
    public double getBufferingRate() {
        return parentRate / getDownsampleFactor();
    }

    public long getSecondsPerMinute() {
        return secondsPerMinute;
    }

    public int getWordBits() {
        return wordBits;
    }

    public boolean isSupportsCompression() {
        return supportsCompression;
    }

    public CompressionDomain getCompressionDomain() {
        return domain;
    }

    public int getBitsPerValue() {
        return bitsPerValue;
    }

    /**
     * @return Number of values packed into each buffered word; 1 without compression.
     */
    public int getCompressionFactor() {
        return domain == CompressionDomain.NONE ? 1 : compFactor;
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public NativeWordType getNativeType() {
        return nativeType;
    }

    /**
     * @return Number of buffered words per multi-channel sample; the ChanPerSamp control.
     */
    public int getChanPerSample() {
        return (int) getValue(RequiredControl.CHAN_PER_SAMP);
    }

    public int getDownsampleFactor() {
        return (int) getValue(RequiredControl.DOWN_SAMP);
    }

    /**
     * @return Buffer capacity in multi-channel samples, as set on the device.
     */
    public int getRawCapacity() {
        return (int) getValue(RequiredControl.BUFF_SIZE);
    }

    /**
     * @return Buffer capacity in stored, possibly compressed, multi-channel samples. The lifetime counter is compared against this.
     */
    public int getCompressedCapacity() {
        return compressedCapacity;
    }

    /**
     * Compression across time changes how many stored samples fit into the buffer; recompute after the buffer size was changed.
     */
    void recomputeCompressedCapacity() {
        this.compressedCapacity = deriveCompressedCapacity();
    }

    private int deriveCompressedCapacity() {
        if (domain == CompressionDomain.TIME) {
            return (int) (getValue(RequiredControl.BUFF_SIZE_MC) / getChanPerSample());
        }
        return getRawCapacity();
    }

    /**
     * @return Largest possible number of channels after decompression.
     */
    public int getMaxChannels() {
        if (domain == CompressionDomain.CHANNELS) {
            return getChanPerSample() * compFactor;
        }
        return getChanPerSample();
    }

    public int getChannelSubselection() {
        return channelSubselection;
    }

    /**
     * Keep channels 1 to n after decoding.
     * @param n  &emsp;
     */
    public void setChannelSubselection(int n) {
        int max = getMaxChannels();
        if (n < 1 || n > max) {
            throw new RangeException("Channel sub-selection", n, 1, max);
        }
        this.channelSubselection = n;
    }

    public double getBufferSizeSeconds() {
        return bufferSizeSeconds;
    }

    void setBufferSizeSeconds(double bufferSizeSeconds) {
        this.bufferSizeSeconds = bufferSizeSeconds;
    }

    public double getResponseWindowSeconds() {
        return responseWindowSeconds;
    }

    void setResponseWindowSeconds(double responseWindowSeconds) {
        this.responseWindowSeconds = responseWindowSeconds;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    /**
     * Samples outside the window are discarded after decoding.
     * @param timeWindow  &emsp;
     */
    public void setTimeWindow(TimeWindow timeWindow) {
        if (timeWindow == null) {
            throw new ValidationException("Time window of " + entityName + " must not be null");
        }
        this.timeWindow = timeWindow;
    }

    public ParameterInfo getInfo(RequiredControl control) {
        return infos.get(control);
    }

    /**
     * @param control A scalar control
     * @return The value last read from the device
     */
    public double getValue(RequiredControl control) {
        Double value = values.get(control);
        if (value == null) {
            throw new IllegalArgumentException("No value known for control " + control.getDeviceName() + " of " + entityName);
        }
        return value;
    }

    /**
     * Record a value read back from the device.
     * @param control  &emsp;
     * @param value  &emsp;
     */
    void updateValue(RequiredControl control, double value) {
        if (control.isArray()) {
            throw new IllegalArgumentException(control.getDeviceName() + " is a buffer, not a scalar control");
        }
        values.put(control, value);
    }

    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject ret = new JSONObject();
        ret.put("name", entityName);
        ret.put("parent", parentName);
        ret.put("parentRate", parentRate);
        ret.put("bufferingRate", getBufferingRate());
        ret.put("secondsPerMinute", secondsPerMinute);
        ret.put("chanPerSample", getChanPerSample());
        ret.put("compression", domain.getLabel());
        ret.put("compressionFactor", getCompressionFactor());
        ret.put("scaleFactor", scaleFactor);
        ret.put("nativeType", nativeType.name());
        ret.put("rawCapacity", getRawCapacity());
        ret.put("compressedCapacity", compressedCapacity);
        ret.put("channelSubselection", channelSubselection);
        ret.put("bufferSizeSeconds", bufferSizeSeconds);
        ret.put("responseWindowSeconds", responseWindowSeconds);
        ret.put("timeWindow", timeWindow.toString());
        return ret;
    }

    @Override
    public String toString() {
        return toJSON().toJSONString();
    }
}
