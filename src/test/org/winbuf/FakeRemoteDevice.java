/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * In-memory stand-in for the acquisition device hosting a single windowed buffer entity.
 * Stored samples are pushed in with {@link #push(long, double...)}, which behaves like the buffer on the device:
 * the three circular buffers are written at their indices, the indices wrap and the lifetime counter increments.
 * Every call is recorded so tests can check the order of remote calls.
 */
public class FakeRemoteDevice implements RemoteDevice {
    public static final String PARENT = "RZ2";

    private final String entityName;
    private final double parentRate;
    private final long secondsPerMinute;
    private final int chanPerSamp;
    private final int capacity;
    private DeviceMode mode = DeviceMode.RECORD;
    private final LinkedHashMap<String, ParameterInfo> infos = new LinkedHashMap<String, ParameterInfo>();
    private final HashMap<String, Double> scalars = new HashMap<String, Double>();
    private final HashMap<String, double[]> arrays = new HashMap<String, double[]>();
    private final HashMap<String, Double> forcedValues = new HashMap<String, Double>();
    private final List<String> calls = new LinkedList<String>();
    private String failOn = null;

    /**
     * @param entityName  &emsp;
     * @param chanPerSamp Words per stored sample
     * @param capacity Capacity in stored samples
     * @param downSamp  &emsp;
     * @param parentRate  &emsp;
     * @param secondsPerMinute  &emsp;
     */
    public FakeRemoteDevice(String entityName, int chanPerSamp, int capacity, int downSamp, double parentRate, long secondsPerMinute) {
        this.entityName = entityName;
        this.parentRate = parentRate;
        this.secondsPerMinute = secondsPerMinute;
        this.chanPerSamp = chanPerSamp;
        this.capacity = capacity;

        scalar("BuffSize", ParameterType.INT, 1, 100000, capacity);
        scalar("ChanPerSamp", ParameterType.INT, 1, 1024, chanPerSamp);
        scalar("DownSamp", ParameterType.INT, 1, 1000, downSamp);
        scalar("RespWin", ParameterType.INT, 0, 1000000, 0);
        scalar("StartBuff", ParameterType.LOGIC, 0, 1, 0);
        scalar("Mindex", ParameterType.INT, 0, Double.POSITIVE_INFINITY, 0);
        scalar("Sindex", ParameterType.INT, 0, Double.POSITIVE_INFINITY, 0);
        scalar("MCindex", ParameterType.INT, 0, Double.POSITIVE_INFINITY, 0);
        scalar("Counter", ParameterType.INT, 0, Double.POSITIVE_INFINITY, 0);
        scalar("EventMin", ParameterType.INT, 0, Double.POSITIVE_INFINITY, 0);
        scalar("EventSec", ParameterType.INT, 0, secondsPerMinute, 0);
        array("Minutes", ParameterType.INT, 0, Double.POSITIVE_INFINITY, capacity);
        array("Seconds", ParameterType.INT, 0, secondsPerMinute, capacity);
        array("MCsamples", ParameterType.FLOAT, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, capacity * chanPerSamp);
    }

    /**
     * Add the compression controls.
     * @param domainCode 0 none, 1 channels, 2 time
     * @param bitsPerVal  &emsp;
     * @param scaleFactor  &emsp;
     * @return this
     */
    public FakeRemoteDevice withCompression(int domainCode, int bitsPerVal, double scaleFactor) {
        scalar("BitsPerVal", ParameterType.INT, 1, 32, bitsPerVal);
        scalar("ScaleFactor", ParameterType.FLOAT, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, scaleFactor);
        scalar("CompDomain", ParameterType.INT, 0, 2, domainCode);
        scalar("BuffSizeMC", ParameterType.INT, 1, Double.POSITIVE_INFINITY, capacity * chanPerSamp);
        if (domainCode == 2) {
            scalars.put("BuffSize", (double) capacity * (32 / bitsPerVal));
        }
        return this;
    }

    /**
     * Declare the type of the sample buffer.
     * @param type  &emsp;
     * @param min Declared minimum; a non-negative minimum makes integer words unsigned
     * @return this
     */
    public FakeRemoteDevice withSampleType(ParameterType type, double min) {
        ParameterInfo old = infos.get("MCsamples");
        infos.put("MCsamples", ParameterInfo.array("MCsamples", type, min, old.getMax(), old.getArrayLength()));
        return this;
    }

    public FakeRemoteDevice withMax(String name, double max) {
        ParameterInfo old = infos.get(name);
        infos.put(name, new ParameterInfo(name, old.getType(), old.getMin(), max, old.getArrayLength()));
        return this;
    }

    public FakeRemoteDevice withoutParameter(String name) {
        infos.remove(name);
        return this;
    }

    public FakeRemoteDevice withExtraParameter(String name) {
        scalar(name, ParameterType.INT, 0, 1, 0);
        return this;
    }

    public void setMode(DeviceMode mode) {
        this.mode = mode;
    }

    /**
     * The device will store this value whenever the parameter is set, whatever was asked for.
     */
    public void forceAppliedValue(String name, double value) {
        forcedValues.put(name, value);
    }

    /**
     * Throw a RemoteCallException from every call that touches this parameter.
     */
    public void failOn(String name) {
        this.failOn = name;
    }

    public void setScalar(String name, double value) {
        scalars.put(name, value);
    }

    public double getScalar(String name) {
        return scalars.get(name);
    }

    /**
     * Set the time stamp of the trigger event.
     * @param sampleIndex Parent clock samples since the clock started
     */
    public void trigger(long sampleIndex) {
        scalars.put("EventMin", (double) Math.floorDiv(sampleIndex, secondsPerMinute));
        scalars.put("EventSec", (double) Math.floorMod(sampleIndex, secondsPerMinute));
    }

    /**
     * Buffer one stored sample, like the entity on the device does.
     * @param sampleIndex Time stamp in parent clock samples
     * @param words ChanPerSamp words
     */
    public void push(long sampleIndex, double... words) {
        if (words.length != chanPerSamp) {
            throw new IllegalArgumentException("Expected " + chanPerSamp + " words, got " + words.length);
        }
        int mindex = scalars.get("Mindex").intValue();
        int sindex = scalars.get("Sindex").intValue();
        int mcindex = scalars.get("MCindex").intValue();
        arrays.get("Minutes")[mindex] = Math.floorDiv(sampleIndex, secondsPerMinute);
        arrays.get("Seconds")[sindex] = Math.floorMod(sampleIndex, secondsPerMinute);
        System.arraycopy(words, 0, arrays.get("MCsamples"), mcindex, chanPerSamp);
        scalars.put("Mindex", (double) ((mindex + 1) % capacity));
        scalars.put("Sindex", (double) ((sindex + 1) % capacity));
        scalars.put("MCindex", (double) ((mcindex + chanPerSamp) % (capacity * chanPerSamp)));
        scalars.put("Counter", scalars.get("Counter") + 1);
    }

    public List<String> getCalls() {
        return calls;
    }

    public void clearCalls() {
        calls.clear();
    }

    private void scalar(String name, ParameterType type, double min, double max, double value) {
        infos.put(name, ParameterInfo.scalar(name, type, min, max));
        scalars.put(name, value);
    }

    private void array(String name, ParameterType type, double min, double max, int length) {
        infos.put(name, ParameterInfo.array(name, type, min, max, length));
        arrays.put(name, new double[length]);
    }

    private void record(String call, String name) throws RemoteCallException {
        record(call, name, "");
    }

    private void record(String call, String name, String detail) throws RemoteCallException {
        calls.add(call + ":" + name + detail);
        if (name != null && name.equals(failOn)) {
            throw new RemoteCallException("Simulated failure on " + name);
        }
    }

    private void checkEntity(String name) throws RemoteCallException {
        if (!entityName.equals(name)) {
            throw new RemoteCallException("No entity called " + name);
        }
    }

    @Override
    public DeviceMode getMode() throws RemoteCallException {
        record("getMode", null);
        return mode;
    }

    @Override
    public List<String> getEntityNames() throws RemoteCallException {
        record("getEntityNames", null);
        return Arrays.asList(entityName, "Sim1");
    }

    @Override
    public String getEntityParent(String name) throws RemoteCallException {
        checkEntity(name);
        return PARENT;
    }

    @Override
    public Map<String, Double> getSamplingRates() throws RemoteCallException {
        HashMap<String, Double> rates = new HashMap<String, Double>();
        rates.put(PARENT, parentRate);
        rates.put("PZ5", 50000.0);
        return rates;
    }

    @Override
    public List<String> getParameterNames(String name) throws RemoteCallException {
        checkEntity(name);
        return new ArrayList<String>(infos.keySet());
    }

    @Override
    public ParameterInfo getParameterInfo(String name, String parameterName) throws RemoteCallException {
        checkEntity(name);
        record("getParameterInfo", parameterName);
        return infos.get(parameterName);
    }

    @Override
    public double getParameterValue(String name, String parameterName) throws RemoteCallException {
        checkEntity(name);
        record("get", parameterName);
        Double value = scalars.get(parameterName);
        if (value == null) {
            throw new RemoteCallException("No scalar parameter " + parameterName);
        }
        return value;
    }

    @Override
    public void setParameterValue(String name, String parameterName, double value) throws RemoteCallException {
        checkEntity(name);
        record("set", parameterName);
        if (!scalars.containsKey(parameterName)) {
            throw new RemoteCallException("No scalar parameter " + parameterName);
        }
        Double forced = forcedValues.get(parameterName);
        scalars.put(parameterName, forced != null ? forced : Math.min(value, infos.get(parameterName).getMax()));
    }

    @Override
    public double[] getParameterValues(String name, String parameterName, int count, int offset) throws RemoteCallException {
        checkEntity(name);
        record("getValues", parameterName, "[" + offset + "," + (offset + count) + ")");
        double[] values = arrays.get(parameterName);
        if (values == null || offset < 0 || offset + count > values.length) {
            throw new RemoteCallException("Bad read of " + parameterName + " at " + offset + " x " + count);
        }
        return Arrays.copyOfRange(values, offset, offset + count);
    }
}
