/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.engine.membuf;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winbuf.RemoteCallException;
import org.winbuf.RemoteDevice;
import org.winbuf.common.MinuteSecondTimestamp;
import org.winbuf.config.BufferSessionConfig;
import org.winbuf.config.RequiredControl;

import java.util.EnumMap;

/**
 * The write indices, lifetime counter and trigger time stamp of a buffer entity, read together.
 * <p>
 * All of these are read before any buffer segment is fetched. Reading an index after fetching another buffer could pair time stamps with the wrong samples.
 */
public class BufferSnapshot {
    private static final Logger logger = LogManager.getLogger(BufferSnapshot.class.getName());

    private final EnumMap<SubBuffer, CircularBufferState> states;
    private final long counter;
    private final MinuteSecondTimestamp trigger;

    public BufferSnapshot(EnumMap<SubBuffer, CircularBufferState> states, long counter, MinuteSecondTimestamp trigger) {
        this.states = states;
        this.counter = counter;
        this.trigger = trigger;
    }

    /**
     * Read fresh values of the index and counter controls from the device.
     * @param device  &emsp;
     * @param config  &emsp;
     * @return BufferSnapshot
     * @throws RemoteCallException  &emsp;
     */
    public static BufferSnapshot capture(RemoteDevice device, BufferSessionConfig config) throws RemoteCallException {
        String entityName = config.getEntityName();
        EnumMap<SubBuffer, Integer> indices = new EnumMap<SubBuffer, Integer>(SubBuffer.class);
        for (SubBuffer subBuffer : SubBuffer.values()) {
            indices.put(subBuffer, (int) device.getParameterValue(entityName, subBuffer.getIndexControl().getDeviceName()));
        }
        long counter = Math.round(device.getParameterValue(entityName, RequiredControl.COUNTER.getDeviceName()));
        double eventMinute = device.getParameterValue(entityName, RequiredControl.EVENT_MINUTE.getDeviceName());
        double eventSecond = device.getParameterValue(entityName, RequiredControl.EVENT_SECOND.getDeviceName());

        EnumMap<SubBuffer, CircularBufferState> states = new EnumMap<SubBuffer, CircularBufferState>(SubBuffer.class);
        int capacity = config.getCompressedCapacity();
        for (SubBuffer subBuffer : SubBuffer.values()) {
            states.put(subBuffer, new CircularBufferState(subBuffer, indices.get(subBuffer), counter, capacity,
                    subBuffer.getElementsPerSample(config)));
        }
        BufferSnapshot snapshot = new BufferSnapshot(states, counter, MinuteSecondTimestamp.fromDeviceValues(eventMinute, eventSecond));
        logger.debug("Snapshot of " + entityName + ": " + snapshot);
        return snapshot;
    }

    public CircularBufferState getState(SubBuffer subBuffer) {
        return states.get(subBuffer);
    }

    public long getCounter() {
        return counter;
    }

    public MinuteSecondTimestamp getTrigger() {
        return trigger;
    }

    @Override
    public String toString() {
        return "counter " + counter + ", trigger " + trigger + ", " + states.values();
    }
}
