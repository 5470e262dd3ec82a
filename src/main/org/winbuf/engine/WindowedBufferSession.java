/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winbuf.RemoteCallException;
import org.winbuf.RemoteDevice;
import org.winbuf.common.TimeWindow;
import org.winbuf.config.BufferSessionConfig;
import org.winbuf.config.ControlWriter;
import org.winbuf.config.RequiredControl;
import org.winbuf.config.SchemaResolver;
import org.winbuf.config.WinBufProperties;
import org.winbuf.config.exception.ConfigException;
import org.winbuf.data.SampleBlock;
import org.winbuf.data.SampleDecompressor;
import org.winbuf.data.TimestampReconstructor;
import org.winbuf.engine.membuf.BufferSnapshot;
import org.winbuf.engine.membuf.CircularBufferReader;
import org.winbuf.engine.membuf.SubBuffer;
import org.winbuf.retrieval.TimeWindowFilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * Client side of one windowed buffer entity on the acquisition device.
 * <p>
 * Data is buffered on the device during a trial, in circular buffers synchronised to a trigger event.
 * After the trial, {@link #getData()} reads the buffered data, decodes it and crops it to the time window.
 * Several sessions may be bound to the same entity to grab data at several points of a trial; each session owns its state.
 * <p>
 * A session is not thread safe. All calls to the device are synchronous and failures are propagated to the caller without retry.
 */
public class WindowedBufferSession {
    private static final Logger logger = LogManager.getLogger(WindowedBufferSession.class.getName());

    private final RemoteDevice device;
    private final BufferSessionConfig config;
    private final CircularBufferReader reader;
    private final ControlWriter writer;
    private final List<ClampWarning> clampWarnings = new LinkedList<ClampWarning>();
    private final List<ClampWarningListener> listeners = new ArrayList<ClampWarningListener>();
    private SampleBlock lastBlock;

    /**
     * Bind to a buffer entity using the installation properties.
     * @param device  Handle on the remote device
     * @param entityName  Name of the windowed buffer entity
     * @throws ConfigException  If the entity cannot be bound or lacks required controls
     * @throws RemoteCallException  &emsp;
     */
    public WindowedBufferSession(RemoteDevice device, String entityName) throws ConfigException, RemoteCallException {
        this(device, entityName, WinBufProperties.load());
    }

    public WindowedBufferSession(RemoteDevice device, String entityName, WinBufProperties properties) throws ConfigException, RemoteCallException {
        this.device = device;
        this.config = new SchemaResolver(properties).resolve(device, entityName);
        this.reader = new CircularBufferReader(device, entityName);
        this.writer = new ControlWriter(device, config);
        checkResponseWindowFits();
    }

    public BufferSessionConfig getConfig() {
        return config;
    }

    public String getEntityName() {
        return config.getEntityName();
    }

    /**
     * Keep only channels 1 to n after decoding.
     * @param n  &emsp;
     */
    public void setChannelSubselection(int n) {
        config.setChannelSubselection(n);
        logger.info("Channel sub-selection of " + getEntityName() + " set to " + n);
    }

    /**
     * Samples outside [lo, hi] are discarded after decoding. -Inf and +Inf are valid.
     * @param lo Seconds relative to the trigger
     * @param hi Seconds relative to the trigger
     */
    public void setTimeWindow(double lo, double hi) {
        TimeWindow window = new TimeWindow(lo, hi);
        config.setTimeWindow(window);
        logger.info("Time window of " + getEntityName() + " set to " + window);
    }

    public double setBufferSize(double seconds) throws RemoteCallException {
        return setBufferSize(seconds, config.getBufferingRate());
    }

    /**
     * Set the size of the buffer, rounded up to the next sample.
     * @param seconds  Buffer duration
     * @param rate Expected buffering rate in Hz, from (0, parent rate]. Useful when the real buffering rate is lower than the maximum, e.g. when buffering spikes.
     * @return The buffer size applied by the device, in seconds
     * @throws RemoteCallException  &emsp;
     */
    public double setBufferSize(double seconds, double rate) throws RemoteCallException {
        ControlWriter.AppliedCount count = writer.writeBufferSize(seconds, rate);
        if (count.isClamped()) {
            raise(new ClampWarning(getEntityName(), ClampWarning.Kind.BUFFER_SIZE, count.getRequested(), count.getApplied()));
        }
        logger.info("Buffer size of " + getEntityName() + " is " + (long) count.getApplied() + " samples, " + config.getBufferSizeSeconds()
                + "s at " + rate + "Hz; capacity " + config.getCompressedCapacity() + " stored samples");
        checkResponseWindowFits();
        return config.getBufferSizeSeconds();
    }

    public double setResponseWindow(double seconds) throws RemoteCallException {
        return setResponseWindow(seconds, config.getBufferingRate());
    }

    /**
     * Set the duration of the response window, rounded up to the next sample of the parent clock.
     * The window cannot be longer than the largest buffer the entity supports at the given rate.
     * @param seconds  Response window duration
     * @param rate Expected buffering rate in Hz, from (0, parent rate]
     * @return The response window applied by the device, in seconds
     * @throws RemoteCallException  &emsp;
     */
    public double setResponseWindow(double seconds, double rate) throws RemoteCallException {
        ControlWriter.AppliedCount count = writer.writeResponseWindow(seconds, rate);
        if (count.isClamped()) {
            raise(new ClampWarning(getEntityName(), ClampWarning.Kind.RESPONSE_WINDOW, count.getRequested(), count.getApplied()));
        }
        logger.info("Response window of " + getEntityName() + " is " + (long) count.getApplied() + " parent samples, " + config.getResponseWindowSeconds() + "s");
        checkResponseWindowFits();
        return config.getResponseWindowSeconds();
    }

    /**
     * Signal the entity to start or resume circular buffering by pulsing StartBuff.
     * @throws RemoteCallException  &emsp;
     */
    public void startBuffering() throws RemoteCallException {
        String startBuff = RequiredControl.START_BUFF.getDeviceName();
        device.setParameterValue(getEntityName(), startBuff, 1);
        device.setParameterValue(getEntityName(), startBuff, 0);
        logger.debug("Started buffering on " + getEntityName());
    }

    /**
     * Read the buffered data of this cycle.
     * We assume that the trigger event has reached the entity and the response window has passed; otherwise the data may be incomplete.
     * @return Decoded samples within the time window, oldest first
     * @throws RemoteCallException  &emsp;
     */
    public SampleBlock getData() throws RemoteCallException {
        BufferSnapshot snapshot = BufferSnapshot.capture(device, config);

        double[] minutes = reader.read(snapshot.getState(SubBuffer.MINUTES));
        double[] seconds = reader.read(snapshot.getState(SubBuffer.SECONDS));
        double[] raw = reader.read(snapshot.getState(SubBuffer.SAMPLES));

        double[] times = new TimestampReconstructor(config).reconstruct(minutes, seconds, snapshot.getTrigger());
        double[][] values = new SampleDecompressor(config).decompress(raw);
        SampleBlock block = new SampleBlock(times, values, config.getChannelSubselection());
        block = new TimeWindowFilter(config.getTimeWindow()).apply(block);

        logger.debug("Read " + times.length + " samples from " + getEntityName() + ", kept " + block.size());
        this.lastBlock = block;
        return block;
    }

    /**
     * @return The result of the last call to {@link #getData()}; null before the first.
     */
    public SampleBlock getLastBlock() {
        return lastBlock;
    }

    public void addClampWarningListener(ClampWarningListener listener) {
        listeners.add(listener);
    }

    public void removeClampWarningListener(ClampWarningListener listener) {
        listeners.remove(listener);
    }

    /**
     * @return All clamp warnings raised since the session was bound, oldest first
     */
    public List<ClampWarning> getClampWarnings() {
        return Collections.unmodifiableList(clampWarnings);
    }

    public String describe() {
        return config.toJSON().toJSONString();
    }

    private void checkResponseWindowFits() {
        double window = config.getResponseWindowSeconds();
        double buffer = config.getBufferSizeSeconds();
        if (window > buffer * (1 + 1e-9)) {
            raise(new ClampWarning(getEntityName(), ClampWarning.Kind.RESPONSE_WINDOW_EXCEEDS_BUFFER, window, buffer));
        }
    }

    private void raise(ClampWarning warning) {
        logger.warn(warning.getMessage());
        clampWarnings.add(warning);
        for (ClampWarningListener listener : listeners) {
            listener.clampWarning(warning);
        }
    }
}
