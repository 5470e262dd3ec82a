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
import org.winbuf.data.AlignmentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads all valid elements of a circular buffer in chronological order, using as few contiguous reads as possible.
 * <p>
 * Before the buffer loops, the data runs from the start of the buffer up to the write index.
 * Once it has looped, the buffer holds [ data tail , data head ]; the head of the data is read from the write index to the end of the buffer, then the tail from the start of the buffer up to the write index.
 */
public class CircularBufferReader {
    private static final Logger logger = LogManager.getLogger(CircularBufferReader.class.getName());

    private final RemoteDevice device;
    private final String entityName;

    public CircularBufferReader(RemoteDevice device, String entityName) {
        this.device = device;
        this.entityName = entityName;
    }

    /**
     * Work out which reads are needed for this buffer state. No remote calls are made.
     * @param state  &emsp;
     * @return Segments in chronological order; empty if nothing was buffered.
     */
    public static List<RawSegment> planReads(CircularBufferState state) {
        if (state.isEmpty()) {
            return Collections.emptyList();
        }
        int index = state.getWriteIndex();
        List<RawSegment> segments = new ArrayList<RawSegment>(2);
        boolean readHead = state.hasWrapped() || state.isExactlyFull();
        if (readHead) {
            segments.add(new RawSegment(index, state.getCapacityElements() - index));
        }
        if (index > 0 || !readHead) {
            segments.add(new RawSegment(0, index));
        }
        return segments;
    }

    /**
     * Fetch the planned segments of a buffer.
     * @param state  &emsp;
     * @return The fetched segments, head first.
     * @throws RemoteCallException  &emsp;
     */
    public List<RawSegment> fetch(CircularBufferState state) throws RemoteCallException {
        List<RawSegment> planned = planReads(state);
        String bufferName = state.getSubBuffer().getBufferControl().getDeviceName();
        logger.debug("Reading " + bufferName + " of " + entityName + " as " + planned + " for " + state);
        List<RawSegment> fetched = new ArrayList<RawSegment>(planned.size());
        for (RawSegment segment : planned) {
            if (segment.getLength() == 0) {
                fetched.add(segment.fetched(new double[0]));
                continue;
            }
            double[] values = device.getParameterValues(entityName, bufferName, segment.getLength(), segment.getOffset());
            if (values == null || values.length != segment.getLength()) {
                throw new AlignmentException("Asked for " + segment.getLength() + " elements of " + bufferName + " at offset "
                        + segment.getOffset() + ", device returned " + (values == null ? "null" : Integer.toString(values.length)));
            }
            fetched.add(segment.fetched(values));
        }
        return fetched;
    }

    /**
     * Fetch and concatenate all valid elements of a buffer, oldest first.
     * @param state  &emsp;
     * @return double[]
     * @throws RemoteCallException  &emsp;
     */
    public double[] read(CircularBufferState state) throws RemoteCallException {
        return concatenate(fetch(state));
    }

    public static double[] concatenate(List<RawSegment> segments) {
        int total = 0;
        for (RawSegment segment : segments) {
            if (!segment.isFetched()) {
                throw new IllegalStateException("Segment " + segment + " has not been fetched");
            }
            total += segment.getLength();
        }
        double[] ret = new double[total];
        int pos = 0;
        for (RawSegment segment : segments) {
            System.arraycopy(segment.getValues(), 0, ret, pos, segment.getLength());
            pos += segment.getLength();
        }
        return ret;
    }
}
