/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.engine.membuf;

import org.winbuf.data.AlignmentException;

/**
 * The state of one circular buffer at the time of a snapshot.
 * <p>
 * The write index is in buffer elements and points at the next element to be written.
 * The lifetime counter counts stored samples since buffering was last started; once it exceeds the capacity the buffer has looped at least once.
 */
public class CircularBufferState {
    private final SubBuffer subBuffer;
    private final int writeIndex;
    private final long counter;
    private final int capacity;
    private final int elementsPerSample;

    /**
     * @param subBuffer  &emsp;
     * @param writeIndex Write index in elements
     * @param counter Lifetime write counter in stored samples
     * @param capacity Capacity in stored samples
     * @param elementsPerSample Elements per stored sample
     */
    public CircularBufferState(SubBuffer subBuffer, int writeIndex, long counter, int capacity, int elementsPerSample) {
        if (capacity < 1 || elementsPerSample < 1) {
            throw new IllegalArgumentException("Invalid capacity " + capacity + " x " + elementsPerSample + " for " + subBuffer);
        }
        if (counter < 0) {
            throw new AlignmentException("Negative write counter " + counter + " for " + subBuffer);
        }
        long capacityElements = (long) capacity * elementsPerSample;
        if (writeIndex < 0 || writeIndex >= capacityElements) {
            throw new AlignmentException("Write index " + writeIndex + " of " + subBuffer + " outside of [0," + capacityElements + ")");
        }
        this.subBuffer = subBuffer;
        this.writeIndex = writeIndex;
        this.counter = counter;
        this.capacity = capacity;
        this.elementsPerSample = elementsPerSample;
    }

    public SubBuffer getSubBuffer() {
        return subBuffer;
    }

    public int getWriteIndex() {
        return writeIndex;
    }

    public long getCounter() {
        return counter;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getElementsPerSample() {
        return elementsPerSample;
    }

    public int getCapacityElements() {
        return capacity * elementsPerSample;
    }

    public boolean isEmpty() {
        return counter == 0;
    }

    public boolean hasWrapped() {
        return counter > capacity;
    }

    /**
     * The buffer has been filled exactly once and the write index has come back round to 0; every element is valid.
     * @return boolean
     */
    public boolean isExactlyFull() {
        return counter == capacity && writeIndex == 0;
    }

    @Override
    public String toString() {
        return String.format("%s: index %d, counter %d, capacity %d x %d", subBuffer, writeIndex, counter, capacity, elementsPerSample);
    }
}
