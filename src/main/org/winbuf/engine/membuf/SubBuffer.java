/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.engine.membuf;

import org.winbuf.config.BufferSessionConfig;
import org.winbuf.config.RequiredControl;

/**
 * The three parallel circular buffers of a windowed buffer entity, each with its own write index.
 * All three share the lifetime write counter.
 */
public enum SubBuffer {
    MINUTES(RequiredControl.MINUTES, RequiredControl.MINUTE_INDEX),
    SECONDS(RequiredControl.SECONDS, RequiredControl.SECOND_INDEX),
    SAMPLES(RequiredControl.SAMPLES, RequiredControl.SAMPLE_INDEX);

    private final RequiredControl bufferControl;
    private final RequiredControl indexControl;

    private SubBuffer(RequiredControl bufferControl, RequiredControl indexControl) {
        this.bufferControl = bufferControl;
        this.indexControl = indexControl;
    }

    public RequiredControl getBufferControl() {
        return bufferControl;
    }

    public RequiredControl getIndexControl() {
        return indexControl;
    }

    /**
     * @param config  &emsp;
     * @return Buffer elements consumed per stored sample; one for the time stamps, ChanPerSamp for the samples.
     */
    public int getElementsPerSample(BufferSessionConfig config) {
        return this == SAMPLES ? config.getChanPerSample() : 1;
    }
}
