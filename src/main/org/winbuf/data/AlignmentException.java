/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.data;

import org.apache.commons.codec.binary.Hex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;

/**
 * Buffered samples and their time stamps do not line up.
 * This can only happen if the buffers were read while the device was writing them, or if the entity is misconfigured; the data of this cycle cannot be trusted.
 */
public class AlignmentException extends RuntimeException {
    private static final long serialVersionUID = -3519260153622905178L;
    private static final Logger logger = LogManager.getLogger(AlignmentException.class.getName());

    public AlignmentException(String msg) {
        super(msg);
    }

    /**
     * @param msg  &emsp;
     * @param rawWords The raw words being decoded; dumped in hex at debug level.
     */
    public AlignmentException(String msg, long[] rawWords) {
        super(msg + ", " + (rawWords != null ? rawWords.length : "null") + " raw words");
        if (logger.isDebugEnabled() && rawWords != null) {
            ByteBuffer buf = ByteBuffer.allocate(rawWords.length * Integer.BYTES);
            for (long word : rawWords) {
                buf.putInt((int) word);
            }
            logger.debug(Hex.encodeHexString(buf.array()));
        }
    }
}
