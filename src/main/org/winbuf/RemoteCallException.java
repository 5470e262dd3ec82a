/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf;

/**
 * Thrown when a round trip to the remote device fails.
 * Sessions never retry; this is propagated to the caller as is.
 */
public class RemoteCallException extends Exception {
    private static final long serialVersionUID = 4410973624190281375L;

    public RemoteCallException(String msg) {
        super(msg);
    }

    public RemoteCallException(String msg, Throwable ex) {
        super(msg, ex);
    }
}
