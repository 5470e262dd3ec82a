/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config.exception;

/**
 * A setter was called with a malformed argument. Nothing has been changed when this is thrown.
 */
public class ValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 7951318846521708826L;

    public ValidationException(String msg) {
        super(msg);
    }
}
