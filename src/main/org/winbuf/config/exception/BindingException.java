/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config.exception;

/**
 * The buffer entity cannot be bound; either it does not exist or the device is not in run-time mode.
 */
public class BindingException extends ConfigException {
    private static final long serialVersionUID = 2386170853317512406L;

    public BindingException(String msg) {
        super(msg);
    }
}
