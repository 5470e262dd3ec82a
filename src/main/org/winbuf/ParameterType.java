/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf;

/**
 * Declared type of a buffer entity parameter, as reported in the parameter metadata.
 */
public enum ParameterType {
    INT,
    FLOAT,
    LOGIC,
    ENUM;
}
