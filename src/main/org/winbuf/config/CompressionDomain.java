/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config;

import org.winbuf.config.exception.SchemaException;

/**
 * The axis along which several values are packed into one buffered word.
 * The code is the value of the CompDomain control.
 */
public enum CompressionDomain {
    NONE(0, "none"),
    CHANNELS(1, "channels"),
    TIME(2, "time");

    private final int code;
    private final String label;

    private CompressionDomain(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static CompressionDomain fromCode(String entityName, double code) throws SchemaException {
        for (CompressionDomain domain : CompressionDomain.values()) {
            if (domain.getCode() == code) {
                return domain;
            }
        }
        throw new SchemaException("Unknown compression type in " + entityName + ", code " + code);
    }
}
