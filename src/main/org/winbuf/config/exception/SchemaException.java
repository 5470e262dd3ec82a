/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config.exception;

import java.util.Collection;

/**
 * The buffer entity does not expose the controls we need, or exposes values we cannot interpret.
 */
public class SchemaException extends ConfigException {
    private static final long serialVersionUID = -6027139410374652145L;

    public SchemaException(String msg) {
        super(msg);
    }

    public static SchemaException missingControls(String entityName, Collection<String> missing) {
        return new SchemaException("Buffer entity " + entityName + " lacks control(s): " + String.join(" , ", missing));
    }
}
