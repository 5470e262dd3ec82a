/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.engine;

/**
 * A non-fatal notice that the device applied a different value than the one requested, or that applied values no longer fit together.
 * The applied value is in use when this is raised.
 */
public class ClampWarning {
    public enum Kind {
        /** BuffSize, in samples at the buffering rate. */
        BUFFER_SIZE,
        /** RespWin, in parent clock samples. */
        RESPONSE_WINDOW,
        /** The response window, in seconds, is longer than the buffer, in seconds. */
        RESPONSE_WINDOW_EXCEEDS_BUFFER
    }

    private final String entityName;
    private final Kind kind;
    private final double requested;
    private final double applied;

    public ClampWarning(String entityName, Kind kind, double requested, double applied) {
        this.entityName = entityName;
        this.kind = kind;
        this.requested = requested;
        this.applied = applied;
    }

    public String getEntityName() {
        return entityName;
    }

    public Kind getKind() {
        return kind;
    }

    public double getRequested() {
        return requested;
    }

    public double getApplied() {
        return applied;
    }

    public String getMessage() {
        switch (kind) {
            case BUFFER_SIZE:
                return "Failed to change " + entityName + " BuffSize to " + (long) requested + ", applied " + (long) applied;
            case RESPONSE_WINDOW:
                return "Failed to change " + entityName + " RespWin to " + (long) requested + ", applied " + (long) applied;
            case RESPONSE_WINDOW_EXCEEDS_BUFFER:
                return "Response window of " + entityName + " is " + requested + "s but the buffer only holds " + applied + "s";
            default:
                throw new IllegalStateException("Unknown kind " + kind);
        }
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
