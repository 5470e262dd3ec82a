/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf;

/**
 * Operating modes reported by the acquisition device.
 * Buffer entities can only be bound while the device is in one of the run-time modes.
 */
public enum DeviceMode {
    IDLE(0, false),
    STANDBY(1, false),
    PREVIEW(2, true),
    RECORD(3, true);

    private final int code;
    private final boolean active;

    private DeviceMode(int code, boolean active) {
        this.code = code;
        this.active = active;
    }

    public int getCode() {
        return code;
    }

    /**
     * @return true if the device is acquiring, i.e. in run-time mode.
     */
    public boolean isActive() {
        return active;
    }

    public static DeviceMode fromCode(int code) {
        for (DeviceMode mode : DeviceMode.values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown device mode code " + code);
    }
}
