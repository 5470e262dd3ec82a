/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Set;

/**
 * The controls a windowed buffer entity must expose, by the name the device uses for them.
 * <p>
 * BASE controls are mandatory. COMPRESSION controls are exposed by entities that pack several values into each buffered word;
 * an entity exposes either all of them or none of them.
 */
public enum RequiredControl {
    BUFF_SIZE("BuffSize", Group.BASE, false),
    CHAN_PER_SAMP("ChanPerSamp", Group.BASE, false),
    DOWN_SAMP("DownSamp", Group.BASE, false),
    RESP_WIN("RespWin", Group.BASE, false),
    START_BUFF("StartBuff", Group.BASE, false),
    MINUTE_INDEX("Mindex", Group.BASE, false),
    SECOND_INDEX("Sindex", Group.BASE, false),
    SAMPLE_INDEX("MCindex", Group.BASE, false),
    COUNTER("Counter", Group.BASE, false),
    EVENT_MINUTE("EventMin", Group.BASE, false),
    EVENT_SECOND("EventSec", Group.BASE, false),
    MINUTES("Minutes", Group.BASE, true),
    SECONDS("Seconds", Group.BASE, true),
    SAMPLES("MCsamples", Group.BASE, true),
    BITS_PER_VAL("BitsPerVal", Group.COMPRESSION, false),
    SCALE_FACTOR("ScaleFactor", Group.COMPRESSION, false),
    COMP_DOMAIN("CompDomain", Group.COMPRESSION, false),
    BUFF_SIZE_MC("BuffSizeMC", Group.COMPRESSION, false);

    public enum Group {
        BASE,
        COMPRESSION
    }

    private static HashMap<String, RequiredControl> deviceNameMapping = new HashMap<String, RequiredControl>();

    static {
        for (RequiredControl control : RequiredControl.values()) {
            deviceNameMapping.put(control.getDeviceName(), control);
        }
    }

    private final String deviceName;
    private final Group group;
    private final boolean array;

    private RequiredControl(String deviceName, Group group, boolean array) {
        this.deviceName = deviceName;
        this.group = group;
        this.array = array;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public Group getGroup() {
        return group;
    }

    /**
     * @return true for the three circular buffers; these are never read as scalars.
     */
    public boolean isArray() {
        return array;
    }

    /**
     * Reverse map from the name the device uses.
     * @param deviceName  &emsp;
     * @return null if this is not one of our controls
     */
    public static RequiredControl fromDeviceName(String deviceName) {
        return deviceNameMapping.get(deviceName);
    }

    public static Set<RequiredControl> inGroup(Group group) {
        EnumSet<RequiredControl> ret = EnumSet.noneOf(RequiredControl.class);
        for (RequiredControl control : RequiredControl.values()) {
            if (control.getGroup() == group) {
                ret.add(control);
            }
        }
        return ret;
    }
}
