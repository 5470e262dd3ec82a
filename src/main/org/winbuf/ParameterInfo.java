/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf;

/**
 * Metadata about one parameter (control) of a buffer entity.
 * <p>
 * The array length is 0 for scalar parameters.
 * For the time stamp arrays, the declared maximum of the Seconds array is the number of Seconds per Minute.
 */
public class ParameterInfo {
    private final String name;
    private final ParameterType type;
    private final double min;
    private final double max;
    private final int arrayLength;

    public ParameterInfo(String name, ParameterType type, double min, double max, int arrayLength) {
        this.name = name;
        this.type = type;
        this.min = min;
        this.max = max;
        this.arrayLength = arrayLength;
    }

    public static ParameterInfo scalar(String name, ParameterType type, double min, double max) {
        return new ParameterInfo(name, type, min, max, 0);
    }

    public static ParameterInfo array(String name, ParameterType type, double min, double max, int arrayLength) {
        return new ParameterInfo(name, type, min, max, arrayLength);
    }

    public String getName() {
        return name;
    }

    public ParameterType getType() {
        return type;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public int getArrayLength() {
        return arrayLength;
    }

    public boolean isArray() {
        return arrayLength > 0;
    }

    @Override
    public String toString() {
        return "ParameterInfo{name=" + name + ", type=" + type + ", min=" + min + ", max=" + max
                + ", arrayLength=" + arrayLength + '}';
    }
}
