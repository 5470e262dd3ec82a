/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.common;

/**
 * A time stamp as the acquisition device keeps it; a Minute count and a Second count.
 * Second counts samples of the parent device clock in [0, secondsPerMinute) and Minute increments each time Second overflows.
 * Splitting the count this way avoids rounding errors in long recordings; we recombine them into a 64 bit sample index.
 */
public class MinuteSecondTimestamp implements Comparable<MinuteSecondTimestamp> {

    private final long minute;
    private final long second;

    public MinuteSecondTimestamp(long minute, long second) {
        this.minute = minute;
        this.second = second;
    }

    /**
     * The device transfers everything as doubles; these hold integer counts.
     * @param minute  &emsp;
     * @param second  &emsp;
     * @return MinuteSecondTimestamp
     */
    public static MinuteSecondTimestamp fromDeviceValues(double minute, double second) {
        return new MinuteSecondTimestamp(Math.round(minute), Math.round(second));
    }

    public static MinuteSecondTimestamp fromSampleIndex(long sampleIndex, long secondsPerMinute) {
        return new MinuteSecondTimestamp(
                Math.floorDiv(sampleIndex, secondsPerMinute), Math.floorMod(sampleIndex, secondsPerMinute));
    }

    public long getMinute() {
        return minute;
    }

    public long getSecond() {
        return second;
    }

    /**
     * @param secondsPerMinute The number of Seconds per Minute; the declared maximum of the Seconds buffer.
     * @return The number of parent clock samples since the device clock started.
     */
    public long toSampleIndex(long secondsPerMinute) {
        return minute * secondsPerMinute + second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        MinuteSecondTimestamp that = (MinuteSecondTimestamp) o;
        return minute == that.minute && second == that.second;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(minute);
        result = 31 * result + Long.hashCode(second);
        return result;
    }

    @Override
    public String toString() {
        return "MinuteSecondTimestamp{minute=" + minute + ", second=" + second + '}';
    }

    @Override
    public int compareTo(MinuteSecondTimestamp other) {
        if (this.minute == other.minute) {
            return Long.compare(this.second, other.second);
        } else {
            return Long.compare(this.minute, other.minute);
        }
    }
}
