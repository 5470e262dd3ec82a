/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.retrieval;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winbuf.common.TimeWindow;
import org.winbuf.data.SampleBlock;

/**
 * Discards decoded samples whose time lies outside an inclusive time window.
 * Samples that fall exactly on an edge of the window are kept.
 * This is applied to fully decoded blocks only; decompression needs the complete contiguous buffer.
 */
public class TimeWindowFilter {
    private static final Logger logger = LogManager.getLogger(TimeWindowFilter.class.getName());

    private final TimeWindow window;

    public TimeWindowFilter(TimeWindow window) {
        this.window = window;
    }

    public SampleBlock apply(SampleBlock block) {
        if (window.isUnbounded() || block.isEmpty()) {
            return block;
        }
        double[] times = block.getTimes();
        double[][] values = block.getValues();
        int kept = 0;
        for (double time : times) {
            if (window.contains(time)) {
                kept++;
            }
        }
        if (kept == times.length) {
            return block;
        }
        double[] keptTimes = new double[kept];
        double[][] keptValues = new double[kept][];
        int pos = 0;
        for (int s = 0; s < times.length; s++) {
            if (window.contains(times[s])) {
                keptTimes[pos] = times[s];
                keptValues[pos] = values[s];
                pos++;
            }
        }
        logger.debug("Time window " + window + " kept " + kept + " of " + times.length + " samples");
        return new SampleBlock(keptTimes, keptValues, block.getChannelCount());
    }
}
