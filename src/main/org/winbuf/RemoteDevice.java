/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf;

import java.util.List;
import java.util.Map;

/** A handle on the remote acquisition device.
 *  <p>
 *  The device hosts named buffer entities, each exposing a set of scalar and array parameters.
 *  Implementations wrap whatever RPC mechanism the device offers; this library only talks to the device through this interface.
 *  A handle is passed explicitly into each session. Calls are synchronous and assumed to be bounded in time.
 *  <p>
 *  All calls may fail with a {@link RemoteCallException}; callers own any retry policy.
 */
public interface RemoteDevice {
    /** @return The current operating mode of the device. */
    public DeviceMode getMode() throws RemoteCallException;

    /** @return Names of all the buffer entities that are visible on the device. */
    public List<String> getEntityNames() throws RemoteCallException;

    /**
     * @param entityName  Name of the buffer entity
     * @return The name of the processing unit that hosts the entity; this names the clock the entity runs on.
     */
    public String getEntityParent(String entityName) throws RemoteCallException;

    /** @return Sampling rate in Hz for each processing unit, keyed by unit name. */
    public Map<String, Double> getSamplingRates() throws RemoteCallException;

    /** @return Names of all parameters exposed by the entity. */
    public List<String> getParameterNames(String entityName) throws RemoteCallException;

    public ParameterInfo getParameterInfo(String entityName, String parameterName) throws RemoteCallException;

    /** Get the current value of a scalar parameter. */
    public double getParameterValue(String entityName, String parameterName) throws RemoteCallException;

    /** Set the value of a scalar parameter. The device may clamp or ignore the value; read it back to find out. */
    public void setParameterValue(String entityName, String parameterName, double value) throws RemoteCallException;

    /**
     * Read a contiguous range of an array parameter.
     * @param entityName  Name of the buffer entity
     * @param parameterName  Name of the array parameter
     * @param count Number of elements to read
     * @param offset  Index of the first element to read
     * @return The values in the range [offset, offset + count)
     */
    public double[] getParameterValues(String entityName, String parameterName, int count, int offset) throws RemoteCallException;
}
