/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winbuf.DeviceMode;
import org.winbuf.ParameterInfo;
import org.winbuf.RemoteCallException;
import org.winbuf.RemoteDevice;
import org.winbuf.config.exception.BindingException;
import org.winbuf.config.exception.ConfigException;
import org.winbuf.config.exception.SchemaException;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds to a named windowed buffer entity and derives its static configuration.
 * <p>
 * The parameters the device reports for the entity are checked against the enumerated schema in {@link RequiredControl}.
 * Entities with the compression extension expose all of the COMPRESSION controls; entities without it are treated as uncompressed with one value per word.
 */
public class SchemaResolver {
    private static final Logger logger = LogManager.getLogger(SchemaResolver.class.getName());

    private final WinBufProperties properties;

    public SchemaResolver(WinBufProperties properties) {
        this.properties = properties;
    }

    public BufferSessionConfig resolve(RemoteDevice device, String entityName) throws ConfigException, RemoteCallException {
        if (StringUtils.isBlank(entityName)) {
            throw new BindingException("Buffer entity name must be a non-empty string");
        }

        DeviceMode mode = device.getMode();
        if (!mode.isActive()) {
            throw new BindingException("Device must be in run-time mode to bind " + entityName + ", it is in " + mode);
        }

        List<String> entityNames = device.getEntityNames();
        if (!entityNames.contains(entityName)) {
            throw new BindingException("Cannot find buffer entity called " + entityName + " among " + entityNames);
        }

        String parentName = device.getEntityParent(entityName);
        Map<RequiredControl, ParameterInfo> infos = fetchSchema(device, entityName);
        boolean supportsCompression = infos.keySet().containsAll(RequiredControl.inGroup(RequiredControl.Group.COMPRESSION));

        EnumMap<RequiredControl, Double> values = new EnumMap<RequiredControl, Double>(RequiredControl.class);
        for (RequiredControl control : infos.keySet()) {
            if (control.isArray()) {
                continue;
            }
            values.put(control, device.getParameterValue(entityName, control.getDeviceName()));
        }

        Map<String, Double> rates = device.getSamplingRates();
        Double parentRate = rates.get(parentName);
        if (parentRate == null || !(parentRate > 0) || Double.isInfinite(parentRate)) {
            throw new SchemaException("No valid sampling rate for parent device " + parentName + " of " + entityName);
        }

        ParameterInfo secondsInfo = infos.get(RequiredControl.SECONDS);
        long secondsPerMinute = Math.round(secondsInfo.getMax());
        if (secondsPerMinute < 1) {
            throw new SchemaException("Seconds buffer of " + entityName + " declares a maximum of " + secondsInfo.getMax());
        }

        checkPositiveInteger(entityName, RequiredControl.CHAN_PER_SAMP, values);
        checkPositiveInteger(entityName, RequiredControl.DOWN_SAMP, values);

        int wordBits = properties.getWordBits();
        NativeWordType nativeType = NativeWordType.fromSampleInfo(infos.get(RequiredControl.SAMPLES));
        CompressionDomain domain = CompressionDomain.NONE;
        int bitsPerValue = wordBits;
        double scaleFactor = 1.0;
        if (supportsCompression) {
            domain = CompressionDomain.fromCode(entityName, values.get(RequiredControl.COMP_DOMAIN));
            double bits = values.get(RequiredControl.BITS_PER_VAL);
            if (bits != Math.rint(bits) || bits < 1 || bits > wordBits || wordBits % (int) bits != 0) {
                throw new SchemaException("BitsPerVal of " + entityName + " must divide the " + wordBits + " bit word, got " + bits);
            }
            bitsPerValue = (int) bits;
            scaleFactor = values.get(RequiredControl.SCALE_FACTOR);
            if (scaleFactor == 0.0 || !Double.isFinite(scaleFactor)) {
                throw new SchemaException("ScaleFactor of " + entityName + " must be finite and non-zero, got " + scaleFactor);
            }
            if (domain != CompressionDomain.NONE && !nativeType.isInteger()) {
                throw new SchemaException("Compressed buffer " + entityName + " must store integer words");
            }
            if (domain == CompressionDomain.TIME) {
                checkPositiveInteger(entityName, RequiredControl.BUFF_SIZE_MC, values);
            }
        }

        BufferSessionConfig config = new BufferSessionConfig(entityName, parentName, parentRate, secondsPerMinute, wordBits,
                infos, values, supportsCompression, domain, bitsPerValue, scaleFactor, nativeType);
        logger.info("Bound buffer entity " + entityName + " on " + parentName + " with " + config.getMaxChannels()
                + " channels, compression " + domain.getLabel() + " x" + config.getCompressionFactor()
                + ", buffering at " + config.getBufferingRate() + "Hz");
        return config;
    }

    /**
     * Fetch metadata for all the parameters of the entity and check them against the schema.
     * Parameters that are not part of the schema are ignored.
     */
    private Map<RequiredControl, ParameterInfo> fetchSchema(RemoteDevice device, String entityName) throws SchemaException, RemoteCallException {
        HashMap<String, ParameterInfo> byName = new HashMap<String, ParameterInfo>();
        for (String parameterName : device.getParameterNames(entityName)) {
            if (RequiredControl.fromDeviceName(parameterName) == null) {
                logger.debug("Ignoring parameter " + parameterName + " of " + entityName);
                continue;
            }
            byName.put(parameterName, device.getParameterInfo(entityName, parameterName));
        }

        List<String> missing = new LinkedList<String>();
        for (RequiredControl control : RequiredControl.inGroup(RequiredControl.Group.BASE)) {
            if (!byName.containsKey(control.getDeviceName())) {
                missing.add(control.getDeviceName());
            }
        }
        if (!missing.isEmpty()) {
            throw SchemaException.missingControls(entityName, missing);
        }

        Set<RequiredControl> compressionControls = RequiredControl.inGroup(RequiredControl.Group.COMPRESSION);
        List<String> compressionMissing = new LinkedList<String>();
        for (RequiredControl control : compressionControls) {
            if (!byName.containsKey(control.getDeviceName())) {
                compressionMissing.add(control.getDeviceName());
            }
        }
        if (!compressionMissing.isEmpty() && compressionMissing.size() < compressionControls.size()) {
            throw SchemaException.missingControls(entityName, compressionMissing);
        }

        EnumMap<RequiredControl, ParameterInfo> infos = new EnumMap<RequiredControl, ParameterInfo>(RequiredControl.class);
        for (Map.Entry<String, ParameterInfo> entry : byName.entrySet()) {
            RequiredControl control = RequiredControl.fromDeviceName(entry.getKey());
            ParameterInfo info = entry.getValue();
            if (control.isArray() != info.isArray()) {
                throw new SchemaException("Control " + entry.getKey() + " of " + entityName
                        + (control.isArray() ? " must be an array" : " must be a scalar"));
            }
            infos.put(control, info);
        }
        return infos;
    }

    private static void checkPositiveInteger(String entityName, RequiredControl control, Map<RequiredControl, Double> values) throws SchemaException {
        double value = values.get(control);
        if (value < 1 || value != Math.rint(value)) {
            throw new SchemaException(control.getDeviceName() + " of " + entityName + " must be a positive integer, got " + value);
        }
    }
}
