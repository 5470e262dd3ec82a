/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winbuf.config.exception.ConfigException;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Properties;

/**
 * Installation specific settings for the buffer client.
 * <p>
 * We look for the properties file using the JVM property WINBUF_PROPERTIES_FILENAME, then the environment variable of the same name.
 * If neither is set, we load winbuf.properties from the classpath.
 * Missing keys take their defaults.
 */
public class WinBufProperties {
    private static final Logger configlogger = LogManager.getLogger("config." + WinBufProperties.class.getName());

    public static final String WINBUF_PROPERTIES_FILENAME = "WINBUF_PROPERTIES_FILENAME";
    public static final String DEFAULT_WINBUF_PROPERTIES_FILENAME = "winbuf.properties";

    /** Bits per word buffered on the device. */
    public static final String WORD_BITS = "org.winbuf.wordBits";
    /** Default confidence level for the Bernoulli confidence interval. */
    public static final String STATS_CONFIDENCE = "org.winbuf.stats.confidence";

    private final int wordBits;
    private final double confidence;

    public WinBufProperties(Properties props) throws ConfigException {
        try {
            this.wordBits = Integer.parseInt(props.getProperty(WORD_BITS, "32").trim());
            this.confidence = Double.parseDouble(props.getProperty(STATS_CONFIDENCE, "0.95").trim());
        } catch (NumberFormatException ex) {
            throw new ConfigException("Invalid number in buffer client properties", ex);
        }

        if (wordBits < 1 || wordBits > 32) {
            throw new ConfigException(WORD_BITS + " must be from range [1,32], got " + wordBits);
        }
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new ConfigException(STATS_CONFIDENCE + " must be from range (0,1), got " + confidence);
        }
    }

    /**
     * @return Properties with every key at its default.
     */
    public static WinBufProperties defaults() {
        try {
            return new WinBufProperties(new Properties());
        } catch (ConfigException ex) {
            throw new IllegalStateException("Defaults are always valid", ex);
        }
    }

    public static WinBufProperties load() throws ConfigException {
        Properties props = new Properties();
        String fileName = System.getProperty(WINBUF_PROPERTIES_FILENAME);
        if (fileName == null) {
            fileName = System.getenv(WINBUF_PROPERTIES_FILENAME);
        }
        if (fileName != null) {
            configlogger.info("Loading " + DEFAULT_WINBUF_PROPERTIES_FILENAME + " using the environment/JVM property from " + fileName);
            try (InputStream is = new FileInputStream(fileName)) {
                props.load(is);
            } catch (Exception ex) {
                throw new ConfigException("Exception loading installation specific properties file " + fileName, ex);
            }
        } else {
            try (InputStream is = WinBufProperties.class.getClassLoader().getResourceAsStream(DEFAULT_WINBUF_PROPERTIES_FILENAME)) {
                if (is == null) {
                    configlogger.info("No " + DEFAULT_WINBUF_PROPERTIES_FILENAME + " on the classpath; using defaults");
                } else {
                    configlogger.info("Loading " + DEFAULT_WINBUF_PROPERTIES_FILENAME + " from the classpath");
                    props.load(is);
                }
            } catch (Exception ex) {
                throw new ConfigException("Exception loading " + DEFAULT_WINBUF_PROPERTIES_FILENAME + " from the classpath", ex);
            }
        }
        return new WinBufProperties(props);
    }

    public int getWordBits() {
        return wordBits;
    }

    public double getConfidence() {
        return confidence;
    }
}
