/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.data;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.winbuf.config.BufferSessionConfig;
import org.winbuf.config.CompressionDomain;
import org.winbuf.config.NativeWordType;

/**
 * Turns the raw contents of a sample buffer into a samples x channels matrix.
 * <p>
 * The steps are
 * <ol>
 * <li>Cast the values the device returns as doubles back into the native word type of the buffer.</li>
 * <li>If values were compressed, break every word into consecutive sub-words of BitsPerVal bits, lowest bits first, keeping the signedness of the word.</li>
 * <li>Re-order into samples x channels. With compression across channels, every stored sample carries ChanPerSamp x factor channels.
 * With compression across time, every word holds factor consecutive samples of one channel; words are ordered by channel within each stored sample.</li>
 * <li>Drop the channels above the channel sub-selection.</li>
 * <li>Remove the scale factor, if any.</li>
 * </ol>
 */
public class SampleDecompressor {
    private static final Logger logger = LogManager.getLogger(SampleDecompressor.class.getName());

    private final BufferSessionConfig config;

    public SampleDecompressor(BufferSessionConfig config) {
        this.config = config;
    }

    /**
     * @param raw The chronologically ordered content of the sample buffer
     * @return Matrix indexed as [sample][channel]
     */
    public double[][] decompress(double[] raw) {
        CompressionDomain domain = config.getCompressionDomain();
        int chanPerSample = config.getChanPerSample();
        int factor = config.getCompressionFactor();
        NativeWordType nativeType = config.getNativeType();

        double[] stream;
        long[] words = null;
        if (nativeType.isInteger()) {
            words = castToWords(raw, nativeType, config.getWordBits());
            long[] values = (domain == CompressionDomain.NONE)
                    ? words
                    : unpack(words, config.getWordBits(), config.getBitsPerValue(), nativeType.isSigned());
            stream = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                stream[i] = values[i];
            }
        } else {
            stream = raw.clone();
        }

        int valuesPerStoredSample = chanPerSample * factor;
        if (stream.length % valuesPerStoredSample != 0) {
            throw new AlignmentException("Sample buffer of " + config.getEntityName() + " holds " + stream.length
                    + " values, not a multiple of " + valuesPerStoredSample, words);
        }
        int storedSamples = stream.length / valuesPerStoredSample;

        double[][] samples;
        switch (domain) {
            case TIME:
                samples = reorderTimeDomain(stream, chanPerSample, factor, storedSamples, config.getChannelSubselection());
                break;
            case CHANNELS:
            case NONE:
                samples = reorderChannelMajor(stream, valuesPerStoredSample, storedSamples, config.getChannelSubselection());
                break;
            default:
                throw new IllegalStateException("Programming error, invalid compression type: " + domain);
        }

        double scaleFactor = config.getScaleFactor();
        if (scaleFactor != 1.0) {
            for (double[] sample : samples) {
                for (int c = 0; c < sample.length; c++) {
                    sample[c] = sample[c] / scaleFactor;
                }
            }
        }

        logger.debug("Decompressed " + raw.length + " buffered values of " + config.getEntityName() + " into "
                + samples.length + " samples x " + config.getChannelSubselection() + " channels");
        return samples;
    }

    public static long[] castToWords(double[] raw, NativeWordType nativeType, int wordBits) {
        long[] words = new long[raw.length];
        for (int i = 0; i < raw.length; i++) {
            words[i] = nativeType.castToWord(raw[i], wordBits);
        }
        return words;
    }

    /**
     * Break each word into wordBits / bitsPerValue sub-words, lowest bits first.
     * @param words  &emsp;
     * @param wordBits  &emsp;
     * @param bitsPerValue  &emsp;
     * @param signed Sign extend each sub-word
     * @return The sub-words, in order
     */
    public static long[] unpack(long[] words, int wordBits, int bitsPerValue, boolean signed) {
        int factor = wordBits / bitsPerValue;
        long wordMask = (wordBits == 64) ? -1L : (1L << wordBits) - 1;
        long valueMask = (1L << bitsPerValue) - 1;
        int shiftBack = Long.SIZE - bitsPerValue;
        long[] values = new long[words.length * factor];
        int pos = 0;
        for (long word : words) {
            long bits = word & wordMask;
            for (int k = 0; k < factor; k++) {
                long value = (bits >>> (k * bitsPerValue)) & valueMask;
                if (signed) {
                    value = (value << shiftBack) >> shiftBack;
                }
                values[pos++] = value;
            }
        }
        return values;
    }

    /**
     * The stream is [channels, samples] with channels varying fastest.
     */
    private static double[][] reorderChannelMajor(double[] stream, int channels, int samples, int keep) {
        double[][] ret = new double[samples][keep];
        for (int s = 0; s < samples; s++) {
            System.arraycopy(stream, s * channels, ret[s], 0, keep);
        }
        return ret;
    }

    /**
     * The stream is [factor, chanPerSample, stored samples] with the compressed time slots varying fastest.
     * Sample s*factor + k of channel c comes from slot k of the word for channel c in stored sample s.
     */
    private static double[][] reorderTimeDomain(double[] stream, int chanPerSample, int factor, int storedSamples, int keep) {
        double[][] ret = new double[storedSamples * factor][keep];
        for (int s = 0; s < storedSamples; s++) {
            for (int c = 0; c < keep; c++) {
                int wordStart = factor * (c + chanPerSample * s);
                for (int k = 0; k < factor; k++) {
                    ret[s * factor + k][c] = stream[wordStart + k];
                }
            }
        }
        return ret;
    }
}
