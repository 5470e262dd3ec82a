/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.winbuf.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.winbuf.FakeRemoteDevice;
import org.winbuf.ParameterType;
import org.winbuf.RemoteCallException;
import org.winbuf.common.TimeWindow;
import org.winbuf.config.BufferSessionConfig;
import org.winbuf.config.WinBufProperties;
import org.winbuf.config.exception.RangeException;
import org.winbuf.config.exception.ValidationException;
import org.winbuf.data.SampleBlock;
import org.winbuf.data.WordPacker;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;

/**
 * Test a bound session against a simulated buffer entity, from the setters through to decoded samples.
 */
public class WindowedBufferSessionTest {
    private static final Logger logger = LogManager.getLogger(WindowedBufferSessionTest.class.getName());
    private static final double RATE = 1000.0;

    private FakeRemoteDevice device;

    @BeforeEach
    public void setUp() {
        // 2 channels, 10 samples, no down sampling
        device = new FakeRemoteDevice("Buf1", 2, 10, 1, RATE, 1000);
    }

    private WindowedBufferSession bind() throws Exception {
        return new WindowedBufferSession(device, "Buf1", WinBufProperties.defaults());
    }

    private void pushRamp(long firstIndex, int count) {
        for (int i = 0; i < count; i++) {
            long index = firstIndex + i;
            device.push(index, index, -index);
        }
    }

    @Test
    public void testNothingBuffered() throws Exception {
        WindowedBufferSession session = bind();
        Assertions.assertNull(session.getLastBlock());
        SampleBlock block = session.getData();
        Assertions.assertTrue(block.isEmpty());
        Assertions.assertEquals(2, block.getChannelCount());
        Assertions.assertSame(block, session.getLastBlock());
    }

    @Test
    public void testNotYetLooped() throws Exception {
        WindowedBufferSession session = bind();
        pushRamp(100, 4);
        device.trigger(103);
        SampleBlock block = session.getData();
        Assertions.assertArrayEquals(new double[] {-0.003, -0.002, -0.001, 0.0}, block.getTimes(), 1e-12);
        Assertions.assertArrayEquals(new double[] {100, 101, 102, 103}, block.getChannel(0));
        Assertions.assertArrayEquals(new double[] {-100, -101, -102, -103}, block.getChannel(1));
        block.getTimes()[3] = 1.0;
        block.getValues()[3][0] = 0;
        Assertions.assertEquals(0.0, session.getLastBlock().getTimes()[3], 1e-12);
        Assertions.assertEquals(103, session.getLastBlock().get(3).getValue(0));
    }

    @Test
    public void testLoopedBufferIsChronological() throws Exception {
        WindowedBufferSession session = bind();
        pushRamp(995, 13);
        device.trigger(1005);
        SampleBlock block = session.getData();
        logger.info("Read " + Arrays.toString(block.getTimes()));
        Assertions.assertEquals(10, block.size());
        double[] expectedTimes = new double[10];
        double[] expectedValues = new double[10];
        for (int i = 0; i < 10; i++) {
            expectedValues[i] = 998 + i;
            expectedTimes[i] = (998 + i - 1005) / RATE;
        }
        Assertions.assertArrayEquals(expectedTimes, block.getTimes(), 1e-12);
        Assertions.assertArrayEquals(expectedValues, block.getChannel(0));
    }

    /**
     * Counter equal to the capacity with the write index back at 0 means every element is valid.
     * The whole buffer is read here; a plain [0, index) read would return nothing.
     */
    @Test
    public void testExactlyFull() throws Exception {
        WindowedBufferSession session = bind();
        pushRamp(0, 10);
        Assertions.assertEquals(0.0, device.getScalar("Mindex"));
        device.trigger(9);
        SampleBlock block = session.getData();
        Assertions.assertEquals(10, block.size());
        Assertions.assertEquals(0.0, block.getChannel(0)[0]);
        Assertions.assertEquals(9.0, block.getChannel(0)[9]);
    }

    @Test
    public void testTimeWindowAndSubselection() throws Exception {
        WindowedBufferSession session = bind();
        pushRamp(100, 10);
        device.trigger(105);
        session.setTimeWindow(-0.002, 0.001);
        session.setChannelSubselection(1);
        SampleBlock block = session.getData();
        Assertions.assertEquals(1, block.getChannelCount());
        Assertions.assertArrayEquals(new double[] {103, 104, 105, 106}, block.getChannel(0));

        session.setTimeWindow(Double.NEGATIVE_INFINITY, 0);
        Assertions.assertEquals(6, session.getData().size());
    }

    @Test
    public void testTimeCompressed() throws Exception {
        // 2 x 16 bit values per word, down sampled by 2; each stored sample covers 4 parent clock samples
        device = new FakeRemoteDevice("Buf1", 2, 5, 2, RATE, 1000).withCompression(2, 16, 1.0).withSampleType(ParameterType.INT, 0);
        WindowedBufferSession session = bind();
        Assertions.assertEquals(5, session.getConfig().getCompressedCapacity());
        for (int s = 0; s < 3; s++) {
            double[] words = new double[2];
            for (int c = 0; c < 2; c++) {
                words[c] = WordPacker.pack(new long[] {10 * c + 2 * s, 10 * c + 2 * s + 1}, 32, 16, false)[0];
            }
            device.push(200 + 4 * s, words);
        }
        device.trigger(208);
        SampleBlock block = session.getData();
        Assertions.assertArrayEquals(new double[] {-0.010, -0.008, -0.006, -0.004, -0.002, 0.0}, block.getTimes(), 1e-12);
        Assertions.assertArrayEquals(new double[] {0, 1, 2, 3, 4, 5}, block.getChannel(0));
        Assertions.assertArrayEquals(new double[] {10, 11, 12, 13, 14, 15}, block.getChannel(1));
    }

    @Test
    public void testChannelCompressedWithScaleFactor() throws Exception {
        device = new FakeRemoteDevice("Buf1", 1, 4, 1, RATE, 1000).withCompression(1, 8, 4.0).withSampleType(ParameterType.INT, 0);
        WindowedBufferSession session = bind();
        device.push(50, WordPacker.pack(new long[] {4, 8, 12, 16}, 32, 8, false));
        device.push(51, WordPacker.pack(new long[] {20, 24, 28, 255}, 32, 8, false));
        device.trigger(51);
        SampleBlock block = session.getData();
        Assertions.assertEquals(4, block.getChannelCount());
        Assertions.assertArrayEquals(new double[] {1, 2, 3, 4}, block.get(0).getValues());
        Assertions.assertArrayEquals(new double[] {5, 6, 7, 63.75}, block.get(1).getValues());
    }

    @Test
    public void testSnapshotBeforeReads() throws Exception {
        WindowedBufferSession session = bind();
        pushRamp(100, 12);
        device.clearCalls();
        session.getData();
        List<String> calls = device.getCalls();
        logger.debug("Calls " + calls);
        Assertions.assertEquals(Arrays.asList("get:Mindex", "get:Sindex", "get:MCindex", "get:Counter", "get:EventMin", "get:EventSec"),
                calls.subList(0, 6));
        for (String call : calls.subList(6, calls.size())) {
            Assertions.assertTrue(call.startsWith("getValues:"), "Unexpected call after the snapshot " + call);
        }
        Assertions.assertTrue(calls.contains("getValues:MCsamples[4,20)"));
        Assertions.assertTrue(calls.contains("getValues:MCsamples[0,4)"));
    }

    @Test
    public void testRemoteFailureKeepsLastBlock() throws Exception {
        WindowedBufferSession session = bind();
        pushRamp(100, 3);
        SampleBlock first = session.getData();
        device.failOn("Seconds");
        Assertions.assertThrows(RemoteCallException.class, () -> session.getData());
        Assertions.assertSame(first, session.getLastBlock());
        Assertions.assertThrows(RemoteCallException.class, () -> bind());
    }

    @Test
    public void testBufferSize() throws Exception {
        WindowedBufferSession session = bind();
        Assertions.assertEquals(0.05, session.setBufferSize(0.05), 1e-12);
        Assertions.assertEquals(50.0, device.getScalar("BuffSize"));
        Assertions.assertEquals(50, session.getConfig().getCompressedCapacity());
        Assertions.assertTrue(session.getClampWarnings().isEmpty());

        session.setBufferSize(0.0101);
        Assertions.assertEquals(11.0, device.getScalar("BuffSize"));

        session.setBufferSize(0.1, 500);
        Assertions.assertEquals(50.0, device.getScalar("BuffSize"));
        Assertions.assertEquals(0.1, session.getConfig().getBufferSizeSeconds(), 1e-12);
    }

    @Test
    public void testBufferSizeClamped() throws Exception {
        device.withMax("BuffSize", 40);
        WindowedBufferSession session = bind();
        List<ClampWarning> heard = new LinkedList<ClampWarning>();
        session.addClampWarningListener(heard::add);

        Assertions.assertEquals(0.04, session.setBufferSize(0.05), 1e-12);
        Assertions.assertEquals(1, heard.size());
        ClampWarning warning = heard.get(0);
        logger.info(warning.getMessage());
        Assertions.assertEquals(ClampWarning.Kind.BUFFER_SIZE, warning.getKind());
        Assertions.assertEquals(50.0, warning.getRequested());
        Assertions.assertEquals(40.0, warning.getApplied());
        Assertions.assertEquals(heard, session.getClampWarnings());

        device.forceAppliedValue("BuffSize", 30);
        Assertions.assertEquals(0.03, session.setBufferSize(0.02), 1e-12);
        Assertions.assertEquals(2, heard.size());
        Assertions.assertEquals(30, session.getConfig().getRawCapacity());
    }

    @Test
    public void testResponseWindow() throws Exception {
        WindowedBufferSession session = bind();
        Assertions.assertEquals(0.005, session.setResponseWindow(0.005), 1e-12);
        Assertions.assertEquals(5.0, device.getScalar("RespWin"));
        Assertions.assertTrue(session.getClampWarnings().isEmpty());

        // the buffer holds 10 ms
        session.setResponseWindow(0.02);
        Assertions.assertEquals(1, session.getClampWarnings().size());
        Assertions.assertEquals(ClampWarning.Kind.RESPONSE_WINDOW_EXCEEDS_BUFFER, session.getClampWarnings().get(0).getKind());

        session.setBufferSize(0.05);
        Assertions.assertEquals(1, session.getClampWarnings().size());

        session.setResponseWindow(0);
        Assertions.assertEquals(0.0, device.getScalar("RespWin"));
    }

    @Test
    public void testResponseWindowLimitedByLargestBuffer() throws Exception {
        device.withMax("BuffSize", 40);
        WindowedBufferSession session = bind();
        Assertions.assertEquals(0.04, session.setResponseWindow(1.0), 1e-12);
        List<ClampWarning> warnings = session.getClampWarnings();
        Assertions.assertEquals(2, warnings.size());
        Assertions.assertEquals(ClampWarning.Kind.RESPONSE_WINDOW, warnings.get(0).getKind());
        Assertions.assertEquals(1000.0, warnings.get(0).getRequested());
        Assertions.assertEquals(40.0, warnings.get(0).getApplied());
        Assertions.assertEquals(ClampWarning.Kind.RESPONSE_WINDOW_EXCEEDS_BUFFER, warnings.get(1).getKind());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> warnings.clear());
    }

    @Test
    public void testListenerRemoval() throws Exception {
        device.withMax("BuffSize", 40);
        WindowedBufferSession session = bind();
        List<ClampWarning> heard = new LinkedList<ClampWarning>();
        ClampWarningListener listener = heard::add;
        session.addClampWarningListener(listener);
        session.removeClampWarningListener(listener);
        session.setBufferSize(1.0);
        Assertions.assertTrue(heard.isEmpty());
        Assertions.assertEquals(1, session.getClampWarnings().size());
    }

    @Test
    public void testInvalidArguments() throws Exception {
        WindowedBufferSession session = bind();
        Assertions.assertThrows(ValidationException.class, () -> session.setBufferSize(0));
        Assertions.assertThrows(ValidationException.class, () -> session.setBufferSize(-1));
        Assertions.assertThrows(ValidationException.class, () -> session.setBufferSize(Double.NaN));
        Assertions.assertThrows(ValidationException.class, () -> session.setResponseWindow(-0.1));
        Assertions.assertThrows(ValidationException.class, () -> session.setResponseWindow(Double.POSITIVE_INFINITY));
        Assertions.assertThrows(RangeException.class, () -> session.setBufferSize(1, 2000));
        Assertions.assertThrows(RangeException.class, () -> session.setBufferSize(1, 0));
        Assertions.assertThrows(RangeException.class, () -> session.setResponseWindow(1, -5));
        Assertions.assertThrows(ValidationException.class, () -> session.setTimeWindow(1, 0));
        Assertions.assertThrows(RangeException.class, () -> session.setChannelSubselection(3));
        Assertions.assertEquals(10.0, device.getScalar("BuffSize"));
    }

    @Test
    public void testStartBuffering() throws Exception {
        WindowedBufferSession session = bind();
        device.clearCalls();
        session.startBuffering();
        Assertions.assertEquals(Arrays.asList("set:StartBuff", "set:StartBuff"), device.getCalls());
        Assertions.assertEquals(0.0, device.getScalar("StartBuff"));
    }

    @Test
    public void testDescribe() throws Exception {
        WindowedBufferSession session = new WindowedBufferSession(device, "Buf1");
        JSONObject description = (JSONObject) new JSONParser().parse(session.describe());
        Assertions.assertEquals("Buf1", description.get("name"));
        Assertions.assertEquals(10L, description.get("rawCapacity"));
    }

    @Test
    public void testConfigOnlyChangesThroughTheDevice() throws Exception {
        WindowedBufferSession session = bind();
        pushRamp(100, 5);
        BufferSessionConfig config = session.getConfig();
        String[] deviceSideMutators = new String[] {"updateValue", "recomputeCompressedCapacity", "setBufferSizeSeconds", "setResponseWindowSeconds"};
        for (Method method : BufferSessionConfig.class.getDeclaredMethods()) {
            if (Arrays.asList(deviceSideMutators).contains(method.getName())) {
                Assertions.assertFalse(Modifier.isPublic(method.getModifiers()), method.getName() + " must not be public");
            }
        }

        Assertions.assertThrows(ValidationException.class, () -> config.setTimeWindow(null));
        Assertions.assertEquals(TimeWindow.ALL, config.getTimeWindow());
        Assertions.assertEquals(5, session.getData().size());
        Assertions.assertEquals(10, config.getCompressedCapacity());
        Assertions.assertEquals(10.0, device.getScalar("BuffSize"));
    }
}
