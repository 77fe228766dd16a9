package com.libragraph.peprobe.characterize.entropy;

import com.libragraph.peprobe.util.buffer.ByteView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class EntropyMeterTest {
    private EntropyMeter meter;

    @BeforeEach
    void setUp() {
        meter = new EntropyMeter();
    }

    @Test
    void shouldReturnZeroForEmptyInput() {
        assertThat(meter.entropy(new byte[0])).isEqualTo(0.0);
        assertThat(meter.entropy(ByteView.empty())).isEqualTo(0.0);
    }

    @Test
    void shouldReturnZeroForSingleRepeatedValue() {
        for (int n : new int[]{1, 2, 17, 4096}) {
            byte[] data = new byte[n];
            Arrays.fill(data, (byte) 0x41);
            assertThat(meter.entropy(data)).as("n=%d", n).isEqualTo(0.0);
        }
    }

    @Test
    void shouldReturnEightForEachByteValueOnce() {
        byte[] data = new byte[256];
        for (int i = 0; i < 256; i++) {
            data[i] = (byte) i;
        }

        assertThat(meter.entropy(data)).isEqualTo(8.0);
    }

    @Test
    void shouldReturnOneBitForTwoEquallyLikelyValues() {
        byte[] data = "ABABABAB".getBytes();

        assertThat(meter.entropy(data)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void shouldStayWithinBoundsForArbitraryInput() {
        Random random = new Random(7);
        for (int n = 1; n <= 2048; n *= 3) {
            byte[] data = new byte[n];
            random.nextBytes(data);
            assertThat(meter.entropy(data)).isBetween(0.0, 8.0);
        }

        byte[] uniform = new byte[256 * 64];
        for (int i = 0; i < uniform.length; i++) {
            uniform[i] = (byte) i;
        }
        assertThat(meter.entropy(uniform)).isBetween(0.0, 8.0).isCloseTo(8.0, within(1e-9));
    }

    @Test
    void shouldMeasureOnlyTheSlicedRange() {
        byte[] data = new byte[512];
        for (int i = 256; i < 512; i++) {
            data[i] = (byte) i;
        }
        ByteView view = ByteView.wrap(data);

        assertThat(meter.entropy(view.slice(0, 256))).isEqualTo(0.0);
        assertThat(meter.entropy(view.slice(256, 256))).isEqualTo(8.0);
    }

    @Test
    void shouldMeasureDirectBuffers() {
        ByteBuffer direct = ByteBuffer.allocateDirect(256);
        for (int i = 0; i < 256; i++) {
            direct.put((byte) i);
        }
        direct.flip();

        assertThat(meter.entropy(ByteView.wrap(direct))).isCloseTo(8.0, within(1e-12));
    }

    @Test
    void shouldFlagHighEntropyRanges() {
        byte[] random = new byte[4096];
        new Random(1).nextBytes(random);
        byte[] text = "The quick brown fox jumps over the lazy dog. ".repeat(50).getBytes();

        assertThat(meter.isHighEntropy(ByteView.wrap(random), 7.0)).isTrue();
        assertThat(meter.isHighEntropy(ByteView.wrap(text), 7.0)).isFalse();
    }
}
