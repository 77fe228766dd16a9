package com.libragraph.peprobe.characterize.fuzzy;

import com.libragraph.peprobe.util.buffer.ByteView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class TlshFuzzyHasherTest {
    private FuzzyFingerprintAdapter adapter;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        adapter = new FuzzyFingerprintAdapter(new TlshFuzzyHasher());
    }

    @Test
    void shouldReportEmptyInputAsUnavailable() {
        FingerprintUnavailableException e = catchThrowableOfType(
                () -> adapter.fingerprint(ByteView.empty()),
                FingerprintUnavailableException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCause()).isInstanceOf(RuntimeException.class);
        assertThat(e.scheme()).isEqualTo(TlshFuzzyHasher.SCHEME);
        assertThat(e.inputSize()).isZero();
    }

    @Test
    void shouldReportTooSmallInputAsUnavailable() {
        assertThatExceptionOfType(FingerprintUnavailableException.class)
                .isThrownBy(() -> adapter.fingerprint(ByteView.wrap(randomBytes(20, 5))));
    }

    @Test
    void shouldReportLowVarianceInputAsUnavailable() {
        byte[] zeros = new byte[4096];
        Arrays.fill(zeros, (byte) 0);

        assertThatExceptionOfType(FingerprintUnavailableException.class)
                .isThrownBy(() -> adapter.fingerprint(ByteView.wrap(zeros)));
    }

    @Test
    void shouldBeDeterministic() {
        byte[] data = randomBytes(4096, 42);

        FuzzyDigest first = adapter.fingerprint(ByteView.wrap(data));
        FuzzyDigest second = adapter.fingerprint(ByteView.wrap(data.clone()));

        assertThat(first.value()).isNotBlank();
        assertThat(first).isEqualTo(second);
        assertThat(first.scheme()).isEqualTo("tlsh");
    }

    @Test
    void shouldMatchAcrossHeapDirectAndMappedBackings() throws Exception {
        byte[] data = randomBytes(20_000, 9);
        Path file = tempDir.resolve("image.bin");
        Files.write(file, data);

        ByteBuffer direct = ByteBuffer.allocateDirect(data.length);
        direct.put(data).flip();

        FuzzyDigest heap = adapter.fingerprint(ByteView.wrap(data));

        assertThat(adapter.fingerprint(ByteView.wrap(direct))).isEqualTo(heap);
        assertThat(adapter.fingerprint(ByteView.map(file))).isEqualTo(heap);
    }

    @Test
    void shouldLeaveTheViewIntactAfterStreaming() {
        byte[] data = randomBytes(20_000, 13);
        ByteView view = ByteView.wrap(data);

        FuzzyDigest first = adapter.fingerprint(view);

        assertThat(view.size()).isEqualTo(20_000);
        assertThat(adapter.fingerprint(view)).isEqualTo(first);
    }

    @Test
    void shouldDistinguishUnrelatedContent() {
        FuzzyDigest a = adapter.fingerprint(ByteView.wrap(randomBytes(4096, 1)));
        FuzzyDigest b = adapter.fingerprint(ByteView.wrap(randomBytes(4096, 2)));

        assertThat(a).isNotEqualTo(b);
    }

    private static byte[] randomBytes(int n, long seed) {
        byte[] data = new byte[n];
        new Random(seed).nextBytes(data);
        return data;
    }
}
