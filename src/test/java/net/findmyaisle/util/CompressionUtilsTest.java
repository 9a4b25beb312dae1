package net.findmyaisle.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompressionUtilsTest {

    @Test
    void gzipUtf8_producesPayloadReadableByDecoder() throws IOException {
        byte[] gzipped = CompressionUtils.gzipUtf8("{\"query\":\"oat milk\"}");
        assertThat(gzipped[0]).isEqualTo((byte) 0x1f);
        assertThat(CompressionUtils.decodeUtf8ExpectingGzip(gzipped)).isEqualTo("{\"query\":\"oat milk\"}");
    }

    @Test
    void gzipUtf8_returnsEmptyArrayForNull() throws IOException {
        assertThat(CompressionUtils.gzipUtf8(null)).isEmpty();
        assertThat(CompressionUtils.decodeUtf8ExpectingGzip(new byte[0])).isNull();
    }

    @Test
    void decodeUtf8ExpectingGzip_throwsForPlainBytes() {
        byte[] payload = "not-gzip".getBytes(StandardCharsets.UTF_8);
        assertThatThrownBy(() -> CompressionUtils.decodeUtf8ExpectingGzip(payload))
                .isInstanceOf(IOException.class);
    }
}
