package io.tryjob4j.client;

import io.tryjob4j.core.SourceStamp;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DeliveryConfigTest {

    @TempDir
    Path dir;

    @Test
    void masterIsSplitIntoHostAndPort() {
        DeliveryConfig config = DeliveryConfig.builder()
                .connectMethod(ConnectMethod.PB)
                .master("build.example.org:8031")
                .username("u").password("p")
                .build();

        assertEquals("build.example.org", config.masterHost());
        assertEquals(8031, config.masterPort());
        assertEquals(DeliveryConfig.DEFAULT_WAIT_CHECK_INTERVAL, config.waitCheckInterval());
    }

    @Test
    void eachMethodRequiresItsEndpoint() {
        assertThrows(TryClientException.class, () -> DeliveryConfig.builder().build());
        assertThrows(TryClientException.class,
                () -> DeliveryConfig.builder().connectMethod(ConnectMethod.PB).username("u").password("p").build());
        assertThrows(TryClientException.class,
                () -> DeliveryConfig.builder().connectMethod(ConnectMethod.PB).master("h:1").build());
        assertThrows(TryClientException.class,
                () -> DeliveryConfig.builder().connectMethod(ConnectMethod.SSH).build());
        assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.builder().master("no-port"));
    }

    @Test
    void connectMethodLabels() {
        assertEquals(ConnectMethod.PB, ConnectMethod.fromLabel("pb"));
        assertEquals("ssh", ConnectMethod.SSH.label());
        assertThrows(IllegalArgumentException.class, () -> ConnectMethod.fromLabel("ftp"));
    }

    @Test
    void diffFileProviderReadsThePatch() throws Exception {
        Path diff = dir.resolve("change.diff");
        Files.writeString(diff, "--- a/f\n+++ b/f\n", StandardCharsets.UTF_8);
        Path empty = dir.resolve("empty.diff");
        Files.writeString(empty, "", StandardCharsets.UTF_8);

        SourceStamp stamp = new DiffFileSourceStampProvider("trunk", "1234", diff, 1).getSourceStamp();
        SourceStamp plain = new DiffFileSourceStampProvider(null, "1234", empty, 0).getSourceStamp();

        assertEquals("trunk", stamp.branch());
        assertEquals("1234", stamp.revision());
        assertEquals(1, stamp.patch().level());
        assertEquals("--- a/f\n+++ b/f\n", stamp.patch().body());
        assertNull(plain.patch());
    }
}
