package taskclock.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

class NamespacesTest {

    @Test
    void derivationIsDeterministic() {
        String a = Namespaces.derive("host", "alice", "/srv/timetable.yaml");
        String b = Namespaces.derive("host", "alice", "/srv/timetable.yaml");

        assertEquals(a, b);
        assertTrue(a.matches("[0-9a-f]{32}"));
    }

    @Test
    void derivationIsMd5OfJoinedParts() throws Exception {
        byte[] digest = MessageDigest.getInstance("MD5").digest("h-u-r".getBytes(StandardCharsets.UTF_8));

        assertEquals(HexFormat.of().formatHex(digest), Namespaces.derive("h", "u", "r"));
    }

    @Test
    void anyPartChangesTheResult() {
        String base = Namespaces.derive("host", "alice", "/a.yaml");

        assertNotEquals(base, Namespaces.derive("other", "alice", "/a.yaml"));
        assertNotEquals(base, Namespaces.derive("host", "bob", "/a.yaml"));
        assertNotEquals(base, Namespaces.derive("host", "alice", "/b.yaml"));
    }

    @Test
    void existingFileResolvesToAbsolutePath(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("t.yaml"), "tasks: []");

        assertEquals(file.toAbsolutePath().normalize().toString(), Namespaces.resource(file.toString()));
    }

    @Test
    void otherSourcesAreUsedVerbatim() {
        assertEquals("https://example.org/t.yaml", Namespaces.resource("https://example.org/t.yaml"));
        assertEquals(Namespaces.GLOBAL_RESOURCE, Namespaces.resource(null));
    }

    @Test
    void sourceDrivesNamespace() {
        assertEquals(Namespaces.forSource("https://example.org/a.yaml"),
                Namespaces.forSource("https://example.org/a.yaml"));
        assertNotEquals(Namespaces.forSource("https://example.org/a.yaml"),
                Namespaces.forSource("https://example.org/b.yaml"));
    }
}
