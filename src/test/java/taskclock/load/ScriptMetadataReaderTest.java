package taskclock.load;

import org.junit.jupiter.api.Test;
import taskclock.model.ValidationException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScriptMetadataReaderTest {

    @Test
    void readsHashBlock() {
        String script = """
                #!/usr/bin/env python3
                # /// task
                # cron = "0 2 * * *"
                #
                # [env]
                # A = "1"
                # ///
                print("hi")
                """;

        Optional<String> block = ScriptMetadataReader.read("task", script);

        assertEquals(Optional.of("cron = \"0 2 * * *\"\n\n[env]\nA = \"1\"\n"), block);
    }

    @Test
    void readsSlashBlock() {
        String script = """
                // /// task
                // cron = "*/5 * * * *"
                // ///
                class Job {}
                """;

        assertEquals(Optional.of("cron = \"*/5 * * * *\"\n"), ScriptMetadataReader.read("task", script));
    }

    @Test
    void ignoresOtherBlockTypes() {
        String script = """
                # /// script
                # dependencies = []
                # ///
                """;

        assertTrue(ScriptMetadataReader.read("task", script).isEmpty());
        assertTrue(ScriptMetadataReader.read("script", script).isPresent());
    }

    @Test
    void rejectsDuplicateBlocks() {
        String script = """
                # /// task
                # cron = "0 1 * * *"
                # ///
                x = 1
                # /// task
                # cron = "0 2 * * *"
                # ///
                """;

        assertThrows(ValidationException.class, () -> ScriptMetadataReader.read("task", script));
    }

    @Test
    void acceptsWindowsLineEndings() {
        String script = "# /// task\r\n# cron = \"0 2 * * *\"\r\n# ///\r\n";

        assertEquals(Optional.of("cron = \"0 2 * * *\"\n"), ScriptMetadataReader.read("task", script));
    }
}
