package info.isaksson.erland.hackoutline;

import info.isaksson.erland.hackoutline.core.OutlineMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliArgsTest {

    @Test
    void defaults() {
        Main.CliArgs a = Main.CliArgs.parse(new String[0]);
        assertEquals(OutlineMode.JSON, a.mode);
        assertFalse(a.pretty);
        assertNull(a.path);
        assertTrue(a.excludes.isEmpty());
    }

    @Test
    void parsesAllFlags() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "--mode", "debug", "--pretty", "yes", "--exclude", "gen/**", "--exclude=*.php", "src"
        });
        assertEquals(OutlineMode.DEBUG, a.mode);
        assertTrue(a.pretty);
        assertEquals(List.of("gen/**", "*.php"), a.excludes);
        assertEquals("src", a.path);
    }

    @Test
    void flagValuesIgnoreCaseRegardlessOfDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Main.CliArgs a = Main.CliArgs.parse(new String[] {"--mode", "LEGACY", "--pretty", "TRUE"});
            assertEquals(OutlineMode.LEGACY, a.mode);
            assertTrue(a.pretty);
            assertFalse(Main.CliArgs.parseBoolean("No", "--pretty"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void dashMeansStandardInput() {
        assertEquals("-", Main.CliArgs.parse(new String[] {"-"}).path);
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--mode"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--mode", "xml"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--pretty", "maybe"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--outline"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a.php", "b.php"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--exclude", "--mode"}));
    }

    @Test
    void help() {
        assertTrue(Main.CliArgs.parse(new String[] {"-h"}).help);
        assertTrue(Main.CliArgs.parse(new String[] {"--help"}).help);
    }
}
