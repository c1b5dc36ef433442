package info.isaksson.erland.hackoutline.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class HackSamples {
    private HackSamples() {}

    /** Reads {@code samples/hack/<name>}, searching upwards from the working directory. */
    public static String read(String name) throws IOException {
        Path p = Path.of("").toAbsolutePath();
        while (p != null && !Files.isDirectory(p.resolve("samples/hack"))) {
            p = p.getParent();
        }
        if (p == null) throw new IOException("samples/hack not found");
        return Files.readString(p.resolve("samples/hack").resolve(name), StandardCharsets.UTF_8);
    }
}
