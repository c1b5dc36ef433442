package info.isaksson.erland.hackoutline.core;

/**
 * Options for rendering an outline.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class OutlineOptions {
    public OutlineMode mode = OutlineMode.JSON;

    /** Indent JSON output. Ignored in debug mode. */
    public boolean pretty = false;

    /** File name reported in positions when rendering a single buffer. Empty for stdin/editor content. */
    public String fileName = "";
}
