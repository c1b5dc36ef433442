package info.isaksson.erland.hackoutline.extract;

/** Helpers for namespace-qualified Hack names. */
final class NameUtil {

    private NameUtil() {}

    /** {@code \Foo\Bar\baz} becomes {@code baz}; unqualified names are returned unchanged. */
    static String stripNamespace(String name) {
        if (name == null) return "";
        int idx = name.lastIndexOf('\\');
        return idx < 0 ? name : name.substring(idx + 1);
    }
}
