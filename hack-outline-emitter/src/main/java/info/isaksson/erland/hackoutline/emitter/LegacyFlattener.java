package info.isaksson.erland.hackoutline.emitter;

import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.model.Modifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens an outline into the legacy list of functions, classes and methods.
 *
 * <p>Entries come out in pre-order: a class-like precedes its methods, and siblings keep their
 * declaration order. Method names are qualified as {@code Class::method}. Properties, constants
 * and type constants are not listed.</p>
 */
public final class LegacyFlattener {

    static final String FUNCTION = "function";
    static final String CLASS = "class";
    static final String METHOD = "method";
    static final String STATIC_METHOD = "static method";

    private LegacyFlattener() {}

    public static List<LegacyEntry> flatten(List<Def> outline) {
        List<LegacyEntry> out = new ArrayList<>();
        if (outline == null) return out;
        for (Def def : outline) {
            flatten("", def, out);
        }
        return out;
    }

    private static void flatten(String prefix, Def def, List<LegacyEntry> out) {
        switch (def.kind) {
            case FUNCTION -> out.add(new LegacyEntry(def.pos, def.name, FUNCTION));
            case CLASS, ENUM, INTERFACE, TRAIT -> {
                out.add(new LegacyEntry(def.pos, def.name, CLASS));
                String memberPrefix = prefix + def.name + "::";
                for (Def child : def.children) {
                    flatten(memberPrefix, child, out);
                }
            }
            case METHOD -> out.add(new LegacyEntry(
                    def.pos,
                    prefix + def.name,
                    def.hasModifier(Modifier.STATIC) ? STATIC_METHOD : METHOD));
            case PROPERTY, CONST, TYPECONST -> {
                // not listed
            }
        }
    }
}
