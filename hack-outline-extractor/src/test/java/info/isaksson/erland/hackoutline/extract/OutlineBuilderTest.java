package info.isaksson.erland.hackoutline.extract;

import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.model.DefKind;
import info.isaksson.erland.hackoutline.model.Modifier;
import info.isaksson.erland.hackoutline.pos.AbsolutePos;
import info.isaksson.erland.hackoutline.pos.RelativePath;
import info.isaksson.erland.hackoutline.testutil.HackSamples;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class OutlineBuilderTest {

    private final OutlineExtractor extractor = new OutlineExtractor();

    private static List<String> names(List<Def> defs) {
        return defs.stream().map(d -> d.name).collect(Collectors.toList());
    }

    private static Def child(Def parent, String name) {
        return parent.children.stream()
                .filter(d -> d.name.equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no child " + name + " in " + parent));
    }

    @Test
    void traitMethodKeepsKeywordOrder() {
        List<Def> out = extractor.extract("trait MyTrait { protected static function foo(): int { return 4; } }");
        assertEquals(1, out.size());
        Def trait = out.get(0);
        assertEquals(DefKind.TRAIT, trait.kind);
        assertEquals("MyTrait", trait.name);
        assertEquals(1, trait.children.size());
        Def foo = trait.children.get(0);
        assertEquals(DefKind.METHOD, foo.kind);
        assertEquals("foo", foo.name);
        assertEquals(List.of(Modifier.PROTECTED, Modifier.STATIC), foo.modifiers);
    }

    @Test
    void publicMethodInClass() {
        List<Def> out = extractor.extract("class A { public function bar(): int { return 1; } }");
        Def a = out.get(0);
        assertEquals(DefKind.CLASS, a.kind);
        assertEquals("A", a.name);
        assertEquals(List.of(Modifier.PUBLIC), a.children.get(0).modifiers);
        assertEquals("bar", a.children.get(0).name);
    }

    @Test
    void abstractClassStaysAClass() {
        Def a = extractor.extract("abstract class A {}").get(0);
        assertEquals(DefKind.CLASS, a.kind);
        assertEquals(List.of(Modifier.ABSTRACT), a.modifiers);
        assertTrue(a.children.isEmpty());
    }

    @Test
    void asyncFunctionGetsAsyncModifier() {
        List<Def> out = extractor.extract("async function f(): Awaitable<void> {}");
        assertEquals(1, out.size());
        assertEquals(DefKind.FUNCTION, out.get(0).kind);
        assertEquals("f", out.get(0).name);
        assertEquals(List.of(Modifier.ASYNC), out.get(0).modifiers);
    }

    @Test
    void abstractFinalClassListsAbstractFirst() {
        Def d = extractor.extract("abstract final class D {}").get(0);
        assertEquals(List.of(Modifier.ABSTRACT, Modifier.FINAL), d.modifiers);
        assertEquals(List.of(Modifier.FINAL), extractor.extract("final class F {}").get(0).modifiers);
    }

    @Test
    void emptyInputHasEmptyOutline() {
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract("<?hh\n// nothing here\n").isEmpty());
    }

    @Test
    void kitchenSinkTopLevelOrderAndKinds() throws IOException {
        List<Def> out = extractor.extract(RelativePath.named("kitchen_sink.hh"), HackSamples.read("kitchen_sink.hh"));

        assertEquals(List.of("price_of", "load_cart", "skus", "stream_skus", "Priced", "Registry",
                "Status", "Audited", "xhp_ui__price_tag"), names(out));
        assertEquals(List.of(DefKind.FUNCTION, DefKind.FUNCTION, DefKind.FUNCTION, DefKind.FUNCTION,
                        DefKind.INTERFACE, DefKind.CLASS, DefKind.ENUM, DefKind.TRAIT, DefKind.CLASS),
                out.stream().map(d -> d.kind).collect(Collectors.toList()));

        assertEquals(List.of(), out.get(0).modifiers);
        assertEquals(List.of(Modifier.ASYNC), out.get(1).modifiers);
        assertEquals(List.of(), out.get(2).modifiers);        // generator
        assertEquals(List.of(Modifier.ASYNC), out.get(3).modifiers);  // async generator
    }

    @Test
    void kitchenSinkClassMembers() throws IOException {
        List<Def> out = extractor.extract(RelativePath.named("kitchen_sink.hh"), HackSamples.read("kitchen_sink.hh"));
        Def registry = out.get(5);
        assertEquals(List.of(Modifier.ABSTRACT, Modifier.FINAL), registry.modifiers);
        assertEquals(List.of("TKey", "TValue", "CAPACITY", "PREFIX", "SUFFIX", "instance", "a", "b", "legacy",
                "instance", "keyOf", "clear"), names(registry.children));

        Def tKey = registry.children.get(0);
        assertEquals(DefKind.TYPECONST, tKey.kind);
        assertEquals(List.of(Modifier.ABSTRACT), tKey.modifiers);
        assertEquals(List.of(), child(registry, "TValue").modifiers);

        Def capacity = child(registry, "CAPACITY");
        assertEquals(DefKind.CONST, capacity.kind);
        assertEquals(List.of(Modifier.ABSTRACT), capacity.modifiers);
        assertEquals(capacity.pos, capacity.span);

        Def prefix = child(registry, "PREFIX");
        assertEquals(List.of(), prefix.modifiers);
        assertEquals(new AbsolutePos.LineInfo(39, 16, 21), prefix.pos.lineInfo());
        assertEquals(new AbsolutePos.MultilineInfo(39, 16, 39, 29), prefix.span.multilineInfo());

        Def property = registry.children.get(5);
        assertEquals(DefKind.PROPERTY, property.kind);
        assertEquals(List.of(Modifier.PRIVATE, Modifier.STATIC), property.modifiers);
        assertEquals(List.of(Modifier.PROTECTED), registry.children.get(6).modifiers);
        assertEquals(List.of(Modifier.PROTECTED), registry.children.get(7).modifiers);
        assertEquals(List.of(), child(registry, "legacy").modifiers);

        Def method = registry.children.get(9);
        assertEquals(DefKind.METHOD, method.kind);
        assertEquals(List.of(Modifier.PUBLIC, Modifier.STATIC, Modifier.ASYNC), method.modifiers);
        assertEquals(List.of(Modifier.ABSTRACT, Modifier.PROTECTED), child(registry, "keyOf").modifiers);
        assertEquals(List.of(Modifier.FINAL, Modifier.PUBLIC), child(registry, "clear").modifiers);
    }

    @Test
    void omittedMembersDoNotAppear() throws IOException {
        List<Def> out = extractor.extract(HackSamples.read("kitchen_sink.hh"));

        Def audited = out.get(7);
        assertEquals(List.of("audit"), names(audited.children));

        Def tag = out.get(8);
        assertEquals(List.of(Modifier.FINAL), tag.modifiers);
        assertEquals(List.of(":currency", ":amount", "render"), names(tag.children));
        assertEquals(DefKind.PROPERTY, tag.children.get(0).kind);
        assertEquals(List.of(), tag.children.get(0).modifiers);

        Def status = out.get(6);
        assertEquals(List.of("ACTIVE", "CLOSED"), names(status.children));
        assertTrue(status.children.stream().allMatch(d -> d.kind == DefKind.CONST));

        Def priced = out.get(4);
        assertEquals(List.of("TPrice", "price"), names(priced.children));
    }

    @Test
    void positionsUseFileNameAndLieWithinSpans() throws IOException {
        List<Def> out = extractor.extract(RelativePath.named("kitchen_sink.hh"), HackSamples.read("kitchen_sink.hh"));

        Def priceOf = out.get(0);
        assertEquals("File \"kitchen_sink.hh\", line 13, characters 10-17:", priceOf.pos.describe());
        assertEquals(13, priceOf.span.multilineInfo().lineStart());
        assertEquals(15, priceOf.span.multilineInfo().lineEnd());

        Def registry = out.get(5);
        assertEquals(new AbsolutePos.LineInfo(35, 22, 29), registry.pos.lineInfo());
        assertEquals(1, registry.span.multilineInfo().charStart());

        assertWithinSpan(out);
    }

    private static void assertWithinSpan(List<Def> defs) {
        for (Def d : defs) {
            assertTrue(d.span.contains(d.pos), d + ": pos outside span");
            assertEquals("kitchen_sink.hh", d.pos.file);
            assertWithinSpan(d.children);
        }
    }

    @Test
    void brokenFileStillYieldsParsedDeclarations() throws IOException {
        List<Def> out = extractor.extract(HackSamples.read("broken.php"));
        assertEquals(List.of("ok_before", "Half", "ok_after"), names(out));
        assertEquals(List.of("fine", "kept"), names(out.get(1).children));
        assertEquals(List.of(Modifier.PRIVATE), out.get(1).children.get(1).modifiers);
    }

    @Test
    void namespacedNamesAreStrippedButMembersAreNot() {
        List<Def> out = extractor.extract("<?hh namespace A\\B; class C { const X = 1; } function g(): void {}");
        assertEquals("g", out.get(1).name);
        assertEquals("C", out.get(0).name);
        assertEquals("X", out.get(0).children.get(0).name);
    }

    @Test
    void typeAliasesGlobalConstantsAndStatementsAreSkipped() {
        List<Def> out = extractor.extract("<?hh type T = int; const int X = 1; echo 1; function f(): void {}");
        assertEquals(List.of("f"), names(out));
    }
}
