package info.isaksson.erland.hackoutline.extract;

import info.isaksson.erland.hackoutline.ast.FunKind;
import info.isaksson.erland.hackoutline.ast.Kind;
import info.isaksson.erland.hackoutline.model.Modifier;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModifierNormalizerTest {

    @Test
    void mapsEveryKeywordOneToOne() {
        for (Kind k : Kind.values()) {
            assertEquals(k.name(), ModifierNormalizer.of(k).name());
        }
    }

    @Test
    void preservesOrderAndDuplicates() {
        assertEquals(List.of(Modifier.PROTECTED, Modifier.STATIC, Modifier.PROTECTED),
                ModifierNormalizer.normalize(List.of(Kind.PROTECTED, Kind.STATIC, Kind.PROTECTED)));
        assertEquals(List.of(), ModifierNormalizer.normalize(List.of()));
    }

    @Test
    void asyncComesOnlyFromFunctionKindAndGoesLast() {
        assertEquals(List.of(Modifier.PUBLIC, Modifier.STATIC, Modifier.ASYNC),
                ModifierNormalizer.forFunction(List.of(Kind.PUBLIC, Kind.STATIC), FunKind.ASYNC));
        assertEquals(List.of(Modifier.ASYNC),
                ModifierNormalizer.forFunction(List.of(), FunKind.ASYNC_GENERATOR));
        assertEquals(List.of(Modifier.PRIVATE),
                ModifierNormalizer.forFunction(List.of(Kind.PRIVATE), FunKind.GENERATOR));
        assertEquals(List.of(), ModifierNormalizer.forFunction(List.of(), FunKind.SYNC));
    }

    @Test
    void nullKeywordIsRejected() {
        assertThrows(NullPointerException.class, () -> ModifierNormalizer.of(null));
        assertThrows(NullPointerException.class, () -> ModifierNormalizer.normalize(Arrays.asList(Kind.FINAL, null)));
    }
}
