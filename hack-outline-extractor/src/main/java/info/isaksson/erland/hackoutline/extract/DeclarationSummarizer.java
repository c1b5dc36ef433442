package info.isaksson.erland.hackoutline.extract;

import info.isaksson.erland.hackoutline.ast.AbsConst;
import info.isaksson.erland.hackoutline.ast.ClassConst;
import info.isaksson.erland.hackoutline.ast.ClassDef;
import info.isaksson.erland.hackoutline.ast.ClassElement;
import info.isaksson.erland.hackoutline.ast.ClassKind;
import info.isaksson.erland.hackoutline.ast.ClassRequire;
import info.isaksson.erland.hackoutline.ast.ClassVar;
import info.isaksson.erland.hackoutline.ast.ClassVars;
import info.isaksson.erland.hackoutline.ast.FunDef;
import info.isaksson.erland.hackoutline.ast.Kind;
import info.isaksson.erland.hackoutline.ast.Method;
import info.isaksson.erland.hackoutline.ast.TraitUse;
import info.isaksson.erland.hackoutline.ast.TypeConst;
import info.isaksson.erland.hackoutline.ast.XhpAttr;
import info.isaksson.erland.hackoutline.ast.XhpCategory;
import info.isaksson.erland.hackoutline.ast.XhpChildren;
import info.isaksson.erland.hackoutline.model.Def;
import info.isaksson.erland.hackoutline.model.DefKind;
import info.isaksson.erland.hackoutline.model.Modifier;
import info.isaksson.erland.hackoutline.pos.AbsolutePos;
import info.isaksson.erland.hackoutline.pos.Pos;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one function or class declaration into an outline {@link Def}.
 *
 * <p>Class members map to zero or more children each: property groups and constant groups expand
 * to one entry per variable/constant, while trait uses, {@code require} clauses and XHP
 * category/children declarations produce nothing.</p>
 */
public final class DeclarationSummarizer {

    private static final MemberSummarizer MEMBERS = new MemberSummarizer();

    private DeclarationSummarizer() {}

    public static Def summarizeFun(FunDef fun) {
        List<Modifier> modifiers = ModifierNormalizer.forFunction(List.of(), fun.funKind);
        return Def.leaf(
                DefKind.FUNCTION,
                NameUtil.stripNamespace(fun.name.name),
                fun.name.pos.toAbsolute(),
                fun.span.toAbsolute(),
                modifiers);
    }

    public static Def summarizeClass(ClassDef cls) {
        List<Modifier> modifiers = new ArrayList<>();
        if (cls.isFinal) modifiers.add(Modifier.FINAL);
        // An abstract final class reads [abstract, final].
        if (cls.classKind == ClassKind.ABSTRACT) modifiers.add(0, Modifier.ABSTRACT);

        List<Def> children = new ArrayList<>();
        for (ClassElement element : cls.body) {
            children.addAll(element.accept(MEMBERS));
        }

        return new Def(
                kindOf(cls),
                NameUtil.stripNamespace(cls.name.name),
                cls.name.pos.toAbsolute(),
                cls.span.toAbsolute(),
                modifiers,
                children);
    }

    static DefKind kindOf(ClassDef cls) {
        return switch (cls.classKind) {
            case INTERFACE -> DefKind.INTERFACE;
            case TRAIT -> DefKind.TRAIT;
            case ENUM -> DefKind.ENUM;
            case NORMAL, ABSTRACT -> DefKind.CLASS;
        };
    }

    static Def summarizeProperty(List<Kind> kinds, ClassVar var) {
        return Def.leaf(
                DefKind.PROPERTY,
                var.name.name,
                var.name.pos.toAbsolute(),
                var.span.toAbsolute(),
                ModifierNormalizer.normalize(kinds));
    }

    static Def summarizeConst(ClassConst.Entry entry) {
        AbsolutePos span = Pos.btw(entry.name.pos, entry.value.pos).toAbsolute();
        return Def.leaf(DefKind.CONST, entry.name.name, entry.name.pos.toAbsolute(), span, List.of());
    }

    static Def summarizeAbsConst(AbsConst constant) {
        AbsolutePos pos = constant.name.pos.toAbsolute();
        return Def.leaf(DefKind.CONST, constant.name.name, pos, pos, List.of(Modifier.ABSTRACT));
    }

    static Def summarizeTypeConst(TypeConst typeConst) {
        return Def.leaf(
                DefKind.TYPECONST,
                typeConst.name.name,
                typeConst.name.pos.toAbsolute(),
                typeConst.span.toAbsolute(),
                typeConst.isAbstract ? List.of(Modifier.ABSTRACT) : List.of());
    }

    static Def summarizeMethod(Method method) {
        return Def.leaf(
                DefKind.METHOD,
                method.name.name,
                method.name.pos.toAbsolute(),
                method.span.toAbsolute(),
                ModifierNormalizer.forFunction(method.kinds, method.funKind));
    }

    /** Supported members map to entries; the rest are omitted on purpose. */
    private static final class MemberSummarizer implements ClassElement.Visitor<List<Def>> {

        @Override public List<Def> visitMethod(Method method) {
            return List.of(summarizeMethod(method));
        }

        @Override public List<Def> visitClassVars(ClassVars vars) {
            List<Def> out = new ArrayList<>(vars.vars.size());
            for (ClassVar v : vars.vars) {
                out.add(summarizeProperty(vars.kinds, v));
            }
            return out;
        }

        @Override public List<Def> visitXhpAttr(XhpAttr attr) {
            return List.of(summarizeProperty(List.of(), attr.var));
        }

        @Override public List<Def> visitConst(ClassConst constants) {
            List<Def> out = new ArrayList<>(constants.entries.size());
            for (ClassConst.Entry e : constants.entries) {
                out.add(summarizeConst(e));
            }
            return out;
        }

        @Override public List<Def> visitAbsConst(AbsConst constant) {
            return List.of(summarizeAbsConst(constant));
        }

        @Override public List<Def> visitTypeConst(TypeConst typeConst) {
            return List.of(summarizeTypeConst(typeConst));
        }

        // Omitted from outlines.

        @Override public List<Def> visitTraitUse(TraitUse use) {
            return List.of();
        }

        @Override public List<Def> visitClassRequire(ClassRequire require) {
            return List.of();
        }

        @Override public List<Def> visitXhpCategory(XhpCategory category) {
            return List.of();
        }

        @Override public List<Def> visitXhpChildren(XhpChildren children) {
            return List.of();
        }
    }
}
