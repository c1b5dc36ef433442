package info.isaksson.erland.hackoutline.ast;

/**
 * A member of a class body.
 *
 * <p>Consumers implement {@link Visitor}, so every member shape has to be handled explicitly,
 * including the ones a consumer chooses to ignore.</p>
 */
public interface ClassElement {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitMethod(Method method);

        R visitClassVars(ClassVars vars);

        R visitXhpAttr(XhpAttr attr);

        R visitConst(ClassConst constants);

        R visitAbsConst(AbsConst constant);

        R visitTypeConst(TypeConst typeConst);

        R visitTraitUse(TraitUse use);

        R visitClassRequire(ClassRequire require);

        R visitXhpCategory(XhpCategory category);

        R visitXhpChildren(XhpChildren children);
    }
}
