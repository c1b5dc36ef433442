package info.isaksson.erland.hackoutline.ast;

import info.isaksson.erland.hackoutline.pos.Pos;

/** A top-level definition. */
public interface Definition {

    Pos span();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitFun(FunDef fun);

        R visitClass(ClassDef cls);

        R visitTypedef(Typedef typedef);

        R visitGlobalConst(GlobalConst constant);

        R visitStmt(Stmt stmt);
    }
}
