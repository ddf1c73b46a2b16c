package sce.hir;

import java.io.PrintWriter;

/**
* Represents a statement that holds a declaration, for example
* <b>int sum = 0;</b> inside a block.
*/
public class DeclarationStatement extends Statement {

    public DeclarationStatement(Declaration decl) {
        super(1);
        addChild(decl);
    }

    public Declaration getDeclaration() {
        return (Declaration)children.get(0);
    }

    public void print(PrintWriter o) {
        getDeclaration().print(o);
        o.print(";");
    }
}
