package sce.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a declaration of one or more variables of the same base type,
* for example <b>int x = 1, *p</b>. The children are the declarators.
*/
public class VariableDeclaration extends Declaration {

    private List<Specifier> specs;

    /**
    * Creates a declaration with a single declarator.
    *
    * @param specs the declaration specifiers.
    * @param decl the declarator.
    */
    public VariableDeclaration(List<Specifier> specs, VariableDeclarator decl) {
        super();
        this.specs = new ArrayList<Specifier>(specs);
        addChild(decl);
    }

    /**
    * Creates a declaration with a list of declarators.
    *
    * @param specs the declaration specifiers.
    * @param decls the declarators.
    */
    public VariableDeclaration(List<Specifier> specs,
                               List<VariableDeclarator> decls) {
        super();
        this.specs = new ArrayList<Specifier>(specs);
        for (VariableDeclarator decl : decls) {
            addChild(decl);
        }
    }

    /** Creates a declaration with a single specifier and declarator. */
    public VariableDeclaration(Specifier spec, VariableDeclarator decl) {
        super();
        this.specs = new ArrayList<Specifier>(1);
        this.specs.add(spec);
        addChild(decl);
    }

    @Override
    public VariableDeclaration clone() {
        VariableDeclaration o = (VariableDeclaration)super.clone();
        o.specs = new ArrayList<Specifier>(specs);
        return o;
    }

    public List<Specifier> getSpecifiers() {
        return specs;
    }

    public VariableDeclarator getDeclarator(int index) {
        return (VariableDeclarator)children.get(index);
    }

    public int getNumDeclarators() {
        return children.size();
    }

    public List<VariableDeclarator> getDeclarators() {
        List<VariableDeclarator> ret =
                new ArrayList<VariableDeclarator>(children.size());
        for (Traversable child : children) {
            ret.add((VariableDeclarator)child);
        }
        return ret;
    }

    public List<Symbol> getDeclaredSymbols() {
        return new ArrayList<Symbol>(getDeclarators());
    }

    public void print(PrintWriter o) {
        for (Specifier spec : specs) {
            spec.print(o);
            o.print(" ");
        }
        PrintTools.printListWithComma(children, o);
    }
}
