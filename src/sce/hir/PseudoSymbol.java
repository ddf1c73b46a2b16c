package sce.hir;

import java.util.ArrayList;
import java.util.List;

/**
* A symbol that stands for storage with no declaration in the IR. Pseudo
* symbols take part in dataflow sets next to variable declarators but can
* never be renamed or declared.
*/
public abstract class PseudoSymbol implements Symbol {

    protected PseudoSymbol() {
    }

    /** Pseudo symbols carry no type. */
    public List<Specifier> getTypeSpecifiers() {
        return new ArrayList<Specifier>(0);
    }

    public List<Specifier> getArraySpecifiers() {
        return new ArrayList<Specifier>(0);
    }

    /**
    * @throws UnsupportedOperationException always
    */
    public void setName(String name) {
        throw new UnsupportedOperationException();
    }

    /**
    * @throws UnsupportedOperationException always
    */
    public Declaration getDeclaration() {
        throw new UnsupportedOperationException();
    }

    @Override
    public String toString() {
        return getSymbolName();
    }
}
