package sce.analysis;

import sce.hir.PseudoSymbol;

/**
* The storage reached through a pointer whose target is not known: pointer
* parameters, pointers loaded from other variables, and whatever a callee
* writes through the pointers it is given. Every indirect write may define
* it and every indirect read uses it.
*/
public final class MemorySymbol extends PseudoSymbol {

    public static final MemorySymbol UNKNOWN = new MemorySymbol();

    private MemorySymbol() {
    }

    public String getSymbolName() {
        return "*?";
    }

    @Override
    public boolean equals(Object o) {
        return (o == this);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }
}
