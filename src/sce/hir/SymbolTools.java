package sce.hir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
* <b>SymbolTools</b> provides tools for symbol lookup, symbol relinking after
* cloning and queries on symbol types.
*/
public final class SymbolTools {

    private SymbolTools() {
    }

    /**
    * Links every identifier under the root whose symbol is a key of the map
    * to the mapped symbol. Cloning a scope uses this to make the copy refer
    * to the copied declarators.
    *
    * @param root the root of the tree to be relinked.
    * @param map the mapping from the original to the new symbols, keyed by
    *   identity.
    */
    public static void relinkSymbols(Traversable root,
                                     Map<Symbol, Symbol> map) {
        DFIterator<Identifier> iter =
                new DFIterator<Identifier>(root, Identifier.class);
        while (iter.hasNext()) {
            Identifier id = iter.next();
            Symbol new_symbol = map.get(id.getSymbol());
            if (new_symbol != null) {
                id.setSymbol(new_symbol);
            }
        }
    }

    /**
    * Returns the symbol visible at the given IR location under the name,
    * searching the enclosing scopes from the innermost one.
    *
    * @param where the IR location where the search starts.
    * @param name the name being searched for.
    * @return the symbol, or null if no scope declares the name.
    */
    public static Symbol findSymbol(Traversable where, String name) {
        Traversable t = where;
        while (t != null) {
            if (t instanceof SymbolTable) {
                Symbol ret = ((SymbolTable)t).findSymbol(name);
                if (ret != null) {
                    return ret;
                }
            }
            t = t.getParent();
        }
        return null;
    }

    /**
    * Returns the symbols referenced by identifiers in the traversable
    * object, in order of first appearance.
    */
    public static Set<Symbol> getAccessedSymbols(Traversable t) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        if (t == null) {
            return ret;
        }
        DFIterator<Identifier> iter =
                new DFIterator<Identifier>(t, Identifier.class);
        while (iter.hasNext()) {
            ret.add(iter.next().getSymbol());
        }
        return ret;
    }

    /**
    * Returns the variables declared within the traversable object, including
    * the parameters of a procedure.
    */
    public static Set<Symbol> getLocalSymbols(Traversable t) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        DFIterator<VariableDeclarator> iter =
                new DFIterator<VariableDeclarator>(t, VariableDeclarator.class);
        while (iter.hasNext()) {
            ret.add(iter.next());
        }
        return ret;
    }

    /**
    * Returns the symbols whose address is taken with the address-of
    * operator in the traversable object.
    */
    public static Set<Symbol> getAddressTakenSymbols(Traversable t) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        DFIterator<UnaryExpression> iter =
                new DFIterator<UnaryExpression>(t, UnaryExpression.class);
        while (iter.hasNext()) {
            UnaryExpression ue = iter.next();
            if (ue.getOperator() == UnaryOperator.ADDRESS_OF) {
                Symbol symbol = getSymbolOf(ue.getExpression());
                if (symbol != null) {
                    ret.add(symbol);
                }
            }
        }
        return ret;
    }

    /**
    * Returns the symbol of the expression if it represents an lvalue.
    * An identifier returns its symbol and an array access returns the symbol
    * of the accessed array. A dereference returns null since the target is
    * not known.
    *
    * @param e the input expression.
    * @return the corresponding symbol object, or null.
    */
    public static Symbol getSymbolOf(Expression e) {
        if (e instanceof Identifier) {
            return ((Identifier)e).getSymbol();
        } else if (e instanceof ArrayAccess) {
            return getSymbolOf(((ArrayAccess)e).getArrayName());
        }
        return null;
    }

    /**
    * Checks if the symbol is declared with array specifiers.
    */
    public static boolean isArray(Symbol symbol) {
        return !symbol.getArraySpecifiers().isEmpty();
    }

    /**
    * Returns the number of pointer specifiers in the type of the symbol.
    */
    public static int getPointerDepth(Symbol symbol) {
        int ret = 0;
        for (Specifier spec : symbol.getTypeSpecifiers()) {
            if (spec instanceof PointerSpecifier) {
                ret++;
            }
        }
        return ret;
    }

    public static boolean isPointer(Symbol symbol) {
        return (getPointerDepth(symbol) > 0);
    }

    /**
    * Checks if the symbol is declared <b>static</b>.
    */
    public static boolean isStatic(Symbol symbol) {
        return symbol.getTypeSpecifiers().contains(Specifier.STATIC);
    }

    /**
    * Returns the base type of the symbol: its type specifiers without
    * qualifiers and pointer specifiers. <b>int *p</b>, <b>int a[4]</b> and
    * <b>const int x</b> all have the base type <b>int</b>.
    */
    public static List<Specifier> getBaseType(Symbol symbol) {
        List<Specifier> ret = new ArrayList<Specifier>(2);
        for (Specifier spec : symbol.getTypeSpecifiers()) {
            if (!(spec instanceof PointerSpecifier) && !spec.isQualifier()) {
                ret.add(spec);
            }
        }
        return ret;
    }
}
