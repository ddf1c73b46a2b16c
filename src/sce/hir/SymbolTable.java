package sce.hir;

import java.util.List;

/**
* Represents a scope that maps names to the symbols declared in it.
* Lookups through enclosing scopes are done with
* {@link SymbolTools#findSymbol(Traversable, String)}.
*/
public interface SymbolTable {

    /**
    * Adds a declaration to this scope.
    *
    * @param decl the declaration to be added.
    * @throws DuplicateSymbolException if a declared name already exists in
    *   this scope.
    */
    void addDeclaration(Declaration decl);

    /**
    * Looks up the symbol with the given name in this scope only.
    *
    * @param name the name to be searched for.
    * @return the symbol, or null if this scope does not declare it.
    */
    Symbol findSymbol(String name);

    /**
    * Returns the symbols declared in this scope in declaration order.
    *
    * @return the list of symbols.
    */
    List<Symbol> getSymbols();

    /**
    * Returns the declarations of this scope in order.
    *
    * @return the list of declarations.
    */
    List<Declaration> getDeclarations();
}
