package sce.hir;

import java.util.List;

/**
* Represents a symbol object that has name and type information. Variable
* declarators and procedures implement this interface, and an
* {@link Identifier} refers to the symbol it was resolved to.
*/
public interface Symbol {

    /**
    * Returns the list of type specifiers of the symbol, including the pointer
    * specifiers of its declarator.
    *
    * @return the list of specifiers.
    */
    List<Specifier> getTypeSpecifiers();

    /**
    * Returns the list of array specifiers of the symbol.
    *
    * @return the list of array specifiers, empty if not an array.
    */
    List<Specifier> getArraySpecifiers();

    /**
    * Returns the name of the symbol.
    *
    * @return the name of the symbol.
    */
    String getSymbolName();

    /**
    * Changes the name of the symbol. Identifiers linked to the symbol print
    * the new name.
    *
    * @param name the new name.
    */
    void setName(String name);

    /**
    * Returns the declaration that declares this symbol.
    *
    * @return the declaration.
    */
    Declaration getDeclaration();
}
