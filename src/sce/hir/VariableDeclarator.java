package sce.hir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a declarator for a variable in a VariableDeclaration, such as
* <b>*p</b>, <b>a[100]</b> or <b>x = 1</b>. The only child of a declarator is
* its initializer, if it has one.
*/
public class VariableDeclarator implements Cloneable, Traversable, Symbol {

    private Traversable parent;

    private List<Traversable> children;

    /** The declared name */
    private String name;

    /** Pointer specifiers that precede the name */
    private List<Specifier> leading_specs;

    /** Array specifiers that follow the name */
    private List<Specifier> trailing_specs;

    private SourceLocation location;

    /**
    * Constructs a plain declarator with the given name.
    *
    * @param name the declared name.
    */
    public VariableDeclarator(String name) {
        this(new ArrayList<Specifier>(0), name, new ArrayList<Specifier>(0));
    }

    /**
    * Constructs a declarator with pointer and array specifiers.
    *
    * @param leading_specs pointer specifiers placed before the name.
    * @param name the declared name.
    * @param trailing_specs array specifiers placed after the name.
    */
    public VariableDeclarator(List<Specifier> leading_specs, String name,
                              List<Specifier> trailing_specs) {
        this.parent = null;
        this.children = new ArrayList<Traversable>(1);
        this.name = name;
        this.leading_specs = new ArrayList<Specifier>(leading_specs);
        this.trailing_specs = new ArrayList<Specifier>(trailing_specs);
    }

    @Override
    public VariableDeclarator clone() {
        VariableDeclarator o = null;
        try {
            o = (VariableDeclarator)super.clone();
        } catch(CloneNotSupportedException e) {
            throw new InternalError();
        }
        o.parent = null;
        o.leading_specs = new ArrayList<Specifier>(leading_specs);
        o.trailing_specs = new ArrayList<Specifier>(trailing_specs);
        o.children = new ArrayList<Traversable>(1);
        if (!children.isEmpty()) {
            Expression init = ((Expression)children.get(0)).clone();
            o.children.add(init);
            init.setParent(o);
        }
        return o;
    }

    /**
    * Returns the initial value of the declared variable.
    *
    * @return the initializer expression, or null if there is none.
    */
    public Expression getInitializer() {
        return children.isEmpty() ? null : (Expression)children.get(0);
    }

    /**
    * Sets the initializer of this declarator, replacing any existing one.
    *
    * @param init the new initializer, or null to remove it.
    */
    public void setInitializer(Expression init) {
        if (!children.isEmpty()) {
            children.get(0).setParent(null);
            children.clear();
        }
        if (init != null) {
            if (init.getParent() != null) {
                throw new NotAnOrphanException();
            }
            children.add(init);
            init.setParent(this);
            init.setParens(false);
        }
    }

    public List<Specifier> getLeadingSpecifiers() {
        return leading_specs;
    }

    /* Symbol interface */
    public List<Specifier> getTypeSpecifiers() {
        List<Specifier> ret = new ArrayList<Specifier>(4);
        Declaration decl = getDeclaration();
        if (decl instanceof VariableDeclaration) {
            ret.addAll(((VariableDeclaration)decl).getSpecifiers());
        }
        ret.addAll(leading_specs);
        return ret;
    }

    /* Symbol interface */
    public List<Specifier> getArraySpecifiers() {
        return trailing_specs;
    }

    /* Symbol interface */
    public String getSymbolName() {
        return name;
    }

    /* Symbol interface */
    public void setName(String name) {
        this.name = name;
    }

    /* Symbol interface */
    public Declaration getDeclaration() {
        Traversable t = parent;
        return (t instanceof Declaration) ? (Declaration)t : null;
    }

    public void setLocation(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Traversable> getChildren() {
        return children;
    }

    public Traversable getParent() {
        return parent;
    }

    public void setParent(Traversable t) {
        parent = t;
    }

    public void removeChild(Traversable child) {
        if (children.isEmpty() || children.get(0) != child) {
            throw new NotAChildException();
        }
        setInitializer(null);
    }

    public void setChild(int index, Traversable t) {
        if (index != 0 || !(t instanceof Expression)) {
            throw new IllegalArgumentException();
        }
        setInitializer((Expression)t);
    }

    public void print(PrintWriter o) {
        for (Specifier spec : leading_specs) {
            spec.print(o);
        }
        o.print(name);
        for (Specifier spec : trailing_specs) {
            spec.print(o);
        }
        if (!children.isEmpty()) {
            o.print(" = ");
            ((Expression)children.get(0)).print(o);
        }
    }

    @Override
    public String toString() {
        StringWriter sw = new StringWriter(40);
        PrintWriter pw = new PrintWriter(sw);
        print(pw);
        pw.flush();
        return sw.toString();
    }
}
