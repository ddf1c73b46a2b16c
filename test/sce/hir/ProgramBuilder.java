package sce.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
* Static helpers that build IR the way a front end would, with locations
* attached to the nodes that tests refer to.
*/
public final class ProgramBuilder {

    private ProgramBuilder() {
    }

    public static SourceLocation loc(int line, int column) {
        return new SourceLocation(line, column);
    }

    public static <T extends Statement> T at(int line, int column, T stmt) {
        stmt.setLocation(loc(line, column));
        return stmt;
    }

    public static <T extends Expression> T at(int line, int column, T expr) {
        expr.setLocation(loc(line, column));
        return expr;
    }

    public static VariableDeclarator var(String name) {
        return new VariableDeclarator(name);
    }

    public static VariableDeclarator pointer(String name) {
        List<Specifier> leading = new ArrayList<Specifier>();
        leading.add(PointerSpecifier.UNQUALIFIED);
        return new VariableDeclarator(leading, name, new ArrayList<Specifier>());
    }

    public static VariableDeclarator array(String name, int dimension) {
        List<Specifier> trailing = new ArrayList<Specifier>();
        trailing.add(new ArraySpecifier(dimension));
        return new VariableDeclarator(new ArrayList<Specifier>(), name,
                                      trailing);
    }

    public static Identifier id(Symbol symbol) {
        return new Identifier(symbol);
    }

    public static IntegerLiteral lit(long value) {
        return new IntegerLiteral(value);
    }

    public static StringLiteral str(String value) {
        return new StringLiteral(value);
    }

    public static BinaryExpression bin(Expression lhs, BinaryOperator op,
                                       Expression rhs) {
        return new BinaryExpression(lhs, op, rhs);
    }

    public static UnaryExpression unary(UnaryOperator op, Expression expr) {
        return new UnaryExpression(op, expr);
    }

    public static AssignmentExpression assign(Expression lhs,
                                              Expression rhs) {
        return new AssignmentExpression(lhs, AssignmentOperator.NORMAL, rhs);
    }

    /** Creates a call to a function named by a name id. */
    public static FunctionCall call(String name, Expression... args) {
        return new FunctionCall(new NameID(name), Arrays.asList(args));
    }

    public static ExpressionStatement stmt(Expression expr) {
        return new ExpressionStatement(expr);
    }

    public static ExpressionStatement stmt(int line, int column,
                                           Expression expr) {
        return at(line, column, new ExpressionStatement(expr));
    }

    public static DeclarationStatement decl(int line, int column,
            Specifier type, VariableDeclarator declarator) {
        declarator.setLocation(loc(line, column + type.toString().length() + 1));
        return at(line, column, new DeclarationStatement(
                new VariableDeclaration(type, declarator)));
    }

    public static DeclarationStatement decl(int line, int column,
            Specifier type, VariableDeclarator declarator, Expression init) {
        declarator.setInitializer(init);
        return decl(line, column, type, declarator);
    }

    public static ReturnStatement ret(int line, int column, Expression expr) {
        return at(line, column, new ReturnStatement(expr));
    }

    public static CompoundStatement block(Statement... stmts) {
        CompoundStatement ret = new CompoundStatement();
        for (Statement stmt : stmts) {
            ret.addStatement(stmt);
        }
        return ret;
    }

    public static VariableDeclaration param(Specifier type,
                                            VariableDeclarator declarator) {
        return new VariableDeclaration(type, declarator);
    }

    public static Procedure procedure(int line, Specifier type, String name,
            List<VariableDeclaration> params, CompoundStatement body) {
        List<Specifier> return_type = new ArrayList<Specifier>();
        return_type.add(type);
        Procedure ret = new Procedure(return_type, name, params, body);
        ret.setLocation(loc(line, 1));
        return ret;
    }

    public static List<VariableDeclaration>
            params(VariableDeclaration... params) {
        return new ArrayList<VariableDeclaration>(Arrays.asList(params));
    }

    /**
    * Returns the innermost statement other than a block that starts on the
    * line, or null.
    */
    public static Statement statementAt(Traversable root, int line) {
        Statement ret = null;
        DFIterator<Statement> iter =
                new DFIterator<Statement>(root, Statement.class);
        while (iter.hasNext()) {
            Statement stmt = iter.next();
            if (!(stmt instanceof CompoundStatement) && stmt.where() == line) {
                ret = stmt;
            }
        }
        return ret;
    }

    /** Returns the first statement of the given type under the root. */
    public static <T extends Statement> T first(Traversable root,
                                                Class<T> type) {
        DFIterator<T> iter = new DFIterator<T>(root, type);
        return iter.hasNext() ? iter.next() : null;
    }

    /** Counts the nodes of the given type under the root. */
    public static int count(Traversable root,
                            Class<? extends Traversable> type) {
        return new DFIterator<Traversable>(root, type).getList().size();
    }
}
