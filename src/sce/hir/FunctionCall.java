package sce.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
* Represents a function call. The first child is the called name and the
* remaining children are the arguments in evaluation order.
*/
public class FunctionCall extends Expression {

    /**
    * Creates a function call.
    *
    * @param function the called name, an identifier or a name id.
    * @param args the arguments.
    */
    public FunctionCall(Expression function, List<Expression> args) {
        super(args.size() + 1);
        needs_parens = false;
        addChild(function);
        for (Expression arg : args) {
            addChild(arg);
            arg.setParens(false);
        }
    }

    @Override
    public FunctionCall clone() {
        return (FunctionCall)super.clone();
    }

    /** Returns the expression naming the called function. */
    public Expression getName() {
        return (Expression)children.get(0);
    }

    /**
    * Returns the called name as a string.
    */
    public String getFunctionName() {
        Expression name = getName();
        if (name instanceof IDExpression) {
            return ((IDExpression)name).getName();
        }
        return name.toString();
    }

    public Expression getArgument(int n) {
        return (Expression)children.get(n + 1);
    }

    public List<Expression> getArguments() {
        List<Expression> ret = new ArrayList<Expression>(children.size() - 1);
        for (int i = 1; i < children.size(); i++) {
            ret.add((Expression)children.get(i));
        }
        return ret;
    }

    public int getNumArguments() {
        return children.size() - 1;
    }

    public void print(PrintWriter o) {
        getName().print(o);
        o.print("(");
        PrintTools.printListWithComma(getArguments(), o);
        o.print(")");
    }
}
