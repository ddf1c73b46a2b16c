package sce.hir;

import java.io.PrintWriter;

/**
* Infix operators. Only the static instances exist, so operators compare by
* identity.
*/
public class BinaryOperator implements Printable {

    public static final BinaryOperator MULTIPLY = new BinaryOperator("*");
    public static final BinaryOperator DIVIDE = new BinaryOperator("/");
    public static final BinaryOperator MODULUS = new BinaryOperator("%");
    public static final BinaryOperator ADD = new BinaryOperator("+");
    public static final BinaryOperator SUBTRACT = new BinaryOperator("-");
    public static final BinaryOperator SHIFT_LEFT = new BinaryOperator("<<");
    public static final BinaryOperator SHIFT_RIGHT = new BinaryOperator(">>");
    public static final BinaryOperator COMPARE_LT = new BinaryOperator("<");
    public static final BinaryOperator COMPARE_LE = new BinaryOperator("<=");
    public static final BinaryOperator COMPARE_GT = new BinaryOperator(">");
    public static final BinaryOperator COMPARE_GE = new BinaryOperator(">=");
    public static final BinaryOperator COMPARE_EQ = new BinaryOperator("==");
    public static final BinaryOperator COMPARE_NE = new BinaryOperator("!=");
    public static final BinaryOperator BITWISE_AND = new BinaryOperator("&");
    public static final BinaryOperator BITWISE_EXCLUSIVE_OR =
            new BinaryOperator("^");
    public static final BinaryOperator BITWISE_INCLUSIVE_OR =
            new BinaryOperator("|");
    public static final BinaryOperator LOGICAL_AND = new BinaryOperator("&&");
    public static final BinaryOperator LOGICAL_OR = new BinaryOperator("||");

    private final String symbol;

    private BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /** Checks if the right operand is evaluated only on some paths. */
    public boolean isShortCircuit() {
        return (this == LOGICAL_AND || this == LOGICAL_OR);
    }

    public void print(PrintWriter o) {
        o.print(symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
