package sce.hir;

import java.io.PrintWriter;

/**
* Unary operators, prefix and postfix.
*/
public class UnaryOperator implements Printable {

    private static String[] names = {
            "&", "~", "*", "!", "-", "+", "--", "++", "--", "++"};

    /** &amp; */
    public static final UnaryOperator ADDRESS_OF = new UnaryOperator(0);
    /** ~ */
    public static final UnaryOperator BITWISE_COMPLEMENT =
            new UnaryOperator(1);
    /** * */
    public static final UnaryOperator DEREFERENCE = new UnaryOperator(2);
    /** ! */
    public static final UnaryOperator LOGICAL_NEGATION = new UnaryOperator(3);
    /** - */
    public static final UnaryOperator MINUS = new UnaryOperator(4);
    /** + */
    public static final UnaryOperator PLUS = new UnaryOperator(5);
    /** -- (postfix) */
    public static final UnaryOperator POST_DECREMENT = new UnaryOperator(6);
    /** ++ (postfix) */
    public static final UnaryOperator POST_INCREMENT = new UnaryOperator(7);
    /** -- (prefix) */
    public static final UnaryOperator PRE_DECREMENT = new UnaryOperator(8);
    /** ++ (prefix) */
    public static final UnaryOperator PRE_INCREMENT = new UnaryOperator(9);

    private final int value;

    private UnaryOperator(int value) {
        this.value = value;
    }

    /**
    * Checks if the operator is printed after its operand.
    */
    public boolean isPostfix() {
        return (this == POST_DECREMENT || this == POST_INCREMENT);
    }

    /**
    * Checks if the operator modifies its operand.
    */
    public boolean modifiesOperand() {
        return (value >= 6);
    }

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }
}
