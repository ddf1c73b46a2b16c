package sce.hir;

import java.io.PrintWriter;

/**
* Operators of the assignment expressions. A compound assignment also reads
* its left-hand side; {@link #getBinaryOperator()} returns the operator it
* applies.
*/
public class AssignmentOperator implements Printable {

    private static String[] names = {
            "=", "+=", "-=", "*=", "/=", "%=", "<<=", ">>=", "&=", "^=", "|="};

    private static BinaryOperator[] binary_ops = {
            null, BinaryOperator.ADD, BinaryOperator.SUBTRACT,
            BinaryOperator.MULTIPLY, BinaryOperator.DIVIDE,
            BinaryOperator.MODULUS, BinaryOperator.SHIFT_LEFT,
            BinaryOperator.SHIFT_RIGHT, BinaryOperator.BITWISE_AND,
            BinaryOperator.BITWISE_EXCLUSIVE_OR,
            BinaryOperator.BITWISE_INCLUSIVE_OR};

    public static final AssignmentOperator NORMAL = new AssignmentOperator(0);
    public static final AssignmentOperator ADD = new AssignmentOperator(1);
    public static final AssignmentOperator SUBTRACT = new AssignmentOperator(2);
    public static final AssignmentOperator MULTIPLY = new AssignmentOperator(3);
    public static final AssignmentOperator DIVIDE = new AssignmentOperator(4);
    public static final AssignmentOperator MODULUS = new AssignmentOperator(5);
    public static final AssignmentOperator SHIFT_LEFT =
            new AssignmentOperator(6);
    public static final AssignmentOperator SHIFT_RIGHT =
            new AssignmentOperator(7);
    public static final AssignmentOperator BITWISE_AND =
            new AssignmentOperator(8);
    public static final AssignmentOperator BITWISE_EXCLUSIVE_OR =
            new AssignmentOperator(9);
    public static final AssignmentOperator BITWISE_INCLUSIVE_OR =
            new AssignmentOperator(10);

    private final int value;

    private AssignmentOperator(int value) {
        this.value = value;
    }

    /**
    * Returns the binary operator applied by a compound assignment.
    *
    * @return the operator, or null for a plain assignment.
    */
    public BinaryOperator getBinaryOperator() {
        return binary_ops[value];
    }

    public void print(PrintWriter o) {
        o.print(names[value]);
    }

    @Override
    public String toString() {
        return names[value];
    }
}
