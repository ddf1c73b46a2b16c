package sce.hir;

import static sce.hir.ProgramBuilder.*;

/**
* The programs used by the tests. Line and column numbers follow the source
* text shown above each builder.
*/
public final class Fixtures {

    private Fixtures() {
    }

    /*
     4 int main() {
     5     int i;
     6     int sum = 0;
     7     int product = 1;
     8     int w = 7;
     9     for(i = 1; i < N; ++i) {
    10       sum = sum + i + w;
    11       product = product * i;
    12     }
    13     write(sum);
    14     write(product);
    15
    16     return 0;
    17 }
    */
    public static TranslationUnit example2() {
        VariableDeclarator i = var("i");
        VariableDeclarator sum = var("sum");
        VariableDeclarator product = var("product");
        VariableDeclarator w = var("w");
        ForLoop loop = at(9, 5, new ForLoop(
                stmt(9, 9, assign(at(9, 9, id(i)), lit(1))),
                bin(id(i), BinaryOperator.COMPARE_LT, lit(100)),
                unary(UnaryOperator.PRE_INCREMENT, id(i)),
                block(
                    stmt(10, 7, assign(at(10, 7, id(sum)),
                            bin(bin(id(sum), BinaryOperator.ADD, id(i)),
                                BinaryOperator.ADD, id(w)))),
                    stmt(11, 7, assign(at(11, 7, id(product)),
                            bin(id(product), BinaryOperator.MULTIPLY,
                                id(i)))))));
        CompoundStatement body = block(
                decl(5, 5, Specifier.INT, i),
                decl(6, 5, Specifier.INT, sum, lit(0)),
                decl(7, 5, Specifier.INT, product, lit(1)),
                decl(8, 5, Specifier.INT, w, lit(7)),
                loop,
                stmt(13, 5, call("write", at(13, 11, id(sum)))),
                stmt(14, 5, call("write", at(14, 11, id(product)))),
                ret(16, 5, lit(0)));
        TranslationUnit tu = new TranslationUnit("example2.c");
        tu.addDeclaration(procedure(4, Specifier.INT, "main", params(), body));
        return tu;
    }

    /*
     3 int to_inline(int a, int b) {
     4     return a + b;
     5 }
     6
     7 int another_inline(int a, int b) {
     8     int sum = a + b;
     9     sum++;
    10     return sum;
    11 }
    12
    13 int main() {
    14     int x = 1;
    15     int y = 2;
    16     int z = to_inline(x, y);
    17     int w = another_inline(x, y);
    18     printf("%d\n", z);
    19     printf("%d\n", w);
    20     return 0;
    21 }
    */
    public static TranslationUnit inline1() {
        TranslationUnit tu = new TranslationUnit("inline1-1.c");

        VariableDeclarator a = var("a");
        VariableDeclarator b = var("b");
        tu.addDeclaration(procedure(3, Specifier.INT, "to_inline",
                params(param(Specifier.INT, a), param(Specifier.INT, b)),
                block(ret(4, 5, bin(id(a), BinaryOperator.ADD, id(b))))));

        VariableDeclarator a2 = var("a");
        VariableDeclarator b2 = var("b");
        VariableDeclarator sum = var("sum");
        tu.addDeclaration(procedure(7, Specifier.INT, "another_inline",
                params(param(Specifier.INT, a2), param(Specifier.INT, b2)),
                block(
                    decl(8, 5, Specifier.INT, sum,
                         bin(id(a2), BinaryOperator.ADD, id(b2))),
                    stmt(9, 5, unary(UnaryOperator.POST_INCREMENT, id(sum))),
                    ret(10, 5, id(sum)))));

        VariableDeclarator x = var("x");
        VariableDeclarator y = var("y");
        VariableDeclarator z = var("z");
        VariableDeclarator w = var("w");
        tu.addDeclaration(procedure(13, Specifier.INT, "main", params(),
                block(
                    decl(14, 5, Specifier.INT, x, lit(1)),
                    decl(15, 5, Specifier.INT, y, lit(2)),
                    decl(16, 5, Specifier.INT, z, at(16, 13,
                            call("to_inline", at(16, 23, id(x)),
                                 at(16, 26, id(y))))),
                    decl(17, 5, Specifier.INT, w, at(17, 13,
                            call("another_inline", id(x), id(y)))),
                    stmt(18, 5, call("printf", str("%d\\n"),
                                     at(18, 20, id(z)))),
                    stmt(19, 5, call("printf", str("%d\\n"),
                                     at(19, 20, id(w)))),
                    ret(20, 5, lit(0)))));
        return tu;
    }

    /*
     3 int fib(int n) {
     4     if (n <= 1) {
     5         return n;
     6     }
     7     return fib(n - 1) + fib(n - 2);
     8 }
     9
    10 int main() {
    11     if (10 <= 1) {
    12         // goto line 14
    13     }
    14     int x = fib(10 - 1) + fib(10 - 2);
    15     return 0;
    16 }
    */
    public static TranslationUnit fib() {
        TranslationUnit tu = new TranslationUnit("inline2-1.c");
        VariableDeclarator n = var("n");
        tu.addDeclaration(procedure(3, Specifier.INT, "fib",
                params(param(Specifier.INT, n)),
                block(
                    at(4, 5, new IfStatement(
                            bin(id(n), BinaryOperator.COMPARE_LE, lit(1)),
                            block(ret(5, 9, id(n))))),
                    ret(7, 5, bin(
                            at(7, 12, call("fib",
                                    bin(id(n), BinaryOperator.SUBTRACT,
                                        lit(1)))),
                            BinaryOperator.ADD,
                            at(7, 25, call("fib",
                                    bin(id(n), BinaryOperator.SUBTRACT,
                                        lit(2)))))))));
        VariableDeclarator x = var("x");
        tu.addDeclaration(procedure(10, Specifier.INT, "main", params(),
                block(
                    at(11, 5, new IfStatement(
                            bin(lit(10), BinaryOperator.COMPARE_LE, lit(1)),
                            block())),
                    decl(14, 5, Specifier.INT, x, bin(
                            at(14, 13, call("fib",
                                    bin(lit(10), BinaryOperator.SUBTRACT,
                                        lit(1)))),
                            BinaryOperator.ADD,
                            at(14, 27, call("fib",
                                    bin(lit(10), BinaryOperator.SUBTRACT,
                                        lit(2)))))),
                    ret(15, 5, lit(0)))));
        return tu;
    }

    /*
     1 int classify(int v) {
     2     if (v < 0) {
     3         return -1;
     4     }
     5     int r = v * 2;
     6     return r;
     7 }
     8
     9 int find(int n) {
    10     int i;
    11     for (i = 0; i < n; i++) {
    12         if (i * i > n) {
    13             return i;
    14         }
    15     }
    16     return -1;
    17 }
    18
    19 int main() {
    20     int a = 5;
    21     int c = classify(a);
    22     int f = find(a);
    23     return c + f;
    24 }
    */
    public static TranslationUnit multiReturn() {
        TranslationUnit tu = new TranslationUnit("multi-return.c");

        VariableDeclarator v = var("v");
        VariableDeclarator r = var("r");
        tu.addDeclaration(procedure(1, Specifier.INT, "classify",
                params(param(Specifier.INT, v)),
                block(
                    at(2, 5, new IfStatement(
                            bin(id(v), BinaryOperator.COMPARE_LT, lit(0)),
                            block(ret(3, 9, unary(UnaryOperator.MINUS,
                                                  lit(1)))))),
                    decl(5, 5, Specifier.INT, r,
                         bin(id(v), BinaryOperator.MULTIPLY, lit(2))),
                    ret(6, 5, id(r)))));

        VariableDeclarator n = var("n");
        VariableDeclarator i = var("i");
        tu.addDeclaration(procedure(9, Specifier.INT, "find",
                params(param(Specifier.INT, n)),
                block(
                    decl(10, 5, Specifier.INT, i),
                    at(11, 5, new ForLoop(
                            stmt(11, 10, assign(id(i), lit(0))),
                            bin(id(i), BinaryOperator.COMPARE_LT, id(n)),
                            unary(UnaryOperator.POST_INCREMENT, id(i)),
                            block(at(12, 9, new IfStatement(
                                    bin(bin(id(i), BinaryOperator.MULTIPLY,
                                            id(i)),
                                        BinaryOperator.COMPARE_GT, id(n)),
                                    block(ret(13, 13, id(i)))))))),
                    ret(16, 5, unary(UnaryOperator.MINUS, lit(1))))));

        VariableDeclarator a = var("a");
        VariableDeclarator c = var("c");
        VariableDeclarator f = var("f");
        tu.addDeclaration(procedure(19, Specifier.INT, "main", params(),
                block(
                    decl(20, 5, Specifier.INT, a, lit(5)),
                    decl(21, 5, Specifier.INT, c,
                         at(21, 13, call("classify", id(a)))),
                    decl(22, 5, Specifier.INT, f,
                         at(22, 13, call("find", id(a)))),
                    ret(23, 5, bin(id(c), BinaryOperator.ADD, id(f))))));
        return tu;
    }

    /*
     1 int total;
     2
     3 void add(int v) {
     4     if (v < 0) {
     5         return;
     6     }
     7     total = total + v;
     8 }
     9
    10 int main() {
    11     add(3);
    12     return total;
    13 }
    */
    public static TranslationUnit voidCall() {
        TranslationUnit tu = new TranslationUnit("void-call.c");
        VariableDeclarator total = var("total");
        total.setLocation(loc(1, 5));
        tu.addDeclaration(new VariableDeclaration(Specifier.INT, total));

        VariableDeclarator v = var("v");
        tu.addDeclaration(procedure(3, Specifier.VOID, "add",
                params(param(Specifier.INT, v)),
                block(
                    at(4, 5, new IfStatement(
                            bin(id(v), BinaryOperator.COMPARE_LT, lit(0)),
                            block(at(5, 9, new ReturnStatement())))),
                    stmt(7, 5, assign(id(total),
                            bin(id(total), BinaryOperator.ADD, id(v)))))));

        tu.addDeclaration(procedure(10, Specifier.INT, "main", params(),
                block(
                    stmt(11, 5, at(11, 5, call("add", lit(3)))),
                    ret(12, 5, id(total)))));
        return tu;
    }

    /*
     1 int sub(int a, int b) {
     2     return a * a - b;
     3 }
     4
     5 int main() {
     6     int i = 0;
     7     int r = sub(next(), i++);
     8     return r;
     9 }
    */
    public static TranslationUnit sideEffects() {
        TranslationUnit tu = new TranslationUnit("side-effects.c");
        VariableDeclarator a = var("a");
        VariableDeclarator b = var("b");
        tu.addDeclaration(procedure(1, Specifier.INT, "sub",
                params(param(Specifier.INT, a), param(Specifier.INT, b)),
                block(ret(2, 5, bin(bin(id(a), BinaryOperator.MULTIPLY,
                                        id(a)),
                                    BinaryOperator.SUBTRACT, id(b))))));
        VariableDeclarator i = var("i");
        VariableDeclarator r = var("r");
        tu.addDeclaration(procedure(5, Specifier.INT, "main", params(),
                block(
                    decl(6, 5, Specifier.INT, i, lit(0)),
                    decl(7, 5, Specifier.INT, r, at(7, 13, call("sub",
                            call("next"),
                            unary(UnaryOperator.POST_INCREMENT, id(i))))),
                    ret(8, 5, id(r)))));
        return tu;
    }

    /*
     1 int g;
     2
     3 int sq(int x) {
     4     int t = x * x;
     5     return t + g;
     6 }
     7
     8 int main() {
     9     int t = 3;
    10     int _param_sq_x = 1;      (or: int g = 1;)
    11     int r = sq(t);
    12     return r + _param_sq_x;   (or: return r + g;)
    13 }
    */
    public static TranslationUnit capture(boolean shadow_global) {
        TranslationUnit tu = new TranslationUnit("capture.c");
        VariableDeclarator g = var("g");
        tu.addDeclaration(new VariableDeclaration(Specifier.INT, g));

        VariableDeclarator x = var("x");
        VariableDeclarator t = var("t");
        tu.addDeclaration(procedure(3, Specifier.INT, "sq",
                params(param(Specifier.INT, x)),
                block(
                    decl(4, 5, Specifier.INT, t,
                         bin(id(x), BinaryOperator.MULTIPLY, id(x))),
                    ret(5, 5, bin(id(t), BinaryOperator.ADD, id(g))))));

        VariableDeclarator t2 = var("t");
        VariableDeclarator other =
                var(shadow_global ? "g" : "_param_sq_x");
        VariableDeclarator r = var("r");
        tu.addDeclaration(procedure(8, Specifier.INT, "main", params(),
                block(
                    decl(9, 5, Specifier.INT, t2, lit(3)),
                    decl(10, 5, Specifier.INT, other, lit(1)),
                    decl(11, 5, Specifier.INT, r,
                         at(11, 13, call("sq", id(t2)))),
                    ret(12, 5, bin(id(r), BinaryOperator.ADD, id(other))))));
        return tu;
    }

    /*
     1 int ptr() {
     2     int a = 1;
     3     int b = 2;
     4     int *p = &a;
     5     *p = 5;
     6     return a + b;
     7 }
    */
    public static TranslationUnit pointers() {
        TranslationUnit tu = new TranslationUnit("pointers.c");
        VariableDeclarator a = var("a");
        VariableDeclarator b = var("b");
        VariableDeclarator p = pointer("p");
        tu.addDeclaration(procedure(1, Specifier.INT, "ptr", params(),
                block(
                    decl(2, 5, Specifier.INT, a, lit(1)),
                    decl(3, 5, Specifier.INT, b, lit(2)),
                    decl(4, 5, Specifier.INT, p,
                         unary(UnaryOperator.ADDRESS_OF, id(a))),
                    stmt(5, 5, assign(
                            unary(UnaryOperator.DEREFERENCE, id(p)), lit(5))),
                    ret(6, 5, bin(id(a), BinaryOperator.ADD, id(b))))));
        return tu;
    }

    /*
     1 int dead(int a) {
     2     return a;
     3     a = a + 1;
     4 }
     5
     6 int spin(int a) {
     7     for (;;) {
     8         a = a + 1;
     9     }
    10 }
    11
    12 int main() {
    13     int d = dead(1);
    14     return d;
    15 }
    */
    public static TranslationUnit deadCode() {
        TranslationUnit tu = new TranslationUnit("dead-code.c");
        VariableDeclarator a = var("a");
        tu.addDeclaration(procedure(1, Specifier.INT, "dead",
                params(param(Specifier.INT, a)),
                block(
                    ret(2, 5, id(a)),
                    stmt(3, 5, assign(id(a),
                            bin(id(a), BinaryOperator.ADD, lit(1)))))));
        VariableDeclarator a2 = var("a");
        tu.addDeclaration(procedure(6, Specifier.INT, "spin",
                params(param(Specifier.INT, a2)),
                block(at(7, 5, new ForLoop(null, null, null,
                        block(stmt(8, 9, assign(id(a2),
                                bin(id(a2), BinaryOperator.ADD,
                                    lit(1))))))))));
        VariableDeclarator d = var("d");
        tu.addDeclaration(procedure(12, Specifier.INT, "main", params(),
                block(
                    decl(13, 5, Specifier.INT, d,
                         at(13, 13, call("dead", lit(1)))),
                    ret(14, 5, id(d)))));
        return tu;
    }

    /*
     1 int store(int *p) {
     2     *p = 1;
     3     int y = *p;
     4     return y;
     5 }
    */
    public static TranslationUnit pointerParameter() {
        TranslationUnit tu = new TranslationUnit("pointer-param.c");
        VariableDeclarator p = pointer("p");
        VariableDeclarator y = var("y");
        tu.addDeclaration(procedure(1, Specifier.INT, "store",
                params(param(Specifier.INT, p)),
                block(
                    stmt(2, 5, assign(
                            unary(UnaryOperator.DEREFERENCE, id(p)), lit(1))),
                    decl(3, 5, Specifier.INT, y,
                         unary(UnaryOperator.DEREFERENCE, id(p))),
                    ret(4, 5, at(4, 12, id(y))))));
        return tu;
    }

    /*
     1 int g;
     2
     3 void bump() {
     4     g = 5;
     5 }
     6
     7 int main() {
     8     g = 0;
     9     bump();
    10     int y = g;
    11     print(y);
    12     return y;
    13 }
    */
    public static TranslationUnit globalWrite() {
        TranslationUnit tu = new TranslationUnit("global-write.c");
        VariableDeclarator g = var("g");
        g.setLocation(loc(1, 5));
        tu.addDeclaration(new VariableDeclaration(Specifier.INT, g));

        tu.addDeclaration(procedure(3, Specifier.VOID, "bump", params(),
                block(stmt(4, 5, assign(id(g), lit(5))))));

        VariableDeclarator y = var("y");
        tu.addDeclaration(procedure(7, Specifier.INT, "main", params(),
                block(
                    stmt(8, 5, assign(id(g), lit(0))),
                    stmt(9, 5, at(9, 5, call("bump"))),
                    decl(10, 5, Specifier.INT, y, id(g)),
                    stmt(11, 5, call("print", at(11, 11, id(y)))),
                    ret(12, 5, at(12, 12, id(y))))));
        return tu;
    }

    /*
     1 int odd(int n) {
     2     if (n == 0) {
     3         return 0;
     4     }
     5     return even(n - 1);
     6 }
     7
     8 int even(int n) {
     9     if (n == 0) {
    10         return 1;
    11     }
    12     return odd(n - 1);
    13 }
    14
    15 int main() {
    16     int r = even(4);
    17     return r;
    18 }
    */
    public static TranslationUnit mutualRecursion() {
        TranslationUnit tu = new TranslationUnit("mutual.c");
        VariableDeclarator n = var("n");
        tu.addDeclaration(procedure(1, Specifier.INT, "odd",
                params(param(Specifier.INT, n)),
                block(
                    at(2, 5, new IfStatement(
                            bin(id(n), BinaryOperator.COMPARE_EQ, lit(0)),
                            block(ret(3, 9, lit(0))))),
                    ret(5, 5, at(5, 12, call("even",
                            bin(id(n), BinaryOperator.SUBTRACT, lit(1))))))));
        VariableDeclarator n2 = var("n");
        tu.addDeclaration(procedure(8, Specifier.INT, "even",
                params(param(Specifier.INT, n2)),
                block(
                    at(9, 5, new IfStatement(
                            bin(id(n2), BinaryOperator.COMPARE_EQ, lit(0)),
                            block(ret(10, 9, lit(1))))),
                    ret(12, 5, at(12, 12, call("odd",
                            bin(id(n2), BinaryOperator.SUBTRACT,
                                lit(1))))))));
        VariableDeclarator r = var("r");
        tu.addDeclaration(procedure(15, Specifier.INT, "main", params(),
                block(
                    decl(16, 5, Specifier.INT, r,
                         at(16, 13, call("even", lit(4)))),
                    ret(17, 5, id(r)))));
        return tu;
    }

    /** Returns the symbol declared under the name in the procedure. */
    public static Symbol symbol(TranslationUnit tu, String proc,
                                String name) {
        for (Symbol symbol :
                SymbolTools.getLocalSymbols(tu.findProcedure(proc))) {
            if (symbol.getSymbolName().equals(name)) {
                return symbol;
            }
        }
        return null;
    }
}
