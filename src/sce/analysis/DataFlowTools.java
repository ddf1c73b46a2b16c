package sce.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sce.hir.ArrayAccess;
import sce.hir.AssignmentExpression;
import sce.hir.AssignmentOperator;
import sce.hir.DFIterator;
import sce.hir.DeclarationStatement;
import sce.hir.Declaration;
import sce.hir.Expression;
import sce.hir.ExpressionStatement;
import sce.hir.FunctionCall;
import sce.hir.Identifier;
import sce.hir.Procedure;
import sce.hir.ReturnStatement;
import sce.hir.Symbol;
import sce.hir.SymbolTools;
import sce.hir.Traversable;
import sce.hir.UnaryExpression;
import sce.hir.UnaryOperator;
import sce.hir.VariableDeclaration;
import sce.hir.VariableDeclarator;

/**
* Tools that compute the variables defined and used by the IR of a CFG node,
* under the {@link MemoryModel} of its procedure.
*
* <p>Writes through a dereference, or through an index into a pointer, have
* no precise target. They are may-definitions of the unknown memory and of
* the aliasable variables with the same base type. A write to an element of a
* known array is a may-definition of that array. Reads through a dereference
* use the same set of variables. A call may-defines what its callee may
* modify and uses what its callee may read.
*/
public final class DataFlowTools {

    private DataFlowTools() {
    }

    /**
    * Returns the parameters, the locals and the globals accessed in the
    * procedure.
    */
    public static Set<Symbol> getVariables(Procedure proc) {
        Set<Symbol> ret = SymbolTools.getLocalSymbols(proc);
        for (Symbol symbol : SymbolTools.getAccessedSymbols(proc.getBody())) {
            if (symbol instanceof VariableDeclarator) {
                ret.add(symbol);
            }
        }
        return ret;
    }

    /**
    * Checks if the lvalue reaches storage through a pointer: a dereference,
    * or an index whose base is not a declared array.
    */
    static boolean isIndirect(Expression e) {
        if (e instanceof UnaryExpression) {
            return (((UnaryExpression)e).getOperator() ==
                    UnaryOperator.DEREFERENCE);
        } else if (e instanceof ArrayAccess) {
            Symbol base = SymbolTools.getSymbolOf(e);
            return (base == null || !SymbolTools.isArray(base));
        }
        return false;
    }

    // Returns the expressions evaluated by the IR of a node.
    private static List<Expression> getEvaluated(Traversable ir) {
        List<Expression> ret = new ArrayList<Expression>(2);
        if (ir instanceof Expression) {
            ret.add((Expression)ir);
        } else if (ir instanceof ExpressionStatement) {
            ret.add(((ExpressionStatement)ir).getExpression());
        } else if (ir instanceof ReturnStatement) {
            Expression expr = ((ReturnStatement)ir).getExpression();
            if (expr != null) {
                ret.add(expr);
            }
        } else if (ir instanceof DeclarationStatement) {
            for (VariableDeclarator vd : getDeclarators(
                    (DeclarationStatement)ir)) {
                if (vd.getInitializer() != null) {
                    ret.add(vd.getInitializer());
                }
            }
        }
        return ret;
    }

    private static List<VariableDeclarator>
            getDeclarators(DeclarationStatement stmt) {
        Declaration decl = stmt.getDeclaration();
        if (decl instanceof VariableDeclaration) {
            return ((VariableDeclaration)decl).getDeclarators();
        }
        return new ArrayList<VariableDeclarator>(0);
    }

    /**
    * Returns the variables defined by the IR. The value mapped to a variable
    * is true for a definite (killing) definition and false for a
    * may-definition.
    *
    * @param ir the IR of a CFG node, possibly null.
    * @param model the memory model of the procedure.
    * @return the defined variables in order of appearance.
    */
    public static Map<Symbol, Boolean>
            getDefSymbols(Traversable ir, MemoryModel model) {
        Map<Symbol, Boolean> ret = new LinkedHashMap<Symbol, Boolean>();
        if (ir instanceof DeclarationStatement) {
            for (VariableDeclarator vd : getDeclarators(
                    (DeclarationStatement)ir)) {
                if (vd.getInitializer() != null) {
                    addDefs(vd.getInitializer(), model, ret);
                    ret.put(vd, Boolean.TRUE);
                }
            }
            return ret;
        }
        for (Expression expr : getEvaluated(ir)) {
            addDefs(expr, model, ret);
        }
        return ret;
    }

    private static void addDefs(Expression root, MemoryModel model,
                                Map<Symbol, Boolean> defs) {
        DFIterator<Expression> iter =
                new DFIterator<Expression>(root, Expression.class);
        while (iter.hasNext()) {
            Expression e = iter.next();
            if (e instanceof AssignmentExpression) {
                addLvalueDef(((AssignmentExpression)e).getLHS(), model, defs);
            } else if (e instanceof UnaryExpression &&
                    ((UnaryExpression)e).getOperator().modifiesOperand()) {
                addLvalueDef(((UnaryExpression)e).getExpression(), model,
                             defs);
            } else if (e instanceof FunctionCall) {
                FunctionCall call = (FunctionCall)e;
                for (Expression arg : call.getArguments()) {
                    addArgumentDef(arg, model, defs);
                }
                ModRefAnalysis.Summary summary = model.getSummary(call);
                if (summary != null) {
                    addMayDefs(summary.getMod(), defs);
                    if (summary.writesMemory()) {
                        addMayDef(MemorySymbol.UNKNOWN, defs);
                        addMayDefs(model.getAliasableSymbols(), defs);
                    }
                }
            }
        }
    }

    private static void addLvalueDef(Expression lhs, MemoryModel model,
                                     Map<Symbol, Boolean> defs) {
        if (lhs instanceof Identifier) {
            Symbol symbol = ((Identifier)lhs).getSymbol();
            if (symbol instanceof VariableDeclarator) {
                defs.put(symbol, Boolean.TRUE);
            }
            return;
        }
        Symbol base = null;
        if (lhs instanceof ArrayAccess) {
            base = SymbolTools.getSymbolOf(lhs);
            if (base != null) {
                addMayDef(base, defs);
            }
        } else if (lhs instanceof UnaryExpression &&
                ((UnaryExpression)lhs).getOperator() ==
                UnaryOperator.DEREFERENCE) {
            base = SymbolTools.getSymbolOf(
                    ((UnaryExpression)lhs).getExpression());
            if (base != null && SymbolTools.isArray(base)) {
                addMayDef(base, defs);
            }
        } else {
            return;
        }
        if (isIndirect(lhs)) {
            addMayDef(MemorySymbol.UNKNOWN, defs);
        }
        addMayDefs(model.getTargets(base), defs);
    }

    // &v, arrays and pointers passed to a call may be written by the callee.
    private static void addArgumentDef(Expression arg, MemoryModel model,
                                       Map<Symbol, Boolean> defs) {
        if (arg instanceof UnaryExpression &&
                ((UnaryExpression)arg).getOperator() ==
                UnaryOperator.ADDRESS_OF) {
            Symbol symbol = SymbolTools.getSymbolOf(
                    ((UnaryExpression)arg).getExpression());
            if (symbol instanceof VariableDeclarator) {
                addMayDef(symbol, defs);
            }
        } else if (arg instanceof Identifier) {
            Symbol symbol = ((Identifier)arg).getSymbol();
            if (symbol instanceof VariableDeclarator) {
                if (SymbolTools.isArray(symbol)) {
                    addMayDef(symbol, defs);
                    addMayDefs(model.getTargets(symbol), defs);
                } else if (SymbolTools.isPointer(symbol)) {
                    addMayDef(MemorySymbol.UNKNOWN, defs);
                    addMayDefs(model.getTargets(symbol), defs);
                }
            }
        }
    }

    private static void addMayDef(Symbol symbol, Map<Symbol, Boolean> defs) {
        if (!defs.containsKey(symbol)) {
            defs.put(symbol, Boolean.FALSE);
        }
    }

    private static void addMayDefs(Set<Symbol> symbols,
                                   Map<Symbol, Boolean> defs) {
        for (Symbol symbol : symbols) {
            addMayDef(symbol, defs);
        }
    }

    /**
    * Returns the variables whose values are read by the IR.
    *
    * @param ir the IR of a CFG node, possibly null.
    * @param model the memory model of the procedure.
    * @return the used variables in order of appearance.
    */
    public static Set<Symbol> getUseSymbols(Traversable ir,
                                            MemoryModel model) {
        Set<Symbol> ret = new LinkedHashSet<Symbol>();
        for (Expression root : getEvaluated(ir)) {
            DFIterator<Expression> iter =
                    new DFIterator<Expression>(root, Expression.class);
            while (iter.hasNext()) {
                Expression e = iter.next();
                if (e instanceof Identifier) {
                    Symbol symbol = ((Identifier)e).getSymbol();
                    if (symbol instanceof VariableDeclarator &&
                            !isWrittenOnly(e)) {
                        ret.add(symbol);
                    }
                } else if (e instanceof UnaryExpression &&
                        ((UnaryExpression)e).getOperator() ==
                        UnaryOperator.DEREFERENCE && !isWrittenOnly(e)) {
                    ret.add(MemorySymbol.UNKNOWN);
                    ret.addAll(model.getTargets(SymbolTools.getSymbolOf(
                            ((UnaryExpression)e).getExpression())));
                } else if (e instanceof ArrayAccess && isIndirect(e) &&
                        !isWrittenOnly(e)) {
                    ret.add(MemorySymbol.UNKNOWN);
                    ret.addAll(model.getTargets(SymbolTools.getSymbolOf(e)));
                } else if (e instanceof FunctionCall) {
                    addCallUses((FunctionCall)e, model, ret);
                }
            }
        }
        return ret;
    }

    // A callee reads the globals in its summary, and through pointer or
    // array arguments the storage they point to.
    private static void addCallUses(FunctionCall call, MemoryModel model,
                                    Set<Symbol> uses) {
        for (Expression arg : call.getArguments()) {
            Symbol symbol = (arg instanceof Identifier) ?
                    ((Identifier)arg).getSymbol() : null;
            if (symbol instanceof VariableDeclarator &&
                    (SymbolTools.isPointer(symbol) ||
                    SymbolTools.isArray(symbol))) {
                if (!SymbolTools.isArray(symbol)) {
                    uses.add(MemorySymbol.UNKNOWN);
                }
                uses.addAll(model.getTargets(symbol));
            }
        }
        ModRefAnalysis.Summary summary = model.getSummary(call);
        if (summary != null) {
            uses.addAll(summary.getRef());
            if (summary.readsMemory()) {
                uses.add(MemorySymbol.UNKNOWN);
                uses.addAll(model.getAliasableSymbols());
            }
        }
    }

    // Checks if the expression is the target of a plain assignment, or the
    // array name of such a target, so its old value is not read.
    private static boolean isWrittenOnly(Expression e) {
        Traversable parent = e.getParent();
        if (parent instanceof AssignmentExpression) {
            AssignmentExpression ae = (AssignmentExpression)parent;
            return (ae.getLHS() == e &&
                    ae.getOperator() == AssignmentOperator.NORMAL);
        }
        if (parent instanceof ArrayAccess && e instanceof Identifier) {
            ArrayAccess aa = (ArrayAccess)parent;
            return (aa.getArrayName() == e && isWrittenOnly(aa));
        }
        return false;
    }
}
