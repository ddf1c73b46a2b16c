package sce.transforms;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sce.analysis.AnalysisContext;
import sce.analysis.CallGraph;
import sce.analysis.UnreachableCodeWarning;
import sce.hir.BinaryExpression;
import sce.hir.CompoundStatement;
import sce.hir.DFIterator;
import sce.hir.Declaration;
import sce.hir.DeclarationStatement;
import sce.hir.Expression;
import sce.hir.ExpressionStatement;
import sce.hir.FunctionCall;
import sce.hir.IRTools;
import sce.hir.Identifier;
import sce.hir.IntegerLiteral;
import sce.hir.NameID;
import sce.hir.PointerSpecifier;
import sce.hir.PrintTools;
import sce.hir.Procedure;
import sce.hir.ReturnStatement;
import sce.hir.SourceLocation;
import sce.hir.Specifier;
import sce.hir.Statement;
import sce.hir.Symbol;
import sce.hir.SymbolTools;
import sce.hir.Tools;
import sce.hir.TranslationUnit;
import sce.hir.Traversable;
import sce.hir.VariableDeclaration;
import sce.hir.VariableDeclarator;

/**
* Replaces one function call with a copy of the body of the called function.
*
* <p>The expansion is placed immediately before the statement containing the
* call: a declaration of the result variable, if the value of the call is
* used, followed by a block that holds
* <ul>
* <li>one temporary per parameter, initialized with the arguments in the
*     order they appear,</li>
* <li>a <i>done</i> flag if the function returns from a point that is not its
*     end,</li>
* <li>the renamed and return-normalized body.</li>
* </ul>
* The call is then replaced by the result variable, or the call statement is
* removed if it only consists of the call. The new names follow the scheme
* {@code _<prefix>_<name>} and become {@code _<prefix>_<n>_<name>} when the
* name is already taken.
*
* <p>The input translation unit is never modified; the inliner works on a
* copy that is returned with the result.
*/
public class Inliner {

    private static final String pass_name = "[INLINER]";

    private String param_prefix = "param";

    private String local_prefix = "local";

    private String result_prefix = "result";

    private String done_prefix = "done";

    private int max_name_length = 256;

    private boolean verify = false;

    public Inliner() {
    }

    /**
    * Sets the prefix of the parameter temporaries. The name of the callee is
    * appended to the prefix.
    */
    public void setParamPrefix(String prefix) {
        param_prefix = checkPrefix(prefix);
    }

    /**
    * Sets the prefix of the renamed locals. The name of the callee is
    * appended to the prefix.
    */
    public void setLocalPrefix(String prefix) {
        local_prefix = checkPrefix(prefix);
    }

    /** Sets the prefix of the result variable. */
    public void setResultPrefix(String prefix) {
        result_prefix = checkPrefix(prefix);
    }

    /** Sets the prefix of the done flag. */
    public void setDonePrefix(String prefix) {
        done_prefix = checkPrefix(prefix);
    }

    /**
    * Sets the maximum length of the generated names.
    *
    * @throws IllegalArgumentException if the length is less than 16.
    */
    public void setMaxNameLength(int length) {
        if (length < 16) {
            throw new IllegalArgumentException(
                    "maximum name length must be at least 16");
        }
        max_name_length = length;
    }

    /**
    * Enables the consistency check of the rewritten caller.
    */
    public void setVerify(boolean verify) {
        this.verify = verify;
    }

    private static String checkPrefix(String prefix) {
        if (prefix == null || !prefix.matches("[A-Za-z0-9_]+")) {
            throw new IllegalArgumentException("invalid prefix: " + prefix);
        }
        return prefix;
    }

    /**
    * Inlines the call described by the request.
    *
    * @param unit the translation unit, which is not modified.
    * @param spec the inlining request.
    * @return the rewritten copy of the unit and the placement of the
    *   inlined code.
    * @throws UnknownFunctionException if the unit has no definition of the
    *   called function.
    * @throws RecursiveInlineException if the called function is recursive
    *   or calls the caller.
    * @throws RangeMismatchException if the inlined code does not occupy the
    *   expected range.
    * @throws InlineException if the call cannot be found or cannot be
    *   inlined.
    */
    public InlineResult inline(TranslationUnit unit, InlineSpec spec) {
        double timer = Tools.getTime();
        PrintTools.printlnStatus(1, pass_name, "begin", spec);
        TranslationUnit tu = unit.clone();
        String callee_name = spec.getCalleeName();
        Procedure callee = tu.findProcedure(callee_name);
        if (callee == null || callee.getBody() == null) {
            throw new UnknownFunctionException(callee_name);
        }
        FunctionCall call = findCall(tu, spec.getCallSite(), callee_name);
        if (call == null) {
            throw new InlineException(
                    "call site not found at " + spec.getCallSite());
        }
        if (!callee_name.equals(call.getFunctionName())) {
            throw new InlineException("call site not found: the call at " +
                    spec.getCallSite() + " is to " + call.getFunctionName());
        }
        Statement call_stmt = call.getStatement();
        Procedure caller = call_stmt.getProcedure();
        checkContext(call, call_stmt);
        CallGraph cg = new CallGraph(tu);
        if (cg.isRecursive(callee) || cg.reaches(callee, caller)) {
            throw new RecursiveInlineException(callee_name,
                                               caller.getSymbolName());
        }
        checkCallee(callee, call, call_stmt);
        boolean value_used = !(call_stmt instanceof ExpressionStatement &&
                ((ExpressionStatement)call_stmt).getExpression() == call);
        if (callee.isVoid() && value_used) {
            throw new InlineException("the value of void function " +
                    callee_name + " is used at " + spec.getCallSite());
        }

        List<UnreachableCodeWarning> warnings =
                AnalysisContext.build(callee).getWarnings();
        Set<String> used = getUsedNames(tu, caller, callee);

        // Result variable
        VariableDeclarator result_var = null;
        DeclarationStatement result_stmt = null;
        if (value_used) {
            List<Specifier> specs = new ArrayList<Specifier>();
            List<Specifier> pointers = new ArrayList<Specifier>();
            for (Specifier s : callee.getReturnType()) {
                if (s instanceof PointerSpecifier) {
                    pointers.add(s);
                } else if (s != Specifier.STATIC && s != Specifier.EXTERN) {
                    specs.add(s);
                }
            }
            result_var = new VariableDeclarator(pointers,
                    getUniqueName(used, result_prefix, callee_name),
                    new ArrayList<Specifier>(0));
            result_stmt = new DeclarationStatement(
                    new VariableDeclaration(specs, result_var));
        }

        CompoundStatement body = callee.getBody().clone();
        CompoundStatement block = new CompoundStatement();
        Map<Symbol, Symbol> param_map = new IdentityHashMap<Symbol, Symbol>();
        for (int i = 0; i < callee.getNumParameters(); i++) {
            VariableDeclarator param = callee.getParameter(i);
            block.addStatement(bindParameter(callee_name, param,
                    call.getArgument(i), used, param_map));
        }
        SymbolTools.relinkSymbols(body, param_map);
        for (Symbol local : SymbolTools.getLocalSymbols(body)) {
            local.setName(getUniqueName(used,
                    local_prefix + "_" + callee_name, local.getSymbolName()));
        }
        DFIterator<CompoundStatement> iter =
                new DFIterator<CompoundStatement>(body, CompoundStatement.class);
        while (iter.hasNext()) {
            iter.next().rehashSymbols();
        }
        VariableDeclarator done = null;
        if (ReturnNormalizer.needsDoneFlag(body)) {
            done = new VariableDeclarator(
                    getUniqueName(used, done_prefix, callee_name));
            done.setInitializer(new IntegerLiteral(0));
            block.addStatement(new DeclarationStatement(
                    new VariableDeclaration(Specifier.INT, done)));
        }
        new ReturnNormalizer(body, result_var, done).normalize();
        for (Statement stmt : body.getStatements()) {
            body.removeStatement(stmt);
            block.addStatement(stmt);
        }

        // Placement
        SourceLocation stmt_loc = call_stmt.getLocation();
        if (stmt_loc == null) {
            stmt_loc = spec.getCallSite();
        }
        LocationAllocator allocator = new LocationAllocator(
                stmt_loc.getLine(), stmt_loc.getColumn());
        if (result_stmt != null) {
            allocator.allocate(result_stmt);
        }
        allocator.allocate(block);
        int min_line = allocator.getFirstLine();
        int max_line = allocator.getLastLine();
        if (spec.hasExpectedRange() &&
                (spec.getExpectedStart().getLine() != min_line ||
                 spec.getExpectedEnd().getLine() != max_line)) {
            throw new RangeMismatchException(
                    spec.getExpectedStart().getLine(),
                    spec.getExpectedEnd().getLine(), min_line, max_line);
        }
        shiftLocations(tu, min_line, allocator.getLineCount());

        CompoundStatement parent = (CompoundStatement)call_stmt.getParent();
        if (result_stmt != null) {
            clearLocations(result_stmt);
            parent.addStatementBefore(call_stmt, result_stmt);
        }
        clearLocations(block);
        parent.addStatementBefore(call_stmt, block);
        if (value_used) {
            IRTools.replaceExpression(call, new Identifier(result_var));
        } else {
            parent.removeStatement(call_stmt);
        }
        allocator.apply();

        if (verify) {
            caller.getBody().verify();
        }
        for (UnreachableCodeWarning warning : warnings) {
            PrintTools.printlnStatus(0, warning);
        }
        PrintTools.printlnStatus(2, pass_name, callee_name, "into",
                caller.getSymbolName(), "at lines", min_line, "-", max_line);
        PrintTools.printlnStatus(1, pass_name, "end in",
                String.format("%.2f seconds", Tools.getTime(timer)));
        return new InlineResult(tu, caller, block, result_var,
                allocator.getLocations(), min_line, max_line, warnings);
    }

    /**
    * Finds the call at the location: a call located there or whose name is
    * located there, or else a call within the innermost statement located
    * there, preferring one to the named function.
    */
    private static FunctionCall
            findCall(TranslationUnit tu, SourceLocation loc, String name) {
        Statement found = null;
        for (Procedure proc : tu.getProcedures()) {
            DFIterator<Traversable> iter =
                    new DFIterator<Traversable>(proc.getBody());
            while (iter.hasNext()) {
                Traversable t = iter.next();
                if (t instanceof FunctionCall) {
                    FunctionCall call = (FunctionCall)t;
                    if (loc.equals(call.getLocation()) ||
                            loc.equals(call.getName().getLocation())) {
                        return call;
                    }
                } else if (t instanceof Statement &&
                        !(t instanceof CompoundStatement) &&
                        loc.equals(((Statement)t).getLocation())) {
                    found = (Statement)t;
                }
            }
        }
        if (found == null) {
            return null;
        }
        FunctionCall ret = null;
        for (FunctionCall call : IRTools.getFunctionCalls(found)) {
            if (call.getStatement() != found) {
                continue;
            }
            if (name.equals(call.getFunctionName())) {
                return call;
            } else if (ret == null) {
                ret = call;
            }
        }
        return ret;
    }

    // Checks that the expansion can be placed before the call statement
    // without changing when the call is evaluated.
    private static void checkContext(FunctionCall call, Statement call_stmt) {
        if (!(call_stmt instanceof ExpressionStatement ||
                call_stmt instanceof DeclarationStatement ||
                call_stmt instanceof ReturnStatement) ||
                !(call_stmt.getParent() instanceof CompoundStatement)) {
            throw new InlineException("unsupported call context at " +
                    call.getLocation() + ": " + call_stmt);
        }
        Traversable t = call.getParent();
        while (t != call_stmt) {
            if (t instanceof BinaryExpression &&
                    ((BinaryExpression)t).getOperator().isShortCircuit()) {
                throw new InlineException(
                        "call under a short-circuit operator: " + t);
            }
            if (t instanceof VariableDeclarator) {
                checkDeclarator((VariableDeclarator)t, call);
            }
            t = t.getParent();
        }
    }

    // The expansion is evaluated before the whole declaration, so earlier
    // declarators must neither be initialized nor be referenced by the call.
    private static void
            checkDeclarator(VariableDeclarator declarator, FunctionCall call) {
        Declaration decl = declarator.getDeclaration();
        Set<Symbol> accessed = SymbolTools.getAccessedSymbols(call);
        for (Traversable child : decl.getChildren()) {
            if (child == declarator) {
                break;
            }
            VariableDeclarator other = (VariableDeclarator)child;
            if (other.getInitializer() != null || accessed.contains(other)) {
                throw new InlineException("call in declaration " + decl +
                        " depends on an earlier declarator");
            }
        }
    }

    private static void checkCallee(Procedure callee, FunctionCall call,
                                    Statement call_stmt) {
        String name = callee.getSymbolName();
        if (call.getNumArguments() != callee.getNumParameters()) {
            throw new InlineException("call to " + name + " passes " +
                    call.getNumArguments() + " arguments for " +
                    callee.getNumParameters() + " parameters");
        }
        Set<Symbol> locals = SymbolTools.getLocalSymbols(callee);
        for (Symbol local : locals) {
            if (SymbolTools.isStatic(local)) {
                throw new InlineException(name + " declares static variable " +
                        local.getSymbolName());
            }
        }
        for (int i = 0; i < callee.getNumParameters(); i++) {
            if (callee.getParameter(i).getArraySpecifiers().size() > 1) {
                throw new InlineException(name +
                        " has a multi-dimensional array parameter");
            }
        }
        // Names of the callee that refer outside of it must keep their
        // meaning at the call site.
        for (Symbol symbol :
                SymbolTools.getAccessedSymbols(callee.getBody())) {
            if (locals.contains(symbol)) {
                continue;
            }
            Symbol visible =
                    SymbolTools.findSymbol(call_stmt, symbol.getSymbolName());
            if (visible != symbol) {
                throw new InlineException(symbol.getSymbolName() +
                        " used by " + name + " is shadowed at the call site");
            }
        }
    }

    /**
    * Collects the names that a generated name must not take: the names
    * declared in the caller, the globals of the unit, and every name that
    * appears in the callee.
    */
    private static Set<String>
            getUsedNames(TranslationUnit tu, Procedure caller, Procedure callee) {
        Set<String> ret = new HashSet<String>();
        for (Symbol symbol : tu.getSymbols()) {
            ret.add(symbol.getSymbolName());
        }
        for (Procedure proc : new Procedure[] {caller, callee}) {
            for (Symbol symbol : SymbolTools.getLocalSymbols(proc)) {
                ret.add(symbol.getSymbolName());
            }
            for (Symbol symbol : SymbolTools.getAccessedSymbols(proc)) {
                ret.add(symbol.getSymbolName());
            }
            DFIterator<NameID> iter = new DFIterator<NameID>(proc, NameID.class);
            while (iter.hasNext()) {
                ret.add(iter.next().getName());
            }
        }
        return ret;
    }

    /**
    * Declares the temporary that replaces a parameter, initialized with the
    * argument. An array parameter becomes a pointer.
    */
    private DeclarationStatement bindParameter(String callee_name,
            VariableDeclarator param, Expression arg, Set<String> used,
            Map<Symbol, Symbol> param_map) {
        List<Specifier> leading =
                new ArrayList<Specifier>(param.getLeadingSpecifiers());
        if (SymbolTools.isArray(param)) {
            leading.add(PointerSpecifier.UNQUALIFIED);
        }
        VariableDeclarator temp = new VariableDeclarator(leading,
                getUniqueName(used, param_prefix + "_" + callee_name,
                              param.getSymbolName()),
                new ArrayList<Specifier>(0));
        temp.setInitializer(arg.clone());
        param_map.put(param, temp);
        List<Specifier> specs =
                ((VariableDeclaration)param.getDeclaration()).getSpecifiers();
        return new DeclarationStatement(new VariableDeclaration(specs, temp));
    }

    /**
    * Returns {@code _prefix_suffix}, or {@code _prefix_n_suffix} with the
    * smallest n from 2 that gives an unused name, and records it as used.
    */
    private String getUniqueName(Set<String> used, String prefix,
                                 String suffix) {
        int i = 1;
        String name = adjustLength("_" + prefix + "_" + suffix);
        while (used.contains(name)) {
            name = adjustLength("_" + prefix + "_" + (++i) + "_" + suffix);
        }
        used.add(name);
        return name;
    }

    /**
    * Keeps a name shorter than the maximum length. A long name loses its
    * leading non-letters and gets the prefix {@code _t_}; if it is still too
    * long, its head is kept and a hash of the full name is appended.
    */
    private String adjustLength(String name) {
        if (name.length() < max_name_length) {
            return name;
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isLetter(name.charAt(i))) {
                String temp = name.substring(i);
                if (temp.length() + 3 < max_name_length) {
                    return "_t_" + temp;
                }
                break;
            }
        }
        return name.substring(0, max_name_length / 2) + "_" +
                Integer.toHexString(name.hashCode());
    }

    /**
    * Moves every located node of the unit at or after the line down by the
    * number of lines.
    */
    private static void shiftLocations(TranslationUnit tu, int line,
                                       int lines) {
        DFIterator<Traversable> iter = new DFIterator<Traversable>(tu);
        while (iter.hasNext()) {
            Traversable t = iter.next();
            if (t instanceof Statement) {
                Statement stmt = (Statement)t;
                stmt.setLocation(shift(stmt.getLocation(), line, lines));
            } else if (t instanceof Expression) {
                Expression expr = (Expression)t;
                expr.setLocation(shift(expr.getLocation(), line, lines));
            } else if (t instanceof VariableDeclarator) {
                VariableDeclarator vd = (VariableDeclarator)t;
                vd.setLocation(shift(vd.getLocation(), line, lines));
            } else if (t instanceof Declaration) {
                Declaration decl = (Declaration)t;
                decl.setLocation(shift(decl.getLocation(), line, lines));
            }
        }
    }

    private static SourceLocation shift(SourceLocation loc, int line,
                                        int lines) {
        if (loc == null || loc.getLine() < line) {
            return loc;
        }
        return loc.shift(lines);
    }

    // Introduced code only has the statement locations it is given.
    private static void clearLocations(Statement stmt) {
        DFIterator<Traversable> iter = new DFIterator<Traversable>(stmt);
        while (iter.hasNext()) {
            Traversable t = iter.next();
            if (t instanceof Statement) {
                ((Statement)t).setLocation(null);
            } else if (t instanceof Expression) {
                ((Expression)t).setLocation(null);
            } else if (t instanceof VariableDeclarator) {
                ((VariableDeclarator)t).setLocation(null);
            } else if (t instanceof Declaration) {
                ((Declaration)t).setLocation(null);
            }
        }
    }
}
