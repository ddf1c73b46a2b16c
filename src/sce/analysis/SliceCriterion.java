package sce.analysis;

import sce.hir.SourceLocation;
import sce.hir.Symbol;

/**
* The point and the variable a slice is computed for. The variable is
* optional; without one, the criterion stands for every variable live at the
* point. The variable is given either as a symbol or as a name looked up in
* the scope of the criterion statement.
*/
public final class SliceCriterion {

    private final SourceLocation location;

    private final Symbol variable;

    private final String variable_name;

    private final SliceDirection direction;

    /** Creates a backward criterion for the live variables at a point. */
    public SliceCriterion(SourceLocation location) {
        this(location, null, null, SliceDirection.BACKWARD);
    }

    /** Creates a backward criterion for a variable at a point. */
    public SliceCriterion(SourceLocation location, Symbol variable) {
        this(location, variable, null, SliceDirection.BACKWARD);
    }

    /** Creates a backward criterion for a named variable at a point. */
    public SliceCriterion(SourceLocation location, String variable_name) {
        this(location, null, variable_name, SliceDirection.BACKWARD);
    }

    private SliceCriterion(SourceLocation location, Symbol variable,
                           String variable_name, SliceDirection direction) {
        if (location == null || direction == null) {
            throw new IllegalArgumentException();
        }
        this.location = location;
        this.variable = variable;
        this.variable_name = (variable == null) ? variable_name :
                variable.getSymbolName();
        this.direction = direction;
    }

    /**
    * Returns a copy of this criterion with a different direction.
    */
    public SliceCriterion withDirection(SliceDirection direction) {
        return new SliceCriterion(location, variable, variable_name,
                                  direction);
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Returns the variable symbol, or null if given by name or absent. */
    public Symbol getVariable() {
        return variable;
    }

    /** Returns the variable name, or null if no variable is given. */
    public String getVariableName() {
        return variable_name;
    }

    public boolean hasVariable() {
        return (variable_name != null);
    }

    public SliceDirection getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return "<" + location + ", " +
                ((variable_name == null) ? "*" : variable_name) + ", " +
                direction + ">";
    }
}
