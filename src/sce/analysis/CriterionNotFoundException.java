package sce.analysis;

import sce.hir.SourceLocation;

/**
* Thrown when the location of a slicing criterion does not match any
* statement of the procedure.
*/
public class CriterionNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 3491L;

    private final SourceLocation location;

    public CriterionNotFoundException(String procedure,
                                      SourceLocation location) {
        super("no statement at " + location + " in " + procedure);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
