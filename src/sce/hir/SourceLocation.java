package sce.hir;

/**
* <b>SourceLocation</b> is the 1-based (line, column) position attached to a
* statement or expression by the front end. Locations are ordered
* lexicographically, first by line and then by column.
*/
public final class SourceLocation implements Comparable<SourceLocation> {

    private final int line;

    private final int column;

    /**
    * Constructs a location.
    *
    * @param line the 1-based line number.
    * @param column the 1-based column number.
    * @throws IllegalArgumentException if either value is less than 1.
    */
    public SourceLocation(int line, int column) {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException(
                    "invalid source location " + line + ":" + column);
        }
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
    * Returns a location moved down by the given number of lines, keeping the
    * column.
    *
    * @param lines the number of lines to shift by.
    * @return the shifted location.
    */
    public SourceLocation shift(int lines) {
        return new SourceLocation(line + lines, column);
    }

    public int compareTo(SourceLocation other) {
        if (line != other.line) {
            return (line < other.line) ? -1 : 1;
        }
        if (column != other.column) {
            return (column < other.column) ? -1 : 1;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation)o;
        return (line == other.line && column == other.column);
    }

    @Override
    public int hashCode() {
        return 31 * line + column;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
