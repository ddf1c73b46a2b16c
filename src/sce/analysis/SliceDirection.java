package sce.analysis;

/**
* Direction of a program slice.
*/
public enum SliceDirection {
    /** Statements that can affect the criterion */
    BACKWARD,
    /** Statements the criterion can affect */
    FORWARD
}
