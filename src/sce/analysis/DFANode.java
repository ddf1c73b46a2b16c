package sce.analysis;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import sce.hir.PrintTools;

/**
 * A graph node carrying named attributes. The CFG stores the statement a node
 * stands for under "stmt", a debugging tag under "tag", and for two-way
 * branches the first node of each arm under "true" and "false". Edges are
 * kept on both ends in insertion order; nodes compare by identity.
 */
public class DFANode {

    private final Map<String, Object> data;

    private final Set<DFANode> preds;

    private final Set<DFANode> succs;

    public DFANode() {
        data = new HashMap<String, Object>(4);
        preds = new LinkedHashSet<DFANode>(2);
        succs = new LinkedHashSet<DFANode>(2);
    }

    public DFANode(String key, Object value) {
        this();
        data.put(key, value);
    }

    /**
     * Returns the attribute stored under <b>key</b>, or null. The caller
     * picks the type; a mismatch shows up as a ClassCastException at the
     * call site.
     */
    @SuppressWarnings("unchecked")
    public <T> T getData(String key) {
        return (T)data.get(key);
    }

    public void putData(String key, Object value) {
        data.put(key, value);
    }

    public Set<DFANode> getSuccs() {
        return succs;
    }

    public Set<DFANode> getPreds() {
        return preds;
    }

    void addPred(DFANode pred) {
        preds.add(pred);
    }

    void addSucc(DFANode succ) {
        succs.add(succ);
    }

    void removePred(DFANode pred) {
        preds.remove(pred);
    }

    void removeSucc(DFANode succ) {
        succs.remove(succ);
    }

    /** Checks if both branch targets are recorded. */
    public boolean isPredicate() {
        return data.get("true") != null && data.get("false") != null;
    }

    @Override
    public String toString() {
        String sep = PrintTools.line_sep;
        StringBuilder sb = new StringBuilder(80);
        sb.append("node ").append(System.identityHashCode(this)).append(sep);
        for (Map.Entry<String, Object> e : data.entrySet()) {
            Object value = e.getValue();
            if (value instanceof DFANode) {
                value = "node " + System.identityHashCode(value);
            }
            sb.append("  ").append(e.getKey()).append(" = ").append(value);
            sb.append(sep);
        }
        sb.append("  ->");
        for (DFANode succ : succs) {
            sb.append(" ").append(System.identityHashCode(succ));
        }
        return sb.toString();
    }

    /**
     * Returns the dot attribute list labeling this node with up to
     * <b>num</b> of the attributes named in the comma-separated <b>keys</b>.
     */
    public String toDot(String keys, int num) {
        StringBuilder label = new StringBuilder();
        int found = 0;
        for (String key : keys.split(",")) {
            Object value = data.get(key);
            if (value == null) {
                continue;
            }
            label.append(value).append("\\n");
            if (++found == num) {
                break;
            }
        }
        return "[label=\"" + label.toString().replace("\"", "\\\"") + "\"]";
    }
}
