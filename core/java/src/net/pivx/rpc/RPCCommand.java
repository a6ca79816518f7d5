package net.pivx.rpc;

/**
 * One entry in the dispatch table. Immutable.
 */
public class RPCCommand {

    /** Commands in this category are left out of the help listing */
    public static final String CATEGORY_HIDDEN = "hidden";

    private final String _category;
    private final String _name;
    private final RPCActor _actor;
    private final boolean _okSafeMode;

    /**
     *  @param category help grouping, e.g. "control", "masternode"
     *  @param name dispatch key
     *  @param actor non-null
     *  @param okSafeMode may this run while the node is in safe mode
     */
    public RPCCommand(String category, String name, RPCActor actor, boolean okSafeMode) {
        if (category == null || name == null || actor == null)
            throw new IllegalArgumentException();
        _category = category;
        _name = name;
        _actor = actor;
        _okSafeMode = okSafeMode;
    }

    public String getCategory() {
        return _category;
    }

    public String getName() {
        return _name;
    }

    public RPCActor getActor() {
        return _actor;
    }

    public boolean isOkSafeMode() {
        return _okSafeMode;
    }

    @Override
    public String toString() {
        return _category + '/' + _name + (_okSafeMode ? "" : " (unsafe)");
    }
}
