package net.pivx.rpc;

/**
 * Owned by the node, tells the dispatcher whether it is
 * running in safe mode, e.g. after detecting a large fork or
 * a clock problem.
 */
public interface SafeModeMonitor {

    /**
     *  @return the reason the node is in safe mode, or null or "" if it is not
     */
    public String getSafeModeWarning();
}
