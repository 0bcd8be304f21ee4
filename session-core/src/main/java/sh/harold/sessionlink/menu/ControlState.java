package sh.harold.sessionlink.menu;

/**
 * Enablement of the menu's host and join controls.
 */
public final class ControlState {

    private volatile boolean hostEnabled = true;
    private volatile boolean joinEnabled = true;

    public boolean isHostEnabled() {
        return hostEnabled;
    }

    public boolean isJoinEnabled() {
        return joinEnabled;
    }

    void setHostEnabled(boolean hostEnabled) {
        this.hostEnabled = hostEnabled;
    }

    void setJoinEnabled(boolean joinEnabled) {
        this.joinEnabled = joinEnabled;
    }

    @Override
    public String toString() {
        return "ControlState{host=" + hostEnabled + ", join=" + joinEnabled + '}';
    }
}
