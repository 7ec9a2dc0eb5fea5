package screennav.navigator;

/** Another operation held the device longer than the lock timeout. */
public class DeviceBusyException extends NavigationException {

    public DeviceBusyException(String serial, long waitedMs) {
        super("Device " + serial + " is busy (waited " + waitedMs + " ms)");
    }
}
