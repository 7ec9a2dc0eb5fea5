package screennav.device;

/** The device disconnected or stopped responding. Never retried. */
public class DeviceUnavailableException extends DriverException {

    public DeviceUnavailableException(String msg) {
        super(msg);
    }

    public DeviceUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
