package screennav.device;

/**
 * Checked exception raised by a {@link DeviceDriver} when a dump or an action
 * fails. Action failures are recoverable: the navigator verifies the screen
 * and re-plans.
 */
public class DriverException extends Exception {

    public DriverException(String msg) {
        super(msg);
    }

    public DriverException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
