package screennav.navigator;

/**
 * Unchecked exception for configuration and usage errors: missing config,
 * unknown device or app, a device busy beyond the lock timeout.
 * Expected navigation outcomes (unknown screen, no path) are results, not exceptions.
 */
public class NavigationException extends RuntimeException {

    public NavigationException(String msg) {
        super(msg);
    }

    public NavigationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
