package screennav.service;

import screennav.navigator.NavigationException;

/** No connected device has the requested serial. */
public class DeviceNotFoundException extends NavigationException {

    public DeviceNotFoundException(String serial) {
        super("Device not found: " + serial);
    }
}
