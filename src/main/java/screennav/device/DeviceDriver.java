package screennav.device;

import screennav.model.NavigationAction;
import screennav.model.UiNode;

/**
 * Connection to one physical or emulated device.
 *
 * <p>Implementations wrap the transport (ADB, uiautomator2, a recorded dump
 * file). A driver is used by at most one navigation at a time; callers
 * serialise access per serial.
 */
public interface DeviceDriver {

    String getSerial();

    /**
     * Captures the current UI hierarchy.
     *
     * @throws DeviceUnavailableException if the device is gone
     * @throws DriverException            if the dump could not be produced
     */
    UiNode dumpUiTree() throws DriverException;

    /**
     * Performs one primitive action. Settle delays ({@code waitAfterSeconds})
     * are applied by the caller, not the driver.
     *
     * @throws DeviceUnavailableException if the device is gone
     * @throws DriverException            if the action failed (element missing, etc.)
     */
    void execute(NavigationAction action) throws DriverException;
}
