package screennav.device;

import java.util.List;
import java.util.Optional;

/** Hands out drivers by device serial. Discovery and transport live behind it. */
public interface DeviceRegistry {

    /** Serials of the currently connected devices. */
    List<String> serials();

    Optional<DeviceDriver> find(String serial);
}
