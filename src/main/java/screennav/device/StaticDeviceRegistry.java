package screennav.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DeviceRegistry} over a fixed, caller-managed set of drivers.
 * Used by the CLI and by tests; a real deployment plugs in its own registry.
 */
public class StaticDeviceRegistry implements DeviceRegistry {

    private static final Logger log = LoggerFactory.getLogger(StaticDeviceRegistry.class);

    private final Map<String, DeviceDriver> drivers = new ConcurrentHashMap<>();

    public StaticDeviceRegistry() {}

    public StaticDeviceRegistry(List<DeviceDriver> initial) {
        initial.forEach(this::add);
    }

    public void add(DeviceDriver driver) {
        drivers.put(driver.getSerial(), driver);
        log.info("Device registered: {}", driver.getSerial());
    }

    public void remove(String serial) {
        if (drivers.remove(serial) != null) {
            log.info("Device removed: {}", serial);
        }
    }

    @Override
    public List<String> serials() {
        return drivers.keySet().stream().sorted().toList();
    }

    @Override
    public Optional<DeviceDriver> find(String serial) {
        return Optional.ofNullable(drivers.get(serial));
    }
}
