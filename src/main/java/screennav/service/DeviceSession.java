package screennav.service;

import screennav.detect.ScreenDetector;
import screennav.device.DeviceDriver;
import screennav.navigator.DeviceBusyException;
import screennav.navigator.NavigationException;
import screennav.navigator.Navigator;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Detector, navigator and lock of one device. Every operation that touches
 * the device runs under {@link #withLock}, so a device never serves two
 * navigations at once while different devices run in parallel.
 */
public class DeviceSession {

    private final DeviceDriver   driver;
    private final ScreenDetector detector;
    private final Navigator      navigator;
    private final ReentrantLock  lock = new ReentrantLock(true);

    public DeviceSession(DeviceDriver driver, ScreenDetector detector, Navigator navigator) {
        this.driver    = driver;
        this.detector  = detector;
        this.navigator = navigator;
    }

    /**
     * Runs {@code operation} holding the device lock.
     *
     * @throws DeviceBusyException if the lock is not obtained within {@code timeoutMs}
     */
    public <T> T withLock(long timeoutMs, Supplier<T> operation) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NavigationException("Interrupted while waiting for device " + getSerial(), e);
        }
        if (!acquired) {
            throw new DeviceBusyException(getSerial(), timeoutMs);
        }
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    public String getSerial()           { return driver.getSerial(); }
    public DeviceDriver getDriver()     { return driver; }
    public ScreenDetector getDetector() { return detector; }
    public Navigator getNavigator()     { return navigator; }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
