package screennav.service;

import screennav.navigator.NavigationException;

import java.util.List;

/** The app has no signature with the requested screen id. */
public class ScreenNotFoundException extends NavigationException {

    private final List<String> availableScreens;

    public ScreenNotFoundException(String appId, String screenId, List<String> availableScreens) {
        super("Screen '" + screenId + "' not found for app '" + appId + "'");
        this.availableScreens = List.copyOf(availableScreens);
    }

    public List<String> getAvailableScreens() {
        return availableScreens;
    }
}
