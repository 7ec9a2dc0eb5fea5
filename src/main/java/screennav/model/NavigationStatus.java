package screennav.model;

public enum NavigationStatus {
    SUCCESS,
    ALREADY_THERE,
    FAILED,
    NO_PATH
}
