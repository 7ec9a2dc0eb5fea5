package screennav.model;

/** Discriminator of the {@link NavigationAction} variants. */
public enum ActionType {
    PRESS_BACK,
    CLICK_BY_TEXT,
    CLICK_BY_LABEL,
    CLICK_BY_SELECTOR,
    SWIPE,
    WAIT,
    LAUNCH_APP,
    PRESS_KEY,
    ENTER_TEXT
}
