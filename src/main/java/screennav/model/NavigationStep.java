package screennav.model;

/** One planned hop of a {@link NavigationPath}. */
public record NavigationStep(String fromScreen, String toScreen, NavigationEdge edge) {

    /** {@code "from → to"}, the form used in path summaries. */
    public String summary() {
        return fromScreen + " → " + toScreen;
    }
}
