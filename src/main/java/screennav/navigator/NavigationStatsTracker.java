package screennav.navigator;

/**
 * Monotonic navigation counters for one device. Average time is taken over
 * successful navigations only.
 */
public class NavigationStatsTracker {

    private long   totalNavigations;
    private long   successfulNavigations;
    private long   totalStepsExecuted;
    private double totalSuccessSeconds;

    public synchronized void recordNavigation(boolean success, double elapsedSeconds) {
        totalNavigations++;
        if (success) {
            successfulNavigations++;
            totalSuccessSeconds += elapsedSeconds;
        }
    }

    public synchronized void recordStep() {
        totalStepsExecuted++;
    }

    public synchronized NavigationStats snapshot(int graphSize) {
        double rate = totalNavigations > 0 ? (double) successfulNavigations / totalNavigations : 0.0;
        double avg  = successfulNavigations > 0 ? totalSuccessSeconds / successfulNavigations : 0.0;
        return new NavigationStats(totalNavigations, successfulNavigations, round(rate, 3),
                totalStepsExecuted, round(avg, 2), graphSize);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
