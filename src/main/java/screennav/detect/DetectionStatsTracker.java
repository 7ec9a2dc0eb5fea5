package screennav.detect;

/** Monotonic detection counters for one device. */
public class DetectionStatsTracker {

    private long   detectionCount;
    private double totalTimeMs;
    private long   unknownCount;

    public synchronized void record(double detectionTimeMs, boolean unknown) {
        detectionCount++;
        totalTimeMs += detectionTimeMs;
        if (unknown) unknownCount++;
    }

    public synchronized DetectionStats snapshot() {
        double avg  = detectionCount > 0 ? totalTimeMs / detectionCount : 0.0;
        double rate = detectionCount > 0 ? (double) unknownCount / detectionCount : 0.0;
        return new DetectionStats(detectionCount, round(avg, 2), unknownCount, round(rate, 3));
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
