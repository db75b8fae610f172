package com.ttennebkram.fftmixer.util;

import org.opencv.core.Mat;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks OpenCV Mats that cross thread boundaries (job snapshots and mix results)
 * so native memory leaks show up as a non-zero active count.
 *
 * Usage:
 * 1. MatTracker.track(mat) after creating a Mat that outlives the current method
 * 2. MatTracker.release(mat) instead of mat.release()
 * 3. MatTracker.dumpLeaksByLocation() to see where unreleased Mats came from
 */
public class MatTracker {

    private static volatile boolean enabled = true;
    private static final Map<Long, MatInfo> activeMats = new ConcurrentHashMap<>();
    private static final AtomicLong totalCreated = new AtomicLong(0);
    private static final AtomicLong totalReleased = new AtomicLong(0);

    private MatTracker() {
    }

    /**
     * Info about a tracked Mat.
     */
    private static class MatInfo {
        final String shortLocation;

        MatInfo() {
            this.shortLocation = callerLocation();
        }

        private static String callerLocation() {
            for (StackTraceElement element : Thread.currentThread().getStackTrace()) {
                String className = element.getClassName();
                if (className.equals("java.lang.Thread") || className.equals(MatTracker.class.getName())
                    || className.startsWith(MatTracker.class.getName() + "$")) {
                    continue;
                }
                return element.getFileName() + ":" + element.getLineNumber();
            }
            return "unknown";
        }
    }

    public static void setEnabled(boolean enable) {
        enabled = enable;
    }

    public static boolean isEnabled() {
        return enabled;
    }

    /**
     * Track an existing Mat. Returns the same Mat for chaining.
     */
    public static Mat track(Mat mat) {
        if (!enabled || mat == null) return mat;

        totalCreated.incrementAndGet();
        activeMats.put(mat.getNativeObjAddr(), new MatInfo());
        return mat;
    }

    /**
     * Release a Mat and remove it from tracking. Null is ignored.
     */
    public static void release(Mat mat) {
        if (mat == null) return;

        if (activeMats.remove(mat.getNativeObjAddr()) != null) {
            totalReleased.incrementAndGet();
        }
        mat.release();
    }

    /**
     * Get count of currently active (unreleased) tracked Mats.
     */
    public static int getActiveCount() {
        return activeMats.size();
    }

    public static long getTotalCreated() {
        return totalCreated.get();
    }

    public static long getTotalReleased() {
        return totalReleased.get();
    }

    public static void printSummary(PrintStream out) {
        out.printf("[MatTracker] Created: %d, Released: %d, Active: %d%n",
            totalCreated.get(), totalReleased.get(), activeMats.size());
    }

    public static void dumpLeaksByLocation() {
        dumpLeaksByLocation(System.out);
    }

    /**
     * Dump active Mats grouped by the location that tracked them.
     */
    public static void dumpLeaksByLocation(PrintStream out) {
        if (activeMats.isEmpty()) {
            out.println("[MatTracker] No active Mats (no leaks detected)");
            return;
        }

        Map<String, AtomicLong> locationCounts = new ConcurrentHashMap<>();
        for (MatInfo info : activeMats.values()) {
            locationCounts.computeIfAbsent(info.shortLocation, k -> new AtomicLong(0))
                .incrementAndGet();
        }

        out.printf("[MatTracker] === LEAKS BY LOCATION (%d total) ===%n", activeMats.size());
        locationCounts.entrySet().stream()
            .sorted((a, b) -> Long.compare(b.getValue().get(), a.getValue().get()))
            .forEach(e -> out.printf("  %5d : %s%n", e.getValue().get(), e.getKey()));
        out.println("[MatTracker] === END ===");
    }

    /**
     * Clear all tracking data and reset counters.
     */
    public static void reset() {
        activeMats.clear();
        totalCreated.set(0);
        totalReleased.set(0);
    }
}
