package de.alive.inboxscan.util;

public final class LogUtils {
    public static final String SUCCESS_EMOJI = "✅";
    public static final String ERROR_EMOJI = "❌";
    public static final String WARNING_EMOJI = "⚠️";
    public static final String SEARCH_EMOJI = "🔍";
    public static final String EMAIL_EMOJI = "📧";
    public static final String PROCESS_EMOJI = "⚙️";
    public static final String STOP_EMOJI = "🛑";
    public static final String ROCKET_EMOJI = "🚀";
    public static final String CHART_EMOJI = "📊";
    public static final String LINK_EMOJI = "🔗";
    public static final String SAVE_EMOJI = "💾";
    public static final String SPEED_EMOJI = "🏃";

    private LogUtils() {
    }

    public static String formatProgress(int current, int total, long startTimeMs) {
        if (total == 0) return "[████████████████████] 0/0 (0.0%)";

        double percentage = ((double) current / total) * 100;
        int bars = (int) (percentage / 5);

        String progressBar = String.format("[%s%s] %d/%d (%.1f%%)",
                "█".repeat(Math.max(0, bars)),
                "░".repeat(Math.max(0, 20 - bars)),
                current, total, percentage);

        if (current > 0 && startTimeMs > 0) {
            return String.format("%s %s", progressBar, formatProcessingSpeed(current, startTimeMs));
        }

        return progressBar;
    }

    public static String formatProcessingSpeed(int processed, long startTimeMs) {
        long elapsedMs = System.currentTimeMillis() - startTimeMs;
        if (elapsedMs == 0) return "";

        double emailsPerSecond = (processed * 1000.0) / elapsedMs;
        if (emailsPerSecond < 1) {
            return String.format("%s %.1f/min", SPEED_EMOJI, emailsPerSecond * 60);
        }
        return String.format("%s %.1f/s", SPEED_EMOJI, emailsPerSecond);
    }

    public static String formatDurationMs(long startTimeMs) {
        return formatDuration(System.currentTimeMillis() - startTimeMs);
    }

    public static String formatDuration(long durationMs) {
        long seconds = durationMs / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;

        if (hours > 0) return String.format("%dh %dm %ds", hours, minutes % 60, seconds % 60);
        if (minutes > 0) return String.format("%dm %ds", minutes, seconds % 60);
        return String.format("%ds", seconds);
    }

    public static String maskEmail(String email) {
        if (email == null || !email.contains("@")) return "***";

        String username = email.substring(0, email.lastIndexOf('@'));
        String domain = email.substring(email.lastIndexOf('@') + 1);

        if (username.length() <= 2) {
            return "***@" + domain;
        }
        return username.substring(0, 2) + "***@" + domain;
    }

    public static String truncateText(String text, int maxLength) {
        if (text == null) return "";
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
