package io.github.shangor.landrop.core.model;

import java.util.Locale;

/**
 * Coarse classification of a peer, derived from the platform tag it announces.
 */
public enum DeviceType {
    DESKTOP,
    MOBILE,
    TABLET;

    public static DeviceType fromPlatform(String platform) {
        if (platform == null || platform.isBlank()) {
            return MOBILE;
        }
        String tag = platform.trim().toLowerCase(Locale.ROOT);
        return switch (tag) {
            case "win32", "darwin", "linux" -> DESKTOP;
            case "ipad" -> TABLET;
            default -> tag.contains("tablet") ? TABLET : MOBILE;
        };
    }
}
