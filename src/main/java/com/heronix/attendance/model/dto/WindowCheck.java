package com.heronix.attendance.model.dto;

/**
 * Result of checking the current time against a period's attendance window.
 *
 * @param allowed          whether a session may be opened now
 * @param reason           explanation when denied, null when allowed
 * @param minutesUntilOpen minutes until the window opens, only set while it is not open yet
 */
public record WindowCheck(
        boolean allowed,
        String reason,
        Long minutesUntilOpen
) {
    public static WindowCheck open() {
        return new WindowCheck(true, null, null);
    }

    public static WindowCheck notYetOpen(String reason, long minutesUntilOpen) {
        return new WindowCheck(false, reason, minutesUntilOpen);
    }

    public static WindowCheck closed(String reason) {
        return new WindowCheck(false, reason, null);
    }
}
