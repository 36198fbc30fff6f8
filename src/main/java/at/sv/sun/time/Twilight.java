package at.sv.sun.time;

import java.util.Locale;

/**
 * Commonly used zenith angles for rise and set.
 */
public enum Twilight {
    /**
     * The visible sunrise and sunset, accounting for atmospheric refraction and the apparent solar disk radius.
     */
    CIVIL(90.83333),
    NAUTICAL(96.0),
    ASTRONOMICAL(108.0);

    private final double zenith;

    Twilight(double zenith) {
        this.zenith = zenith;
    }

    public double getZenith() {
        return zenith;
    }

    public static Twilight fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ENGLISH)) {
            case "civil", "official" -> CIVIL;
            case "nautical" -> NAUTICAL;
            case "astronomical" -> ASTRONOMICAL;
            default -> null;
        };
    }
}
