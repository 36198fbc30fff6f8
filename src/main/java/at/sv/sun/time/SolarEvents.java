package at.sv.sun.time;

import java.time.LocalDateTime;

/**
 * Local civil sunrise and sunset of a single date, with minute resolution.
 */
public record SolarEvents(LocalDateTime sunrise, LocalDateTime sunset) {

    public static SolarEvents of(LocalDateTime sunrise, LocalDateTime sunset) {
        return new SolarEvents(sunrise, sunset);
    }

    @Override
    public String toString() {
        return "[sunrise=" + sunrise + ",sunset=" + sunset + ']';
    }
}
