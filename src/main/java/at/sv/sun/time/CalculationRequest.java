package at.sv.sun.time;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable input of a sunrise/sunset calculation. All values are validated on construction.
 *
 * @param date      the calendar date, only its day of year is relevant
 * @param location  the geographic position
 * @param utcOffset the offset of the local civil time to UTC in hours, within [-12, 14]
 * @param zenith    the angle from vertical in degrees at which the sun is considered to rise or set
 */
public record CalculationRequest(LocalDate date, Location location, double utcOffset, double zenith) {

    public static final double MIN_UTC_OFFSET = -12;
    public static final double MAX_UTC_OFFSET = 14;

    public CalculationRequest {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(location, "location");
        if (!(utcOffset >= MIN_UTC_OFFSET && utcOffset <= MAX_UTC_OFFSET)) {
            throw new InvalidCalculationRequest("Invalid UTC offset '" + utcOffset + "'. Must be between "
                                                + MIN_UTC_OFFSET + " and " + MAX_UTC_OFFSET + " hours.");
        }
        if (!(zenith > 0 && zenith < 180)) {
            throw new InvalidCalculationRequest("Invalid zenith '" + zenith + "'. Must be between 0 and 180 degrees (exclusive).");
        }
    }

    public static CalculationRequest of(LocalDate date, double latitude, double longitude, double utcOffset) {
        return of(date, latitude, longitude, utcOffset, Twilight.CIVIL.getZenith());
    }

    public static CalculationRequest of(LocalDate date, double latitude, double longitude, double utcOffset,
                                        double zenith) {
        return new CalculationRequest(date, Location.of(latitude, longitude), utcOffset, zenith);
    }

    public CalculationRequest withDate(LocalDate date) {
        return new CalculationRequest(date, location, utcOffset, zenith);
    }

    public CalculationRequest withUtcOffset(double utcOffset) {
        return new CalculationRequest(date, location, utcOffset, zenith);
    }

    public CalculationRequest withZenith(double zenith) {
        return new CalculationRequest(date, location, utcOffset, zenith);
    }

    public double latitude() {
        return location.latitude();
    }

    public double longitude() {
        return location.longitude();
    }
}
