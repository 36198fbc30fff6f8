package at.sv.sun.time;

/**
 * A geographic position in degrees. Latitude must be within [-90, 90] and longitude within [-180, 180].
 */
public record Location(double latitude, double longitude) {

    public Location {
        if (!(latitude >= -90 && latitude <= 90)) {
            throw new InvalidCalculationRequest("Invalid latitude '" + latitude + "'. Must be between -90 and 90 degrees.");
        }
        if (!(longitude >= -180 && longitude <= 180)) {
            throw new InvalidCalculationRequest("Invalid longitude '" + longitude + "'. Must be between -180 and 180 degrees.");
        }
    }

    public static Location of(double latitude, double longitude) {
        return new Location(latitude, longitude);
    }

    /**
     * @return the longitude converted to hours, i.e. 15 degrees per hour
     */
    double longitudeHours() {
        return longitude / 15;
    }
}
