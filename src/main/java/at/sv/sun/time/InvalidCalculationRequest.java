package at.sv.sun.time;

/**
 * Signals an out-of-range latitude, longitude, UTC offset or zenith. Thrown while constructing a request, so no
 * calculation is ever attempted with invalid input.
 */
public final class InvalidCalculationRequest extends IllegalArgumentException {
    public InvalidCalculationRequest(String message) {
        super(message);
    }
}
