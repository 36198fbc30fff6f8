package at.sv.sun.time;

import java.time.LocalDateTime;

/**
 * Computes the local civil sunrise and sunset for a {@link CalculationRequest}.
 * <p>
 * Implementations are pure: calling them repeatedly with the same request yields identical results.
 */
public interface SolarEventCalculator {

    /**
     * @throws SolarEventUnavailable if the sun does not rise or set on the requested date
     */
    SolarEvents calculate(CalculationRequest request);

    LocalDateTime calculate(CalculationRequest request, SolarEventType eventType);

    default LocalDateTime calculateSunrise(CalculationRequest request) {
        return calculate(request, SolarEventType.SUNRISE);
    }

    default LocalDateTime calculateSunset(CalculationRequest request) {
        return calculate(request, SolarEventType.SUNSET);
    }
}
