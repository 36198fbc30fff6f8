package at.sv.sun.time;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Sunrise equation approximation as published in the Almanac for Computers (1990). Accurate to about one or two
 * minutes for non-polar latitudes.
 * <p>
 * All normalizations use a single wrap-around correction instead of a general modulo, since each raw value is known to
 * be within one period of its target range.
 */
@Slf4j
public final class SolarEventCalculatorImpl implements SolarEventCalculator {

    @Override
    public SolarEvents calculate(CalculationRequest request) {
        return SolarEvents.of(calculate(request, SolarEventType.SUNRISE), calculate(request, SolarEventType.SUNSET));
    }

    @Override
    public LocalDateTime calculate(CalculationRequest request, SolarEventType eventType) {
        LocalDate date = request.date();
        double localTime = localTime(request, eventType);
        int hour = (int) Math.floor(localTime);
        int minute = (int) Math.floor((localTime - hour) * 60);
        return date.atTime(LocalTime.of(hour, minute));
    }

    /**
     * @return the local civil time of the event in fractional hours, within [0, 24)
     */
    double localTime(CalculationRequest request, SolarEventType eventType) {
        double universalTime = universalTime(request, eventType);
        return adjustTime(universalTime + request.utcOffset());
    }

    /**
     * @return the UTC time of the event in fractional hours. After the single wrap this may still lie slightly outside
     * of [0, 24), e.g. near the polar circles at longitude 180, always within (-1, 25). The local time wrap absorbs it.
     */
    double universalTime(CalculationRequest request, SolarEventType eventType) {
        int dayOfYear = request.date().getDayOfYear();
        double lngHour = request.location().longitudeHours();
        double t = dayOfYear + ((eventType.getHourConstant() - lngHour) / 24);

        double meanAnomaly = (0.9856 * t) - 3.289;
        double trueLongitude = trueLongitude(meanAnomaly);
        double rightAscensionHours = rightAscension(trueLongitude) / 15;

        double sinDec = 0.39782 * sin(trueLongitude);
        double cosDec = Math.cos(Math.asin(sinDec));

        double cosH = (cos(request.zenith()) - (sinDec * sin(request.latitude()))) / (cosDec * cos(request.latitude()));
        if (cosH > 1) {
            throw new SunNeverRises(eventType, request.date(), cosH);
        }
        if (cosH < -1) {
            throw new SunNeverSets(eventType, request.date(), cosH);
        }
        double hourAngle = hourAngle(cosH, eventType);

        double localMeanTime = hourAngle + rightAscensionHours - (0.06571 * t) - 6.622;
        double universalTime = adjustTime(localMeanTime - lngHour);
        log.trace("{} {}: N={}, t={}, M={}, L={}, RA={}h, cosH={}, H={}h, T={}, UT={}", eventType.getLabel(),
                request.date(), dayOfYear, t, meanAnomaly, trueLongitude, rightAscensionHours, cosH, hourAngle,
                localMeanTime, universalTime);
        return universalTime;
    }

    /**
     * @return the sun's true longitude in degrees, within [0, 360)
     */
    static double trueLongitude(double meanAnomaly) {
        return adjustAngle(meanAnomaly + (1.916 * sin(meanAnomaly)) + (0.020 * sin(2 * meanAnomaly)) + 282.634);
    }

    /**
     * @return the sun's right ascension in degrees, within [0, 360) and in the same quadrant as the true longitude
     */
    static double rightAscension(double trueLongitude) {
        double rightAscension = adjustAngle(Math.toDegrees(Math.atan(0.91764 * tan(trueLongitude))));
        double longitudeQuadrant = Math.floor(trueLongitude / 90) * 90;
        double rightAscensionQuadrant = Math.floor(rightAscension / 90) * 90;
        return rightAscension + (longitudeQuadrant - rightAscensionQuadrant);
    }

    private static double hourAngle(double cosH, SolarEventType eventType) {
        double degrees = Math.toDegrees(Math.acos(cosH));
        if (eventType == SolarEventType.SUNRISE) {
            return (360 - degrees) / 15;
        }
        return degrees / 15;
    }

    static double adjustAngle(double degrees) {
        if (degrees < 0) {
            return degrees + 360;
        } else if (degrees >= 360) {
            return degrees - 360;
        }
        return degrees;
    }

    static double adjustTime(double hours) {
        if (hours < 0) {
            return hours + 24;
        } else if (hours >= 24) {
            return hours - 24;
        }
        return hours;
    }

    private static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    private static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    private static double tan(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }
}
