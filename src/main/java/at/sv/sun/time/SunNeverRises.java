package at.sv.sun.time;

import java.time.LocalDate;

/**
 * The sun stays below the requested zenith for the whole day.
 */
public final class SunNeverRises extends SolarEventUnavailable {

    public SunNeverRises(SolarEventType eventType, LocalDate date, double hourAngleCosine) {
        super("No " + eventType.getLabel() + " on " + date + ": the sun never rises (cos(H) = " + hourAngleCosine + ")",
                eventType, date, hourAngleCosine);
    }

    @Override
    public String getReason() {
        return "never rises";
    }
}
