package at.sv.sun.time;

import java.time.LocalDate;

/**
 * The sun stays above the requested zenith for the whole day.
 */
public final class SunNeverSets extends SolarEventUnavailable {

    public SunNeverSets(SolarEventType eventType, LocalDate date, double hourAngleCosine) {
        super("No " + eventType.getLabel() + " on " + date + ": the sun never sets (cos(H) = " + hourAngleCosine + ")",
                eventType, date, hourAngleCosine);
    }

    @Override
    public String getReason() {
        return "never sets";
    }
}
