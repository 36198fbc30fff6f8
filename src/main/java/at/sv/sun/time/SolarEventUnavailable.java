package at.sv.sun.time;

import java.time.LocalDate;

/**
 * Signals that the sun does not cross the requested zenith on the given date and location, i.e. the cosine of the
 * local hour angle lies outside of [-1, 1]. Happens near the poles or for extreme zenith values.
 */
public abstract class SolarEventUnavailable extends RuntimeException {

    private final SolarEventType eventType;
    private final LocalDate date;
    private final double hourAngleCosine;

    protected SolarEventUnavailable(String message, SolarEventType eventType, LocalDate date, double hourAngleCosine) {
        super(message);
        this.eventType = eventType;
        this.date = date;
        this.hourAngleCosine = hourAngleCosine;
    }

    public SolarEventType getEventType() {
        return eventType;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getHourAngleCosine() {
        return hourAngleCosine;
    }

    /**
     * @return a short human-readable reason, e.g. "never rises"
     */
    public abstract String getReason();
}
