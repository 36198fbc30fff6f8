package at.sv.sun;

import at.sv.sun.time.SolarEventUnavailable;
import at.sv.sun.time.SolarEventsProvider;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.function.Function;

/**
 * Sunrise and sunset of a single date. An event is {@code null} if the sun does not rise or set that day, in which
 * case the corresponding reason is set instead.
 */
public record DailyReport(LocalDate date, LocalTime sunrise, String sunriseUnavailable,
                          LocalTime sunset, String sunsetUnavailable) {

    public static DailyReport create(SolarEventsProvider provider, LocalDate date) {
        Outcome sunrise = Outcome.of(date, d -> provider.getSunrise(d).toLocalTime());
        Outcome sunset = Outcome.of(date, d -> provider.getSunset(d).toLocalTime());
        return new DailyReport(date, sunrise.time(), sunrise.reason(), sunset.time(), sunset.reason());
    }

    private record Outcome(LocalTime time, String reason) {
        private static Outcome of(LocalDate date, Function<LocalDate, LocalTime> event) {
            try {
                return new Outcome(event.apply(date), null);
            } catch (SolarEventUnavailable e) {
                return new Outcome(null, e.getReason());
            }
        }
    }
}
