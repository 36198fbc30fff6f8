package at.sv.sun.time;

import java.time.LocalDate;
import java.time.LocalDateTime;

public interface SolarEventsProvider {

    SolarEvents getSolarEvents(LocalDate date);

    LocalDateTime getSunrise(LocalDate date);

    LocalDateTime getSunset(LocalDate date);

    String toDebugString(LocalDate date);

    void clearCache();
}
