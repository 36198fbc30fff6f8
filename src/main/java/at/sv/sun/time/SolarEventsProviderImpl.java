package at.sv.sun.time;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provides sunrise and sunset for a fixed location, UTC offset and zenith. Results are cached per date and event.
 */
@Slf4j
public final class SolarEventsProviderImpl implements SolarEventsProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private final SolarEventCalculator calculator;
    private final CalculationRequest template;
    private final Map<String, LocalDateTime> cache;

    public SolarEventsProviderImpl(double lat, double lng, double utcOffset, double zenith) {
        this(new SolarEventCalculatorImpl(), CalculationRequest.of(LocalDate.EPOCH, lat, lng, utcOffset, zenith));
    }

    public SolarEventsProviderImpl(SolarEventCalculator calculator, CalculationRequest template) {
        this.calculator = calculator;
        this.template = template;
        cache = new ConcurrentHashMap<>();
    }

    @Override
    public SolarEvents getSolarEvents(LocalDate date) {
        return SolarEvents.of(getSunrise(date), getSunset(date));
    }

    @Override
    public LocalDateTime getSunrise(LocalDate date) {
        return eventFor(date, SolarEventType.SUNRISE);
    }

    @Override
    public LocalDateTime getSunset(LocalDate date) {
        return eventFor(date, SolarEventType.SUNSET);
    }

    private LocalDateTime eventFor(LocalDate date, SolarEventType eventType) {
        String key = generateKey(date, eventType);
        return cache.computeIfAbsent(key, k -> calculate(date, eventType));
    }

    private LocalDateTime calculate(LocalDate date, SolarEventType eventType) {
        log.trace("Calculate {} for {}", eventType.getLabel(), date);
        try {
            return calculator.calculate(template.withDate(date), eventType);
        } catch (SolarEventUnavailable e) {
            log.debug(e.getMessage());
            throw e;
        }
    }

    private String generateKey(LocalDate date, SolarEventType eventType) {
        return date.toString() + "-" + eventType;
    }

    @Override
    public String toDebugString(LocalDate date) {
        return "sunrise: " + format(date, SolarEventType.SUNRISE) +
               "\nsunset: " + format(date, SolarEventType.SUNSET);
    }

    private String format(LocalDate date, SolarEventType eventType) {
        try {
            return TIME_FORMATTER.format(eventFor(date, eventType));
        } catch (SolarEventUnavailable e) {
            return e.getReason();
        }
    }

    @Override
    public void clearCache() {
        cache.clear();
    }
}
