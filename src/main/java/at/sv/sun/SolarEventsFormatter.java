package at.sv.sun;

import at.sv.sun.time.Location;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders computed sunrise and sunset times either as plain text or JSON.
 */
public final class SolarEventsFormatter {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private final ObjectMapper mapper;
    private final Location location;
    private final double utcOffset;
    private final double zenith;

    public SolarEventsFormatter(Location location, double utcOffset, double zenith) {
        this.location = location;
        this.utcOffset = utcOffset;
        this.zenith = zenith;
        mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String format(List<DailyReport> reports, OutputFormat format) {
        return switch (format) {
            case TEXT -> formatText(reports);
            case JSON -> formatJson(reports);
        };
    }

    public String formatText(List<DailyReport> reports) {
        StringBuilder sb = new StringBuilder();
        sb.append("Latitude: ").append(formatNumber(location.latitude())).append('\n');
        sb.append("Longitude: ").append(formatNumber(location.longitude())).append('\n');
        sb.append("Offset: ").append(formatOffset(utcOffset)).append('\n');
        sb.append("Zenith: ").append(formatNumber(zenith)).append('\n');
        for (DailyReport report : reports) {
            sb.append(report.date())
              .append("  sunrise: ").append(formatEvent(report.sunrise(), report.sunriseUnavailable()))
              .append("  sunset: ").append(formatEvent(report.sunset(), report.sunsetUnavailable()))
              .append('\n');
        }
        return sb.toString();
    }

    public String formatJson(List<DailyReport> reports) {
        ObjectNode root = mapper.createObjectNode();
        root.put("latitude", location.latitude());
        root.put("longitude", location.longitude());
        root.put("utcOffset", utcOffset);
        root.put("zenith", zenith);
        ArrayNode days = root.putArray("days");
        for (DailyReport report : reports) {
            ObjectNode day = days.addObject();
            day.put("date", report.date().toString());
            putEvent(day, "sunrise", report.sunrise(), report.sunriseUnavailable());
            putEvent(day, "sunset", report.sunset(), report.sunsetUnavailable());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize solar events: " + e.getMessage(), e);
        }
    }

    private static void putEvent(ObjectNode day, String name, LocalTime time, String unavailable) {
        if (time != null) {
            day.put(name, TIME_FORMATTER.format(time));
        } else {
            day.putNull(name);
            day.put(name + "Unavailable", unavailable);
        }
    }

    private static String formatEvent(LocalTime time, String unavailable) {
        if (time == null) {
            return unavailable;
        }
        return TIME_FORMATTER.format(time);
    }

    static String formatOffset(double utcOffset) {
        int totalMinutes = (int) Math.round(Math.abs(utcOffset) * 60);
        return String.format(Locale.ROOT, "UTC%s%02d:%02d", utcOffset < 0 ? "-" : "+", totalMinutes / 60,
                totalMinutes % 60);
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
