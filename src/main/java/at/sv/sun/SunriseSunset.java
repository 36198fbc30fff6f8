package at.sv.sun;

import at.sv.sun.time.CalculationRequest;
import at.sv.sun.time.Location;
import at.sv.sun.time.SolarEventCalculatorImpl;
import at.sv.sun.time.SolarEventsProvider;
import at.sv.sun.time.SolarEventsProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

@Command(name = "SunriseSunset", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Computes the local sunrise and sunset for a given day, location, UTC offset and zenith.")
public final class SunriseSunset implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SunriseSunset.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = {"-d", "--date"}, paramLabel = "<yyyy-MM-dd>",
            description = "The date to compute sunrise and sunset for. Default: today")
    LocalDate date;
    @Option(names = {"-o", "--offset"}, paramLabel = "<hours>",
            defaultValue = "${env:UTC_OFFSET:-0}",
            description = "The offset of your local time to UTC in hours [-12..14]. Default: ${DEFAULT-VALUE}")
    double utcOffset;
    @Option(names = {"-z", "--zenith"}, paramLabel = "<zenith>",
            defaultValue = "${env:ZENITH:-civil}",
            converter = ZenithConverter.class,
            description = "The zenith in degrees at which the sun is considered to rise or set, or one of " +
                          "[civil, nautical, astronomical]. Default: ${DEFAULT-VALUE}")
    double zenith;
    @Option(names = "--days", paramLabel = "<days>",
            defaultValue = "1",
            description = "The number of consecutive days to compute, starting at the given date [1..366]. " +
                          "Default: ${DEFAULT-VALUE}")
    int days;
    @Option(names = "--format",
            defaultValue = "text",
            description = "The output format, one of [${COMPLETION-CANDIDATES}]. Default: ${DEFAULT-VALUE}")
    OutputFormat format;

    private final Supplier<LocalDate> today;

    public SunriseSunset() {
        this(LocalDate::now);
    }

    public SunriseSunset(Supplier<LocalDate> today) {
        this.today = today;
    }

    public static void main(String[] args) {
        int execute = createCommandLine(new SunriseSunset()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    static CommandLine createCommandLine(SunriseSunset sunriseSunset) {
        return new CommandLine(sunriseSunset).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        LocalDate startDate = date != null ? date : today.get();
        LOG.debug("Compute {} day(s) starting {} for lat={}, long={}, offset={}, zenith={}", days, startDate,
                latitude, longitude, utcOffset, zenith);
        SolarEventsProvider provider = createProvider();
        List<DailyReport> reports = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            LocalDate day = startDate.plusDays(i);
            MDC.put("context", day.toString());
            reports.add(DailyReport.create(provider, day));
        }
        MDC.remove("context");
        SolarEventsFormatter formatter = new SolarEventsFormatter(Location.of(latitude, longitude), utcOffset, zenith);
        PrintWriter out = getOut();
        out.print(formatter.format(reports, format));
        out.flush();
    }

    private SolarEventsProvider createProvider() {
        return new SolarEventsProviderImpl(new SolarEventCalculatorImpl(),
                CalculationRequest.of(LocalDate.EPOCH, latitude, longitude, utcOffset, zenith));
    }

    private PrintWriter getOut() {
        if (spec != null) {
            return spec.commandLine().getOut();
        }
        return new PrintWriter(System.out, true);
    }

    private void assertConfigurationParameters() {
        assertGeographicConfigurations();
        assertTimeConfigurations();
    }

    private void assertGeographicConfigurations() {
        if (!(latitude >= -90 && latitude <= 90)) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (!(longitude >= -180 && longitude <= 180)) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (!(zenith > 0 && zenith < 180)) {
            fail("--zenith must be between 0 and 180 degrees (exclusive)");
        }
    }

    private void assertTimeConfigurations() {
        if (!(utcOffset >= CalculationRequest.MIN_UTC_OFFSET && utcOffset <= CalculationRequest.MAX_UTC_OFFSET)) {
            fail("--offset must be between -12 and 14 hours");
        }
        if (days < 1 || days > 366) {
            fail("--days must be within [1,366]");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
