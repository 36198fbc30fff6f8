package at.sv.sun.time;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CalculationRequestTest {

    private static final LocalDate DATE = LocalDate.of(2014, 1, 1);

    private static void assertValid(double latitude, double longitude, double utcOffset) {
        assertDoesNotThrow(() -> CalculationRequest.of(DATE, latitude, longitude, utcOffset));
    }

    private static void assertInvalid(double latitude, double longitude, double utcOffset) {
        assertThrows(InvalidCalculationRequest.class, () -> CalculationRequest.of(DATE, latitude, longitude, utcOffset));
    }

    @Test
    void latitude_boundsAreInclusive() {
        assertValid(90.0, 0, 0);
        assertValid(-90.0, 0, 0);
        assertInvalid(90.0001, 0, 0);
        assertInvalid(-90.0001, 0, 0);
    }

    @Test
    void longitude_boundsAreInclusive() {
        assertValid(0, 180.0, 0);
        assertValid(0, -180.0, 0);
        assertInvalid(0, 180.0001, 0);
        assertInvalid(0, -180.0001, 0);
    }

    @Test
    void utcOffset_boundsAreInclusive() {
        assertValid(0, 0, -12);
        assertValid(0, 0, 14);
        assertValid(0, 0, 5.75);
        assertInvalid(0, 0, -12.0001);
        assertInvalid(0, 0, 14.0001);
    }

    @Test
    void notANumber_rejected() {
        assertInvalid(Double.NaN, 0, 0);
        assertInvalid(0, Double.NaN, 0);
        assertInvalid(0, 0, Double.NaN);
    }

    @Test
    void zenith_mustBeBetweenZeroAnd180() {
        assertThrows(InvalidCalculationRequest.class, () -> CalculationRequest.of(DATE, 0, 0, 0, 0));
        assertThrows(InvalidCalculationRequest.class, () -> CalculationRequest.of(DATE, 0, 0, 0, 180));
        assertThrows(InvalidCalculationRequest.class, () -> CalculationRequest.of(DATE, 0, 0, 0, Double.POSITIVE_INFINITY));
        assertDoesNotThrow(() -> CalculationRequest.of(DATE, 0, 0, 0, Twilight.ASTRONOMICAL.getZenith()));
    }

    @Test
    void invalidRequest_isIllegalArgument_withDescriptiveMessage() {
        InvalidCalculationRequest exception = assertThrows(InvalidCalculationRequest.class,
                () -> CalculationRequest.of(DATE, 91, 0, 0));

        assertThat(exception instanceof IllegalArgumentException, is(true));
        assertThat(exception.getMessage(), is("Invalid latitude '91.0'. Must be between -90 and 90 degrees."));
    }

    @Test
    void missingDate_rejected() {
        assertThrows(NullPointerException.class, () -> CalculationRequest.of(null, 0, 0, 0));
    }

    @Test
    void defaultZenith_isCivil() {
        CalculationRequest request = CalculationRequest.of(DATE, 46.805, -71.2316, -5);

        assertThat(request.zenith(), is(90.83333));
    }

    @Test
    void copyMethods_onlyReplaceGivenValue() {
        CalculationRequest request = CalculationRequest.of(DATE, 46.805, -71.2316, -5);

        CalculationRequest copy = request.withDate(DATE.plusDays(1)).withUtcOffset(-4).withZenith(96);

        assertThat(copy.date(), is(DATE.plusDays(1)));
        assertThat(copy.location(), is(Location.of(46.805, -71.2316)));
        assertThat(copy.utcOffset(), is(-4.0));
        assertThat(copy.zenith(), is(96.0));
        assertThat(request.date(), is(DATE));
    }

    @Test
    void copyMethods_validateAgain() {
        CalculationRequest request = CalculationRequest.of(DATE, 0, 0, 0);

        assertThrows(InvalidCalculationRequest.class, () -> request.withUtcOffset(15));
    }
}
