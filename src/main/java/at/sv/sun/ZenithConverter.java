package at.sv.sun;

import at.sv.sun.time.Twilight;
import picocli.CommandLine;

/**
 * Parses a zenith given either as twilight keyword (civil, nautical, astronomical) or as plain number of degrees.
 */
public final class ZenithConverter implements CommandLine.ITypeConverter<Double> {

    @Override
    public Double convert(String value) {
        return parseZenith(value);
    }

    public static double parseZenith(String value) {
        Twilight twilight = Twilight.fromName(value);
        if (twilight != null) {
            return twilight.getZenith();
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new CommandLine.TypeConversionException("Invalid zenith '" + value + "'. Please provide either a " +
                                                          "number of degrees or one of [civil, nautical, astronomical].");
        }
    }
}
