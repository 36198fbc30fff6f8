package at.sv.sun.time;

public enum SolarEventType {
    SUNRISE(6, "sunrise"),
    SUNSET(18, "sunset");

    private final int hourConstant;
    private final String label;

    SolarEventType(int hourConstant, String label) {
        this.hourConstant = hourConstant;
        this.label = label;
    }

    /**
     * @return the approximate local hour of the event, used as starting point of the approximation
     */
    public int getHourConstant() {
        return hourConstant;
    }

    public String getLabel() {
        return label;
    }
}
