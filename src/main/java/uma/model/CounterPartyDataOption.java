package uma.model;

public record CounterPartyDataOption(
    boolean mandatory
) {

}
