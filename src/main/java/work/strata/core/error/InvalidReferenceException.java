package work.strata.core.error;

/**
 * Image address that does not parse as a docker reference.
 */
public final class InvalidReferenceException extends StrataException {
    private final String address;

    public InvalidReferenceException(String address, String reason) {
        super("invalid_reference", "invalid reference \"" + address + "\": " + reason, address);
        this.address = address;
    }

    public String address() {
        return address;
    }
}
