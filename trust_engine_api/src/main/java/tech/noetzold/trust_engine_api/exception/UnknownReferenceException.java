package tech.noetzold.trust_engine_api.exception;

public class UnknownReferenceException extends RuntimeException {

    private final String reference;

    public UnknownReferenceException(String kind, String reference) {
        super("Unknown " + kind + ": " + reference);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
