package outbreak;

import outbreak.data.SeriesKey;

import java.util.Objects;

/** A requested (entity, disease) pair that produced no forecast, and why. */
public final class PairFailure {

    private final String entity;
    private final String disease;
    private final FailureKind kind;
    private final String message;

    public PairFailure(SeriesKey key, FailureKind kind, String message) {
        this.entity = key.getEntity();
        this.disease = key.getDisease();
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
    }

    public String getEntity() { return entity; }
    public String getDisease() { return disease; }
    public FailureKind getKind() { return kind; }
    public String getMessage() { return message; }

    public SeriesKey key() {
        return new SeriesKey(entity, disease);
    }

    @Override
    public String toString() {
        return entity + "/" + disease + " " + kind + ": " + message;
    }
}
