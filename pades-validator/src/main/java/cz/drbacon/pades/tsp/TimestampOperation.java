package cz.drbacon.pades.tsp;

public enum TimestampOperation {
    REQUEST,
    VERIFY,
    EXTRACT,
    EMBED
}
