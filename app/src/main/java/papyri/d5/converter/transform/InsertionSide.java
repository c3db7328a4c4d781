package papyri.d5.converter.transform;

/**
 * Where a deferred insertion is spliced relative to the line it was found on.
 */
public enum InsertionSide {
    BEFORE,
    AFTER
}
