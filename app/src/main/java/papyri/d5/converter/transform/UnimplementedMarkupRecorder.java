package papyri.d5.converter.transform;

/**
 * Collects markup values the transformer recognises structurally but has no rendering for.
 */
@FunctionalInterface
public interface UnimplementedMarkupRecorder {

    UnimplementedMarkupRecorder NONE = description -> { };

    void record(String description);
}
