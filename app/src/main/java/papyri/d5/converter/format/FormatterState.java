package papyri.d5.converter.format;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Mutable validation state of exactly one document conversion: the diagnostics logged so far, the typo
 * corrections applied and the languages declared in the document.
 */
public final class FormatterState {

    private static final String GREEK = "grc";

    private final List<String> errorLog = new ArrayList<>();
    private final List<List<String>> changes = new ArrayList<>();
    private final SortedSet<String> languages;

    public FormatterState(Collection<String> languages) {
        this.languages = Collections.unmodifiableSortedSet(new TreeSet<>(languages));
    }

    public static FormatterState withoutLanguages() {
        return new FormatterState(Set.of());
    }

    void logError(String diagnostic) {
        errorLog.add(diagnostic);
    }

    /**
     * @return a position in the error log to which {@link #discardErrorsSince(int)} can later rewind
     */
    int errorMark() {
        return errorLog.size();
    }

    void discardErrorsSince(int mark) {
        errorLog.subList(mark, errorLog.size()).clear();
    }

    void recordChanges(List<String> pass) {
        changes.add(List.copyOf(pass));
    }

    /**
     * Auto-correction of Latin look-alikes is only safe when the document is declared purely Greek.
     */
    boolean isPurelyGreek() {
        return languages.size() == 1 && languages.contains(GREEK);
    }

    public List<String> errorLog() {
        return List.copyOf(errorLog);
    }

    public boolean hasErrors() {
        return !errorLog.isEmpty();
    }

    public List<List<String>> changes() {
        return List.copyOf(changes);
    }

    public SortedSet<String> languages() {
        return languages;
    }
}
