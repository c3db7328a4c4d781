package papyri.d5.converter.convert;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Output of converting one document.
 *
 * @param blocks      non-empty text blocks in document order
 * @param diagnostics line-level problems found while validating
 * @param corrections one list of change notes per typo-correction pass
 * @param languages   languages declared in the document, {@code en} excluded
 */
public record ConversionResult(List<TextBlock> blocks, List<String> diagnostics, List<List<String>> corrections,
        SortedSet<String> languages) {

    public ConversionResult {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
        languages = Collections.unmodifiableSortedSet(languages == null ? new TreeSet<>() : new TreeSet<>(languages));
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return the lines of all blocks in order
     */
    public List<String> lines() {
        return blocks.stream()
                .flatMap(block -> block.lines().stream())
                .collect(Collectors.toUnmodifiableList());
    }
}
