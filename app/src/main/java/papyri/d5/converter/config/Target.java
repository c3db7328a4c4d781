package papyri.d5.converter.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import papyri.d5.converter.corpus.PapyrusFilter;

/**
 * What a run converts. Exactly one kind of target is given per run.
 */
public interface Target {

    record TmNumbers(List<Integer> values) implements Target {
        public TmNumbers {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("At least one TM number must be given");
            }
            values = values.stream().sorted().distinct().collect(Collectors.toUnmodifiableList());
        }
    }

    record CollectionNames(List<String> names) implements Target {
        public CollectionNames {
            if (names == null || names.isEmpty()) {
                throw new IllegalArgumentException("At least one collection must be given");
            }
            names = List.copyOf(names);
        }
    }

    record Filter(PapyrusFilter filter) implements Target {
        public Filter {
            Objects.requireNonNull(filter, "filter");
        }
    }

    record SingleFile(Path file) implements Target {
        public SingleFile {
            Objects.requireNonNull(file, "file");
        }
    }
}
