package papyri.d5.converter.batch;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import papyri.d5.converter.config.Target;
import papyri.d5.converter.corpus.CollectionSelector;
import papyri.d5.converter.corpus.CorpusLayout;
import papyri.d5.converter.corpus.PapyrusFilter;

/**
 * Turns a run target into TM numbers and names its export directory.
 */
public class TargetResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(TargetResolver.class);

    private final CorpusLayout layout;
    private final CollectionSelector collectionSelector;

    public TargetResolver(CorpusLayout layout) {
        this(layout, new CollectionSelector(layout));
    }

    TargetResolver(CorpusLayout layout, CollectionSelector collectionSelector) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.collectionSelector = Objects.requireNonNull(collectionSelector, "collectionSelector");
    }

    public ResolvedTarget resolve(Target target) {
        ResolvedTarget resolved;
        if (target instanceof Target.TmNumbers tmNumbers) {
            List<Integer> values = tmNumbers.values();
            String name = values.size() == 1
                    ? String.valueOf(values.get(0))
                    : values.get(0) + "-" + values.get(values.size() - 1);
            resolved = new ResolvedTarget(name, values);
        } else if (target instanceof Target.CollectionNames collections) {
            resolved = new ResolvedTarget(String.join("+", collections.names()),
                    collectionSelector.tmNumbers(collections.names()));
        } else if (target instanceof Target.Filter filter) {
            PapyrusFilter papyrusFilter = filter.filter();
            resolved = new ResolvedTarget(papyrusFilter.name(), papyrusFilter.select(layout));
        } else {
            throw new IllegalArgumentException("Target cannot be resolved to TM numbers: " + target);
        }
        LOGGER.info("Resolved {} TM numbers for export directory {}", resolved.tmNumbers().size(),
                resolved.exportDirectory());
        return resolved;
    }
}
