package papyri.d5.converter.insert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import papyri.d5.converter.format.LineFormatter;
import papyri.d5.converter.transform.InsertionRequest;
import papyri.d5.converter.transform.InsertionSide;
import papyri.d5.converter.transform.RawLine;

/**
 * Splices deferred additions into the line list as lines of their own.
 *
 * <p>Additions requested before line {@code i} are inserted at {@code i}, additions requested after it at
 * {@code i + 1}. Requests are applied in line order; every applied request shifts the later targets down by
 * one. Several before-requests on one line are applied in reverse; with the shift this leaves the last
 * request on top.
 */
public final class InsertionResolver {

    private InsertionResolver() {
    }

    public static List<String> resolve(List<RawLine> lines) {
        List<String> texts = lines.stream()
                .map(RawLine::text)
                .collect(Collectors.toCollection(ArrayList::new));
        List<PendingInsertion> pending = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            List<String> before = texts(lines.get(i), InsertionSide.BEFORE);
            Collections.reverse(before);
            for (String text : before) {
                pending.add(new PendingInsertion(i, text));
            }
            for (String text : texts(lines.get(i), InsertionSide.AFTER)) {
                pending.add(new PendingInsertion(i + 1, text));
            }
        }
        int shift = 0;
        for (PendingInsertion insertion : pending) {
            int index = Math.min(insertion.target() + shift, texts.size());
            texts.add(index, LineFormatter.formatLine(insertion.text()));
            shift++;
        }
        return texts;
    }

    private static List<String> texts(RawLine line, InsertionSide side) {
        return line.insertions().stream()
                .filter(request -> request.side() == side)
                .map(InsertionRequest::text)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private record PendingInsertion(int target, String text) {
    }
}
