package com.example.waterrights.application.service.extraction;

import com.example.waterrights.domain.model.report.KeyValuePair;
import com.example.waterrights.domain.model.report.TextBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pairs label blocks with the value blocks that follow them.
 * A label font starts a new pair, value fonts append to the open pair. The open pair survives page breaks.
 * Value blocks printed before the first label of a page go to the open pair while it has no values yet;
 * otherwise they continue the latest pair of their column, falling back to the open pair. Values seen
 * before any label at all are dropped.
 */
@Component
public class KeyValueGrouper {

    private static final Logger log = LoggerFactory.getLogger(KeyValueGrouper.class);

    private final FontRoleTable fontRoles;

    public KeyValueGrouper(FontRoleTable fontRoles) {
        this.fontRoles = fontRoles;
    }

    /**
     * @param pages text blocks per page in reading order
     * @return key-value pairs in reading order
     */
    public List<KeyValuePair> group(List<List<TextBlock>> pages) {
        List<PairBuilder> pairs = new ArrayList<>();
        ColumnContinuationIndex<PairBuilder> continuation = new ColumnContinuationIndex<>();

        PairBuilder open = null;
        for (List<TextBlock> page : pages) {
            boolean labelOnPage = false;
            for (TextBlock block : page) {
                if (block.content() == null || block.fontFamily() == null) {
                    continue;
                }
                switch (fontRoles.roleOf(block.fontFamily())) {
                    case LABEL -> {
                        labelOnPage = true;
                        open = new PairBuilder(block.content());
                        pairs.add(open);
                        continuation.register(block.column(), open);
                    }
                    case VALUE -> {
                        if (labelOnPage || (open != null && open.values.isEmpty())) {
                            open.addValue(block.content());
                            continuation.register(block.column(), open);
                        } else {
                            continueColumn(continuation, open, block);
                        }
                    }
                    case IGNORED -> log.debug("Page {}: ignoring block in font {}", block.page(), block.fontFamily());
                }
            }
        }

        return pairs.stream().map(PairBuilder::build).toList();
    }

    private void continueColumn(ColumnContinuationIndex<PairBuilder> continuation, PairBuilder open,
                                TextBlock block) {
        Optional<PairBuilder> previous = continuation.lookup(block.column());
        if (previous.isPresent()) {
            log.debug("Page {}: continuing '{}' in column {}", block.page(), previous.get().key, block.column());
            previous.get().continueWith(block.content());
        } else if (open != null) {
            open.addValue(block.content());
            continuation.register(block.column(), open);
        } else {
            log.warn("Page {}: dropping value '{}' without label", block.page(), block.content());
        }
    }

    private static final class PairBuilder {
        private final String key;
        private final List<String> values = new ArrayList<>();

        private PairBuilder(String key) {
            this.key = key;
        }

        private void addValue(String value) {
            values.add(value);
        }

        private void continueWith(String fragment) {
            if (values.isEmpty()) {
                values.add(fragment);
            } else {
                int last = values.size() - 1;
                values.set(last, values.get(last) + " " + fragment);
            }
        }

        private KeyValuePair build() {
            return new KeyValuePair(key, values);
        }
    }
}
