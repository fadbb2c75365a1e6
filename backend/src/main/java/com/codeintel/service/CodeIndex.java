package com.codeintel.service;

import com.codeintel.exception.CodeLoadException;
import com.codeintel.exception.IndexNotReadyException;
import com.codeintel.model.code.CodePage;
import com.codeintel.model.code.CodeQuery;
import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.PaymentSet;
import com.codeintel.model.code.RawCodeRecord;
import com.codeintel.model.code.SearchEntry;
import com.codeintel.model.enums.CodeSortField;
import com.codeintel.model.enums.CodeType;
import com.codeintel.model.enums.SortOrder;
import com.codeintel.source.CodeBatch;
import com.codeintel.source.CodeManifest;
import com.codeintel.source.CodeSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.text.Collator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Code Index
 *
 * Owns the in-memory structures over the full code collection:
 * - code string to record (exact, then upper-cased lookup)
 * - code system to its records
 * - flattened search corpus
 * - derived payments per code, computed once at build time
 *
 * Everything is built into an {@link IndexSnapshot} and published only when complete,
 * so readers see either nothing (and get {@link IndexNotReadyException}) or the whole index.
 */
@Slf4j
@Component
public class CodeIndex {

    private static final Locale COLLATION_LOCALE = Locale.US;

    private final PaymentDeriver paymentDeriver;

    private volatile IndexSnapshot snapshot;
    private volatile Exception loadError;

    public CodeIndex(PaymentDeriver paymentDeriver) {
        this.paymentDeriver = paymentDeriver;
    }

    // ========================================================================
    // Loading
    // ========================================================================

    /**
     * Read the source and build the index. A second call after a successful load is a no-op.
     *
     * @throws CodeLoadException if the source cannot be read or a record is malformed;
     *                           the index stays unloaded
     */
    public synchronized void load(CodeSource source) {
        if (snapshot != null) {
            return;
        }
        log.info("Loading codes from {}", source.describe());
        long start = System.currentTimeMillis();
        try {
            CodeBatch batch = source.read();
            IndexSnapshot built = build(batch);
            loadError = null;
            snapshot = built;
            log.info("Total loading + indexing: {}ms", System.currentTimeMillis() - start);
        } catch (IOException e) {
            loadError = e;
            log.error("Error loading codes from {}: {}", source.describe(), e.getMessage());
            throw new CodeLoadException("Failed to read code data from " + source.describe(), e);
        } catch (IllegalArgumentException e) {
            loadError = e;
            log.error("Malformed code data in {}: {}", source.describe(), e.getMessage());
            throw new CodeLoadException("Malformed code data in " + source.describe() + ": " + e.getMessage(), e);
        }
    }

    private IndexSnapshot build(CodeBatch batch) {
        log.info("Building indexes...");
        List<CodeRecord> records = new ArrayList<>(batch.records().size());
        Map<String, CodeRecord> byCode = new HashMap<>();
        Map<CodeType, List<CodeRecord>> byType = new LinkedHashMap<>();
        List<SearchEntry> corpus = new ArrayList<>(batch.records().size());
        Map<String, PaymentSet> payments = new HashMap<>();

        int position = 0;
        int duplicates = 0;
        for (RawCodeRecord raw : batch.records()) {
            CodeRecord record;
            try {
                record = CodeRecord.fromRaw(raw);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("record #" + position + ": " + e.getMessage(), e);
            }
            position++;

            records.add(record);
            if (byCode.put(record.code(), record) != null) {
                duplicates++;
            }
            byType.computeIfAbsent(record.type(), type -> new ArrayList<>()).add(record);
            corpus.add(SearchEntry.of(record));
            payments.put(record.code(), paymentDeriver.derive(record));
        }
        if (duplicates > 0) {
            log.warn("{} duplicate codes found; the last occurrence wins for lookups", duplicates);
        }

        Comparator<CodeRecord> byCodeAsc = comparator(CodeSortField.CODE, SortOrder.ASC);
        Map<CodeType, List<CodeRecord>> byTypeSorted = new LinkedHashMap<>();
        Map<CodeType, List<CodeRecord>> frozenByType = new LinkedHashMap<>();
        byType.forEach((type, list) -> {
            frozenByType.put(type, Collections.unmodifiableList(list));
            List<CodeRecord> sorted = new ArrayList<>(list);
            sorted.sort(byCodeAsc);
            byTypeSorted.put(type, Collections.unmodifiableList(sorted));
        });
        List<CodeRecord> allSorted = new ArrayList<>(records);
        allSorted.sort(byCodeAsc);

        log.info("Index stats:");
        log.info("  - Code index size: {}", byCode.size());
        frozenByType.forEach((type, list) -> log.info("    - {}: {} codes", type.getValue(), list.size()));

        return new IndexSnapshot(
            Collections.unmodifiableList(records),
            Collections.unmodifiableMap(byCode),
            Collections.unmodifiableMap(frozenByType),
            Collections.unmodifiableMap(byTypeSorted),
            Collections.unmodifiableList(allSorted),
            Collections.unmodifiableList(corpus),
            Collections.unmodifiableMap(payments),
            batch.loadMethod(),
            batch.manifest()
        );
    }

    // ========================================================================
    // State
    // ========================================================================

    public boolean isReady() {
        return snapshot != null;
    }

    /**
     * Cause of the last failed load, empty when loading succeeded or has not been attempted.
     */
    public Optional<Exception> getLoadError() {
        return Optional.ofNullable(loadError);
    }

    // ========================================================================
    // Lookups
    // ========================================================================

    /**
     * Exact lookup, then retried with the code upper-cased.
     */
    public Optional<CodeRecord> getByCode(String code) {
        IndexSnapshot current = requireReady();
        if (code == null) {
            return Optional.empty();
        }
        CodeRecord record = current.byCode().get(code);
        if (record == null) {
            record = current.byCode().get(code.toUpperCase(Locale.ROOT));
        }
        return Optional.ofNullable(record);
    }

    /**
     * Sorted, paginated listing of one code system, or of every code when the query has no type.
     * Sorting is stable and uses locale-aware collation.
     */
    public CodePage listByType(CodeQuery query) {
        IndexSnapshot current = requireReady();
        List<CodeRecord> sorted;
        if (query.sortBy() == CodeSortField.CODE && query.sortOrder() == SortOrder.ASC) {
            sorted = query.type() == null
                ? current.allSorted()
                : current.byTypeSorted().getOrDefault(query.type(), List.of());
        } else {
            List<CodeRecord> source = query.type() == null
                ? current.records()
                : current.byType().getOrDefault(query.type(), List.of());
            sorted = new ArrayList<>(source);
            sorted.sort(comparator(query.sortBy(), query.sortOrder()));
        }

        int total = sorted.size();
        int from = Math.min(query.offset(), total);
        int to = (int) Math.min((long) from + query.limit(), total);
        return new CodePage(sorted.subList(from, to), total, query.limit(), query.offset());
    }

    /**
     * Search corpus in load order.
     */
    public List<SearchEntry> searchCorpus() {
        return requireReady().searchCorpus();
    }

    public PaymentSet paymentsFor(CodeRecord record) {
        return requireReady().payments().getOrDefault(record.code(), PaymentSet.ZERO);
    }

    public int size() {
        return requireReady().records().size();
    }

    /**
     * Count per code system, in first-seen order.
     */
    public Map<CodeType, Integer> typeCounts() {
        Map<CodeType, Integer> counts = new LinkedHashMap<>();
        requireReady().byType().forEach((type, list) -> counts.put(type, list.size()));
        return counts;
    }

    public String loadMethod() {
        return requireReady().loadMethod();
    }

    public Optional<CodeManifest> manifest() {
        return Optional.ofNullable(requireReady().manifest());
    }

    IndexSnapshot requireReady() {
        IndexSnapshot current = snapshot;
        if (current == null) {
            throw new IndexNotReadyException();
        }
        return current;
    }

    private static Comparator<CodeRecord> comparator(CodeSortField field, SortOrder order) {
        Collator collator = Collator.getInstance(COLLATION_LOCALE);
        Comparator<CodeRecord> comparator = Comparator.comparing(field::extract, collator);
        return order == SortOrder.DESC ? comparator.reversed() : comparator;
    }
}
