package com.codeintel.service;

import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.SearchEntry;
import com.codeintel.model.code.SearchResult;
import com.codeintel.model.enums.CodeType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Relevance-ranked text search over the code index.
 *
 * Scoring:
 * - code equals the whole query: 100
 * - otherwise code contains the query: 80
 * - plus 10 for each query term found in "code description"
 *
 * Records scoring zero are dropped. Equal scores are ordered by code.
 */
@Service
public class CodeSearchService {

    public static final int MIN_QUERY_LENGTH = 2;

    private static final int EXACT_CODE_SCORE = 100;
    private static final int PARTIAL_CODE_SCORE = 80;
    private static final int TERM_SCORE = 10;

    private static final Comparator<ScoredRecord> RANKING =
        Comparator.comparingInt(ScoredRecord::score).reversed()
            .thenComparing(scored -> scored.record().code());

    private final CodeIndex codeIndex;

    public CodeSearchService(CodeIndex codeIndex) {
        this.codeIndex = codeIndex;
    }

    /**
     * @param type  null searches every code system
     * @param limit maximum number of hits returned; the total still counts every match
     */
    public SearchResult search(String query, CodeType type, int limit) {
        if (query == null || query.trim().length() < MIN_QUERY_LENGTH) {
            return SearchResult.empty(query);
        }
        String normalized = query.toLowerCase(Locale.ROOT).trim();
        String[] terms = normalized.split("\\s+");

        List<ScoredRecord> matches = new ArrayList<>();
        for (SearchEntry entry : codeIndex.searchCorpus()) {
            if (type != null && entry.type() != type) {
                continue;
            }
            int score = score(entry, normalized, terms);
            if (score > 0) {
                matches.add(new ScoredRecord(entry.record(), score));
            }
        }
        matches.sort(RANKING);

        List<CodeRecord> top = matches.stream()
            .limit(Math.max(limit, 0))
            .map(ScoredRecord::record)
            .toList();
        return new SearchResult(top, matches.size(), query);
    }

    static int score(SearchEntry entry, String normalizedQuery, String[] terms) {
        int score = 0;
        if (entry.codeLower().equals(normalizedQuery)) {
            score += EXACT_CODE_SCORE;
        } else if (entry.codeLower().contains(normalizedQuery)) {
            score += PARTIAL_CODE_SCORE;
        }
        for (String term : terms) {
            if (entry.searchText().contains(term)) {
                score += TERM_SCORE;
            }
        }
        return score;
    }

    private record ScoredRecord(CodeRecord record, int score) {}
}
