package com.codeintel.service;

import com.codeintel.model.code.CodeRecord;
import com.codeintel.model.code.PaymentSet;
import com.codeintel.model.code.SearchEntry;
import com.codeintel.model.enums.CodeType;
import com.codeintel.source.CodeManifest;

import java.util.List;
import java.util.Map;

/**
 * Fully built, immutable state of the code index. Published in one volatile write.
 *
 * @param records      every record in load order
 * @param byCode       code string to record; later duplicates win
 * @param byType       records per code system, load order, first-seen type order
 * @param byTypeSorted records per code system ordered by code ascending (collated)
 * @param allSorted    every record ordered by code ascending (collated)
 * @param manifest     null unless loaded from chunks
 */
record IndexSnapshot(
    List<CodeRecord> records,
    Map<String, CodeRecord> byCode,
    Map<CodeType, List<CodeRecord>> byType,
    Map<CodeType, List<CodeRecord>> byTypeSorted,
    List<CodeRecord> allSorted,
    List<SearchEntry> searchCorpus,
    Map<String, PaymentSet> payments,
    String loadMethod,
    CodeManifest manifest
) {}
