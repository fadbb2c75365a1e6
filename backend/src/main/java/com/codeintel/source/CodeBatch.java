package com.codeintel.source;

import com.codeintel.model.code.RawCodeRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a {@link CodeSource} read: the rows in file order plus how they were stored.
 *
 * @param manifest chunk manifest, null for single-file loads
 */
public record CodeBatch(List<RawCodeRecord> records, String loadMethod, CodeManifest manifest) {

    public static final String CHUNKED = "chunked";
    public static final String SINGLE_FILE = "single-file";

    public CodeBatch {
        // rows may be null in malformed files; CodeRecord.fromRaw rejects them
        records = Collections.unmodifiableList(new ArrayList<>(records));
    }
}
