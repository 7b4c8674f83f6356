package com.motaz.insight.engine.clean;

import com.motaz.insight.engine.config.DuplicateKey;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.model.NormalizedRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

class DuplicateResolver {

    List<NormalizedRecord> resolve(List<NormalizedRecord> records, RecordSchema schema, DuplicateKey mode, CleaningLedger ledger) {
        Map<String, String> firstSeen = new HashMap<>();
        List<NormalizedRecord> kept = new ArrayList<>(records.size());
        for (NormalizedRecord record : records) {
            String key = duplicateKey(record, schema, mode);
            String first = firstSeen.putIfAbsent(key, record.getRecordId());
            if (first == null) {
                kept.add(record);
            } else {
                ledger.duplicate(record.getRecordId(), first, key);
            }
        }
        return kept;
    }

    static String duplicateKey(NormalizedRecord record, RecordSchema schema, DuplicateKey mode) {
        if (mode == DuplicateKey.EXPLICIT_KEY_FIELDS) {
            return schema.keyFields().stream()
                    .map(field -> record.field(field).canonical())
                    .collect(Collectors.joining("|"));
        }
        String row = record.getFields().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue().canonical())
                .collect(Collectors.joining("\u001f"));
        return sha256(row);
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
