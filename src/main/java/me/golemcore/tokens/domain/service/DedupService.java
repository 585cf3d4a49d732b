package me.golemcore.tokens.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.domain.model.UsageRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes records that several sources reported for the same message.
 *
 * <p>
 * Identity is {@code (provider, messageId, requestId)}. The first occurrence
 * wins and the relative order of the survivors is preserved. Records whose
 * ids are both empty share one identity per provider.
 */
@Service
@Slf4j
public class DedupService {

    public List<UsageRecord> dedup(List<UsageRecord> records) {
        Set<RecordKey> seen = new HashSet<>(records.size() * 2);
        List<UsageRecord> unique = new ArrayList<>(records.size());
        for (UsageRecord record : records) {
            if (seen.add(RecordKey.of(record))) {
                unique.add(record);
            }
        }
        if (unique.size() < records.size()) {
            log.debug("[Dedup] Dropped {} duplicate records", records.size() - unique.size());
        }
        return unique;
    }

    private record RecordKey(String provider, String messageId, String requestId) {

        static RecordKey of(UsageRecord record) {
            return new RecordKey(record.getProvider(), record.getMessageId(), record.getRequestId());
        }
    }
}
