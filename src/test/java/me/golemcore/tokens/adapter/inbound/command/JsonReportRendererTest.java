package me.golemcore.tokens.adapter.inbound.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tokens.domain.model.AggregatedBucket;
import me.golemcore.tokens.domain.model.BucketMode;
import me.golemcore.tokens.domain.model.Cost;
import me.golemcore.tokens.domain.model.UsageReport;
import me.golemcore.tokens.infrastructure.config.AutoConfiguration;
import me.golemcore.tokens.testsupport.UsageRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportRendererTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private JsonReportRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new JsonReportRenderer(objectMapper);
    }

    private UsageReport report() {
        AggregatedBucket day = new AggregatedBucket();
        day.add(UsageRecords.record("claude", "a", "claude-sonnet-4-5-20250929", 100, 50).toBuilder()
                .project("zeta").build(), Cost.of(0.5));
        day.add(UsageRecords.record("codex", "b", "mystery-model", 10, 5).toBuilder()
                .project("alpha").build(), Cost.undefined());
        day.finish();

        SortedMap<String, AggregatedBucket> buckets = new TreeMap<>();
        buckets.put("2026-03-01", day);
        AggregatedBucket total = new AggregatedBucket();
        total.accumulateFrom(day);

        return UsageReport.builder()
                .mode(BucketMode.DAILY)
                .recordCount(2)
                .buckets(buckets)
                .total(total)
                .unpricedModels(List.of("mystery-model"))
                .build();
    }

    @Test
    void rendersBucketsWithTotalsAndSortedSets() throws Exception {
        JsonNode root = objectMapper.readTree(renderer.render(report()));

        assertEquals("daily", root.get("mode").asText());
        assertEquals(2, root.get("records").asInt());
        JsonNode bucket = root.get("buckets").get(0);
        assertEquals("2026-03-01", bucket.get("key").asText());
        assertEquals(110, bucket.get("inputTokens").asLong());
        assertEquals(55, bucket.get("outputTokens").asLong());
        assertEquals(165, bucket.get("totalTokens").asLong());
        assertEquals(0.5, bucket.get("cost").asDouble(), 1e-9);
        assertEquals("alpha", bucket.get("projects").get(0).asText());
        assertEquals("zeta", bucket.get("projects").get(1).asText());
        assertEquals("claude", bucket.get("tools").get(0).asText());
        assertEquals("sonnet-4-5", bucket.get("models").get(0).asText());
        assertEquals("mystery-model", root.get("unpricedModels").get(0).asText());
    }

    @Test
    void undefinedModelCostIsNullNotZero() throws Exception {
        JsonNode root = objectMapper.readTree(renderer.render(report()));

        JsonNode breakdown = root.get("buckets").get(0).get("modelBreakdown");
        assertEquals(2, breakdown.size());
        assertEquals("claude-sonnet-4-5-20250929", breakdown.get(0).get("model").asText());
        assertTrue(breakdown.get(1).get("cost").isNull());
        assertEquals(0.5, root.get("total").get("cost").asDouble(), 1e-9);
    }

    @Test
    void emptyBucketCostIsNull() throws Exception {
        UsageReport empty = UsageReport.builder()
                .mode(BucketMode.MONTHLY)
                .recordCount(0)
                .buckets(new TreeMap<>())
                .total(new AggregatedBucket().finish())
                .unpricedModels(List.of())
                .build();

        JsonNode root = objectMapper.readTree(renderer.render(empty));

        assertEquals(0, root.get("buckets").size());
        assertTrue(root.get("total").get("cost").isNull());
    }
}
