package me.golemcore.tokens.adapter.inbound.command;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.tokens.domain.model.AggregatedBucket;
import me.golemcore.tokens.domain.model.Cost;
import me.golemcore.tokens.domain.model.ModelBucketDetail;
import me.golemcore.tokens.domain.model.TokenTotals;
import me.golemcore.tokens.domain.model.UsageReport;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link UsageReport} as pretty-printed JSON.
 *
 * <p>
 * Undefined costs are written as {@code null}, never as zero.
 */
@Component
@RequiredArgsConstructor
public class JsonReportRenderer {

    private final ObjectMapper objectMapper;

    public String render(UsageReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("mode", report.getMode().name().toLowerCase(Locale.ROOT));
        root.put("records", report.getRecordCount());

        ArrayNode buckets = root.putArray("buckets");
        for (Map.Entry<String, AggregatedBucket> entry : report.getBuckets().entrySet()) {
            ObjectNode bucket = bucketNode(entry.getValue());
            bucket.put("key", entry.getKey());
            buckets.add(bucket);
        }
        root.set("total", bucketNode(report.getTotal()));
        addStrings(root.putArray("unpricedModels"), report.getUnpricedModels());

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render report", e);
        }
    }

    private ObjectNode bucketNode(AggregatedBucket bucket) {
        ObjectNode node = objectMapper.createObjectNode();
        putTotals(node, bucket);
        addStrings(node.putArray("models"), bucket.getModels());
        addStrings(node.putArray("projects"), bucket.getProjects());
        addStrings(node.putArray("tools"), bucket.getTools());
        ArrayNode details = node.putArray("modelBreakdown");
        for (ModelBucketDetail detail : bucket.getModelDetails()) {
            ObjectNode detailNode = details.addObject();
            detailNode.put("model", detail.getModel());
            putTotals(detailNode, detail);
        }
        return node;
    }

    private static void putTotals(ObjectNode node, TokenTotals totals) {
        node.put("inputTokens", totals.getInputTokens());
        node.put("outputTokens", totals.getOutputTokens());
        node.put("cacheCreationTokens", totals.getCacheCreationInputTokens());
        node.put("cacheReadTokens", totals.getCacheReadInputTokens());
        node.put("totalTokens", totals.getTotalTokens());
        Cost cost = totals.getCost();
        if (cost.isDefined()) {
            node.put("cost", cost.getValue());
        } else {
            node.putNull("cost");
        }
    }

    private static void addStrings(ArrayNode array, Collection<String> values) {
        values.forEach(array::add);
    }
}
