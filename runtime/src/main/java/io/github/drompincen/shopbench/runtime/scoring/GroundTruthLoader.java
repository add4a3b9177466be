package io.github.drompincen.shopbench.runtime.scoring;

import io.github.drompincen.shopbench.protocol.api.ReportFields;
import io.github.drompincen.shopbench.tabular.TabularStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Product ground truth keyed by {@code sku_id}. Each entry is the row's other
 * non-blank values joined with {@code ", "} in column order.
 */
@Component
public class GroundTruthLoader {

    private static final Logger log = LoggerFactory.getLogger(GroundTruthLoader.class);

    private final TabularStore tabularStore;

    public GroundTruthLoader(TabularStore tabularStore) {
        this.tabularStore = tabularStore;
    }

    public Map<String, String> load(Path path) {
        Map<String, String> bySku = new LinkedHashMap<>();
        for (Map<String, String> row : tabularStore.load(path)) {
            String sku = row.getOrDefault(ReportFields.SKU_ID, "").strip();
            if (sku.isEmpty()) continue;
            List<String> values = new ArrayList<>();
            row.forEach((column, value) -> {
                if (ReportFields.SKU_ID.equals(column) || value == null) return;
                String text = value.strip();
                if (!text.isEmpty()) values.add(text);
            });
            bySku.put(sku, String.join(", ", values));
        }
        log.info("[Scoring] Loaded ground truth for {} SKUs from {}", bySku.size(), path);
        return bySku;
    }
}
