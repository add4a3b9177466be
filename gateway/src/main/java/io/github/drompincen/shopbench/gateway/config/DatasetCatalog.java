package io.github.drompincen.shopbench.gateway.config;

import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Maps a {@code --setting} name to its dataset input locations. */
@Component
public class DatasetCatalog {

    private final Map<String, BenchmarkProperties.Dataset> datasets = new TreeMap<>();
    private final String defaultDataset;

    public DatasetCatalog(BenchmarkProperties properties) {
        properties.datasets().forEach((name, dataset) -> datasets.put(normalize(name), dataset));
        this.defaultDataset = normalize(properties.defaultDataset());
    }

    /**
     * @throws PreconditionException for a name that is not configured
     */
    public BenchmarkProperties.Dataset resolve(String name) {
        String key = name == null || name.isBlank() ? defaultDataset : normalize(name);
        BenchmarkProperties.Dataset dataset = datasets.get(key);
        if (dataset == null) {
            throw new PreconditionException("Unknown dataset '" + key + "'. Available options: "
                    + String.join(", ", datasets.keySet()));
        }
        return dataset;
    }

    private static String normalize(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }
}
