package io.github.drompincen.shopbench.runtime.llm;

import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ModelClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelClientRegistry.class);

    private final Map<String, ModelClient> clients = new ConcurrentHashMap<>();

    public ModelClientRegistry(List<ModelClient> discovered) {
        discovered.forEach(this::register);
        log.info("[Registry] Model clients available for {}", platformIds());
    }

    public void register(ModelClient client) {
        for (String id : client.platformIds()) {
            clients.put(normalize(id), client);
        }
    }

    public Optional<ModelClient> get(String platformId) {
        if (platformId == null) return Optional.empty();
        return Optional.ofNullable(clients.get(normalize(platformId)));
    }

    public ModelClient require(String platformId) {
        return get(platformId).orElseThrow(() ->
                new PreconditionException("Unknown platform_id=" + platformId));
    }

    public Set<String> platformIds() {
        return new TreeSet<>(clients.keySet());
    }

    private static String normalize(String platformId) {
        return platformId.strip().toUpperCase(Locale.ROOT);
    }
}
