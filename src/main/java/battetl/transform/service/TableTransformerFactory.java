package battetl.transform.service;

import battetl.transform.transformer.NoOpTableTransformer;
import battetl.transform.transformer.TableTransformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory service for loading and caching post-transform hooks.
 *
 * This service:
 * - Loads hook classes by name
 * - Caches hook instances (class name -> instance)
 * - Falls back to NoOpTableTransformer when no class is configured or loading fails
 */
@Service
@Slf4j
public class TableTransformerFactory {

    private final Map<String, TableTransformer> transformerCache = new ConcurrentHashMap<>();

    /**
     * Get the hook for a configured class name.
     *
     * @param className fully qualified class name, or null/blank for no hook
     * @return TableTransformer instance (never null)
     */
    public TableTransformer getTransformer(String className) {
        if (className == null || className.trim().isEmpty()) {
            log.debug("No hook class configured, using NoOpTableTransformer");
            return new NoOpTableTransformer();
        }

        String name = className.trim();
        TableTransformer cached = transformerCache.get(name);
        if (cached != null) {
            log.debug("Returning cached hook: {}", name);
            return cached;
        }

        try {
            log.info("Loading hook class: {}", name);

            Class<?> clazz = Class.forName(name);
            if (!TableTransformer.class.isAssignableFrom(clazz)) {
                log.error("Class {} does not implement TableTransformer", name);
                return new NoOpTableTransformer();
            }

            TableTransformer transformer = (TableTransformer) clazz.getDeclaredConstructor().newInstance();
            transformer.initialize();
            transformerCache.put(name, transformer);

            log.info("Loaded and initialized hook: {}", name);
            return transformer;

        } catch (ClassNotFoundException e) {
            log.error("Hook class not found: {}. Using NoOpTableTransformer.", name, e);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.error("Error loading hook class: {}. Using NoOpTableTransformer.", name, e);
        }

        return new NoOpTableTransformer();
    }

    /**
     * Drop cached hooks, calling cleanup on each.
     */
    public void clearCache() {
        log.info("Clearing hook cache ({} entries)", transformerCache.size());

        transformerCache.values().forEach(transformer -> {
            try {
                transformer.cleanup();
            } catch (RuntimeException e) {
                log.warn("Error during hook cleanup", e);
            }
        });

        transformerCache.clear();
    }
}
