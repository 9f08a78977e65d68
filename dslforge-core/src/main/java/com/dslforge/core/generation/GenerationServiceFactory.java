package com.dslforge.core.generation;

import com.dslforge.core.config.ForgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Discovers generation services via {@link ServiceLoader} and creates the
 * configured one.
 */
public final class GenerationServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(GenerationServiceFactory.class);

    private GenerationServiceFactory() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Lists every registered service.
     *
     * @return discovered services
     */
    public static List<GenerationService> discover() {
        log.debug("Discovering generation services via ServiceLoader");
        ServiceLoader<GenerationService> loader = ServiceLoader.load(GenerationService.class);
        List<GenerationService> services = new ArrayList<>();
        loader.forEach(services::add);
        log.debug("Discovered {} generation services", services.size());
        return services;
    }

    /**
     * Creates and configures the service named by {@code settings.provider()}.
     *
     * @param settings generation settings
     * @return configured service
     * @throws IllegalArgumentException if no service has that id
     */
    public static GenerationService create(ForgeConfig.GenerationConfig settings) {
        GenerationService service = discover().stream()
            .filter(candidate -> candidate.getId().equalsIgnoreCase(settings.provider()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown generation provider: " + settings.provider()));
        service.configure(settings);
        log.info("Using generation service: {} ({})", service.getDisplayName(), service.getId());
        return service;
    }
}
