package com.dslforge.core.generation;

import com.dslforge.core.config.ForgeConfig;

/**
 * Interface for external text-generation services that produce DSL drafts.
 *
 * <p>The self-correction loop calls a service when deterministic repair cannot
 * resolve the remaining defects. A service is a black box: prompt in, text out.
 * Every failure is reported as a {@link GenerationException} carrying a
 * {@link ServiceError} kind; implementations never return null.
 *
 * <p>Services are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class EchoGenerationService implements GenerationService {
 *     @Override
 *     public String getId() {
 *         return "echo";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Echo";
 *     }
 *
 *     @Override
 *     public String generate(GenerationRequest request) {
 *         return request.diagnostics().previousDraft();
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.dslforge.core.generation.GenerationService}
 *
 * @see GenerationServiceFactory
 */
public interface GenerationService {

    /**
     * Returns unique identifier for this service.
     *
     * <p>Used for referencing the service in configuration ({@code generation.provider}).
     *
     * @return lowercase service identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this service.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Applies configuration. Called once before the first request.
     *
     * @param settings generation settings
     */
    default void configure(ForgeConfig.GenerationConfig settings) {
    }

    /**
     * Requests a new DSL draft.
     *
     * <p>Implementations must honour {@link GenerationRequest#timeout()} and
     * report it as {@link ServiceError#TIMEOUT}. The loop additionally bounds
     * the call with its own timeout.
     *
     * @param request prompt and diagnostics
     * @return raw response text
     * @throws GenerationException if the service fails
     */
    String generate(GenerationRequest request) throws GenerationException;
}
