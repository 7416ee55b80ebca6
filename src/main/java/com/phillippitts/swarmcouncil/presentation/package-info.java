/**
 * Presentation layer: REST controllers, request/response records and exception mapping.
 *
 * <p>Controllers are thin adapters over the councils; domain exceptions are translated to HTTP
 * responses by {@link com.phillippitts.swarmcouncil.presentation.exception.GlobalExceptionHandler}.
 *
 * <p>Exception mapping:
 * <ul>
 *   <li>{@code InvalidRequestException}, Bean Validation failures → 400 Bad Request</li>
 *   <li>{@code CouncilNotReadyException}, {@code CouncilConfigurationException} → 503 Service Unavailable</li>
 *   <li>{@code ProviderException} → 502 Bad Gateway</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 */
package com.phillippitts.swarmcouncil.presentation;
