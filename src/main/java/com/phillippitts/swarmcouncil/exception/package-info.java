/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.SwarmCouncilException} - Base exception</li>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.CouncilConfigurationException} - No usable
 *       providers, or an invalid provider entry; fatal to initialization</li>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.ProviderConstructionException} and
 *       {@link com.phillippitts.swarmcouncil.exception.ConstructionTimeoutException} - A single
 *       provider failed to construct; recorded, initialization continues</li>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.ProviderSetupException} - Role or specialty
 *       assignment failed; logged, provider still activated</li>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.InvalidRequestException} - Empty prompt,
 *       unknown workflow or role; raised before any provider call</li>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.CouncilNotReadyException} - Call made while
 *       the council is not operational</li>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.StageExecutionException} - A pipeline stage
 *       failed; converted into a degraded result</li>
 *   <li>{@link com.phillippitts.swarmcouncil.exception.ProviderException} - Backend transport or
 *       response failure</li>
 * </ul>
 *
 * <p>Provider-level errors are converted into state (initialization errors, health records,
 * degraded runs). Only whole-council failures reach callers as exceptions, mapped to HTTP
 * responses by {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.swarmcouncil.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.swarmcouncil.exception;
