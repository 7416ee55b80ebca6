/**
 * Councils: provider lifecycle, role assignment and the workflow entry points.
 *
 * <p>{@link com.phillippitts.swarmcouncil.service.council.SwarmCouncil} serves the standard
 * workflows; the quality variant lives in {@code service.quality}.
 */
package com.phillippitts.swarmcouncil.service.council;
