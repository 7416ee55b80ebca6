package com.phillippitts.swarmcouncil.exception;

/**
 * Base exception for all swarm-council application errors.
 * Domain exceptions extend this class so the REST boundary can handle them in one place.
 */
public class SwarmCouncilException extends RuntimeException {

    public SwarmCouncilException(String message) {
        super(message);
    }

    public SwarmCouncilException(String message, Throwable cause) {
        super(message, cause);
    }

    public SwarmCouncilException(Throwable cause) {
        super(cause);
    }
}
