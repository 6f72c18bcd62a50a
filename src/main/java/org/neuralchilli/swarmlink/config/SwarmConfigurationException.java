package org.neuralchilli.swarmlink.config;

import org.neuralchilli.swarmlink.core.SwarmException;

/**
 * Raised at startup when settings or handler wiring are inconsistent.
 */
public class SwarmConfigurationException extends SwarmException {

    public SwarmConfigurationException(String message) {
        super(message);
    }
}
